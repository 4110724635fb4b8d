package org.metricshub.f2cpp.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * F2Cpp
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * Node of the expression tree built once per statement by the
 * {@link org.metricshub.f2cpp.frontend.ExpressionParser}.
 * <p>
 * The tree is immutable. Index shifting and intrinsic mapping are performed
 * by an {@link ExpressionVisitor} walking it, never by rewriting the text.
 */
public abstract class Expression {

	/**
	 * Dispatches to the visitor method matching the concrete node.
	 *
	 * @param visitor the visitor
	 * @param <R> type of the visit result
	 * @return the visit result
	 */
	public abstract <R> R accept(ExpressionVisitor<R> visitor);
}

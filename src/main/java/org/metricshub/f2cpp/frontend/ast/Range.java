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
 * <code>lower:upper[:stride]</code> in an argument list: an array section,
 * or a bound pair in a declaration. Every part may be absent, as in the
 * assumed-shape marker <code>:</code>.
 */
public final class Range extends Expression {

	private final Expression lower;
	private final Expression upper;
	private final Expression stride;

	public Range(Expression lower, Expression upper, Expression stride) {
		this.lower = lower;
		this.upper = upper;
		this.stride = stride;
	}

	public Expression getLower() {
		return lower;
	}

	public Expression getUpper() {
		return upper;
	}

	public Expression getStride() {
		return stride;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitRange(this);
	}

	@Override
	public String toString() {
		StringBuilder text = new StringBuilder();
		if (lower != null) {
			text.append(lower);
		}
		text.append(':');
		if (upper != null) {
			text.append(upper);
		}
		if (stride != null) {
			text.append(':').append(stride);
		}
		return text.toString();
	}
}

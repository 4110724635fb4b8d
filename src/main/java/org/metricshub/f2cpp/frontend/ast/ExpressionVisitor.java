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
 * Visitor over the {@link Expression} tree.
 *
 * @param <R> type of the visit result
 */
public interface ExpressionVisitor<R> {

	R visitIntegerLiteral(IntegerLiteral literal);

	R visitRealLiteral(RealLiteral literal);

	R visitStringLiteral(StringLiteral literal);

	R visitLogicalLiteral(LogicalLiteral literal);

	R visitNameReference(NameReference reference);

	R visitApplication(Application application);

	R visitBinaryOperation(BinaryOperation operation);

	R visitUnaryOperation(UnaryOperation operation);

	R visitParenthesized(Parenthesized parenthesized);

	R visitArrayConstructor(ArrayConstructor constructor);

	R visitKeywordArgument(KeywordArgument argument);

	R visitRange(Range range);
}

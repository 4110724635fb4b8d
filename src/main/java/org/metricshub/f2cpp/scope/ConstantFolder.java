package org.metricshub.f2cpp.scope;

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

import java.util.Collections;
import java.util.List;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.BinaryOperation;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.ExpressionVisitor;
import org.metricshub.f2cpp.frontend.ast.IntegerLiteral;
import org.metricshub.f2cpp.frontend.ast.KeywordArgument;
import org.metricshub.f2cpp.frontend.ast.LogicalLiteral;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.frontend.ast.Parenthesized;
import org.metricshub.f2cpp.frontend.ast.Range;
import org.metricshub.f2cpp.frontend.ast.RealLiteral;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.frontend.ast.UnaryOperation;

/**
 * Evaluates integer constant expressions: literals, integer
 * <code>parameter</code> constants and the arithmetic operators. Any other
 * expression folds to {@code null}.
 */
public class ConstantFolder implements ExpressionVisitor<Long> {

	private final ScopeStack scopes;
	private List<Symbol> pending = Collections.emptyList();

	public ConstantFolder(ScopeStack scopes) {
		this.scopes = scopes;
	}

	/**
	 * Folds an expression that may refer to constants of the declaration
	 * statement being processed, which are not declared yet, as
	 * <code>v</code> in <code>integer, parameter :: n = 3, v(n) = 0</code>.
	 *
	 * @param expression an expression, may be {@code null}
	 * @param declared the symbols of the statement created so far
	 * @return its value, or {@code null} when it is not an integer constant
	 *         expression
	 */
	public Long fold(Expression expression, List<Symbol> declared) {
		pending = declared;
		try {
			return fold(expression);
		} finally {
			pending = Collections.emptyList();
		}
	}

	/**
	 * @param expression an expression, may be {@code null}
	 * @return its value, or {@code null} when it is not an integer constant
	 *         expression
	 */
	public Long fold(Expression expression) {
		return expression == null ? null : expression.accept(this);
	}

	@Override
	public Long visitIntegerLiteral(IntegerLiteral literal) {
		return Long.valueOf(literal.getValue());
	}

	@Override
	public Long visitNameReference(NameReference reference) {
		Symbol symbol = null;
		for (Symbol candidate : pending) {
			if (candidate.getKey().equals(Symbol.keyOf(reference.getName()))) {
				symbol = candidate;
			}
		}
		if (symbol == null) {
			symbol = scopes.lookup(reference.getName());
		}
		if (symbol == null || !symbol.isConstant() || symbol.isArray() || symbol.getType() != TargetType.INTEGER) {
			return null;
		}
		return fold(symbol.getInitializer());
	}

	@Override
	public Long visitBinaryOperation(BinaryOperation operation) {
		Long left = fold(operation.getLeft());
		Long right = fold(operation.getRight());
		if (left == null || right == null) {
			return null;
		}
		long l = left.longValue();
		long r = right.longValue();
		switch (operation.getOperator()) {
		case ADD:
			return Long.valueOf(l + r);
		case SUBTRACT:
			return Long.valueOf(l - r);
		case MULTIPLY:
			return Long.valueOf(l * r);
		case DIVIDE:
			// Fortran integer division truncates toward zero, as Java does
			return r == 0 ? null : Long.valueOf(l / r);
		case POWER:
			if (r < 0) {
				return null;
			}
			long result = 1;
			for (long i = 0; i < r; i++) {
				result *= l;
			}
			return Long.valueOf(result);
		default:
			return null;
		}
	}

	@Override
	public Long visitUnaryOperation(UnaryOperation operation) {
		Long operand = fold(operation.getOperand());
		if (operand == null) {
			return null;
		}
		switch (operation.getOperator()) {
		case MINUS:
			return Long.valueOf(-operand.longValue());
		case PLUS:
			return operand;
		default:
			return null;
		}
	}

	@Override
	public Long visitParenthesized(Parenthesized parenthesized) {
		return fold(parenthesized.getInner());
	}

	@Override
	public Long visitRealLiteral(RealLiteral literal) {
		return null;
	}

	@Override
	public Long visitStringLiteral(StringLiteral literal) {
		return null;
	}

	@Override
	public Long visitLogicalLiteral(LogicalLiteral literal) {
		return null;
	}

	@Override
	public Long visitApplication(Application application) {
		return null;
	}

	@Override
	public Long visitArrayConstructor(ArrayConstructor constructor) {
		return null;
	}

	@Override
	public Long visitKeywordArgument(KeywordArgument argument) {
		return null;
	}

	@Override
	public Long visitRange(Range range) {
		return null;
	}
}

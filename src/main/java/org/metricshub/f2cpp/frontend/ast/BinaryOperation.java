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
 * Binary operation.
 */
public final class BinaryOperation extends Expression {

	/** Fortran binary operators, with their source spelling. */
	public enum Operator {
		POWER("**"),
		MULTIPLY("*"),
		DIVIDE("/"),
		ADD("+"),
		SUBTRACT("-"),
		CONCAT("//"),
		EQ("=="),
		NE("/="),
		LT("<"),
		LE("<="),
		GT(">"),
		GE(">="),
		AND(".and."),
		OR(".or."),
		EQV(".eqv."),
		NEQV(".neqv.");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final Expression left;
	private final Expression right;

	public BinaryOperation(Operator operator, Expression left, Expression right) {
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBinaryOperation(this);
	}

	@Override
	public String toString() {
		return left + " " + operator.getSymbol() + " " + right;
	}
}

package org.metricshub.f2cpp.backend;

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

import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * A translated C++ expression: its text, the precedence of its outermost
 * operator, and what is known of its type.
 */
public final class CppCode {

	public static final int PRIMARY = 17;
	public static final int UNARY = 15;
	public static final int MULTIPLICATIVE = 13;
	public static final int ADDITIVE = 12;
	public static final int SHIFT = 11;
	public static final int RELATIONAL = 10;
	public static final int EQUALITY = 9;
	public static final int LOGICAL_AND = 5;
	public static final int LOGICAL_OR = 4;
	public static final int CONDITIONAL = 3;

	private final String text;
	private final int precedence;
	private final TargetType type;
	private final Symbol array;

	/**
	 * @param text C++ text
	 * @param precedence precedence of the outermost operator
	 * @param type type of the value, {@code null} when unknown
	 */
	public CppCode(String text, int precedence, TargetType type) {
		this(text, precedence, type, null);
	}

	/**
	 * @param text C++ text
	 * @param precedence precedence of the outermost operator
	 * @param type element type, {@code null} when unknown
	 * @param array the array symbol when the expression denotes a whole
	 *        array
	 */
	public CppCode(String text, int precedence, TargetType type, Symbol array) {
		this.text = text;
		this.precedence = precedence;
		this.type = type;
		this.array = array;
	}

	public String getText() {
		return text;
	}

	public int getPrecedence() {
		return precedence;
	}

	public TargetType getType() {
		return type;
	}

	/**
	 * @return the array symbol when the expression is a whole array, else
	 *         {@code null}
	 */
	public Symbol getArray() {
		return array;
	}

	public boolean isWholeArray() {
		return array != null;
	}

	/**
	 * @param required the minimum precedence the context accepts without
	 *        parentheses
	 * @return the text, parenthesized when its precedence is lower
	 */
	public String operand(int required) {
		return precedence < required ? "(" + text + ")" : text;
	}

	@Override
	public String toString() {
		return text;
	}
}

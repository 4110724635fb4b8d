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

import java.util.Locale;
import org.metricshub.f2cpp.frontend.ast.Expression;

/**
 * A declared name: variable, constant, dummy argument or function result.
 * <p>
 * Fortran names are case-insensitive: the symbol is looked up by its
 * {@link #getKey() key} and always rendered with the spelling of its
 * declaration, so that every reference agrees in the case-sensitive C++
 * output.
 */
public class Symbol {

	private final String name;
	private final String targetName;
	private final TargetType type;
	private final Shape shape;
	private boolean constant;
	private Expression initializer;
	private Intent intent = Intent.NONE;
	private boolean allocatable;
	private boolean dummy;
	private boolean implicitlyTyped;
	private Scope owner;

	public Symbol(String name, TargetType type, Shape shape) {
		this.name = name;
		this.targetName = CppKeywords.safeName(name);
		this.type = type;
		this.shape = shape;
	}

	/**
	 * Creates the symbol of an undeclared name, typed with the Fortran
	 * implicit rules: names starting with <code>i</code> to <code>n</code> are
	 * integers, other names are reals.
	 *
	 * @param name the undeclared name
	 * @return an implicitly typed scalar
	 */
	public static Symbol implicit(String name) {
		char first = Character.toLowerCase(name.charAt(0));
		TargetType type = first >= 'i' && first <= 'n' ? TargetType.INTEGER : TargetType.REAL;
		Symbol symbol = new Symbol(name, type, Shape.SCALAR);
		symbol.implicitlyTyped = true;
		return symbol;
	}

	/**
	 * @param name a Fortran name
	 * @return the case-insensitive lookup key of the name
	 */
	public static String keyOf(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	public String getName() {
		return name;
	}

	public String getKey() {
		return keyOf(name);
	}

	public String getTargetName() {
		return targetName;
	}

	public TargetType getType() {
		return type;
	}

	public Shape getShape() {
		return shape;
	}

	public boolean isArray() {
		return shape.isArray();
	}

	public boolean isConstant() {
		return constant;
	}

	public void setConstant(boolean constant) {
		this.constant = constant;
	}

	public Expression getInitializer() {
		return initializer;
	}

	public void setInitializer(Expression initializer) {
		this.initializer = initializer;
	}

	public Intent getIntent() {
		return intent;
	}

	public void setIntent(Intent intent) {
		this.intent = intent;
	}

	public boolean isAllocatable() {
		return allocatable;
	}

	public void setAllocatable(boolean allocatable) {
		this.allocatable = allocatable;
	}

	public boolean isDummy() {
		return dummy;
	}

	public void setDummy(boolean dummy) {
		this.dummy = dummy;
	}

	public boolean isImplicitlyTyped() {
		return implicitlyTyped;
	}

	/**
	 * @return the scope that declared this symbol, {@code null} before it is
	 *         declared
	 */
	public Scope getOwner() {
		return owner;
	}

	void setOwner(Scope owner) {
		this.owner = owner;
	}

	@Override
	public String toString() {
		StringBuilder description = new StringBuilder(name).append(": ").append(type).append(' ').append(shape);
		if (constant) {
			description.append(" constant");
		}
		if (dummy) {
			description.append(" dummy(").append(intent).append(')');
		}
		return description.toString();
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>name(arguments)</code>, which Fortran syntax does not distinguish:
 * it is an array element when the name resolves to an array, and a function
 * call otherwise. The distinction is made when translating, with the symbol
 * table at hand.
 */
public final class Application extends Expression {

	private final String name;
	private final List<Expression> arguments;

	public Application(String name, List<Expression> arguments) {
		this.name = name;
		this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
	}

	public String getName() {
		return name;
	}

	public List<Expression> getArguments() {
		return arguments;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitApplication(this);
	}

	@Override
	public String toString() {
		StringBuilder text = new StringBuilder(name).append('(');
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				text.append(", ");
			}
			text.append(arguments.get(i));
		}
		return text.append(')').toString();
	}
}

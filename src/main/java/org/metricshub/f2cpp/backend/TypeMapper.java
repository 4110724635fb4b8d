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

import java.util.List;
import org.metricshub.f2cpp.scope.Dimension;
import org.metricshub.f2cpp.scope.Shape;
import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * Maps symbols to C++ types.
 * <p>
 * Fixed-size arrays become <code>std::array</code>, with their extents
 * inlined as folded values; dynamically sized arrays become
 * <code>std::vector</code>. Rank 2 arrays are nested containers, the first
 * subscript selecting the row: <code>a(i, j)</code> is
 * <code>a[i - 1][j - 1]</code>.
 */
public class TypeMapper {

	private final TranslationContext context;

	TypeMapper(TranslationContext context) {
		this.context = context;
	}

	/**
	 * @param type a scalar type
	 * @return its C++ name, with the header it needs required
	 */
	public String scalar(TargetType type) {
		if (type == TargetType.STRING) {
			context.require("string");
		}
		return type.getCppName();
	}

	/**
	 * @param symbol a symbol
	 * @return the C++ type of a variable holding the symbol
	 */
	public String type(Symbol symbol) {
		String element = scalar(symbol.getType());
		Shape shape = symbol.getShape();
		if (!shape.isArray()) {
			return element;
		}
		List<Dimension> dimensions = shape.getDimensions();
		String type = element;
		if (shape.isFixed()) {
			context.require("array");
			for (int i = dimensions.size() - 1; i >= 0; i--) {
				type = "array<" + type + ", " + dimensions.get(i).getExtent() + ">";
			}
		} else {
			context.require("vector");
			for (int i = 0; i < dimensions.size(); i++) {
				type = "vector<" + type + ">";
			}
		}
		return type;
	}

	/**
	 * @param symbol a dummy argument
	 * @param readOnly whether the procedure never modifies it
	 * @return the C++ type of the parameter: read-only scalars by value
	 *         (strings by const reference), read-only arrays by const
	 *         reference, anything else by reference
	 */
	public String parameter(Symbol symbol, boolean readOnly) {
		String type = type(symbol);
		if (!readOnly) {
			return type + "&";
		}
		if (symbol.isArray() || symbol.getType() == TargetType.STRING) {
			return "const " + type + "&";
		}
		return type;
	}

	/**
	 * @param symbol a dynamically sized rank 2 array
	 * @return the C++ type of one of its rows
	 */
	public String row(Symbol symbol) {
		context.require("vector");
		return "vector<" + scalar(symbol.getType()) + ">";
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shape of a {@link Symbol}: scalar, fixed-size array (every bound known at
 * translation time, mapped to <code>std::array</code>) or dynamically sized
 * array (mapped to <code>std::vector</code>).
 */
public final class Shape {

	/** Shape categories. */
	public enum Kind {
		SCALAR,
		FIXED_ARRAY,
		ASSUMED_SHAPE
	}

	/** The shape of all scalars. */
	public static final Shape SCALAR = new Shape(Kind.SCALAR, Collections.<Dimension>emptyList());

	private final Kind kind;
	private final List<Dimension> dimensions;

	private Shape(Kind kind, List<Dimension> dimensions) {
		this.kind = kind;
		this.dimensions = Collections.unmodifiableList(new ArrayList<Dimension>(dimensions));
	}

	/**
	 * Builds the shape of an array from its dimensions: fixed when every
	 * dimension is constant, dynamic otherwise.
	 *
	 * @param dimensions the dimensions, at least one
	 * @return the shape
	 */
	public static Shape of(List<Dimension> dimensions) {
		for (Dimension dimension : dimensions) {
			if (!dimension.isConstant()) {
				return new Shape(Kind.ASSUMED_SHAPE, dimensions);
			}
		}
		return new Shape(Kind.FIXED_ARRAY, dimensions);
	}

	/**
	 * @param dimensions the dimensions, at least one
	 * @return a dynamically sized shape, whatever the bounds
	 */
	public static Shape dynamic(List<Dimension> dimensions) {
		return new Shape(Kind.ASSUMED_SHAPE, dimensions);
	}

	public Kind getKind() {
		return kind;
	}

	public List<Dimension> getDimensions() {
		return dimensions;
	}

	public int getRank() {
		return dimensions.size();
	}

	public boolean isArray() {
		return kind != Kind.SCALAR;
	}

	public boolean isFixed() {
		return kind == Kind.FIXED_ARRAY;
	}

	public boolean isDynamic() {
		return kind == Kind.ASSUMED_SHAPE;
	}

	@Override
	public String toString() {
		return kind == Kind.SCALAR ? "scalar" : kind.name().toLowerCase(java.util.Locale.ROOT) + dimensions;
	}
}

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

import org.metricshub.f2cpp.frontend.ast.Expression;

/**
 * Bounds of one dimension of an array.
 * <p>
 * The bound expressions are kept as written. The folded values are only
 * available when the bounds are integer constant expressions; an absent
 * upper bound denotes an assumed-shape, deferred-shape or assumed-size
 * dimension.
 */
public final class Dimension {

	private final Expression lower;
	private final Expression upper;
	private final Long lowerValue;
	private final Long upperValue;

	/**
	 * @param lower lower bound, {@code null} for the default of 1
	 * @param upper upper bound, {@code null} when unknown at declaration
	 * @param lowerValue folded lower bound, {@code null} when not constant
	 * @param upperValue folded upper bound, {@code null} when not constant
	 */
	public Dimension(Expression lower, Expression upper, Long lowerValue, Long upperValue) {
		this.lower = lower;
		this.upper = upper;
		this.lowerValue = lower == null ? Long.valueOf(1) : lowerValue;
		this.upperValue = upperValue;
	}

	public Expression getLower() {
		return lower;
	}

	public Expression getUpper() {
		return upper;
	}

	public Long getLowerValue() {
		return lowerValue;
	}

	public Long getUpperValue() {
		return upperValue;
	}

	/**
	 * @return whether both bounds are known at translation time
	 */
	public boolean isConstant() {
		return lowerValue != null && upperValue != null;
	}

	/**
	 * @return the number of elements, or {@code null} when the bounds are not
	 *         constant
	 */
	public Long getExtent() {
		if (!isConstant()) {
			return null;
		}
		return Long.valueOf(Math.max(0, upperValue.longValue() - lowerValue.longValue() + 1));
	}

	@Override
	public String toString() {
		return (lower == null ? "" : lower + ":") + (upper == null ? ":" : upper.toString());
	}
}

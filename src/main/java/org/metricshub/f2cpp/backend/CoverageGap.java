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

/**
 * A construct that was not translated, or translated with a caveat that
 * needs a human review.
 */
public final class CoverageGap {

	private final int line;
	private final String message;
	private final String source;

	/**
	 * @param line source line
	 * @param message what was not translated and why
	 * @param source the offending statement text
	 */
	public CoverageGap(int line, String message, String source) {
		this.line = line;
		this.message = message;
		this.source = source;
	}

	public int getLine() {
		return line;
	}

	public String getMessage() {
		return message;
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return "line " + line + ": " + message;
	}
}

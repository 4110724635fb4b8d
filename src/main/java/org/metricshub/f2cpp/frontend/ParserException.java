package org.metricshub.f2cpp.frontend;

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
 * Raised when an expression cannot be parsed.
 * <p>
 * This is a coverage gap, not a fatal error: the statement holding the
 * expression is passed through untranslated.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int position;

	/**
	 * @param message description of the problem
	 * @param text expression text being parsed
	 * @param position offset in the text where the problem was found
	 */
	public ParserException(String message, String text, int position) {
		super(message + " (at offset " + position + " of: " + text + ")");
		this.position = position;
	}

	/**
	 * @return offset in the expression text where parsing stopped
	 */
	public int getPosition() {
		return position;
	}
}

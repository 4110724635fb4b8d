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
 * One logical Fortran statement: the code of one or more physical lines
 * joined together, with its comment split apart.
 * <p>
 * A statement with no code and a comment represents a whole-line comment,
 * which must be reproduced at its original position.
 */
public final class LogicalStatement {

	private final String text;
	private final String comment;
	private final int firstLine;
	private final int lastLine;

	/**
	 * @param text code of the statement, without its comment
	 * @param comment text following the comment marker, or {@code null}
	 * @param firstLine first physical line (1-based)
	 * @param lastLine last physical line (1-based)
	 */
	public LogicalStatement(String text, String comment, int firstLine, int lastLine) {
		this.text = text == null ? "" : text.trim();
		this.comment = comment;
		this.firstLine = firstLine;
		this.lastLine = lastLine;
	}

	/**
	 * Creates the statement of a whole-line comment.
	 *
	 * @param comment text following the comment marker
	 * @param line physical line of the comment
	 * @return a comment-only statement
	 */
	public static LogicalStatement commentOnly(String comment, int line) {
		return new LogicalStatement("", comment, line, line);
	}

	public String getText() {
		return text;
	}

	public String getComment() {
		return comment;
	}

	public boolean hasComment() {
		return comment != null;
	}

	public boolean isCommentOnly() {
		return text.isEmpty() && comment != null;
	}

	public int getFirstLine() {
		return firstLine;
	}

	public int getLastLine() {
		return lastLine;
	}

	@Override
	public String toString() {
		StringBuilder description = new StringBuilder();
		description.append(firstLine);
		if (lastLine != firstLine) {
			description.append('-').append(lastLine);
		}
		description.append(": ").append(text);
		if (comment != null) {
			description.append(" !").append(comment);
		}
		return description.toString();
	}
}

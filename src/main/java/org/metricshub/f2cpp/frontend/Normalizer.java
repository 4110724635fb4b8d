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

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits free-form Fortran source text into {@link LogicalStatement}s.
 * <p>
 * The normalizer never looks at the meaning of a statement. It:
 * <ul>
 * <li>separates the <code>!</code> comment of each line from its code,
 * without being fooled by a marker inside a string literal;
 * <li>joins lines continued with a trailing <code>&amp;</code> (the optional
 * leading <code>&amp;</code> of the continued line is dropped);
 * <li>splits lines holding several statements separated by <code>;</code>;
 * <li>turns whole-line comments into comment-only statements, and drops
 * blank lines.
 * </ul>
 */
public class Normalizer {

	private final List<LogicalStatement> statements = new ArrayList<LogicalStatement>();
	private final StringBuilder code = new StringBuilder();
	private final List<String> comments = new ArrayList<String>();
	private int firstLine;
	private boolean continued;

	/**
	 * Reads the whole source and returns its logical statements, in order.
	 *
	 * @param source reader of the Fortran source
	 * @return the logical statements
	 * @throws IOException when the source cannot be read
	 */
	public List<LogicalStatement> normalize(Reader source) throws IOException {
		statements.clear();
		code.setLength(0);
		comments.clear();
		continued = false;

		LineNumberReader reader = new LineNumberReader(source);
		String line;
		while ((line = reader.readLine()) != null) {
			addLine(line, reader.getLineNumber());
		}
		if (continued) {
			// dangling continuation marker on the last line
			flush(reader.getLineNumber());
		}
		return new ArrayList<LogicalStatement>(statements);
	}

	private void addLine(String line, int lineNumber) {
		String body = line;
		String comment = null;
		int marker = SourceText.indexOfComment(line);
		if (marker >= 0) {
			comment = SourceText.stripTrailing(line.substring(marker + 1));
			body = line.substring(0, marker);
		}
		body = body.trim();

		if (body.isEmpty()) {
			if (comment != null) {
				if (continued) {
					comments.add(comment);
				} else {
					statements.add(LogicalStatement.commentOnly(comment, lineNumber));
				}
			}
			return;
		}

		if (continued) {
			if (body.charAt(0) == '&') {
				body = body.substring(1).trim();
				// a leading '&' continues the previous token without a blank
				if (code.length() > 0 && code.charAt(code.length() - 1) == ' ') {
					code.setLength(code.length() - 1);
				}
			}
		} else {
			firstLine = lineNumber;
		}
		if (comment != null) {
			comments.add(comment);
		}

		if (body.endsWith("&")) {
			code.append(body.substring(0, body.length() - 1).trim()).append(' ');
			continued = true;
			return;
		}
		code.append(body);
		flush(lineNumber);
	}

	private void flush(int lastLine) {
		String comment = joinComments();
		List<String> pieces = SourceText.splitTopLevel(code.toString(), ';');
		List<String> nonEmpty = new ArrayList<String>();
		for (String piece : pieces) {
			if (!piece.isEmpty()) {
				nonEmpty.add(piece);
			}
		}
		if (nonEmpty.isEmpty() && comment != null) {
			statements.add(LogicalStatement.commentOnly(comment, firstLine));
		}
		for (int i = 0; i < nonEmpty.size(); i++) {
			// the comment belongs to the last statement of the line
			String attached = i == nonEmpty.size() - 1 ? comment : null;
			statements.add(new LogicalStatement(nonEmpty.get(i), attached, firstLine, lastLine));
		}
		code.setLength(0);
		comments.clear();
		continued = false;
	}

	private String joinComments() {
		if (comments.isEmpty()) {
			return null;
		}
		StringBuilder joined = new StringBuilder(comments.get(0));
		for (int i = 1; i < comments.size(); i++) {
			joined.append(' ').append(comments.get(i).trim());
		}
		return joined.toString();
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scanning helpers over a single line (or logical statement) of Fortran text.
 * <p>
 * All helpers track the quote state, so that a comment marker, a separator
 * or a parenthesis inside a string literal is never taken into account.
 * Both <code>'</code> and <code>"</code> delimit literals, and a doubled
 * delimiter inside a literal simply closes and re-opens it, which is
 * harmless for scanning purposes.
 */
public final class SourceText {

	private SourceText() {}

	/**
	 * Returns the index of the comment marker <code>!</code> of the specified
	 * line, ignoring any marker inside a string literal.
	 *
	 * @param line one physical source line
	 * @return index of the marker, or {@code -1} when the line has no comment
	 */
	public static int indexOfComment(String line) {
		char quote = 0;
		for (int i = 0; i < line.length(); i++) {
			char ch = line.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
			} else if (ch == '\'' || ch == '"') {
				quote = ch;
			} else if (ch == '!') {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Splits the text on the specified separator, considering only separators
	 * outside string literals, parentheses and brackets.
	 *
	 * @param text text to split
	 * @param separator separator character
	 * @return trimmed parts, empty when the text is blank
	 */
	public static List<String> splitTopLevel(String text, char separator) {
		if (text == null || text.trim().isEmpty()) {
			return Collections.emptyList();
		}
		List<String> parts = new ArrayList<String>();
		int depth = 0;
		char quote = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == '\'' || ch == '"') {
				quote = ch;
			} else if (ch == '(' || ch == '[') {
				depth++;
			} else if (ch == ')' || ch == ']') {
				depth--;
			} else if (ch == separator && depth == 0) {
				parts.add(text.substring(start, i).trim());
				start = i + 1;
			}
		}
		parts.add(text.substring(start).trim());
		return parts;
	}

	/**
	 * Finds the first occurrence of the token outside string literals,
	 * parentheses and brackets.
	 *
	 * @param text text to search
	 * @param token token to find
	 * @return index of the token, or {@code -1}
	 */
	public static int indexOfTopLevel(String text, String token) {
		int depth = 0;
		char quote = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == '\'' || ch == '"') {
				quote = ch;
			} else if (ch == '(' || ch == '[') {
				depth++;
			} else if (ch == ')' || ch == ']') {
				depth--;
			} else if (depth == 0 && text.startsWith(token, i)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Finds the assignment operator of a statement: the first <code>=</code>
	 * outside literals and parentheses that is not part of <code>==</code>,
	 * <code>/=</code>, <code>&lt;=</code>, <code>&gt;=</code> or <code>=&gt;</code>.
	 *
	 * @param text statement text
	 * @return index of the assignment operator, or {@code -1}
	 */
	public static int findAssignment(String text) {
		int depth = 0;
		char quote = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == '\'' || ch == '"') {
				quote = ch;
			} else if (ch == '(' || ch == '[') {
				depth++;
			} else if (ch == ')' || ch == ']') {
				depth--;
			} else if (ch == '=' && depth == 0) {
				char previous = i > 0 ? text.charAt(i - 1) : ' ';
				char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
				if (previous == '=' || previous == '/' || previous == '<' || previous == '>') {
					continue;
				}
				if (next == '=' || next == '>') {
					i++;
					continue;
				}
				return i;
			}
		}
		return -1;
	}

	/**
	 * Returns the index of the parenthesis closing the one at {@code open}.
	 *
	 * @param text text to scan
	 * @param open index of an opening parenthesis
	 * @return index of the matching closing parenthesis, or {@code -1}
	 */
	public static int matchingParenthesis(String text, int open) {
		int depth = 0;
		char quote = 0;
		for (int i = open; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (quote != 0) {
				if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == '\'' || ch == '"') {
				quote = ch;
			} else if (ch == '(') {
				depth++;
			} else if (ch == ')') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Removes trailing whitespace.
	 *
	 * @param text text to strip
	 * @return the text without trailing blanks
	 */
	public static String stripTrailing(String text) {
		int end = text.length();
		while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(0, end);
	}
}

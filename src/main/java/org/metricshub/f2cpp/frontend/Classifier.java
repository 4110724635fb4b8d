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

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.f2cpp.util.F2CppLogger;
import org.slf4j.Logger;

/**
 * Assigns a {@link StatementKind} to each {@link LogicalStatement}, based on
 * its leading keyword and its shape.
 * <p>
 * Keywords are case-insensitive. A statement that matches no rule is
 * classified as {@link StatementKind#UNRECOGNIZED}: this is a coverage gap,
 * not an error, and the statement is passed through for manual review.
 */
public class Classifier {

	private static final Logger LOGGER = F2CppLogger.getLogger(Classifier.class);

	private static final int FLAGS = Pattern.CASE_INSENSITIVE;

	private static final String TYPE = "(?:integer|real|double\\s*precision|logical|character|complex)";
	private static final String PREFIX = "(?:(?:pure|elemental|recursive|impure)\\s+)*";

	private static final Pattern END_NAMED = Pattern
			.compile("end\\s*(do|if|function|subroutine|module|program)(?:\\s+(\\w+))?", FLAGS);
	private static final Pattern END = Pattern.compile("end", FLAGS);
	private static final Pattern CONTAINS = Pattern.compile("contains", FLAGS);
	private static final Pattern IMPLICIT = Pattern.compile("implicit\\s+(.*)", FLAGS);
	private static final Pattern MODULE = Pattern.compile("module\\s+(\\w+)", FLAGS);
	private static final Pattern PROGRAM = Pattern.compile("program\\s+(\\w+)", FLAGS);
	private static final Pattern PROCEDURE = Pattern
			.compile(
					PREFIX
							+ "(?:(" + TYPE + "(?:\\s*\\([^)]*\\)|\\s*\\*\\s*\\d+)?)\\s+)?"
							+ PREFIX
							+ "(function|subroutine)\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?\\s*(?:result\\s*\\(\\s*(\\w+)\\s*\\))?",
					FLAGS);
	private static final Pattern USE = Pattern
			.compile("use\\s*(?:,\\s*intrinsic\\s*::\\s*|::\\s*)?(\\w+)\\s*(?:,\\s*only\\s*:\\s*(.*))?", FLAGS);
	private static final Pattern DO_WHILE = Pattern.compile("(?:(\\w+)\\s*:\\s*)?do\\s+while\\s*\\((.*)\\)", FLAGS);
	private static final Pattern DO_ENDLESS = Pattern.compile("(?:(\\w+)\\s*:\\s*)?do", FLAGS);
	private static final Pattern DO_COUNTED = Pattern.compile("(?:(\\w+)\\s*:\\s*)?do\\s+(\\w+)\\s*=\\s*(.+)", FLAGS);
	private static final Pattern IF_HEAD = Pattern.compile("if\\s*\\(", FLAGS);
	private static final Pattern ELSE_IF_HEAD = Pattern.compile("else\\s*if\\s*\\(", FLAGS);
	private static final Pattern ELSE = Pattern.compile("else", FLAGS);
	private static final Pattern EXIT = Pattern.compile("exit(?:\\s+(\\w+))?", FLAGS);
	private static final Pattern CYCLE = Pattern.compile("cycle(?:\\s+(\\w+))?", FLAGS);
	private static final Pattern RETURN = Pattern.compile("return", FLAGS);
	private static final Pattern STOP = Pattern.compile("(error\\s+)?stop(?:\\s+(.+))?", FLAGS);
	private static final Pattern CALL = Pattern.compile("call\\s+(\\w+)\\s*(?:\\((.*)\\))?", FLAGS);
	private static final Pattern PRINT = Pattern.compile("print\\b\\s*(.*)", FLAGS);
	private static final Pattern IO_HEAD = Pattern.compile("(write|read)\\s*\\(", FLAGS);
	private static final Pattern READ_FORMAT = Pattern.compile("read\\s*([*'\"\\d].*)", FLAGS);
	private static final Pattern ALLOCATE = Pattern.compile("(de)?allocate\\s*\\((.*)\\)", FLAGS);
	private static final Pattern OLD_STYLE_DECLARATION = Pattern
			.compile("(" + TYPE + "(?:\\s*\\*\\s*\\d+|\\s*\\([^)]*\\))?)\\s+([a-z_]\\w*.*)", FLAGS);

	/**
	 * Classifies one logical statement.
	 *
	 * @param statement the statement to classify
	 * @return the classified statement, never {@code null}
	 */
	public Statement classify(LogicalStatement statement) {
		Statement result = doClassify(statement);
		LOGGER.debug("line {}: {}", statement.getFirstLine(), result);
		return result;
	}

	private Statement doClassify(LogicalStatement s) {
		if (s.isCommentOnly()) {
			return new Statement(StatementKind.COMMENT, s);
		}
		String text = s.getText();
		Matcher m;

		if ((m = END_NAMED.matcher(text)).matches()) {
			String block = m.group(1).toLowerCase(Locale.ROOT);
			switch (block) {
			case "do":
				return new Statement(StatementKind.LOOP_CLOSE, s, m.group(2));
			case "if":
				return new Statement(StatementKind.IF_CLOSE, s);
			case "module":
				return new Statement(StatementKind.MODULE_CLOSE, s, m.group(2));
			case "program":
				return new Statement(StatementKind.PROGRAM_CLOSE, s, m.group(2));
			default:
				return new Statement(StatementKind.PROCEDURE_CLOSE, s, block, m.group(2));
			}
		}
		if (END.matcher(text).matches()) {
			return new Statement(StatementKind.PROCEDURE_CLOSE, s, null, null);
		}
		if (CONTAINS.matcher(text).matches()) {
			return new Statement(StatementKind.CONTAINS, s);
		}
		if ((m = IMPLICIT.matcher(text)).matches()) {
			return new Statement(StatementKind.IMPLICIT, s, m.group(1).trim());
		}
		if ((m = MODULE.matcher(text)).matches() && !m.group(1).equalsIgnoreCase("procedure")) {
			return new Statement(StatementKind.MODULE_OPEN, s, m.group(1));
		}
		if ((m = PROGRAM.matcher(text)).matches()) {
			return new Statement(StatementKind.PROGRAM_OPEN, s, m.group(1));
		}
		if ((m = PROCEDURE.matcher(text)).matches()) {
			return new Statement(
					StatementKind.PROCEDURE_OPEN,
					s,
					m.group(2).toLowerCase(Locale.ROOT),
					m.group(3),
					m.group(4),
					m.group(5),
					m.group(1));
		}
		if ((m = USE.matcher(text)).matches()) {
			return new Statement(StatementKind.USE, s, m.group(1), m.group(2));
		}
		if ((m = DO_WHILE.matcher(text)).matches()) {
			return new Statement(StatementKind.LOOP_WHILE_OPEN, s, m.group(2).trim(), m.group(1));
		}
		if ((m = DO_ENDLESS.matcher(text)).matches()) {
			return new Statement(StatementKind.LOOP_WHILE_OPEN, s, null, m.group(1));
		}
		if ((m = DO_COUNTED.matcher(text)).matches()) {
			List<String> bounds = SourceText.splitTopLevel(m.group(3), ',');
			if (bounds.size() == 2 || bounds.size() == 3) {
				return new Statement(
						StatementKind.LOOP_OPEN,
						s,
						m.group(2),
						bounds.get(0),
						bounds.get(1),
						bounds.size() == 3 ? bounds.get(2) : null,
						m.group(1));
			}
		}

		Statement conditional = classifyConditional(s, text);
		if (conditional != null) {
			return conditional;
		}
		if (ELSE.matcher(text).matches()) {
			return new Statement(StatementKind.ELSE, s);
		}
		if ((m = EXIT.matcher(text)).matches()) {
			return new Statement(StatementKind.EXIT, s, m.group(1));
		}
		if ((m = CYCLE.matcher(text)).matches()) {
			return new Statement(StatementKind.CYCLE, s, m.group(1));
		}
		if (RETURN.matcher(text).matches()) {
			return new Statement(StatementKind.RETURN, s);
		}
		if ((m = STOP.matcher(text)).matches()) {
			return new Statement(StatementKind.STOP, s, m.group(2), m.group(1) == null ? null : "error");
		}
		if ((m = CALL.matcher(text)).matches()) {
			return new Statement(StatementKind.CALL, s, m.group(1), m.group(2));
		}

		Statement io = classifyInputOutput(s, text);
		if (io != null) {
			return io;
		}
		if ((m = ALLOCATE.matcher(text)).matches()) {
			StatementKind kind = m.group(1) == null ? StatementKind.ALLOCATE : StatementKind.DEALLOCATE;
			return new Statement(kind, s, m.group(2).trim());
		}

		int separator = SourceText.indexOfTopLevel(text, "::");
		if (separator > 0 && Character.isLetter(text.charAt(0))) {
			return new Statement(
					StatementKind.DECLARATION,
					s,
					text.substring(0, separator).trim(),
					text.substring(separator + 2).trim());
		}
		if ((m = OLD_STYLE_DECLARATION.matcher(text)).matches() && SourceText.findAssignment(text) < 0) {
			return new Statement(StatementKind.DECLARATION, s, m.group(1).trim(), m.group(2).trim());
		}

		int assignment = SourceText.findAssignment(text);
		if (assignment > 0) {
			return new Statement(
					StatementKind.ASSIGNMENT,
					s,
					text.substring(0, assignment).trim(),
					text.substring(assignment + 1).trim());
		}
		return new Statement(StatementKind.UNRECOGNIZED, s);
	}

	/**
	 * Handles <code>if (...) then</code>, <code>else if (...) then</code> and
	 * the one-line <code>if (...) statement</code>. The condition is delimited
	 * by its matching parenthesis, since it may contain parentheses itself.
	 */
	private Statement classifyConditional(LogicalStatement s, String text) {
		Matcher m = ELSE_IF_HEAD.matcher(text);
		boolean elseIf = m.lookingAt();
		if (!elseIf) {
			m = IF_HEAD.matcher(text);
			if (!m.lookingAt()) {
				return null;
			}
		}
		int open = m.end() - 1;
		int close = SourceText.matchingParenthesis(text, open);
		if (close < 0) {
			return null;
		}
		String condition = text.substring(open + 1, close).trim();
		String rest = text.substring(close + 1).trim();
		if (rest.equalsIgnoreCase("then")) {
			return new Statement(elseIf ? StatementKind.ELSE_IF : StatementKind.IF_OPEN, s, condition);
		}
		if (elseIf || rest.isEmpty() || Character.isDigit(rest.charAt(0))) {
			// arithmetic IF and malformed branches are left unrecognized
			return null;
		}
		return new Statement(StatementKind.IF_SINGLE, s, condition, rest);
	}

	private Statement classifyInputOutput(LogicalStatement s, String text) {
		Matcher m = PRINT.matcher(text);
		if (m.matches() && !m.group(1).startsWith("=")) {
			String rest = m.group(1).trim();
			int comma = SourceText.indexOfTopLevel(rest, ",");
			if (comma < 0) {
				return new Statement(StatementKind.PRINT, s, rest, null);
			}
			return new Statement(
					StatementKind.PRINT,
					s,
					rest.substring(0, comma).trim(),
					emptyToNull(rest.substring(comma + 1)));
		}

		m = IO_HEAD.matcher(text);
		if (m.lookingAt()) {
			int open = m.end() - 1;
			int close = SourceText.matchingParenthesis(text, open);
			if (close < 0) {
				return null;
			}
			String items = text.substring(close + 1).trim();
			if (items.startsWith("=")) {
				// write(i) = ... is an assignment to an array named write
				return null;
			}
			if (items.startsWith(",")) {
				items = items.substring(1);
			}
			StatementKind kind = m.group(1).equalsIgnoreCase("write") ? StatementKind.WRITE : StatementKind.READ;
			return new Statement(kind, s, text.substring(open + 1, close).trim(), emptyToNull(items));
		}

		m = READ_FORMAT.matcher(text);
		if (m.matches()) {
			String rest = m.group(1).trim();
			int comma = SourceText.indexOfTopLevel(rest, ",");
			String format = comma < 0 ? rest : rest.substring(0, comma).trim();
			String items = comma < 0 ? null : emptyToNull(rest.substring(comma + 1));
			return new Statement(StatementKind.READ, s, "*, " + format, items);
		}
		return null;
	}

	private static String emptyToNull(String text) {
		String trimmed = text.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.SourceText;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * Emits list-directed input and output: <code>print *</code> and
 * <code>write(*,*)</code> to the standard output, <code>write(0,*)</code>
 * to the standard error, and <code>read *</code> from the standard input.
 * Output items are separated by a space and the record ends the line.
 */
class IoEmitter {

	private final TranslationContext context;

	IoEmitter(TranslationContext context) {
		this.context = context;
	}

	void print(Statement statement) {
		checkFormat(statement.part(0));
		output("cout", statement.part(1));
	}

	void write(Statement statement) {
		List<String> control = control(statement.part(0));
		String unit = control.get(0);
		String stream;
		if ("*".equals(unit) || "6".equals(unit)) {
			stream = "cout";
		} else if ("0".equals(unit)) {
			stream = "cerr";
		} else {
			throw new UnsupportedFeatureException("Output to unit " + unit + " is not supported");
		}
		output(stream, statement.part(1));
	}

	void read(Statement statement) {
		List<String> control = control(statement.part(0));
		String unit = control.get(0);
		if (!"*".equals(unit) && !"5".equals(unit)) {
			throw new UnsupportedFeatureException("Input from unit " + unit + " is not supported");
		}
		context.require("iostream");
		if (statement.part(1) == null) {
			context.review("'read' without items skips a record");
			context.emit("cin.ignore(numeric_limits<streamsize>::max(), '\\n');");
			context.require("limits");
			return;
		}
		StringBuilder text = new StringBuilder("cin");
		for (Expression item : context.parseArguments(statement.part(1))) {
			String name;
			if (item instanceof NameReference) {
				name = ((NameReference) item).getName();
			} else if (item instanceof Application) {
				name = ((Application) item).getName();
			} else {
				throw new UnsupportedFeatureException("Cannot read into '" + item + "'");
			}
			CppCode code = context.translate(item);
			if (code.isWholeArray()) {
				throw new UnsupportedFeatureException("Reading whole array '" + name + "' is not supported");
			}
			context.markAssigned(name);
			text.append(" >> ").append(code.getText());
		}
		context.emit(text.append(';').toString());
	}

	/**
	 * Splits the control list of <code>write</code> and <code>read</code>
	 * into unit and format, checking that the format is list-directed.
	 */
	private static List<String> control(String text) {
		List<String> parts = new ArrayList<String>();
		for (String part : SourceText.splitTopLevel(text, ',')) {
			String lower = part.toLowerCase(Locale.ROOT);
			if (lower.startsWith("unit=") || lower.startsWith("fmt=")) {
				part = part.substring(part.indexOf('=') + 1).trim();
			} else if (part.indexOf('=') >= 0) {
				throw new UnsupportedFeatureException("I/O specifier '" + part + "' is not supported");
			}
			parts.add(part);
		}
		if (parts.size() != 2) {
			throw new UnsupportedFeatureException("Unsupported I/O control list (" + text + ")");
		}
		checkFormat(parts.get(1));
		return parts;
	}

	private static void checkFormat(String format) {
		if (!"*".equals(format)) {
			throw new UnsupportedFeatureException("Formatted I/O is not supported: " + format);
		}
	}

	private void output(String stream, String items) {
		context.require("iostream");
		if (items == null) {
			context.emit(stream + " << endl;");
			return;
		}
		List<String> texts = new ArrayList<String>();
		for (Expression item : context.parseArguments(items)) {
			CppCode code = context.translate(item);
			if (code.isWholeArray()) {
				throw new UnsupportedFeatureException("Output of whole array '" + code.getArray().getName() + "' is not supported");
			}
			if (code.getType() == TargetType.BOOLEAN) {
				texts.add("(" + code.operand(CppCode.CONDITIONAL + 1) + " ? \"T\" : \"F\")");
			} else {
				texts.add(code.operand(CppCode.ADDITIVE));
			}
		}
		context.emit(stream + " << " + String.join(" << \" \" << ", texts) + " << endl;");
	}
}

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

import java.util.function.Supplier;
import org.metricshub.f2cpp.TranslationException;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ParserException;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.ScopeKind;
import org.metricshub.f2cpp.scope.ScopeStack;
import org.metricshub.f2cpp.scope.Shape;
import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * Emits loops, conditionals and the statements that transfer control:
 * <code>exit</code>, <code>cycle</code>, <code>return</code> and
 * <code>stop</code>.
 * <p>
 * Block openers are always emitted, even when their expressions cannot be
 * translated (the source text is kept, with a review note), so that the
 * braces of the output stay balanced.
 */
class ControlFlowEmitter {

	private final TranslationContext context;
	private final ScopeStack scopes;

	ControlFlowEmitter(TranslationContext context) {
		this.context = context;
		this.scopes = context.getScopes();
	}

	/**
	 * <code>do i = lo, hi[, step]</code>: the upper bound is inclusive. The
	 * upper bound and a variable step are copied to a constant before the
	 * loop when its body may change their value, as Fortran evaluates them
	 * only once.
	 */
	void countedLoop(Statement statement) {
		String variable = statement.part(0);
		String lower = context.translateOrKeep(statement.part(1));
		CppCode upper = bound(statement.part(2));
		LoopBound upperReads = LoopBound.of(scopes, parseQuietly(statement.part(2)));
		String step = statement.part(3);

		Symbol symbol = context.lookup(variable);
		Scope loop = scopes.enter(ScopeKind.LOOP, null, statement.getLine());
		loop.setLabel(statement.part(4));
		loop.setInductionVariable(variable);

		String init;
		if (symbol == null) {
			symbol = new Symbol(variable, TargetType.INTEGER, Shape.SCALAR);
			scopes.declareLocal(symbol, statement.getLine());
			init = "int " + symbol.getTargetName() + " = " + lower;
		} else {
			if (symbol.getType() != TargetType.INTEGER) {
				context.review("loop variable '" + variable + "' is not an integer");
			}
			context.markAssigned(variable);
			init = symbol.getTargetName() + " = " + lower;
		}

		Long stepValue = step == null ? Long.valueOf(1) : foldStep(step);
		if (stepValue == null) {
			CppCode stepCode = bound(step);
			LoopBound stepReads = LoopBound.of(scopes, parseQuietly(step));
			context.emit(new LoopHeader(loop, symbol.getTargetName(), init, upper, upperReads, stepCode, stepReads));
		} else {
			if (stepValue.longValue() == 0) {
				context.review("loop step is zero");
			}
			context.emit(new LoopHeader(loop, symbol.getTargetName(), init, upper, upperReads, stepValue.longValue()));
		}
		context.indent();
	}

	private CppCode bound(String text) {
		try {
			return context.translate(context.parse(text));
		} catch (ParserException | UnsupportedFeatureException e) {
			context.review("untranslated expression '" + text + "': " + e.getMessage());
			return new CppCode(text, CppCode.PRIMARY, null);
		}
	}

	private Expression parseQuietly(String text) {
		try {
			return context.parse(text);
		} catch (ParserException e) {
			return null;
		}
	}

	private String unusedName(String base) {
		String name = base;
		while (scopes.lookup(name) != null) {
			name += "_";
		}
		return name;
	}

	private Long foldStep(String step) {
		try {
			return context.getFolder().fold(context.parse(step));
		} catch (ParserException e) {
			return null;
		}
	}

	/**
	 * The <code>for</code> line of a counted loop, rendered once the body is
	 * translated, when it is known whether the body modifies the variables
	 * read by the bounds.
	 */
	private class LoopHeader implements Supplier<String> {

		private final Scope loop;
		private final String target;
		private final String init;
		private final CppCode upper;
		private final LoopBound upperReads;
		private final CppCode step;
		private final LoopBound stepReads;
		private final long stepValue;
		private final String endName;
		private final String stepName;
		private String text;

		LoopHeader(Scope loop, String target, String init, CppCode upper, LoopBound upperReads, CppCode step, LoopBound stepReads) {
			this.loop = loop;
			this.target = target;
			this.init = init;
			this.endName = unusedName(target + "_end");
			this.stepName = unusedName(target + "_step");
			this.upper = upper;
			this.upperReads = upperReads;
			this.step = step;
			this.stepReads = stepReads;
			this.stepValue = 0;
		}

		LoopHeader(Scope loop, String target, String init, CppCode upper, LoopBound upperReads, long stepValue) {
			this.loop = loop;
			this.target = target;
			this.init = init;
			this.endName = unusedName(target + "_end");
			this.stepName = unusedName(target + "_step");
			this.upper = upper;
			this.upperReads = upperReads;
			this.step = null;
			this.stepReads = null;
			this.stepValue = stepValue;
		}

		@Override
		public String get() {
			if (text == null) {
				StringBuilder saved = new StringBuilder();
				String end = save(upper, upperReads, endName, saved);
				String condition;
				String increment;
				if (step != null) {
					String by = save(step, stepReads, stepName, saved);
					condition = "(" + by + " > 0 ? " + target + " <= " + end + " : " + target + " >= " + end + ")";
					increment = target + " += " + by;
				} else if (stepValue >= 0) {
					condition = target + " <= " + end;
					increment = stepValue == 1 ? target + "++" : target + " += " + stepValue;
				} else {
					condition = target + " >= " + end;
					increment = stepValue == -1 ? target + "--" : target + " -= " + (-stepValue);
				}
				text = saved + "for (" + init + "; " + condition + "; " + increment + ") {";
			}
			return text;
		}

		private String save(CppCode value, LoopBound reads, String base, StringBuilder saved) {
			if (!reads.mustBeSaved(loop)) {
				return value.getText();
			}
			String name = context.generatedName(base);
			saved.append("const ").append(declaredType(value)).append(' ').append(name).append(" = ").append(value.getText()).append(";\n");
			return name;
		}

		private String declaredType(CppCode value) {
			return value.getType() == null ? "auto" : context.getTypes().scalar(value.getType());
		}
	}

	/**
	 * <code>do while (c)</code> and the endless <code>do</code>.
	 */
	void whileLoop(Statement statement) {
		String condition = statement.part(0) == null ? "true" : context.translateOrKeep(statement.part(0));
		Scope loop = scopes.enter(ScopeKind.LOOP, null, statement.getLine());
		loop.setLabel(statement.part(1));
		context.emit("while (" + condition + ") {");
		context.indent();
	}

	void endLoop(Statement statement) {
		String label = statement.part(0);
		Scope top = scopes.current();
		if (label != null && top != null && top.getKind() == ScopeKind.LOOP && !label.equalsIgnoreCase(top.getLabel())) {
			throw new TranslationException(statement.getLine(), "Unbalanced block: 'end do " + label + "' closes " + top);
		}
		scopes.leave(ScopeKind.LOOP, statement.getLine());
		context.outdent();
		context.emit("}");
	}

	void openIf(Statement statement) {
		String condition = context.translateOrKeep(statement.part(0));
		scopes.enter(ScopeKind.CONDITIONAL, null, statement.getLine());
		context.emit("if (" + condition + ") {");
		context.indent();
	}

	void elseIf(Statement statement) {
		requireConditional(statement, "else if");
		String condition = context.translateOrKeep(statement.part(0));
		context.outdent();
		context.emit("} else if (" + condition + ") {");
		context.indent();
	}

	void otherwise(Statement statement) {
		requireConditional(statement, "else");
		context.outdent();
		context.emit("} else {");
		context.indent();
	}

	private void requireConditional(Statement statement, String keyword) {
		Scope top = scopes.current();
		if (top == null || top.getKind() != ScopeKind.CONDITIONAL) {
			throw new TranslationException(
					statement.getLine(),
					"Unbalanced block: '" + keyword + "' found while " + (top == null ? "no block" : top.toString()) + " is open");
		}
	}

	void endIf(Statement statement) {
		scopes.leave(ScopeKind.CONDITIONAL, statement.getLine());
		context.outdent();
		context.emit("}");
	}

	/**
	 * <code>exit</code> and <code>cycle</code> only transfer control within
	 * the innermost loop.
	 *
	 * @param statement the statement
	 * @param keyword <code>exit</code> or <code>cycle</code>
	 * @param transfer the C++ statement
	 */
	void loopControl(Statement statement, String keyword, String transfer) {
		String label = statement.part(0);
		Scope target = scopes.loop(label);
		if (target == null) {
			if (label != null && scopes.loop(null) != null) {
				throw new TranslationException(statement.getLine(), "'" + keyword + " " + label + "' names no enclosing loop");
			}
			throw new TranslationException(statement.getLine(), "'" + keyword + "' outside of a loop");
		}
		if (target != scopes.loop(null)) {
			throw new UnsupportedFeatureException("'" + keyword + "' of an outer loop is not supported");
		}
		context.emit(transfer);
	}

	void returnStatement(Statement statement) {
		Scope unit = scopes.unit();
		if (unit == null || unit.getKind() == ScopeKind.PROGRAM) {
			context.emit("return 0;");
			return;
		}
		ProcedureSignature procedure = unit.getProcedure();
		if (procedure == null) {
			throw new TranslationException(statement.getLine(), "'return' outside of a procedure");
		}
		if (procedure.isFunction()) {
			context.emit("return " + UnitEmitter.resultName(procedure) + ";");
		} else {
			context.emit("return;");
		}
	}

	/**
	 * <code>stop</code> returns from <code>main</code>, or exits the process
	 * from a procedure. A message goes to the standard error.
	 */
	void stop(Statement statement) {
		String status = statement.part(1) == null ? "0" : "1";
		if (statement.part(0) != null) {
			Expression code = context.parse(statement.part(0));
			CppCode value = context.translate(code);
			if (code instanceof StringLiteral || value.getType() == TargetType.STRING) {
				context.require("iostream");
				context.emit("cerr << " + value.getText() + " << endl;");
			} else {
				status = value.getText();
			}
		}
		Scope unit = scopes.unit();
		if (unit != null && unit.getKind() == ScopeKind.PROGRAM) {
			context.emit("return " + status + ";");
		} else {
			context.require("cstdlib");
			context.emit("exit(" + status + ");");
		}
	}
}

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

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.f2cpp.TranslationException;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.Classifier;
import org.metricshub.f2cpp.frontend.LogicalStatement;
import org.metricshub.f2cpp.frontend.ParserException;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.StatementKind;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.ScopeKind;
import org.metricshub.f2cpp.scope.ScopeStack;
import org.metricshub.f2cpp.util.F2CppLogger;
import org.metricshub.f2cpp.util.TranslatorSettings.GapStyle;
import org.slf4j.Logger;

/**
 * Translates classified statements one at a time, in source order, into
 * the fragments of a {@link TranslationContext}.
 * <p>
 * A statement that cannot be translated becomes a coverage gap: whatever
 * it emitted is discarded and replaced with an untranslated marker holding
 * its source text. Structural errors are thrown as
 * {@link TranslationException}s.
 */
public class StatementEmitter {

	private static final Logger LOGGER = F2CppLogger.getLogger(StatementEmitter.class);

	static final String MARKER = "[f2cpp]";

	/** Statements allowed after the condition of a one-line <code>if</code>. */
	private static final Set<StatementKind> SIMPLE = EnumSet
			.of(
					StatementKind.ASSIGNMENT,
					StatementKind.EXIT,
					StatementKind.CYCLE,
					StatementKind.RETURN,
					StatementKind.STOP,
					StatementKind.CALL,
					StatementKind.PRINT,
					StatementKind.WRITE,
					StatementKind.READ,
					StatementKind.ALLOCATE,
					StatementKind.DEALLOCATE);

	/** Statements that may appear before any program unit is opened. */
	private static final Set<StatementKind> OUTSIDE = EnumSet
			.of(
					StatementKind.COMMENT,
					StatementKind.MODULE_OPEN,
					StatementKind.PROGRAM_OPEN,
					StatementKind.PROCEDURE_OPEN,
					StatementKind.MODULE_CLOSE,
					StatementKind.PROGRAM_CLOSE,
					StatementKind.PROCEDURE_CLOSE,
					StatementKind.UNRECOGNIZED);

	private final TranslationContext context;
	private final ScopeStack scopes;
	private final Classifier classifier = new Classifier();
	private final DeclarationEmitter declarations;
	private final UnitEmitter units;
	private final ControlFlowEmitter controlFlow;
	private final AssignmentEmitter assignments;
	private final IoEmitter io;

	private int lastLine;

	public StatementEmitter(TranslationContext context) {
		this.context = context;
		this.scopes = context.getScopes();
		this.declarations = new DeclarationEmitter(context);
		this.units = new UnitEmitter(context, declarations);
		this.controlFlow = new ControlFlowEmitter(context);
		this.assignments = new AssignmentEmitter(context);
		this.io = new IoEmitter(context);
	}

	/**
	 * Translates one statement.
	 *
	 * @param statement the classified statement
	 * @throws TranslationException when the statement breaks the block
	 *         structure of the source
	 */
	public void translate(Statement statement) {
		lastLine = statement.getSource().getLastLine();
		if (scopes.isEmpty() && !OUTSIDE.contains(statement.getKind())) {
			units.openImplicitProgram(statement.getLine());
		}

		int depth = context.getDepth();
		int scopeDepth = scopes.depth();
		context.beginStatement(statement);
		try {
			dispatch(statement);
		} catch (ParserException | UnsupportedFeatureException e) {
			if (scopes.depth() != scopeDepth) {
				throw new TranslationException(statement.getLine(), "Cannot translate '" + statement.getText() + "': " + e.getMessage());
			}
			while (context.getDepth() > depth) {
				context.outdent();
			}
			context.discardStatement();
			gap(statement, e.getMessage());
		} finally {
			context.endStatement();
		}
	}

	private void dispatch(Statement statement) {
		switch (statement.getKind()) {
		case COMMENT:
			context.emitComment(statement.getSource().getComment());
			break;
		case DECLARATION:
			declarations.declaration(statement);
			break;
		case USE:
			declarations.use(statement);
			break;
		case IMPLICIT:
			declarations.implicit(statement);
			break;
		case ASSIGNMENT:
			assignments.assignment(statement);
			break;
		case CALL:
			assignments.call(statement);
			break;
		case ALLOCATE:
			assignments.allocate(statement);
			break;
		case DEALLOCATE:
			assignments.deallocate(statement);
			break;
		case LOOP_OPEN:
			controlFlow.countedLoop(statement);
			break;
		case LOOP_WHILE_OPEN:
			controlFlow.whileLoop(statement);
			break;
		case LOOP_CLOSE:
			controlFlow.endLoop(statement);
			break;
		case IF_OPEN:
			controlFlow.openIf(statement);
			break;
		case ELSE_IF:
			controlFlow.elseIf(statement);
			break;
		case ELSE:
			controlFlow.otherwise(statement);
			break;
		case IF_CLOSE:
			controlFlow.endIf(statement);
			break;
		case IF_SINGLE:
			singleIf(statement);
			break;
		case EXIT:
			controlFlow.loopControl(statement, "exit", "break;");
			break;
		case CYCLE:
			controlFlow.loopControl(statement, "cycle", "continue;");
			break;
		case RETURN:
			controlFlow.returnStatement(statement);
			break;
		case STOP:
			controlFlow.stop(statement);
			break;
		case PRINT:
			io.print(statement);
			break;
		case WRITE:
			io.write(statement);
			break;
		case READ:
			io.read(statement);
			break;
		case MODULE_OPEN:
			units.openModule(statement);
			break;
		case MODULE_CLOSE:
			units.closeModule(statement);
			break;
		case PROGRAM_OPEN:
			units.openProgram(statement);
			break;
		case PROGRAM_CLOSE:
			units.closeProgram(statement);
			break;
		case PROCEDURE_OPEN:
			units.openProcedure(statement);
			break;
		case PROCEDURE_CLOSE:
			units.closeProcedure(statement);
			break;
		case CONTAINS:
			units.contains(statement);
			break;
		case UNRECOGNIZED:
		default:
			throw new UnsupportedFeatureException("unrecognized statement");
		}
	}

	/**
	 * <code>if (c) statement</code>: the statement is translated on its own,
	 * then guarded by the condition.
	 */
	private void singleIf(Statement statement) {
		String condition = context.translate(context.parse(statement.part(0))).getText();
		LogicalStatement source = statement.getSource();
		Statement inner = classifier.classify(new LogicalStatement(statement.part(1), null, source.getFirstLine(), source.getLastLine()));
		if (!SIMPLE.contains(inner.getKind())) {
			throw new UnsupportedFeatureException("Unsupported statement in one-line 'if': " + statement.part(1));
		}

		int mark = context.mark();
		dispatch(inner);
		List<EmittedFragment> body = context.takeFrom(mark);
		if (body.size() == 1) {
			EmittedFragment single = body.get(0);
			context.emit(() -> "if (" + condition + ") " + single.getText());
			return;
		}
		context.emit("if (" + condition + ") {");
		for (EmittedFragment fragment : body) {
			fragment.shift(1);
			context.append(fragment);
		}
		context.emit("}");
	}

	private void gap(Statement statement, String message) {
		String text = statement.getText();
		context.getDiagnostics().gap(statement.getLine(), message, text);
		if (context.getSettings().getGapStyle() == GapStyle.RAW) {
			context.emit(text + " // " + MARKER + " untranslated");
		} else {
			context.emit("// " + MARKER + " untranslated: " + text);
		}
	}

	/**
	 * Checks the end of the source: every block must be closed, except a
	 * main program opened implicitly, which is closed here. The procedures
	 * called but never defined are reported as coverage gaps.
	 *
	 * @throws TranslationException when a block is left open
	 */
	public void finish() {
		Scope current = scopes.current();
		if (current != null && scopes.depth() == 1 && current.getKind() == ScopeKind.PROGRAM && current.getName() == null) {
			units.closeProgram(new Statement(StatementKind.PROGRAM_CLOSE, new LogicalStatement("end", null, lastLine, lastLine)));
		}
		if (!scopes.isEmpty()) {
			throw new TranslationException(lastLine, "Unclosed block at end of source: " + scopes.current());
		}
		for (Map.Entry<String, Integer> call : context.getUnresolvedCalls().entrySet()) {
			String message = "'" + call.getKey() + "' is called but never defined";
			LOGGER.debug("line {}: {}", call.getValue(), message);
			context.getDiagnostics().gap(call.getValue().intValue(), message, "");
		}
	}
}

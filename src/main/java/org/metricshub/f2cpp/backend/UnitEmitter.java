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
import java.util.function.Supplier;
import org.metricshub.f2cpp.TranslationException;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ParserException;
import org.metricshub.f2cpp.frontend.SourceText;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.scope.CppKeywords;
import org.metricshub.f2cpp.scope.ModuleUnit;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.ScopeKind;
import org.metricshub.f2cpp.scope.ScopeStack;
import org.metricshub.f2cpp.scope.Symbol;

/**
 * Emits program units: modules become namespaces, the main program becomes
 * <code>main</code>, functions and subroutines become C++ functions.
 * <p>
 * The procedures contained in a main program follow <code>main</code> in
 * the output: the <code>contains</code> statement closes <code>main</code>,
 * and the procedures called from it get prototypes at the top of the file.
 */
class UnitEmitter {

	private final TranslationContext context;
	private final ScopeStack scopes;
	private final DeclarationEmitter declarations;

	private EmittedFragment header;
	private EmittedFragment result;

	UnitEmitter(TranslationContext context, DeclarationEmitter declarations) {
		this.context = context;
		this.scopes = context.getScopes();
		this.declarations = declarations;
	}

	/**
	 * Supplies the header of a procedure, once the declarations of its dummy
	 * arguments and the assignments of its body are known: the type of each
	 * parameter depends on both.
	 */
	private final class ProcedureHeader implements Supplier<String> {

		private final ProcedureSignature signature;

		private ProcedureHeader(ProcedureSignature signature) {
			this.signature = signature;
		}

		@Override
		public String get() {
			String returnType = "void";
			if (signature.isFunction()) {
				Symbol resultSymbol = signature.getResult();
				returnType = context.getTypes().type(resultSymbol != null ? resultSymbol : Symbol.implicit(signature.getResultName()));
			}
			List<String> parameters = new ArrayList<String>();
			for (int i = 0; i < signature.getArity(); i++) {
				Symbol parameter = signature.getParameter(i);
				if (parameter == null) {
					parameter = Symbol.implicit(signature.getDummyNames().get(i));
				}
				parameters.add(context.getTypes().parameter(parameter, signature.isReadOnly(i)) + " " + parameter.getTargetName());
			}
			return returnType + " " + signature.getTargetName() + "(" + String.join(", ", parameters) + ")";
		}
	}

	/**
	 * @param signature a function
	 * @return the C++ name of its result variable
	 */
	static String resultName(ProcedureSignature signature) {
		Symbol resultSymbol = signature.getResult();
		return resultSymbol != null ? resultSymbol.getTargetName() : CppKeywords.safeName(signature.getResultName());
	}

	void openModule(Statement statement) {
		String name = statement.part(0);
		if (!scopes.isEmpty()) {
			throw new TranslationException(statement.getLine(), "Module '" + name + "' cannot be nested in " + scopes.current());
		}
		Scope scope = scopes.enterModule(name, statement.getLine());
		context.emit("namespace " + CppKeywords.safeName(name) + " {");
		context.emit(context.prototypes(scope.getModule()));
	}

	void closeModule(Statement statement) {
		Scope scope = scopes.leave(ScopeKind.MODULE, statement.getLine());
		checkName(statement, statement.part(0), scope);
		context.emit("} // namespace " + CppKeywords.safeName(scope.getName()));
	}

	void openProgram(Statement statement) {
		if (!scopes.isEmpty()) {
			throw new TranslationException(statement.getLine(), "Program '" + statement.part(0) + "' cannot be nested in " + scopes.current());
		}
		scopes.enter(ScopeKind.PROGRAM, statement.part(0), statement.getLine());
		context.emit("int main() {");
		context.indent();
	}

	/**
	 * Opens the main program of a source whose executable statements are not
	 * preceded by a <code>program</code> statement.
	 *
	 * @param line line of the first statement of the program
	 */
	void openImplicitProgram(int line) {
		scopes.enter(ScopeKind.PROGRAM, null, line);
		context.emit("int main() {");
		context.indent();
	}

	void closeProgram(Statement statement) {
		Scope scope = scopes.leave(ScopeKind.PROGRAM, statement.getLine());
		checkName(statement, statement.part(1) == null ? statement.part(0) : statement.part(1), scope);
		if (!scope.isContainsSeen()) {
			closeMain();
		}
	}

	private void closeMain() {
		context.emit("return 0;");
		context.outdent();
		context.emit("}");
	}

	void contains(Statement statement) {
		Scope current = scopes.current();
		if (current == null) {
			throw new TranslationException(statement.getLine(), "'contains' outside of a program unit");
		}
		switch (current.getKind()) {
		case PROGRAM:
			if (!current.isContainsSeen()) {
				closeMain();
			}
			current.setContainsSeen(true);
			break;
		case MODULE:
			current.setContainsSeen(true);
			break;
		case PROCEDURE:
			throw new TranslationException(
					statement.getLine(),
					"Internal procedures of " + current + " cannot be translated to C++ functions");
		default:
			throw new TranslationException(statement.getLine(), "Unbalanced block: 'contains' found while " + current + " is open");
		}
	}

	void openProcedure(Statement statement) {
		String kind = statement.part(0);
		String name = statement.part(1);
		Scope current = scopes.current();
		ModuleUnit module = null;
		if (current != null) {
			if (current.getKind() == ScopeKind.MODULE) {
				module = current.getModule();
			} else if (current.getKind() != ScopeKind.PROGRAM || !current.isContainsSeen()) {
				throw new TranslationException(statement.getLine(), "Unbalanced block: " + kind + " '" + name + "' found while " + current + " is open");
			}
		}

		boolean function = "function".equals(kind);
		String resultName = function ? (statement.part(3) != null ? statement.part(3) : name) : null;
		List<String> dummies = SourceText.splitTopLevel(statement.part(2), ',');
		ProcedureSignature signature = new ProcedureSignature(name, function, dummies, resultName, module);
		scopes.enterProcedure(signature, statement.getLine());

		final ProcedureHeader procedureHeader = new ProcedureHeader(signature);
		context.defineProcedure(signature, procedureHeader);
		header = context.emit(() -> procedureHeader.get() + " {");
		context.indent();

		result = null;
		if (function) {
			if (statement.part(4) != null) {
				try {
					for (Symbol symbol : context.getSymbolTableBuilder().declare(statement.part(4), resultName, statement.getLine())) {
						declarations.declare(symbol);
					}
				} catch (ParserException | UnsupportedFeatureException e) {
					context.review("result type '" + statement.part(4) + "' not translated: " + e.getMessage());
				}
			}
			if (signature.getResult() == null) {
				// declared by the body, or implicitly typed
				result = context.emit(() -> {
					if (signature.getResult() != null) {
						return "";
					}
					Symbol implicit = Symbol.implicit(signature.getResultName());
					return context.getTypes().type(implicit) + " " + implicit.getTargetName() + ";";
				});
			}
		}
	}

	/**
	 * Closes a procedure, or with a bare <code>end</code> whatever program
	 * unit is innermost.
	 */
	void closeProcedure(Statement statement) {
		String kind = statement.part(0);
		Scope top = scopes.current();
		if (kind == null && top != null && top.getKind() == ScopeKind.PROGRAM) {
			closeProgram(statement);
			return;
		}
		if (kind == null && top != null && top.getKind() == ScopeKind.MODULE) {
			closeModule(statement);
			return;
		}

		Scope scope = scopes.leave(ScopeKind.PROCEDURE, statement.getLine());
		ProcedureSignature signature = scope.getProcedure();
		if (kind != null && signature.isFunction() != "function".equals(kind)) {
			throw new TranslationException(statement.getLine(), "Unbalanced block: 'end " + kind + "' closes " + signature);
		}
		checkName(statement, statement.part(1), scope);

		for (int i = 0; i < signature.getArity(); i++) {
			if (signature.getParameter(i) == null) {
				String dummy = signature.getDummyNames().get(i);
				context.review(header, "implicitly typed argument '" + dummy + "'", statement.getText());
			}
		}
		if (signature.isFunction()) {
			if (result != null && signature.getResult() == null) {
				context.review(result, "implicitly typed result '" + signature.getResultName() + "'", statement.getText());
			}
			context.emit("return " + resultName(signature) + ";");
		}
		context.outdent();
		context.emit("}");
		header = null;
		result = null;
	}

	private static void checkName(Statement statement, String name, Scope scope) {
		if (name != null && scope.getName() != null && !name.equalsIgnoreCase(scope.getName())) {
			throw new TranslationException(statement.getLine(), "Unbalanced block: 'end " + name + "' closes " + scope);
		}
	}
}

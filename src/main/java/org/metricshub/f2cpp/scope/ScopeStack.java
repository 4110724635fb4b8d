package org.metricshub.f2cpp.scope;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.f2cpp.TranslationException;
import org.metricshub.f2cpp.util.F2CppLogger;
import org.slf4j.Logger;

/**
 * Explicit stack of the lexical contexts open at the current statement.
 * <p>
 * Every statement is translated relative to the top of the stack. Blocks
 * must nest properly: closing a block that is not the innermost one is a
 * fatal {@link TranslationException}.
 * <p>
 * The stack also keeps, for the whole run, the registry of the modules and
 * of the procedures that do not belong to a module, so that they remain
 * visible once their own scope is closed.
 */
public class ScopeStack {

	private static final Logger LOGGER = F2CppLogger.getLogger(ScopeStack.class);

	private final Deque<Scope> scopes = new ArrayDeque<Scope>();
	private final Map<String, ModuleUnit> modules = new LinkedHashMap<String, ModuleUnit>();
	private final Map<String, ProcedureSignature> procedures = new LinkedHashMap<String, ProcedureSignature>();

	/**
	 * Opens a new block.
	 *
	 * @param kind kind of the block
	 * @param name name of the unit or procedure, {@code null} for blocks
	 * @param line source line of the opening statement
	 * @return the new scope
	 */
	public Scope enter(ScopeKind kind, String name, int line) {
		Scope scope = new Scope(kind, name, line);
		scopes.push(scope);
		LOGGER.debug("line {}: enter {} (depth {})", line, scope, scopes.size());
		return scope;
	}

	/**
	 * Opens a module and registers it for later imports.
	 *
	 * @param name module name
	 * @param line source line of the module statement
	 * @return the new scope, whose {@link Scope#getModule()} is the unit
	 */
	public Scope enterModule(String name, int line) {
		if (modules.containsKey(Symbol.keyOf(name))) {
			throw new TranslationException(line, "Module '" + name + "' is already defined");
		}
		Scope scope = enter(ScopeKind.MODULE, name, line);
		ModuleUnit module = new ModuleUnit(name, scope);
		scope.setModule(module);
		modules.put(Symbol.keyOf(name), module);
		return scope;
	}

	/**
	 * Opens a procedure and registers its signature, in its module when it is
	 * a module procedure.
	 *
	 * @param signature the procedure signature
	 * @param line source line of the procedure statement
	 * @return the new scope
	 */
	public Scope enterProcedure(ProcedureSignature signature, int line) {
		if (signature.getModule() != null) {
			if (signature.getModule().getProcedure(signature.getName()) != null) {
				throw new TranslationException(line, "Procedure '" + signature.getName() + "' is already defined");
			}
			signature.getModule().addProcedure(signature);
		} else {
			if (procedures.containsKey(Symbol.keyOf(signature.getName()))) {
				throw new TranslationException(line, "Procedure '" + signature.getName() + "' is already defined");
			}
			procedures.put(Symbol.keyOf(signature.getName()), signature);
		}
		Scope scope = enter(ScopeKind.PROCEDURE, signature.getName(), line);
		scope.setProcedure(signature);
		return scope;
	}

	/**
	 * Closes the innermost block.
	 *
	 * @param kind kind of the construct being closed
	 * @param line source line of the closing statement
	 * @return the closed scope
	 * @throws TranslationException when no block is open, or when the
	 *         innermost block is of another kind
	 */
	public Scope leave(ScopeKind kind, int line) {
		Scope top = scopes.peek();
		if (top == null) {
			throw new TranslationException(line, "Unbalanced block: end of " + kind.label() + " without a matching opening");
		}
		if (top.getKind() != kind) {
			throw new TranslationException(
					line,
					"Unbalanced block: end of " + kind.label() + " found while " + top + " is open");
		}
		scopes.pop();
		LOGGER.debug("line {}: leave {} (depth {})", line, top, scopes.size());
		return top;
	}

	/**
	 * @return the innermost scope, or {@code null} when the stack is empty
	 */
	public Scope current() {
		return scopes.peek();
	}

	public boolean isEmpty() {
		return scopes.isEmpty();
	}

	public int depth() {
		return scopes.size();
	}

	/**
	 * @param kind a scope kind
	 * @return the innermost scope of that kind, or {@code null}
	 */
	public Scope innermost(ScopeKind kind) {
		for (Scope scope : scopes) {
			if (scope.getKind() == kind) {
				return scope;
			}
		}
		return null;
	}

	/**
	 * @return the innermost program, procedure or module scope, or
	 *         {@code null}
	 */
	public Scope unit() {
		for (Scope scope : scopes) {
			if (scope.getKind() != ScopeKind.LOOP && scope.getKind() != ScopeKind.CONDITIONAL) {
				return scope;
			}
		}
		return null;
	}

	/**
	 * Finds the loop targeted by an <code>exit</code> or <code>cycle</code>
	 * statement, without crossing the enclosing procedure.
	 *
	 * @param label construct name, {@code null} for the innermost loop
	 * @return the loop, or {@code null} when there is none
	 */
	public Scope loop(String label) {
		for (Scope scope : scopes) {
			if (scope.getKind() == ScopeKind.LOOP && (label == null || label.equalsIgnoreCase(scope.getLabel()))) {
				return scope;
			}
			if (scope.getKind() != ScopeKind.LOOP && scope.getKind() != ScopeKind.CONDITIONAL) {
				return null;
			}
		}
		return null;
	}

	/**
	 * Records a possible modification of a variable in every loop that
	 * encloses the current statement, up to the enclosing program unit.
	 *
	 * @param name the modified name
	 */
	public void markModified(String name) {
		for (Scope scope : scopes) {
			if (scope.getKind() == ScopeKind.LOOP) {
				scope.markModified(name);
			} else if (scope.getKind() != ScopeKind.CONDITIONAL) {
				return;
			}
		}
	}

	/**
	 * Declares a symbol in the innermost program unit or procedure.
	 *
	 * @param symbol the symbol
	 * @param line source line of the declaration
	 * @throws TranslationException when the name is already declared in that
	 *         scope, or when no unit is open
	 */
	public void declare(Symbol symbol, int line) {
		Scope unit = unit();
		if (unit == null) {
			throw new TranslationException(line, "Declaration of '" + symbol.getName() + "' outside of any program unit");
		}
		if (unit.getSymbol(symbol.getName()) != null) {
			throw new TranslationException(line, "Duplicate declaration of '" + symbol.getName() + "' in " + unit);
		}
		unit.addSymbol(symbol);
		LOGGER.debug("line {}: declare {}", line, symbol);
	}

	/**
	 * Declares a symbol in the innermost scope, typically the induction
	 * variable of a loop that was not declared by the source.
	 *
	 * @param symbol the symbol
	 * @param line source line of the statement
	 */
	public void declareLocal(Symbol symbol, int line) {
		Scope scope = scopes.peek();
		if (scope == null) {
			throw new TranslationException(line, "Declaration of '" + symbol.getName() + "' outside of any program unit");
		}
		scope.addSymbol(symbol);
		LOGGER.debug("line {}: declare {} in {}", line, symbol, scope);
	}

	/**
	 * Resolves a name, from the innermost scope outwards. In each scope, the
	 * names declared locally hide the names imported from modules.
	 *
	 * @param name the name
	 * @return the nearest symbol of that name, or {@code null} when it is not
	 *         declared
	 */
	public Symbol lookup(String name) {
		for (Scope scope : scopes) {
			Symbol symbol = scope.getSymbol(name);
			if (symbol != null) {
				return symbol;
			}
			for (ModuleImport moduleImport : scope.getImports()) {
				ModuleUnit module = modules.get(Symbol.keyOf(moduleImport.getModuleName()));
				if (module != null && moduleImport.isVisible(name)) {
					symbol = module.getSymbol(name);
					if (symbol != null) {
						return symbol;
					}
				}
			}
		}
		return null;
	}

	/**
	 * Resolves a procedure name: procedures of the enclosing module, then
	 * imported module procedures, then procedures outside of any module.
	 *
	 * @param name the name
	 * @return the signature, or {@code null} when no such procedure is known
	 *         (yet)
	 */
	public ProcedureSignature lookupProcedure(String name) {
		for (Scope scope : scopes) {
			if (scope.getModule() != null) {
				ProcedureSignature signature = scope.getModule().getProcedure(name);
				if (signature != null) {
					return signature;
				}
			}
			for (ModuleImport moduleImport : scope.getImports()) {
				ModuleUnit module = modules.get(Symbol.keyOf(moduleImport.getModuleName()));
				if (module != null && moduleImport.isVisible(name)) {
					ProcedureSignature signature = module.getProcedure(name);
					if (signature != null) {
						return signature;
					}
				}
			}
		}
		return procedures.get(Symbol.keyOf(name));
	}

	/**
	 * @param name a module name
	 * @return the module, or {@code null} when it is not defined in the
	 *         source unit
	 */
	public ModuleUnit module(String name) {
		return modules.get(Symbol.keyOf(name));
	}
}

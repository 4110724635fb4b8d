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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A frame of the {@link ScopeStack}: a program unit, a procedure, a loop or
 * a conditional block, with the symbols and module imports declared in it.
 */
public final class Scope {

	private final ScopeKind kind;
	private final String name;
	private final int line;
	private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
	private final List<ModuleImport> imports = new ArrayList<ModuleImport>();
	private String label;
	private String inductionVariable;
	private ProcedureSignature procedure;
	private ModuleUnit module;
	private boolean containsSeen;
	private final Set<String> modified = new HashSet<String>();

	Scope(ScopeKind kind, String name, int line) {
		this.kind = kind;
		this.name = name;
		this.line = line;
	}

	public ScopeKind getKind() {
		return kind;
	}

	/**
	 * @return the name of the unit or procedure, {@code null} for blocks
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the source line that opened the scope
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @param symbolName a name
	 * @return the symbol declared in this scope, or {@code null}
	 */
	public Symbol getSymbol(String symbolName) {
		return symbols.get(Symbol.keyOf(symbolName));
	}

	/**
	 * @return the symbols declared in this scope, in declaration order
	 */
	public Collection<Symbol> getSymbols() {
		return Collections.unmodifiableCollection(symbols.values());
	}

	void addSymbol(Symbol symbol) {
		symbols.put(symbol.getKey(), symbol);
		symbol.setOwner(this);
	}

	public List<ModuleImport> getImports() {
		return Collections.unmodifiableList(imports);
	}

	public void addImport(ModuleImport moduleImport) {
		imports.add(moduleImport);
	}

	/**
	 * @return the construct name of a labelled loop, or {@code null}
	 */
	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label;
	}

	public String getInductionVariable() {
		return inductionVariable;
	}

	public void setInductionVariable(String inductionVariable) {
		this.inductionVariable = inductionVariable;
	}

	/**
	 * Records that a statement in the body of this LOOP scope may modify a
	 * variable.
	 *
	 * @param variable the modified name
	 */
	public void markModified(String variable) {
		modified.add(Symbol.keyOf(variable));
	}

	/**
	 * @param variable a name
	 * @return whether a statement in the body of this loop may modify it
	 */
	public boolean isModified(String variable) {
		return modified.contains(Symbol.keyOf(variable));
	}

	/**
	 * @return the signature of a PROCEDURE scope, {@code null} otherwise
	 */
	public ProcedureSignature getProcedure() {
		return procedure;
	}

	void setProcedure(ProcedureSignature procedure) {
		this.procedure = procedure;
		procedure.setScope(this);
	}

	/**
	 * @return the unit of a MODULE scope, {@code null} otherwise
	 */
	public ModuleUnit getModule() {
		return module;
	}

	void setModule(ModuleUnit module) {
		this.module = module;
	}

	/**
	 * @return whether the <code>contains</code> statement of this program
	 *         unit was seen
	 */
	public boolean isContainsSeen() {
		return containsSeen;
	}

	public void setContainsSeen(boolean containsSeen) {
		this.containsSeen = containsSeen;
	}

	@Override
	public String toString() {
		return kind.label() + (name == null ? "" : " " + name) + " (line " + line + ")";
	}
}

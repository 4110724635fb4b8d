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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Fortran module, translated to a C++ namespace.
 * <p>
 * The unit outlives its scope on the {@link ScopeStack}: once the module is
 * closed, it remains registered so that later <code>use</code> statements
 * can import its variables and procedures.
 */
public final class ModuleUnit {

	private final String name;
	private final Scope scope;
	private final Map<String, ProcedureSignature> procedures = new LinkedHashMap<String, ProcedureSignature>();

	ModuleUnit(String name, Scope scope) {
		this.name = name;
		this.scope = scope;
	}

	public String getName() {
		return name;
	}

	/**
	 * @param symbolName a name
	 * @return the module variable or constant of that name, or {@code null}
	 */
	public Symbol getSymbol(String symbolName) {
		return scope.getSymbol(symbolName);
	}

	/**
	 * @param procedureName a name
	 * @return the module procedure of that name, or {@code null}
	 */
	public ProcedureSignature getProcedure(String procedureName) {
		return procedures.get(Symbol.keyOf(procedureName));
	}

	void addProcedure(ProcedureSignature procedure) {
		procedures.put(Symbol.keyOf(procedure.getName()), procedure);
	}

	public List<ProcedureSignature> getProcedures() {
		return new ArrayList<ProcedureSignature>(procedures.values());
	}

	/**
	 * @param name a name
	 * @return whether the module defines a variable or procedure of that name
	 */
	public boolean defines(String name) {
		return getSymbol(name) != null || getProcedure(name) != null;
	}
}

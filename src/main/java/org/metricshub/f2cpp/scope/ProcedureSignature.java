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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Signature of a function or subroutine.
 * <p>
 * The signature is registered when the procedure opens, before the
 * declarations of its dummy arguments are seen: the types of the parameters
 * are read from the procedure {@link Scope} when they are needed, which is
 * why the emitted header is resolved lazily.
 */
public final class ProcedureSignature {

	private final String name;
	private final String targetName;
	private final boolean function;
	private final List<String> dummyNames;
	private final String resultName;
	private final ModuleUnit module;
	private final Set<String> assigned = new HashSet<String>();
	private Scope scope;
	private boolean forwardReferenced;

	/**
	 * @param name name of the procedure
	 * @param function whether it is a function (otherwise a subroutine)
	 * @param dummyNames names of the dummy arguments, in order
	 * @param resultName name of the result variable, {@code null} for a
	 *        subroutine
	 * @param module owning module, {@code null} for external or contained
	 *        procedures of a program
	 */
	public ProcedureSignature(String name, boolean function, List<String> dummyNames, String resultName, ModuleUnit module) {
		this.name = name;
		this.targetName = CppKeywords.safeName(name);
		this.function = function;
		this.dummyNames = Collections.unmodifiableList(new ArrayList<String>(dummyNames));
		this.resultName = resultName;
		this.module = module;
	}

	public String getName() {
		return name;
	}

	public String getTargetName() {
		return targetName;
	}

	public boolean isFunction() {
		return function;
	}

	public List<String> getDummyNames() {
		return dummyNames;
	}

	public int getArity() {
		return dummyNames.size();
	}

	public String getResultName() {
		return resultName;
	}

	public ModuleUnit getModule() {
		return module;
	}

	public Scope getScope() {
		return scope;
	}

	void setScope(Scope scope) {
		this.scope = scope;
	}

	/**
	 * @param index position of the dummy argument
	 * @return the declared dummy argument, or {@code null} when it is not
	 *         declared (yet)
	 */
	public Symbol getParameter(int index) {
		return scope == null ? null : scope.getSymbol(dummyNames.get(index));
	}

	/**
	 * @param keyword a keyword used at a call site
	 * @return the position of the dummy argument of that name, or -1
	 */
	public int indexOf(String keyword) {
		for (int i = 0; i < dummyNames.size(); i++) {
			if (dummyNames.get(i).equalsIgnoreCase(keyword)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return the declared result variable, or {@code null}
	 */
	public Symbol getResult() {
		return scope == null || resultName == null ? null : scope.getSymbol(resultName);
	}

	/**
	 * @param dummyName a name
	 * @return whether the name is one of the dummy arguments
	 */
	public boolean isDummy(String dummyName) {
		return indexOf(dummyName) >= 0;
	}

	/**
	 * Records that the body may modify a dummy argument.
	 *
	 * @param dummyName the modified name
	 */
	public void markAssigned(String dummyName) {
		assigned.add(Symbol.keyOf(dummyName));
	}

	/**
	 * A dummy argument is read-only when declared <code>intent(in)</code>, or
	 * when it has no intent and the body never modifies it.
	 *
	 * @param index position of the dummy argument
	 * @return whether the argument can be passed by value or const reference
	 */
	public boolean isReadOnly(int index) {
		Symbol parameter = getParameter(index);
		Intent intent = parameter == null ? Intent.NONE : parameter.getIntent();
		switch (intent) {
		case IN:
			return true;
		case OUT:
		case INOUT:
			return false;
		default:
			return !assigned.contains(Symbol.keyOf(dummyNames.get(index)));
		}
	}

	/**
	 * @return whether a call was translated before the procedure was defined,
	 *         which requires a prototype
	 */
	public boolean isForwardReferenced() {
		return forwardReferenced;
	}

	public void setForwardReferenced(boolean forwardReferenced) {
		this.forwardReferenced = forwardReferenced;
	}

	@Override
	public String toString() {
		return (function ? "function " : "subroutine ") + name + dummyNames;
	}
}

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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A <code>use</code> statement: the imported module and, when the import is
 * restricted with <code>only:</code>, the names made visible.
 */
public final class ModuleImport {

	private final String moduleName;
	private final Set<String> only;

	/**
	 * @param moduleName the imported module
	 * @param only the visible names, {@code null} to import everything
	 */
	public ModuleImport(String moduleName, List<String> only) {
		this.moduleName = moduleName;
		if (only == null) {
			this.only = null;
		} else {
			Set<String> keys = new LinkedHashSet<String>();
			for (String name : only) {
				keys.add(Symbol.keyOf(name));
			}
			this.only = keys;
		}
	}

	public String getModuleName() {
		return moduleName;
	}

	public boolean isRestricted() {
		return only != null;
	}

	/**
	 * @return the lower case names of the <code>only:</code> list, empty when
	 *         the import is not restricted
	 */
	public List<String> getOnly() {
		return only == null ? Collections.<String>emptyList() : new ArrayList<String>(only);
	}

	/**
	 * @param name a name
	 * @return whether the import makes the name visible
	 */
	public boolean isVisible(String name) {
		return only == null || only.contains(Symbol.keyOf(name));
	}
}

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A {@link LogicalStatement} tagged with its {@link StatementKind} and the
 * parts the classifier extracted from it.
 */
public final class Statement {

	private final StatementKind kind;
	private final LogicalStatement source;
	private final List<String> parts;

	public Statement(StatementKind kind, LogicalStatement source, String... parts) {
		this.kind = kind;
		this.source = source;
		this.parts = Collections.unmodifiableList(Arrays.asList(parts.clone()));
	}

	public StatementKind getKind() {
		return kind;
	}

	public LogicalStatement getSource() {
		return source;
	}

	/**
	 * @param index index of the part, as documented in {@link StatementKind}
	 * @return the part, or {@code null} when absent
	 */
	public String part(int index) {
		return index < parts.size() ? parts.get(index) : null;
	}

	public int getLine() {
		return source.getFirstLine();
	}

	public String getText() {
		return source.getText();
	}

	@Override
	public String toString() {
		return kind + " " + parts;
	}
}

package org.metricshub.f2cpp;

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

import java.util.Collections;
import java.util.List;
import org.metricshub.f2cpp.backend.CoverageGap;

/**
 * The C++ text produced from one Fortran source, with the coverage gaps
 * found on the way.
 */
public final class TranslationResult {

	private final String text;
	private final List<CoverageGap> gaps;

	public TranslationResult(String text, List<CoverageGap> gaps) {
		this.text = text;
		this.gaps = Collections.unmodifiableList(gaps);
	}

	/**
	 * @return the C++ translation unit
	 */
	public String getText() {
		return text;
	}

	public List<CoverageGap> getGaps() {
		return gaps;
	}

	/**
	 * @return whether some of the source needs manual review
	 */
	public boolean hasGaps() {
		return !gaps.isEmpty();
	}

	@Override
	public String toString() {
		return text;
	}
}

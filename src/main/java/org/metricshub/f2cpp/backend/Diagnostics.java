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
import java.util.Collections;
import java.util.List;
import org.metricshub.f2cpp.util.F2CppLogger;
import org.slf4j.Logger;

/**
 * Accumulates the coverage gaps of a translation run. Gaps never stop the
 * translation: they are all reported together with the output.
 */
public class Diagnostics {

	private static final Logger LOGGER = F2CppLogger.getLogger(Diagnostics.class);

	private final List<CoverageGap> gaps = new ArrayList<CoverageGap>();

	/**
	 * Records a coverage gap.
	 *
	 * @param line source line
	 * @param message what was not translated
	 * @param source statement text
	 */
	public void gap(int line, String message, String source) {
		CoverageGap gap = new CoverageGap(line, message, source);
		gaps.add(gap);
		LOGGER.warn("line {}: {} [{}]", line, message, source);
	}

	public List<CoverageGap> getGaps() {
		return Collections.unmodifiableList(gaps);
	}

	public boolean isEmpty() {
		return gaps.isEmpty();
	}
}

package org.metricshub.f2cpp.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a translation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the translator programmatically, from within Java code.
 */
public class TranslatorSettings {

	/**
	 * How statements that have no translation rule are written to the
	 * output.
	 */
	public enum GapStyle {
		/** <code>// [f2cpp] untranslated: &lt;source&gt;</code> */
		COMMENT,
		/** <code>&lt;source&gt; // [f2cpp] untranslated</code>, for hand-fixing in place */
		RAW
	}

	/**
	 * Indentation of one nesting level;
	 * two spaces by default.
	 */
	private String indent = "  ";

	/**
	 * How untranslated statements are written;
	 * {@link GapStyle#COMMENT} by default.
	 */
	private GapStyle gapStyle = GapStyle.COMMENT;

	/**
	 * Whether to append the list of coverage gaps to the output;
	 * <code>true</code> by default.
	 */
	private boolean gapSummary = true;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means the command line interface writes the translation to stdout
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("indent = '").append(indent).append('\'').append(newLine);
		desc.append("gapStyle = ").append(gapStyle).append(newLine);
		desc.append("gapSummary = ").append(gapSummary).append(newLine);

		return desc.toString();
	}

	public String getIndent() {
		return indent;
	}

	/**
	 * @param indent indentation of one nesting level, must not be {@code null}
	 */
	public void setIndent(String indent) {
		if (indent == null) {
			throw new IllegalArgumentException("indent must not be null");
		}
		this.indent = indent;
	}

	public GapStyle getGapStyle() {
		return gapStyle;
	}

	public void setGapStyle(GapStyle gapStyle) {
		this.gapStyle = gapStyle;
	}

	public boolean isGapSummary() {
		return gapSummary;
	}

	public void setGapSummary(boolean gapSummary) {
		this.gapSummary = gapSummary;
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to write the translation to (instead of
	 * System.out by default)
	 *
	 * @param pOutputStream OutputStream to use
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}
}

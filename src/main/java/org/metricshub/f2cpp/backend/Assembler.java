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

import java.util.List;

/**
 * Joins the emitted fragments into the final C++ text: the required
 * headers, the prototypes of the procedures called before their
 * definition, then the fragments, indented by their depth.
 * <p>
 * Fragment texts are resolved first, since resolving them is what
 * requires the headers.
 */
public class Assembler {

	private final TranslationContext context;
	private final String indent;

	public Assembler(TranslationContext context) {
		this.context = context;
		this.indent = context.getSettings().getIndent();
	}

	/**
	 * @return the C++ translation unit
	 */
	public String assemble() {
		StringBuilder body = new StringBuilder();
		String prototypes = context.prototypes(null).get();
		if (!prototypes.isEmpty()) {
			body.append(prototypes).append("\n\n");
		}
		for (EmittedFragment fragment : context.getFragments()) {
			render(fragment, body);
		}

		StringBuilder out = new StringBuilder();
		for (String header : context.getHeaders()) {
			out.append("#include <").append(header).append(">\n");
		}
		out.append("using namespace std;\n\n");
		out.append(body);
		if (context.getSettings().isGapSummary() && !context.getDiagnostics().isEmpty()) {
			summary(out);
		}
		return out.toString();
	}

	private void render(EmittedFragment fragment, StringBuilder out) {
		String prefix = indentation(fragment.getDepth());
		if (fragment.isCommentOnly()) {
			out.append(prefix).append("//").append(fragment.getComment()).append('\n');
			return;
		}
		String text = context.resolveArguments(fragment, fragment.getText());
		String trailer = trailer(fragment);
		if (text.isEmpty()) {
			if (!trailer.isEmpty()) {
				out.append(prefix).append(trailer.substring(1)).append('\n');
			}
			return;
		}
		String[] lines = text.split("\n");
		for (int i = 0; i < lines.length; i++) {
			out.append(prefix).append(lines[i]);
			if (i == 0) {
				out.append(trailer);
			}
			out.append('\n');
		}
	}

	/**
	 * @return the source comment and the review notes of a fragment, each
	 *         preceded by a space, or an empty string
	 */
	private static String trailer(EmittedFragment fragment) {
		StringBuilder trailer = new StringBuilder();
		if (fragment.getComment() != null) {
			trailer.append(" //").append(fragment.getComment());
		}
		List<String> notes = fragment.getNotes();
		if (!notes.isEmpty()) {
			trailer.append(" // ").append(StatementEmitter.MARKER).append(" review: ").append(String.join("; ", notes));
		}
		return trailer.toString();
	}

	private String indentation(int depth) {
		StringBuilder prefix = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			prefix.append(indent);
		}
		return prefix.toString();
	}

	private void summary(StringBuilder out) {
		List<CoverageGap> gaps = context.getDiagnostics().getGaps();
		out.append('\n');
		out.append("// ").append(StatementEmitter.MARKER).append(" coverage gaps: ").append(gaps.size()).append('\n');
		for (CoverageGap gap : gaps) {
			out.append("//   ").append(gap).append('\n');
		}
	}
}

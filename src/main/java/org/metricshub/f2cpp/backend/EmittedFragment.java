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
import java.util.function.Supplier;

/**
 * A piece of C++ output, in emission order, with the source statement it
 * comes from.
 * <p>
 * The text is a {@link Supplier} so that it can be resolved at assembly
 * time: a procedure header is emitted before the declarations that give the
 * types of its parameters. The text may span several lines, each of which
 * is indented at the depth of the fragment.
 */
public final class EmittedFragment {

	private final Supplier<String> text;
	private int depth;
	private final int line;
	private String comment;
	private final boolean commentOnly;
	private final List<String> notes = new ArrayList<String>();

	/**
	 * @param text C++ text, resolved at assembly
	 * @param depth nesting depth
	 * @param line source line
	 */
	public EmittedFragment(Supplier<String> text, int depth, int line) {
		this(text, depth, line, null, false);
	}

	private EmittedFragment(Supplier<String> text, int depth, int line, String comment, boolean commentOnly) {
		this.text = text;
		this.depth = depth;
		this.line = line;
		this.comment = comment;
		this.commentOnly = commentOnly;
	}

	/**
	 * Creates the fragment of a whole-line comment.
	 *
	 * @param comment comment text, following the marker
	 * @param depth nesting depth
	 * @param line source line
	 * @return the fragment
	 */
	public static EmittedFragment commentOnly(String comment, int depth, int line) {
		return new EmittedFragment(() -> "", depth, line, comment, true);
	}

	public String getText() {
		return text.get();
	}

	public int getDepth() {
		return depth;
	}

	void shift(int levels) {
		depth += levels;
	}

	public int getLine() {
		return line;
	}

	/**
	 * @return the trailing comment reproduced after the text, or {@code null}
	 */
	public String getComment() {
		return comment;
	}

	void setComment(String comment) {
		this.comment = comment;
	}

	public boolean isCommentOnly() {
		return commentOnly;
	}

	public List<String> getNotes() {
		return Collections.unmodifiableList(notes);
	}

	void addNote(String note) {
		if (!notes.contains(note)) {
			notes.add(note);
		}
	}

	@Override
	public String toString() {
		return line + ": " + (commentOnly ? "//" + comment : getText());
	}
}

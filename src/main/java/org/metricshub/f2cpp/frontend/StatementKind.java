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

/**
 * The category a classified statement belongs to.
 * <p>
 * The comment of each constant lists the parts extracted by the
 * {@link Classifier}, as available through {@link Statement#part(int)}.
 */
public enum StatementKind {
	/** Whole-line comment. No parts. */
	COMMENT,
	/** Type declaration. Parts: type spec with attributes, entity list. */
	DECLARATION,
	/** Assignment. Parts: left-hand side, right-hand side. */
	ASSIGNMENT,
	/** Counted loop. Parts: variable, start, end, step (nullable), label (nullable). */
	LOOP_OPEN,
	/** Conditional or endless loop. Parts: condition (null for endless), label (nullable). */
	LOOP_WHILE_OPEN,
	/** End of a loop. Parts: label (nullable). */
	LOOP_CLOSE,
	/** Block conditional. Parts: condition. */
	IF_OPEN,
	/** Else-if branch. Parts: condition. */
	ELSE_IF,
	/** Else branch. No parts. */
	ELSE,
	/** End of a block conditional. No parts. */
	IF_CLOSE,
	/** One-line conditional. Parts: condition, guarded statement. */
	IF_SINGLE,
	/** Loop exit. Parts: label (nullable). */
	EXIT,
	/** Next loop iteration. Parts: label (nullable). */
	CYCLE,
	/** Function or subroutine. Parts: kind, name, dummy list (nullable), result (nullable), type prefix (nullable). */
	PROCEDURE_OPEN,
	/** End of a procedure, or bare <code>end</code>. Parts: kind (nullable), name (nullable). */
	PROCEDURE_CLOSE,
	/** Module. Parts: name. */
	MODULE_OPEN,
	/** End of a module. Parts: name (nullable). */
	MODULE_CLOSE,
	/** Main program. Parts: name. */
	PROGRAM_OPEN,
	/** End of the main program. Parts: name (nullable). */
	PROGRAM_CLOSE,
	/** Start of the contained procedures. No parts. */
	CONTAINS,
	/** Module import. Parts: module name, only-list (nullable). */
	USE,
	/** Implicit typing rule. Parts: the rule. */
	IMPLICIT,
	/** List output. Parts: format, items (nullable). */
	PRINT,
	/** Output statement. Parts: control list, items (nullable). */
	WRITE,
	/** Input statement. Parts: control list, items (nullable). */
	READ,
	/** Subroutine call. Parts: name, arguments (nullable). */
	CALL,
	/** Return from a procedure. No parts. */
	RETURN,
	/** Program termination. Parts: stop code (nullable), "error" for error stop (nullable). */
	STOP,
	/** Allocation. Parts: allocation list. */
	ALLOCATE,
	/** Deallocation. Parts: object list. */
	DEALLOCATE,
	/** Anything else. No parts. */
	UNRECOGNIZED
}

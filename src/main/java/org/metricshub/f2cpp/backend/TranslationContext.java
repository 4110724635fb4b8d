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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ExpressionParser;
import org.metricshub.f2cpp.frontend.ParserException;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.scope.ConstantFolder;
import org.metricshub.f2cpp.scope.ModuleUnit;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.ScopeKind;
import org.metricshub.f2cpp.scope.ScopeStack;
import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.SymbolTableBuilder;
import org.metricshub.f2cpp.util.TranslatorSettings;

/**
 * State of one translation run, passed explicitly to every emitter: the
 * scope stack and symbol tables, the emitted fragments, the required
 * headers and the diagnostics.
 * <p>
 * The context also tracks the statement being translated, so that the
 * fragments it emits receive its comment and its review notes.
 */
public class TranslationContext {

	/** Delimits the placeholder of a deferred argument. */
	private static final String DEFERRED = "\u0001";

	private final TranslatorSettings settings;
	private final ScopeStack scopes = new ScopeStack();
	private final Set<String> generatedNames = new HashSet<String>();
	private final List<Function<EmittedFragment, String>> deferredArguments = new ArrayList<Function<EmittedFragment, String>>();
	private final SymbolTableBuilder symbolTableBuilder = new SymbolTableBuilder(scopes);
	private final ConstantFolder folder = new ConstantFolder(scopes);
	private final ExpressionParser parser = new ExpressionParser();
	private final Diagnostics diagnostics = new Diagnostics();
	private final TypeMapper types = new TypeMapper(this);
	private final ExpressionTranslator translator = new ExpressionTranslator(this);

	private final SortedSet<String> headers = new TreeSet<String>();
	private final List<EmittedFragment> fragments = new ArrayList<EmittedFragment>();
	private final Map<String, Integer> unresolvedCalls = new LinkedHashMap<String, Integer>();
	private final List<ProcedureSignature> procedures = new ArrayList<ProcedureSignature>();
	private final Map<ProcedureSignature, Supplier<String>> procedureHeaders = new LinkedHashMap<ProcedureSignature, Supplier<String>>();
	private int depth;

	private Statement statement;
	private int statementStart;
	private final List<String> notes = new ArrayList<String>();

	public TranslationContext(TranslatorSettings settings) {
		this.settings = settings;
	}

	public TranslatorSettings getSettings() {
		return settings;
	}

	public ScopeStack getScopes() {
		return scopes;
	}

	public SymbolTableBuilder getSymbolTableBuilder() {
		return symbolTableBuilder;
	}

	public ConstantFolder getFolder() {
		return folder;
	}

	public Diagnostics getDiagnostics() {
		return diagnostics;
	}

	public TypeMapper getTypes() {
		return types;
	}

	public ExpressionTranslator getTranslator() {
		return translator;
	}

	// ---- statements

	/**
	 * Starts the translation of a statement.
	 *
	 * @param current the statement
	 */
	public void beginStatement(Statement current) {
		statement = current;
		statementStart = fragments.size();
		notes.clear();
	}

	/**
	 * Ends the translation of the current statement: its comment and its
	 * review notes go to the first fragment it emitted, or to a
	 * comment line when it emitted nothing.
	 */
	public void endStatement() {
		if (statement == null) {
			return;
		}
		String comment = statement.getSource().getComment();
		if (statementStart < fragments.size()) {
			EmittedFragment first = fragments.get(statementStart);
			if (first.getComment() == null && !first.isCommentOnly()) {
				first.setComment(comment);
			}
			for (String note : notes) {
				first.addNote(note);
			}
		} else if (comment != null || !notes.isEmpty()) {
			EmittedFragment standalone;
			if (comment != null) {
				standalone = EmittedFragment.commentOnly(comment, depth, statement.getLine());
			} else {
				standalone = new EmittedFragment(() -> "", depth, statement.getLine());
			}
			for (String note : notes) {
				standalone.addNote(note);
			}
			fragments.add(standalone);
		}
		statement = null;
		notes.clear();
	}

	public Statement getStatement() {
		return statement;
	}

	/**
	 * @return the line of the current statement, or -1 between statements
	 */
	public int getLine() {
		return statement == null ? -1 : statement.getLine();
	}

	/**
	 * Drops the fragments emitted so far by the current statement, before
	 * it is replaced with an untranslated marker.
	 */
	void discardStatement() {
		while (fragments.size() > statementStart) {
			fragments.remove(fragments.size() - 1);
		}
	}

	/**
	 * Records a caveat of the current statement: it is reported as a
	 * coverage gap, and appended as a review note to the output line.
	 *
	 * @param note the caveat
	 */
	public void review(String note) {
		if (!notes.contains(note)) {
			notes.add(note);
			diagnostics.gap(getLine(), note, statement == null ? "" : statement.getText());
		}
	}

	/**
	 * Attaches a review note to an already emitted fragment.
	 *
	 * @param fragment the fragment
	 * @param note the caveat
	 * @param source source text the caveat is about
	 */
	public void review(EmittedFragment fragment, String note, String source) {
		fragment.addNote(note);
		diagnostics.gap(fragment.getLine(), note, source);
	}

	// ---- output

	/**
	 * @param text a line of C++ code
	 * @return the fragment, at the current depth
	 */
	public EmittedFragment emit(String text) {
		return emit(() -> text);
	}

	/**
	 * @param text C++ code resolved at assembly time
	 * @return the fragment, at the current depth
	 */
	public EmittedFragment emit(Supplier<String> text) {
		EmittedFragment fragment = new EmittedFragment(text, depth, getLine());
		fragments.add(fragment);
		return fragment;
	}

	/**
	 * @param comment text of a whole-line comment
	 */
	public void emitComment(String comment) {
		fragments.add(EmittedFragment.commentOnly(comment, depth, getLine()));
	}

	/**
	 * @return a position in the fragments, for {@link #takeFrom(int)}
	 */
	int mark() {
		return fragments.size();
	}

	/**
	 * Removes and returns the fragments emitted since a mark.
	 */
	List<EmittedFragment> takeFrom(int mark) {
		List<EmittedFragment> taken = new ArrayList<EmittedFragment>(fragments.subList(mark, fragments.size()));
		while (fragments.size() > mark) {
			fragments.remove(fragments.size() - 1);
		}
		return taken;
	}

	void append(EmittedFragment fragment) {
		fragments.add(fragment);
	}

	public List<EmittedFragment> getFragments() {
		return Collections.unmodifiableList(fragments);
	}

	public int getDepth() {
		return depth;
	}

	public void indent() {
		depth++;
	}

	public void outdent() {
		depth--;
	}

	/**
	 * @param header a standard header, without brackets
	 */
	public void require(String header) {
		headers.add(header);
	}

	public SortedSet<String> getHeaders() {
		return Collections.unmodifiableSortedSet(headers);
	}

	// ---- symbols and expressions

	/**
	 * Resolves a name, noting the references to variables of a main program
	 * from its contained procedures, which C++ functions cannot see.
	 *
	 * @param name a name
	 * @return the symbol, or {@code null} when it is not declared
	 */
	public Symbol lookup(String name) {
		Symbol symbol = scopes.lookup(name);
		if (symbol != null && symbol.getOwner() != null && symbol.getOwner().getKind() == ScopeKind.PROGRAM) {
			Scope unit = scopes.unit();
			if (unit != null && unit.getKind() == ScopeKind.PROCEDURE) {
				review("host-associated variable '" + symbol.getName() + "' is not visible in the C++ function");
			}
		}
		return symbol;
	}

	/**
	 * @return the procedure being translated, or {@code null}
	 */
	public ProcedureSignature currentProcedure() {
		Scope procedure = scopes.innermost(ScopeKind.PROCEDURE);
		return procedure == null ? null : procedure.getProcedure();
	}

	/**
	 * Records that the current statement may modify a variable, which
	 * matters when the variable is a dummy argument of the current
	 * procedure, or when it appears in the bounds of an enclosing loop.
	 *
	 * @param name the modified name
	 */
	public void markAssigned(String name) {
		scopes.markModified(name);
		ProcedureSignature procedure = currentProcedure();
		if (procedure != null && procedure.isDummy(name)) {
			procedure.markAssigned(name);
		}
	}

	/**
	 * Picks the name of a variable introduced by the translation, distinct
	 * from the other names picked so far.
	 *
	 * @param base the preferred name
	 * @return {@code base}, or {@code base} followed by a number
	 */
	public String generatedName(String base) {
		String name = base;
		for (int i = 2; !generatedNames.add(name); i++) {
			name = base + i;
		}
		return name;
	}

	/**
	 * @param text Fortran expression text
	 * @return its tree
	 * @throws ParserException when the expression is not supported
	 */
	public Expression parse(String text) {
		return parser.parse(text);
	}

	/**
	 * @param text comma-separated Fortran expressions
	 * @return their trees
	 * @throws ParserException when an expression is not supported
	 */
	public List<Expression> parseArguments(String text) {
		return parser.parseArguments(text);
	}

	/**
	 * @param expression an expression tree
	 * @return its C++ translation
	 */
	public CppCode translate(Expression expression) {
		return translator.translate(expression);
	}

	/**
	 * Translates an expression, falling back to the source text with a
	 * review note when it cannot be translated. Used where the statement
	 * opens a block, which must be emitted to keep the output balanced.
	 *
	 * @param text Fortran expression text
	 * @return the C++ text
	 */
	public String translateOrKeep(String text) {
		try {
			return translate(parse(text)).getText();
		} catch (ParserException | UnsupportedFeatureException e) {
			review("untranslated expression '" + text + "': " + e.getMessage());
			return text;
		}
	}

	// ---- procedures

	/**
	 * Records a call to a name that is neither a known procedure nor an
	 * intrinsic: it may be defined later in the unit.
	 *
	 * @param name the called name
	 */
	public void recordUnresolvedCall(String name) {
		String key = Symbol.keyOf(name);
		if (!unresolvedCalls.containsKey(key)) {
			unresolvedCalls.put(key, Integer.valueOf(getLine()));
		}
	}

	/**
	 * Registers a procedure being defined, with the supplier of its header.
	 *
	 * @param signature the procedure
	 * @param header supplier of <code>type name(parameters)</code>
	 */
	public void defineProcedure(ProcedureSignature signature, Supplier<String> header) {
		if (unresolvedCalls.remove(Symbol.keyOf(signature.getName())) != null) {
			signature.setForwardReferenced(true);
		}
		procedures.add(signature);
		procedureHeaders.put(signature, header);
	}

	/**
	 * Builds the supplier of the prototypes of the procedures called before
	 * being defined.
	 *
	 * @param module the module whose procedures are concerned, {@code null}
	 *        for the procedures outside of any module
	 * @return the prototypes, one per line, resolved at assembly
	 */
	public Supplier<String> prototypes(final ModuleUnit module) {
		return () -> {
			StringBuilder text = new StringBuilder();
			for (ProcedureSignature signature : procedures) {
				if (signature.isForwardReferenced() && signature.getModule() == module) {
					if (text.length() > 0) {
						text.append('\n');
					}
					text.append(procedureHeaders.get(signature).get()).append(';');
				}
			}
			return text.toString();
		};
	}

	/**
	 * Defers the rendering of a fixed-size array passed to a procedure that
	 * is not defined yet: once the whole file is translated, the array is
	 * copied to a <code>vector</code> when the parameter turns out to be a
	 * read-only assumed-shape array.
	 *
	 * @param procedure the called name
	 * @param position position of the argument
	 * @param array the array passed
	 * @return a placeholder, replaced by {@link #resolveArguments}
	 */
	public String deferArgument(String procedure, int position, Symbol array) {
		final String source = statement == null ? "" : statement.getText();
		final String key = Symbol.keyOf(procedure);
		deferredArguments.add(fragment -> {
			String text = array.getTargetName();
			ProcedureSignature signature = definedProcedure(key);
			if (signature == null || position >= signature.getArity()) {
				return text;
			}
			Symbol parameter = signature.getParameter(position);
			if (parameter.isArray() && parameter.getShape().isDynamic()) {
				if (signature.isReadOnly(position) && array.getShape().getRank() == 1) {
					return types.type(parameter) + "(" + text + ".begin(), " + text + ".end())";
				}
				review(fragment, "fixed-size array '" + array.getName() + "' passed to dynamic parameter of '" + signature.getName() + "'", source);
			}
			return text;
		});
		return DEFERRED + (deferredArguments.size() - 1) + DEFERRED;
	}

	/**
	 * @param fragment an emitted fragment
	 * @param text its text
	 * @return the text, with the placeholders of deferred arguments replaced
	 */
	public String resolveArguments(EmittedFragment fragment, String text) {
		if (text.indexOf(DEFERRED) < 0) {
			return text;
		}
		StringBuilder resolved = new StringBuilder();
		int from = 0;
		int start;
		while ((start = text.indexOf(DEFERRED, from)) >= 0) {
			int end = text.indexOf(DEFERRED, start + 1);
			resolved.append(text, from, start);
			int index = Integer.parseInt(text.substring(start + 1, end));
			resolved.append(deferredArguments.get(index).apply(fragment));
			from = end + 1;
		}
		return resolved.append(text.substring(from)).toString();
	}

	private ProcedureSignature definedProcedure(String key) {
		for (ProcedureSignature signature : procedures) {
			if (Symbol.keyOf(signature.getName()).equals(key)) {
				return signature;
			}
		}
		return null;
	}

	/**
	 * @return the names called but never defined, with the line of their
	 *         first call
	 */
	public Map<String, Integer> getUnresolvedCalls() {
		return Collections.unmodifiableMap(unresolvedCalls);
	}
}

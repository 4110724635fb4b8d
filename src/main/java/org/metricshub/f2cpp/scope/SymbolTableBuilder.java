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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ExpressionParser;
import org.metricshub.f2cpp.frontend.SourceText;
import org.metricshub.f2cpp.frontend.ast.Expression;

/**
 * Turns declaration statements into {@link Symbol}s of the current program
 * unit.
 * <p>
 * A declaration is made of a type spec with its attributes, and a list of
 * entities:
 *
 * <pre>
 * real(dp), dimension(3), intent(in) :: a, b(n), c = 1.0
 * </pre>
 *
 * One symbol is created per entity. Either every entity of the statement is
 * declared, or none is: an unsupported type or attribute raises an
 * {@link UnsupportedFeatureException} before anything is declared.
 */
public class SymbolTableBuilder {

	private static final Pattern TYPE = Pattern
			.compile(
					"(integer|real|double\\s*precision|logical|character|complex|type|class)\\s*(\\(.*\\)|\\*\\s*(?:\\d+|\\(\\s*\\*\\s*\\)))?",
					Pattern.CASE_INSENSITIVE);
	private static final Pattern INTENT = Pattern.compile("intent\\s*\\(\\s*(in|out|inout|in\\s+out)\\s*\\)", Pattern.CASE_INSENSITIVE);
	private static final Pattern DIMENSION = Pattern.compile("dimension\\s*\\((.*)\\)", Pattern.CASE_INSENSITIVE);
	private static final Pattern ENTITY = Pattern.compile("([A-Za-z_]\\w*)\\s*(.*)");

	private static final List<String> IGNORED_ATTRIBUTES = Collections
			.unmodifiableList(
					Arrays
							.asList("save", "optional", "target", "public", "private", "value", "volatile", "external", "intrinsic"));

	private final ScopeStack scopes;
	private final ExpressionParser parser = new ExpressionParser();
	private final ConstantFolder folder;

	public SymbolTableBuilder(ScopeStack scopes) {
		this.scopes = scopes;
		this.folder = new ConstantFolder(scopes);
	}

	/**
	 * Declares the entities of a declaration statement in the current unit.
	 *
	 * @param typeSpec type and attributes, as in
	 *        <code>integer, parameter</code>
	 * @param entities comma-separated entities, as in <code>n = 3, v(n)</code>
	 * @param line source line of the declaration
	 * @return the declared symbols, in order
	 * @throws UnsupportedFeatureException when the type, an attribute or an
	 *         entity form has no translation
	 * @throws org.metricshub.f2cpp.TranslationException when a name is
	 *         already declared in the current unit
	 */
	public List<Symbol> declare(String typeSpec, String entities, int line) {
		List<String> specParts = SourceText.splitTopLevel(typeSpec, ',');
		TargetType type = parseType(specParts.get(0));

		boolean constant = false;
		boolean allocatable = false;
		Intent intent = Intent.NONE;
		String dimensionText = null;
		for (String attribute : specParts.subList(1, specParts.size())) {
			String lower = attribute.toLowerCase(Locale.ROOT);
			Matcher m;
			if (lower.equals("parameter")) {
				constant = true;
			} else if (lower.equals("allocatable")) {
				allocatable = true;
			} else if ((m = INTENT.matcher(attribute)).matches()) {
				intent = parseIntent(m.group(1));
			} else if ((m = DIMENSION.matcher(attribute)).matches()) {
				dimensionText = m.group(1);
			} else if (!IGNORED_ATTRIBUTES.contains(lower)) {
				throw new UnsupportedFeatureException("Unsupported attribute: " + attribute);
			}
		}

		Scope unit = scopes.unit();
		ProcedureSignature procedure = unit == null ? null : unit.getProcedure();
		List<Symbol> symbols = new ArrayList<Symbol>();
		for (String entity : SourceText.splitTopLevel(entities, ',')) {
			if (SourceText.indexOfTopLevel(entity, "=>") >= 0) {
				throw new UnsupportedFeatureException("Pointer initialization is not supported: " + entity);
			}
			String initializerText = null;
			int assignment = SourceText.findAssignment(entity);
			String head = entity;
			if (assignment >= 0) {
				initializerText = entity.substring(assignment + 1).trim();
				head = entity.substring(0, assignment).trim();
			}
			Matcher m = ENTITY.matcher(head);
			if (!m.matches()) {
				throw new UnsupportedFeatureException("Unsupported declaration entity: " + entity);
			}
			String name = m.group(1);
			String rest = m.group(2).trim();
			String ownDimensions = null;
			if (rest.startsWith("(")) {
				int close = SourceText.matchingParenthesis(rest, 0);
				if (close < 0) {
					throw new UnsupportedFeatureException("Unbalanced parentheses in: " + entity);
				}
				ownDimensions = rest.substring(1, close);
				rest = rest.substring(close + 1).trim();
			}
			if (!rest.isEmpty() && !rest.startsWith("*")) {
				throw new UnsupportedFeatureException("Unsupported declaration entity: " + entity);
			}

			String dimensions = ownDimensions != null ? ownDimensions : dimensionText;
			Shape shape = Shape.SCALAR;
			if (dimensions != null) {
				List<Dimension> parsed = parseDimensions(dimensions, symbols);
				if (parsed.size() > 2) {
					throw new UnsupportedFeatureException("Arrays of rank " + parsed.size() + " are not supported: " + name);
				}
				shape = allocatable ? Shape.dynamic(parsed) : Shape.of(parsed);
			}

			Symbol symbol = new Symbol(name, type, shape);
			symbol.setConstant(constant);
			symbol.setAllocatable(allocatable);
			symbol.setIntent(intent);
			if (initializerText != null) {
				symbol.setInitializer(parser.parse(initializerText));
			}
			if (procedure != null && procedure.isDummy(name)) {
				symbol.setDummy(true);
			}
			symbols.add(symbol);
		}

		for (Symbol symbol : symbols) {
			scopes.declare(symbol, line);
		}
		return symbols;
	}

	/**
	 * @param typeText type keyword with its kind or length selector
	 * @return the target type
	 * @throws UnsupportedFeatureException for complex and derived types
	 */
	public static TargetType parseType(String typeText) {
		Matcher m = TYPE.matcher(typeText.trim());
		if (!m.matches()) {
			throw new UnsupportedFeatureException("Unsupported type: " + typeText);
		}
		String keyword = m.group(1).toLowerCase(Locale.ROOT);
		if (keyword.startsWith("double")) {
			return TargetType.REAL;
		}
		switch (keyword) {
		case "integer":
			return TargetType.INTEGER;
		case "real":
			return TargetType.REAL;
		case "logical":
			return TargetType.BOOLEAN;
		case "character":
			return TargetType.STRING;
		default:
			throw new UnsupportedFeatureException("Unsupported type: " + typeText);
		}
	}

	private static Intent parseIntent(String text) {
		String intent = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
		switch (intent) {
		case "in":
			return Intent.IN;
		case "out":
			return Intent.OUT;
		default:
			return Intent.INOUT;
		}
	}

	/**
	 * Parses an array specification: explicit bounds (<code>n</code>,
	 * <code>0:n</code>), assumed or deferred shape (<code>:</code>), assumed
	 * size (<code>*</code>).
	 */
	private List<Dimension> parseDimensions(String text, List<Symbol> declared) {
		List<Dimension> dimensions = new ArrayList<Dimension>();
		for (String piece : SourceText.splitTopLevel(text, ',')) {
			List<String> bounds = SourceText.splitTopLevel(piece, ':');
			Expression lower = null;
			Expression upper;
			if (bounds.size() == 1) {
				upper = parseBound(piece);
			} else if (bounds.size() == 2) {
				lower = bounds.get(0).isEmpty() ? null : parseBound(bounds.get(0));
				upper = bounds.get(1).isEmpty() ? null : parseBound(bounds.get(1));
			} else {
				throw new UnsupportedFeatureException("Invalid array bounds: " + piece);
			}
			dimensions.add(new Dimension(lower, upper, folder.fold(lower, declared), folder.fold(upper, declared)));
		}
		return dimensions;
	}

	/**
	 * @return the bound, or {@code null} for the assumed-size marker
	 */
	private Expression parseBound(String text) {
		String bound = text.trim();
		if (bound.equals("*")) {
			return null;
		}
		return parser.parse(bound);
	}
}

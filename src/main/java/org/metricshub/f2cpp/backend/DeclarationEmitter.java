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
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.SourceText;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.scope.CppKeywords;
import org.metricshub.f2cpp.scope.Dimension;
import org.metricshub.f2cpp.scope.ModuleImport;
import org.metricshub.f2cpp.scope.ModuleUnit;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.Symbol;

/**
 * Emits type declarations, <code>use</code> and <code>implicit</code>
 * statements.
 */
class DeclarationEmitter {

	private final TranslationContext context;

	DeclarationEmitter(TranslationContext context) {
		this.context = context;
	}

	/**
	 * One C++ declaration per declared name. Dummy arguments are declared by
	 * the procedure header instead.
	 */
	void declaration(Statement statement) {
		List<Symbol> symbols = context.getSymbolTableBuilder().declare(statement.part(0), statement.part(1), statement.getLine());
		for (Symbol symbol : symbols) {
			if (!symbol.isDummy()) {
				declare(symbol);
			}
		}
	}

	/**
	 * Emits the declaration of a variable or constant.
	 *
	 * @param symbol the declared symbol
	 */
	void declare(Symbol symbol) {
		String type = (symbol.isConstant() ? "const " : "") + context.getTypes().type(symbol);
		String name = symbol.getTargetName();
		Expression initializer = symbol.getInitializer();

		if (initializer == null) {
			List<Dimension> dimensions = symbol.getShape().getDimensions();
			if (symbol.getShape().isDynamic() && !symbol.isAllocatable() && hasUpperBounds(dimensions)) {
				// automatic array: sized at construction
				if (dimensions.size() == 1) {
					context.emit(type + " " + name + "(" + extent(dimensions.get(0)) + ");");
				} else {
					context.emit(
							type + " " + name + "(" + extent(dimensions.get(0)) + ", " + context.getTypes().row(symbol) + "("
									+ extent(dimensions.get(1)) + "));");
				}
				return;
			}
			context.emit(type + " " + name + ";");
			return;
		}

		CppCode value = context.translate(initializer);
		if (!symbol.isArray()) {
			if (value.isWholeArray()) {
				throw new UnsupportedFeatureException("Array initializer for scalar '" + symbol.getName() + "'");
			}
			context.emit(type + " " + name + " = " + value.getText() + ";");
			return;
		}
		if (symbol.getShape().getRank() != 1 || value.isWholeArray()) {
			throw new UnsupportedFeatureException("Unsupported initializer for array '" + symbol.getName() + "'");
		}
		Dimension dimension = symbol.getShape().getDimensions().get(0);
		if (initializer instanceof ArrayConstructor) {
			int count = ((ArrayConstructor) initializer).getItems().size();
			if (dimension.getExtent() != null && dimension.getExtent().longValue() != count) {
				context.review("array constructor of " + count + " items for '" + symbol.getName() + "' of size " + dimension.getExtent());
			}
			context.emit(type + " " + name + " = " + value.getText() + ";");
		} else if (symbol.getShape().isFixed()) {
			// a scalar initializes every element
			List<String> items = new ArrayList<String>(Collections.nCopies(dimension.getExtent().intValue(), value.getText()));
			context.emit(type + " " + name + " = {" + String.join(", ", items) + "};");
		} else if (dimension.getUpper() != null) {
			context.emit(type + " " + name + "(" + extent(dimension) + ", " + value.getText() + ");");
		} else {
			throw new UnsupportedFeatureException("Unsupported initializer for array '" + symbol.getName() + "'");
		}
	}

	private static boolean hasUpperBounds(List<Dimension> dimensions) {
		for (Dimension dimension : dimensions) {
			if (dimension.getUpper() == null) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the number of elements of a dimension, as a C++ expression
	 */
	String extent(Dimension dimension) {
		if (dimension.getExtent() != null) {
			return String.valueOf(dimension.getExtent());
		}
		CppCode upper = context.translate(dimension.getUpper());
		Long lower = dimension.getLowerValue();
		if (lower != null && lower.longValue() == 1) {
			return upper.getText();
		}
		if (lower != null) {
			long offset = 1 - lower.longValue();
			return upper.operand(CppCode.ADDITIVE) + (offset >= 0 ? " + " + offset : " - " + (-offset));
		}
		return upper.operand(CppCode.ADDITIVE) + " - " + context.translate(dimension.getLower()).operand(CppCode.ADDITIVE + 1) + " + 1";
	}

	/**
	 * <code>use m</code> brings the whole namespace into scope,
	 * <code>use m, only: a, b</code> one using declaration per name.
	 */
	void use(Statement statement) {
		String moduleName = statement.part(0);
		ModuleUnit module = context.getScopes().module(moduleName);
		if (module == null) {
			throw new UnsupportedFeatureException("Unknown module '" + moduleName + "'");
		}
		String namespace = CppKeywords.safeName(module.getName());
		Scope unit = context.getScopes().unit();
		if (statement.part(1) == null) {
			unit.addImport(new ModuleImport(moduleName, null));
			context.emit("using namespace " + namespace + ";");
			return;
		}

		List<String> names = SourceText.splitTopLevel(statement.part(1), ',');
		for (String name : names) {
			if (name.contains("=>")) {
				throw new UnsupportedFeatureException("Renamed imports are not supported: " + name);
			}
		}
		unit.addImport(new ModuleImport(moduleName, names));
		for (String name : names) {
			Symbol symbol = module.getSymbol(name);
			ProcedureSignature procedure = module.getProcedure(name);
			String target;
			if (symbol != null) {
				target = symbol.getTargetName();
			} else if (procedure != null) {
				target = procedure.getTargetName();
			} else {
				context.review("'" + name + "' is not defined in module '" + module.getName() + "'");
				target = CppKeywords.safeName(name);
			}
			context.emit("using " + namespace + "::" + target + ";");
		}
	}

	/**
	 * <code>implicit none</code> emits nothing; other implicit typing rules
	 * are not supported.
	 */
	void implicit(Statement statement) {
		if (!"none".equalsIgnoreCase(statement.part(0).trim())) {
			throw new UnsupportedFeatureException("Implicit typing rules are not supported");
		}
	}
}

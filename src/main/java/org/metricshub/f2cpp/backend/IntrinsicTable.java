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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.KeywordArgument;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * Maps Fortran intrinsic procedures to C++ standard library equivalents.
 * <p>
 * Known intrinsics that have no mapping are coverage gaps. Names that are
 * not Fortran intrinsics are not handled here: they pass through unchanged.
 */
class IntrinsicTable {

	/** Elemental math functions with the same name in <code>&lt;cmath&gt;</code>. */
	private static final Set<String> MATH = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"sqrt",
											"abs",
											"exp",
											"log",
											"log10",
											"sin",
											"cos",
											"tan",
											"asin",
											"acos",
											"atan",
											"atan2",
											"sinh",
											"cosh",
											"tanh")));

	private static final Set<String> MAPPED = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"size",
											"floor",
											"ceiling",
											"min",
											"max",
											"mod",
											"dble",
											"real",
											"float",
											"int",
											"nint",
											"sum",
											"product",
											"maxval",
											"minval",
											"dot_product",
											"allocated",
											"len",
											"len_trim",
											"trim")));

	private static final Set<String> UNSUPPORTED = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"matmul",
											"transpose",
											"reshape",
											"modulo",
											"sign",
											"any",
											"all",
											"count",
											"pack",
											"unpack",
											"spread",
											"merge",
											"present",
											"associated",
											"cshift",
											"eoshift",
											"maxloc",
											"minloc",
											"lbound",
											"ubound",
											"shape",
											"huge",
											"tiny",
											"epsilon",
											"adjustl",
											"adjustr",
											"index",
											"scan",
											"verify",
											"repeat",
											"achar",
											"iachar",
											"char",
											"ichar",
											"cmplx",
											"aimag",
											"conjg",
											"kind",
											"selected_real_kind",
											"selected_int_kind",
											"random_number",
											"random_seed",
											"cpu_time",
											"date_and_time",
											"system_clock",
											"move_alloc")));

	private final TranslationContext context;
	private final ExpressionTranslator translator;

	IntrinsicTable(TranslationContext context, ExpressionTranslator translator) {
		this.context = context;
		this.translator = translator;
	}

	/**
	 * @param name a procedure name
	 * @return whether it is a Fortran intrinsic that has no translation
	 */
	static boolean isUnsupported(String name) {
		return UNSUPPORTED.contains(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * @param name a procedure name
	 * @return whether it is an intrinsic with a translation
	 */
	static boolean isMapped(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		return MATH.contains(key) || MAPPED.contains(key);
	}

	/**
	 * Translates a reference to an intrinsic function.
	 *
	 * @param name the function name
	 * @param arguments the actual arguments
	 * @return the translation, or {@code null} when the name is not a mapped
	 *         intrinsic
	 * @throws UnsupportedFeatureException when the name is an intrinsic with
	 *         no translation, or when its arguments are not supported
	 */
	CppCode translate(String name, List<Expression> arguments) {
		String key = name.toLowerCase(Locale.ROOT);
		if (UNSUPPORTED.contains(key)) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' has no translation");
		}
		if (MATH.contains(key)) {
			return math(key, arguments);
		}
		if (!MAPPED.contains(key)) {
			return null;
		}
		switch (key) {
		case "size":
			return size(name, arguments);
		case "floor":
		case "ceiling":
			context.require("cmath");
			return new CppCode(
					"static_cast<int>(" + (key.equals("floor") ? "floor" : "ceil") + "(" + single(name, arguments).getText() + "))",
					CppCode.PRIMARY,
					TargetType.INTEGER);
		case "min":
		case "max":
			return minMax(key, arguments);
		case "mod":
			return mod(name, arguments);
		case "dble":
		case "real":
		case "float":
			return new CppCode("static_cast<double>(" + first(name, arguments).getText() + ")", CppCode.PRIMARY, TargetType.REAL);
		case "int":
			return new CppCode("static_cast<int>(" + first(name, arguments).getText() + ")", CppCode.PRIMARY, TargetType.INTEGER);
		case "nint":
			context.require("cmath");
			return new CppCode("static_cast<int>(round(" + single(name, arguments).getText() + "))", CppCode.PRIMARY, TargetType.INTEGER);
		case "sum":
		case "product":
			return reduction(key, arguments);
		case "maxval":
		case "minval":
			Symbol array = wholeArray(name, arguments);
			context.require("algorithm");
			return new CppCode(
					"*" + (key.equals("maxval") ? "max_element" : "min_element") + "(" + range(array) + ")",
					CppCode.UNARY,
					array.getType());
		case "dot_product":
			return dotProduct(name, arguments);
		case "allocated":
			return new CppCode("!" + wholeArray(name, arguments).getTargetName() + ".empty()", CppCode.UNARY, TargetType.BOOLEAN);
		case "len":
			return count(string(name, arguments) + ".size()");
		case "len_trim":
			// npos + 1 wraps to 0 for an all-blank string
			return count(string(name, arguments) + ".find_last_not_of(' ') + 1");
		default:
			// trim: C++ strings carry no blank padding
			CppCode value = single(name, arguments);
			return new CppCode(value.getText(), value.getPrecedence(), TargetType.STRING);
		}
	}

	private CppCode math(String name, List<Expression> arguments) {
		context.require("cmath");
		List<CppCode> codes = positional(name, arguments);
		if (codes.isEmpty()) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires arguments");
		}
		TargetType type = name.equals("abs") ? codes.get(0).getType() : TargetType.REAL;
		return new CppCode(name + "(" + join(codes) + ")", CppCode.PRIMARY, type);
	}

	private CppCode size(String name, List<Expression> arguments) {
		if (arguments.isEmpty() || arguments.size() > 2) {
			throw new UnsupportedFeatureException("Unsupported form of '" + name + "'");
		}
		Symbol array = arrayArgument(name, arguments.get(0));
		Long dimension = null;
		if (arguments.size() == 2) {
			Expression dim = arguments.get(1);
			if (dim instanceof KeywordArgument) {
				if (!((KeywordArgument) dim).getKeyword().equalsIgnoreCase("dim")) {
					throw new UnsupportedFeatureException("Unsupported argument of '" + name + "': " + dim);
				}
				dim = ((KeywordArgument) dim).getValue();
			}
			dimension = context.getFolder().fold(dim);
			if (dimension == null) {
				throw new UnsupportedFeatureException("Non-constant dimension in '" + name + "'");
			}
		}
		String target = array.getTargetName();
		int rank = array.getShape().getRank();
		if (dimension == null) {
			return count(rank == 1 ? target + ".size()" : target + ".size() * " + target + "[0].size()");
		}
		if (dimension.longValue() == 1 && rank >= 1) {
			return count(target + ".size()");
		}
		if (dimension.longValue() == 2 && rank == 2) {
			return count(target + "[0].size()");
		}
		throw new UnsupportedFeatureException("Invalid dimension " + dimension + " in '" + name + "'");
	}

	/**
	 * Converts an unsigned <code>size_t</code> count to a Fortran default
	 * integer, so that it mixes with signed operands.
	 */
	private static CppCode count(String text) {
		return new CppCode("static_cast<int>(" + text + ")", CppCode.PRIMARY, TargetType.INTEGER);
	}

	private CppCode minMax(String name, List<Expression> arguments) {
		List<CppCode> codes = positional(name, arguments);
		if (codes.size() < 2) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires at least two arguments");
		}
		context.require("algorithm");
		boolean real = false;
		boolean integer = false;
		for (CppCode code : codes) {
			real |= code.getType() == TargetType.REAL;
			integer |= code.getType() == TargetType.INTEGER;
		}
		// std::min and std::max need both arguments of the same type
		String function = real && integer ? name + "<double>" : name;
		TargetType type = real ? TargetType.REAL : integer ? TargetType.INTEGER : null;
		if (codes.size() == 2) {
			return new CppCode(function + "(" + join(codes) + ")", CppCode.PRIMARY, type);
		}
		return new CppCode(function + "({" + join(codes) + "})", CppCode.PRIMARY, type);
	}

	private CppCode mod(String name, List<Expression> arguments) {
		List<CppCode> codes = positional(name, arguments);
		if (codes.size() != 2) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires two arguments");
		}
		CppCode a = codes.get(0);
		CppCode p = codes.get(1);
		if (a.getType() == TargetType.INTEGER && p.getType() == TargetType.INTEGER) {
			return new CppCode(
					a.operand(CppCode.MULTIPLICATIVE) + " % " + p.operand(CppCode.MULTIPLICATIVE + 1),
					CppCode.MULTIPLICATIVE,
					TargetType.INTEGER);
		}
		context.require("cmath");
		return new CppCode("fmod(" + join(codes) + ")", CppCode.PRIMARY, TargetType.REAL);
	}

	private CppCode reduction(String name, List<Expression> arguments) {
		Symbol array = wholeArray(name, arguments);
		if (array.getShape().getRank() != 1) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' is only supported on rank 1 arrays");
		}
		context.require("numeric");
		boolean real = array.getType() == TargetType.REAL;
		if (name.equals("sum")) {
			return new CppCode("accumulate(" + range(array) + ", " + (real ? "0.0" : "0") + ")", CppCode.PRIMARY, array.getType());
		}
		context.require("functional");
		String type = real ? "double" : "int";
		return new CppCode(
				"accumulate(" + range(array) + ", " + (real ? "1.0" : "1") + ", multiplies<" + type + ">())",
				CppCode.PRIMARY,
				array.getType());
	}

	private CppCode dotProduct(String name, List<Expression> arguments) {
		if (arguments.size() != 2) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires two arguments");
		}
		Symbol a = arrayArgument(name, arguments.get(0));
		Symbol b = arrayArgument(name, arguments.get(1));
		context.require("numeric");
		boolean real = a.getType() == TargetType.REAL || b.getType() == TargetType.REAL;
		return new CppCode(
				"inner_product(" + range(a) + ", " + b.getTargetName() + ".begin(), " + (real ? "0.0" : "0") + ")",
				CppCode.PRIMARY,
				real ? TargetType.REAL : TargetType.INTEGER);
	}

	private static String range(Symbol array) {
		return array.getTargetName() + ".begin(), " + array.getTargetName() + ".end()";
	}

	private Symbol wholeArray(String name, List<Expression> arguments) {
		if (arguments.size() != 1) {
			throw new UnsupportedFeatureException("Unsupported arguments of '" + name + "'");
		}
		return arrayArgument(name, arguments.get(0));
	}

	private Symbol arrayArgument(String name, Expression argument) {
		CppCode code = translator.translate(argument);
		if (!code.isWholeArray()) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' is only supported on a whole array: " + argument);
		}
		return code.getArray();
	}

	private CppCode single(String name, List<Expression> arguments) {
		List<CppCode> codes = positional(name, arguments);
		if (codes.size() != 1) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires one argument");
		}
		return codes.get(0);
	}

	/**
	 * @return the first argument, ignoring a kind argument
	 */
	/**
	 * @return the single argument as the object of a member call, string
	 *         literals wrapped in a <code>std::string</code>
	 */
	private String string(String name, List<Expression> arguments) {
		CppCode value = single(name, arguments);
		if (arguments.get(0) instanceof StringLiteral) {
			context.require("string");
			return "string(" + value.getText() + ")";
		}
		return value.operand(CppCode.PRIMARY);
	}

	private CppCode first(String name, List<Expression> arguments) {
		if (arguments.isEmpty()) {
			throw new UnsupportedFeatureException("Intrinsic '" + name + "' requires an argument");
		}
		return positional(name, arguments.subList(0, 1)).get(0);
	}

	private List<CppCode> positional(String name, List<Expression> arguments) {
		List<CppCode> codes = new ArrayList<CppCode>();
		for (Expression argument : arguments) {
			if (argument instanceof KeywordArgument) {
				throw new UnsupportedFeatureException("Keyword arguments of '" + name + "' are not supported");
			}
			CppCode code = translator.translate(argument);
			if (code.isWholeArray()) {
				throw new UnsupportedFeatureException("Elemental use of '" + name + "' on array '" + argument + "' is not supported");
			}
			codes.add(code);
		}
		return codes;
	}

	private static String join(List<CppCode> codes) {
		StringBuilder text = new StringBuilder();
		for (CppCode code : codes) {
			if (text.length() > 0) {
				text.append(", ");
			}
			text.append(code.getText());
		}
		return text.toString();
	}
}

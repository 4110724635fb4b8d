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
import java.util.List;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.BinaryOperation;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.ExpressionVisitor;
import org.metricshub.f2cpp.frontend.ast.IntegerLiteral;
import org.metricshub.f2cpp.frontend.ast.KeywordArgument;
import org.metricshub.f2cpp.frontend.ast.LogicalLiteral;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.frontend.ast.Parenthesized;
import org.metricshub.f2cpp.frontend.ast.Range;
import org.metricshub.f2cpp.frontend.ast.RealLiteral;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.frontend.ast.UnaryOperation;
import org.metricshub.f2cpp.scope.CppKeywords;
import org.metricshub.f2cpp.scope.Dimension;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Symbol;
import org.metricshub.f2cpp.scope.TargetType;

/**
 * Renders an expression tree to C++ in one walk.
 * <p>
 * The same <code>name(args)</code> node is an array element when the name
 * resolves to an array, and a call otherwise. Array subscripts are shifted
 * to the zero origin as they are rendered, so each one is shifted exactly
 * once, including subscripts nested in other subscripts or in intrinsic
 * arguments. Parentheses are added wherever the C++ precedence of an
 * operand requires them.
 */
public class ExpressionTranslator implements ExpressionVisitor<CppCode> {

	private final TranslationContext context;
	private final IntrinsicTable intrinsics;

	ExpressionTranslator(TranslationContext context) {
		this.context = context;
		this.intrinsics = new IntrinsicTable(context, this);
	}

	/**
	 * @param expression an expression tree
	 * @return its C++ translation
	 * @throws UnsupportedFeatureException when the expression uses a construct
	 *         that has no translation
	 */
	public CppCode translate(Expression expression) {
		return expression.accept(this);
	}

	@Override
	public CppCode visitIntegerLiteral(IntegerLiteral literal) {
		return new CppCode(String.valueOf(literal.getValue()), CppCode.PRIMARY, TargetType.INTEGER);
	}

	@Override
	public CppCode visitRealLiteral(RealLiteral literal) {
		return new CppCode(literal.getText(), CppCode.PRIMARY, TargetType.REAL);
	}

	@Override
	public CppCode visitStringLiteral(StringLiteral literal) {
		String escaped = literal.getValue().replace("\\", "\\\\").replace("\"", "\\\"");
		return new CppCode("\"" + escaped + "\"", CppCode.PRIMARY, TargetType.STRING);
	}

	@Override
	public CppCode visitLogicalLiteral(LogicalLiteral literal) {
		return new CppCode(literal.getValue() ? "true" : "false", CppCode.PRIMARY, TargetType.BOOLEAN);
	}

	@Override
	public CppCode visitNameReference(NameReference reference) {
		Symbol symbol = context.lookup(reference.getName());
		if (symbol != null) {
			return new CppCode(symbol.getTargetName(), CppCode.PRIMARY, symbol.getType(), symbol.isArray() ? symbol : null);
		}
		context.review("undeclared identifier '" + reference.getName() + "'");
		return new CppCode(CppKeywords.safeName(reference.getName()), CppCode.PRIMARY, null);
	}

	@Override
	public CppCode visitApplication(Application application) {
		String name = application.getName();
		Symbol symbol = context.lookup(name);
		if (symbol != null && symbol.isArray()) {
			return element(symbol, application.getArguments());
		}
		ProcedureSignature procedure = context.getScopes().lookupProcedure(name);
		if (procedure != null) {
			Symbol result = procedure.getResult();
			return new CppCode(call(procedure, application.getArguments()), CppCode.PRIMARY, result == null ? null : result.getType());
		}
		if (symbol != null) {
			if (symbol.getType() == TargetType.STRING) {
				throw new UnsupportedFeatureException("Substrings are not supported: " + application);
			}
			throw new UnsupportedFeatureException("'" + name + "' is neither an array nor a function");
		}
		CppCode intrinsic = intrinsics.translate(name, application.getArguments());
		if (intrinsic != null) {
			return intrinsic;
		}
		return new CppCode(unresolvedCall(name, application.getArguments(), false), CppCode.PRIMARY, null);
	}

	/**
	 * Renders an array element, each subscript shifted by the lower bound of
	 * its dimension.
	 */
	private CppCode element(Symbol symbol, List<Expression> subscripts) {
		List<Dimension> dimensions = symbol.getShape().getDimensions();
		if (subscripts.size() != dimensions.size()) {
			throw new UnsupportedFeatureException(
					"Array '" + symbol.getName() + "' of rank " + dimensions.size() + " referenced with " + subscripts.size() + " subscript(s)");
		}
		StringBuilder text = new StringBuilder(symbol.getTargetName());
		for (int i = 0; i < subscripts.size(); i++) {
			Expression subscript = subscripts.get(i);
			if (subscript instanceof Range) {
				throw new UnsupportedFeatureException("Array sections are not supported: " + symbol.getName() + "(" + subscript + ")");
			}
			if (subscript instanceof KeywordArgument) {
				throw new UnsupportedFeatureException("Invalid subscript of '" + symbol.getName() + "': " + subscript);
			}
			text.append('[').append(index(subscript, dimensions.get(i))).append(']');
		}
		return new CppCode(text.toString(), CppCode.PRIMARY, symbol.getType());
	}

	/**
	 * Shifts a subscript to the zero origin: <code>e</code> becomes
	 * <code>e - L</code>, <code>(e) - L</code> when <code>e</code> is not
	 * atomic, and integer literals are folded.
	 *
	 * @param subscript the Fortran subscript
	 * @param dimension the dimension it indexes
	 * @return the C++ index
	 */
	String index(Expression subscript, Dimension dimension) {
		Long lower = dimension.getLowerValue();
		if (lower != null && subscript instanceof IntegerLiteral) {
			return String.valueOf(((IntegerLiteral) subscript).getValue() - lower.longValue());
		}
		CppCode code = translate(subscript);
		if (code.isWholeArray()) {
			throw new UnsupportedFeatureException("Vector subscripts are not supported: " + subscript);
		}
		if (lower != null && lower.longValue() == 0) {
			return code.getText();
		}
		String base = code.operand(CppCode.PRIMARY);
		if (lower == null) {
			return base + " - " + translate(dimension.getLower()).operand(CppCode.ADDITIVE + 1);
		}
		if (lower.longValue() < 0) {
			return base + " + " + (-lower.longValue());
		}
		return base + " - " + lower;
	}

	/**
	 * Renders a call to a known procedure. Keyword arguments are placed by
	 * the dummy argument names; a fixed-size array passed to a read-only
	 * dynamically sized parameter is converted to a vector.
	 *
	 * @param procedure the called procedure
	 * @param arguments the actual arguments
	 * @return <code>name(arguments)</code>
	 */
	String call(ProcedureSignature procedure, List<Expression> arguments) {
		Expression[] ordered = new Expression[Math.max(procedure.getArity(), arguments.size())];
		int position = 0;
		for (Expression argument : arguments) {
			if (argument instanceof KeywordArgument) {
				KeywordArgument keyword = (KeywordArgument) argument;
				int index = procedure.indexOf(keyword.getKeyword());
				if (index < 0) {
					throw new UnsupportedFeatureException("'" + procedure.getName() + "' has no argument '" + keyword.getKeyword() + "'");
				}
				ordered[index] = keyword.getValue();
			} else {
				ordered[position++] = argument;
			}
		}

		List<String> texts = new ArrayList<String>();
		for (int i = 0; i < ordered.length; i++) {
			if (ordered[i] == null) {
				throw new UnsupportedFeatureException("Omitted optional arguments are not supported in call to '" + procedure.getName() + "'");
			}
			CppCode code = translate(ordered[i]);
			Symbol parameter = i < procedure.getArity() ? procedure.getParameter(i) : null;
			boolean readOnly = i < procedure.getArity() && procedure.isReadOnly(i);
			String text = code.getText();
			if (code.isWholeArray() && parameter != null && parameter.isArray()) {
				Symbol array = code.getArray();
				if (parameter.getShape().isDynamic() && array.getShape().isFixed()) {
					if (readOnly && array.getShape().getRank() == 1) {
						text = context.getTypes().type(parameter) + "(" + text + ".begin(), " + text + ".end())";
					} else {
						context.review("fixed-size array '" + array.getName() + "' passed to dynamic parameter of '" + procedure.getName() + "'");
					}
				} else if (parameter.getShape().isFixed() && array.getShape().isDynamic()) {
					context.review("dynamic array '" + array.getName() + "' passed to fixed-size parameter of '" + procedure.getName() + "'");
				}
			}
			if (!readOnly) {
				markModified(ordered[i]);
			}
			texts.add(text);
		}
		return procedure.getTargetName() + "(" + String.join(", ", texts) + ")";
	}

	/**
	 * Renders a call to a name that is not known yet: a procedure defined
	 * later in the unit, or an external procedure.
	 *
	 * @param name the called name
	 * @param arguments the actual arguments
	 * @param subroutine whether the call is a <code>call</code> statement,
	 *        whose arguments may be modified
	 * @return <code>name(arguments)</code>
	 */
	String unresolvedCall(String name, List<Expression> arguments, boolean subroutine) {
		context.recordUnresolvedCall(name);
		List<String> texts = new ArrayList<String>();
		for (Expression argument : arguments) {
			if (argument instanceof KeywordArgument) {
				throw new UnsupportedFeatureException("Keyword arguments in call to unknown procedure '" + name + "'");
			}
			CppCode code = translate(argument);
			if (subroutine) {
				markModified(argument);
			}
			if (code.isWholeArray() && code.getArray().getShape().isFixed()) {
				texts.add(context.deferArgument(name, texts.size(), code.getArray()));
			} else {
				texts.add(code.getText());
			}
		}
		return CppKeywords.safeName(name) + "(" + String.join(", ", texts) + ")";
	}

	private void markModified(Expression argument) {
		if (argument instanceof NameReference) {
			context.markAssigned(((NameReference) argument).getName());
		} else if (argument instanceof Application) {
			context.markAssigned(((Application) argument).getName());
		}
	}

	@Override
	public CppCode visitBinaryOperation(BinaryOperation operation) {
		CppCode left = translate(operation.getLeft());
		CppCode right = translate(operation.getRight());
		if (left.isWholeArray() || right.isWholeArray()) {
			throw new UnsupportedFeatureException("Elemental array expressions are not supported: " + operation);
		}
		switch (operation.getOperator()) {
		case POWER:
			context.require("cmath");
			String power = "pow(" + left.getText() + ", " + right.getText() + ")";
			if (left.getType() == TargetType.INTEGER && right.getType() == TargetType.INTEGER) {
				return new CppCode("static_cast<int>(" + power + ")", CppCode.PRIMARY, TargetType.INTEGER);
			}
			return new CppCode(power, CppCode.PRIMARY, TargetType.REAL);
		case MULTIPLY:
			return binary(left, " * ", right, CppCode.MULTIPLICATIVE, numeric(left, right));
		case DIVIDE:
			return binary(left, " / ", right, CppCode.MULTIPLICATIVE, numeric(left, right));
		case ADD:
			return binary(left, " + ", right, CppCode.ADDITIVE, numeric(left, right));
		case SUBTRACT:
			return binary(left, " - ", right, CppCode.ADDITIVE, numeric(left, right));
		case CONCAT:
			context.require("string");
			if (operation.getLeft() instanceof StringLiteral) {
				left = new CppCode("string(" + left.getText() + ")", CppCode.PRIMARY, TargetType.STRING);
			}
			return binary(left, " + ", right, CppCode.ADDITIVE, TargetType.STRING);
		case EQ:
			return binary(left, " == ", right, CppCode.EQUALITY, TargetType.BOOLEAN);
		case NE:
			return binary(left, " != ", right, CppCode.EQUALITY, TargetType.BOOLEAN);
		case LT:
			return binary(left, " < ", right, CppCode.RELATIONAL, TargetType.BOOLEAN);
		case LE:
			return binary(left, " <= ", right, CppCode.RELATIONAL, TargetType.BOOLEAN);
		case GT:
			return binary(left, " > ", right, CppCode.RELATIONAL, TargetType.BOOLEAN);
		case GE:
			return binary(left, " >= ", right, CppCode.RELATIONAL, TargetType.BOOLEAN);
		case AND:
			return binary(left, " && ", right, CppCode.LOGICAL_AND, TargetType.BOOLEAN);
		case OR:
			return binary(left, " || ", right, CppCode.LOGICAL_OR, TargetType.BOOLEAN);
		case EQV:
			return new CppCode(
					left.operand(CppCode.EQUALITY + 1) + " == " + right.operand(CppCode.EQUALITY + 1),
					CppCode.EQUALITY,
					TargetType.BOOLEAN);
		default:
			return new CppCode(
					left.operand(CppCode.EQUALITY + 1) + " != " + right.operand(CppCode.EQUALITY + 1),
					CppCode.EQUALITY,
					TargetType.BOOLEAN);
		}
	}

	/**
	 * Left-associative binary operator: the right operand is parenthesized
	 * when it binds as loosely as the operator.
	 */
	private static CppCode binary(CppCode left, String operator, CppCode right, int precedence, TargetType type) {
		return new CppCode(left.operand(precedence) + operator + right.operand(precedence + 1), precedence, type);
	}

	private static TargetType numeric(CppCode left, CppCode right) {
		if (left.getType() == TargetType.REAL || right.getType() == TargetType.REAL) {
			return TargetType.REAL;
		}
		if (left.getType() == TargetType.INTEGER && right.getType() == TargetType.INTEGER) {
			return TargetType.INTEGER;
		}
		return null;
	}

	@Override
	public CppCode visitUnaryOperation(UnaryOperation operation) {
		CppCode operand = translate(operation.getOperand());
		if (operand.isWholeArray()) {
			throw new UnsupportedFeatureException("Elemental array expressions are not supported: " + operation);
		}
		switch (operation.getOperator()) {
		case NOT:
			return new CppCode("!" + operand.operand(CppCode.UNARY), CppCode.UNARY, TargetType.BOOLEAN);
		case MINUS:
			// -a * b has the value of -(a * b)
			if (operand.getPrecedence() == CppCode.MULTIPLICATIVE) {
				return new CppCode("-" + operand.getText(), CppCode.MULTIPLICATIVE, operand.getType());
			}
			return new CppCode("-" + operand.operand(CppCode.UNARY), CppCode.UNARY, operand.getType());
		default:
			return operand;
		}
	}

	@Override
	public CppCode visitParenthesized(Parenthesized parenthesized) {
		CppCode inner = translate(parenthesized.getInner());
		if (inner.isWholeArray()) {
			return inner;
		}
		return new CppCode("(" + inner.getText() + ")", CppCode.PRIMARY, inner.getType());
	}

	@Override
	public CppCode visitArrayConstructor(ArrayConstructor constructor) {
		List<String> items = new ArrayList<String>();
		TargetType type = null;
		for (Expression item : constructor.getItems()) {
			CppCode code = translate(item);
			if (code.isWholeArray()) {
				throw new UnsupportedFeatureException("Arrays in array constructors are not supported: " + item);
			}
			if (type == null || code.getType() == TargetType.REAL) {
				type = code.getType();
			}
			items.add(code.getText());
		}
		return new CppCode("{" + String.join(", ", items) + "}", CppCode.PRIMARY, type);
	}

	@Override
	public CppCode visitKeywordArgument(KeywordArgument argument) {
		throw new UnsupportedFeatureException("Unexpected keyword argument: " + argument);
	}

	@Override
	public CppCode visitRange(Range range) {
		throw new UnsupportedFeatureException("Array sections are not supported: " + range);
	}
}

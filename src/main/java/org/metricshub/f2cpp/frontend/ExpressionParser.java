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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.BinaryOperation;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.IntegerLiteral;
import org.metricshub.f2cpp.frontend.ast.KeywordArgument;
import org.metricshub.f2cpp.frontend.ast.LogicalLiteral;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.frontend.ast.Parenthesized;
import org.metricshub.f2cpp.frontend.ast.Range;
import org.metricshub.f2cpp.frontend.ast.RealLiteral;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.frontend.ast.UnaryOperation;

/**
 * Recursive descent parser of Fortran expressions.
 * <p>
 * The grammar follows the Fortran operator precedence, from the loosest to
 * the tightest binding:
 *
 * <pre>
 * equivalence    : or ((.eqv. | .neqv.) or)*
 * or             : and (.or. and)*
 * and            : not (.and. not)*
 * not            : .not. not | relational
 * relational     : concat (relop concat)?
 * concat         : additive (// additive)*
 * additive       : [+|-] multiplicative ((+|-) multiplicative)*
 * multiplicative : power ((*|/) power)*
 * power          : primary (** [+|-] power)?
 * primary        : literal | name [( arguments )] | ( expression ) | constructor
 * </pre>
 *
 * Instances keep the lexer state of the text being parsed and must not be
 * shared between threads.
 */
public class ExpressionParser {

	/** Lexer token values. */
	enum Token {
		EOF,
		INTEGER,
		REAL,
		STRING,
		TRUE,
		FALSE,
		ID,

		PLUS,
		MINUS,
		MULT,
		DIVIDE,
		POW,
		CONCAT,

		EQ,
		NE,
		LT,
		LE,
		GT,
		GE,
		AND,
		OR,
		NOT,
		EQV,
		NEQV,

		OPEN_PAREN,
		CLOSE_PAREN,
		OPEN_BRACKET,
		CLOSE_BRACKET,
		OPEN_CONSTRUCTOR,
		CLOSE_CONSTRUCTOR,
		COMMA,
		COLON,
		EQUALS,
		PERCENT
	}

	private String input;
	private int position;
	private int c;
	private Token token;
	private int tokenStart;
	private final StringBuilder text = new StringBuilder();

	/**
	 * Parses a complete expression.
	 *
	 * @param expression the expression text
	 * @return the expression tree
	 * @throws ParserException when the text is not a supported expression
	 */
	public Expression parse(String expression) {
		start(expression);
		if (token == Token.EOF) {
			throw parserException("Empty expression");
		}
		Expression result = equivalence();
		expect(Token.EOF);
		return result;
	}

	/**
	 * Parses a comma-separated list of arguments, which may hold keyword
	 * arguments and ranges, as found in call argument lists, I/O lists and
	 * dimension specifications.
	 *
	 * @param arguments the text of the list, without the enclosing parentheses
	 * @return the arguments, empty when the text is blank
	 * @throws ParserException when an argument is not a supported expression
	 */
	public List<Expression> parseArguments(String arguments) {
		start(arguments == null ? "" : arguments);
		if (token == Token.EOF) {
			return Collections.emptyList();
		}
		List<Expression> result = new ArrayList<Expression>();
		result.add(argument());
		while (token == Token.COMMA) {
			lexer();
			result.add(argument());
		}
		expect(Token.EOF);
		return result;
	}

	private void start(String expression) {
		input = expression;
		position = 0;
		c = input.isEmpty() ? -1 : input.charAt(0);
		token = null;
		lexer();
	}

	// ---- lexer

	private void read() {
		text.append((char) c);
		position++;
		c = position < input.length() ? input.charAt(position) : -1;
	}

	private int peek(int offset) {
		int index = position + offset;
		return index < input.length() ? input.charAt(index) : -1;
	}

	private void expect(Token expectedToken) {
		if (token != expectedToken) {
			throw parserException("Expecting " + expectedToken.name() + ". Found: " + token.name() + " (" + text + ")");
		}
		if (token != Token.EOF) {
			lexer();
		}
	}

	private Token lexer() {
		while (c == ' ' || c == '\t') {
			read();
		}
		text.setLength(0);
		tokenStart = position;
		if (c < 0) {
			token = Token.EOF;
			return token;
		}
		switch (c) {
		case ',':
			return single(Token.COMMA);
		case ':':
			return single(Token.COLON);
		case '[':
			return single(Token.OPEN_BRACKET);
		case ']':
			return single(Token.CLOSE_BRACKET);
		case ')':
			return single(Token.CLOSE_PAREN);
		case '+':
			return single(Token.PLUS);
		case '-':
			return single(Token.MINUS);
		case '%':
			return single(Token.PERCENT);
		case '(':
			read();
			if (c == '/' && peek(1) != '=') {
				read();
				token = Token.OPEN_CONSTRUCTOR;
				return token;
			}
			token = Token.OPEN_PAREN;
			return token;
		case '*':
			read();
			if (c == '*') {
				read();
				token = Token.POW;
				return token;
			}
			token = Token.MULT;
			return token;
		case '/':
			read();
			if (c == '/') {
				read();
				token = Token.CONCAT;
				return token;
			}
			if (c == '=') {
				read();
				token = Token.NE;
				return token;
			}
			if (c == ')') {
				read();
				token = Token.CLOSE_CONSTRUCTOR;
				return token;
			}
			token = Token.DIVIDE;
			return token;
		case '=':
			read();
			if (c == '=') {
				read();
				token = Token.EQ;
				return token;
			}
			token = Token.EQUALS;
			return token;
		case '<':
			read();
			if (c == '=') {
				read();
				token = Token.LE;
				return token;
			}
			token = Token.LT;
			return token;
		case '>':
			read();
			if (c == '=') {
				read();
				token = Token.GE;
				return token;
			}
			token = Token.GT;
			return token;
		case '\'':
		case '"':
			return string();
		case '.':
			if (Character.isDigit(peek(1))) {
				return number();
			}
			return dotOperator();
		default:
			break;
		}
		if (Character.isDigit(c)) {
			return number();
		}
		if (Character.isLetter(c) || c == '_') {
			while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
				read();
			}
			token = Token.ID;
			return token;
		}
		throw parserException("Invalid character: " + (char) c);
	}

	private Token single(Token value) {
		read();
		token = value;
		return token;
	}

	private Token string() {
		int delimiter = c;
		position++;
		c = position < input.length() ? input.charAt(position) : -1;
		while (true) {
			if (c < 0) {
				throw parserException("Unterminated string: " + text);
			}
			if (c == delimiter) {
				if (peek(1) == delimiter) {
					// doubled delimiter stands for the delimiter itself
					read();
					position++;
					c = position < input.length() ? input.charAt(position) : -1;
					continue;
				}
				position++;
				c = position < input.length() ? input.charAt(position) : -1;
				break;
			}
			read();
		}
		token = Token.STRING;
		return token;
	}

	private Token dotOperator() {
		String word = dotWord(position);
		if (word == null) {
			throw parserException("Invalid operator at: " + input.substring(position));
		}
		Token value = dotToken(word);
		if (value == null) {
			throw parserException("Unknown operator: ." + word + ".");
		}
		for (int i = 0; i < word.length() + 2; i++) {
			read();
		}
		token = value;
		return token;
	}

	/**
	 * @return the letters between the dot at <code>start</code> and the next
	 *         dot, or {@code null} when there is no such word
	 */
	private String dotWord(int start) {
		int end = start + 1;
		while (end < input.length() && Character.isLetter(input.charAt(end))) {
			end++;
		}
		if (end == start + 1 || end >= input.length() || input.charAt(end) != '.') {
			return null;
		}
		return input.substring(start + 1, end).toLowerCase(Locale.ROOT);
	}

	private static Token dotToken(String word) {
		switch (word) {
		case "eq":
			return Token.EQ;
		case "ne":
			return Token.NE;
		case "lt":
			return Token.LT;
		case "le":
			return Token.LE;
		case "gt":
			return Token.GT;
		case "ge":
			return Token.GE;
		case "and":
			return Token.AND;
		case "or":
			return Token.OR;
		case "not":
			return Token.NOT;
		case "eqv":
			return Token.EQV;
		case "neqv":
			return Token.NEQV;
		case "true":
			return Token.TRUE;
		case "false":
			return Token.FALSE;
		default:
			return null;
		}
	}

	/**
	 * Reads an integer or a real literal. The token text is the C++ spelling
	 * of the literal: the kind suffix is dropped, the exponent marker is
	 * <code>e</code> and a zero exponent is removed.
	 */
	private Token number() {
		StringBuilder mantissa = new StringBuilder();
		boolean real = false;
		while (c >= 0 && Character.isDigit(c)) {
			mantissa.append((char) c);
			read();
		}
		// "1.eq.2" is an integer followed by an operator
		if (c == '.' && !(dotWord(position) != null && dotToken(dotWord(position)) != null)) {
			real = true;
			mantissa.append('.');
			read();
			while (c >= 0 && Character.isDigit(c)) {
				mantissa.append((char) c);
				read();
			}
		}
		String exponent = null;
		if ((c == 'e' || c == 'E' || c == 'd' || c == 'D')
				&& (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
			real = true;
			StringBuilder digits = new StringBuilder();
			read();
			if (c == '+' || c == '-') {
				digits.append((char) c);
				read();
			}
			while (c >= 0 && Character.isDigit(c)) {
				digits.append((char) c);
				read();
			}
			exponent = digits.toString();
		}
		if (c == '_') {
			read();
			while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
				read();
			}
		}

		text.setLength(0);
		if (!real) {
			text.append(mantissa);
			token = Token.INTEGER;
			return token;
		}
		if (mantissa.charAt(0) == '.') {
			mantissa.insert(0, '0');
		}
		if (mantissa.charAt(mantissa.length() - 1) == '.') {
			mantissa.append('0');
		}
		boolean zeroExponent = exponent == null || Long.parseLong(exponent.replace("+", "")) == 0;
		if (zeroExponent && mantissa.indexOf(".") < 0) {
			mantissa.append(".0");
		}
		text.append(mantissa);
		if (!zeroExponent) {
			text.append('e').append(exponent.replace("+", ""));
		}
		token = Token.REAL;
		return token;
	}

	// ---- grammar

	private Expression equivalence() {
		Expression left = or();
		while (token == Token.EQV || token == Token.NEQV) {
			BinaryOperation.Operator operator = token == Token.EQV ? BinaryOperation.Operator.EQV : BinaryOperation.Operator.NEQV;
			lexer();
			left = new BinaryOperation(operator, left, or());
		}
		return left;
	}

	private Expression or() {
		Expression left = and();
		while (token == Token.OR) {
			lexer();
			left = new BinaryOperation(BinaryOperation.Operator.OR, left, and());
		}
		return left;
	}

	private Expression and() {
		Expression left = not();
		while (token == Token.AND) {
			lexer();
			left = new BinaryOperation(BinaryOperation.Operator.AND, left, not());
		}
		return left;
	}

	private Expression not() {
		if (token == Token.NOT) {
			lexer();
			return new UnaryOperation(UnaryOperation.Operator.NOT, not());
		}
		return relational();
	}

	private Expression relational() {
		Expression left = concat();
		BinaryOperation.Operator operator = relationalOperator(token);
		if (operator != null) {
			lexer();
			return new BinaryOperation(operator, left, concat());
		}
		return left;
	}

	private static BinaryOperation.Operator relationalOperator(Token value) {
		switch (value) {
		case EQ:
			return BinaryOperation.Operator.EQ;
		case NE:
			return BinaryOperation.Operator.NE;
		case LT:
			return BinaryOperation.Operator.LT;
		case LE:
			return BinaryOperation.Operator.LE;
		case GT:
			return BinaryOperation.Operator.GT;
		case GE:
			return BinaryOperation.Operator.GE;
		default:
			return null;
		}
	}

	private Expression concat() {
		Expression left = additive();
		while (token == Token.CONCAT) {
			lexer();
			left = new BinaryOperation(BinaryOperation.Operator.CONCAT, left, additive());
		}
		return left;
	}

	private Expression additive() {
		Expression left;
		if (token == Token.MINUS || token == Token.PLUS) {
			UnaryOperation.Operator sign = token == Token.MINUS ? UnaryOperation.Operator.MINUS : UnaryOperation.Operator.PLUS;
			lexer();
			left = new UnaryOperation(sign, multiplicative());
		} else {
			left = multiplicative();
		}
		while (token == Token.PLUS || token == Token.MINUS) {
			BinaryOperation.Operator operator = token == Token.PLUS ? BinaryOperation.Operator.ADD : BinaryOperation.Operator.SUBTRACT;
			lexer();
			left = new BinaryOperation(operator, left, multiplicative());
		}
		return left;
	}

	private Expression multiplicative() {
		Expression left = power();
		while (token == Token.MULT || token == Token.DIVIDE) {
			BinaryOperation.Operator operator = token == Token.MULT ? BinaryOperation.Operator.MULTIPLY : BinaryOperation.Operator.DIVIDE;
			lexer();
			left = new BinaryOperation(operator, left, power());
		}
		return left;
	}

	private Expression power() {
		Expression base = primary();
		if (token != Token.POW) {
			return base;
		}
		lexer();
		if (token == Token.MINUS || token == Token.PLUS) {
			UnaryOperation.Operator sign = token == Token.MINUS ? UnaryOperation.Operator.MINUS : UnaryOperation.Operator.PLUS;
			lexer();
			return new BinaryOperation(BinaryOperation.Operator.POWER, base, new UnaryOperation(sign, power()));
		}
		return new BinaryOperation(BinaryOperation.Operator.POWER, base, power());
	}

	private Expression primary() {
		String value = text.toString();
		switch (token) {
		case INTEGER:
			lexer();
			try {
				return new IntegerLiteral(Long.parseLong(value));
			} catch (NumberFormatException e) {
				throw parserException("Integer literal out of range: " + value);
			}
		case REAL:
			lexer();
			return new RealLiteral(value);
		case STRING:
			lexer();
			return new StringLiteral(value);
		case TRUE:
			lexer();
			return new LogicalLiteral(true);
		case FALSE:
			lexer();
			return new LogicalLiteral(false);
		case ID:
			lexer();
			if (token == Token.PERCENT) {
				throw parserException("Derived type components are not supported: " + value + "%");
			}
			if (token != Token.OPEN_PAREN) {
				return new NameReference(value);
			}
			lexer();
			List<Expression> arguments = new ArrayList<Expression>();
			if (token != Token.CLOSE_PAREN) {
				arguments.add(argument());
				while (token == Token.COMMA) {
					lexer();
					arguments.add(argument());
				}
			}
			expect(Token.CLOSE_PAREN);
			if (token == Token.OPEN_PAREN) {
				throw parserException("Substrings are not supported: " + value);
			}
			return new Application(value, arguments);
		case OPEN_PAREN:
			lexer();
			Expression inner = equivalence();
			if (token == Token.COMMA) {
				throw parserException("Complex literals and implied loops are not supported");
			}
			expect(Token.CLOSE_PAREN);
			return new Parenthesized(inner);
		case OPEN_CONSTRUCTOR:
			lexer();
			List<Expression> items = constructorItems(Token.CLOSE_CONSTRUCTOR);
			expect(Token.CLOSE_CONSTRUCTOR);
			return new ArrayConstructor(items);
		case OPEN_BRACKET:
			lexer();
			List<Expression> bracketItems = constructorItems(Token.CLOSE_BRACKET);
			expect(Token.CLOSE_BRACKET);
			return new ArrayConstructor(bracketItems);
		default:
			throw parserException("Unexpected " + token.name() + (value.isEmpty() ? "" : " (" + value + ")"));
		}
	}

	private List<Expression> constructorItems(Token closing) {
		List<Expression> items = new ArrayList<Expression>();
		if (token == closing) {
			return items;
		}
		items.add(equivalence());
		while (token == Token.COMMA) {
			lexer();
			items.add(equivalence());
		}
		return items;
	}

	/**
	 * argument : [name =] expression | [expression] : [expression] [: expression]
	 */
	private Expression argument() {
		if (token == Token.ID) {
			// look ahead for "name =", restoring the lexer state otherwise
			int savedPosition = position;
			int savedC = c;
			int savedStart = tokenStart;
			String keyword = text.toString();
			lexer();
			if (token == Token.EQUALS) {
				lexer();
				return new KeywordArgument(keyword, equivalence());
			}
			position = savedPosition;
			c = savedC;
			tokenStart = savedStart;
			text.setLength(0);
			text.append(keyword);
			token = Token.ID;
		}
		Expression lower = null;
		if (token != Token.COLON) {
			lower = equivalence();
			if (token != Token.COLON) {
				return lower;
			}
		}
		lexer();
		Expression upper = null;
		if (token != Token.COMMA && token != Token.CLOSE_PAREN && token != Token.COLON && token != Token.EOF) {
			upper = equivalence();
		}
		Expression stride = null;
		if (token == Token.COLON) {
			lexer();
			stride = equivalence();
		}
		return new Range(lower, upper, stride);
	}

	private ParserException parserException(String message) {
		return new ParserException(message, input, tokenStart);
	}
}

package org.metricshub.f2cpp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
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
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.frontend.ast.UnaryOperation;

public class ExpressionParserTest {

	private final ExpressionParser parser = new ExpressionParser();

	private static BinaryOperation binary(Expression expression, BinaryOperation.Operator operator) {
		assertTrue(expression + " is not a binary operation", expression instanceof BinaryOperation);
		BinaryOperation operation = (BinaryOperation) expression;
		assertEquals(operator, operation.getOperator());
		return operation;
	}

	private static void assertName(String name, Expression expression) {
		assertTrue(expression + " is not a name", expression instanceof NameReference);
		assertEquals(name, ((NameReference) expression).getName());
	}

	@Test
	public void multiplicationBindsTighterThanAddition() {
		BinaryOperation sum = binary(parser.parse("a + b * c"), BinaryOperation.Operator.ADD);
		assertName("a", sum.getLeft());
		BinaryOperation product = binary(sum.getRight(), BinaryOperation.Operator.MULTIPLY);
		assertName("b", product.getLeft());
		assertName("c", product.getRight());
	}

	@Test
	public void subtractionIsLeftAssociative() {
		BinaryOperation outer = binary(parser.parse("a - b - c"), BinaryOperation.Operator.SUBTRACT);
		assertName("c", outer.getRight());
		binary(outer.getLeft(), BinaryOperation.Operator.SUBTRACT);
	}

	@Test
	public void powerIsRightAssociative() {
		BinaryOperation outer = binary(parser.parse("a ** b ** c"), BinaryOperation.Operator.POWER);
		assertName("a", outer.getLeft());
		binary(outer.getRight(), BinaryOperation.Operator.POWER);
	}

	@Test
	public void unaryMinusAppliesToTheProduct() {
		Expression expression = parser.parse("-a * b");
		assertTrue(expression instanceof UnaryOperation);
		UnaryOperation negation = (UnaryOperation) expression;
		assertEquals(UnaryOperation.Operator.MINUS, negation.getOperator());
		binary(negation.getOperand(), BinaryOperation.Operator.MULTIPLY);
	}

	@Test
	public void signedExponent() {
		BinaryOperation power = binary(parser.parse("x**-2"), BinaryOperation.Operator.POWER);
		assertTrue(power.getRight() instanceof UnaryOperation);
	}

	@Test
	public void logicalOperators() {
		BinaryOperation or = binary(parser.parse("a > 0 .or. .not. b .and. c"), BinaryOperation.Operator.OR);
		binary(or.getLeft(), BinaryOperation.Operator.GT);
		BinaryOperation and = binary(or.getRight(), BinaryOperation.Operator.AND);
		assertTrue(and.getLeft() instanceof UnaryOperation);
		assertName("c", and.getRight());
	}

	@Test
	public void dottedRelationalOperators() {
		binary(parser.parse("i .LE. n"), BinaryOperation.Operator.LE);
		binary(parser.parse("i /= n"), BinaryOperation.Operator.NE);
		binary(parser.parse("a .eqv. .true."), BinaryOperation.Operator.EQV);
	}

	@Test
	public void integerFollowedByDottedOperator() {
		BinaryOperation comparison = binary(parser.parse("1.eq.n"), BinaryOperation.Operator.EQ);
		assertTrue(comparison.getLeft() instanceof IntegerLiteral);
		assertEquals(1, ((IntegerLiteral) comparison.getLeft()).getValue());
	}

	@Test
	public void concatenation() {
		BinaryOperation concat = binary(parser.parse("'ab' // \"it''s\""), BinaryOperation.Operator.CONCAT);
		assertEquals("ab", ((StringLiteral) concat.getLeft()).getValue());
		assertEquals("it''s", ((StringLiteral) concat.getRight()).getValue());
	}

	@Test
	public void doubledQuote() {
		assertEquals("it's", ((StringLiteral) parser.parse("'it''s'")).getValue());
	}

	@Test
	public void applicationAndParentheses() {
		Expression expression = parser.parse("sqrt((x(i) + 1))");
		assertTrue(expression instanceof Application);
		Application sqrt = (Application) expression;
		assertEquals("sqrt", sqrt.getName());
		assertEquals(1, sqrt.getArguments().size());
		assertTrue(sqrt.getArguments().get(0) instanceof Parenthesized);
	}

	@Test
	public void arrayConstructors() {
		Expression slashes = parser.parse("(/ 1, 2, 3 /)");
		assertTrue(slashes instanceof ArrayConstructor);
		assertEquals(3, ((ArrayConstructor) slashes).getItems().size());

		Expression brackets = parser.parse("[1.0, -2.0]");
		assertEquals(2, ((ArrayConstructor) brackets).getItems().size());

		assertEquals(0, ((ArrayConstructor) parser.parse("[]")).getItems().size());
	}

	@Test
	public void logicalLiterals() {
		assertTrue(((LogicalLiteral) parser.parse(".TRUE.")).getValue());
	}

	@Test
	public void argumentsWithKeywordsAndRanges() {
		List<Expression> arguments = parser.parseArguments("x, dim=1, 2:n, :");
		assertEquals(4, arguments.size());
		assertName("x", arguments.get(0));

		KeywordArgument keyword = (KeywordArgument) arguments.get(1);
		assertEquals("dim", keyword.getKeyword());
		assertEquals(1, ((IntegerLiteral) keyword.getValue()).getValue());

		Range bounded = (Range) arguments.get(2);
		assertEquals(2, ((IntegerLiteral) bounded.getLower()).getValue());
		assertName("n", bounded.getUpper());
		assertNull(bounded.getStride());

		Range open = (Range) arguments.get(3);
		assertNull(open.getLower());
		assertNull(open.getUpper());
	}

	@Test
	public void nameFollowedByComparisonIsNotAKeyword() {
		List<Expression> arguments = parser.parseArguments("a == b");
		assertEquals(1, arguments.size());
		binary(arguments.get(0), BinaryOperation.Operator.EQ);
	}

	@Test
	public void blankArgumentList() {
		assertTrue(parser.parseArguments("  ").isEmpty());
		assertTrue(parser.parseArguments(null).isEmpty());
	}

	@Test
	public void unsupportedConstructs() {
		assertThrows(ParserException.class, () -> parser.parse(""));
		assertThrows(ParserException.class, () -> parser.parse("p%x"));
		assertThrows(ParserException.class, () -> parser.parse("name(1:3)(2:2)"));
		assertThrows(ParserException.class, () -> parser.parse("(1.0, 2.0)"));
		assertThrows(ParserException.class, () -> parser.parse("a .xor. b"));
		assertThrows(ParserException.class, () -> parser.parse("'open"));
		assertThrows(ParserException.class, () -> parser.parse("a +"));
		assertThrows(ParserException.class, () -> parser.parse("a b"));
	}

	@Test
	public void errorPosition() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parse("a + ?"));
		assertEquals(4, e.getPosition());
	}
}

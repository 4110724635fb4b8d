package org.metricshub.f2cpp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.util.List;
import org.junit.Test;

public class NormalizerTest {

	private static List<LogicalStatement> normalize(String... lines) throws Exception {
		return new Normalizer().normalize(new StringReader(String.join("\n", lines)));
	}

	@Test
	public void blankLinesAreDropped() throws Exception {
		List<LogicalStatement> statements = normalize("x = 1", "", "   ", "y = 2");
		assertEquals(2, statements.size());
		assertEquals("y = 2", statements.get(1).getText());
		assertEquals(4, statements.get(1).getFirstLine());
	}

	@Test
	public void trailingComment() throws Exception {
		LogicalStatement statement = normalize("  x = 1   ! set x  ").get(0);
		assertEquals("x = 1", statement.getText());
		assertEquals(" set x", statement.getComment());
	}

	@Test
	public void wholeLineComment() throws Exception {
		LogicalStatement statement = normalize("   ! alone").get(0);
		assertTrue(statement.isCommentOnly());
		assertEquals(" alone", statement.getComment());
	}

	@Test
	public void commentMarkerInString() throws Exception {
		LogicalStatement statement = normalize("print *, 'a ! b', \"c ! d\" ! real").get(0);
		assertEquals("print *, 'a ! b', \"c ! d\"", statement.getText());
		assertEquals(" real", statement.getComment());
	}

	@Test
	public void continuationLines() throws Exception {
		List<LogicalStatement> statements = normalize("x = a + &  ! first", "    b + &", "    c ! last", "y = 0");
		assertEquals(2, statements.size());
		LogicalStatement joined = statements.get(0);
		assertEquals("x = a + b + c", joined.getText());
		assertEquals(1, joined.getFirstLine());
		assertEquals(3, joined.getLastLine());
		assertEquals(" first last", joined.getComment());
	}

	@Test
	public void leadingAmpersandJoinsTokens() throws Exception {
		LogicalStatement statement = normalize("call comp&", "    &ute(x)").get(0);
		assertEquals("call compute(x)", statement.getText());
	}

	@Test
	public void commentBetweenContinuationLines() throws Exception {
		List<LogicalStatement> statements = normalize("x = 1 + &", "! inside", "  2");
		assertEquals(1, statements.size());
		assertEquals("x = 1 + 2", statements.get(0).getText());
		assertEquals(" inside", statements.get(0).getComment());
	}

	@Test
	public void semicolonSeparatedStatements() throws Exception {
		List<LogicalStatement> statements = normalize("a = 1; b = ';'; c = 3 ! last");
		assertEquals(3, statements.size());
		assertEquals("b = ';'", statements.get(1).getText());
		assertNull(statements.get(0).getComment());
		assertEquals(" last", statements.get(2).getComment());
		assertEquals(1, statements.get(2).getFirstLine());
	}

	@Test
	public void danglingContinuation() throws Exception {
		List<LogicalStatement> statements = normalize("x = 1 + &");
		assertEquals(1, statements.size());
		assertEquals("x = 1 +", statements.get(0).getText());
	}
}

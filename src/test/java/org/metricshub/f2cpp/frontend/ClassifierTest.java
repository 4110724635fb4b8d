package org.metricshub.f2cpp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class ClassifierTest {

	private final Classifier classifier = new Classifier();

	private Statement classify(String text) {
		return classifier.classify(new LogicalStatement(text, null, 1, 1));
	}

	private void assertKind(StatementKind expected, String text) {
		assertEquals(text, expected, classify(text).getKind());
	}

	@Test
	public void programUnits() {
		assertKind(StatementKind.MODULE_OPEN, "module stats");
		assertKind(StatementKind.MODULE_CLOSE, "end module stats");
		assertKind(StatementKind.PROGRAM_OPEN, "PROGRAM Main");
		assertKind(StatementKind.PROGRAM_CLOSE, "endprogram");
		assertKind(StatementKind.CONTAINS, "contains");
		assertKind(StatementKind.PROCEDURE_CLOSE, "end");
		assertKind(StatementKind.UNRECOGNIZED, "module procedure foo");
	}

	@Test
	public void functionHeader() {
		Statement statement = classify("pure recursive integer function fact(n) result(f)");
		assertEquals(StatementKind.PROCEDURE_OPEN, statement.getKind());
		assertEquals("function", statement.part(0));
		assertEquals("fact", statement.part(1));
		assertEquals("n", statement.part(2));
		assertEquals("f", statement.part(3));
		assertEquals("integer", statement.part(4));
	}

	@Test
	public void subroutineHeaderWithoutArguments() {
		Statement statement = classify("Subroutine report");
		assertEquals(StatementKind.PROCEDURE_OPEN, statement.getKind());
		assertEquals("subroutine", statement.part(0));
		assertNull(statement.part(2));
		assertNull(statement.part(4));
	}

	@Test
	public void endProcedureKeepsItsKind() {
		Statement statement = classify("end function fact");
		assertEquals(StatementKind.PROCEDURE_CLOSE, statement.getKind());
		assertEquals("function", statement.part(0));
		assertEquals("fact", statement.part(1));
	}

	@Test
	public void declarations() {
		Statement statement = classify("real, intent(in) :: x(:), y");
		assertEquals(StatementKind.DECLARATION, statement.getKind());
		assertEquals("real, intent(in)", statement.part(0));
		assertEquals("x(:), y", statement.part(1));

		Statement oldStyle = classify("integer i, j");
		assertEquals(StatementKind.DECLARATION, oldStyle.getKind());
		assertEquals("integer", oldStyle.part(0));
		assertEquals("i, j", oldStyle.part(1));
	}

	@Test
	public void assignments() {
		Statement statement = classify("x(i) = a == b");
		assertEquals(StatementKind.ASSIGNMENT, statement.getKind());
		assertEquals("x(i)", statement.part(0));
		assertEquals("a == b", statement.part(1));
		// a variable named like a keyword
		assertKind(StatementKind.ASSIGNMENT, "print = 3");
		assertKind(StatementKind.ASSIGNMENT, "integer = 1");
	}

	@Test
	public void loops() {
		Statement counted = classify("outer: do i = 1, n, 2");
		assertEquals(StatementKind.LOOP_OPEN, counted.getKind());
		assertEquals("i", counted.part(0));
		assertEquals("1", counted.part(1));
		assertEquals("n", counted.part(2));
		assertEquals("2", counted.part(3));
		assertEquals("outer", counted.part(4));

		Statement whileLoop = classify("do while (x(i) > 0)");
		assertEquals(StatementKind.LOOP_WHILE_OPEN, whileLoop.getKind());
		assertEquals("x(i) > 0", whileLoop.part(0));

		Statement endless = classify("do");
		assertEquals(StatementKind.LOOP_WHILE_OPEN, endless.getKind());
		assertNull(endless.part(0));

		assertKind(StatementKind.LOOP_CLOSE, "enddo");
		assertEquals("outer", classify("end do outer").part(0));
	}

	@Test
	public void conditionals() {
		assertKind(StatementKind.IF_OPEN, "if (a(1) > 0) then");
		assertKind(StatementKind.ELSE_IF, "else if (b) then");
		assertKind(StatementKind.ELSE, "else");
		assertKind(StatementKind.IF_CLOSE, "end if");

		Statement single = classify("if (mod(i, 2) == 0) cycle");
		assertEquals(StatementKind.IF_SINGLE, single.getKind());
		assertEquals("mod(i, 2) == 0", single.part(0));
		assertEquals("cycle", single.part(1));

		// arithmetic if
		assertKind(StatementKind.UNRECOGNIZED, "if (x) 10, 20, 30");
	}

	@Test
	public void controlTransfers() {
		assertKind(StatementKind.EXIT, "exit");
		assertEquals("outer", classify("cycle outer").part(0));
		assertKind(StatementKind.RETURN, "return");
		Statement stop = classify("error stop 'bad input'");
		assertEquals(StatementKind.STOP, stop.getKind());
		assertEquals("'bad input'", stop.part(0));
		assertEquals("error", stop.part(1));
		assertNull(classify("stop").part(0));
	}

	@Test
	public void inputOutput() {
		Statement print = classify("print *, 'x =', x");
		assertEquals(StatementKind.PRINT, print.getKind());
		assertEquals("*", print.part(0));
		assertEquals("'x =', x", print.part(1));

		Statement write = classify("write(*,*) a, b");
		assertEquals(StatementKind.WRITE, write.getKind());
		assertEquals("*,*", write.part(0));
		assertEquals("a, b", write.part(1));

		Statement read = classify("read *, n");
		assertEquals(StatementKind.READ, read.getKind());
		assertEquals("*, *", read.part(0));
		assertEquals("n", read.part(1));

		assertNull(classify("print *").part(1));
	}

	@Test
	public void otherStatements() {
		Statement call = classify("call solve(a, n=3)");
		assertEquals(StatementKind.CALL, call.getKind());
		assertEquals("solve", call.part(0));
		assertEquals("a, n=3", call.part(1));

		Statement use = classify("use stats, only: mean, var");
		assertEquals(StatementKind.USE, use.getKind());
		assertEquals("stats", use.part(0));
		assertEquals("mean, var", use.part(1));

		assertKind(StatementKind.IMPLICIT, "implicit none");
		assertKind(StatementKind.ALLOCATE, "allocate(a(n), b(n, m))");
		assertKind(StatementKind.DEALLOCATE, "deallocate(a)");
		assertKind(StatementKind.UNRECOGNIZED, "goto 10");
		assertKind(StatementKind.UNRECOGNIZED, "format (i5)");
	}

	@Test
	public void commentOnly() {
		Statement statement = classifier.classify(LogicalStatement.commentOnly(" note", 3));
		assertEquals(StatementKind.COMMENT, statement.getKind());
		assertEquals(3, statement.getLine());
	}
}

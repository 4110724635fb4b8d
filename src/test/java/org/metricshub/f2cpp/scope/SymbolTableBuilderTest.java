package org.metricshub.f2cpp.scope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.f2cpp.TranslationException;
import org.metricshub.f2cpp.UnsupportedFeatureException;

public class SymbolTableBuilderTest {

	private ScopeStack scopes;
	private SymbolTableBuilder builder;

	@Before
	public void setUp() {
		scopes = new ScopeStack();
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		builder = new SymbolTableBuilder(scopes);
	}

	@Test
	public void scalars() {
		List<Symbol> symbols = builder.declare("integer", "i, j = 2", 2);
		assertEquals(2, symbols.size());
		assertEquals(TargetType.INTEGER, scopes.lookup("i").getType());
		assertFalse(scopes.lookup("i").isArray());
		assertNull(scopes.lookup("i").getInitializer());
		assertEquals("2", scopes.lookup("j").getInitializer().toString());
	}

	@Test
	public void typeSpellings() {
		assertEquals(TargetType.REAL, SymbolTableBuilder.parseType("real(kind=8)"));
		assertEquals(TargetType.REAL, SymbolTableBuilder.parseType("double precision"));
		assertEquals(TargetType.REAL, SymbolTableBuilder.parseType("real*8"));
		assertEquals(TargetType.BOOLEAN, SymbolTableBuilder.parseType("Logical"));
		assertEquals(TargetType.STRING, SymbolTableBuilder.parseType("character(len=20)"));
		assertEquals(TargetType.STRING, SymbolTableBuilder.parseType("character*10"));
		assertEquals(TargetType.STRING, SymbolTableBuilder.parseType("character(len=*)"));
		assertThrows(UnsupportedFeatureException.class, () -> SymbolTableBuilder.parseType("complex"));
		assertThrows(UnsupportedFeatureException.class, () -> SymbolTableBuilder.parseType("type(point)"));
	}

	@Test
	public void constantsSizeArraysOfTheSameStatement() {
		builder.declare("integer, parameter", "n = 3, vec(n) = [1, 2, 3]", 2);
		Symbol vec = scopes.lookup("vec");
		assertTrue(vec.isConstant());
		assertTrue(vec.getShape().isFixed());
		assertEquals(Long.valueOf(3), vec.getShape().getDimensions().get(0).getExtent());
	}

	@Test
	public void constantsFromEarlierStatements() {
		builder.declare("integer, parameter", "n = 4, m = n * 2 - 1", 2);
		builder.declare("real", "grid(n, m)", 3);
		Shape shape = scopes.lookup("grid").getShape();
		assertTrue(shape.isFixed());
		assertEquals(2, shape.getRank());
		assertEquals(Long.valueOf(7), shape.getDimensions().get(1).getExtent());
	}

	@Test
	public void explicitLowerBound() {
		builder.declare("real, dimension(0:4)", "w, z", 2);
		Dimension dimension = scopes.lookup("z").getShape().getDimensions().get(0);
		assertEquals(Long.valueOf(0), dimension.getLowerValue());
		assertEquals(Long.valueOf(5), dimension.getExtent());
	}

	@Test
	public void entityDimensionsOverrideTheAttribute() {
		builder.declare("integer, dimension(10)", "a, b(2)", 2);
		assertEquals(Long.valueOf(10), scopes.lookup("a").getShape().getDimensions().get(0).getExtent());
		assertEquals(Long.valueOf(2), scopes.lookup("b").getShape().getDimensions().get(0).getExtent());
	}

	@Test
	public void allocatableArraysAreDynamic() {
		builder.declare("real, allocatable", "a(:), b(:,:)", 2);
		assertTrue(scopes.lookup("a").isAllocatable());
		assertTrue(scopes.lookup("a").getShape().isDynamic());
		assertEquals(2, scopes.lookup("b").getShape().getRank());
	}

	@Test
	public void variableBoundsAreDynamic() {
		builder.declare("integer", "n", 2);
		builder.declare("real", "work(n)", 3);
		assertTrue(scopes.lookup("work").getShape().isDynamic());
	}

	@Test
	public void dummyArguments() {
		ProcedureSignature signature = new ProcedureSignature("norm", true, Arrays.asList("x", "n"), "r", null);
		scopes.enterProcedure(signature, 5);
		builder.declare("real, intent(in)", "x(:)", 6);
		builder.declare("integer, intent(in out)", "n", 7);
		builder.declare("real", "r, tmp", 8);

		Symbol x = signature.getParameter(0);
		assertTrue(x.isDummy());
		assertEquals(Intent.IN, x.getIntent());
		assertTrue(x.getShape().isDynamic());
		assertEquals(Intent.INOUT, signature.getParameter(1).getIntent());
		assertFalse(scopes.lookup("tmp").isDummy());
		assertEquals(TargetType.REAL, signature.getResult().getType());
	}

	@Test
	public void ignoredAttributes() {
		builder.declare("integer, save, target", "counter = 0", 2);
		assertEquals(TargetType.INTEGER, scopes.lookup("counter").getType());
	}

	@Test
	public void unsupportedFormsDeclareNothing() {
		assertThrows(UnsupportedFeatureException.class, () -> builder.declare("integer", "a, b(2, 2, 2)", 2));
		assertNull(scopes.lookup("a"));
		assertThrows(UnsupportedFeatureException.class, () -> builder.declare("real, pointer", "p", 3));
		assertThrows(UnsupportedFeatureException.class, () -> builder.declare("real", "p => null()", 4));
		assertThrows(UnsupportedFeatureException.class, () -> builder.declare("complex", "c", 5));
		assertTrue(scopes.current().getSymbols().isEmpty());
	}

	@Test
	public void duplicateInTheSameUnit() {
		builder.declare("integer", "k", 2);
		TranslationException e = assertThrows(TranslationException.class, () -> builder.declare("real", "K", 3));
		assertEquals(3, e.getLineNumber());
	}
}

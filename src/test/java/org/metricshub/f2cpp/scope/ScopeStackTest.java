package org.metricshub.f2cpp.scope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.f2cpp.TranslationException;

public class ScopeStackTest {

	private ScopeStack scopes;

	@Before
	public void setUp() {
		scopes = new ScopeStack();
	}

	private static Symbol integer(String name) {
		return new Symbol(name, TargetType.INTEGER, Shape.SCALAR);
	}

	@Test
	public void lookupIsCaseInsensitive() {
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.declare(integer("Count"), 2);
		Symbol symbol = scopes.lookup("COUNT");
		assertEquals("Count", symbol.getName());
		assertEquals("Count", symbol.getTargetName());
	}

	@Test
	public void innerDeclarationsShadowOuterOnes() {
		Scope program = scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.declare(integer("i"), 2);
		scopes.enter(ScopeKind.LOOP, null, 3);
		Symbol local = new Symbol("i", TargetType.REAL, Shape.SCALAR);
		scopes.declareLocal(local, 3);
		assertSame(local, scopes.lookup("i"));

		scopes.leave(ScopeKind.LOOP, 5);
		assertSame(program, scopes.current());
		assertEquals(TargetType.INTEGER, scopes.lookup("i").getType());
	}

	@Test
	public void declarationsGoToTheEnclosingUnit() {
		Scope program = scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.enter(ScopeKind.CONDITIONAL, null, 2);
		scopes.declare(integer("k"), 3);
		assertSame(program, scopes.unit());
		assertEquals(1, program.getSymbols().size());
	}

	@Test
	public void duplicateDeclaration() {
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.declare(integer("x"), 2);
		TranslationException e = assertThrows(TranslationException.class, () -> scopes.declare(integer("X"), 4));
		assertEquals(4, e.getLineNumber());
	}

	@Test
	public void declarationOutsideOfAnyUnit() {
		assertThrows(TranslationException.class, () -> scopes.declare(integer("x"), 1));
	}

	@Test
	public void unbalancedBlocks() {
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.enter(ScopeKind.LOOP, null, 2);
		TranslationException e = assertThrows(TranslationException.class, () -> scopes.leave(ScopeKind.CONDITIONAL, 3));
		assertTrue(e.getMessage().startsWith("Unbalanced block"));
		assertEquals(2, scopes.depth());

		scopes.leave(ScopeKind.LOOP, 4);
		scopes.leave(ScopeKind.PROGRAM, 5);
		assertTrue(scopes.isEmpty());
		assertThrows(TranslationException.class, () -> scopes.leave(ScopeKind.PROGRAM, 6));
	}

	@Test
	public void loopLabels() {
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		Scope outer = scopes.enter(ScopeKind.LOOP, null, 2);
		outer.setLabel("outer");
		scopes.enter(ScopeKind.CONDITIONAL, null, 3);
		Scope inner = scopes.enter(ScopeKind.LOOP, null, 4);

		assertSame(inner, scopes.loop(null));
		assertSame(outer, scopes.loop("OUTER"));
		assertNull(scopes.loop("missing"));
	}

	@Test
	public void loopsDoNotCrossProcedures() {
		scopes.enter(ScopeKind.PROGRAM, "main", 1);
		scopes.enter(ScopeKind.LOOP, null, 2);
		scopes.enterProcedure(new ProcedureSignature("f", true, Collections.<String>emptyList(), "f", null), 3);
		assertNull(scopes.loop(null));
	}

	@Test
	public void moduleSymbolsThroughImports() {
		scopes.enterModule("consts", 1);
		Symbol n = integer("n");
		n.setConstant(true);
		scopes.declare(n, 2);
		scopes.declare(integer("hidden"), 3);
		scopes.leave(ScopeKind.MODULE, 4);

		Scope program = scopes.enter(ScopeKind.PROGRAM, "main", 5);
		assertNull(scopes.lookup("n"));
		program.addImport(new ModuleImport("Consts", Arrays.asList("N")));
		assertSame(n, scopes.lookup("n"));
		assertNull(scopes.lookup("hidden"));
	}

	@Test
	public void moduleProcedures() {
		Scope module = scopes.enterModule("geometry", 1);
		ProcedureSignature area = new ProcedureSignature("area", true, Arrays.asList("r"), "area", module.getModule());
		scopes.enterProcedure(area, 3);
		scopes.leave(ScopeKind.PROCEDURE, 5);
		scopes.leave(ScopeKind.MODULE, 6);

		Scope program = scopes.enter(ScopeKind.PROGRAM, "main", 7);
		assertNull(scopes.lookupProcedure("area"));
		program.addImport(new ModuleImport("geometry", null));
		assertSame(area, scopes.lookupProcedure("AREA"));
		assertTrue(scopes.module("geometry").defines("area"));
	}

	@Test
	public void redefinitions() {
		scopes.enterModule("m", 1);
		scopes.leave(ScopeKind.MODULE, 2);
		assertThrows(TranslationException.class, () -> scopes.enterModule("M", 3));

		scopes.enterProcedure(new ProcedureSignature("s", false, Collections.<String>emptyList(), null, null), 4);
		scopes.leave(ScopeKind.PROCEDURE, 5);
		assertThrows(
				TranslationException.class,
				() -> scopes.enterProcedure(new ProcedureSignature("s", false, Collections.<String>emptyList(), null, null), 6));
	}

	@Test
	public void readOnlyArguments() {
		ProcedureSignature signature = new ProcedureSignature("s", false, Arrays.asList("a", "b", "c"), null, null);
		scopes.enterProcedure(signature, 1);
		Symbol a = integer("a");
		a.setIntent(Intent.IN);
		Symbol b = integer("b");
		b.setIntent(Intent.OUT);
		scopes.declare(a, 2);
		scopes.declare(b, 2);

		assertTrue(signature.isReadOnly(0));
		assertTrue(!signature.isReadOnly(1));
		// no intent: read-only until assigned
		assertTrue(signature.isReadOnly(2));
		signature.markAssigned("C");
		assertTrue(!signature.isReadOnly(2));
	}
}

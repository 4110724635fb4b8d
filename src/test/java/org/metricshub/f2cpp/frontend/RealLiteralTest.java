package org.metricshub.f2cpp.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.RealLiteral;

/**
 * Spelling of Fortran real literals in C++.
 */
@RunWith(Parameterized.class)
public class RealLiteralTest {

	@Parameters(name = "{0} -> {1}")
	public static Iterable<Object[]> literals() {
		return Arrays
				.asList(
						new Object[][] {
								{ "1.0", "1.0" },
								{ "1d0", "1.0" },
								{ "1.0d0", "1.0" },
								{ "1.D+0", "1.0" },
								{ ".5", "0.5" },
								{ "3.", "3.0" },
								{ "1.5e3", "1.5e3" },
								{ "2.5D-4", "2.5e-4" },
								{ "1e+2", "1e2" },
								{ "1.0_dp", "1.0" },
								{ "0.25_8", "0.25" } });
	}

	@Parameter(0)
	public String fortran;

	@Parameter(1)
	public String cpp;

	@Test
	public void spelling() {
		Expression expression = new ExpressionParser().parse(fortran);
		assertTrue(expression instanceof RealLiteral);
		assertEquals(cpp, ((RealLiteral) expression).getText());
	}
}

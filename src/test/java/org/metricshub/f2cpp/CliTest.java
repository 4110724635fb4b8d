package org.metricshub.f2cpp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.f2cpp.util.TranslatorSettings.GapStyle;

public class CliTest {

	private static String unitOf(String fixture) {
		String path = F2CppTestSupport.fixturePath(fixture);
		return path.substring(0, path.length() - ".f90".length());
	}

	@Test
	public void unitWithoutExtension() throws Exception {
		F2CppTestSupport
				.cliTest("xstats")
				.args(unitOf("xstats.f90"))
				.expectLines("double mean(const vector<double>& x) {", "int main() {")
				.expectExitCode(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void outputFile() throws Exception {
		Path target = Files.createTempFile("f2cpp", ".cpp");
		target.toFile().deleteOnExit();
		F2CppTestSupport
				.cliTest("-o")
				.args("-o", target.toString(), F2CppTestSupport.fixturePath("xfactorial.f90"))
				.readOutputFrom(target)
				.expectLines("int factorial(int n) {", "    if (fac > 100) break;")
				.runAndAssert();
	}

	@Test
	public void gapsDoNotChangeTheExitStatus() throws Exception {
		F2CppTestSupport
				.cliTest("gaps with options")
				.args("--raw-gaps", "--no-summary", "-i", "4", F2CppTestSupport.fixturePath("gaps.f90"))
				.expectLines("    goto 10 // [f2cpp] untranslated")
				.expectNotContains("coverage gaps")
				.expectExitCode(Cli.EXIT_OK)
				.runAndAssert();
	}

	@Test
	public void structuralErrorFails() throws Exception {
		F2CppTestSupport
				.cliTest("unbalanced")
				.args(F2CppTestSupport.fixturePath("unbalanced.f90"))
				.expectError("TranslationException (line 6)")
				.expectExitCode(Cli.EXIT_FAILURE)
				.runAndAssert();
	}

	@Test
	public void missingSourceFails() throws Exception {
		F2CppTestSupport
				.cliTest("missing source")
				.args(new File("no-such-unit").getAbsolutePath())
				.expectError("no-such-unit.f90")
				.expectExitCode(Cli.EXIT_FAILURE)
				.runAndAssert();
	}

	@Test
	public void unknownOption() throws Exception {
		F2CppTestSupport
				.cliTest("unknown option")
				.args("--frobnicate", "unit")
				.expectError("Unknown parameter: --frobnicate")
				.expectExitCode(Cli.EXIT_USAGE)
				.runAndAssert();
	}

	@Test
	public void missingUnit() throws Exception {
		F2CppTestSupport.cliTest("no unit").args("-o", "out.cpp").expectExitCode(Cli.EXIT_USAGE).runAndAssert();
	}

	@Test
	public void usage() throws Exception {
		F2CppTestSupport.cliTest("help").args("-h").expectContains("Usage:", "--raw-gaps").runAndAssert();
	}

	@Test
	public void parseSettings() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-i", "\\t", "--raw-gaps", "--no-summary", "prog.f" });
		assertEquals("\t", cli.getSettings().getIndent());
		assertEquals(GapStyle.RAW, cli.getSettings().getGapStyle());
		assertEquals(false, cli.getSettings().isGapSummary());
		assertEquals("prog.f", cli.getSourcePath());
		assertNull(cli.getOutputFile());
	}

	@Test
	public void resolveUnit() {
		assertEquals("prog.f90", Cli.resolveUnit("prog"));
		assertEquals("dir.v2" + File.separator + "prog.f90", Cli.resolveUnit("dir.v2" + File.separator + "prog"));
		assertEquals("prog.f95", Cli.resolveUnit("prog.f95"));
	}

	@Test
	public void twoUnitsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "a", "b" }));
	}
}

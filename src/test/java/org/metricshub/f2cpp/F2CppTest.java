package org.metricshub.f2cpp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import org.junit.Test;

public class F2CppTest {

	@Test
	public void factorialModuleAndProgram() throws Exception {
		F2CppTestSupport
				.translateTest("xfactorial.f90")
				.fixture("xfactorial.f90")
				.expectLines(
						"#include <array>",
						"#include <cmath>",
						"#include <iostream>",
						"using namespace std;",
						"// demonstrate function, array constructor, and",
						"// looping over array elements",
						"namespace m {",
						"int factorial(int n) {",
						"  int nfac;",
						"  int i;",
						"  nfac = 1;",
						"  for (i = 2; i <= n; i++) {",
						"    nfac = nfac * i;",
						"  }",
						"  return nfac;",
						"}",
						"} // namespace m",
						"int main() {",
						"  using namespace m;",
						"  const int n = 3;",
						"  const array<int, 3> vec = {3, 5, 10};",
						"  int i;",
						"  int fac;",
						"  double xfac;",
						"  for (i = 1; i <= n; i++) {",
						"    fac = factorial(vec[i - 1]);",
						"    xfac = fac;",
						"    cout << vec[i - 1] << \" \" << fac << \" \" << sqrt(xfac) << endl;",
						"    if (fac > 100) break;",
						"  }",
						"  return 0;",
						"}")
				.expectGaps(0)
				.expectNotContains("[f2cpp]")
				.runAndAssert();
	}

	@Test
	public void meanOfFixedArrayIsConvertedToVector() throws Exception {
		F2CppTestSupport
				.translateTest("xstats.f90")
				.fixture("xstats.f90")
				.expectLines(
						"namespace m {",
						"double mean(const vector<double>& x) {",
						"  double xmean;",
						"  double xsum;",
						"  int i;",
						"  int n;",
						"  n = static_cast<int>(x.size());",
						"  xsum = 0.0;",
						"  for (i = 1; i <= n; i++) {",
						"    xsum = xsum + x[i - 1];",
						"  }",
						"  xmean = xsum / n;",
						"  return xmean;",
						"}",
						"} // namespace m",
						"int main() {",
						"  using namespace m;",
						"  array<double, 3> x;",
						"  x = {10.0, 20.0, 90.0};",
						"  cout << mean(vector<double>(x.begin(), x.end())) << endl;",
						"  return 0;",
						"}")
				.expectContains("#include <vector>", "#include <array>")
				.expectGaps(0)
				.runAndAssert();
	}

	@Test
	public void literalSubscriptsAreFolded() throws Exception {
		F2CppTestSupport
				.translateTest("xvec.f90")
				.fixture("xvec.f90")
				.expectLines(
						"  using m::mean;",
						"  const int n = 3;",
						"  array<double, 3> x;",
						"  int i;",
						"  x[0] = 10.0;",
						"  x[1] = 20.0;",
						"  x[2] = 30.0;",
						"  for (i = 1; i <= n; i++) {",
						"    cout << i << \" \" << 10 * x[i - 1] << endl;",
						"  }",
						"  cout << mean(vector<double>(x.begin(), x.end())) << endl;")
				.expectNotContains("using namespace m;")
				.expectGaps(0)
				.runAndAssert();
	}

	@Test
	public void containedProceduresFollowMain() throws Exception {
		TranslationResult result = new F2Cpp().translate(F2CppTestSupport.fixture("contained.f90"));
		String text = result.getText();
		int prototype = text.indexOf("void bounds(const vector<double>& v, double& vmin, double& vmax);");
		int widthPrototype = text.indexOf("double width(double a, double b);");
		int main = text.indexOf("int main() {");
		int definition = text.indexOf("void bounds(const vector<double>& v, double& vmin, double& vmax) {");
		assertTrue(text, prototype >= 0 && widthPrototype >= 0);
		assertTrue(text, prototype < main && widthPrototype < main);
		assertTrue(text, main < definition);
		assertTrue(text, text.contains("  x[i - 1] = i * 2.5; // even steps"));
		assertTrue(text, text.contains("  vmin = *min_element(v.begin(), v.end());"));
		assertTrue(text, text.contains("  double width;\n  width = b - a;\n  return width;\n}"));
		assertTrue(text, text.contains("  cout << \"width:\" << \" \" << width(lo, hi) << endl;"));
		// the fixed-size array passed before the definition is converted once the parameter is known
		assertTrue(text, text.contains("  bounds(vector<double>(x.begin(), x.end()), lo, hi);"));
		assertFalse(text, result.hasGaps());
	}

	@Test
	public void fixedArrayPassedToLaterModifyingProcedure() throws Exception {
		TranslationResult result = new F2Cpp().translate(
				new StringReader(
						"program p\n"
								+ "real :: x(3)\n"
								+ "call bump(x)\n"
								+ "contains\n"
								+ "subroutine bump(v)\n"
								+ "real, intent(inout) :: v(:)\n"
								+ "v(1) = 2.0 * v(1)\n"
								+ "end subroutine bump\n"
								+ "end program p\n"));
		String text = result.getText();
		assertTrue(text, text.contains("  bump(x); // [f2cpp] review: fixed-size array 'x' passed to dynamic parameter of 'bump'"));
		assertEquals(1, result.getGaps().size());
		assertEquals(3, result.getGaps().get(0).getLine());
	}

	@Test
	public void loopsAndConditionals() throws Exception {
		F2CppTestSupport
				.translateTest("loops.f90")
				.fixture("loops.f90")
				.expectLines(
						"  for (i = 10; i >= 1; i -= 2) {",
						"    if (i % 4 == 0) continue;",
						"    total = total + i;",
						"  }",
						"  while (total > 0) {",
						"    total = total - 7;",
						"    if (total < 3) {",
						"      break;",
						"    } else if (total < 10) {",
						"      total = total - 1;",
						"    } else {",
						"      total = total - 2;",
						"    }",
						"  }",
						"  if (total != 0) {",
						"    cerr << \"negative total\" << endl;",
						"    return 0;",
						"  }",
						"  return 0;",
						"}")
				.expectGaps(0)
				.runAndAssert();
	}

	@Test
	public void untranslatedStatementsAreMarkedAndSummarized() throws Exception {
		F2CppTestSupport
				.translateTest("gaps.f90")
				.fixture("gaps.f90")
				.expectLines(
						"  a.fill(1.0);",
						"  // [f2cpp] untranslated: b = matmul(a, a)",
						"  // [f2cpp] untranslated: write(*, '(f8.3)') a(1)",
						"  k = 2;",
						"  // [f2cpp] untranslated: goto 10",
						"  cout << k << endl;",
						"// [f2cpp] coverage gaps: 3")
				.expectGaps(3)
				.runAndAssert();
	}

	@Test
	public void rawGapsKeepTheSourceText() throws Exception {
		F2CppTestSupport
				.translateTest("raw gap style")
				.fixture("gaps.f90")
				.rawGaps()
				.noSummary()
				.expectLines("  goto 10 // [f2cpp] untranslated")
				.expectNotContains("coverage gaps")
				.expectGaps(3)
				.runAndAssert();
	}

	@Test
	public void unbalancedBlockAborts() throws Exception {
		F2CppTestSupport
				.translateTest("unbalanced.f90")
				.fixture("unbalanced.f90")
				.expectThrow(TranslationException.class, "Unbalanced block")
				.runAndAssert();
	}

	@Test
	public void unclosedBlockAtEndOfSource() throws Exception {
		F2CppTestSupport
				.translateTest("unclosed program")
				.source("program p", "integer :: i", "i = 1")
				.expectThrow(TranslationException.class, "Unclosed block")
				.runAndAssert();
	}

	@Test
	public void duplicateDeclarationAborts() throws Exception {
		try {
			new F2Cpp().translate("program p\ninteger :: k\nreal :: k\nend program p\n");
		} catch (TranslationException e) {
			assertEquals(3, e.getLineNumber());
			assertTrue(e.getMessage(), e.getMessage().contains("Duplicate declaration"));
			return;
		}
		throw new AssertionError("duplicate declaration was accepted");
	}

	@Test
	public void statementsWithoutProgramOpenAnImplicitMain() throws Exception {
		F2CppTestSupport
				.translateTest("snippet")
				.source("integer :: k", "k = 4", "print *, k")
				.expect(
						"#include <iostream>",
						"using namespace std;",
						"",
						"int main() {",
						"  int k;",
						"  k = 4;",
						"  cout << k << endl;",
						"  return 0;",
						"}")
				.runAndAssert();
	}

	@Test
	public void commentsKeepTheirPosition() throws Exception {
		F2CppTestSupport
				.translateTest("comments")
				.source(
						"program p ! entry",
						"  ! counter",
						"  integer :: k",
						"  k = 1 ! start; not a separator",
						"  print *, 'done! really' ! report",
						"end program p")
				.expectLines(
						"int main() { // entry",
						"  // counter",
						"  int k;",
						"  k = 1; // start; not a separator",
						"  cout << \"done! really\" << endl; // report")
				.runAndAssert();
	}

	@Test
	public void customIndent() throws Exception {
		F2CppTestSupport
				.translateTest("tab indent")
				.indent("\t")
				.source("program p", "integer :: i", "do i = 1, 2", "print *, i", "end do", "end program p")
				.expectLines("\tfor (i = 1; i <= 2; i++) {", "\t\tcout << i << endl;", "\t}")
				.runAndAssert();
	}

	@Test
	public void loopBoundModifiedInBodyIsSavedOnce() throws Exception {
		F2CppTestSupport
				.translateTest("saved bound")
				.source(
						"program p",
						"  integer :: i, n, cnt",
						"  n = 3",
						"  cnt = 0",
						"  do i = 1, n",
						"    n = n + 1",
						"    cnt = cnt + 1",
						"    if (cnt > 50) exit",
						"  end do",
						"  print *, cnt",
						"end program p")
				.expectLines(
						"  const int i_end = n;",
						"  for (i = 1; i <= i_end; i++) {",
						"    n = n + 1;",
						"  }",
						"  cout << cnt << endl;")
				.runAndAssert();
	}

	@Test
	public void variableStepModifiedInBodyIsSavedOnce() throws Exception {
		F2CppTestSupport
				.translateTest("saved step")
				.source(
						"program p",
						"  integer :: i, j, k, s",
						"  s = 2",
						"  do i = 1, 10, s",
						"    s = s + 1",
						"  end do",
						"  do k = 1, 2",
						"    do j = 1, k",
						"      print *, j",
						"    end do",
						"  end do",
						"end program p")
				.expectLines(
						"  const int i_step = s;",
						"  for (i = 1; (i_step > 0 ? i <= 10 : i >= 10); i += i_step) {",
						"  for (k = 1; k <= 2; k++) {",
						"    for (j = 1; j <= k; j++) {")
				.runAndAssert();
	}

	@Test
	public void translateFromReader() throws Exception {
		TranslationResult result = new F2Cpp().translate(new StringReader("program p\nstop\nend program p\n"));
		assertFalse(result.hasGaps());
		assertTrue(result.getText(), result.getText().contains("  return 0;\n  return 0;\n}"));
	}

	@Test
	public void instanceIsReusable() throws Exception {
		F2Cpp translator = new F2Cpp();
		String first = translator.translate(F2CppTestSupport.fixture("xstats.f90")).getText();
		String second = translator.translate(F2CppTestSupport.fixture("xstats.f90")).getText();
		assertEquals(first, second);
	}
}

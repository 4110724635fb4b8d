package org.metricshub.f2cpp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.f2cpp.util.TranslatorSettings;
import org.metricshub.f2cpp.util.TranslatorSettings.GapStyle;

/**
 * Reusable helpers for building and executing translator tests. The class
 * exposes fluent builders ({@link #translateTest(String)} and
 * {@link #cliTest(String)}) that let tests describe their Fortran source and
 * expectations declaratively before executing or asserting the results.
 */
public final class F2CppTestSupport {

	private F2CppTestSupport() {}

	/**
	 * Creates a builder for a test that exercises the {@link F2Cpp} API
	 * directly.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static TranslateTestBuilder translateTest(String description) {
		return new TranslateTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that exercises the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Reads a Fortran fixture from <code>src/test/resources/fortran</code>.
	 *
	 * @param name file name of the fixture
	 * @return its text
	 */
	public static String fixture(String name) {
		try (InputStream in = F2CppTestSupport.class.getResourceAsStream("/fortran/" + name)) {
			if (in == null) {
				throw new IllegalArgumentException("No such fixture: " + name);
			}
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			int read;
			while ((read = in.read(buffer)) > 0) {
				bytes.write(buffer, 0, read);
			}
			return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * @param name file name of a fixture
	 * @return the path of the fixture on the file system
	 */
	public static String fixturePath(String name) {
		URL resource = F2CppTestSupport.class.getResource("/fortran/" + name);
		if (resource == null) {
			throw new IllegalArgumentException("No such fixture: " + name);
		}
		try {
			return Paths.get(resource.toURI()).toFile().getAbsolutePath();
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Illegal URL " + resource, e);
		}
	}

	/**
	 * Splits an output into lines, ignoring the trailing newline.
	 */
	static List<String> lines(String output) {
		if (output.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = output.replace("\r\n", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	/**
	 * Captures the outcome of a configured test and asserts it against the
	 * expectations of its builder.
	 */
	public static final class TestResult {
		private final BaseTestBuilder<?> builder;
		private final String output;
		private final int gapCount;
		private final int exitCode;
		private final Throwable thrownException;

		TestResult(BaseTestBuilder<?> builder, String output, int gapCount, int exitCode, Throwable thrownException) {
			this.builder = builder;
			this.output = output;
			this.gapCount = gapCount;
			this.exitCode = exitCode;
			this.thrownException = thrownException;
		}

		public String output() {
			return output;
		}

		public List<String> lines() {
			return F2CppTestSupport.lines(output);
		}

		public int gapCount() {
			return gapCount;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * Verifies that the output, gaps, exit code or thrown exception match
		 * the expectations defined in the builder.
		 */
		public void assertExpected() {
			String description = builder.description;
			if (builder.expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception " + builder.expectedException.getName() + " for " + description
									+ " but translation completed successfully");
				}
				if (!builder.expectedException.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception " + builder.expectedException.getName() + " for " + description + " but got "
									+ thrownException.getClass().getName(),
							thrownException);
				}
				if (builder.expectedMessage != null) {
					assertTrue(
							"Unexpected message for " + description + ": " + thrownException.getMessage(),
							thrownException.getMessage().contains(builder.expectedMessage));
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (builder.expectedOutput != null) {
				assertEquals("Unexpected output for " + description, builder.expectedOutput, output);
			}
			List<String> actual = lines();
			int from = 0;
			for (String expected : builder.expectedSequence) {
				int index = actual.subList(from, actual.size()).indexOf(expected);
				assertTrue("Missing line '" + expected + "' for " + description + " in:\n" + output, index >= 0);
				from += index + 1;
			}
			for (String fragment : builder.expectedFragments) {
				assertTrue("Missing '" + fragment + "' for " + description + " in:\n" + output, output.contains(fragment));
			}
			for (String fragment : builder.forbiddenFragments) {
				assertFalse("Unexpected '" + fragment + "' for " + description + " in:\n" + output, output.contains(fragment));
			}
			if (builder.expectedGaps != null) {
				assertEquals("Unexpected gap count for " + description, builder.expectedGaps.intValue(), gapCount);
			}
			int expectedExit = builder.expectedExitCode == null ? 0 : builder.expectedExitCode.intValue();
			assertEquals("Unexpected exit code for " + description, expectedExit, exitCode);
		}
	}

	/**
	 * Expectations shared by all builders.
	 *
	 * @param <B> concrete builder type, returned for chaining
	 */
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		final String description;
		final TranslatorSettings settings = new TranslatorSettings();
		String expectedOutput;
		final List<String> expectedSequence = new ArrayList<>();
		final List<String> expectedFragments = new ArrayList<>();
		final List<String> forbiddenFragments = new ArrayList<>();
		Integer expectedGaps;
		Integer expectedExitCode;
		Class<? extends Throwable> expectedException;
		String expectedMessage;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		B self() {
			return (B) this;
		}

		/**
		 * Expects the whole output, exactly.
		 */
		public B expect(String... outputLines) {
			expectedOutput = String.join("\n", outputLines) + "\n";
			return self();
		}

		/**
		 * Expects these complete lines, indentation included, in this order,
		 * among the lines of the output.
		 */
		public B expectLines(String... outputLines) {
			expectedSequence.addAll(Arrays.asList(outputLines));
			return self();
		}

		public B expectContains(String... fragments) {
			expectedFragments.addAll(Arrays.asList(fragments));
			return self();
		}

		public B expectNotContains(String... fragments) {
			forbiddenFragments.addAll(Arrays.asList(fragments));
			return self();
		}

		public B expectGaps(int count) {
			expectedGaps = Integer.valueOf(count);
			return self();
		}

		public B expectExitCode(int code) {
			expectedExitCode = Integer.valueOf(code);
			return self();
		}

		public B expectThrow(Class<? extends Throwable> type) {
			expectedException = type;
			return self();
		}

		public B expectThrow(Class<? extends Throwable> type, String messageFragment) {
			expectedException = type;
			expectedMessage = messageFragment;
			return self();
		}

		public B rawGaps() {
			settings.setGapStyle(GapStyle.RAW);
			return self();
		}

		public B noSummary() {
			settings.setGapSummary(false);
			return self();
		}

		public B indent(String indent) {
			settings.setIndent(indent);
			return self();
		}

		/**
		 * Executes the configured test case and returns the captured result
		 * without asserting it.
		 */
		public abstract TestResult run() throws Exception;

		/**
		 * Executes the configured test case and asserts the expectations.
		 */
		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Fluent builder for tests that translate with {@link F2Cpp} directly.
	 */
	public static final class TranslateTestBuilder extends BaseTestBuilder<TranslateTestBuilder> {
		private String source;

		private TranslateTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param sourceLines Fortran source, one line per argument
		 * @return this builder for method chaining
		 */
		public TranslateTestBuilder source(String... sourceLines) {
			source = String.join("\n", sourceLines) + "\n";
			return this;
		}

		/**
		 * @param name file name of a fixture under <code>fortran/</code>
		 * @return this builder for method chaining
		 */
		public TranslateTestBuilder fixture(String name) {
			source = F2CppTestSupport.fixture(name);
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			try {
				TranslationResult result = new F2Cpp(settings).translate(source);
				return new TestResult(this, result.getText(), result.getGaps().size(), 0, null);
			} catch (TranslationException e) {
				return new TestResult(this, "", 0, Cli.EXIT_FAILURE, e);
			}
		}
	}

	/**
	 * Fluent builder for tests that go through {@link Cli#execute}, capturing
	 * its standard output and error.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> args = new ArrayList<>();
		private String expectedError;
		private Path outputFile;

		private CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder args(String... values) {
			args.addAll(Arrays.asList(values));
			return this;
		}

		/**
		 * Expects a fragment of the standard error.
		 */
		public CliTestBuilder expectError(String fragment) {
			expectedError = fragment;
			return this;
		}

		/**
		 * Asserts on the file given to <code>-o</code> instead of the standard
		 * output.
		 */
		public CliTestBuilder readOutputFrom(Path file) {
			outputFile = file;
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			int code;
			try (PrintStream os = new PrintStream(out, true, StandardCharsets.UTF_8);
					PrintStream es = new PrintStream(err, true, StandardCharsets.UTF_8)) {
				code = Cli.execute(args.toArray(new String[0]), os, es);
			}
			String error = new String(err.toByteArray(), StandardCharsets.UTF_8);
			if (expectedError != null) {
				assertTrue("Missing error '" + expectedError + "' for " + description + " in:\n" + error, error.contains(expectedError));
			}
			String output = outputFile == null
					? new String(out.toByteArray(), StandardCharsets.UTF_8)
					: new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
			return new TestResult(this, output, 0, code, null);
		}
	}
}

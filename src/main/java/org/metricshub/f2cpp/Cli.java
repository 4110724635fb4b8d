package org.metricshub.f2cpp;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.metricshub.f2cpp.util.SourceFileUnit;
import org.metricshub.f2cpp.util.TranslatorSettings;
import org.metricshub.f2cpp.util.TranslatorSettings.GapStyle;

/**
 * Command-line interface for the translator: reads <code>unit.f90</code>
 * and writes its C++ translation to the standard output, or to the file
 * given with <code>-o</code>.
 * <p>
 * Exit status is 0 on success, coverage gaps included, 1 on a structural
 * error or an unreadable source, and 2 on invalid arguments.
 */
public final class Cli {

	/** Exit status of a successful translation */
	public static final int EXIT_OK = 0;

	/** Exit status of a failed translation */
	public static final int EXIT_FAILURE = 1;

	/** Exit status of invalid command-line arguments */
	public static final int EXIT_USAGE = 2;

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "f2cpp.jar";
		}
		JAR_NAME = myName;
	}

	private final TranslatorSettings settings = new TranslatorSettings();
	private final PrintStream out;

	private String sourcePath;
	private File outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the translation and the usage are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link TranslatorSettings} configured from the
	 * command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TranslatorSettings getSettings() {
		return settings;
	}

	/**
	 * @return path of the Fortran source, with its extension resolved
	 */
	public String getSourcePath() {
		return sourcePath;
	}

	/**
	 * @return the file given with <code>-o</code>, or {@code null}
	 */
	public File getOutputFile() {
		return outputFile;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException on an invalid argument
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				if (sourcePath != null) {
					throw new IllegalArgumentException("Only one source unit may be translated: " + arg);
				}
				sourcePath = resolveUnit(arg);
			} else if (arg.equals("-o")) {
				// -o filename : write the translation to a file
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("-i")) {
				// -i indent : indentation of one nesting level
				checkParameterHasArgument(args, argIdx);
				settings.setIndent(parseIndent(args[++argIdx]));
			} else if (arg.equals("--raw-gaps")) {
				settings.setGapStyle(GapStyle.RAW);
			} else if (arg.equals("--no-summary")) {
				settings.setGapSummary(false);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (sourcePath == null) {
			throw new IllegalArgumentException("Fortran source unit not provided.");
		}
	}

	/**
	 * A unit named without extension is the <code>.f90</code> file of that
	 * name.
	 */
	static String resolveUnit(String unit) {
		String fileName = new File(unit).getName();
		return fileName.indexOf('.') < 0 ? unit + ".f90" : unit;
	}

	/**
	 * The indentation is either a number of spaces, or the literal text of
	 * one level (<code>\t</code> stands for a tab).
	 */
	private static String parseIndent(String value) {
		if (value.matches("\\d+")) {
			int count = Integer.parseInt(value);
			StringBuilder indent = new StringBuilder();
			for (int i = 0; i < count; i++) {
				indent.append(' ');
			}
			return indent.toString();
		}
		return value.replace("\\t", "\t");
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Translates the source unit based on the previously parsed arguments.
	 *
	 * @return the translation, or {@code null} when only the usage was printed
	 * @throws IOException if the source cannot be read or the output written
	 * @throws TranslationException on a structural error of the source
	 */
	public TranslationResult run() throws IOException {
		if (printUsage) {
			usage(out);
			return null;
		}
		SourceFileUnit unit = new SourceFileUnit(sourcePath);
		if (outputFile == null) {
			return new F2Cpp(settings).invoke(unit);
		}
		try (PrintStream fileOut = new PrintStream(new FileOutputStream(outputFile), false, StandardCharsets.UTF_8)) {
			settings.setOutputStream(fileOut);
			return new F2Cpp(settings).invoke(unit);
		} finally {
			settings.setOutputStream(out);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [-o output-filename] [-i indent] [--raw-gaps] [--no-summary] unit");
		dest.println();
		dest.println(" unit = Fortran source file; unit.f90 when given without extension.");
		dest.println(" -o filename = Write the C++ translation to filename instead of stdout.");
		dest.println(" -i indent = Indent each nesting level with that many spaces, or with that text.");
		dest.println(" --raw-gaps = Keep untranslated statements as code, followed by a marker.");
		dest.println(" --no-summary = Do not append the list of coverage gaps to the output.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses the arguments and translates, reporting errors to the given
	 * stream.
	 *
	 * @param args command-line arguments
	 * @param os stream for the translation
	 * @param es stream for error messages
	 * @return the exit status
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream os, PrintStream es) {
		Cli cli = new Cli(os);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			es.printf("%s\n", e.getMessage());
			es.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE;
		}
		try {
			cli.run();
			return EXIT_OK;
		} catch (TranslationException e) {
			if (e.getLineNumber() >= 0) {
				es.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return EXIT_FAILURE;
		} catch (IOException | UncheckedIOException e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return EXIT_FAILURE;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		System.exit(execute(args, System.out, System.err));
	}
}

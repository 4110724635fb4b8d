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

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import org.metricshub.f2cpp.backend.Assembler;
import org.metricshub.f2cpp.backend.StatementEmitter;
import org.metricshub.f2cpp.backend.TranslationContext;
import org.metricshub.f2cpp.frontend.Classifier;
import org.metricshub.f2cpp.frontend.LogicalStatement;
import org.metricshub.f2cpp.frontend.Normalizer;
import org.metricshub.f2cpp.util.F2CppLogger;
import org.metricshub.f2cpp.util.SourceUnit;
import org.metricshub.f2cpp.util.TranslatorSettings;
import org.slf4j.Logger;

/**
 * Entry point into the translation of free-form Fortran source to C++.
 * This entry point is used both when the translator is executed as a
 * library and when invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Normalize the source into logical statements, with their comments.
 * <li>Classify each statement by its leading keyword and shape.
 * <li>Translate the statements in order, maintaining the scopes and symbol
 * tables, into C++ fragments.
 * <li>Assemble the fragments, with the headers they need.
 * </ul>
 * Constructs with no translation rule do not stop the process: they are
 * reported as coverage gaps in the result. Structural errors, such as
 * unbalanced blocks, raise a {@link TranslationException}.
 * <p>
 * An instance holds no state between translations and may be reused.
 */
public class F2Cpp {

	private static final Logger LOGGER = F2CppLogger.getLogger(F2Cpp.class);

	private final TranslatorSettings settings;

	/**
	 * Create a new translator with the default settings
	 */
	public F2Cpp() {
		this(new TranslatorSettings());
	}

	/**
	 * @param settings indentation, gap style and gap summary of the output
	 */
	public F2Cpp(TranslatorSettings settings) {
		this.settings = settings;
	}

	/**
	 * Translates Fortran source text.
	 *
	 * @param source Fortran source text
	 * @return the C++ translation
	 * @throws IOException never for in-memory text, declared for symmetry
	 *         with the other overloads
	 * @throws TranslationException on a structural error of the source
	 */
	public TranslationResult translate(String source) throws IOException {
		return translate(new SourceUnit(SourceUnit.DESCRIPTION_INLINE, new StringReader(source)));
	}

	/**
	 * Translates Fortran source read from a {@link Reader}, which is closed
	 * afterwards.
	 *
	 * @param source reader of the Fortran source
	 * @return the C++ translation
	 * @throws IOException upon an error reading the source
	 * @throws TranslationException on a structural error of the source
	 */
	public TranslationResult translate(Reader source) throws IOException {
		return translate(new SourceUnit(SourceUnit.DESCRIPTION_INLINE, source));
	}

	/**
	 * Translates a Fortran {@link SourceUnit}.
	 *
	 * @param unit the source
	 * @return the C++ translation
	 * @throws IOException upon an error reading the source
	 * @throws TranslationException on a structural error of the source
	 */
	public TranslationResult translate(SourceUnit unit) throws IOException {
		LOGGER.info("Translating {}", unit);
		LOGGER.debug("Settings:\n{}", settings.toDescriptionString());
		List<LogicalStatement> statements;
		try (Reader reader = unit.getReader()) {
			statements = new Normalizer().normalize(reader);
		}

		TranslationContext context = new TranslationContext(settings);
		Classifier classifier = new Classifier();
		StatementEmitter emitter = new StatementEmitter(context);
		for (LogicalStatement statement : statements) {
			emitter.translate(classifier.classify(statement));
		}
		emitter.finish();

		String text = new Assembler(context).assemble();
		TranslationResult result = new TranslationResult(text, context.getDiagnostics().getGaps());
		LOGGER.info("Translated {}: {} statement(s), {} coverage gap(s)", unit, statements.size(), result.getGaps().size());
		return result;
	}

	/**
	 * Translates a {@link SourceUnit} and writes the C++ text to the output
	 * stream of the settings.
	 *
	 * @param unit the source
	 * @return the C++ translation
	 * @throws IOException upon an error reading the source
	 * @throws TranslationException on a structural error of the source
	 */
	public TranslationResult invoke(SourceUnit unit) throws IOException {
		TranslationResult result = translate(unit);
		PrintStream out = settings.getOutputStream();
		out.print(result.getText());
		out.flush();
		return result;
	}
}

package org.metricshub.p4llvm;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * P4LLVM
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
import java.io.IOException;
import java.io.PrintStream;
import org.metricshub.p4llvm.backend.LlvmProgram;
import org.metricshub.p4llvm.frontend.HlirJsonReader;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.intermediate.DirectiveList;
import org.metricshub.p4llvm.intermediate.ProgramPrinter;
import org.metricshub.p4llvm.util.HlirSource;
import org.metricshub.p4llvm.util.LlvmSettings;
import org.metricshub.p4llvm.util.P4Logger;
import org.slf4j.Logger;

/**
 * Entry point into the lowering of a P4 program.
 * <p>
 * A program is compiled into a {@link DirectiveList}, which can be rendered
 * as program text with {@link #translate(Hlir, LlvmSettings)}. A compilation
 * that raises a {@link CompilationException} produces nothing.
 * <p>
 * Use {@link Main} to run the compiler as a stand-alone application.
 */
public class P4Llvm {

	private static final Logger LOGGER = P4Logger.getLogger(P4Llvm.class);

	private LlvmProgram lastProgram;

	/**
	 * Returns the program lowered by the last successful compilation.
	 *
	 * @return the program, or {@code null} before the first compilation
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public LlvmProgram getLastProgram() {
		return lastProgram;
	}

	public DirectiveList compile(Hlir hlir) {
		return compile(hlir, new LlvmSettings());
	}

	/**
	 * Lowers a program into checked directives.
	 *
	 * @param hlir the program
	 * @param settings compilation parameters
	 * @return the directives of the generated program
	 * @throws CompilationException if the program cannot be lowered
	 */
	public DirectiveList compile(Hlir hlir, LlvmSettings settings) {
		LOGGER.debug("Compiling {} with settings:\n{}", settings.getProgramName(), settings.toDescriptionString());
		LlvmProgram program = new LlvmProgram(settings.getProgramName(), hlir);
		DirectiveList directives = new DirectiveList();
		program.generate(directives);
		directives.postProcess();
		lastProgram = program;
		LOGGER
				.debug(
						"Compiled {} into {} directives with {} warning(s)",
						settings.getProgramName(),
						directives.size(),
						program.getWarningCount());
		return directives;
	}

	/**
	 * Loads and lowers the JSON description of a program.
	 *
	 * @param source the description
	 * @param settings compilation parameters
	 * @return the directives of the generated program
	 * @throws IOException if the description cannot be read
	 * @throws CompilationException if the program cannot be loaded or lowered
	 */
	public DirectiveList compile(HlirSource source, LlvmSettings settings) throws IOException {
		return compile(new HlirJsonReader().read(source), settings);
	}

	public String translate(Hlir hlir) {
		return translate(hlir, new LlvmSettings());
	}

	/**
	 * Lowers a program into program text.
	 *
	 * @param hlir the program
	 * @param settings compilation parameters
	 * @return the text of the generated program
	 */
	public String translate(Hlir hlir, LlvmSettings settings) {
		return new ProgramPrinter(settings.getIndentWidth()).print(compile(hlir, settings));
	}

	/**
	 * Compiles a JSON description and writes the result to the output stream
	 * of the settings: the directive listing when
	 * {@link LlvmSettings#isDumpDirectives()}, the program text otherwise.
	 *
	 * @param source the description
	 * @param settings compilation parameters
	 * @throws IOException if the description cannot be read
	 */
	public void invoke(HlirSource source, LlvmSettings settings) throws IOException {
		write(compile(source, settings), settings);
	}

	/**
	 * Writes compiled directives to the output stream of the settings, as
	 * {@link #invoke(HlirSource, LlvmSettings)} does.
	 *
	 * @param directives the result of a compilation
	 * @param settings compilation parameters
	 */
	public void write(DirectiveList directives, LlvmSettings settings) {
		PrintStream out = settings.getOutputStream();
		if (settings.isDumpDirectives()) {
			directives.dump(out);
		} else {
			out.print(new ProgramPrinter(settings.getIndentWidth()).print(directives));
		}
		out.flush();
	}
}

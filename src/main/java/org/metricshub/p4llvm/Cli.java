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
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.p4llvm.intermediate.DirectiveList;
import org.metricshub.p4llvm.util.HlirSource;
import org.metricshub.p4llvm.util.LlvmSettings;

/**
 * Command-line interface for P4LLVM.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "p4llvm.jar";
		}
		JAR_NAME = myName;
	}

	private final LlvmSettings settings = new LlvmSettings();
	private final PrintStream out;

	private HlirSource hlirSource;
	private File outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance writing the generated program and the usage
	 * output to the supplied stream.
	 *
	 * @param out stream where program output is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link LlvmSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public LlvmSettings getSettings() {
		return settings;
	}

	/**
	 * @return the HLIR description given with {@code -f}, or {@code null}
	 */
	public HlirSource getHlirSource() {
		return hlirSource;
	}

	/**
	 * @return the file given with {@code -o}, or {@code null} for the output stream
	 */
	public File getOutputFile() {
		return outputFile;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments are invalid
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
			if (arg.equals("-f")) {
				// -f filename : JSON description of the program
				checkParameterHasArgument(args, argIdx);
				hlirSource = HlirSource.fromFile(args[++argIdx]);
			} else if (arg.equals("-o")) {
				// -o filename : write the result to a file
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("-n")) {
				// -n name : program name
				checkParameterHasArgument(args, argIdx);
				settings.setProgramName(args[++argIdx]);
			} else if (arg.equals("-d") || arg.equals("--dump-intermediate")) {
				settings.setDumpDirectives(true);
			} else if (arg.equals("--indent")) {
				checkParameterHasArgument(args, argIdx);
				String width = args[++argIdx];
				try {
					settings.setIndentWidth(Integer.parseInt(width));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid indentation width: " + width, e);
				}
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

		if (hlirSource == null) {
			throw new IllegalArgumentException("HLIR description not provided (-f).");
		}
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
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the description cannot be read or the output cannot be written
	 * @throws CompilationException if the program cannot be compiled
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		P4Llvm compiler = new P4Llvm();
		if (outputFile == null) {
			compiler.invoke(hlirSource, settings);
			return;
		}
		// the file is only created once the program compiled
		DirectiveList directives = compiler.compile(hlirSource, settings);
		try (PrintStream fileStream = new PrintStream(new FileOutputStream(outputFile), false, StandardCharsets.UTF_8.name())) {
			settings.setOutputStream(fileStream);
			compiler.write(directives, settings);
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
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" -f hlir-filename" +
								" [-o output-filename]" +
								" [-n program-name]" +
								" [-d]" +
								" [--indent width]");
		dest.println();
		dest.println(" -f filename = Compile the program described by this JSON file.");
		dest.println(" -o filename = Write the generated program to filename instead of stdout.");
		dest.println(" -n name = Name of the program (default " + LlvmSettings.DEFAULT_PROGRAM_NAME + ").");
		dest.println(" -d, --dump-intermediate = Print the directive listing instead of the program text.");
		dest.println(" --indent width = Spaces per indentation level of the program text.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for program output
	 * @return configured and executed CLI instance
	 * @throws IOException if the execution fails
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}
}

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

/**
 * Entry point into the compilation of a P4 program described in JSON.
 * This entry point is used when P4LLVM is executed as a stand-alone application.
 * If you want to use P4LLVM as a library, please use {@link P4Llvm}.
 */
public final class Main {

	/** Exit status of a failed compilation. */
	public static final int EXIT_FAILURE = 1;

	/** Exit status of invalid command-line arguments. */
	public static final int EXIT_USAGE = 2;

	private Main() {}

	/**
	 * Runs the command-line interface and returns the exit status instead of
	 * exiting the VM.
	 *
	 * @param args Command line arguments
	 * @return 0 on success, {@link #EXIT_FAILURE} or {@link #EXIT_USAGE} otherwise
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int invoke(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
			return 0;
		} catch (IllegalArgumentException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE;
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return EXIT_FAILURE;
		}
	}

	/**
	 * The entry point to P4LLVM for the VM.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		System.exit(invoke(args));
	}
}

package org.metricshub.p4llvm.util;

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
import java.io.PrintStream;
import org.metricshub.p4llvm.intermediate.ProgramPrinter;

/**
 * A simple container for the parameters of a single compilation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the compiler programmatically, from within Java code.
 */
public class LlvmSettings {

	/** Program name used when none is given. */
	public static final String DEFAULT_PROGRAM_NAME = "p4program";

	/**
	 * Name of the compiled program, shown in the generated code;
	 * {@value #DEFAULT_PROGRAM_NAME} by default.
	 */
	private String programName = DEFAULT_PROGRAM_NAME;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Whether to print the raw directive listing instead of program text;
	 * <code>false</code> by default.
	 */
	private boolean dumpDirectives = false;

	/**
	 * Number of spaces per indentation level of the program text.
	 */
	private int indentWidth = ProgramPrinter.DEFAULT_INDENT_WIDTH;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("programName = ").append(getProgramName()).append(newLine);
		desc.append("dumpDirectives = ").append(isDumpDirectives()).append(newLine);
		desc.append("indentWidth = ").append(getIndentWidth()).append(newLine);

		return desc.toString();
	}

	public String getProgramName() {
		return programName;
	}

	public void setProgramName(String programName) {
		if (programName == null || programName.isEmpty()) {
			throw new IllegalArgumentException("Program name must not be empty");
		}
		this.programName = programName;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (instead of System.out by default)
	 *
	 * @param pOutputStream OutputStream to use for print statements
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	public boolean isDumpDirectives() {
		return dumpDirectives;
	}

	public void setDumpDirectives(boolean dumpDirectives) {
		this.dumpDirectives = dumpDirectives;
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	public void setIndentWidth(int indentWidth) {
		if (indentWidth < 0) {
			throw new IllegalArgumentException("Indentation width must not be negative: " + indentWidth);
		}
		this.indentWidth = indentWidth;
	}
}

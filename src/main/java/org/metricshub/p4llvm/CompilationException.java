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

import java.text.MessageFormat;

/**
 * A fault that aborts the compilation of a program. No output is produced
 * for a program whose compilation raised this exception.
 * <p>
 * Messages use {@link MessageFormat} patterns, e.g.
 * {@code "Could not locate table named {0}"}.
 */
public class CompilationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final boolean bug;

	/**
	 * @param bug {@code true} when the fault reveals a defect of the compiler
	 *        rather than of the compiled program
	 * @param format {@link MessageFormat} pattern
	 * @param arguments pattern arguments
	 */
	public CompilationException(boolean bug, String format, Object... arguments) {
		super(MessageFormat.format(format, arguments));
		this.bug = bug;
	}

	public CompilationException(boolean bug, String message, Throwable cause) {
		super(message, cause);
		this.bug = bug;
	}

	/**
	 * Whether the fault is an internal compiler error.
	 *
	 * @return {@code true} for compiler defects, {@code false} for faults of the
	 *         input program
	 */
	public boolean isBug() {
		return bug;
	}
}

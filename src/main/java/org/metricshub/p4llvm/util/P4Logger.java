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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the SLF4J loggers of P4LLVM.
 * <p>
 * Besides the usual per-class loggers, compilation warnings go to a single
 * logger, {@value #WARNINGS}, so that they can be routed or silenced
 * independently of the diagnostic output of the compiler itself. SLF4J is
 * kept from reporting its own initialization.
 */
public final class P4Logger {

	/** Name of the logger receiving compilation warnings. */
	public static final String WARNINGS = "org.metricshub.p4llvm.warnings";

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private P4Logger() {
		// utility class
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * @return the logger of compilation warnings
	 */
	public static Logger getWarningLogger() {
		return LoggerFactory.getLogger(WARNINGS);
	}
}

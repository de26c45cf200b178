package org.metricshub.p4llvm.backend;

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

import org.metricshub.p4llvm.CompilationException;

/**
 * Maps bit widths of P4 fields to storage types.
 */
public class LlvmTypeFactory {

	/** Widest field stored in a scalar. */
	public static final int MAX_SCALAR_WIDTH = 64;

	/**
	 * @param width field width in bits
	 * @return the smallest unsigned type holding the width, or a byte array
	 *         beyond {@value #MAX_SCALAR_WIDTH} bits
	 * @throws CompilationException if the width is not positive
	 */
	public LlvmType forWidth(int width) {
		if (width <= 0) {
			throw new CompilationException(true, "Invalid field width {0}", width);
		}
		if (width <= 8) {
			return new LlvmType("uint8_t", width, 0);
		}
		if (width <= 16) {
			return new LlvmType("uint16_t", width, 0);
		}
		if (width <= 32) {
			return new LlvmType("uint32_t", width, 0);
		}
		if (width <= MAX_SCALAR_WIDTH) {
			return new LlvmType("uint64_t", width, 0);
		}
		return new LlvmType("uint8_t", width, (width + 7) / 8);
	}
}

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

import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * The storage type of a field of the generated program: an unsigned integer
 * wide enough for the field, or a byte array for fields wider than 64 bits.
 */
public final class LlvmType {

	private final String name;
	private final int widthInBits;
	private final int arrayLength;

	LlvmType(String name, int widthInBits, int arrayLength) {
		this.name = name;
		this.widthInBits = widthInBits;
		this.arrayLength = arrayLength;
	}

	/**
	 * @return the C type, or the element type for byte arrays
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the width of the P4 field this type stores
	 */
	public int getWidthInBits() {
		return widthInBits;
	}

	/**
	 * @return the number of bytes of a byte array, 0 for scalar types
	 */
	public int getArrayLength() {
		return arrayLength;
	}

	public boolean isArray() {
		return arrayLength > 0;
	}

	/**
	 * Declares a struct member of this type.
	 *
	 * @param serializer where to emit
	 * @param memberName member name
	 */
	public void declare(ProgramSerializer serializer, String memberName) {
		serializer.structField(name, memberName, arrayLength);
	}

	/**
	 * @return the zero value of this type
	 */
	public String getInitializer() {
		return isArray() ? "{ 0 }" : "0";
	}

	@Override
	public String toString() {
		return isArray() ? name + "[" + arrayLength + "]" : name;
	}
}

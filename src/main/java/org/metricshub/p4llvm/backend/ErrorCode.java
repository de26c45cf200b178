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

import java.util.ArrayList;
import java.util.List;

/**
 * Packet-processing faults of the generated program, in the order of the
 * generated {@code enum ErrorCode}. Companion runtime code relies on both the
 * names and the ordinals.
 */
public enum ErrorCode {
	NO_ERROR("p4_pe_no_error"),
	INDEX_OUT_OF_BOUNDS("p4_pe_index_out_of_bounds"),
	OUT_OF_PACKET("p4_pe_out_of_packet"),
	HEADER_TOO_LONG("p4_pe_header_too_long"),
	HEADER_TOO_SHORT("p4_pe_header_too_short"),
	UNHANDLED_SELECT("p4_pe_unhandled_select"),
	CHECKSUM("p4_pe_checksum");

	/** Name of the generated enumeration type. */
	public static final String ENUM_NAME = "ErrorCode";

	private final String generatedName;

	ErrorCode(String generatedName) {
		this.generatedName = generatedName;
	}

	/**
	 * @return the constant name in the generated program
	 */
	public String getGeneratedName() {
		return generatedName;
	}

	/**
	 * @return the generated constant names, in ordinal order
	 */
	public static List<String> generatedNames() {
		List<String> names = new ArrayList<String>();
		for (ErrorCode code : values()) {
			names.add(code.generatedName);
		}
		return names;
	}
}

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

import org.metricshub.p4llvm.hlir.P4Counter;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * An array of packet or byte counters, updated by the {@code count}
 * primitive.
 */
public class LlvmCounter {

	static final String ELEMENT_TYPE = "uint64_t";

	private final P4Counter hlirCounter;

	LlvmCounter(P4Counter hlirCounter) {
		this.hlirCounter = hlirCounter;
	}

	public String getName() {
		return hlirCounter.getName();
	}

	public P4Counter getHlirCounter() {
		return hlirCounter;
	}

	/**
	 * @param program the owning program
	 * @return the amount one packet adds to a counter
	 */
	String getIncrement(LlvmProgram program) {
		return hlirCounter.getType() == P4Counter.CounterType.BYTES ? program.getPacketSizeName() : "1";
	}

	public void serialize(ProgramSerializer serializer, LlvmProgram program) {
		serializer.declareCounter(getName(), ELEMENT_TYPE, hlirCounter.getInstanceCount());
	}
}

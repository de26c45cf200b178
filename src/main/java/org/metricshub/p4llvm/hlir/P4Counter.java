package org.metricshub.p4llvm.hlir;

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

import java.util.Locale;
import java.util.Objects;

/**
 * An array of packet or byte counters, incremented by the {@code count}
 * primitive.
 */
public final class P4Counter {

	public enum CounterType {
		PACKETS,
		BYTES;

		public static CounterType fromName(String name) {
			return valueOf(name.toUpperCase(Locale.ROOT));
		}
	}

	private final String name;
	private final CounterType type;
	private final int instanceCount;

	public P4Counter(String name, CounterType type, int instanceCount) {
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		if (instanceCount <= 0) {
			throw new IllegalArgumentException("Counter " + name + " needs at least one instance");
		}
		this.instanceCount = instanceCount;
	}

	public String getName() {
		return name;
	}

	public CounterType getType() {
		return type;
	}

	public int getInstanceCount() {
		return instanceCount;
	}

	@Override
	public String toString() {
		return name;
	}
}

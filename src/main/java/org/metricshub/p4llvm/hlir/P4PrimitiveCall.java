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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call to a primitive action, such as {@code modify_field(ipv4.ttl, 64)}.
 */
public final class P4PrimitiveCall {

	private final String name;
	private final List<P4Expression> arguments;

	public P4PrimitiveCall(String name, List<P4Expression> arguments) {
		this.name = Objects.requireNonNull(name, "name");
		this.arguments = Collections.unmodifiableList(new ArrayList<P4Expression>(arguments));
	}

	public P4PrimitiveCall(String name, P4Expression... arguments) {
		this(name, Arrays.asList(arguments));
	}

	public String getName() {
		return name;
	}

	public List<P4Expression> getArguments() {
		return arguments;
	}

	@Override
	public String toString() {
		return name + arguments;
	}
}

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compound action: a sequence of primitive calls over the action
 * parameters.
 * <p>
 * Actions injected by the compiler rather than written by the user carry a
 * negative line number.
 */
public final class P4Action {

	private final String name;
	private final Map<String, Integer> parameters;
	private final List<P4PrimitiveCall> body;
	private final int lineNumber;

	private P4Action(String name, Map<String, Integer> parameters, List<P4PrimitiveCall> body, int lineNumber) {
		this.name = name;
		this.parameters = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(parameters));
		this.body = Collections.unmodifiableList(new ArrayList<P4PrimitiveCall>(body));
		this.lineNumber = lineNumber;
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return parameter name to width in bits, in declaration order
	 */
	public Map<String, Integer> getParameters() {
		return parameters;
	}

	public List<P4PrimitiveCall> getBody() {
		return body;
	}

	/**
	 * @return the source line of the declaration, negative for compiler-injected actions
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public String toString() {
		return name;
	}

	public static final class Builder {
		private final String name;
		private final Map<String, Integer> parameters = new LinkedHashMap<String, Integer>();
		private final List<P4PrimitiveCall> body = new ArrayList<P4PrimitiveCall>();
		private int lineNumber = 1;

		private Builder(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public Builder parameter(String parameterName, int width) {
			if (width <= 0) {
				throw new IllegalArgumentException("Parameter " + parameterName + " of " + name + " must have a positive width");
			}
			if (parameters.put(parameterName, width) != null) {
				throw new IllegalArgumentException("Duplicate parameter " + parameterName + " in action " + name);
			}
			return this;
		}

		public Builder call(String primitive, P4Expression... arguments) {
			body.add(new P4PrimitiveCall(primitive, arguments));
			return this;
		}

		public Builder call(P4PrimitiveCall call) {
			body.add(Objects.requireNonNull(call, "call"));
			return this;
		}

		public Builder lineNumber(int line) {
			this.lineNumber = line;
			return this;
		}

		public P4Action build() {
			return new P4Action(name, parameters, body, lineNumber);
		}
	}
}

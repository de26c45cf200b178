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

import java.util.Locale;

/**
 * Raised when a name does not resolve to an entity owned by the program
 * being compiled.
 */
public class EntityNotFoundException extends CompilationException {

	private static final long serialVersionUID = 1L;

	/**
	 * The registries a name is looked up in.
	 */
	public enum Kind {
		HEADER("header instance"),
		STACK("header stack"),
		INSTANCE("instance"),
		TABLE("table"),
		CONDITIONAL("conditional"),
		ACTION("action"),
		COUNTER("counter"),
		PARSE_STATE("parse state");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final Kind kind;
	private final String name;

	public EntityNotFoundException(Kind kind, String name) {
		super(true, "Could not locate {0} named {1}", kind.getDescription(), name);
		this.kind = kind;
		this.name = name;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}
}

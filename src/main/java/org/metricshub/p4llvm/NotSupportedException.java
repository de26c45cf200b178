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

/**
 * Raised while lowering a program that uses a construct the backend does not
 * translate, such as a calculated field list.
 */
public class NotSupportedException extends CompilationException {

	private static final long serialVersionUID = 1L;

	private final String feature;
	private final String name;

	/**
	 * @param feature the unsupported construct, e.g. {@code "calculated field"}
	 * @param name the offending declaration
	 */
	public NotSupportedException(String feature, String name) {
		super(false, "Not supported: {0} {1}", feature, name);
		this.feature = feature;
		this.name = name;
	}

	public String getFeature() {
		return feature;
	}

	public String getName() {
		return name;
	}
}

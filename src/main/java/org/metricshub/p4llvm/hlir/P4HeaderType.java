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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The layout of a header or metadata structure: an ordered list of fields
 * with their widths in bits.
 */
public final class P4HeaderType {

	private final String name;
	private final Map<String, Integer> fields;

	/**
	 * Creates a header type.
	 *
	 * @param name type name
	 * @param fields field name to width in bits, in layout order
	 */
	public P4HeaderType(String name, Map<String, Integer> fields) {
		this.name = Objects.requireNonNull(name, "name");
		Map<String, Integer> copy = new LinkedHashMap<String, Integer>();
		for (Map.Entry<String, Integer> entry : fields.entrySet()) {
			if (entry.getValue() == null || entry.getValue() <= 0) {
				throw new IllegalArgumentException(
						"Field " + name + "." + entry.getKey() + " must have a positive width");
			}
			copy.put(entry.getKey(), entry.getValue());
		}
		this.fields = Collections.unmodifiableMap(copy);
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return field name to width in bits, in layout order
	 */
	public Map<String, Integer> getFields() {
		return fields;
	}

	/**
	 * @param field field name
	 * @return the width of the field in bits, or {@code null} if the type has no such field
	 */
	public Integer getFieldWidth(String field) {
		return fields.get(field);
	}

	/**
	 * @return the sum of all field widths in bits
	 */
	public int getWidth() {
		int width = 0;
		for (int w : fields.values()) {
			width += w;
		}
		return width;
	}

	@Override
	public String toString() {
		return name + fields;
	}

	/**
	 * Collects fields in layout order.
	 */
	public static final class Builder {
		private final String name;
		private final Map<String, Integer> fields = new LinkedHashMap<String, Integer>();

		private Builder(String name) {
			this.name = name;
		}

		public Builder field(String fieldName, int width) {
			if (fields.put(fieldName, width) != null) {
				throw new IllegalArgumentException("Duplicate field " + fieldName + " in header type " + name);
			}
			return this;
		}

		public P4HeaderType build() {
			return new P4HeaderType(name, fields);
		}
	}
}

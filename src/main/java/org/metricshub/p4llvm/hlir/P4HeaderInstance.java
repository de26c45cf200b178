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
 * A named occurrence of a {@link P4HeaderType}: a packet header, a metadata
 * block, or one element of a header stack.
 * <p>
 * Stack elements share a base name and are named {@code base[index]}; their
 * {@link #getMaxIndex()} is the last valid index of the stack. Scalar
 * instances have no maximum index.
 */
public final class P4HeaderInstance {

	private final String name;
	private final String baseName;
	private final P4HeaderType headerType;
	private final boolean metadata;
	private final Integer maxIndex;
	private final int index;
	private final Map<String, String> initializer;

	private P4HeaderInstance(
			String name,
			String baseName,
			P4HeaderType headerType,
			boolean metadata,
			Integer maxIndex,
			int index,
			Map<String, String> initializer) {
		this.name = Objects.requireNonNull(name, "name");
		this.baseName = Objects.requireNonNull(baseName, "baseName");
		this.headerType = Objects.requireNonNull(headerType, "headerType");
		this.metadata = metadata;
		this.maxIndex = maxIndex;
		this.index = index;
		this.initializer = Collections.unmodifiableMap(new LinkedHashMap<String, String>(initializer));
	}

	/**
	 * Creates a regular packet header instance.
	 *
	 * @param name instance name
	 * @param type header layout
	 * @return the new instance
	 */
	public static P4HeaderInstance header(String name, P4HeaderType type) {
		return new P4HeaderInstance(name, name, type, false, null, 0, Collections.<String, String>emptyMap());
	}

	/**
	 * Creates a metadata instance with all fields initialized to zero.
	 *
	 * @param name instance name
	 * @param type metadata layout
	 * @return the new instance
	 */
	public static P4HeaderInstance metadata(String name, P4HeaderType type) {
		return metadata(name, type, Collections.<String, String>emptyMap());
	}

	/**
	 * Creates a metadata instance.
	 *
	 * @param name instance name
	 * @param type metadata layout
	 * @param initializer initial field values by field name; missing fields start at zero
	 * @return the new instance
	 */
	public static P4HeaderInstance metadata(String name, P4HeaderType type, Map<String, String> initializer) {
		for (String field : initializer.keySet()) {
			if (type.getFieldWidth(field) == null) {
				throw new IllegalArgumentException("Metadata " + name + " initializes unknown field " + field);
			}
		}
		return new P4HeaderInstance(name, name, type, true, null, 0, initializer);
	}

	/**
	 * Creates one element of a header stack.
	 *
	 * @param baseName name shared by all elements of the stack
	 * @param index position of this element, starting at 0
	 * @param maxIndex last valid position of the stack
	 * @param type header layout
	 * @return the new instance, named {@code baseName[index]}
	 */
	public static P4HeaderInstance stackElement(String baseName, int index, int maxIndex, P4HeaderType type) {
		if (index < 0 || index > maxIndex) {
			throw new IllegalArgumentException(
					"Stack element " + baseName + "[" + index + "] outside of [0, " + maxIndex + "]");
		}
		return new P4HeaderInstance(
				baseName + "[" + index + "]",
				baseName,
				type,
				false,
				maxIndex,
				index,
				Collections.<String, String>emptyMap());
	}

	public String getName() {
		return name;
	}

	public String getBaseName() {
		return baseName;
	}

	public P4HeaderType getHeaderType() {
		return headerType;
	}

	public boolean isMetadata() {
		return metadata;
	}

	/**
	 * @return the last valid index of the stack this instance belongs to, or
	 *         {@code null} for scalar instances
	 */
	public Integer getMaxIndex() {
		return maxIndex;
	}

	public int getIndex() {
		return index;
	}

	public Map<String, String> getInitializer() {
		return initializer;
	}

	@Override
	public String toString() {
		return name;
	}
}

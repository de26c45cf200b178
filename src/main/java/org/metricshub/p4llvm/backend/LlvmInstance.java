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

import java.util.Map;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.hlir.P4HeaderType;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * The storage of one HLIR header instance in the generated program.
 * <p>
 * The set of storage categories is closed: {@link LlvmHeader},
 * {@link LlvmMetadata} and {@link LlvmHeaderStack}, told apart by
 * {@link #getKind()}.
 */
public abstract class LlvmInstance {

	/**
	 * Storage categories of header instances.
	 */
	public enum InstanceKind {
		HEADER,
		METADATA,
		HEADER_STACK
	}

	/** Member holding the validity bit of packet headers. */
	public static final String VALID_FIELD = "valid";

	private final P4HeaderInstance hlirInstance;
	private final String structVariable;
	private final LlvmTypeFactory typeFactory;

	LlvmInstance(P4HeaderInstance hlirInstance, String structVariable, LlvmTypeFactory typeFactory) {
		this.hlirInstance = hlirInstance;
		this.structVariable = structVariable;
		this.typeFactory = typeFactory;
	}

	public abstract InstanceKind getKind();

	/**
	 * @return the initial value of the instance in the enclosing struct
	 *         initializer
	 */
	public abstract String getInitializer();

	/**
	 * @return the instance name; the base name for a stack
	 */
	public String getName() {
		return hlirInstance.getName();
	}

	public P4HeaderInstance getHlirInstance() {
		return hlirInstance;
	}

	public P4HeaderType getHeaderType() {
		return hlirInstance.getHeaderType();
	}

	/**
	 * @return the C type of one instance, e.g. {@code struct ethernet_t}
	 */
	public String getTypeName() {
		return "struct " + getHeaderType().getName();
	}

	/**
	 * @return total width of one instance, in bits
	 */
	public int getWidth() {
		return getHeaderType().getWidth();
	}

	/**
	 * @return the expression designating this instance in the generated code
	 */
	public String getAccessPath() {
		return structVariable + "." + getName();
	}

	/**
	 * @param field field name
	 * @return the storage type of the field
	 * @throws CompilationException if the instance has no such field
	 */
	public LlvmType getFieldType(String field) {
		Integer width = getHeaderType().getFieldWidth(field);
		if (width == null) {
			throw new CompilationException(false, "{0} has no field named {1}", getName(), field);
		}
		return typeFactory.forWidth(width);
	}

	/**
	 * @return whether instances carry a validity bit
	 */
	public boolean hasValidity() {
		return true;
	}

	/**
	 * Declares the struct type of this instance.
	 *
	 * @param serializer where to emit
	 */
	public void declareType(ProgramSerializer serializer) {
		serializer.beginStruct(getHeaderType().getName());
		for (Map.Entry<String, Integer> field : getHeaderType().getFields().entrySet()) {
			typeFactory.forWidth(field.getValue()).declare(serializer, field.getKey());
		}
		if (hasValidity()) {
			serializer.structField("uint8_t", VALID_FIELD, 0);
		}
		serializer.endStruct();
	}

	/**
	 * Declares this instance as a member of the headers or metadata struct.
	 *
	 * @param serializer where to emit
	 */
	public void declareMember(ProgramSerializer serializer) {
		serializer.structField(getTypeName(), getName(), 0);
	}

	LlvmTypeFactory getTypeFactory() {
		return typeFactory;
	}

	@Override
	public String toString() {
		return getKind() + " " + getName();
	}
}

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

import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * An array of headers sharing a base name. Extraction fills the element
 * designated by the index variable, then moves it forward.
 */
public final class LlvmHeaderStack extends LlvmInstance {

	/** Index designating the last extracted element. */
	public static final String LAST = "last";

	/** Index designating the next element to extract. */
	public static final String NEXT = "next";

	private final String indexVariable;

	/**
	 * @param hlirInstance element 0 of the stack
	 * @param structVariable variable of the enclosing headers struct
	 * @param indexVariable name of the variable counting extracted elements
	 * @param typeFactory storage types
	 */
	LlvmHeaderStack(
			P4HeaderInstance hlirInstance,
			String structVariable,
			String indexVariable,
			LlvmTypeFactory typeFactory) {
		super(hlirInstance, structVariable, typeFactory);
		this.indexVariable = indexVariable;
	}

	@Override
	public InstanceKind getKind() {
		return InstanceKind.HEADER_STACK;
	}

	@Override
	public String getName() {
		return getHlirInstance().getBaseName();
	}

	public String getIndexVariable() {
		return indexVariable;
	}

	public int getMaxIndex() {
		return getHlirInstance().getMaxIndex();
	}

	/**
	 * @return number of elements
	 */
	public int getSize() {
		return getMaxIndex() + 1;
	}

	/**
	 * @param index a constant index, {@value #LAST} or {@value #NEXT}
	 * @return the expression designating one element
	 * @throws CompilationException if the index is not valid for this stack
	 */
	public String getElementAccess(String index) {
		String position;
		if (LAST.equals(index)) {
			position = indexVariable + " - 1";
		} else if (NEXT.equals(index)) {
			position = indexVariable;
		} else {
			int value;
			try {
				value = Integer.parseInt(index.trim());
			} catch (NumberFormatException e) {
				throw new CompilationException(false, "Invalid index " + index + " of stack " + getName(), e);
			}
			if (value < 0 || value > getMaxIndex()) {
				throw new CompilationException(false, "Index {0} out of the bounds of stack {1}", index, getName());
			}
			position = String.valueOf(value);
		}
		return getAccessPath() + "[" + position + "]";
	}

	@Override
	public void declareMember(ProgramSerializer serializer) {
		serializer.structField(getTypeName(), getName(), getSize());
	}

	@Override
	public String getInitializer() {
		return "{ { ." + VALID_FIELD + " = 0 } }";
	}
}

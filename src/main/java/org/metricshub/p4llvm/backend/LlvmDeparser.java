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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * Writes the valid headers back into the packet, in deparse order, then
 * returns the egress port. Dropped packets are not written back.
 */
public class LlvmDeparser {

	private final List<String> order;

	/**
	 * @param order header and stack names, in the order they are written back
	 * @param program the owning program, used to check every name resolves to a packet header
	 * @throws org.metricshub.p4llvm.EntityNotFoundException if a name is not a header or a stack
	 */
	LlvmDeparser(List<String> order, LlvmProgram program) {
		this.order = Collections.unmodifiableList(new ArrayList<String>(order));
		for (String name : order) {
			if (!program.hasStackInstance(name)) {
				program.getHeaderInstance(name);
			}
		}
	}

	public List<String> getOrder() {
		return order;
	}

	public void serialize(ProgramSerializer serializer, LlvmProgram program) {
		String write = program.freshName("deparse");
		String drop = program.freshName("drop");
		serializer.comment("deparser");
		serializer.branch(program.getDropBitName(), drop, write);
		serializer.label(write);
		serializer.assign(program.getOffsetVariableName(), "0");
		for (String name : order) {
			if (program.hasStackInstance(name)) {
				LlvmHeaderStack stack = program.getStackInstance(name);
				for (int i = 0; i < stack.getSize(); i++) {
					emitHeader(serializer, program, stack, stack.getElementAccess(String.valueOf(i)), name + "_" + i);
				}
			} else {
				LlvmInstance header = program.getHeaderInstance(name);
				emitHeader(serializer, program, header, header.getAccessPath(), name);
			}
		}
		serializer.returnValue(program.getEgressPortExpression());
		serializer.label(drop);
		serializer.returnValue("-1");
	}

	private void emitHeader(
			ProgramSerializer serializer,
			LlvmProgram program,
			LlvmInstance instance,
			String access,
			String labelBase) {
		String emit = program.freshName("emit_" + labelBase);
		String skip = program.freshName("skip_" + labelBase);
		String offset = program.getOffsetVariableName();
		serializer.branch(access + "." + LlvmInstance.VALID_FIELD, emit, skip);
		serializer.label(emit);
		int fieldOffset = 0;
		for (Map.Entry<String, Integer> field : instance.getHeaderType().getFields().entrySet()) {
			String source = access + "." + field.getKey();
			LlvmType type = instance.getFieldType(field.getKey());
			if (type.isArray()) {
				for (int i = 0; i < type.getArrayLength(); i++) {
					serializer.store(
							source + "[" + i + "]",
							program.getPacketName(),
							offset + " + " + (fieldOffset + 8 * i),
							Math.min(8, field.getValue() - 8 * i));
				}
			} else {
				serializer.store(source, program.getPacketName(), offset + " + " + fieldOffset, field.getValue());
			}
			fieldOffset += field.getValue();
		}
		serializer.assign(offset, offset + " + " + instance.getWidth());
		serializer.label(skip);
	}
}

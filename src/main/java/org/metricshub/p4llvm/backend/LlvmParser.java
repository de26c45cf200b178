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

import java.util.List;
import java.util.Map;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4Node;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * One state of the parser. Its code is labeled with the state name, reads
 * the extracted headers from the packet at the bit cursor and jumps to the
 * next state.
 */
public class LlvmParser {

	private final P4ParseState parseState;

	LlvmParser(P4ParseState parseState) {
		this.parseState = parseState;
	}

	public String getName() {
		return parseState.getName();
	}

	public P4ParseState getParseState() {
		return parseState;
	}

	public void serialize(ProgramSerializer serializer, LlvmProgram program) {
		serializer.label(program.getLabel(parseState));
		for (String extract : parseState.getExtracts()) {
			emitExtract(serializer, program, extract);
		}
		for (P4ParseState.SetStatement set : parseState.getSetStatements()) {
			serializer.assign(program.translate(set.getTarget()), program.translate(set.getValue()));
		}
		emitTransition(serializer, program);
	}

	private void emitExtract(ProgramSerializer serializer, LlvmProgram program, String extract) {
		String baseName = extract;
		String index = LlvmHeaderStack.NEXT;
		int bracket = extract.indexOf('[');
		if (bracket >= 0 && extract.endsWith("]")) {
			baseName = extract.substring(0, bracket);
			index = extract.substring(bracket + 1, extract.length() - 1).trim();
		}

		LlvmInstance instance;
		LlvmHeaderStack stack = null;
		String access;
		if (program.hasStackInstance(baseName)) {
			stack = program.getStackInstance(baseName);
			instance = stack;
			String indexVariable = stack.getIndexVariable();
			if (LlvmHeaderStack.NEXT.equals(index)) {
				String indexOk = program.freshName(getName() + "_" + baseName + "_indexOk");
				serializer.branch(
						indexVariable + " > " + stack.getMaxIndex(),
						program.getErrorLabel(ErrorCode.INDEX_OUT_OF_BOUNDS),
						indexOk);
				serializer.label(indexOk);
				access = stack.getElementAccess(LlvmHeaderStack.NEXT);
			} else if (LlvmHeaderStack.LAST.equals(index)) {
				throw new NotSupportedException("extraction into the last element of stack", baseName);
			} else {
				access = stack.getElementAccess(index);
			}
		} else {
			instance = program.getHeaderInstance(extract);
			access = instance.getAccessPath();
		}

		String offset = program.getOffsetVariableName();
		int width = instance.getWidth();
		serializer.comment("extract " + extract);
		String inPacket = program.freshName(getName() + "_" + instance.getName() + "_inPacket");
		serializer.branch(
				offset + " + " + width + " > " + program.getPacketSizeName() + " * 8",
				program.getErrorLabel(ErrorCode.OUT_OF_PACKET),
				inPacket);
		serializer.label(inPacket);

		int fieldOffset = 0;
		for (Map.Entry<String, Integer> field : instance.getHeaderType().getFields().entrySet()) {
			String target = access + "." + field.getKey();
			LlvmType type = instance.getFieldType(field.getKey());
			if (type.isArray()) {
				for (int i = 0; i < type.getArrayLength(); i++) {
					int chunk = Math.min(8, field.getValue() - 8 * i);
					serializer.load(
							target + "[" + i + "]",
							program.getPacketName(),
							offset + " + " + (fieldOffset + 8 * i),
							chunk);
				}
			} else {
				serializer.load(target, program.getPacketName(), offset + " + " + fieldOffset, field.getValue());
			}
			fieldOffset += field.getValue();
		}
		serializer.assign(access + "." + LlvmInstance.VALID_FIELD, "1");
		serializer.assign(offset, offset + " + " + width);

		if (stack != null) {
			if (LlvmHeaderStack.NEXT.equals(index)) {
				serializer.assign(stack.getIndexVariable(), stack.getIndexVariable() + " + 1");
			} else {
				serializer.assign(stack.getIndexVariable(), String.valueOf(Integer.parseInt(index) + 1));
			}
		}
	}

	private void emitTransition(ProgramSerializer serializer, LlvmProgram program) {
		Map<String, P4Node> transitions = parseState.getTransitions();
		if (transitions.isEmpty()) {
			serializer.gotoLabel(program.getLabel(null));
			return;
		}
		List<P4Expression> selectKey = parseState.getSelectKey();
		if (selectKey.isEmpty()) {
			P4Node target = transitions.containsKey(P4ParseState.DEFAULT)
					? transitions.get(P4ParseState.DEFAULT)
					: transitions.values().iterator().next();
			serializer.gotoLabel(program.getLabel(target));
			return;
		}

		String key = program.translate(selectKey.get(0));
		for (int i = 1; i < selectKey.size(); i++) {
			P4Expression component = selectKey.get(i);
			if (!(component instanceof P4Expression.FieldRef)) {
				throw new NotSupportedException("non-field select key component in parse state", getName());
			}
			int width = program.getFieldWidth((P4Expression.FieldRef) component);
			key = "((" + key + " << " + width + ") | " + program.translate(component) + ")";
		}

		serializer.beginSelect(key);
		for (Map.Entry<String, P4Node> transition : transitions.entrySet()) {
			if (P4ParseState.DEFAULT.equals(transition.getKey())) {
				continue;
			}
			if (transition.getKey().contains("&&&")) {
				throw new NotSupportedException("masked select value in parse state", getName());
			}
			serializer.selectCase(transition.getKey(), program.getLabel(transition.getValue()));
		}
		if (transitions.containsKey(P4ParseState.DEFAULT)) {
			serializer.selectDefault(program.getLabel(transitions.get(P4ParseState.DEFAULT)));
		} else {
			serializer.selectDefault(program.getErrorLabel(ErrorCode.UNHANDLED_SELECT));
		}
		serializer.endSelect();
	}
}

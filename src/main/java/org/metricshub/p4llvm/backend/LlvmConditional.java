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

import org.metricshub.p4llvm.hlir.P4ConditionalNode;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * A two-way branch of the pipeline.
 */
public class LlvmConditional implements ControlFlowUnit {

	private final P4ConditionalNode hlirNode;
	private final LlvmProgram program;

	LlvmConditional(P4ConditionalNode hlirNode, LlvmProgram program) {
		this.hlirNode = hlirNode;
		this.program = program;
	}

	public String getName() {
		return hlirNode.getName();
	}

	@Override
	public P4ConditionalNode getNode() {
		return hlirNode;
	}

	public LlvmProgram getProgram() {
		return program;
	}

	@Override
	public void serializeControlFlow(ProgramSerializer serializer, LlvmProgram program, P4ControlFlowNode nextEntryPoint) {
		serializer.label(program.getLabel(hlirNode));
		if (hlirNode.getDescription() != null) {
			serializer.comment("if " + hlirNode.getDescription());
		}
		String condition = program.translate(hlirNode.getCondition());
		serializer.branch(
				condition,
				program.getLabel(successor(hlirNode.getTrueNext(), nextEntryPoint)),
				program.getLabel(successor(hlirNode.getFalseNext(), nextEntryPoint)));
	}

	private static P4ControlFlowNode successor(P4ControlFlowNode configured, P4ControlFlowNode nextEntryPoint) {
		return configured != null ? configured : nextEntryPoint;
	}
}

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

import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * The code of one node of the match-action pipeline: a table or a
 * conditional.
 */
public interface ControlFlowUnit {

	/**
	 * @return the HLIR node this unit generates code for
	 */
	P4ControlFlowNode getNode();

	/**
	 * Emits the labeled block of the node. Branches without a configured
	 * successor jump to {@code nextEntryPoint}, or to the end of the program
	 * when it is {@code null}.
	 *
	 * @param serializer where to emit
	 * @param program the program owning this unit
	 * @param nextEntryPoint the node following the enclosing pipeline, or {@code null}
	 */
	void serializeControlFlow(ProgramSerializer serializer, LlvmProgram program, P4ControlFlowNode nextEntryPoint);
}

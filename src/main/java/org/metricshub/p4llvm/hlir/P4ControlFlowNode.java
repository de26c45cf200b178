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

import java.util.Collection;
import java.util.Map;

/**
 * A node of the ingress or egress match-action graph.
 * <p>
 * The outgoing edges map a branch selector (an action name, {@code hit},
 * {@code miss}, {@code true} or {@code false}) to the next node. A
 * {@code null} target ends the branch.
 */
public interface P4ControlFlowNode extends P4Node {

	/**
	 * @return the outgoing edges, in declaration order; values may be {@code null}
	 */
	Map<String, P4ControlFlowNode> getNext();

	/**
	 * @return every node this one may continue with, {@code null} for the
	 *         end of a branch; the targets of {@link #getNext()} by default
	 */
	default Collection<P4ControlFlowNode> getSuccessors() {
		return getNext().values();
	}

	/**
	 * Dispatches to the visitor method for this node kind.
	 *
	 * @param visitor the visitor to apply
	 * @param <R> result type
	 * @return the visitor result
	 */
	<R> R accept(ControlFlowNodeVisitor<R> visitor);
}

package org.metricshub.p4llvm.intermediate;

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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.metricshub.p4llvm.hlir.P4Node;
import org.metricshub.p4llvm.hlir.P4ParseState;

/**
 * Issues the generated names of one program: fresh symbols and the labels
 * of control-flow points.
 * <p>
 * Every program being compiled owns its own registry. Names issued by
 * {@link #freshName(String)} never repeat within a registry. Labels are
 * bound to node identity, once, and never change afterwards.
 */
public class NameRegistry {

	/** Label of the end of the pipeline, where the deparser runs. */
	public static final String END = "end";

	private int uniqueNameCounter;
	private final Map<P4Node, String> labels = new IdentityHashMap<P4Node, String>();
	private final Set<String> issued = new HashSet<String>(Collections.singleton(END));

	/**
	 * Generates a fresh name based on the specified base name, by appending
	 * {@code _<counter>}. The counter starts at 0 and grows on every call.
	 * A counter value whose name is already taken, by a parse state label,
	 * is skipped.
	 *
	 * @param base prefix of the name
	 * @return a name this registry never returned before
	 */
	public String freshName(String base) {
		Objects.requireNonNull(base, "base");
		String name;
		do {
			name = base + "_" + uniqueNameCounter;
			uniqueNameCounter++;
		} while (!issued.add(name));
		return name;
	}

	/**
	 * Returns the label of a point in the control flow.
	 * <p>
	 * {@code null} stands for the end of the pipeline and always maps to
	 * {@link #END}. A parse state is labeled with its own name, unless that
	 * name is {@link #END} or was already issued; any other node, and a parse
	 * state whose name is taken, gets a fresh name derived from its name the
	 * first time it is asked for.
	 *
	 * @param node a parse state, a control-flow node, or {@code null}
	 * @return the label of the node, identical on every call
	 */
	public String labelFor(P4Node node) {
		if (node == null) {
			return END;
		}
		String label = labels.get(node);
		if (label == null) {
			if (node instanceof P4ParseState && issued.add(node.getName())) {
				label = node.getName();
			} else {
				label = freshName(node.getName());
			}
			labels.put(node, label);
		}
		return label;
	}

	/**
	 * @param node a node
	 * @return {@code true} if a label was already assigned to this node
	 */
	public boolean hasLabel(P4Node node) {
		return labels.containsKey(node);
	}

	/**
	 * @return the labels assigned so far, keyed by node identity
	 */
	public Map<P4Node, String> getLabels() {
		return Collections.unmodifiableMap(labels);
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The high-level intermediate representation of a P4 program: the immutable
 * input of the backend.
 * <p>
 * Collections keep declaration order. Name uniqueness inside each collection
 * is checked by the consumer, not here, so that an HLIR loaded from an
 * external description can still be diagnosed.
 */
public final class Hlir {

	private final List<P4HeaderType> headerTypes;
	private final List<P4HeaderInstance> headerInstances;
	private final List<P4ParseState> parseStates;
	private final P4ParseState startState;
	private final List<P4Action> actions;
	private final List<P4Table> tables;
	private final List<P4ConditionalNode> conditionals;
	private final List<P4Counter> counters;
	private final List<P4FieldListCalculation> fieldListCalculations;
	private final List<P4ControlFlowNode> ingressEntryPoints;
	private final P4ControlFlowNode egressEntry;
	private final List<String> deparseOrder;

	private Hlir(Builder builder) {
		this.headerTypes = freeze(builder.headerTypes);
		this.headerInstances = freeze(builder.headerInstances);
		this.parseStates = freeze(builder.parseStates);
		this.actions = freeze(builder.actions);
		this.tables = freeze(builder.tables);
		this.conditionals = freeze(builder.conditionals);
		this.counters = freeze(builder.counters);
		this.fieldListCalculations = freeze(builder.fieldListCalculations);
		this.egressEntry = builder.egressEntry;
		this.startState = builder.startState != null
				? builder.startState
				: (parseStates.isEmpty() ? null : parseStates.get(0));
		this.ingressEntryPoints = freeze(
				builder.ingressEntryPoints.isEmpty() ? deriveIngressEntryPoints(parseStates) : builder.ingressEntryPoints);
		this.deparseOrder = freeze(
				builder.deparseOrder.isEmpty() ? deriveDeparseOrder(headerInstances) : builder.deparseOrder);

		for (P4ParseState state : parseStates) {
			state.freeze();
		}
		for (P4Table table : tables) {
			table.freeze();
		}
		for (P4ConditionalNode conditional : conditionals) {
			conditional.freeze();
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/**
	 * Control-flow nodes that parse states transition to, in the order the
	 * transitions are declared. A node reached from several states is listed
	 * once per state.
	 */
	private static List<P4ControlFlowNode> deriveIngressEntryPoints(List<P4ParseState> states) {
		List<P4ControlFlowNode> entries = new ArrayList<P4ControlFlowNode>();
		for (P4ParseState state : states) {
			for (P4Node target : state.getTransitions().values()) {
				if (target instanceof P4ControlFlowNode) {
					entries.add((P4ControlFlowNode) target);
				}
			}
		}
		return entries;
	}

	private static List<String> deriveDeparseOrder(List<P4HeaderInstance> instances) {
		Set<String> order = new LinkedHashSet<String>();
		for (P4HeaderInstance instance : instances) {
			if (!instance.isMetadata()) {
				order.add(instance.getMaxIndex() != null ? instance.getBaseName() : instance.getName());
			}
		}
		return new ArrayList<String>(order);
	}

	public List<P4HeaderType> getHeaderTypes() {
		return headerTypes;
	}

	public List<P4HeaderInstance> getHeaderInstances() {
		return headerInstances;
	}

	public List<P4ParseState> getParseStates() {
		return parseStates;
	}

	/**
	 * @return the state parsing starts in, or {@code null} for a program without parser
	 */
	public P4ParseState getStartState() {
		return startState;
	}

	public List<P4Action> getActions() {
		return actions;
	}

	public List<P4Table> getTables() {
		return tables;
	}

	public List<P4ConditionalNode> getConditionals() {
		return conditionals;
	}

	public List<P4Counter> getCounters() {
		return counters;
	}

	public List<P4FieldListCalculation> getFieldListCalculations() {
		return fieldListCalculations;
	}

	/**
	 * @return control-flow nodes reached at the end of parsing; may contain duplicates
	 */
	public List<P4ControlFlowNode> getIngressEntryPoints() {
		return ingressEntryPoints;
	}

	/**
	 * @return the first node of the egress pipeline, or {@code null} when there is no egress
	 */
	public P4ControlFlowNode getEgressEntry() {
		return egressEntry;
	}

	/**
	 * @return instance names (stack base names for stacks) in the order they are written back
	 */
	public List<String> getDeparseOrder() {
		return deparseOrder;
	}

	/**
	 * Collects the parts of an {@link Hlir}.
	 */
	public static final class Builder {
		private final List<P4HeaderType> headerTypes = new ArrayList<P4HeaderType>();
		private final List<P4HeaderInstance> headerInstances = new ArrayList<P4HeaderInstance>();
		private final List<P4ParseState> parseStates = new ArrayList<P4ParseState>();
		private final List<P4Action> actions = new ArrayList<P4Action>();
		private final List<P4Table> tables = new ArrayList<P4Table>();
		private final List<P4ConditionalNode> conditionals = new ArrayList<P4ConditionalNode>();
		private final List<P4Counter> counters = new ArrayList<P4Counter>();
		private final List<P4FieldListCalculation> fieldListCalculations = new ArrayList<P4FieldListCalculation>();
		private final List<P4ControlFlowNode> ingressEntryPoints = new ArrayList<P4ControlFlowNode>();
		private final List<String> deparseOrder = new ArrayList<String>();
		private P4ParseState startState;
		private P4ControlFlowNode egressEntry;

		private Builder() {}

		public Builder headerType(P4HeaderType type) {
			headerTypes.add(Objects.requireNonNull(type, "type"));
			return this;
		}

		public Builder headerInstance(P4HeaderInstance instance) {
			headerInstances.add(Objects.requireNonNull(instance, "instance"));
			return this;
		}

		/**
		 * Adds every element {@code base[0]} to {@code base[size - 1]} of a header stack.
		 *
		 * @param baseName stack name
		 * @param size number of elements
		 * @param type header layout
		 * @return this builder
		 */
		public Builder headerStack(String baseName, int size, P4HeaderType type) {
			for (int i = 0; i < size; i++) {
				headerInstance(P4HeaderInstance.stackElement(baseName, i, size - 1, type));
			}
			return this;
		}

		public Builder parseState(P4ParseState state) {
			parseStates.add(Objects.requireNonNull(state, "state"));
			return this;
		}

		/**
		 * Selects the start state. Defaults to the first parse state added.
		 *
		 * @param state a state also passed to {@link #parseState(P4ParseState)}
		 * @return this builder
		 */
		public Builder startState(P4ParseState state) {
			this.startState = state;
			return this;
		}

		public Builder action(P4Action action) {
			actions.add(Objects.requireNonNull(action, "action"));
			return this;
		}

		public Builder table(P4Table table) {
			tables.add(Objects.requireNonNull(table, "table"));
			return this;
		}

		public Builder conditional(P4ConditionalNode conditional) {
			conditionals.add(Objects.requireNonNull(conditional, "conditional"));
			return this;
		}

		public Builder counter(P4Counter counter) {
			counters.add(Objects.requireNonNull(counter, "counter"));
			return this;
		}

		public Builder fieldListCalculation(P4FieldListCalculation calculation) {
			fieldListCalculations.add(Objects.requireNonNull(calculation, "calculation"));
			return this;
		}

		/**
		 * Declares an ingress entry point explicitly. Without any explicit entry
		 * point, the entry points are the control-flow nodes parse states
		 * transition to.
		 *
		 * @param node the entry node
		 * @return this builder
		 */
		public Builder ingressEntryPoint(P4ControlFlowNode node) {
			ingressEntryPoints.add(Objects.requireNonNull(node, "node"));
			return this;
		}

		public Builder egressEntry(P4ControlFlowNode node) {
			this.egressEntry = node;
			return this;
		}

		/**
		 * Appends an instance (or stack base name) to the deparse order. Without
		 * an explicit order, all non-metadata instances are written back in
		 * declaration order.
		 *
		 * @param instanceName instance or stack name
		 * @return this builder
		 */
		public Builder deparse(String instanceName) {
			deparseOrder.add(Objects.requireNonNull(instanceName, "instanceName"));
			return this;
		}

		public Hlir build() {
			return new Hlir(this);
		}
	}
}

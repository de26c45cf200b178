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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One state of the parser state machine.
 * <p>
 * A state extracts headers, runs {@code set} statements and then moves to
 * the next state selected by the transition key. A transition target is
 * another parse state, a control-flow node (parsing is over and the ingress
 * pipeline starts there) or {@code null} (the packet goes straight to the
 * end of the program).
 * <p>
 * States are mutable until the owning {@link Hlir} is built, so that cyclic
 * transitions can be wired.
 */
public final class P4ParseState implements P4Node {

	/** Transition value of the default branch. */
	public static final String DEFAULT = "default";

	private final String name;
	private final List<String> extracts = new ArrayList<String>();
	private final List<SetStatement> setStatements = new ArrayList<SetStatement>();
	private final List<P4Expression> selectKey = new ArrayList<P4Expression>();
	private final Map<String, P4Node> transitions = new LinkedHashMap<String, P4Node>();
	private boolean frozen;

	public P4ParseState(String name) {
		this.name = Objects.requireNonNull(name, "name");
	}

	@Override
	public String getName() {
		return name;
	}

	/**
	 * Extracts the named instance from the packet. For a header stack, the
	 * name is the stack base name and the next free element is filled.
	 *
	 * @param instance instance or stack name
	 * @return this state
	 */
	public P4ParseState extract(String instance) {
		checkMutable();
		extracts.add(Objects.requireNonNull(instance, "instance"));
		return this;
	}

	public P4ParseState set(P4Expression.FieldRef target, P4Expression value) {
		checkMutable();
		setStatements.add(new SetStatement(target, value));
		return this;
	}

	/**
	 * Appends an expression to the transition key.
	 *
	 * @param key key component
	 * @return this state
	 */
	public P4ParseState selectOn(P4Expression key) {
		checkMutable();
		selectKey.add(Objects.requireNonNull(key, "key"));
		return this;
	}

	/**
	 * Adds a transition. Use {@link #DEFAULT} as value for the default branch.
	 *
	 * @param value key value selecting this transition
	 * @param target next parse state or control-flow node, or {@code null}
	 * @return this state
	 */
	public P4ParseState transition(String value, P4Node target) {
		checkMutable();
		if (target != null && !(target instanceof P4ParseState) && !(target instanceof P4ControlFlowNode)) {
			throw new IllegalArgumentException("Unsupported transition target " + target.getClass().getName());
		}
		if (transitions.containsKey(value)) {
			throw new IllegalArgumentException("Duplicate transition " + value + " in parse state " + name);
		}
		transitions.put(value, target);
		return this;
	}

	/**
	 * Shorthand for a single unconditional transition.
	 *
	 * @param target next parse state or control-flow node, or {@code null}
	 * @return this state
	 */
	public P4ParseState then(P4Node target) {
		return transition(DEFAULT, target);
	}

	public List<String> getExtracts() {
		return Collections.unmodifiableList(extracts);
	}

	public List<SetStatement> getSetStatements() {
		return Collections.unmodifiableList(setStatements);
	}

	public List<P4Expression> getSelectKey() {
		return Collections.unmodifiableList(selectKey);
	}

	/**
	 * @return transition value to target, in declaration order; targets may be {@code null}
	 */
	public Map<String, P4Node> getTransitions() {
		return Collections.unmodifiableMap(transitions);
	}

	void freeze() {
		frozen = true;
	}

	private void checkMutable() {
		if (frozen) {
			throw new IllegalStateException("Parse state " + name + " belongs to a built HLIR and cannot change");
		}
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * A {@code set_metadata} statement executed while parsing.
	 */
	public static final class SetStatement {
		private final P4Expression.FieldRef target;
		private final P4Expression value;

		SetStatement(P4Expression.FieldRef target, P4Expression value) {
			this.target = Objects.requireNonNull(target, "target");
			this.value = Objects.requireNonNull(value, "value");
		}

		public P4Expression.FieldRef getTarget() {
			return target;
		}

		public P4Expression getValue() {
			return value;
		}
	}
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A two-way branch of the match-action graph.
 */
public final class P4ConditionalNode implements P4ControlFlowNode {

	public static final String TRUE = "true";
	public static final String FALSE = "false";

	private final String name;
	private final P4Expression condition;
	private final String description;
	private final Map<String, P4ControlFlowNode> next = new LinkedHashMap<String, P4ControlFlowNode>();
	private boolean frozen;

	public P4ConditionalNode(String name, P4Expression condition) {
		this(name, condition, null);
	}

	/**
	 * @param name node name
	 * @param condition branch condition
	 * @param description source text of the condition, or {@code null}
	 */
	public P4ConditionalNode(String name, P4Expression condition, String description) {
		this.name = Objects.requireNonNull(name, "name");
		this.condition = Objects.requireNonNull(condition, "condition");
		this.description = description;
		next.put(TRUE, null);
		next.put(FALSE, null);
	}

	@Override
	public String getName() {
		return name;
	}

	public P4Expression getCondition() {
		return condition;
	}

	/**
	 * @return the condition as written in the source program, or its
	 *         structural rendering when no source text was given
	 */
	public String getDescription() {
		return description != null ? description : condition.toString();
	}

	public P4ConditionalNode whenTrue(P4ControlFlowNode target) {
		checkMutable();
		next.put(TRUE, target);
		return this;
	}

	public P4ConditionalNode whenFalse(P4ControlFlowNode target) {
		checkMutable();
		next.put(FALSE, target);
		return this;
	}

	public P4ControlFlowNode getTrueNext() {
		return next.get(TRUE);
	}

	public P4ControlFlowNode getFalseNext() {
		return next.get(FALSE);
	}

	@Override
	public Map<String, P4ControlFlowNode> getNext() {
		return Collections.unmodifiableMap(next);
	}

	@Override
	public <R> R accept(ControlFlowNodeVisitor<R> visitor) {
		return visitor.visitConditional(this);
	}

	void freeze() {
		frozen = true;
	}

	private void checkMutable() {
		if (frozen) {
			throw new IllegalStateException("Conditional " + name + " belongs to a built HLIR and cannot change");
		}
	}

	@Override
	public String toString() {
		return name;
	}
}

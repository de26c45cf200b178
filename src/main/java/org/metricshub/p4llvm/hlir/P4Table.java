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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A match-action table.
 * <p>
 * The outgoing edges are keyed either by action name or by {@link #HIT} and
 * {@link #MISS}. A branch with no configured edge falls through to whatever
 * follows the enclosing pipeline.
 */
public final class P4Table implements P4ControlFlowNode {

	public static final String HIT = "hit";
	public static final String MISS = "miss";

	/** Size used when the source program does not declare one. */
	public static final int DEFAULT_SIZE = 1024;

	private final String name;
	private final List<P4MatchKey> keys = new ArrayList<P4MatchKey>();
	private final List<String> actions = new ArrayList<String>();
	private final Map<String, P4ControlFlowNode> next = new LinkedHashMap<String, P4ControlFlowNode>();
	private P4ControlFlowNode defaultNext;
	private String defaultAction;
	private List<String> defaultActionData = Collections.emptyList();
	private int size = DEFAULT_SIZE;
	private boolean frozen;

	public P4Table(String name) {
		this.name = Objects.requireNonNull(name, "name");
	}

	@Override
	public String getName() {
		return name;
	}

	public P4Table matchOn(P4Expression target, P4MatchKey.MatchType matchType) {
		checkMutable();
		keys.add(new P4MatchKey(target, matchType));
		return this;
	}

	public P4Table action(String actionName) {
		checkMutable();
		if (actions.contains(actionName)) {
			throw new IllegalArgumentException("Table " + name + " lists action " + actionName + " twice");
		}
		actions.add(actionName);
		return this;
	}

	/**
	 * Sets the action run on a miss.
	 *
	 * @param actionName one of the actions of the table
	 * @param data constant values of the action parameters
	 * @return this table
	 */
	public P4Table defaultAction(String actionName, String... data) {
		checkMutable();
		this.defaultAction = actionName;
		this.defaultActionData = Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(data)));
		return this;
	}

	public P4Table size(int maxEntries) {
		checkMutable();
		if (maxEntries <= 0) {
			throw new IllegalArgumentException("Table " + name + " must have a positive size");
		}
		this.size = maxEntries;
		return this;
	}

	/**
	 * Adds an outgoing edge.
	 *
	 * @param selector action name, {@link #HIT} or {@link #MISS}
	 * @param target next node, or {@code null} to end the branch
	 * @return this table
	 */
	public P4Table next(String selector, P4ControlFlowNode target) {
		checkMutable();
		next.put(Objects.requireNonNull(selector, "selector"), target);
		return this;
	}

	/**
	 * Sets where the table continues when no action runs: the lookup
	 * missed and there is no default action, or the entry names an action
	 * the table does not know.
	 *
	 * @param target next node, or {@code null} to fall through like an
	 *        unconfigured branch
	 * @return this table
	 */
	public P4Table defaultNext(P4ControlFlowNode target) {
		checkMutable();
		this.defaultNext = target;
		return this;
	}

	public List<P4MatchKey> getKeys() {
		return Collections.unmodifiableList(keys);
	}

	public List<String> getActions() {
		return Collections.unmodifiableList(actions);
	}

	/**
	 * @return the action run on a miss, or {@code null} if a miss runs nothing
	 */
	public String getDefaultAction() {
		return defaultAction;
	}

	public List<String> getDefaultActionData() {
		return defaultActionData;
	}

	public int getSize() {
		return size;
	}

	/**
	 * @return {@code true} when the edges are keyed by {@link #HIT}/{@link #MISS}
	 *         rather than by action name
	 */
	public boolean isHitMissSelected() {
		return next.containsKey(HIT) || next.containsKey(MISS);
	}

	/**
	 * @return where the table continues when no action runs, or {@code null}
	 */
	public P4ControlFlowNode getDefaultNext() {
		return defaultNext;
	}

	@Override
	public Map<String, P4ControlFlowNode> getNext() {
		return Collections.unmodifiableMap(next);
	}

	@Override
	public Collection<P4ControlFlowNode> getSuccessors() {
		List<P4ControlFlowNode> successors = new ArrayList<P4ControlFlowNode>(next.values());
		successors.add(defaultNext);
		return successors;
	}

	@Override
	public <R> R accept(ControlFlowNodeVisitor<R> visitor) {
		return visitor.visitTable(this);
	}

	void freeze() {
		frozen = true;
	}

	private void checkMutable() {
		if (frozen) {
			throw new IllegalStateException("Table " + name + " belongs to a built HLIR and cannot change");
		}
	}

	@Override
	public String toString() {
		return name;
	}
}

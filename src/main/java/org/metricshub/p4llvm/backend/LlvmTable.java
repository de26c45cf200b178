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
import java.util.List;
import java.util.Locale;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4MatchKey;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * A match-action table.
 * <p>
 * Every table comes with a one-entry companion table,
 * {@code <table>_defaultAction}, keyed by the zero key, which holds the
 * entry applied on a miss. A table without match keys only consults its
 * companion.
 */
public class LlvmTable implements ControlFlowUnit {

	/** Member of the value struct holding the action identifier. */
	static final String ACTION_FIELD = "action";

	/** Member of the key struct holding the prefix length of LPM lookups. */
	static final String PREFIX_LENGTH_FIELD = "prefixlen";

	private final P4Table hlirTable;
	private final LlvmProgram program;
	private final List<LlvmAction> actions = new ArrayList<LlvmAction>();
	private final List<String> keyMembers = new ArrayList<String>();
	private final List<LlvmType> keyTypes = new ArrayList<LlvmType>();
	private final boolean longestPrefixMatch;
	private final String keyVariable;
	private final String valueVariable;
	private final String hitVariable;

	/**
	 * @throws NotSupportedException for ternary and range matches
	 * @throws org.metricshub.p4llvm.EntityNotFoundException if an action is not declared
	 */
	LlvmTable(P4Table hlirTable, LlvmProgram program) {
		this.hlirTable = hlirTable;
		this.program = program;

		boolean lpm = false;
		for (P4MatchKey key : hlirTable.getKeys()) {
			switch (key.getMatchType()) {
			case TERNARY:
			case RANGE:
				throw new NotSupportedException(key.getMatchType().name().toLowerCase(Locale.ROOT) + " match in table", getName());
			case LPM:
				lpm = true;
				keyMembers.add(memberName(key.getTarget()));
				keyTypes.add(program.getTypeFactory().forWidth(program.getFieldWidth((P4Expression.FieldRef) key.getTarget())));
				break;
			case VALID:
				keyMembers.add(memberName(key.getTarget()));
				keyTypes.add(program.getTypeFactory().forWidth(8));
				break;
			default:
				keyMembers.add(memberName(key.getTarget()));
				keyTypes.add(program.getTypeFactory().forWidth(program.getFieldWidth((P4Expression.FieldRef) key.getTarget())));
				break;
			}
		}
		this.longestPrefixMatch = lpm;

		if (hlirTable.getActions().isEmpty()) {
			throw new CompilationException(false, "Table {0} has no action", getName());
		}
		for (String actionName : hlirTable.getActions()) {
			LlvmAction action = program.getAction(actionName);
			if (action.isInternal()) {
				program.emitWarning("Table {0} runs compiler-injected action {1}", getName(), actionName);
			}
			actions.add(action);
		}
		String defaultAction = hlirTable.getDefaultAction();
		if (defaultAction != null && !hlirTable.getActions().contains(defaultAction)) {
			throw new CompilationException(false, "Default action {0} of table {1} is not one of its actions", defaultAction, getName());
		}

		this.keyVariable = hasKeys() ? program.freshName(getName() + "_key") : null;
		this.valueVariable = program.freshName(getName() + "_value");
		this.hitVariable = program.freshName(getName() + "_hit");
	}

	private static String memberName(P4Expression target) {
		String text;
		if (target instanceof P4Expression.FieldRef) {
			P4Expression.FieldRef field = (P4Expression.FieldRef) target;
			text = field.getInstance() + "_" + field.getField();
		} else {
			text = ((P4Expression.HeaderRef) target).getInstance() + "_" + LlvmInstance.VALID_FIELD;
		}
		return text.replaceAll("[^A-Za-z0-9_]", "_");
	}

	public String getName() {
		return hlirTable.getName();
	}

	@Override
	public P4Table getNode() {
		return hlirTable;
	}

	public LlvmProgram getProgram() {
		return program;
	}

	public List<LlvmAction> getActions() {
		return actions;
	}

	public boolean hasKeys() {
		return !hlirTable.getKeys().isEmpty();
	}

	public String getKeyTypeName() {
		return getName() + "_key";
	}

	public String getValueTypeName() {
		return getName() + "_value";
	}

	public String getDefaultTableName() {
		return getName() + "_defaultAction";
	}

	/**
	 * @param action one of the actions of this table
	 * @return the enumeration constant identifying the action in table entries
	 */
	public String getActionConstant(LlvmAction action) {
		return (getName() + "_ACTION_" + action.getName()).toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
	}

	/**
	 * Declares the key and value types, the action enumeration, the table and
	 * its companion default table.
	 */
	public void serialize(ProgramSerializer serializer, LlvmProgram program) {
		serializer.comment("table " + getName());
		if (hasKeys()) {
			serializer.beginStruct(getKeyTypeName());
			if (longestPrefixMatch) {
				serializer.structField("uint32_t", PREFIX_LENGTH_FIELD, 0);
			}
			for (int i = 0; i < keyMembers.size(); i++) {
				keyTypes.get(i).declare(serializer, keyMembers.get(i));
			}
			serializer.endStruct();
		}

		List<String> constants = new ArrayList<String>();
		for (LlvmAction action : actions) {
			constants.add(getActionConstant(action));
		}
		serializer.declareEnum(getName() + "_actions", constants);

		serializer.beginStruct(getValueTypeName());
		serializer.structField("uint32_t", ACTION_FIELD, 0);
		for (LlvmAction action : actions) {
			if (action.hasParameters()) {
				serializer.structField("struct " + action.getParameterStructName(), action.getName(), 0);
			}
		}
		serializer.endStruct();

		if (hasKeys()) {
			serializer.declareTable(getName(), "struct " + getKeyTypeName(), "struct " + getValueTypeName(), hlirTable.getSize());
		}
		if (hlirTable.getDefaultAction() != null) {
			serializer.comment(
					"default action " + hlirTable.getDefaultAction() + "(" + String.join(", ", hlirTable.getDefaultActionData())
							+ ")");
		}
		serializer.declareTable(getDefaultTableName(), "uint32_t", "struct " + getValueTypeName(), 1);
	}

	/**
	 * Declares the per-packet variables of the table.
	 */
	void declareVariables(ProgramSerializer serializer) {
		if (hasKeys()) {
			serializer.declareVariable("struct " + getKeyTypeName(), keyVariable, "{ 0 }");
		}
		serializer.declareVariable("struct " + getValueTypeName() + " *", valueVariable, "NULL");
		if (hlirTable.isHitMissSelected()) {
			serializer.declareVariable("uint8_t", hitVariable, "0");
		}
	}

	@Override
	public void serializeControlFlow(ProgramSerializer serializer, LlvmProgram program, P4ControlFlowNode nextEntryPoint) {
		boolean hitMiss = hlirTable.isHitMissSelected();
		serializer.label(program.getLabel(hlirTable));
		serializer.comment("apply " + getName());

		String dispatch = program.freshName(getName() + "_dispatch");
		String noAction = program.freshName(getName() + "_noAction");
		String selectNext = hitMiss ? program.freshName(getName() + "_select") : null;

		if (hasKeys()) {
			int prefixLength = 0;
			for (int i = 0; i < keyMembers.size(); i++) {
				P4MatchKey key = hlirTable.getKeys().get(i);
				String value = program.translate(key.getTarget());
				if (key.getMatchType() == P4MatchKey.MatchType.VALID) {
					value = value + "." + LlvmInstance.VALID_FIELD;
				}
				serializer.assign(keyVariable + "." + keyMembers.get(i), value);
				prefixLength += keyTypes.get(i).getWidthInBits();
			}
			if (longestPrefixMatch) {
				serializer.assign(keyVariable + "." + PREFIX_LENGTH_FIELD, String.valueOf(prefixLength));
			}
			if (hitMiss) {
				serializer.assign(hitVariable, "1");
			}
			String miss = program.freshName(getName() + "_miss");
			serializer.lookup(getName(), keyVariable, valueVariable);
			serializer.branch(valueVariable + " == NULL", miss, dispatch);
			serializer.label(miss);
		}
		if (hitMiss) {
			serializer.assign(hitVariable, "0");
		}
		serializer.lookup(getDefaultTableName(), program.getZeroKeyName(), valueVariable);
		serializer.branch(valueVariable + " == NULL", noAction, dispatch);

		serializer.label(dispatch);
		List<String> actionLabels = new ArrayList<String>();
		serializer.beginSelect(valueVariable + "->" + ACTION_FIELD);
		for (LlvmAction action : actions) {
			String actionLabel = program.freshName(getName() + "_" + action.getName());
			actionLabels.add(actionLabel);
			serializer.selectCase(getActionConstant(action), actionLabel);
		}
		serializer.selectDefault(noAction);
		serializer.endSelect();

		for (int i = 0; i < actions.size(); i++) {
			LlvmAction action = actions.get(i);
			serializer.label(actionLabels.get(i));
			if (action.hasParameters()) {
				serializer.assign(program.getActionDataName(), "&" + valueVariable + "->" + action.getName());
			}
			action.serialize(serializer, program);
			serializer.gotoLabel(hitMiss ? selectNext : successorLabel(program, action.getName(), nextEntryPoint));
		}

		serializer.label(noAction);
		if (hitMiss) {
			serializer.gotoLabel(selectNext);
		} else {
			P4ControlFlowNode defaultNext = hlirTable.getDefaultNext();
			serializer.gotoLabel(program.getLabel(defaultNext != null ? defaultNext : nextEntryPoint));
		}

		if (hitMiss) {
			serializer.label(selectNext);
			serializer.branch(
					hitVariable,
					successorLabel(program, P4Table.HIT, nextEntryPoint),
					successorLabel(program, P4Table.MISS, nextEntryPoint));
		}
	}

	private String successorLabel(LlvmProgram program, String selector, P4ControlFlowNode nextEntryPoint) {
		P4ControlFlowNode target = hlirTable.getNext().get(selector);
		return program.getLabel(target != null ? target : nextEntryPoint);
	}
}

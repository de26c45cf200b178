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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One emission call recorded by a {@link DirectiveList}: a
 * {@link DirectiveKind} and its operands.
 * <p>
 * Operands are either {@link String} or {@link Long}; which one is documented
 * on the kind.
 *
 * @see DirectiveList
 */
public final class Directive {

	private final DirectiveKind kind;
	private final List<Object> operands;

	Directive(DirectiveKind kind, Object... operands) {
		this.kind = kind;
		for (Object operand : operands) {
			assert (operand instanceof String) || (operand instanceof Long) : "Invalid operand " + operand + " for "
					+ kind;
		}
		this.operands = Collections.unmodifiableList(new ArrayList<Object>(Arrays.asList(operands)));
	}

	public DirectiveKind getKind() {
		return kind;
	}

	public int getOperandCount() {
		return operands.size();
	}

	public List<Object> getOperands() {
		return operands;
	}

	/**
	 * @param index operand position
	 * @return the operand as a string
	 * @throws Error if the operand is not a string
	 */
	public String stringArg(int index) {
		Object operand = operands.get(index);
		if (operand instanceof String) {
			return (String) operand;
		}
		throw new Error("Invalid arg type: " + typeOf(operand) + ", arg_idx = " + index + ", directive = " + this);
	}

	/**
	 * @param index operand position
	 * @return the operand as a number
	 * @throws Error if the operand is not a number
	 */
	public long longArg(int index) {
		Object operand = operands.get(index);
		if (operand instanceof Long) {
			return (Long) operand;
		}
		throw new Error("Invalid arg type: " + typeOf(operand) + ", arg_idx = " + index + ", directive = " + this);
	}

	/**
	 * @return the string operands from {@code fromIndex} to the end
	 */
	public List<String> stringArgs(int fromIndex) {
		List<String> result = new ArrayList<String>();
		for (int i = fromIndex; i < operands.size(); i++) {
			result.add(stringArg(i));
		}
		return result;
	}

	/**
	 * @return the labels this directive jumps to, in operand order
	 */
	public List<String> targetLabels() {
		List<String> labels = new ArrayList<String>();
		for (int index : kind.getLabelOperands()) {
			labels.add(stringArg(index));
		}
		return labels;
	}

	private static String typeOf(Object operand) {
		return operand == null ? "null" : operand.getClass().getSimpleName();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(kind.name());
		for (Object operand : operands) {
			sb.append(", ");
			if (operand instanceof String) {
				sb.append('"').append(operand).append('"');
			} else {
				sb.append(operand);
			}
		}
		return sb.toString();
	}
}

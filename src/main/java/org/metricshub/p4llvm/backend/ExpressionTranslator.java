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

import java.util.HashMap;
import java.util.Map;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.hlir.P4Expression;

/**
 * Renders HLIR expressions as expressions of the generated program.
 * <p>
 * Instance references resolve through the program's lookup registries.
 * Action parameters are only meaningful inside an action body, where they
 * are read through the action-data pointer.
 */
class ExpressionTranslator implements P4Expression.Visitor<String> {

	private static final Map<String, String> OPERATORS = new HashMap<String, String>();

	static {
		OPERATORS.put("and", "&&");
		OPERATORS.put("or", "||");
		OPERATORS.put("not", "!");
		OPERATORS.put("xor", "^");
	}

	private final LlvmProgram program;
	private final LlvmAction action;

	/**
	 * @param program owner of the instances referenced
	 * @param action action whose parameters may be referenced, or {@code null}
	 */
	ExpressionTranslator(LlvmProgram program, LlvmAction action) {
		this.program = program;
		this.action = action;
	}

	String translate(P4Expression expression) {
		return expression.accept(this);
	}

	@Override
	public String visitField(P4Expression.FieldRef field) {
		return program.getFieldAccess(field.getInstance(), field.getField());
	}

	@Override
	public String visitHeader(P4Expression.HeaderRef header) {
		return program.getInstanceAccess(header.getInstance());
	}

	@Override
	public String visitParameter(P4Expression.ParameterRef parameter) {
		if (action == null) {
			throw new CompilationException(false, "Parameter {0} used outside of an action", parameter.getName());
		}
		return action.getParameterAccess(parameter.getName(), program.getActionDataName());
	}

	@Override
	public String visitCounter(P4Expression.CounterRef counter) {
		return program.getCounter(counter.getName()).getName();
	}

	@Override
	public String visitConstant(P4Expression.Constant constant) {
		return constant.getText();
	}

	@Override
	public String visitOperation(P4Expression.Operation operation) {
		String operator = operation.getOperator();
		if (P4Expression.Operation.VALID.equals(operator)) {
			return "(" + translate(operation.getRight()) + "." + LlvmInstance.VALID_FIELD + " != 0)";
		}
		if ("d2b".equals(operator) || "b2d".equals(operator)) {
			return translate(operation.getRight());
		}
		String rendered = OPERATORS.containsKey(operator) ? OPERATORS.get(operator) : operator;
		if (operation.isUnary()) {
			return "(" + rendered + translate(operation.getRight()) + ")";
		}
		return "(" + translate(operation.getLeft()) + " " + rendered + " " + translate(operation.getRight()) + ")";
	}

	@Override
	public String visitTernary(P4Expression.Ternary ternary) {
		return "(" + translate(ternary.getCondition()) + " ? " + translate(ternary.getIfTrue()) + " : "
				+ translate(ternary.getIfFalse()) + ")";
	}
}

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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.P4Action;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4PrimitiveCall;
import org.metricshub.p4llvm.intermediate.ProgramSerializer;

/**
 * A compound action. Its body is emitted inline in every table that can
 * run it; its parameters are read from the table entry through the
 * action-data pointer.
 */
public class LlvmAction {

	/** Primitive name to accepted argument counts. */
	private static final Map<String, List<Integer>> PRIMITIVES = new HashMap<String, List<Integer>>();

	static {
		PRIMITIVES.put("modify_field", Arrays.asList(2, 3));
		PRIMITIVES.put("add_to_field", Collections.singletonList(2));
		PRIMITIVES.put("subtract_from_field", Collections.singletonList(2));
		PRIMITIVES.put("add", Collections.singletonList(3));
		PRIMITIVES.put("subtract", Collections.singletonList(3));
		PRIMITIVES.put("drop", Collections.singletonList(0));
		PRIMITIVES.put("mark_for_drop", Collections.singletonList(0));
		PRIMITIVES.put("no_op", Collections.singletonList(0));
		PRIMITIVES.put("add_header", Collections.singletonList(1));
		PRIMITIVES.put("remove_header", Collections.singletonList(1));
		PRIMITIVES.put("count", Collections.singletonList(2));
	}

	private final P4Action hlirAction;
	private final LlvmProgram program;

	/**
	 * @throws NotSupportedException if the body calls an unknown primitive
	 * @throws CompilationException if a primitive has the wrong number of arguments
	 */
	LlvmAction(P4Action hlirAction, LlvmProgram program) {
		this.hlirAction = hlirAction;
		this.program = program;
		for (P4PrimitiveCall call : hlirAction.getBody()) {
			List<Integer> arities = PRIMITIVES.get(call.getName());
			if (arities == null) {
				throw new NotSupportedException("primitive", call.getName());
			}
			if (!arities.contains(call.getArguments().size())) {
				throw new CompilationException(
						false,
						"Primitive {0} in action {1} expects {2} arguments, got {3}",
						call.getName(),
						getName(),
						arities,
						call.getArguments().size());
			}
		}
	}

	/**
	 * @param name a primitive name
	 * @return whether action bodies may call it
	 */
	public static boolean isSupportedPrimitive(String name) {
		return PRIMITIVES.containsKey(name);
	}

	public String getName() {
		return hlirAction.getName();
	}

	public P4Action getHlirAction() {
		return hlirAction;
	}

	public LlvmProgram getProgram() {
		return program;
	}

	/**
	 * Tells whether the action was injected by the compiler. This relies on
	 * the negative line number convention of the front end and is only used
	 * for diagnostics.
	 *
	 * @return {@code true} for compiler-injected actions
	 */
	public boolean isInternal() {
		return LlvmProgram.isInternalAction(hlirAction);
	}

	public boolean hasParameters() {
		return !hlirAction.getParameters().isEmpty();
	}

	/**
	 * @return name of the struct holding the parameters in a table entry
	 */
	public String getParameterStructName() {
		return getName() + "_params";
	}

	/**
	 * @param parameter parameter name
	 * @param actionData name of the action-data pointer
	 * @return the expression reading the parameter
	 * @throws CompilationException if the action has no such parameter
	 */
	String getParameterAccess(String parameter, String actionData) {
		if (!hlirAction.getParameters().containsKey(parameter)) {
			throw new CompilationException(false, "Action {0} has no parameter named {1}", getName(), parameter);
		}
		return "((struct " + getParameterStructName() + " *) " + actionData + ")->" + parameter;
	}

	/**
	 * Declares the parameter struct, if the action has parameters.
	 *
	 * @param serializer where to emit
	 */
	public void declareParameters(ProgramSerializer serializer) {
		if (!hasParameters()) {
			return;
		}
		serializer.beginStruct(getParameterStructName());
		for (Map.Entry<String, Integer> parameter : hlirAction.getParameters().entrySet()) {
			program.getTypeFactory().forWidth(parameter.getValue()).declare(serializer, parameter.getKey());
		}
		serializer.endStruct();
	}

	/**
	 * Emits the statements of the action body.
	 *
	 * @param serializer where to emit
	 * @param program the owning program
	 */
	public void serialize(ProgramSerializer serializer, LlvmProgram program) {
		ExpressionTranslator translator = new ExpressionTranslator(program, this);
		serializer.comment("action " + getName());
		for (P4PrimitiveCall call : hlirAction.getBody()) {
			List<P4Expression> arguments = call.getArguments();
			String name = call.getName();
			if ("modify_field".equals(name)) {
				String target = translator.translate(arguments.get(0));
				String value = translator.translate(arguments.get(1));
				if (arguments.size() == 3) {
					String mask = translator.translate(arguments.get(2));
					value = "((" + target + " & ~" + mask + ") | (" + value + " & " + mask + "))";
				}
				serializer.assign(target, value);
			} else if ("add_to_field".equals(name) || "subtract_from_field".equals(name)) {
				String target = translator.translate(arguments.get(0));
				String operator = "add_to_field".equals(name) ? " + " : " - ";
				serializer.assign(target, target + operator + translator.translate(arguments.get(1)));
			} else if ("add".equals(name) || "subtract".equals(name)) {
				String operator = "add".equals(name) ? " + " : " - ";
				serializer.assign(
						translator.translate(arguments.get(0)),
						translator.translate(arguments.get(1)) + operator + translator.translate(arguments.get(2)));
			} else if ("drop".equals(name) || "mark_for_drop".equals(name)) {
				serializer.assign(program.getDropBitName(), "1");
			} else if ("add_header".equals(name) || "remove_header".equals(name)) {
				String header = translator.translate(arguments.get(0));
				serializer.assign(header + "." + LlvmInstance.VALID_FIELD, "add_header".equals(name) ? "1" : "0");
			} else if ("count".equals(name)) {
				LlvmCounter counter = program.getCounter(counterName(arguments.get(0)));
				String cell = counter.getName() + "[" + translator.translate(arguments.get(1)) + "]";
				serializer.assign(cell, cell + " + " + counter.getIncrement(program));
			}
			// no_op emits nothing
		}
	}

	private String counterName(P4Expression argument) {
		if (argument instanceof P4Expression.CounterRef) {
			return ((P4Expression.CounterRef) argument).getName();
		}
		throw new CompilationException(false, "First argument of count in action {0} must be a counter: {1}", getName(), argument);
	}

	@Override
	public String toString() {
		return getName();
	}
}

package org.metricshub.p4llvm.frontend;

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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4Action;
import org.metricshub.p4llvm.hlir.P4ConditionalNode;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Counter;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4FieldListCalculation;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.hlir.P4HeaderType;
import org.metricshub.p4llvm.hlir.P4MatchKey;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4PrimitiveCall;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.util.HlirSource;
import org.metricshub.p4llvm.util.P4Logger;
import org.slf4j.Logger;

/**
 * Loads an {@link Hlir} from the JSON description of a P4 program, in the
 * layout produced for the behavioral model: {@code header_types},
 * {@code headers}, {@code header_stacks}, {@code parsers}, {@code actions},
 * {@code pipelines} (named {@code ingress} and {@code egress}),
 * {@code counter_arrays}, {@code calculations} and {@code deparsers}.
 * <p>
 * A parse transition to {@code null} ends parsing and enters the ingress
 * pipeline at its {@code init_table}.
 */
public class HlirJsonReader {

	private static final Logger LOGGER = P4Logger.getLogger(HlirJsonReader.class);

	private static final Pattern STACK_ELEMENT = Pattern.compile("(.+)\\[(\\d+)\\]");

	static final String HIT_SELECTOR = "__HIT__";
	static final String MISS_SELECTOR = "__MISS__";

	/**
	 * Reads and converts a JSON description. The reader of the source is
	 * closed afterwards.
	 *
	 * @param source the description
	 * @return the program
	 * @throws IOException if the source cannot be read
	 * @throws CompilationException if the description is malformed or inconsistent
	 */
	public Hlir read(HlirSource source) throws IOException {
		LOGGER.debug("Reading HLIR from {}", source.getDescription());
		JSONObject document;
		try (Reader reader = source.getReader()) {
			document = new JSONObject(new JSONTokener(reader));
		} catch (JSONException e) {
			throw new CompilationException(false, "Invalid JSON in " + source.getDescription() + ": " + e.getMessage(), e);
		}
		return read(document);
	}

	/**
	 * Converts a parsed JSON description.
	 *
	 * @param document the description
	 * @return the program
	 * @throws CompilationException if the description is inconsistent
	 */
	public Hlir read(JSONObject document) {
		try {
			return new Conversion(document).convert();
		} catch (JSONException e) {
			throw new CompilationException(false, "Malformed HLIR description: " + e.getMessage(), e);
		} catch (IllegalArgumentException e) {
			throw new CompilationException(false, "Inconsistent HLIR description: " + e.getMessage(), e);
		}
	}

	/**
	 * The state of one conversion.
	 */
	private static final class Conversion {
		private final JSONObject document;
		private final Hlir.Builder builder = Hlir.builder();
		private final Map<String, P4HeaderType> types = new HashMap<String, P4HeaderType>();
		private final Map<String, Integer> stackSizes = new HashMap<String, Integer>();
		private final Map<Integer, String> actionNamesById = new HashMap<Integer, String>();
		private final Map<String, P4ControlFlowNode> nodes = new HashMap<String, P4ControlFlowNode>();
		private final Map<String, P4ParseState> states = new HashMap<String, P4ParseState>();
		private P4ControlFlowNode ingressEntry;

		Conversion(JSONObject document) {
			this.document = document;
		}

		Hlir convert() {
			convertHeaderTypes();
			convertHeaders();
			convertActions();
			convertCounters();
			convertCalculations();
			convertPipelines();
			convertParser();
			convertDeparser();
			return builder.build();
		}

		private JSONArray array(JSONObject object, String key) {
			JSONArray array = object.optJSONArray(key);
			return array == null ? new JSONArray() : array;
		}

		private void convertHeaderTypes() {
			JSONArray headerTypes = array(document, "header_types");
			for (int i = 0; i < headerTypes.length(); i++) {
				JSONObject json = headerTypes.getJSONObject(i);
				String name = json.getString("name");
				P4HeaderType.Builder type = P4HeaderType.builder(name);
				JSONArray fields = array(json, "fields");
				for (int j = 0; j < fields.length(); j++) {
					JSONArray field = fields.getJSONArray(j);
					Object width = field.get(1);
					if (!(width instanceof Number)) {
						throw new NotSupportedException("variable-length field", name + "." + field.getString(0));
					}
					type.field(field.getString(0), ((Number) width).intValue());
				}
				P4HeaderType built = type.build();
				types.put(name, built);
				builder.headerType(built);
			}
		}

		private P4HeaderType type(String name, String user) {
			P4HeaderType type = types.get(name);
			if (type == null) {
				throw new CompilationException(false, "{0} has unknown header type {1}", user, name);
			}
			return type;
		}

		private void convertHeaders() {
			JSONArray stacks = array(document, "header_stacks");
			for (int i = 0; i < stacks.length(); i++) {
				JSONObject stack = stacks.getJSONObject(i);
				stackSizes.put(stack.getString("name"), array(stack, "header_ids").length());
			}
			JSONArray headers = array(document, "headers");
			for (int i = 0; i < headers.length(); i++) {
				JSONObject json = headers.getJSONObject(i);
				String name = json.getString("name");
				P4HeaderType type = type(json.getString("header_type"), name);
				Matcher element = STACK_ELEMENT.matcher(name);
				if (element.matches() && stackSizes.containsKey(element.group(1))) {
					int size = stackSizes.get(element.group(1));
					builder.headerInstance(
							P4HeaderInstance.stackElement(element.group(1), Integer.parseInt(element.group(2)), size - 1, type));
				} else if (json.optBoolean("metadata", false)) {
					builder.headerInstance(P4HeaderInstance.metadata(name, type));
				} else {
					builder.headerInstance(P4HeaderInstance.header(name, type));
				}
			}
		}

		private void convertActions() {
			JSONArray actions = array(document, "actions");
			for (int i = 0; i < actions.length(); i++) {
				JSONObject json = actions.getJSONObject(i);
				String name = json.getString("name");
				if (json.has("id")) {
					actionNamesById.put(json.getInt("id"), name);
				}
				P4Action.Builder action = P4Action.builder(name);
				List<String> parameters = new ArrayList<String>();
				JSONArray runtimeData = array(json, "runtime_data");
				for (int j = 0; j < runtimeData.length(); j++) {
					JSONObject parameter = runtimeData.getJSONObject(j);
					parameters.add(parameter.getString("name"));
					action.parameter(parameter.getString("name"), parameter.getInt("bitwidth"));
				}
				JSONArray primitives = array(json, "primitives");
				for (int j = 0; j < primitives.length(); j++) {
					JSONObject primitive = primitives.getJSONObject(j);
					List<P4Expression> arguments = new ArrayList<P4Expression>();
					JSONArray jsonArguments = array(primitive, "parameters");
					for (int k = 0; k < jsonArguments.length(); k++) {
						arguments.add(expression(jsonArguments.getJSONObject(k), parameters));
					}
					action.call(new P4PrimitiveCall(primitive.getString("op"), arguments));
				}
				JSONObject sourceInfo = json.optJSONObject("source_info");
				if (sourceInfo != null && sourceInfo.has("line")) {
					action.lineNumber(sourceInfo.getInt("line"));
				}
				builder.action(action.build());
			}
		}

		private void convertCounters() {
			JSONArray counters = array(document, "counter_arrays");
			for (int i = 0; i < counters.length(); i++) {
				JSONObject json = counters.getJSONObject(i);
				builder.counter(
						new P4Counter(
								json.getString("name"),
								P4Counter.CounterType.fromName(json.optString("type", "packets")),
								json.getInt("size")));
			}
		}

		private void convertCalculations() {
			JSONArray calculations = array(document, "calculations");
			for (int i = 0; i < calculations.length(); i++) {
				JSONObject json = calculations.getJSONObject(i);
				builder.fieldListCalculation(new P4FieldListCalculation(json.getString("name"), json.optString("algo", "")));
			}
		}

		private void convertPipelines() {
			JSONArray pipelines = array(document, "pipelines");
			List<JSONObject> tableJsons = new ArrayList<JSONObject>();
			List<JSONObject> conditionalJsons = new ArrayList<JSONObject>();
			for (int i = 0; i < pipelines.length(); i++) {
				JSONObject pipeline = pipelines.getJSONObject(i);
				JSONArray tables = array(pipeline, "tables");
				for (int j = 0; j < tables.length(); j++) {
					JSONObject json = tables.getJSONObject(j);
					nodes.put(json.getString("name"), table(json));
					tableJsons.add(json);
				}
				JSONArray conditionals = array(pipeline, "conditionals");
				for (int j = 0; j < conditionals.length(); j++) {
					JSONObject json = conditionals.getJSONObject(j);
					P4ConditionalNode conditional = new P4ConditionalNode(
							json.getString("name"),
							expression(json.getJSONObject("expression"), Collections.<String>emptyList()),
							json.has("source_info") ? json.getJSONObject("source_info").optString("source_fragment", null) : null);
					nodes.put(conditional.getName(), conditional);
					conditionalJsons.add(json);
				}
			}

			for (JSONObject json : tableJsons) {
				P4Table table = (P4Table) nodes.get(json.getString("name"));
				JSONObject next = json.optJSONObject("next_tables");
				if (next != null) {
					for (String selector : next.keySet()) {
						String target = next.isNull(selector) ? null : next.getString(selector);
						table.next(selectorName(selector), node(target, table.getName()));
					}
				}
				if (!json.isNull("base_default_next")) {
					table.defaultNext(node(json.getString("base_default_next"), table.getName()));
				}
				builder.table(table);
			}
			for (JSONObject json : conditionalJsons) {
				P4ConditionalNode conditional = (P4ConditionalNode) nodes.get(json.getString("name"));
				conditional.whenTrue(node(json.isNull("true_next") ? null : json.getString("true_next"), conditional.getName()));
				conditional.whenFalse(node(json.isNull("false_next") ? null : json.getString("false_next"), conditional.getName()));
				builder.conditional(conditional);
			}

			for (int i = 0; i < pipelines.length(); i++) {
				JSONObject pipeline = pipelines.getJSONObject(i);
				String init = pipeline.isNull("init_table") ? null : pipeline.getString("init_table");
				String name = pipeline.getString("name");
				if ("ingress".equals(name)) {
					ingressEntry = node(init, name);
				} else if ("egress".equals(name)) {
					builder.egressEntry(node(init, name));
				} else {
					throw new CompilationException(false, "Unknown pipeline {0}", name);
				}
			}
		}

		private static String selectorName(String selector) {
			if (HIT_SELECTOR.equals(selector)) {
				return P4Table.HIT;
			}
			if (MISS_SELECTOR.equals(selector)) {
				return P4Table.MISS;
			}
			return selector;
		}

		private P4ControlFlowNode node(String name, String user) {
			if (name == null) {
				return null;
			}
			P4ControlFlowNode node = nodes.get(name);
			if (node == null) {
				throw new CompilationException(false, "{0} refers to unknown table or conditional {1}", user, name);
			}
			return node;
		}

		private P4Table table(JSONObject json) {
			P4Table table = new P4Table(json.getString("name"));
			JSONArray keys = array(json, "key");
			for (int i = 0; i < keys.length(); i++) {
				JSONObject key = keys.getJSONObject(i);
				P4MatchKey.MatchType matchType = P4MatchKey.MatchType.fromName(key.getString("match_type"));
				Object target = key.get("target");
				if (target instanceof JSONArray) {
					JSONArray path = (JSONArray) target;
					table.matchOn(P4Expression.field(path.getString(0), path.getString(1)), matchType);
				} else {
					table.matchOn(P4Expression.header(String.valueOf(target)), matchType);
				}
			}
			JSONArray actions = array(json, "actions");
			for (int i = 0; i < actions.length(); i++) {
				table.action(actions.getString(i));
			}
			int size = json.optInt("max_size", P4Table.DEFAULT_SIZE);
			if (size > 0) {
				table.size(size);
			}
			JSONObject defaultEntry = json.optJSONObject("default_entry");
			if (defaultEntry != null) {
				String action = actionNamesById.get(defaultEntry.getInt("action_id"));
				if (action == null) {
					throw new CompilationException(
							false,
							"Default entry of table {0} refers to unknown action id {1}",
							table.getName(),
							defaultEntry.getInt("action_id"));
				}
				JSONArray data = array(defaultEntry, "action_data");
				String[] values = new String[data.length()];
				for (int i = 0; i < data.length(); i++) {
					values[i] = String.valueOf(data.get(i));
				}
				table.defaultAction(action, values);
			}
			return table;
		}

		private void convertParser() {
			JSONArray parsers = array(document, "parsers");
			if (parsers.length() == 0) {
				return;
			}
			if (parsers.length() > 1) {
				throw new NotSupportedException("multiple parsers", parsers.getJSONObject(1).optString("name"));
			}
			JSONObject parser = parsers.getJSONObject(0);
			JSONArray stateJsons = array(parser, "parse_states");
			List<P4ParseState> ordered = new ArrayList<P4ParseState>();
			for (int i = 0; i < stateJsons.length(); i++) {
				P4ParseState state = new P4ParseState(stateJsons.getJSONObject(i).getString("name"));
				states.put(state.getName(), state);
				ordered.add(state);
			}
			for (int i = 0; i < stateJsons.length(); i++) {
				convertState(ordered.get(i), stateJsons.getJSONObject(i));
				builder.parseState(ordered.get(i));
			}
			if (!parser.isNull("init_state")) {
				String init = parser.getString("init_state");
				P4ParseState start = states.get(init);
				if (start == null) {
					throw new CompilationException(false, "Unknown initial parse state {0}", init);
				}
				builder.startState(start);
			}
		}

		private void convertState(P4ParseState state, JSONObject json) {
			JSONArray ops = array(json, "parser_ops");
			for (int i = 0; i < ops.length(); i++) {
				JSONObject op = ops.getJSONObject(i);
				String kind = op.getString("op");
				JSONArray parameters = op.getJSONArray("parameters");
				if ("extract".equals(kind)) {
					state.extract(parameters.getJSONObject(0).getString("value"));
				} else if ("set".equals(kind)) {
					P4Expression target = expression(parameters.getJSONObject(0), Collections.<String>emptyList());
					if (!(target instanceof P4Expression.FieldRef)) {
						throw new CompilationException(false, "Parse state {0} sets something else than a field", state.getName());
					}
					state.set(
							(P4Expression.FieldRef) target,
							expression(parameters.getJSONObject(1), Collections.<String>emptyList()));
				} else {
					throw new NotSupportedException("parser operation " + kind + " in state", state.getName());
				}
			}
			JSONArray key = array(json, "transition_key");
			for (int i = 0; i < key.length(); i++) {
				state.selectOn(expression(key.getJSONObject(i), Collections.<String>emptyList()));
			}
			JSONArray transitions = array(json, "transitions");
			for (int i = 0; i < transitions.length(); i++) {
				JSONObject transition = transitions.getJSONObject(i);
				String value = String.valueOf(transition.get("value"));
				if (!transition.isNull("mask")) {
					value = value + " &&& " + transition.get("mask");
				}
				if (transition.isNull("next_state")) {
					state.transition(value, ingressEntry);
				} else {
					String next = transition.getString("next_state");
					P4ParseState target = states.get(next);
					if (target == null) {
						throw new CompilationException(false, "Parse state {0} refers to unknown state {1}", state.getName(), next);
					}
					state.transition(value, target);
				}
			}
		}

		private void convertDeparser() {
			JSONArray deparsers = array(document, "deparsers");
			if (deparsers.length() == 0) {
				return;
			}
			Set<String> order = new LinkedHashSet<String>();
			JSONArray names = array(deparsers.getJSONObject(0), "order");
			for (int i = 0; i < names.length(); i++) {
				String name = names.getString(i);
				Matcher element = STACK_ELEMENT.matcher(name);
				order.add(element.matches() && stackSizes.containsKey(element.group(1)) ? element.group(1) : name);
			}
			for (String name : order) {
				builder.deparse(name);
			}
		}

		/**
		 * @param json JSON expression
		 * @param parameters names of the parameters of the enclosing action, by index
		 */
		private P4Expression expression(JSONObject json, List<String> parameters) {
			String type = json.getString("type");
			if ("expression".equals(type)) {
				JSONObject value = json.getJSONObject("value");
				if (!value.has("op")) {
					return expression(value, parameters);
				}
				String op = value.getString("op");
				P4Expression left = value.isNull("left") ? null : expression(value.getJSONObject("left"), parameters);
				P4Expression right = expression(value.getJSONObject("right"), parameters);
				if ("?".equals(op)) {
					return P4Expression.ternary(expression(value.getJSONObject("cond"), parameters), left, right);
				}
				if (P4Expression.Operation.VALID.equals(op)) {
					if (!(right instanceof P4Expression.HeaderRef)) {
						throw new CompilationException(false, "Validity test of something else than a header: {0}", right);
					}
					return P4Expression.valid(((P4Expression.HeaderRef) right).getInstance());
				}
				return left == null ? P4Expression.unary(op, right) : P4Expression.operation(op, left, right);
			}
			if ("field".equals(type)) {
				JSONArray path = json.getJSONArray("value");
				return P4Expression.field(path.getString(0), path.getString(1));
			}
			if ("header".equals(type)) {
				return P4Expression.header(json.getString("value"));
			}
			if ("hexstr".equals(type)) {
				return P4Expression.constant(String.valueOf(json.get("value")));
			}
			if ("bool".equals(type)) {
				return P4Expression.constant(json.getBoolean("value") ? "1" : "0");
			}
			if ("runtime_data".equals(type)) {
				int index = json.getInt("value");
				if (index < 0 || index >= parameters.size()) {
					throw new CompilationException(false, "Action parameter index {0} out of range", index);
				}
				return P4Expression.parameter(parameters.get(index));
			}
			if ("counter_array".equals(type)) {
				return P4Expression.counter(json.getString("value"));
			}
			throw new NotSupportedException("expression type", type);
		}
	}
}

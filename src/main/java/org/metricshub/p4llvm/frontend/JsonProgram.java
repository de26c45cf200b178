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

import java.util.ArrayList;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONObject;
import org.metricshub.p4llvm.EntityNotFoundException;

/**
 * Name-based queries over the JSON description of a program: widths of
 * header types, headers and fields, and the contents of parse states.
 * <p>
 * Width queries return {@code null} for unknown names.
 */
public class JsonProgram {

	private final JSONObject document;

	public JsonProgram(JSONObject document) {
		this.document = document;
	}

	public JSONObject getDocument() {
		return document;
	}

	/**
	 * @param headerType header type name
	 * @return the sum of the field widths, or {@code null} if the type is unknown
	 */
	public Integer getHeaderTypeWidth(String headerType) {
		JSONObject type = find(document.optJSONArray("header_types"), headerType);
		if (type == null) {
			return null;
		}
		int width = 0;
		JSONArray fields = type.getJSONArray("fields");
		for (int i = 0; i < fields.length(); i++) {
			width += fields.getJSONArray(i).getInt(1);
		}
		return width;
	}

	/**
	 * @param header header instance name
	 * @return the width of its type, or {@code null} if the header is unknown
	 */
	public Integer getHeaderWidth(String header) {
		String type = getHeaderType(header);
		return type == null ? null : getHeaderTypeWidth(type);
	}

	/**
	 * @param header header instance name
	 * @param field field name
	 * @return the field width, or {@code null} if the header or the field is unknown
	 */
	public Integer getFieldWidth(String header, String field) {
		String typeName = getHeaderType(header);
		if (typeName == null) {
			return null;
		}
		JSONObject type = find(document.optJSONArray("header_types"), typeName);
		if (type == null) {
			return null;
		}
		JSONArray fields = type.getJSONArray("fields");
		for (int i = 0; i < fields.length(); i++) {
			JSONArray candidate = fields.getJSONArray(i);
			if (candidate.getString(0).equals(field)) {
				return candidate.getInt(1);
			}
		}
		return null;
	}

	/**
	 * @param header header instance name
	 * @return the name of its type, or {@code null} if the header is unknown
	 */
	public String getHeaderType(String header) {
		JSONObject instance = find(document.optJSONArray("headers"), header);
		return instance == null ? null : instance.getString("header_type");
	}

	/**
	 * @param stateName parse state name
	 * @return the state of the first parser, or {@code null} if there is none by that name
	 */
	public JSONObject stateNameToState(String stateName) {
		JSONArray parsers = document.optJSONArray("parsers");
		if (parsers == null || parsers.length() == 0) {
			return null;
		}
		return find(parsers.getJSONObject(0).optJSONArray("parse_states"), stateName);
	}

	/**
	 * @param stateName parse state name
	 * @return the headers the state extracts, in order; a stack extraction
	 *         is listed as element 0 of the stack, e.g. {@code vlan[0]}
	 * @throws EntityNotFoundException if the state does not exist
	 */
	public List<String> stateToHeaders(String stateName) {
		JSONObject state = requireState(stateName);
		List<String> headers = new ArrayList<String>();
		JSONArray ops = state.optJSONArray("parser_ops");
		if (ops == null) {
			return headers;
		}
		for (int i = 0; i < ops.length(); i++) {
			JSONObject op = ops.getJSONObject(i);
			if (!"extract".equals(op.getString("op"))) {
				continue;
			}
			JSONObject parameter = op.getJSONArray("parameters").getJSONObject(0);
			String type = parameter.getString("type");
			if ("regular".equals(type)) {
				headers.add(parameter.getString("value"));
			} else if ("stack".equals(type)) {
				headers.add(parameter.getString("value") + "[0]");
			}
		}
		return headers;
	}

	/**
	 * Describes the first {@code set} operation of a parse state.
	 *
	 * @param stateName parse state name
	 * @return the description, or {@code null} if the state sets nothing
	 * @throws EntityNotFoundException if the state does not exist
	 */
	public StateExpression stateToExpression(String stateName) {
		JSONObject state = requireState(stateName);
		JSONArray ops = state.optJSONArray("parser_ops");
		if (ops == null) {
			return null;
		}
		for (int i = 0; i < ops.length(); i++) {
			JSONObject op = ops.getJSONObject(i);
			if (!"set".equals(op.getString("op"))) {
				continue;
			}
			JSONArray parameters = op.getJSONArray("parameters");
			StringBuilder destination = new StringBuilder();
			new ExpressionFlattener().flatten(parameters.getJSONObject(0), destination);
			JSONObject source = parameters.getJSONObject(1);
			if ("expression".equals(source.getString("type"))) {
				JSONObject value = source.optJSONObject("value");
				if (value != null) {
					StringBuilder text = new StringBuilder();
					// the value is either a typed expression or the bare operation
					new ExpressionFlattener().flatten(value.has("type") ? value : source, text);
					return new StateExpression(StateExpression.EXPRESSION, destination.toString(), text.toString());
				}
			} else {
				ExpressionFlattener flattener = new ExpressionFlattener();
				flattener.flatten(source, new StringBuilder());
				String reference = flattener.getReferences().isEmpty() ? null : flattener.getReferences().get(0);
				return new StateExpression(StateExpression.FIELD, destination.toString(), reference);
			}
		}
		return null;
	}

	private JSONObject requireState(String stateName) {
		JSONObject state = stateNameToState(stateName);
		if (state == null) {
			throw new EntityNotFoundException(EntityNotFoundException.Kind.PARSE_STATE, stateName);
		}
		return state;
	}

	private static JSONObject find(JSONArray array, String name) {
		if (array == null) {
			return null;
		}
		for (int i = 0; i < array.length(); i++) {
			JSONObject candidate = array.getJSONObject(i);
			if (name.equals(candidate.optString("name", null))) {
				return candidate;
			}
		}
		return null;
	}

	/**
	 * The first {@code set} operation of a parse state.
	 */
	public static final class StateExpression {

		/** The source is an expression. */
		public static final String EXPRESSION = "expression";

		/** The source is a single field, or a constant. */
		public static final String FIELD = "field";

		private final String kind;
		private final String destination;
		private final String source;

		StateExpression(String kind, String destination, String source) {
			this.kind = kind;
			this.destination = destination;
			this.source = source;
		}

		/**
		 * @return {@link #EXPRESSION} or {@link #FIELD}
		 */
		public String getKind() {
			return kind;
		}

		public String getDestination() {
			return destination;
		}

		/**
		 * @return the rendered expression, or the {@code $}-joined source
		 *         field; {@code null} when a constant is set
		 */
		public String getSource() {
			return source;
		}

		@Override
		public String toString() {
			return kind + ": " + destination + " = " + source;
		}
	}
}

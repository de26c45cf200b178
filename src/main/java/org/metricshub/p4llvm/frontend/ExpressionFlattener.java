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
import org.metricshub.p4llvm.CompilationException;

/**
 * Renders the JSON form of an expression as parenthesized text, collecting
 * the header and field paths it references.
 * <p>
 * Paths are joined with {@code $}: field {@code ["ipv4", "ttl"]} renders as
 * {@code ipv4$ttl}. Binary operations render as {@code (left op right)}, a
 * {@code +} or {@code -} without left operand as {@code (op right)}, and a
 * ternary as {@code (cond ? left : right)}.
 */
public class ExpressionFlattener {

	/** Separator of the components of a header or field path. */
	public static final String PATH_SEPARATOR = "$";

	private final List<String> references = new ArrayList<String>();

	/**
	 * Flattens one expression with a fresh flattener.
	 *
	 * @param expression JSON expression with a {@code type} and a {@code value}
	 * @return the rendered text
	 */
	public static String flattenToString(JSONObject expression) {
		StringBuilder out = new StringBuilder();
		new ExpressionFlattener().flatten(expression, out);
		return out.toString();
	}

	/**
	 * Appends the rendering of an expression. A {@code null} expression
	 * renders as nothing.
	 *
	 * @param expression JSON expression with a {@code type} and a {@code value}
	 * @param out where to append
	 * @throws CompilationException if the expression type is unknown
	 */
	public void flatten(JSONObject expression, StringBuilder out) {
		if (expression == null) {
			return;
		}
		String type = expression.getString("type");
		if ("expression".equals(type)) {
			JSONObject value = expression.getJSONObject("value");
			if (!value.has("op")) {
				flatten(value, out);
				return;
			}
			String op = value.getString("op");
			JSONObject left = value.optJSONObject("left");
			JSONObject right = value.optJSONObject("right");
			out.append('(');
			if ("?".equals(op)) {
				flatten(value.getJSONObject("cond"), out);
				out.append(" ? ");
				flatten(left, out);
				out.append(" : ");
				flatten(right, out);
			} else if (left == null) {
				out.append(op);
				flatten(right, out);
			} else {
				flatten(left, out);
				out.append(' ').append(op).append(' ');
				flatten(right, out);
			}
			out.append(')');
		} else if ("header".equals(type) || "field".equals(type)) {
			String path = path(expression.get("value"));
			out.append(path);
			references.add(path);
		} else if ("bool".equals(type) || "hexstr".equals(type) || "local".equals(type) || "register".equals(type)) {
			out.append(String.valueOf(expression.get("value")));
		} else {
			throw new CompilationException(false, "Unsupported expression type {0}", type);
		}
	}

	private static String path(Object value) {
		if (value instanceof JSONArray) {
			JSONArray components = (JSONArray) value;
			List<String> parts = new ArrayList<String>();
			for (int i = 0; i < components.length(); i++) {
				parts.add(components.getString(i));
			}
			return String.join(PATH_SEPARATOR, parts);
		}
		return String.valueOf(value);
	}

	/**
	 * @return the header and field paths met so far, in rendering order
	 */
	public List<String> getReferences() {
		return references;
	}
}

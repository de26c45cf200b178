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

import java.util.List;

/**
 * Renders a {@link DirectiveList} as C program text.
 * <p>
 * Packet access, table lookups and table declarations are rendered as calls
 * to the {@code llvm_load_bits}, {@code llvm_store_bits},
 * {@code llvm_table_lookup} helpers and the {@code llvm_table_def} type,
 * provided by the hand-written runtime the generated program is compiled
 * with.
 */
public class ProgramPrinter {

	/** Indentation used when none is configured. */
	public static final int DEFAULT_INDENT_WIDTH = 4;

	private final String tab;

	public ProgramPrinter() {
		this(DEFAULT_INDENT_WIDTH);
	}

	/**
	 * @param indentWidth number of spaces per nesting level
	 */
	public ProgramPrinter(int indentWidth) {
		if (indentWidth < 0) {
			throw new IllegalArgumentException("Indentation width must not be negative: " + indentWidth);
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < indentWidth; i++) {
			sb.append(' ');
		}
		this.tab = sb.toString();
	}

	/**
	 * Renders the directives. The list is post-processed first, so a
	 * malformed list is rejected before anything is rendered.
	 *
	 * @param directives the program
	 * @return the program text
	 */
	public String print(DirectiveList directives) {
		directives.postProcess();
		StringBuilder out = new StringBuilder();
		int depth = 0;
		for (Directive d : directives.getDirectives()) {
			switch (d.getKind()) {
			case COMMENT:
				line(out, depth, "// " + d.stringArg(0));
				break;
			case DECLARE_ENUM:
				line(out, depth, "enum " + d.stringArg(0) + " {");
				List<String> constants = d.stringArgs(1);
				for (int i = 0; i < constants.size(); i++) {
					line(out, depth + 1, constants.get(i) + (i + 1 < constants.size() ? "," : ""));
				}
				line(out, depth, "};");
				out.append('\n');
				break;
			case BEGIN_STRUCT:
				line(out, depth, "struct " + d.stringArg(0) + " {");
				depth++;
				break;
			case STRUCT_FIELD:
				long length = d.longArg(2);
				line(out, depth, d.stringArg(0) + " " + d.stringArg(1) + (length > 0 ? "[" + length + "]" : "") + ";");
				break;
			case END_STRUCT:
				depth--;
				line(out, depth, "};");
				out.append('\n');
				break;
			case DECLARE_TABLE:
				line(
						out,
						depth,
						"struct llvm_table_def " + d.stringArg(0) + " = { .key_size = sizeof(" + d.stringArg(1)
								+ "), .value_size = sizeof(" + d.stringArg(2) + "), .max_entries = " + d.longArg(3) + " };");
				break;
			case DECLARE_COUNTER:
				line(out, depth, d.stringArg(1) + " " + d.stringArg(0) + "[" + d.longArg(2) + "];");
				break;
			case BEGIN_FUNCTION:
				out.append('\n');
				line(out, depth, d.stringArg(0) + " " + d.stringArg(1) + "(" + String.join(", ", d.stringArgs(2)) + ") {");
				depth++;
				break;
			case END_FUNCTION:
				depth--;
				line(out, depth, "}");
				break;
			case DECLARE_VARIABLE:
				String initialValue = d.stringArg(2);
				line(out, depth, d.stringArg(0) + " " + d.stringArg(1) + (initialValue.isEmpty() ? "" : " = " + initialValue) + ";");
				break;
			case BEGIN_INITIALIZER:
				line(out, depth, d.stringArg(0) + " " + d.stringArg(1) + " = {");
				depth++;
				break;
			case INITIALIZER_FIELD:
				line(out, depth, "." + d.stringArg(0) + " = " + d.stringArg(1) + ",");
				break;
			case END_INITIALIZER:
				depth--;
				line(out, depth, "};");
				break;
			case LABEL:
				line(out, Math.max(depth - 1, 0), d.stringArg(0) + ":");
				break;
			case GOTO:
				line(out, depth, "goto " + d.stringArg(0) + ";");
				break;
			case BRANCH:
				line(out, depth, "if (" + d.stringArg(0) + ") goto " + d.stringArg(1) + "; else goto " + d.stringArg(2) + ";");
				break;
			case BEGIN_SELECT:
				line(out, depth, "switch (" + d.stringArg(0) + ") {");
				depth++;
				break;
			case SELECT_CASE:
				line(out, depth, "case " + d.stringArg(0) + ": goto " + d.stringArg(1) + ";");
				break;
			case SELECT_DEFAULT:
				line(out, depth, "default: goto " + d.stringArg(0) + ";");
				break;
			case END_SELECT:
				depth--;
				line(out, depth, "}");
				break;
			case ASSIGN:
				line(out, depth, d.stringArg(0) + " = " + d.stringArg(1) + ";");
				break;
			case LOAD:
				line(
						out,
						depth,
						d.stringArg(0) + " = llvm_load_bits(" + d.stringArg(1) + ", " + d.stringArg(2) + ", " + d.longArg(3) + ");");
				break;
			case STORE:
				line(
						out,
						depth,
						"llvm_store_bits(" + d.stringArg(1) + ", " + d.stringArg(2) + ", " + d.longArg(3) + ", " + d.stringArg(0) + ");");
				break;
			case LOOKUP:
				line(out, depth, d.stringArg(2) + " = llvm_table_lookup(&" + d.stringArg(0) + ", &" + d.stringArg(1) + ");");
				break;
			case RETURN:
				line(out, depth, "return " + d.stringArg(0) + ";");
				break;
			default:
				throw new Error("Unknown directive kind: " + d.getKind());
			}
		}
		return out.toString();
	}

	private void line(StringBuilder out, int depth, String text) {
		for (int i = 0; i < depth; i++) {
			out.append(tab);
		}
		out.append(text).append('\n');
	}
}

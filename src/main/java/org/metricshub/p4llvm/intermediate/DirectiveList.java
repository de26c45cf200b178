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

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.p4llvm.CompilationException;

/**
 * A {@link ProgramSerializer} that records every emission call as a
 * {@link Directive}, in order.
 * <p>
 * The recorded list is what the backend produces. It can be dumped,
 * checked with {@link #postProcess()}, and rendered to program text with
 * {@link ProgramPrinter}.
 */
public class DirectiveList implements ProgramSerializer {

	private final List<Directive> queue = new ArrayList<Directive>(256);

	/** Label to the index of the directive defining it. */
	private final Map<String, Integer> labelIndexes = new HashMap<String, Integer>();

	/** Open blocks, innermost first. */
	private final Deque<DirectiveKind> openBlocks = new ArrayDeque<DirectiveKind>();

	private boolean postProcessed;

	@Override
	public void comment(String text) {
		add(DirectiveKind.COMMENT, text);
	}

	@Override
	public void declareEnum(String name, List<String> constants) {
		Object[] operands = new Object[constants.size() + 1];
		operands[0] = name;
		for (int i = 0; i < constants.size(); i++) {
			operands[i + 1] = constants.get(i);
		}
		add(DirectiveKind.DECLARE_ENUM, operands);
	}

	@Override
	public void beginStruct(String typeName) {
		open(DirectiveKind.BEGIN_STRUCT);
		add(DirectiveKind.BEGIN_STRUCT, typeName);
	}

	@Override
	public void structField(String type, String name, int arrayLength) {
		assert openBlocks.peek() == DirectiveKind.BEGIN_STRUCT : "struct member " + name + " outside of a struct";
		add(DirectiveKind.STRUCT_FIELD, type, name, (long) arrayLength);
	}

	@Override
	public void endStruct() {
		close(DirectiveKind.BEGIN_STRUCT);
		add(DirectiveKind.END_STRUCT);
	}

	@Override
	public void declareTable(String name, String keyType, String valueType, int maxEntries) {
		add(DirectiveKind.DECLARE_TABLE, name, keyType, valueType, (long) maxEntries);
	}

	@Override
	public void declareCounter(String name, String elementType, int size) {
		add(DirectiveKind.DECLARE_COUNTER, name, elementType, (long) size);
	}

	@Override
	public void beginFunction(String returnType, String name, List<String> parameters) {
		open(DirectiveKind.BEGIN_FUNCTION);
		Object[] operands = new Object[parameters.size() + 2];
		operands[0] = returnType;
		operands[1] = name;
		for (int i = 0; i < parameters.size(); i++) {
			operands[i + 2] = parameters.get(i);
		}
		add(DirectiveKind.BEGIN_FUNCTION, operands);
	}

	@Override
	public void endFunction() {
		close(DirectiveKind.BEGIN_FUNCTION);
		add(DirectiveKind.END_FUNCTION);
	}

	@Override
	public void declareVariable(String type, String name, String initialValue) {
		add(DirectiveKind.DECLARE_VARIABLE, type, name, initialValue == null ? "" : initialValue);
	}

	@Override
	public void beginInitializer(String type, String name) {
		open(DirectiveKind.BEGIN_INITIALIZER);
		add(DirectiveKind.BEGIN_INITIALIZER, type, name);
	}

	@Override
	public void initializerField(String field, String value) {
		assert openBlocks.peek() == DirectiveKind.BEGIN_INITIALIZER : "initializer member " + field
				+ " outside of an initializer";
		add(DirectiveKind.INITIALIZER_FIELD, field, value);
	}

	@Override
	public void endInitializer() {
		close(DirectiveKind.BEGIN_INITIALIZER);
		add(DirectiveKind.END_INITIALIZER);
	}

	/**
	 * {@inheritDoc}
	 *
	 * @throws CompilationException if the label is already defined
	 */
	@Override
	public void label(String label) {
		Integer previous = labelIndexes.put(label, queue.size());
		if (previous != null) {
			throw new CompilationException(true, "Label {0} defined twice, at directives {1} and {2}", label, previous, queue.size());
		}
		add(DirectiveKind.LABEL, label);
	}

	@Override
	public void gotoLabel(String label) {
		add(DirectiveKind.GOTO, label);
	}

	@Override
	public void branch(String condition, String trueLabel, String falseLabel) {
		add(DirectiveKind.BRANCH, condition, trueLabel, falseLabel);
	}

	@Override
	public void beginSelect(String expression) {
		open(DirectiveKind.BEGIN_SELECT);
		add(DirectiveKind.BEGIN_SELECT, expression);
	}

	@Override
	public void selectCase(String value, String label) {
		assert openBlocks.peek() == DirectiveKind.BEGIN_SELECT : "case " + value + " outside of a select";
		add(DirectiveKind.SELECT_CASE, value, label);
	}

	@Override
	public void selectDefault(String label) {
		assert openBlocks.peek() == DirectiveKind.BEGIN_SELECT : "default case outside of a select";
		add(DirectiveKind.SELECT_DEFAULT, label);
	}

	@Override
	public void endSelect() {
		close(DirectiveKind.BEGIN_SELECT);
		add(DirectiveKind.END_SELECT);
	}

	@Override
	public void assign(String target, String value) {
		add(DirectiveKind.ASSIGN, target, value);
	}

	@Override
	public void load(String target, String packet, String bitOffset, int width) {
		add(DirectiveKind.LOAD, target, packet, bitOffset, (long) width);
	}

	@Override
	public void store(String source, String packet, String bitOffset, int width) {
		add(DirectiveKind.STORE, source, packet, bitOffset, (long) width);
	}

	@Override
	public void lookup(String table, String key, String result) {
		add(DirectiveKind.LOOKUP, table, key, result);
	}

	@Override
	public void returnValue(String value) {
		add(DirectiveKind.RETURN, value);
	}

	private void add(DirectiveKind kind, Object... operands) {
		if (postProcessed) {
			throw new IllegalStateException("No directive can be added after post-processing");
		}
		queue.add(new Directive(kind, operands));
	}

	private void open(DirectiveKind kind) {
		openBlocks.push(kind);
	}

	private void close(DirectiveKind kind) {
		DirectiveKind open = openBlocks.poll();
		if (open != kind) {
			throw new CompilationException(true, "Closing {0} while {1} is open", kind, open);
		}
	}

	/**
	 * Executed after all directives are recorded. Checks that every block is
	 * closed and that every jump targets a label defined exactly once.
	 * <p>
	 * This method is idempotent.
	 *
	 * @throws CompilationException if the program is not well formed
	 */
	public void postProcess() {
		if (postProcessed) {
			return;
		}
		if (!openBlocks.isEmpty()) {
			throw new CompilationException(true, "Unclosed {0} at the end of the program", openBlocks.peek());
		}
		for (int i = 0; i < queue.size(); i++) {
			Directive directive = queue.get(i);
			for (String target : directive.targetLabels()) {
				if (!labelIndexes.containsKey(target)) {
					throw new CompilationException(true, "Directive {0} ({1}) jumps to undefined label {2}", i, directive, target);
				}
			}
		}
		postProcessed = true;
	}

	public int size() {
		return queue.size();
	}

	public Directive get(int index) {
		return queue.get(index);
	}

	public List<Directive> getDirectives() {
		return Collections.unmodifiableList(queue);
	}

	/**
	 * @param kind a directive kind
	 * @return the recorded directives of that kind, in order
	 */
	public List<Directive> directivesOfKind(DirectiveKind kind) {
		List<Directive> result = new ArrayList<Directive>();
		for (Directive directive : queue) {
			if (directive.getKind() == kind) {
				result.add(directive);
			}
		}
		return result;
	}

	/**
	 * @return the defined labels, in definition order
	 */
	public Set<String> getLabels() {
		Set<String> labels = new LinkedHashSet<String>();
		for (Directive directive : directivesOfKind(DirectiveKind.LABEL)) {
			labels.add(directive.stringArg(0));
		}
		return labels;
	}

	/**
	 * @param label a label
	 * @return the index of the directive defining the label, or -1 if it is not defined
	 */
	public int indexOfLabel(String label) {
		Integer index = labelIndexes.get(label);
		return index == null ? -1 : index;
	}

	/**
	 * Dumps the recorded directives to the provided {@link PrintStream}, one
	 * per line, prefixed by their index.
	 *
	 * @param ps destination stream for the listing
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < queue.size(); i++) {
			Directive directive = queue.get(i);
			if (directive.getKind() == DirectiveKind.LABEL) {
				ps.println(i + " : [" + directive.stringArg(0) + "]");
			} else {
				ps.println(i + " : " + directive);
			}
		}
	}
}

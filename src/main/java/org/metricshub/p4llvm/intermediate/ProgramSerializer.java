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
 * The sink the backend emits a program into.
 * <p>
 * The backend only ever talks to this interface, in program order. An
 * implementation may record the calls ({@link DirectiveList}) or render them
 * directly; it never feeds anything back into the backend.
 */
public interface ProgramSerializer {

	void comment(String text);

	/**
	 * @param name enumeration name
	 * @param constants constant names, in ordinal order
	 */
	void declareEnum(String name, List<String> constants);

	void beginStruct(String typeName);

	/**
	 * @param type member type
	 * @param name member name
	 * @param arrayLength number of elements, 0 for a scalar member
	 */
	void structField(String type, String name, int arrayLength);

	void endStruct();

	void declareTable(String name, String keyType, String valueType, int maxEntries);

	void declareCounter(String name, String elementType, int size);

	void beginFunction(String returnType, String name, List<String> parameters);

	void endFunction();

	/**
	 * @param type variable type
	 * @param name variable name
	 * @param initialValue initial value, or {@code null}
	 */
	void declareVariable(String type, String name, String initialValue);

	void beginInitializer(String type, String name);

	void initializerField(String field, String value);

	void endInitializer();

	void label(String label);

	void gotoLabel(String label);

	void branch(String condition, String trueLabel, String falseLabel);

	void beginSelect(String expression);

	void selectCase(String value, String label);

	void selectDefault(String label);

	void endSelect();

	void assign(String target, String value);

	/**
	 * Reads {@code width} bits of the packet at a bit offset.
	 */
	void load(String target, String packet, String bitOffset, int width);

	/**
	 * Writes {@code width} bits of a value into the packet at a bit offset.
	 */
	void store(String source, String packet, String bitOffset, int width);

	/**
	 * Looks a key up in a table; the result pointer is {@code NULL} on a miss.
	 */
	void lookup(String table, String key, String result);

	void returnValue(String value);
}

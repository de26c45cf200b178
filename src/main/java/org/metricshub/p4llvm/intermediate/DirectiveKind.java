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

/**
 * The kinds of directive a {@link ProgramSerializer} receives.
 * <p>
 * Each constant documents its operands. Operands are strings unless stated
 * otherwise; label operands name a jump target defined by a {@link #LABEL}
 * directive of the same program.
 */
public enum DirectiveKind {
	/**
	 * A comment line.
	 * <p>
	 * Operands: text
	 */
	COMMENT(false),
	/**
	 * Declares an enumeration.
	 * <p>
	 * Operands: enumeration name, then one operand per constant, in ordinal order
	 */
	DECLARE_ENUM(false),
	/**
	 * Opens a struct type declaration.
	 * <p>
	 * Operands: type name
	 */
	BEGIN_STRUCT(false),
	/**
	 * Declares one member of the struct being declared.
	 * <p>
	 * Operands: member type, member name, array length (a number, 0 for a scalar)
	 */
	STRUCT_FIELD(false),
	/**
	 * Closes the struct type declaration.
	 */
	END_STRUCT(false),
	/**
	 * Declares a match table shared with the control plane.
	 * <p>
	 * Operands: table name, key type, value type, maximum number of entries (a number)
	 */
	DECLARE_TABLE(false),
	/**
	 * Declares an array of counters.
	 * <p>
	 * Operands: counter name, element type, number of elements (a number)
	 */
	DECLARE_COUNTER(false),
	/**
	 * Opens a function definition.
	 * <p>
	 * Operands: return type, function name, then one operand per parameter declaration
	 */
	BEGIN_FUNCTION(false),
	/**
	 * Closes the function definition.
	 */
	END_FUNCTION(false),
	/**
	 * Declares a local variable.
	 * <p>
	 * Operands: type, name, initial value (empty when none)
	 */
	DECLARE_VARIABLE(false),
	/**
	 * Opens an initializer list for a variable of struct type.
	 * <p>
	 * Operands: type, variable name
	 */
	BEGIN_INITIALIZER(false),
	/**
	 * One designated member of the initializer being emitted.
	 * <p>
	 * Operands: member name, value
	 */
	INITIALIZER_FIELD(false),
	/**
	 * Closes the initializer list.
	 */
	END_INITIALIZER(false),
	/**
	 * Defines a jump target at the current position.
	 * <p>
	 * Operands: label
	 */
	LABEL(false),
	/**
	 * Jumps unconditionally.
	 * <p>
	 * Operands: label
	 */
	GOTO(true, 0),
	/**
	 * Jumps to one of two targets depending on a condition.
	 * <p>
	 * Operands: condition, label when true, label when false
	 */
	BRANCH(true, 1, 2),
	/**
	 * Opens a multi-way jump on the value of an expression.
	 * <p>
	 * Operands: expression
	 */
	BEGIN_SELECT(false),
	/**
	 * Jumps to a label when the selected expression equals a value.
	 * <p>
	 * Operands: value, label
	 */
	SELECT_CASE(true, 1),
	/**
	 * Jumps to a label when no case of the select matched.
	 * <p>
	 * Operands: label
	 */
	SELECT_DEFAULT(true, 0),
	/**
	 * Closes the multi-way jump.
	 */
	END_SELECT(false),
	/**
	 * Assigns a value to a storage location.
	 * <p>
	 * Operands: target, value
	 */
	ASSIGN(false),
	/**
	 * Reads bits from the packet into a storage location.
	 * <p>
	 * Operands: target, packet variable, bit offset expression, width in bits (a number)
	 */
	LOAD(false),
	/**
	 * Writes bits of a storage location back into the packet.
	 * <p>
	 * Operands: source, packet variable, bit offset expression, width in bits (a number)
	 */
	STORE(false),
	/**
	 * Looks a key up in a table.
	 * <p>
	 * Operands: table name, key variable, result pointer variable
	 */
	LOOKUP(false),
	/**
	 * Returns from the function being defined.
	 * <p>
	 * Operands: value
	 */
	RETURN(false);

	private final boolean jump;
	private final int[] labelOperands;

	DirectiveKind(boolean jump, int... labelOperands) {
		this.jump = jump;
		this.labelOperands = labelOperands;
	}

	/**
	 * @return {@code true} if directives of this kind transfer control to a label
	 */
	public boolean isJump() {
		return jump;
	}

	/**
	 * @return positions of the operands that reference a label
	 */
	public int[] getLabelOperands() {
		return labelOperands.clone();
	}
}

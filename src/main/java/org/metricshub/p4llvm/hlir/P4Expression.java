package org.metricshub.p4llvm.hlir;

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

import java.util.Objects;

/**
 * An expression of the HLIR: a reference to a field, a header, an action
 * parameter or a counter, a literal, an operation or a ternary.
 * <p>
 * The set of expression kinds is closed. Consumers walk an expression with a
 * {@link Visitor}, which forces them to handle every kind.
 */
public abstract class P4Expression {

	P4Expression() {}

	/**
	 * Dispatches to the visitor method matching this expression kind.
	 *
	 * @param visitor the visitor to apply
	 * @param <R> result type of the visitor
	 * @return the visitor result
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Visits every kind of {@link P4Expression}.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitField(FieldRef field);

		R visitHeader(HeaderRef header);

		R visitParameter(ParameterRef parameter);

		R visitCounter(CounterRef counter);

		R visitConstant(Constant constant);

		R visitOperation(Operation operation);

		R visitTernary(Ternary ternary);
	}

	public static FieldRef field(String instance, String field) {
		return new FieldRef(instance, field);
	}

	public static HeaderRef header(String instance) {
		return new HeaderRef(instance);
	}

	public static ParameterRef parameter(String name) {
		return new ParameterRef(name);
	}

	public static CounterRef counter(String name) {
		return new CounterRef(name);
	}

	public static Constant constant(String text) {
		return new Constant(text);
	}

	public static Constant constant(long value) {
		return new Constant(Long.toString(value));
	}

	public static Operation operation(String operator, P4Expression left, P4Expression right) {
		return new Operation(operator, left, right);
	}

	public static Operation unary(String operator, P4Expression operand) {
		return new Operation(operator, null, operand);
	}

	/**
	 * @param instance header instance to test
	 * @return the {@code valid(instance)} test
	 */
	public static Operation valid(String instance) {
		return new Operation(Operation.VALID, null, new HeaderRef(instance));
	}

	public static Ternary ternary(P4Expression condition, P4Expression ifTrue, P4Expression ifFalse) {
		return new Ternary(condition, ifTrue, ifFalse);
	}

	/**
	 * A field of a header or metadata instance, e.g. {@code ipv4.ttl}.
	 * Stack elements use the element name as instance, e.g. {@code vlan[0]}.
	 */
	public static final class FieldRef extends P4Expression {
		private final String instance;
		private final String field;

		FieldRef(String instance, String field) {
			this.instance = Objects.requireNonNull(instance, "instance");
			this.field = Objects.requireNonNull(field, "field");
		}

		public String getInstance() {
			return instance;
		}

		public String getField() {
			return field;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitField(this);
		}

		@Override
		public String toString() {
			return instance + "." + field;
		}
	}

	/**
	 * A whole header instance, used by {@code add_header}, {@code remove_header}
	 * and the validity test.
	 */
	public static final class HeaderRef extends P4Expression {
		private final String instance;

		HeaderRef(String instance) {
			this.instance = Objects.requireNonNull(instance, "instance");
		}

		public String getInstance() {
			return instance;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitHeader(this);
		}

		@Override
		public String toString() {
			return instance;
		}
	}

	/**
	 * A parameter of the enclosing action, filled by the control plane.
	 */
	public static final class ParameterRef extends P4Expression {
		private final String name;

		ParameterRef(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitParameter(this);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static final class CounterRef extends P4Expression {
		private final String name;

		CounterRef(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCounter(this);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A literal, kept in its source spelling ({@code 0x0800}, {@code 64}).
	 */
	public static final class Constant extends P4Expression {
		private final String text;

		Constant(String text) {
			this.text = Objects.requireNonNull(text, "text");
		}

		public String getText() {
			return text;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitConstant(this);
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * A binary operation, or a unary one when {@link #getLeft()} is
	 * {@code null}.
	 */
	public static final class Operation extends P4Expression {

		/** Operator of the header validity test. Its operand is a {@link HeaderRef}. */
		public static final String VALID = "valid";

		private final String operator;
		private final P4Expression left;
		private final P4Expression right;

		Operation(String operator, P4Expression left, P4Expression right) {
			this.operator = Objects.requireNonNull(operator, "operator");
			this.left = left;
			this.right = Objects.requireNonNull(right, "right");
		}

		public String getOperator() {
			return operator;
		}

		public P4Expression getLeft() {
			return left;
		}

		public P4Expression getRight() {
			return right;
		}

		public boolean isUnary() {
			return left == null;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOperation(this);
		}

		@Override
		public String toString() {
			if (isUnary()) {
				return "(" + operator + " " + right + ")";
			}
			return "(" + left + " " + operator + " " + right + ")";
		}
	}

	public static final class Ternary extends P4Expression {
		private final P4Expression condition;
		private final P4Expression ifTrue;
		private final P4Expression ifFalse;

		Ternary(P4Expression condition, P4Expression ifTrue, P4Expression ifFalse) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.ifTrue = Objects.requireNonNull(ifTrue, "ifTrue");
			this.ifFalse = Objects.requireNonNull(ifFalse, "ifFalse");
		}

		public P4Expression getCondition() {
			return condition;
		}

		public P4Expression getIfTrue() {
			return ifTrue;
		}

		public P4Expression getIfFalse() {
			return ifFalse;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTernary(this);
		}

		@Override
		public String toString() {
			return "(" + condition + " ? " + ifTrue + " : " + ifFalse + ")";
		}
	}
}

package org.metricshub.p4llvm.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.p4llvm.HlirTestSupport.compile;
import static org.metricshub.p4llvm.HlirTestSupport.exactTable;
import static org.metricshub.p4llvm.HlirTestSupport.noOp;
import static org.metricshub.p4llvm.HlirTestSupport.program;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.EntityNotFoundException;
import org.metricshub.p4llvm.HlirTestSupport.Compiled;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4MatchKey;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.Directive;
import org.metricshub.p4llvm.intermediate.DirectiveKind;

public class LlvmTableTest {

	private static Directive find(Compiled compiled, DirectiveKind kind, String firstOperand) {
		for (Directive directive : compiled.directives().directivesOfKind(kind)) {
			if (directive.stringArg(0).equals(firstOperand)) {
				return directive;
			}
		}
		return null;
	}

	@Test
	public void tableComesWithADefaultTable() {
		P4Table t1 = exactTable("t1", "a", "b").size(64);
		Compiled compiled = compile(program(t1).action(noOp("a")).action(noOp("b")).table(t1).build());

		Directive table = find(compiled, DirectiveKind.DECLARE_TABLE, "t1");
		assertNotNull(table);
		assertEquals("struct t1_key", table.stringArg(1));
		assertEquals("struct t1_value", table.stringArg(2));
		assertEquals(64L, table.longArg(3));
		Directive defaults = find(compiled, DirectiveKind.DECLARE_TABLE, "t1_defaultAction");
		assertNotNull(defaults);
		assertEquals("uint32_t", defaults.stringArg(1));
		assertEquals(1L, defaults.longArg(3));

		Directive actions = find(compiled, DirectiveKind.DECLARE_ENUM, "t1_actions");
		assertEquals(Arrays.asList("T1_ACTION_A", "T1_ACTION_B"), actions.stringArgs(1));

		Directive lookup = find(compiled, DirectiveKind.LOOKUP, "t1");
		assertTrue(lookup.stringArg(1).startsWith("t1_key_"));
		Directive fallback = find(compiled, DirectiveKind.LOOKUP, "t1_defaultAction");
		assertEquals("llvm_zero", fallback.stringArg(1));
		assertTrue(compiled.has(DirectiveKind.ASSIGN, "llvm_headers.ethernet.etherType"));
		assertTrue(compiled.has(DirectiveKind.BEGIN_SELECT, "->action"));
		assertEquals(2, compiled.directives().directivesOfKind(DirectiveKind.SELECT_CASE).size());
	}

	@Test
	public void keylessTableOnlyReadsTheDefaultTable() {
		P4Table t1 = new P4Table("t1").action("a");
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).build());

		assertEquals(null, find(compiled, DirectiveKind.DECLARE_TABLE, "t1"));
		assertEquals(1, compiled.directives().directivesOfKind(DirectiveKind.LOOKUP).size());
		assertFalse(compiled.text().contains("struct t1_key"));
	}

	@Test
	public void defaultActionIsRecorded() {
		P4Table t1 = exactTable("t1", "a").defaultAction("a", "7");
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).build());
		assertTrue(compiled.has(DirectiveKind.COMMENT, "default action a(7)"));
	}

	@Test
	public void actionEdgesSelectTheSuccessor() {
		P4Table t2 = exactTable("t2", "a");
		P4Table t1 = exactTable("t1", "a", "b").next("a", t2);
		Compiled compiled = compile(program(t1).action(noOp("a")).action(noOp("b")).table(t1).table(t2).build());

		int a = compiled.directives().indexOfLabel(find(compiled, DirectiveKind.SELECT_CASE, "T1_ACTION_A").stringArg(1));
		int b = compiled.directives().indexOfLabel(find(compiled, DirectiveKind.SELECT_CASE, "T1_ACTION_B").stringArg(1));
		// label, action comment, then the jump
		assertEquals(compiled.program().getLabel(t2), compiled.directives().get(a + 2).stringArg(0));
		assertEquals("end", compiled.directives().get(b + 2).stringArg(0));
	}

	private static String noActionTarget(Compiled compiled, String table) {
		for (Directive label : compiled.directives().directivesOfKind(DirectiveKind.LABEL)) {
			if (label.stringArg(0).startsWith(table + "_noAction_")) {
				Directive jump = compiled.directives().get(compiled.directives().indexOfLabel(label.stringArg(0)) + 1);
				assertEquals(DirectiveKind.GOTO, jump.getKind());
				return jump.stringArg(0);
			}
		}
		return null;
	}

	@Test
	public void missWithoutDefaultActionGoesToTheDefaultNext() {
		P4Table t2 = exactTable("t2", "a");
		P4Table t1 = exactTable("t1", "a").next("a", t2).defaultNext(t2);
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).table(t2).build());

		assertEquals(compiled.program().getLabel(t2), noActionTarget(compiled, "t1"));
		assertEquals("end", noActionTarget(compiled, "t2"));
	}

	@Test
	public void defaultNextIsEmittedEvenWithoutActionEdge() {
		P4Table t2 = exactTable("t2", "a");
		P4Table t1 = exactTable("t1", "a").next("a", null).defaultNext(t2);
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).table(t2).build());

		assertEquals(Arrays.<P4ControlFlowNode>asList(t1, t2), compiled.program().getIngressEmissionOrder());
		assertEquals(1, compiled.definitions(compiled.program().getLabel(t2)));
		assertEquals(compiled.program().getLabel(t2), noActionTarget(compiled, "t1"));
	}

	@Test
	public void hitAndMissEdgesBranchOnTheHitFlag() {
		P4Table t2 = exactTable("t2", "a");
		P4Table t1 = exactTable("t1", "a").next(P4Table.HIT, t2).next(P4Table.MISS, null);
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).table(t2).build());

		Directive hitFlag = null;
		for (Directive variable : compiled.directives().directivesOfKind(DirectiveKind.DECLARE_VARIABLE)) {
			if (variable.stringArg(1).startsWith("t1_hit_")) {
				hitFlag = variable;
			}
		}
		assertNotNull(hitFlag);
		Directive select = find(compiled, DirectiveKind.BRANCH, hitFlag.stringArg(1));
		assertNotNull(select);
		assertEquals(Arrays.asList(compiled.program().getLabel(t2), "end"), select.targetLabels());
	}

	@Test
	public void longestPrefixMatchCarriesThePrefixLength() {
		P4Table t1 = new P4Table("t1")
				.matchOn(P4Expression.field("ethernet", "etherType"), P4MatchKey.MatchType.LPM)
				.action("a");
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).build());

		assertTrue(compiled.text(), compiled.text().contains("struct t1_key {\n    uint32_t prefixlen;\n    uint16_t ethernet_etherType;\n};"));
		boolean prefix = false;
		for (Directive assign : compiled.directives().directivesOfKind(DirectiveKind.ASSIGN)) {
			if (assign.stringArg(0).endsWith(".prefixlen")) {
				assertEquals("16", assign.stringArg(1));
				prefix = true;
			}
		}
		assertTrue(prefix);
	}

	@Test
	public void validMatchReadsTheValidityBit() {
		P4Table t1 = new P4Table("t1").matchOn(P4Expression.header("ethernet"), P4MatchKey.MatchType.VALID).action("a");
		Compiled compiled = compile(program(t1).action(noOp("a")).table(t1).build());

		boolean found = false;
		for (Directive assign : compiled.directives().directivesOfKind(DirectiveKind.ASSIGN)) {
			if (assign.stringArg(0).endsWith(".ethernet_valid")) {
				assertEquals("llvm_headers.ethernet.valid", assign.stringArg(1));
				found = true;
			}
		}
		assertTrue(found);
	}

	@Test
	public void ternaryMatchIsNotSupported() {
		P4Table t1 = new P4Table("t1")
				.matchOn(P4Expression.field("ethernet", "etherType"), P4MatchKey.MatchType.TERNARY)
				.action("a");
		Hlir hlir = program(t1).action(noOp("a")).table(t1).build();
		NotSupportedException e = assertThrows(NotSupportedException.class, () -> compile(hlir));
		assertEquals("t1", e.getName());
		assertEquals("ternary match in table", e.getFeature());
	}

	@Test
	public void inconsistentTablesAreRejected() {
		P4Table empty = exactTable("t1");
		assertThrows(CompilationException.class, () -> compile(program(empty).table(empty).build()));

		P4Table foreignDefault = exactTable("t1", "a").defaultAction("b");
		assertThrows(
				CompilationException.class,
				() -> compile(program(foreignDefault).action(noOp("a")).action(noOp("b")).table(foreignDefault).build()));

		P4Table undeclared = exactTable("t1", "a");
		EntityNotFoundException e = assertThrows(
				EntityNotFoundException.class,
				() -> compile(program(undeclared).table(undeclared).build()));
		assertEquals(EntityNotFoundException.Kind.ACTION, e.getKind());
		assertEquals("a", e.getName());
	}
}

package org.metricshub.p4llvm.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.p4llvm.HlirTestSupport.compile;
import static org.metricshub.p4llvm.HlirTestSupport.declarations;
import static org.metricshub.p4llvm.HlirTestSupport.exactTable;
import static org.metricshub.p4llvm.HlirTestSupport.noOp;
import static org.metricshub.p4llvm.HlirTestSupport.program;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.HlirTestSupport.Compiled;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4ConditionalNode;
import org.metricshub.p4llvm.hlir.P4ControlFlowNode;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.Directive;
import org.metricshub.p4llvm.intermediate.DirectiveKind;
import org.metricshub.p4llvm.intermediate.DirectiveList;

public class PipelineLinearizationTest {

	private static P4ConditionalNode ethernetValid(String name) {
		return new P4ConditionalNode(name, P4Expression.valid("ethernet"));
	}

	@Test
	public void diamondIsEmittedOnce() {
		P4Table t3 = exactTable("t3", "a");
		P4Table t1 = exactTable("t1", "a").next("a", t3);
		P4Table t2 = exactTable("t2", "a").next("a", t3);
		P4ConditionalNode c1 = ethernetValid("c1").whenTrue(t1).whenFalse(t2);
		Hlir hlir = program(c1).action(noOp("a")).table(t1).table(t2).table(t3).conditional(c1).build();

		Compiled compiled = compile(hlir);
		LlvmProgram program = compiled.program();

		List<P4ControlFlowNode> order = program.getIngressEmissionOrder();
		assertEquals(4, order.size());
		assertSame(c1, order.get(0));
		assertEquals(new HashSet<P4ControlFlowNode>(Arrays.<P4ControlFlowNode>asList(c1, t1, t2, t3)), new HashSet<P4ControlFlowNode>(order));
		for (P4ControlFlowNode node : order) {
			assertEquals(node.getName(), 1, compiled.definitions(program.getLabel(node)));
		}
		assertTrue(program.getEgressEmissionOrder().isEmpty());
	}

	@Test
	public void conditionalBranchesToItsSuccessors() {
		P4Table t1 = exactTable("t1", "a");
		P4ConditionalNode c1 = ethernetValid("c1").whenTrue(t1).whenFalse(null);
		Compiled compiled = compile(program(c1).action(noOp("a")).table(t1).conditional(c1).build());

		String label = compiled.program().getLabel(t1);
		assertTrue(compiled.has(DirectiveKind.BRANCH, "(llvm_headers.ethernet.valid != 0)"));
		int branch = compiled.directives().indexOfLabel(compiled.program().getLabel(c1)) + 2;
		assertEquals(DirectiveKind.BRANCH, compiled.directives().get(branch).getKind());
		assertEquals(Arrays.asList(label, "end"), compiled.directives().get(branch).targetLabels());
	}

	@Test
	public void cycleThroughAConditionalIsEmittedOnce() {
		P4Table t1 = exactTable("t1", "a");
		P4ConditionalNode c1 = ethernetValid("c1").whenTrue(t1).whenFalse(null);
		t1.next("a", c1);
		Compiled compiled = compile(program(c1).action(noOp("a")).table(t1).conditional(c1).build());
		LlvmProgram program = compiled.program();

		assertEquals(Arrays.<P4ControlFlowNode>asList(c1, t1), program.getIngressEmissionOrder());
		assertEquals(1, compiled.definitions(program.getLabel(c1)));
		assertEquals(1, compiled.definitions(program.getLabel(t1)));

		String actionLabel = null;
		for (Directive selectCase : compiled.directives().directivesOfKind(DirectiveKind.SELECT_CASE)) {
			if (selectCase.stringArg(0).equals("T1_ACTION_A")) {
				actionLabel = selectCase.stringArg(1);
			}
		}
		// label, action comment, then the jump back
		Directive back = compiled.directives().get(compiled.directives().indexOfLabel(actionLabel) + 2);
		assertEquals(DirectiveKind.GOTO, back.getKind());
		assertEquals(program.getLabel(c1), back.stringArg(0));
	}

	@Test
	public void nullSuccessorsAreNotEmitted() {
		P4ConditionalNode c1 = ethernetValid("c1").whenTrue(null).whenFalse(null);
		Compiled compiled = compile(program(c1).conditional(c1).build());

		assertEquals(Collections.singletonList(c1), compiled.program().getIngressEmissionOrder());
		assertTrue(compiled.jumpTargets().contains("end"));
	}

	@Test
	public void ingressFallsThroughToEgress() {
		P4Table eg = exactTable("eg", "a");
		P4Table t1 = exactTable("t1", "a");
		Hlir hlir = program(t1).action(noOp("a")).table(t1).table(eg).egressEntry(eg).build();

		Compiled compiled = compile(hlir);
		LlvmProgram program = compiled.program();

		assertEquals(Collections.<P4ControlFlowNode>singletonList(t1), program.getIngressEmissionOrder());
		assertEquals(Collections.<P4ControlFlowNode>singletonList(eg), program.getEgressEmissionOrder());
		String egLabel = program.getLabel(eg);
		assertEquals(1, compiled.definitions(egLabel));
		assertTrue(compiled.jumpTargets().contains(egLabel));
		assertTrue(
				compiled.directives().indexOfLabel(program.getLabel(t1)) < compiled.directives().indexOfLabel(egLabel));
	}

	@Test
	public void egressEntryReachedFromIngressIsEmittedInEgress() {
		P4Table eg = exactTable("eg", "a");
		P4Table t1 = exactTable("t1", "a").next("a", eg);
		Hlir hlir = program(t1).action(noOp("a")).table(t1).table(eg).egressEntry(eg).build();

		LlvmProgram program = compile(hlir).program();
		assertEquals(Collections.<P4ControlFlowNode>singletonList(t1), program.getIngressEmissionOrder());
		assertEquals(Collections.<P4ControlFlowNode>singletonList(eg), program.getEgressEmissionOrder());
	}

	@Test
	public void sharedEntryPointIsEmittedOnce() {
		P4Table t1 = exactTable("t1", "a");
		P4ConditionalNode c1 = ethernetValid("c1").whenTrue(t1);
		P4ParseState start = new P4ParseState("start")
				.extract("ethernet")
				.selectOn(P4Expression.field("ethernet", "etherType"))
				.transition("0x0800", c1)
				.transition(P4ParseState.DEFAULT, c1);
		Hlir hlir = declarations().parseState(start).action(noOp("a")).table(t1).conditional(c1).build();

		Compiled compiled = compile(hlir);
		assertEquals(2, compiled.program().getEntryPoints().size());
		assertEquals(1, compiled.definitions(compiled.program().getLabel(c1)));
		assertEquals(2, compiled.program().getIngressEmissionOrder().size());
	}

	@Test
	public void nodeSharedByBothPipelinesIsRejected() {
		P4Table shared = exactTable("shared", "a");
		P4Table eg = exactTable("eg", "a").next("a", shared);
		P4Table t1 = exactTable("t1", "a").next("a", shared);
		Hlir hlir = program(t1).action(noOp("a")).table(t1).table(eg).table(shared).egressEntry(eg).build();

		NotSupportedException e = assertThrows(NotSupportedException.class, () -> compile(hlir));
		assertFalse(e.isBug());
		assertEquals("shared", e.getName());
		assertEquals("control-flow node shared by ingress and egress", e.getFeature());
	}

	@Test
	public void undeclaredNodeIsReported() {
		P4Table stray = exactTable("stray", "a");
		Hlir hlir = program(stray).action(noOp("a")).build();
		assertThrows(CompilationException.class, () -> compile(hlir));
	}

	@Test
	public void nodeMustBeTheDeclaredOne() {
		P4Table declared = exactTable("t1", "a");
		P4Table impostor = exactTable("t1", "a");
		Hlir hlir = program(impostor).action(noOp("a")).table(declared).build();
		CompilationException e = assertThrows(CompilationException.class, () -> compile(hlir));
		assertTrue(e.isBug());
	}

	@Test
	public void emptyPipelineGoesStraightToTheDeparser() {
		Compiled compiled = compile(program(null).build());
		assertTrue(compiled.program().getIngressEmissionOrder().isEmpty());
		assertTrue(compiled.program().getEntryPoints().isEmpty());
		assertTrue(compiled.has(DirectiveKind.GOTO, "end"));
	}

	@Test
	public void seedsAreFilteredAgainstEarlierPasses() {
		P4Table t1 = exactTable("t1", "a");
		LlvmProgram program = new LlvmProgram("seeds", program(t1).action(noOp("a")).table(t1).build());

		List<P4ControlFlowNode> emitted = program.generatePipelineInternal(
				new DirectiveList(),
				Arrays.<P4ControlFlowNode>asList(t1, null, t1),
				null,
				Collections.<P4ControlFlowNode>emptyList());
		assertEquals(Collections.<P4ControlFlowNode>singletonList(t1), emitted);

		assertThrows(
				CompilationException.class,
				() -> program.generatePipelineInternal(
						new DirectiveList(),
						Collections.<P4ControlFlowNode>singletonList(t1),
						null,
						Collections.<P4ControlFlowNode>singletonList(t1)));
	}
}

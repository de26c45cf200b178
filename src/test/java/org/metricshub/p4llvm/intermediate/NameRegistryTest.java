package org.metricshub.p4llvm.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.p4llvm.hlir.P4ConditionalNode;
import org.metricshub.p4llvm.hlir.P4Expression;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4Table;

public class NameRegistryTest {

	@Test
	public void freshNamesAppendGrowingCounter() {
		NameRegistry names = new NameRegistry();
		assertEquals("x_0", names.freshName("x"));
		assertEquals("x_1", names.freshName("x"));
		assertEquals("x_2", names.freshName("x"));
	}

	@Test
	public void counterIsSharedAcrossBases() {
		NameRegistry names = new NameRegistry();
		assertEquals("a_0", names.freshName("a"));
		assertEquals("b_1", names.freshName("b"));
	}

	@Test
	public void registriesAreIndependent() {
		NameRegistry first = new NameRegistry();
		NameRegistry second = new NameRegistry();
		first.freshName("x");
		assertEquals("x_0", second.freshName("x"));
	}

	@Test
	public void nullLabelIsEnd() {
		NameRegistry names = new NameRegistry();
		assertEquals(NameRegistry.END, names.labelFor(null));
		assertEquals("end", names.labelFor(null));
		assertTrue(names.getLabels().isEmpty());
	}

	@Test
	public void parseStateIsLabeledWithItsName() {
		NameRegistry names = new NameRegistry();
		P4ParseState start = new P4ParseState("parse_ethernet");
		assertEquals("parse_ethernet", names.labelFor(start));
		// the counter is untouched
		assertEquals("y_0", names.freshName("y"));
	}

	@Test
	public void controlFlowNodeGetsStableFreshLabel() {
		NameRegistry names = new NameRegistry();
		P4Table table = new P4Table("t1");
		assertFalse(names.hasLabel(table));
		String label = names.labelFor(table);
		assertEquals("t1_0", label);
		assertSame(label, names.labelFor(table));
		assertEquals("t1_0", names.labelFor(table));
		assertTrue(names.hasLabel(table));
	}

	@Test
	public void labelsAreKeyedByIdentity() {
		NameRegistry names = new NameRegistry();
		P4ConditionalNode first = new P4ConditionalNode("c", P4Expression.valid("ethernet"));
		P4ConditionalNode second = new P4ConditionalNode("c", P4Expression.valid("ethernet"));
		assertNotEquals(names.labelFor(first), names.labelFor(second));
		assertEquals(2, names.getLabels().size());
	}

	@Test
	public void parseStateNamedEndGetsAFreshLabel() {
		NameRegistry names = new NameRegistry();
		P4ParseState end = new P4ParseState("end");
		String label = names.labelFor(end);
		assertEquals("end_0", label);
		assertNotEquals(names.labelFor(null), label);
		assertEquals(label, names.labelFor(end));
	}

	@Test
	public void parseStateCannotReuseAnIssuedName() {
		NameRegistry names = new NameRegistry();
		assertEquals("t1_0", names.labelFor(new P4Table("t1")));
		assertEquals("t1_0_1", names.labelFor(new P4ParseState("t1_0")));
	}

	@Test
	public void freshNamesSkipParseStateLabels() {
		NameRegistry names = new NameRegistry();
		assertEquals("x_0", names.labelFor(new P4ParseState("x_0")));
		assertEquals("x_1", names.freshName("x"));
	}
}

package org.metricshub.p4llvm.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;

public class ProgramPrinterTest {

	@Test
	public void rendersStructs() {
		DirectiveList list = new DirectiveList();
		list.beginStruct("ethernet_t");
		list.structField("uint8_t", "dstAddr", 6);
		list.structField("uint16_t", "etherType", 0);
		list.endStruct();
		assertEquals(
				"struct ethernet_t {\n" + "    uint8_t dstAddr[6];\n" + "    uint16_t etherType;\n" + "};\n\n",
				new ProgramPrinter().print(list));
	}

	@Test
	public void labelsAreOutdented() {
		DirectiveList list = new DirectiveList();
		list.beginFunction("int", "f", Collections.<String>emptyList());
		list.gotoLabel("out");
		list.label("out");
		list.returnValue("0");
		list.endFunction();
		assertEquals(
				"\nint f() {\n" + "    goto out;\n" + "out:\n" + "    return 0;\n" + "}\n",
				new ProgramPrinter().print(list));
	}

	@Test
	public void rendersSelectAndPacketAccess() {
		DirectiveList list = new DirectiveList();
		list.label("s");
		list.load("h.f", "pkt", "off + 0", 16);
		list.store("h.f", "pkt", "off + 0", 16);
		list.beginSelect("h.f");
		list.selectCase("0x0800", "s");
		list.selectDefault("s");
		list.endSelect();
		String text = new ProgramPrinter(2).print(list);
		assertTrue(text, text.contains("h.f = llvm_load_bits(pkt, off + 0, 16);"));
		assertTrue(text, text.contains("llvm_store_bits(pkt, off + 0, 16, h.f);"));
		assertTrue(text, text.contains("switch (h.f) {\n  case 0x0800: goto s;\n  default: goto s;\n}"));
	}

	@Test
	public void rendersDeclarations() {
		DirectiveList list = new DirectiveList();
		list.declareEnum("E", Arrays.asList("A", "B"));
		list.declareTable("t", "struct t_key", "struct t_value", 64);
		list.declareCounter("c", "uint64_t", 4);
		list.beginInitializer("struct m_t", "m");
		list.initializerField("a", "0");
		list.endInitializer();
		String text = new ProgramPrinter().print(list);
		assertTrue(text, text.contains("enum E {\n    A,\n    B\n};"));
		assertTrue(
				text,
				text.contains(
						"struct llvm_table_def t = { .key_size = sizeof(struct t_key), .value_size = sizeof(struct t_value), .max_entries = 64 };"));
		assertTrue(text, text.contains("uint64_t c[4];"));
		assertTrue(text, text.contains("struct m_t m = {\n    .a = 0,\n};"));
	}

	@Test
	public void malformedListIsNotRendered() {
		DirectiveList list = new DirectiveList();
		list.gotoLabel("missing");
		assertThrows(CompilationException.class, () -> new ProgramPrinter().print(list));
	}

	@Test
	public void negativeIndentationIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new ProgramPrinter(-1));
	}
}

package org.metricshub.p4llvm.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.p4llvm.HlirTestSupport.ETHERNET_T;
import static org.metricshub.p4llvm.HlirTestSupport.VLAN_T;
import static org.metricshub.p4llvm.HlirTestSupport.compile;
import static org.metricshub.p4llvm.HlirTestSupport.declarations;
import static org.metricshub.p4llvm.HlirTestSupport.exactTable;
import static org.metricshub.p4llvm.HlirTestSupport.noOp;
import static org.metricshub.p4llvm.HlirTestSupport.program;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;
import org.metricshub.p4llvm.EntityNotFoundException;
import org.metricshub.p4llvm.HlirTestSupport.Compiled;
import org.metricshub.p4llvm.NotSupportedException;
import org.metricshub.p4llvm.hlir.Hlir;
import org.metricshub.p4llvm.hlir.P4Action;
import org.metricshub.p4llvm.hlir.P4FieldListCalculation;
import org.metricshub.p4llvm.hlir.P4HeaderInstance;
import org.metricshub.p4llvm.hlir.P4HeaderType;
import org.metricshub.p4llvm.hlir.P4ParseState;
import org.metricshub.p4llvm.hlir.P4Table;
import org.metricshub.p4llvm.intermediate.DirectiveKind;

public class LlvmProgramTest {

	@Test
	public void classifiesInstances() {
		P4ParseState start = new P4ParseState("start").extract("ethernet").extract("vlan").then(null);
		Hlir hlir = declarations().headerType(VLAN_T).headerStack("vlan", 3, VLAN_T).parseState(start).build();

		LlvmProgram program = new LlvmProgram("classify", hlir);

		assertEquals(1, program.getHeaders().size());
		assertEquals("ethernet", program.getHeaders().get(0).getName());
		assertEquals(LlvmInstance.InstanceKind.HEADER, program.getHeaders().get(0).getKind());
		assertEquals(1, program.getMetadata().size());
		assertEquals(LlvmInstance.InstanceKind.METADATA, program.getMetadata().get(0).getKind());
		assertFalse(program.getMetadata().get(0).hasValidity());

		// only the first element materializes the stack
		assertEquals(1, program.getStacks().size());
		LlvmHeaderStack vlan = program.getStacks().get(0);
		assertEquals("vlan", vlan.getName());
		assertEquals(3, vlan.getSize());
		assertEquals(2, vlan.getMaxIndex());
		assertEquals("vlan_index_0", vlan.getIndexVariable());
		assertEquals(LlvmInstance.InstanceKind.HEADER_STACK, vlan.getKind());
		assertTrue(program.hasStackInstance("vlan"));
		assertFalse(program.hasStackInstance("ethernet"));
	}

	@Test
	public void stackElementAccess() {
		P4ParseState start = new P4ParseState("start").extract("vlan").then(null);
		Hlir hlir = Hlir.builder().headerType(VLAN_T).headerStack("vlan", 2, VLAN_T).parseState(start).build();
		LlvmHeaderStack vlan = new LlvmProgram("stack", hlir).getStackInstance("vlan");

		assertEquals("llvm_headers.vlan[vlan_index_0]", vlan.getElementAccess(LlvmHeaderStack.NEXT));
		assertEquals("llvm_headers.vlan[vlan_index_0 - 1]", vlan.getElementAccess(LlvmHeaderStack.LAST));
		assertEquals("llvm_headers.vlan[1]", vlan.getElementAccess("1"));
		assertThrows(CompilationException.class, () -> vlan.getElementAccess("2"));
		assertThrows(CompilationException.class, () -> vlan.getElementAccess("first"));
	}

	@Test
	public void fieldAccessResolvesEveryInstanceKind() {
		P4ParseState start = new P4ParseState("start").extract("ethernet").then(null);
		Hlir hlir = declarations().headerType(VLAN_T).headerStack("vlan", 2, VLAN_T).parseState(start).build();
		LlvmProgram program = new LlvmProgram("access", hlir);

		assertEquals("llvm_headers.ethernet.etherType", program.getFieldAccess("ethernet", "etherType"));
		assertEquals("llvm_metadata.standard_metadata.egress_port", program.getFieldAccess("standard_metadata", "egress_port"));
		assertEquals("llvm_headers.vlan[1].vid", program.getFieldAccess("vlan[1]", "vid"));
		assertEquals("llvm_headers.vlan[vlan_index_0 - 1].vid", program.getFieldAccess("vlan[last]", "vid"));
		assertThrows(CompilationException.class, () -> program.getFieldAccess("ethernet", "ttl"));
	}

	@Test
	public void calculatedFieldsAreNotSupported() {
		Hlir hlir = program(null).fieldListCalculation(new P4FieldListCalculation("ipv4_checksum", "csum16")).build();
		NotSupportedException e = assertThrows(NotSupportedException.class, () -> new LlvmProgram("csum", hlir));
		assertEquals("ipv4_checksum", e.getName());
		assertEquals("calculated field", e.getFeature());
		assertFalse(e.isBug());
	}

	@Test
	public void duplicateNamesAreRejected() {
		Hlir tables = program(null)
				.action(noOp("a"))
				.table(exactTable("t", "a"))
				.table(exactTable("t", "a"))
				.build();
		CompilationException e = assertThrows(CompilationException.class, () -> new LlvmProgram("dup", tables));
		assertTrue(e.getMessage(), e.getMessage().contains("table"));

		Hlir instances = program(null).headerInstance(P4HeaderInstance.header("ethernet", ETHERNET_T)).build();
		assertThrows(CompilationException.class, () -> new LlvmProgram("dup", instances));
	}

	@Test
	public void lookupsReportWhatIsMissing() {
		LlvmProgram program = new LlvmProgram("lookup", program(null).build());

		EntityNotFoundException table = assertThrows(EntityNotFoundException.class, () -> program.getTable("nope"));
		assertEquals(EntityNotFoundException.Kind.TABLE, table.getKind());
		assertEquals("nope", table.getName());
		assertEquals(
				EntityNotFoundException.Kind.CONDITIONAL,
				assertThrows(EntityNotFoundException.class, () -> program.getConditional("c")).getKind());
		assertEquals(
				EntityNotFoundException.Kind.ACTION,
				assertThrows(EntityNotFoundException.class, () -> program.getAction("a")).getKind());
		assertEquals(
				EntityNotFoundException.Kind.COUNTER,
				assertThrows(EntityNotFoundException.class, () -> program.getCounter("c")).getKind());
		assertEquals(
				EntityNotFoundException.Kind.STACK,
				assertThrows(EntityNotFoundException.class, () -> program.getStackInstance("vlan")).getKind());
		assertEquals(
				EntityNotFoundException.Kind.HEADER,
				assertThrows(EntityNotFoundException.class, () -> program.getHeaderInstance("standard_metadata")).getKind());
		assertEquals(
				EntityNotFoundException.Kind.PARSE_STATE,
				assertThrows(EntityNotFoundException.class, () -> program.getParser("parse_ipv4")).getKind());
		assertSame(program.getHlir().getStartState(), program.getParser("start").getParseState());
	}

	@Test
	public void unknownTransitionTargetIsReported() {
		P4ParseState stray = new P4ParseState("parse_vlan");
		P4ParseState start = new P4ParseState("start").extract("ethernet").then(stray);
		Hlir hlir = declarations().parseState(start).build();
		EntityNotFoundException e = assertThrows(EntityNotFoundException.class, () -> new LlvmProgram("stray", hlir));
		assertEquals(EntityNotFoundException.Kind.PARSE_STATE, e.getKind());
	}

	@Test
	public void metadataStartsWithDeclaredValues() {
		P4HeaderType type = P4HeaderType.builder("meta_t").field("a", 8).field("b", 128).build();
		Hlir hlir = program(null)
				.headerType(type)
				.headerInstance(P4HeaderInstance.metadata("meta", type, Collections.singletonMap("a", "5")))
				.build();
		Compiled compiled = compile(hlir);

		assertEquals("{ .a = 5, .b = { 0 } }", compiled.program().getMetadata().get(1).getInitializer());
		assertTrue(compiled.has(DirectiveKind.INITIALIZER_FIELD, "{ .a = 5, .b = { 0 } }"));
		assertTrue(compiled.has(DirectiveKind.INITIALIZER_FIELD, "{ .valid = 0 }"));
	}

	@Test
	public void missingEgressPortIsAWarning() {
		P4ParseState start = new P4ParseState("start").extract("ethernet").then(null);
		Hlir hlir = Hlir
				.builder()
				.headerType(ETHERNET_T)
				.headerInstance(P4HeaderInstance.header("ethernet", ETHERNET_T))
				.parseState(start)
				.build();
		Compiled compiled = compile(hlir);

		assertEquals(1, compiled.program().getWarningCount());
		assertEquals("0", compiled.program().getEgressPortExpression());
		assertTrue(compiled.text().contains("return 0;"));
	}

	@Test
	public void egressPortComesFromMetadata() {
		Compiled compiled = compile(program(null).build());
		assertEquals(0, compiled.program().getWarningCount());
		assertEquals("llvm_metadata.standard_metadata.egress_port", compiled.program().getEgressPortExpression());
		assertTrue(compiled.has(DirectiveKind.RETURN, "llvm_metadata.standard_metadata.egress_port"));
		assertTrue(compiled.has(DirectiveKind.RETURN, "-1"));
	}

	@Test
	public void programLayout() {
		Compiled compiled = compile(program(null).build());
		String text = compiled.text();

		assertTrue(text, text.startsWith("// Program "));
		assertTrue(text, text.contains("enum ErrorCode {\n    p4_pe_no_error,"));
		assertTrue(text, text.contains("struct ethernet_t {\n    uint64_t dstAddr;\n    uint64_t srcAddr;\n    uint16_t etherType;\n    uint8_t valid;\n};"));
		assertTrue(text, text.contains("struct llvm_headers_t {\n    struct ethernet_t ethernet;\n};"));
		assertTrue(text, text.contains("int llvm_filter(uint8_t *llvm_packet, uint32_t llvm_packetSize) {"));
		assertTrue(text, text.contains("enum ErrorCode llvm_error = p4_pe_no_error;"));
		assertTrue(text, text.indexOf("goto start;") < text.indexOf("start:"));
		assertTrue(text, text.indexOf("end:") < text.indexOf("// deparser"));
		assertEquals(1, compiled.definitions("end"));
	}

	@Test
	public void internalActionsOnlyWarn() {
		P4Table t1 = exactTable("t1", "_nop");
		Hlir hlir = program(t1)
				.action(P4Action.builder("_nop").call("no_op").lineNumber(-1).build())
				.table(t1)
				.build();
		Compiled compiled = compile(hlir);
		assertTrue(compiled.program().getAction("_nop").isInternal());
		assertEquals(1, compiled.program().getWarningCount());
	}

	@Test
	public void namesAreScopedToOneProgram() {
		Hlir hlir = program(null).build();
		LlvmProgram first = new LlvmProgram("a", hlir);
		LlvmProgram second = new LlvmProgram("b", hlir);
		assertEquals(first.freshName("x"), second.freshName("x"));
	}
}

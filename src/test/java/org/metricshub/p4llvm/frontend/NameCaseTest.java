package org.metricshub.p4llvm.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class NameCaseTest {

	@Test
	public void pascalCase() {
		assertEquals("Ipv4Lpm", NameCase.pascalCase("ipv4_lpm"));
		assertEquals("SendFrame", NameCase.pascalCase("send_frame"));
		assertEquals("Drop", NameCase.pascalCase("_drop"));
		assertEquals("ParseVlanTag", NameCase.pascalCase("PARSE.vlan-tag"));
		assertEquals("", NameCase.pascalCase("__"));
	}

	@Test
	public void camelCase() {
		assertEquals("ipv4Lpm", NameCase.camelCase("ipv4_lpm"));
		assertEquals("setNhop", NameCase.camelCase("set_nhop"));
		assertEquals("", NameCase.camelCase(""));
	}
}

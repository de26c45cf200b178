package org.metricshub.p4llvm.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;
import org.json.JSONObject;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;

public class ExpressionFlattenerTest {

	private static JSONObject json(String text) {
		return new JSONObject(text.replace('\'', '"'));
	}

	@Test
	public void fieldsAreJoinedWithDollar() {
		assertEquals("ipv4$ttl", ExpressionFlattener.flattenToString(json("{'type': 'field', 'value': ['ipv4', 'ttl']}")));
		assertEquals("ipv4", ExpressionFlattener.flattenToString(json("{'type': 'header', 'value': 'ipv4'}")));
	}

	@Test
	public void binaryOperation() {
		JSONObject expression = json(
				"{'type': 'expression', 'value': {'op': '+', "
						+ "'left': {'type': 'field', 'value': ['ipv4', 'ttl']}, "
						+ "'right': {'type': 'hexstr', 'value': '0x1'}}}");
		ExpressionFlattener flattener = new ExpressionFlattener();
		StringBuilder out = new StringBuilder();
		flattener.flatten(expression, out);
		assertEquals("(ipv4$ttl + 0x1)", out.toString());
		assertEquals(Arrays.asList("ipv4$ttl"), flattener.getReferences());
	}

	@Test
	public void unaryAndTernary() {
		assertEquals(
				"(-0x1)",
				ExpressionFlattener.flattenToString(
						json("{'type': 'expression', 'value': {'op': '-', 'left': null, 'right': {'type': 'hexstr', 'value': '0x1'}}}")));
		assertEquals(
				"(true ? a$x : 0x0)",
				ExpressionFlattener.flattenToString(
						json(
								"{'type': 'expression', 'value': {'op': '?', "
										+ "'cond': {'type': 'bool', 'value': true}, "
										+ "'left': {'type': 'field', 'value': ['a', 'x']}, "
										+ "'right': {'type': 'hexstr', 'value': '0x0'}}}")));
	}

	@Test
	public void nestedExpressionsAreUnwrapped() {
		assertEquals(
				"((a$x & 0xff) == 0x1)",
				ExpressionFlattener.flattenToString(
						json(
								"{'type': 'expression', 'value': {'op': '==', "
										+ "'left': {'type': 'expression', 'value': {'type': 'expression', 'value': {'op': '&', "
										+ "'left': {'type': 'field', 'value': ['a', 'x']}, 'right': {'type': 'hexstr', 'value': '0xff'}}}}, "
										+ "'right': {'type': 'hexstr', 'value': '0x1'}}}")));
	}

	@Test
	public void unknownTypeIsRejected() {
		assertThrows(
				CompilationException.class,
				() -> ExpressionFlattener.flattenToString(json("{'type': 'stack_field', 'value': ['vlan', 'vid']}")));
	}
}

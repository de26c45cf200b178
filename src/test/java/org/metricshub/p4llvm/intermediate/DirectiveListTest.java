package org.metricshub.p4llvm.intermediate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.p4llvm.CompilationException;

public class DirectiveListTest {

	private static DirectiveList smallFunction() {
		DirectiveList list = new DirectiveList();
		list.beginFunction("int", "f", Collections.singletonList("uint8_t *p"));
		list.declareVariable("uint8_t", "x", "0");
		list.branch("x", "yes", "no");
		list.label("yes");
		list.returnValue("1");
		list.label("no");
		list.returnValue("0");
		list.endFunction();
		return list;
	}

	@Test
	public void recordsCallsInOrder() {
		DirectiveList list = smallFunction();
		assertEquals(8, list.size());
		assertEquals(DirectiveKind.BEGIN_FUNCTION, list.get(0).getKind());
		assertEquals(Arrays.asList("uint8_t *p"), list.get(0).stringArgs(2));
		assertEquals(Arrays.asList("yes", "no"), list.get(2).targetLabels());
		assertEquals(3, list.indexOfLabel("yes"));
		assertEquals(-1, list.indexOfLabel("maybe"));
		assertEquals(2, list.directivesOfKind(DirectiveKind.RETURN).size());
	}

	@Test
	public void duplicateLabelIsRejected() {
		DirectiveList list = new DirectiveList();
		list.label("l");
		CompilationException e = assertThrows(CompilationException.class, () -> list.label("l"));
		assertTrue(e.isBug());
	}

	@Test
	public void jumpToUndefinedLabelFailsPostProcessing() {
		DirectiveList list = new DirectiveList();
		list.gotoLabel("nowhere");
		CompilationException e = assertThrows(CompilationException.class, list::postProcess);
		assertTrue(e.getMessage().contains("nowhere"));
	}

	@Test
	public void unclosedBlockFailsPostProcessing() {
		DirectiveList list = new DirectiveList();
		list.beginStruct("s");
		assertThrows(CompilationException.class, list::postProcess);
	}

	@Test
	public void mismatchedCloseIsRejected() {
		DirectiveList list = new DirectiveList();
		list.beginSelect("x");
		assertThrows(CompilationException.class, list::endStruct);
	}

	@Test
	public void postProcessIsIdempotentAndFreezes() {
		DirectiveList list = smallFunction();
		list.postProcess();
		list.postProcess();
		assertThrows(IllegalStateException.class, () -> list.comment("late"));
	}

	@Test
	public void longOperandsAreTyped() {
		DirectiveList list = new DirectiveList();
		list.load("x", "p", "o", 12);
		Directive load = list.get(0);
		assertEquals(12L, load.longArg(3));
		assertThrows(Error.class, () -> load.longArg(0));
		assertThrows(Error.class, () -> load.stringArg(3));
	}

	@Test
	public void dumpNumbersDirectives() throws Exception {
		DirectiveList list = new DirectiveList();
		list.label("start");
		list.gotoLabel("start");
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		list.dump(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		String dump = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(dump, dump.contains("0 : [start]"));
		assertTrue(dump, dump.contains("1 : GOTO, \"start\""));
	}
}

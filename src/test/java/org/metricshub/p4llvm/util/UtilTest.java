package org.metricshub.p4llvm.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Test;

public class UtilTest {

	@Test
	public void inlineSourceHandsOutItsReader() throws IOException {
		Reader reader = new StringReader("{}");
		HlirSource source = new HlirSource(HlirSource.DESCRIPTION_INLINE, reader);
		assertEquals("<inline-hlir>", source.getDescription());
		assertEquals("<inline-hlir>", source.toString());
		assertSame(reader, source.getReader());
	}

	@Test
	public void fileSourceIsReadAsUtf8() throws IOException {
		File tmp = File.createTempFile("p4llvm", ".json");
		tmp.deleteOnExit();
		Files.write(tmp.toPath(), "{\"name\": \"déjà\"}".getBytes(StandardCharsets.UTF_8));

		HlirSource source = HlirSource.fromFile(tmp.getPath());
		assertEquals(tmp.getPath(), source.getDescription());
		try (BufferedReader reader = new BufferedReader(source.getReader())) {
			assertEquals("{\"name\": \"déjà\"}", reader.readLine());
		}
	}

	@Test
	public void settingsDefaults() {
		LlvmSettings settings = new LlvmSettings();
		assertEquals(LlvmSettings.DEFAULT_PROGRAM_NAME, settings.getProgramName());
		assertFalse(settings.isDumpDirectives());
		assertSame(System.out, settings.getOutputStream());

		settings.setProgramName("router");
		settings.setDumpDirectives(true);
		settings.setIndentWidth(2);
		String description = settings.toDescriptionString();
		assertTrue(description.contains("programName = router\n"));
		assertTrue(description.contains("dumpDirectives = true\n"));
		assertTrue(description.contains("indentWidth = 2\n"));
	}

	@Test
	public void warningsHaveTheirOwnLogger() {
		assertEquals(P4Logger.WARNINGS, P4Logger.getWarningLogger().getName());
		assertEquals(UtilTest.class.getName(), P4Logger.getLogger(UtilTest.class).getName());
	}
}

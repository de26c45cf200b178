package org.metricshub.p4llvm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import org.junit.Test;

public class CliTest {

	private static File routerFile() throws Exception {
		File tmp = File.createTempFile("p4llvm", ".json");
		tmp.deleteOnExit();
		try (InputStream in = CliTest.class.getResourceAsStream("/simple_router.json")) {
			Files.copy(in, tmp.toPath(), StandardCopyOption.REPLACE_EXISTING);
		}
		return tmp;
	}

	@Test
	public void noArgumentsPrintsUsage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = Cli.create(new String[0], new PrintStream(out, false, StandardCharsets.UTF_8.name()));
		assertTrue(cli.isPrintUsage());
		String usage = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(usage, usage.startsWith("Usage:"));
		assertTrue(usage, usage.contains("-f hlir-filename"));
	}

	@Test
	public void helpMustBeAlone() {
		assertTrue(Cli.parseCommandLineArguments(new String[] { "-h" }).isPrintUsage());
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-f", "x.json", "-?" }));
	}

	@Test
	public void descriptionIsRequired() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> Cli.parseCommandLineArguments(new String[] { "-n", "router" }));
		assertEquals("HLIR description not provided (-f).", e.getMessage());
	}

	@Test
	public void invalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-f" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--verbose" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "" }));
		assertThrows(
				IllegalArgumentException.class,
				() -> Cli.parseCommandLineArguments(new String[] { "-f", "x.json", "--indent", "wide" }));
	}

	@Test
	public void optionsConfigureTheSettings() {
		Cli cli = Cli
				.parseCommandLineArguments(new String[] { "-f", "router.json", "-n", "router", "-d", "--indent", "2", "-o", "out.c" });
		assertEquals("router.json", cli.getHlirSource().getDescription());
		assertEquals("router", cli.getSettings().getProgramName());
		assertTrue(cli.getSettings().isDumpDirectives());
		assertEquals(2, cli.getSettings().getIndentWidth());
		assertEquals("out.c", cli.getOutputFile().getName());
		assertFalse(cli.isPrintUsage());
	}

	@Test
	public void compilesToTheOutputStream() throws Exception {
		File router = routerFile();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = Cli.create(new String[] { "-f", router.getAbsolutePath() }, new PrintStream(out, false, StandardCharsets.UTF_8.name()));
		assertNull(cli.getOutputFile());
		String text = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(text, text.contains("int llvm_filter("));
	}

	@Test
	public void compilesToAFile() throws Exception {
		File router = routerFile();
		File output = File.createTempFile("p4llvm", ".c");
		output.deleteOnExit();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli.create(
				new String[] { "-f", router.getAbsolutePath(), "-o", output.getAbsolutePath() },
				new PrintStream(out, false, StandardCharsets.UTF_8.name()));

		assertEquals(0, out.size());
		String text = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
		assertTrue(text, text.contains("int llvm_filter("));
	}

	@Test
	public void exitStatus() throws Exception {
		assertEquals(Main.EXIT_USAGE, Main.invoke(new String[] { "--verbose" }));
		assertEquals(Main.EXIT_FAILURE, Main.invoke(new String[] { "-f", "does-not-exist.json" }));

		File output = File.createTempFile("p4llvm", ".c");
		output.deleteOnExit();
		assertEquals(0, Main.invoke(new String[] { "-f", routerFile().getAbsolutePath(), "-o", output.getAbsolutePath() }));
	}

	@Test
	public void failedCompilationWritesNoFile() throws Exception {
		File broken = File.createTempFile("p4llvm", ".json");
		broken.deleteOnExit();
		Files.write(broken.toPath(), "{ not json".getBytes(StandardCharsets.UTF_8));
		File output = File.createTempFile("p4llvm", ".c");
		assertTrue(output.delete());

		assertEquals(Main.EXIT_FAILURE, Main.invoke(new String[] { "-f", broken.getAbsolutePath(), "-o", output.getAbsolutePath() }));
		assertFalse(output.exists());
	}
}

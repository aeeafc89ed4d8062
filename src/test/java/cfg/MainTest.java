package cfg;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import cfg.report.AnalysisReport;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args){
		return Main.run(args, new PrintStream(out, true), new PrintStream(err, true));
	}

	private String out(){
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err(){
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testExample(){
		assertEquals(0, run("--example", "Simple Unambiguous"));
		assertTrue(out().startsWith(AnalysisReport.TITLE), out());
		assertFalse(out().contains("Sample Strings:"));
	}

	@Test
	public void testDetails(){
		assertEquals(0, run("--details", "--example", "Dangling Else"));
		assertTrue(out().contains("Status: ambiguous"), out());
		assertTrue(out().contains("Sample Strings:"), out());
	}

	@Test
	public void testFile(@TempDir Path folder) throws IOException {
		Path file = folder.resolve("grammar.txt");
		Files.write(file, "E -> E + E | id".getBytes(StandardCharsets.UTF_8));
		assertEquals(0, run(file.toString()));
		assertTrue(out().contains("Status: ambiguous"), out());
	}

	@Test
	public void testInvalidGrammar(@TempDir Path folder) throws IOException {
		Path file = folder.resolve("grammar.txt");
		Files.write(file, "s -> a\nS -> A".getBytes(StandardCharsets.UTF_8));
		assertEquals(1, run(file.toString()));
		assertTrue(err().contains("Error at [1:1]: Non-terminal \"s\" must start with uppercase letter"), err());
		assertTrue(err().contains("Non-terminal \"A\" is used but never defined"), err());
		assertEquals("", out());
	}

	@Test
	public void testDotFiles(@TempDir Path folder){
		Path dot = folder.resolve("trees");
		assertEquals(0, run("--dot", dot.toString(), "--example", "Expression (Ambiguous)"));
		assertTrue(Files.exists(dot.resolve("original_1.dot")));
		assertTrue(Files.exists(dot.resolve("original_2.dot")));
		assertTrue(Files.exists(dot.resolve("converted_1.dot")));
	}

	@Test
	public void testUsageErrors(@TempDir Path folder){
		assertEquals(2, run());
		assertEquals(2, run("--example", "Palindromes"));
		assertEquals(2, run("--dot"));
		assertEquals(2, run(folder.resolve("missing.txt").toString()));
		assertTrue(err().contains("Usage:"), err());
	}

	@Test
	public void testLogsTheGrammarSource(){
		List<String> messages = new ArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				messages.add(record.getMessage());
			}

			@Override
			public void flush() {
			}

			@Override
			public void close() {
			}
		};
		Level level = Config.LOG.getLevel();
		Config.LOG.setLevel(Level.INFO);
		Config.LOG.addHandler(handler);
		try {
			assertEquals(0, run("--example", "Simple Unambiguous", "--details"));
		} finally {
			Config.LOG.removeHandler(handler);
			Config.LOG.setLevel(level);
		}
		assertTrue(messages.contains("Analysing Simple Unambiguous"), messages.toString());
	}
}

package cfg;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.LogManager;

import guru.nidi.graphviz.engine.Format;

import cfg.grammar.*;
import cfg.report.AnalysisReport;
import cfg.tree.ParseTreeDot;
import cfg.tree.ParseTreeGenerator;
import cfg.tree.ParseTreeNode;

import static cfg.Config.LOG;

/**
 * Command line interface: analyses a grammar file and prints the report.
 *
 * <pre>
 * Main [--details] [--dot DIR] [--svg DIR] (FILE | - | --example NAME)
 * </pre>
 */
public class Main {

	private static final String USAGE = "Usage: Main [--details] [--dot DIR] [--svg DIR] (FILE | - | --example NAME)\n" +
			"Examples: " + ExampleGrammars.EXAMPLES.keySet();

	public static void main(String[] args) {
		setupLogging();
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err){
		boolean details = false;
		Path dotFolder = null;
		Path svgFolder = null;
		String source = null;
		String text = null;
		try {
			for (int i = 0; i < args.length; i++){
				switch (args[i]){
					case "--details":
						details = true;
						break;
					case "--dot":
						dotFolder = Paths.get(argument(args, ++i));
						break;
					case "--svg":
						svgFolder = Paths.get(argument(args, ++i));
						break;
					case "--example":
						source = argument(args, ++i);
						if (!ExampleGrammars.EXAMPLES.containsKey(source)){
							err.println("Unknown example \"" + source + "\"\n" + USAGE);
							return 2;
						}
						text = ExampleGrammars.EXAMPLES.get(source);
						break;
					default:
						source = args[i];
						text = read(source);
				}
			}
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage() + "\n" + USAGE);
			return 2;
		} catch (IOException e) {
			err.println("Can't read " + source + ": " + e.getMessage());
			return 2;
		}
		if (text == null){
			err.println(USAGE);
			return 2;
		}
		String name = source;
		LOG.info(() -> "Analysing " + name);
		ParseResult result = GrammarParser.parseGrammar(text);
		if (!result.isSuccess()){
			for (GrammarError error : result.getErrors()){
				err.println(error);
			}
			return 1;
		}
		AnalysisReport report = AnalysisReport.analyze(text, result.getGrammar()).withDetails(details);
		out.print(report.format());
		try {
			if (dotFolder != null){
				writeTrees(report, result.getGrammar(), dotFolder, null);
			}
			if (svgFolder != null){
				writeTrees(report, result.getGrammar(), svgFolder, Format.SVG);
			}
		} catch (IOException e) {
			err.println("Can't write the parse trees: " + e.getMessage());
			return 3;
		}
		return 0;
	}

	private static String argument(String[] args, int index){
		if (index >= args.length){
			throw new IllegalArgumentException(args[index - 1] + " needs an argument");
		}
		return args[index];
	}

	private static String read(String source) throws IOException {
		if (source.equals("-")){
			ByteArrayOutputStream stream = new ByteArrayOutputStream();
			byte[] buffer = new byte[4096];
			int read;
			while ((read = System.in.read(buffer)) != -1){
				stream.write(buffer, 0, read);
			}
			return new String(stream.toByteArray(), StandardCharsets.UTF_8);
		}
		return new String(Files.readAllBytes(Paths.get(source)), StandardCharsets.UTF_8);
	}

	/**
	 * Writes the parse trees of the original and of the converted grammar, as dot files if the
	 * format is null
	 */
	private static void writeTrees(AnalysisReport report, Grammar grammar, Path folder, Format format) throws IOException {
		Files.createDirectories(folder);
		Map<String, Grammar> grammars = new LinkedHashMap<>();
		grammars.put("original", grammar);
		if (report.getTransformation().success){
			grammars.put("converted", report.getTransformation().grammar);
		}
		ParseTreeGenerator generator = new ParseTreeGenerator();
		for (Map.Entry<String, Grammar> entry : grammars.entrySet()){
			List<ParseTreeNode> trees = generator.generate(entry.getValue());
			for (int i = 0; i < trees.size(); i++){
				String name = entry.getKey() + "_" + (i + 1);
				if (format == null){
					Path path = folder.resolve(name + ".dot");
					Files.write(path, ParseTreeDot.toDot(trees.get(i), name).getBytes(StandardCharsets.UTF_8));
				} else {
					ParseTreeDot.render(trees.get(i), name, format, folder.resolve(name + ".svg").toFile());
				}
				LOG.info("Wrote parse tree " + name);
			}
		}
	}

	private static void setupLogging(){
		try (InputStream stream = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
			if (stream != null){
				LogManager.getLogManager().readConfiguration(stream);
			}
		} catch (IOException e) {
			System.err.println("Can't load the logging configuration: " + e.getMessage());
		}
		Level level = Config.logLevel();
		LOG.setLevel(level);
		java.util.logging.Logger.getLogger("cfg").getParent().setLevel(level);
	}
}

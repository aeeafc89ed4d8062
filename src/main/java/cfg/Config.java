package cfg;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default values for the bounded generators and the command line tool.
 *
 * Values are read from a {@value #configFile} resource on the class path and afterwards from a
 * {@value #configFile} file in the working directory (lines of the form <code>key = value</code>).
 */
public class Config {

	public static final String configFile = "config.ini";

	public static final Logger LOG = Logger.getLogger("cfg");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("treeDepth", "4");
		put("treeCount", "2");
		put("sampleLength", "5");
		put("sampleCount", "5");
		put("compactNotation", "yes");
		put("logLevel", "INFO");
	}};

	private static final Map<String, String> defaults = new HashMap<>(config);

	/** Maximum expansion depth of parse tree skeletons */
	public static int treeDepth(){
		return getInt("treeDepth");
	}

	/** Maximum number of parse tree skeletons per grammar */
	public static int treeCount(){
		return getInt("treeCount");
	}

	/** Maximum number of tokens in a sample string */
	public static int sampleLength(){
		return getInt("sampleLength");
	}

	/** Maximum number of sample strings */
	public static int sampleCount(){
		return getInt("sampleCount");
	}

	/** Split alternatives without whitespace into single character terminals and non terminals? */
	public static boolean compactNotation(){
		return config.get("compactNotation").equals("yes");
	}

	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException e) {
			LOG.warning(() -> String.format("Invalid log level \"%s\", using %s", config.get("logLevel"),
					defaults.get("logLevel")));
			return Level.parse(defaults.get("logLevel"));
		}
	}

	public static String get(String key){
		if (!config.containsKey(key)){
			throw new CFGException(String.format("Unknown config key \"%s\"", key));
		}
		return config.get(key);
	}

	private static int getInt(String key){
		String value = get(key);
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			LOG.warning(() -> String.format("Config value \"%s\" of %s isn't an integer, using %s", value, key,
					defaults.get(key)));
			return Integer.parseInt(defaults.get(key));
		}
	}

	static void load(Reader source, String sourceName) throws IOException {
		BufferedReader reader = new BufferedReader(source);
		String line;
		while ((line = reader.readLine()) != null){
			if (line.trim().startsWith("#") || !line.contains("=")){
				continue;
			}
			String[] parts = line.split("=", 2);
			String key = parts[0].trim();
			if (config.containsKey(key)){
				config.put(key, parts[1].trim());
			} else {
				LOG.warning(String.format("Unknown config key \"%s\" in %s", key, sourceName));
			}
		}
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getClassLoader().getResourceAsStream(configFile)) {
			if (stream != null){
				load(new InputStreamReader(stream, StandardCharsets.UTF_8), "class path resource " + configFile);
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read the config resource", e);
		}
		File file = new File(configFile);
		if (file.exists()){
			try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
				load(reader, file.getAbsolutePath());
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read " + file.getAbsolutePath(), e);
			}
		}
	}

	static {
		loadConfig();
	}
}

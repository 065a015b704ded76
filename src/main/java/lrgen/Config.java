package lrgen;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;

import lrgen.lr.LookaheadMode;

import static lrgen.util.Utils.LOG;

/**
 * Configuration of the generator, read from lines of the form <pre>key = value</pre>.
 *
 * Keys that aren't set in a file keep their default values.
 */
public class Config {

	public static final String configFile = "lrgen.ini";

	private static final Map<String, String> defaults = new LinkedHashMap<String, String>(){{
		put("lookahead", "slr1");
		put("logLevel", "INFO");
		put("cacheSize", "10");
		put("failOnConflict", "no");
	}};

	private static Config defaultConfig;

	private final Map<String, String> config;

	public Config(Map<String, String> overrides) {
		Map<String, String> map = new LinkedHashMap<>(defaults);
		for (Map.Entry<String, String> entry : overrides.entrySet()){
			if (map.containsKey(entry.getKey())){
				map.put(entry.getKey(), entry.getValue());
			} else {
				LOG.warning("Unknown config key \"" + entry.getKey() + "\"");
			}
		}
		this.config = Collections.unmodifiableMap(map);
	}

	public Config() {
		this(Collections.<String, String>emptyMap());
	}

	/**
	 * Configuration from the passed file, the default values are used if the file doesn't exist.
	 */
	public static Config load(File file) throws IOException {
		Map<String, String> values = new LinkedHashMap<>();
		if (file.exists()){
			try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
				String line;
				while ((line = reader.readLine()) != null){
					if (line.contains("=") && !line.trim().startsWith("#")){
						String[] parts = line.split("=", 2);
						values.put(parts[0].trim(), parts[1].trim());
					}
				}
			}
		}
		return new Config(values);
	}

	/**
	 * Configuration from the {@value #configFile} file in the working directory, loaded on the first call.
	 * Its log level becomes the level of the logger.
	 */
	public static synchronized Config getDefault(){
		if (defaultConfig == null){
			try {
				defaultConfig = load(new File(configFile));
				LOG.setLevel(defaultConfig.logLevel());
			} catch (IOException e) {
				throw new LRGenException("Can't read config file " + configFile + ": " + e.getMessage());
			}
		}
		return defaultConfig;
	}

	public String get(String key){
		if (!config.containsKey(key)){
			throw new IllegalArgumentException("Unknown config key \"" + key + "\"");
		}
		return config.get(key);
	}

	/** Reduce on follow sets (SLR(1)) or on every terminal (LR(0))? */
	public LookaheadMode lookahead(){
		return LookaheadMode.parse(get("lookahead"));
	}

	public Level logLevel(){
		return Level.parse(get("logLevel").toUpperCase());
	}

	public int cacheSize(){
		return Integer.parseInt(get("cacheSize"));
	}

	public boolean failOnConflict(){
		return get("failOnConflict").equals("yes");
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<String, String> entry : config.entrySet()){
			builder.append(String.format("%s = %s\n", entry.getKey(), entry.getValue()));
		}
		return builder.toString();
	}
}

package org.javai.commonmark.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads configuration options from YAML.
 *
 * The result is the raw option map expected by
 * {@code EnvironmentBuilder.mergeConfig}. Validation happens when the
 * environment is built.
 */
public class ConfigurationLoader {

	private final Yaml yaml = new Yaml();

	/**
	 * Load options from a YAML file.
	 */
	public Map<String, Object> load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IOException e) {
			throw new InvalidConfigurationException(null, "Failed to read configuration from path: " + path, e);
		}
	}

	/**
	 * Load options from an input stream.
	 */
	public Map<String, Object> load(InputStream inputStream) {
		try {
			return toOptions(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new InvalidConfigurationException(null, "Failed to parse configuration from input stream", e);
		}
	}

	/**
	 * Load options from a reader.
	 */
	public Map<String, Object> load(Reader reader) {
		try {
			return toOptions(yaml.load(reader));
		} catch (YAMLException e) {
			throw new InvalidConfigurationException(null, "Failed to parse configuration from reader", e);
		}
	}

	/**
	 * Load options from a YAML string.
	 */
	public Map<String, Object> loadString(String yamlContent) {
		try {
			return toOptions(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new InvalidConfigurationException(null, "Failed to parse configuration from string", e);
		}
	}

	private Map<String, Object> toOptions(Object document) {
		if (document == null) {
			return Map.of();
		}
		return Options.asMap("<root>", document);
	}
}

package org.javai.commonmark.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The set of top-level configuration sections known to an environment. Each
 * extension declares its own section.
 */
public final class ConfigurationSchema {

	private final Map<String, OptionSchema<?>> sections = new LinkedHashMap<>();

	/**
	 * @throws IllegalArgumentException if another extension already declared the section
	 */
	public ConfigurationSchema section(String key, OptionSchema<?> schema) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(schema, "schema must not be null");
		if (sections.containsKey(key)) {
			throw new IllegalArgumentException("Configuration section '" + key + "' is already declared");
		}
		sections.put(key, schema);
		return this;
	}

	/**
	 * Validates raw merged options against every declared section.
	 *
	 * @throws InvalidConfigurationException for the first malformed option, or for a section nobody declared
	 */
	public MarkdownConfiguration validate(Map<String, Object> raw) {
		for (String key : raw.keySet()) {
			if (!sections.containsKey(key)) {
				throw new InvalidConfigurationException(key,
					"unexpected option; known options are " + sections.keySet());
			}
		}
		Map<String, Object> validated = new LinkedHashMap<>();
		for (Map.Entry<String, OptionSchema<?>> entry : sections.entrySet()) {
			Object value = entry.getValue().validate(entry.getKey(), raw.get(entry.getKey()));
			if (value != null) {
				validated.put(entry.getKey(), value);
			}
		}
		return new MarkdownConfiguration(validated);
	}
}

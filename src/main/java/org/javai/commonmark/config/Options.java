package org.javai.commonmark.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for {@link OptionSchema} implementations that read nested option maps.
 */
public final class Options {

	private Options() {
	}

	/**
	 * Reads a section as a map with string keys. {@code null} reads as an empty map.
	 */
	public static Map<String, Object> asMap(String path, Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new InvalidConfigurationException(path, "expected a map, got " + typeName(value));
		}
		Map<String, Object> result = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (!(entry.getKey() instanceof String key)) {
				throw new InvalidConfigurationException(path, "keys must be strings, got " + typeName(entry.getKey()));
			}
			result.put(key, entry.getValue());
		}
		return result;
	}

	public static void rejectUnknownKeys(String path, Map<String, Object> options, Set<String> known) {
		for (String key : options.keySet()) {
			if (!known.contains(key)) {
				throw new InvalidConfigurationException(path + "." + key,
					"unexpected option; known options are " + known);
			}
		}
	}

	public static boolean booleanOption(String path, Map<String, Object> options, String key, boolean defaultValue) {
		Object value = options.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof Boolean b)) {
			throw new InvalidConfigurationException(path + "." + key, "expected a boolean, got " + typeName(value));
		}
		return b;
	}

	public static String stringOption(String path, Map<String, Object> options, String key, String defaultValue) {
		Object value = options.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (!(value instanceof String s)) {
			throw new InvalidConfigurationException(path + "." + key, "expected a string, got " + typeName(value));
		}
		return s;
	}

	public static String requiredString(String path, Map<String, Object> options, String key) {
		Object value = options.get(key);
		if (value == null) {
			throw new InvalidConfigurationException(path + "." + key, "option is required");
		}
		if (!(value instanceof String s) || s.isEmpty()) {
			throw new InvalidConfigurationException(path + "." + key,
				"expected a non-empty string, got " + typeName(value));
		}
		return s;
	}

	public static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getName();
	}
}

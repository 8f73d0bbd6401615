package org.javai.commonmark.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validated configuration: one entry per declared section, in the form produced
 * by that section's {@link OptionSchema}. Immutable.
 */
public final class MarkdownConfiguration {

	private final Map<String, Object> sections;

	MarkdownConfiguration(Map<String, Object> sections) {
		this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
	}

	public static MarkdownConfiguration empty() {
		return new MarkdownConfiguration(Map.of());
	}

	public boolean exists(String key) {
		return sections.containsKey(key);
	}

	/**
	 * Looks up a validated section.
	 *
	 * @throws IllegalStateException if the section holds a value of another type
	 */
	public <T> Optional<T> get(String key, Class<T> type) {
		Object value = sections.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (!type.isInstance(value)) {
			throw new IllegalStateException("Configuration section '" + key + "' is a "
				+ value.getClass().getName() + ", not a " + type.getName());
		}
		return Optional.of(type.cast(value));
	}
}

package org.javai.commonmark.config;

/**
 * Validates one top-level configuration section and turns it into its internal form.
 *
 * @param <T> the validated representation of the section
 */
@FunctionalInterface
public interface OptionSchema<T> {

	/**
	 * @param path the dotted path of the section, used in error messages
	 * @param value the raw value as merged, or {@code null} when the section is absent
	 * @return the validated section, with defaults applied
	 * @throws InvalidConfigurationException if the value is malformed
	 */
	T validate(String path, Object value);
}

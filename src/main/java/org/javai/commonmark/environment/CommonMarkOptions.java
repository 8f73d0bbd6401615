package org.javai.commonmark.environment;

import java.util.Map;
import java.util.Set;
import org.javai.commonmark.config.Options;

/**
 * Options of the {@code commonmark} configuration section.
 *
 * @param enableEm whether single delimiters produce emphasis
 * @param enableStrong whether double delimiters produce strong emphasis
 * @param useAsterisk whether {@code *} is an emphasis delimiter
 * @param useUnderscore whether {@code _} is an emphasis delimiter
 */
public record CommonMarkOptions(boolean enableEm, boolean enableStrong, boolean useAsterisk, boolean useUnderscore) {

	public static final String SECTION = "commonmark";

	private static final Set<String> KEYS = Set.of("enable_em", "enable_strong", "use_asterisk", "use_underscore");

	public static CommonMarkOptions defaults() {
		return new CommonMarkOptions(true, true, true, true);
	}

	static CommonMarkOptions validate(String path, Object value) {
		Map<String, Object> options = Options.asMap(path, value);
		Options.rejectUnknownKeys(path, options, KEYS);
		return new CommonMarkOptions(
			Options.booleanOption(path, options, "enable_em", true),
			Options.booleanOption(path, options, "enable_strong", true),
			Options.booleanOption(path, options, "use_asterisk", true),
			Options.booleanOption(path, options, "use_underscore", true));
	}
}

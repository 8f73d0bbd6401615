package org.javai.commonmark.ext.smartpunct;

import java.util.Map;
import java.util.Set;
import org.javai.commonmark.config.Options;

/**
 * Options of the {@code smartpunct} configuration section: the glyphs quotes turn into.
 */
public record SmartPunctOptions(String doubleQuoteOpener, String doubleQuoteCloser,
		String singleQuoteOpener, String singleQuoteCloser) {

	public static final String SECTION = "smartpunct";

	private static final Set<String> KEYS = Set.of(
		"double_quote_opener", "double_quote_closer", "single_quote_opener", "single_quote_closer");

	public static SmartPunctOptions defaults() {
		return new SmartPunctOptions("“", "”", "‘", "’");
	}

	static SmartPunctOptions validate(String path, Object value) {
		Map<String, Object> options = Options.asMap(path, value);
		Options.rejectUnknownKeys(path, options, KEYS);
		SmartPunctOptions defaults = defaults();
		return new SmartPunctOptions(
			Options.stringOption(path, options, "double_quote_opener", defaults.doubleQuoteOpener()),
			Options.stringOption(path, options, "double_quote_closer", defaults.doubleQuoteCloser()),
			Options.stringOption(path, options, "single_quote_opener", defaults.singleQuoteOpener()),
			Options.stringOption(path, options, "single_quote_closer", defaults.singleQuoteCloser()));
	}

	public String opener(char quote) {
		return quote == '"' ? doubleQuoteOpener : singleQuoteOpener;
	}

	public String closer(char quote) {
		return quote == '"' ? doubleQuoteCloser : singleQuoteCloser;
	}
}

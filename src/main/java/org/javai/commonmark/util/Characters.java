package org.javai.commonmark.util;

/**
 * Character classes used by the flanking rules and the link syntax.
 */
public final class Characters {

	private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

	private Characters() {
	}

	public static boolean isAsciiPunctuation(char c) {
		return ASCII_PUNCTUATION.indexOf(c) >= 0 && c != '\0';
	}

	/**
	 * ASCII punctuation plus the Unicode punctuation and symbol categories.
	 */
	public static boolean isPunctuation(char c) {
		if (isAsciiPunctuation(c)) {
			return true;
		}
		return switch (Character.getType(c)) {
			case Character.CONNECTOR_PUNCTUATION,
				Character.DASH_PUNCTUATION,
				Character.START_PUNCTUATION,
				Character.END_PUNCTUATION,
				Character.INITIAL_QUOTE_PUNCTUATION,
				Character.FINAL_QUOTE_PUNCTUATION,
				Character.OTHER_PUNCTUATION,
				Character.MATH_SYMBOL,
				Character.CURRENCY_SYMBOL,
				Character.MODIFIER_SYMBOL,
				Character.OTHER_SYMBOL -> true;
			default -> false;
		};
	}

	/**
	 * Unicode whitespace as CommonMark defines it: the Zs category plus tab, line feed, form feed
	 * and carriage return.
	 */
	public static boolean isWhitespace(char c) {
		return switch (c) {
			case ' ', '\t', '\n', '\u000B', '\f', '\r' -> true;
			default -> Character.getType(c) == Character.SPACE_SEPARATOR;
		};
	}

	/**
	 * Word character in the sense of the regex class {@code \w}.
	 */
	public static boolean isWordCharacter(char c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}
}

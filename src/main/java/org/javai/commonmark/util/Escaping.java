package org.javai.commonmark.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.text.StringEscapeUtils;

/**
 * Backslash-escape and entity handling.
 */
public final class Escaping {

	public static final String ENTITY = "&(?:#[xX][0-9a-fA-F]{1,6}|#[0-9]{1,7}|[A-Za-z][A-Za-z0-9]{1,31});";

	private static final Pattern ENTITY_OR_ESCAPE = Pattern.compile(
		"\\\\[!\"#$%&'()*+,./:;<=>?@\\[\\\\\\]^_`{|}~-]|" + ENTITY);

	private static final char REPLACEMENT_CHARACTER = '\uFFFD';

	private Escaping() {
	}

	/**
	 * Resolves backslash escapes and entities, as in link destinations and titles.
	 */
	public static String unescapeString(String s) {
		if (s.indexOf('\\') < 0 && s.indexOf('&') < 0) {
			return s;
		}
		Matcher matcher = ENTITY_OR_ESCAPE.matcher(s);
		StringBuilder sb = new StringBuilder(s.length());
		while (matcher.find()) {
			String match = matcher.group();
			String replacement = match.charAt(0) == '\\'
				? match.substring(1)
				: decodeEntity(match);
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	/**
	 * Decodes a complete entity reference such as {@code &amp;}, {@code &#35;} or {@code &#x22;}.
	 * Unknown named entities come back unchanged.
	 */
	public static String decodeEntity(String entity) {
		if (entity.startsWith("&#")) {
			int codePoint;
			try {
				codePoint = entity.charAt(2) == 'x' || entity.charAt(2) == 'X'
					? Integer.parseInt(entity.substring(3, entity.length() - 1), 16)
					: Integer.parseInt(entity.substring(2, entity.length() - 1));
			} catch (NumberFormatException e) {
				return String.valueOf(REPLACEMENT_CHARACTER);
			}
			if (codePoint == 0 || !Character.isValidCodePoint(codePoint)
				|| (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
				return String.valueOf(REPLACEMENT_CHARACTER);
			}
			return new String(Character.toChars(codePoint));
		}
		return StringEscapeUtils.unescapeHtml4(entity);
	}

	/**
	 * Escapes the characters that are significant in HTML text and attribute values.
	 */
	public static String escapeHtml(String s) {
		StringBuilder sb = null;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			String replacement = switch (c) {
				case '&' -> "&amp;";
				case '<' -> "&lt;";
				case '>' -> "&gt;";
				case '"' -> "&quot;";
				default -> null;
			};
			if (replacement != null) {
				if (sb == null) {
					sb = new StringBuilder(s.length() + 16);
					sb.append(s, 0, i);
				}
				sb.append(replacement);
			} else if (sb != null) {
				sb.append(c);
			}
		}
		return sb != null ? sb.toString() : s;
	}
}

package org.javai.commonmark.util;

import java.util.regex.Pattern;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.CursorState;

/**
 * Parsers for the pieces of link syntax: destination, title and label.
 *
 * Each method either consumes its construct and returns it, or returns a
 * "no match" value and leaves the cursor where it was.
 */
public final class LinkParserHelper {

	private static final int MAX_NESTED_PARENS = 32;

	private static final int MAX_LABEL_LENGTH = 999;

	private static final Pattern LINK_TITLE = Pattern.compile(
		"\"(?:\\\\[\\s\\S]|[^\"\\\\])*\"" +
		"|'(?:\\\\[\\s\\S]|[^'\\\\])*'" +
		"|\\((?:\\\\[\\s\\S]|[^()\\\\])*\\)");

	private static final Pattern LINK_LABEL = Pattern.compile(
		"\\[(?:[^\\\\\\[\\]]|\\\\[\\s\\S]){0," + (MAX_LABEL_LENGTH + 1) + "}\\]");

	private LinkParserHelper() {
	}

	/**
	 * Parses a destination, either {@code <...>} or a run of non-space characters with balanced parentheses.
	 *
	 * @return the unescaped destination (possibly empty), or {@code null} if there is none here
	 */
	public static String parseLinkDestination(Cursor cursor) {
		CursorState start = cursor.saveState();
		if (cursor.getCharacter() == '<') {
			String destination = parsePointyDestination(cursor);
			if (destination == null) {
				cursor.restoreState(start);
			}
			return destination;
		}

		int from = cursor.getPosition();
		int openParens = 0;
		char c;
		while ((c = cursor.getCharacter()) != Cursor.END) {
			if (c == '\\' && Characters.isAsciiPunctuation(cursor.peek(1))) {
				cursor.advanceBy(2);
			} else if (c == '(') {
				openParens++;
				if (openParens > MAX_NESTED_PARENS) {
					cursor.restoreState(start);
					return null;
				}
				cursor.advance();
			} else if (c == ')') {
				if (openParens == 0) {
					break;
				}
				openParens--;
				cursor.advance();
			} else if (c <= ' ' || c == 0x7F) {
				break;
			} else {
				cursor.advance();
			}
		}

		if (cursor.getPosition() == from && c != ')') {
			cursor.restoreState(start);
			return null;
		}
		if (openParens != 0) {
			cursor.restoreState(start);
			return null;
		}
		return Escaping.unescapeString(cursor.getSubstring(from, cursor.getPosition() - from));
	}

	private static String parsePointyDestination(Cursor cursor) {
		cursor.advance();
		int from = cursor.getPosition();
		char c;
		while ((c = cursor.getCharacter()) != Cursor.END) {
			if (c == '>') {
				String raw = cursor.getSubstring(from, cursor.getPosition() - from);
				cursor.advance();
				return Escaping.unescapeString(raw);
			}
			if (c == '\n' || c == '\r' || c == '<') {
				return null;
			}
			if (c == '\\' && Characters.isAsciiPunctuation(cursor.peek(1))) {
				cursor.advanceBy(2);
			} else {
				cursor.advance();
			}
		}
		return null;
	}

	/**
	 * Parses a title in double quotes, single quotes or parentheses.
	 *
	 * @return the unescaped title without its delimiters, or {@code null} if there is none here
	 */
	public static String parseLinkTitle(Cursor cursor) {
		String title = cursor.match(LINK_TITLE);
		if (title == null) {
			return null;
		}
		return Escaping.unescapeString(title.substring(1, title.length() - 1));
	}

	/**
	 * Parses a bracketed link label such as {@code [foo]}.
	 *
	 * @return the length of the label including both brackets, or 0 if there is no valid label here
	 */
	public static int parseLinkLabel(Cursor cursor) {
		CursorState start = cursor.saveState();
		String label = cursor.match(LINK_LABEL);
		if (label == null) {
			return 0;
		}
		if (label.length() > MAX_LABEL_LENGTH + 2) {
			cursor.restoreState(start);
			return 0;
		}
		return label.length();
	}
}

package org.javai.commonmark.inline;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repositionable view over the text of one block.
 *
 * Reading past either end never fails: {@link #peek(int)} answers {@link #END}
 * instead. Speculative parsing saves the state first and restores it when the
 * attempt is abandoned.
 */
public final class Cursor {

	/**
	 * Returned for positions outside the text. Input is expected to have had NUL replaced.
	 */
	public static final char END = '\0';

	private final String text;
	private int position;

	public Cursor(String text) {
		this.text = text != null ? text : "";
	}

	public int getPosition() {
		return position;
	}

	public int length() {
		return text.length();
	}

	public boolean isAtEnd() {
		return position >= text.length();
	}

	/**
	 * Character at the current position, or {@link #END}.
	 */
	public char getCharacter() {
		return peek(0);
	}

	/**
	 * Character {@code offset} positions away from the current one (negative looks back), or {@link #END}.
	 */
	public char peek(int offset) {
		int index = position + offset;
		if (index < 0 || index >= text.length()) {
			return END;
		}
		return text.charAt(index);
	}

	public void advance() {
		advanceBy(1);
	}

	public void advanceBy(int characters) {
		position = Math.min(position + characters, text.length());
	}

	/**
	 * Skips spaces and tabs, at most one line ending, then spaces and tabs again.
	 *
	 * @return the number of characters skipped
	 */
	public int advanceToNextNonSpaceOrNewline() {
		int start = position;
		skipSpacesAndTabs();
		if (peek(0) == '\r' && peek(1) == '\n') {
			position += 2;
		} else if (peek(0) == '\n' || peek(0) == '\r') {
			position++;
		}
		skipSpacesAndTabs();
		return position - start;
	}

	/**
	 * Skips spaces and tabs only.
	 *
	 * @return the number of characters skipped
	 */
	public int advanceToNextNonSpaceOrTab() {
		int start = position;
		skipSpacesAndTabs();
		return position - start;
	}

	private void skipSpacesAndTabs() {
		while (position < text.length() && (text.charAt(position) == ' ' || text.charAt(position) == '\t')) {
			position++;
		}
	}

	public String getSubstring(int start, int length) {
		int from = Math.max(0, start);
		int to = Math.min(text.length(), from + Math.max(0, length));
		return text.substring(from, to);
	}

	public String getRemainder() {
		return isAtEnd() ? "" : text.substring(position);
	}

	/**
	 * Matches {@code pattern} anchored at the current position. On success the
	 * cursor moves past the match.
	 *
	 * @return the matched text, or {@code null} when the pattern does not match here
	 */
	public String match(Pattern pattern) {
		if (isAtEnd()) {
			return null;
		}
		Matcher matcher = pattern.matcher(text);
		matcher.region(position, text.length());
		matcher.useTransparentBounds(true);
		matcher.useAnchoringBounds(false);
		if (!matcher.lookingAt()) {
			return null;
		}
		position = matcher.end();
		return matcher.group();
	}

	/**
	 * Whether the text at the current position starts with {@code literal}. Does not move.
	 */
	public boolean startsWith(String literal) {
		return text.startsWith(literal, position);
	}

	public CursorState saveState() {
		return new CursorState(position);
	}

	public void restoreState(CursorState state) {
		this.position = state.position();
	}

	@Override
	public String toString() {
		return "Cursor{position=" + position + ", remainder=" + getRemainder() + "}";
	}
}

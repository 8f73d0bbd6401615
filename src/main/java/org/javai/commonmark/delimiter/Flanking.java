package org.javai.commonmark.delimiter;

import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.util.Characters;

/**
 * Flanking classification of a delimiter run, from the characters on either side of it.
 *
 * @param left whether the run is left-flanking
 * @param right whether the run is right-flanking
 * @param beforeIsPunctuation whether the character before the run is punctuation
 * @param afterIsPunctuation whether the character after the run is punctuation
 */
public record Flanking(boolean left, boolean right, boolean beforeIsPunctuation, boolean afterIsPunctuation) {

	/**
	 * Classifies a run. {@link Cursor#END} on either side counts as a line ending.
	 */
	public static Flanking of(char before, char after) {
		char charBefore = before == Cursor.END ? '\n' : before;
		char charAfter = after == Cursor.END ? '\n' : after;

		boolean beforeIsWhitespace = Characters.isWhitespace(charBefore);
		boolean beforeIsPunctuation = Characters.isPunctuation(charBefore);
		boolean afterIsWhitespace = Characters.isWhitespace(charAfter);
		boolean afterIsPunctuation = Characters.isPunctuation(charAfter);

		boolean left = !afterIsWhitespace
			&& (!afterIsPunctuation || beforeIsWhitespace || beforeIsPunctuation);
		boolean right = !beforeIsWhitespace
			&& (!beforeIsPunctuation || afterIsWhitespace || afterIsPunctuation);

		return new Flanking(left, right, beforeIsPunctuation, afterIsPunctuation);
	}

	/**
	 * Whether an emphasis run of {@code delimiterChar} can open. Underscore may not open inside a word.
	 */
	public boolean canOpenEmphasis(char delimiterChar) {
		if (delimiterChar == '_') {
			return left && (!right || beforeIsPunctuation);
		}
		return left;
	}

	/**
	 * Whether an emphasis run of {@code delimiterChar} can close. Underscore may not close inside a word.
	 */
	public boolean canCloseEmphasis(char delimiterChar) {
		if (delimiterChar == '_') {
			return right && (!left || afterIsPunctuation);
		}
		return right;
	}
}

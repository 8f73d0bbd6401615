package org.javai.commonmark.delimiter;

import org.javai.commonmark.node.Node;

/**
 * Pairs runs of one delimiter character into a wrapping node (emphasis,
 * strikethrough, quotes).
 *
 * The pairing loop in {@link DelimiterStack#processDelimiters} finds a closer
 * and a candidate opener. It asks {@link #getDelimiterUse} how many characters
 * to consume, trims that many from both runs, and then calls {@link #process}
 * to wrap the nodes between them.
 */
public interface DelimiterProcessor {

	char getOpeningCharacter();

	char getClosingCharacter();

	/**
	 * Shortest run that is treated as a delimiter at all; shorter runs stay literal.
	 */
	int getMinLength();

	/**
	 * Longest run that is treated as a delimiter; longer runs stay literal.
	 */
	default int getMaxLength() {
		return Integer.MAX_VALUE;
	}

	/**
	 * Whether the "multiple of three" rule for runs that can both open and close applies.
	 */
	default boolean isMultipleOfThreeSensitive() {
		return false;
	}

	/**
	 * Number of characters to consume from both runs, or 0 if these two cannot pair.
	 */
	int getDelimiterUse(Delimiter opener, Delimiter closer);

	/**
	 * Wraps the siblings strictly between {@code opener} and {@code closer}.
	 * Both nodes already had {@code delimiterUse} characters removed.
	 */
	void process(Node opener, Node closer, int delimiterUse);
}

package org.javai.commonmark.delimiter;

import org.javai.commonmark.node.Emphasis;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.StrongEmphasis;

/**
 * Emphasis ({@code *foo*}) and strong emphasis ({@code **foo**}) for one
 * delimiter character.
 */
public class EmphasisDelimiterProcessor implements DelimiterProcessor {

	private final char delimiterChar;
	private final boolean enableEm;
	private final boolean enableStrong;

	public EmphasisDelimiterProcessor(char delimiterChar) {
		this(delimiterChar, true, true);
	}

	public EmphasisDelimiterProcessor(char delimiterChar, boolean enableEm, boolean enableStrong) {
		this.delimiterChar = delimiterChar;
		this.enableEm = enableEm;
		this.enableStrong = enableStrong;
	}

	@Override
	public char getOpeningCharacter() {
		return delimiterChar;
	}

	@Override
	public char getClosingCharacter() {
		return delimiterChar;
	}

	@Override
	public int getMinLength() {
		return 1;
	}

	@Override
	public boolean isMultipleOfThreeSensitive() {
		return true;
	}

	@Override
	public int getDelimiterUse(Delimiter opener, Delimiter closer) {
		if (opener.getLength() >= 2 && closer.getLength() >= 2 && enableStrong) {
			return 2;
		}
		return enableEm ? 1 : 0;
	}

	@Override
	public void process(Node opener, Node closer, int delimiterUse) {
		String delimiter = String.valueOf(delimiterChar).repeat(delimiterUse);
		Node wrapper = delimiterUse == 1 ? new Emphasis(delimiter) : new StrongEmphasis(delimiter);

		Node node = opener.getNext();
		while (node != null && node != closer) {
			Node next = node.getNext();
			wrapper.appendChild(node);
			node = next;
		}

		opener.insertAfter(wrapper);
	}
}

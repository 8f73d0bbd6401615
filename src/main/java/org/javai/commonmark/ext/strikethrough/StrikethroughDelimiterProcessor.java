package org.javai.commonmark.ext.strikethrough;

import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.delimiter.DelimiterProcessor;
import org.javai.commonmark.node.Node;

/**
 * Pairs runs of one or two tildes of equal length.
 */
public class StrikethroughDelimiterProcessor implements DelimiterProcessor {

	@Override
	public char getOpeningCharacter() {
		return '~';
	}

	@Override
	public char getClosingCharacter() {
		return '~';
	}

	@Override
	public int getMinLength() {
		return 1;
	}

	@Override
	public int getMaxLength() {
		return 2;
	}

	@Override
	public int getDelimiterUse(Delimiter opener, Delimiter closer) {
		if (opener.getLength() != closer.getLength()) {
			return 0;
		}
		return opener.getLength();
	}

	@Override
	public void process(Node opener, Node closer, int delimiterUse) {
		Strikethrough strikethrough = new Strikethrough("~".repeat(delimiterUse));

		Node node = opener.getNext();
		while (node != null && node != closer) {
			Node next = node.getNext();
			strikethrough.appendChild(node);
			node = next;
		}

		opener.insertAfter(strikethrough);
	}
}

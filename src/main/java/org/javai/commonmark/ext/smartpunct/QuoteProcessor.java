package org.javai.commonmark.ext.smartpunct;

import java.util.Objects;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.delimiter.DelimiterProcessor;
import org.javai.commonmark.node.Node;

/**
 * Turns a matched pair of straight quotes into curly ones.
 */
public class QuoteProcessor implements DelimiterProcessor {

	private final char quote;
	private final String opener;
	private final String closer;

	public QuoteProcessor(char quote, SmartPunctOptions options) {
		Objects.requireNonNull(options, "options must not be null");
		this.quote = quote;
		this.opener = options.opener(quote);
		this.closer = options.closer(quote);
	}

	@Override
	public char getOpeningCharacter() {
		return quote;
	}

	@Override
	public char getClosingCharacter() {
		return quote;
	}

	@Override
	public int getMinLength() {
		return 1;
	}

	@Override
	public int getDelimiterUse(Delimiter opener, Delimiter closer) {
		return 1;
	}

	@Override
	public void process(Node openerNode, Node closerNode, int delimiterUse) {
		openerNode.insertAfter(new Quote(opener));
		closerNode.insertBefore(new Quote(closer));
	}
}

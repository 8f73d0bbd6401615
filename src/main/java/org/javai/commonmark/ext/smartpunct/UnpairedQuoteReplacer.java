package org.javai.commonmark.ext.smartpunct;

import org.javai.commonmark.environment.DocumentProcessor;
import org.javai.commonmark.node.Document;
import org.javai.commonmark.node.NodeWalker;

/**
 * Curls the quotes that found no partner: a lone {@code '} reads as an
 * apostrophe, a lone {@code "} as an opening quote.
 */
public class UnpairedQuoteReplacer implements DocumentProcessor {

	private final String apostrophe;
	private final String doubleQuote;

	public UnpairedQuoteReplacer(SmartPunctOptions options) {
		this.apostrophe = options.singleQuoteCloser();
		this.doubleQuote = options.doubleQuoteOpener();
	}

	@Override
	public void process(Document document) {
		NodeWalker.walkPreOrder(document, node -> {
			if (node instanceof Quote quote) {
				if (Quote.SINGLE_QUOTE.equals(quote.getLiteral())) {
					quote.setLiteral(apostrophe);
				} else if (Quote.DOUBLE_QUOTE.equals(quote.getLiteral())) {
					quote.setLiteral(doubleQuote);
				}
			}
		});
	}
}

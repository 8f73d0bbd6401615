package org.javai.commonmark.environment;

import org.javai.commonmark.node.Document;

/**
 * Runs over the whole document after every block's inlines have been parsed.
 */
@FunctionalInterface
public interface DocumentProcessor {

	void process(Document document);
}

package org.javai.commonmark.inline;

import org.javai.commonmark.delimiter.DelimiterProcessorCollection;
import org.javai.commonmark.delimiter.DelimiterStack;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.reference.ReferenceMap;

/**
 * State of one inline parsing call: the block being filled, the cursor over
 * its text, the pending delimiters and the references to resolve against.
 * Owned by a single call and never shared.
 */
public final class InlineParserContext {

	private final Node container;
	private final Cursor cursor;
	private final DelimiterStack delimiterStack;
	private final ReferenceMap referenceMap;
	private final DelimiterProcessorCollection delimiterProcessors;

	public InlineParserContext(Node container, Cursor cursor, ReferenceMap referenceMap,
			DelimiterProcessorCollection delimiterProcessors) {
		this.container = container;
		this.cursor = cursor;
		this.referenceMap = referenceMap != null ? referenceMap : new ReferenceMap();
		this.delimiterProcessors = delimiterProcessors;
		this.delimiterStack = new DelimiterStack();
	}

	public Node getContainer() {
		return container;
	}

	public Cursor getCursor() {
		return cursor;
	}

	public DelimiterStack getDelimiterStack() {
		return delimiterStack;
	}

	public ReferenceMap getReferenceMap() {
		return referenceMap;
	}

	public DelimiterProcessorCollection getDelimiterProcessors() {
		return delimiterProcessors;
	}
}

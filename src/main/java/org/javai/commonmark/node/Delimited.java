package org.javai.commonmark.node;

/**
 * Capability of nodes that wrap content between an opening and a closing delimiter.
 */
public interface Delimited {

	String getOpeningDelimiter();

	String getClosingDelimiter();
}

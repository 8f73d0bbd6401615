package org.javai.commonmark.node;

/**
 * Capability of nodes that carry literal character content.
 */
public interface StringContainer {

	String getLiteral();

	void setLiteral(String literal);
}

package org.javai.commonmark.node;

/**
 * Root of a parsed document.
 */
public class Document extends Node {

	@Override
	public String kind() {
		return "document";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}
}

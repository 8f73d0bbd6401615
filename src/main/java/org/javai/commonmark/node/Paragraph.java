package org.javai.commonmark.node;

/**
 * Block that holds the inline nodes of one paragraph.
 */
public class Paragraph extends Node {

	@Override
	public String kind() {
		return "paragraph";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}
}

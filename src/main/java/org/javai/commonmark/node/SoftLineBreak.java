package org.javai.commonmark.node;

public class SoftLineBreak extends Node {

	@Override
	public String kind() {
		return "softbreak";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}
}

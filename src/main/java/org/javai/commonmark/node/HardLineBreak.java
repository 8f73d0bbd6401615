package org.javai.commonmark.node;

public class HardLineBreak extends Node {

	@Override
	public String kind() {
		return "linebreak";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}
}

package org.javai.commonmark.node;

public class Emphasis extends Node implements Delimited {

	private final String delimiter;

	public Emphasis(String delimiter) {
		this.delimiter = delimiter;
	}

	@Override
	public String kind() {
		return "emph";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}

	@Override
	public String getOpeningDelimiter() {
		return delimiter;
	}

	@Override
	public String getClosingDelimiter() {
		return delimiter;
	}
}

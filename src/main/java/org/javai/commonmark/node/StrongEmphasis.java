package org.javai.commonmark.node;

public class StrongEmphasis extends Node implements Delimited {

	private final String delimiter;

	public StrongEmphasis(String delimiter) {
		this.delimiter = delimiter;
	}

	@Override
	public String kind() {
		return "strong";
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

package org.javai.commonmark.node;

/**
 * Plain literal text.
 */
public class Text extends Node implements StringContainer {

	private String literal;

	public Text(String literal) {
		this.literal = literal != null ? literal : "";
	}

	@Override
	public String kind() {
		return "text";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}

	@Override
	public String getLiteral() {
		return literal;
	}

	@Override
	public void setLiteral(String literal) {
		this.literal = literal != null ? literal : "";
	}

	@Override
	protected String toStringAttributes() {
		return "literal=" + literal;
	}
}

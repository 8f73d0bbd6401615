package org.javai.commonmark.node;

/**
 * Raw inline HTML, passed through to the output unchanged.
 */
public class HtmlInline extends Node implements StringContainer {

	private String literal;

	public HtmlInline(String literal) {
		this.literal = literal != null ? literal : "";
	}

	@Override
	public String kind() {
		return "html_inline";
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
}

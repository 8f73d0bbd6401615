package org.javai.commonmark.node;

/**
 * Inline code span. The literal has already had its line endings and
 * surrounding space normalized.
 */
public class Code extends Node implements StringContainer {

	private String literal;

	public Code(String literal) {
		this.literal = literal != null ? literal : "";
	}

	@Override
	public String kind() {
		return "code";
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

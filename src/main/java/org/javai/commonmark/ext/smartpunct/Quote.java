package org.javai.commonmark.ext.smartpunct;

import java.util.Map;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.StringContainer;

/**
 * A single or double quote. Starts out as the straight character and is
 * replaced by a curly one once it is known to open or close.
 */
public class Quote extends CustomNode implements StringContainer {

	public static final String DOUBLE_QUOTE = "\"";
	public static final String SINGLE_QUOTE = "'";

	private String literal;

	public Quote(String literal) {
		this.literal = literal != null ? literal : "";
	}

	@Override
	public String kind() {
		return "quote";
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
	public Map<String, String> attributes() {
		return Map.of("literal", literal);
	}

	@Override
	protected String toStringAttributes() {
		return "literal=" + literal;
	}
}

package org.javai.commonmark.ext.strikethrough;

import java.util.Map;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.Delimited;

/**
 * Struck-through text, {@code ~~like this~~}.
 */
public class Strikethrough extends CustomNode implements Delimited {

	private final String delimiter;

	public Strikethrough(String delimiter) {
		this.delimiter = delimiter;
	}

	@Override
	public String kind() {
		return "strikethrough";
	}

	@Override
	public String getOpeningDelimiter() {
		return delimiter;
	}

	@Override
	public String getClosingDelimiter() {
		return delimiter;
	}

	@Override
	public Map<String, String> attributes() {
		return Map.of("delimiter", delimiter);
	}
}

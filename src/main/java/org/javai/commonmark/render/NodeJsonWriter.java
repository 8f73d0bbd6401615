package org.javai.commonmark.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.Delimited;
import org.javai.commonmark.node.Image;
import org.javai.commonmark.node.Link;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.StringContainer;

/**
 * Utility to convert a node tree into JSON for other tools or diagnostics.
 *
 * Every node becomes an object with its {@code kind}, its kind-specific
 * fields and a {@code children} array.
 */
public final class NodeJsonWriter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private NodeJsonWriter() {
	}

	public static ObjectNode toJson(Node node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("kind", node.kind());

		if (node instanceof StringContainer container) {
			json.put("literal", container.getLiteral());
		}
		if (node instanceof Delimited delimited) {
			json.put("delimiter", delimited.getOpeningDelimiter());
		}
		if (node instanceof Link link) {
			json.put("destination", link.getDestination());
			json.put("title", link.getTitle());
		} else if (node instanceof Image image) {
			json.put("destination", image.getDestination());
			json.put("label", image.getLabel());
			json.put("title", image.getTitle());
		} else if (node instanceof CustomNode custom) {
			custom.attributes().forEach(json::put);
		}

		ArrayNode children = json.putArray("children");
		for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
			children.add(toJson(child));
		}
		return json;
	}

	public static String toJsonString(Node node) {
		return toJson(node).toString();
	}
}

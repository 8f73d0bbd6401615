package org.javai.commonmark.node;

import java.util.Map;

/**
 * Base for node types contributed by extensions.
 *
 * Extension nodes are rendered by the renderer registered for their class and
 * expose their data through {@link #attributes()}.
 */
public abstract class CustomNode extends Node {

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}

	/**
	 * What this node becomes when it ends up inside the text of a link or image.
	 * Nodes that are links in their own right return a plain-text stand-in, since
	 * links cannot nest.
	 */
	public Node toLinkContent() {
		return this;
	}

	/**
	 * Kind-specific data of this node, used when the tree is exported.
	 */
	public Map<String, String> attributes() {
		return Map.of();
	}
}

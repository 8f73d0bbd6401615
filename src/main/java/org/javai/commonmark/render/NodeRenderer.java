package org.javai.commonmark.render;

import org.javai.commonmark.node.Node;

/**
 * Renders an extension node type to HTML. Registered per node class through the environment.
 */
@FunctionalInterface
public interface NodeRenderer {

	void render(Node node, HtmlRenderContext context);
}

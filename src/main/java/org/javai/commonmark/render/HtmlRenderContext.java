package org.javai.commonmark.render;

import java.util.Map;
import org.javai.commonmark.node.Node;

/**
 * Output side of the HTML renderer, as seen by a {@link NodeRenderer}.
 */
public interface HtmlRenderContext {

	/**
	 * Writes text, escaping HTML-significant characters.
	 */
	void text(String text);

	/**
	 * Writes markup unchanged.
	 */
	void raw(String html);

	/**
	 * Writes an opening tag. Attribute values are escaped; {@code selfClosing} emits {@code <name ... />}.
	 */
	void tag(String name, Map<String, String> attributes, boolean selfClosing);

	void closeTag(String name);

	/**
	 * Renders the children of {@code parent} in order.
	 */
	void renderChildren(Node parent);
}

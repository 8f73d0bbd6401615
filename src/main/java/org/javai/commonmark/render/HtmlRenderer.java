package org.javai.commonmark.render;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.commonmark.environment.Environment;
import org.javai.commonmark.node.Code;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.Document;
import org.javai.commonmark.node.Emphasis;
import org.javai.commonmark.node.HardLineBreak;
import org.javai.commonmark.node.HtmlInline;
import org.javai.commonmark.node.Image;
import org.javai.commonmark.node.Link;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.Paragraph;
import org.javai.commonmark.node.SoftLineBreak;
import org.javai.commonmark.node.StrongEmphasis;
import org.javai.commonmark.node.Text;
import org.javai.commonmark.node.Visitor;
import org.javai.commonmark.util.Escaping;

/**
 * Renders a node tree as CommonMark-style HTML. Extension nodes are handed to
 * the {@link NodeRenderer} registered for their class; nodes without one
 * render just their children.
 */
public class HtmlRenderer {

	private final Environment environment;

	public HtmlRenderer(Environment environment) {
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	public String render(Node node) {
		Objects.requireNonNull(node, "node must not be null");
		RenderingVisitor visitor = new RenderingVisitor();
		node.accept(visitor);
		return visitor.html.toString();
	}

	private class RenderingVisitor implements Visitor, HtmlRenderContext {

		private final StringBuilder html = new StringBuilder();

		@Override
		public void visit(Document document) {
			renderChildren(document);
		}

		@Override
		public void visit(Paragraph paragraph) {
			tag("p", Map.of(), false);
			renderChildren(paragraph);
			closeTag("p");
			html.append('\n');
		}

		@Override
		public void visit(Text text) {
			text(text.getLiteral());
		}

		@Override
		public void visit(Code code) {
			tag("code", Map.of(), false);
			text(code.getLiteral());
			closeTag("code");
		}

		@Override
		public void visit(HtmlInline htmlInline) {
			raw(htmlInline.getLiteral());
		}

		@Override
		public void visit(SoftLineBreak softLineBreak) {
			html.append('\n');
		}

		@Override
		public void visit(HardLineBreak hardLineBreak) {
			tag("br", Map.of(), true);
			html.append('\n');
		}

		@Override
		public void visit(Emphasis emphasis) {
			tag("em", Map.of(), false);
			renderChildren(emphasis);
			closeTag("em");
		}

		@Override
		public void visit(StrongEmphasis strongEmphasis) {
			tag("strong", Map.of(), false);
			renderChildren(strongEmphasis);
			closeTag("strong");
		}

		@Override
		public void visit(Link link) {
			Map<String, String> attributes = new LinkedHashMap<>();
			attributes.put("href", link.getDestination());
			if (!link.getTitle().isEmpty()) {
				attributes.put("title", link.getTitle());
			}
			tag("a", attributes, false);
			renderChildren(link);
			closeTag("a");
		}

		@Override
		public void visit(Image image) {
			Map<String, String> attributes = new LinkedHashMap<>();
			attributes.put("src", image.getDestination());
			attributes.put("alt", image.getLabel());
			if (!image.getTitle().isEmpty()) {
				attributes.put("title", image.getTitle());
			}
			tag("img", attributes, true);
		}

		@Override
		public void visit(CustomNode customNode) {
			NodeRenderer renderer = environment.getNodeRenderer(customNode.getClass());
			if (renderer != null) {
				renderer.render(customNode, this);
			} else {
				renderChildren(customNode);
			}
		}

		@Override
		public void text(String text) {
			html.append(Escaping.escapeHtml(text));
		}

		@Override
		public void raw(String raw) {
			html.append(raw);
		}

		@Override
		public void tag(String name, Map<String, String> attributes, boolean selfClosing) {
			html.append('<').append(name);
			attributes.forEach((key, value) ->
				html.append(' ').append(key).append("=\"").append(Escaping.escapeHtml(value)).append('"'));
			html.append(selfClosing ? " />" : ">");
		}

		@Override
		public void closeTag(String name) {
			html.append("</").append(name).append('>');
		}

		@Override
		public void renderChildren(Node parent) {
			for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
				child.accept(this);
			}
		}
	}
}

package org.javai.commonmark.node;

/**
 * Visitor over the node tree.
 *
 * Extension node types all arrive through {@link #visit(CustomNode)}.
 */
public interface Visitor {

	void visit(Document document);

	void visit(Paragraph paragraph);

	void visit(Text text);

	void visit(Code code);

	void visit(HtmlInline htmlInline);

	void visit(SoftLineBreak softLineBreak);

	void visit(HardLineBreak hardLineBreak);

	void visit(Emphasis emphasis);

	void visit(StrongEmphasis strongEmphasis);

	void visit(Link link);

	void visit(Image image);

	void visit(CustomNode customNode);
}

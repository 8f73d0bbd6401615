package org.javai.commonmark.node;

/**
 * Visitor that descends into children by default. Override the methods of
 * interest and call {@link #visitChildren(Node)} to keep descending.
 */
public abstract class AbstractVisitor implements Visitor {

	@Override
	public void visit(Document document) {
		visitChildren(document);
	}

	@Override
	public void visit(Paragraph paragraph) {
		visitChildren(paragraph);
	}

	@Override
	public void visit(Text text) {
		visitChildren(text);
	}

	@Override
	public void visit(Code code) {
		visitChildren(code);
	}

	@Override
	public void visit(HtmlInline htmlInline) {
		visitChildren(htmlInline);
	}

	@Override
	public void visit(SoftLineBreak softLineBreak) {
		visitChildren(softLineBreak);
	}

	@Override
	public void visit(HardLineBreak hardLineBreak) {
		visitChildren(hardLineBreak);
	}

	@Override
	public void visit(Emphasis emphasis) {
		visitChildren(emphasis);
	}

	@Override
	public void visit(StrongEmphasis strongEmphasis) {
		visitChildren(strongEmphasis);
	}

	@Override
	public void visit(Link link) {
		visitChildren(link);
	}

	@Override
	public void visit(Image image) {
		visitChildren(image);
	}

	@Override
	public void visit(CustomNode customNode) {
		visitChildren(customNode);
	}

	protected void visitChildren(Node parent) {
		Node child = parent.getFirstChild();
		while (child != null) {
			// the visitor may unlink the child
			Node next = child.getNext();
			child.accept(this);
			child = next;
		}
	}
}

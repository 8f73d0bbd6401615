package org.javai.commonmark.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base of the inline node tree.
 *
 * Every node keeps links to its parent, its first and last child and its
 * previous and next sibling. All structural operations update both directions
 * of a link together, so a node is never reachable from a parent it no longer
 * belongs to.
 */
public abstract class Node {

	private Node parent;
	private Node firstChild;
	private Node lastChild;
	private Node previous;
	private Node next;

	/**
	 * Short, stable name of this node type (for example {@code "text"} or {@code "link"}).
	 */
	public abstract String kind();

	/**
	 * Dispatches to the matching {@link Visitor} method.
	 */
	public abstract void accept(Visitor visitor);

	public Node getParent() {
		return parent;
	}

	public Node getFirstChild() {
		return firstChild;
	}

	public Node getLastChild() {
		return lastChild;
	}

	public Node getPrevious() {
		return previous;
	}

	public Node getNext() {
		return next;
	}

	public boolean hasChildren() {
		return firstChild != null;
	}

	/**
	 * Snapshot of the direct children in document order.
	 */
	public List<Node> children() {
		List<Node> children = new ArrayList<>();
		for (Node child = firstChild; child != null; child = child.next) {
			children.add(child);
		}
		return children;
	}

	public void appendChild(Node child) {
		Objects.requireNonNull(child, "child must not be null");
		child.unlink();
		child.parent = this;
		if (lastChild != null) {
			lastChild.next = child;
			child.previous = lastChild;
			lastChild = child;
		} else {
			firstChild = child;
			lastChild = child;
		}
	}

	public void prependChild(Node child) {
		Objects.requireNonNull(child, "child must not be null");
		child.unlink();
		child.parent = this;
		if (firstChild != null) {
			firstChild.previous = child;
			child.next = firstChild;
			firstChild = child;
		} else {
			firstChild = child;
			lastChild = child;
		}
	}

	/**
	 * Inserts {@code sibling} directly after this node, detaching it from wherever it was.
	 */
	public void insertAfter(Node sibling) {
		Objects.requireNonNull(sibling, "sibling must not be null");
		sibling.unlink();
		sibling.next = next;
		if (sibling.next != null) {
			sibling.next.previous = sibling;
		}
		sibling.previous = this;
		next = sibling;
		sibling.parent = parent;
		if (sibling.next == null && parent != null) {
			parent.lastChild = sibling;
		}
	}

	/**
	 * Inserts {@code sibling} directly before this node, detaching it from wherever it was.
	 */
	public void insertBefore(Node sibling) {
		Objects.requireNonNull(sibling, "sibling must not be null");
		sibling.unlink();
		sibling.previous = previous;
		if (sibling.previous != null) {
			sibling.previous.next = sibling;
		}
		sibling.next = this;
		previous = sibling;
		sibling.parent = parent;
		if (sibling.previous == null && parent != null) {
			parent.firstChild = sibling;
		}
	}

	/**
	 * Puts {@code replacement} where this node was and detaches this node.
	 * Children of this node stay with it.
	 */
	public void replaceWith(Node replacement) {
		Objects.requireNonNull(replacement, "replacement must not be null");
		if (replacement == this) {
			return;
		}
		insertAfter(replacement);
		unlink();
	}

	/**
	 * Detaches this node from its parent and siblings.
	 */
	public void unlink() {
		if (previous != null) {
			previous.next = next;
		} else if (parent != null) {
			parent.firstChild = next;
		}
		if (next != null) {
			next.previous = previous;
		} else if (parent != null) {
			parent.lastChild = previous;
		}
		parent = null;
		next = null;
		previous = null;
	}

	/**
	 * Detaches every child of this node.
	 */
	public void removeChildren() {
		Node child = firstChild;
		while (child != null) {
			Node following = child.next;
			child.unlink();
			child = following;
		}
	}

	@Override
	public String toString() {
		String details = toStringAttributes();
		return getClass().getSimpleName() + "{" + details + "}";
	}

	protected String toStringAttributes() {
		return "";
	}
}

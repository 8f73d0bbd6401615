package org.javai.commonmark.node;

import java.util.function.Consumer;

/**
 * Utility class for walking node trees.
 * Provides common traversal patterns for tree operations.
 */
public final class NodeWalker {

	private NodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a node tree in pre-order (visits node before children).
	 * The consumer may unlink the node it is given; its siblings are still visited.
	 *
	 * @param node the root node to start traversal from
	 * @param action the action to apply to each node
	 */
	public static void walkPreOrder(Node node, Consumer<Node> action) {
		if (node == null) {
			return;
		}

		action.accept(node);

		Node child = node.getFirstChild();
		while (child != null) {
			Node next = child.getNext();
			walkPreOrder(child, action);
			child = next;
		}
	}

	/**
	 * Walks a node tree in post-order (visits children before node).
	 *
	 * @param node the root node to start traversal from
	 * @param action the action to apply to each node
	 */
	public static void walkPostOrder(Node node, Consumer<Node> action) {
		if (node == null) {
			return;
		}

		Node child = node.getFirstChild();
		while (child != null) {
			Node next = child.getNext();
			walkPostOrder(child, action);
			child = next;
		}

		action.accept(node);
	}

	/**
	 * Concatenates the literal text of a subtree, the way it reads when all markup is removed.
	 * Line breaks read as {@code "\n"}, images contribute their label.
	 */
	public static String textContent(Node node) {
		StringBuilder sb = new StringBuilder();
		appendTextContent(node, sb);
		return sb.toString();
	}

	private static void appendTextContent(Node node, StringBuilder sb) {
		if (node instanceof StringContainer container) {
			sb.append(container.getLiteral());
		} else if (node instanceof Image image) {
			sb.append(image.getLabel());
		} else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
			sb.append('\n');
		}
		for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
			appendTextContent(child, sb);
		}
	}
}

package org.javai.commonmark.node;

/**
 * Merges runs of adjacent {@link Text} siblings into a single node.
 * Purely structural: the literal text read in order is unchanged.
 */
public final class AdjacentTextMerger {

	private AdjacentTextMerger() {
	}

	/**
	 * Merges text among the direct children of {@code parent}.
	 */
	public static void mergeChildNodes(Node parent) {
		if (parent.getFirstChild() == null || parent.getFirstChild() == parent.getLastChild()) {
			return;
		}
		mergeTextNodesInclusive(parent.getFirstChild(), parent.getLastChild());
	}

	/**
	 * Merges text among the children of {@code root} and of all its descendants.
	 */
	public static void mergeRecursively(Node root) {
		NodeWalker.walkPostOrder(root, AdjacentTextMerger::mergeChildNodes);
	}

	/**
	 * Merges text strictly between two siblings; {@code from} and {@code to} themselves are untouched.
	 */
	public static void mergeTextNodesBetweenExclusive(Node from, Node to) {
		if (from == to || from.getNext() == to || to.getPrevious() == from) {
			return;
		}
		mergeTextNodesInclusive(from.getNext(), to.getPrevious());
	}

	private static void mergeTextNodesInclusive(Node from, Node to) {
		Text first = null;
		Text last = null;
		int length = 0;

		Node node = from;
		while (node != null) {
			if (node instanceof Text text) {
				if (first == null) {
					first = text;
				}
				length += text.getLiteral().length();
				last = text;
			} else {
				mergeIfNeeded(first, last, length);
				first = null;
				last = null;
				length = 0;
			}
			if (node == to) {
				break;
			}
			node = node.getNext();
		}

		mergeIfNeeded(first, last, length);
	}

	private static void mergeIfNeeded(Text first, Text last, int textLength) {
		if (first == null || last == null || first == last) {
			return;
		}
		StringBuilder sb = new StringBuilder(textLength);
		sb.append(first.getLiteral());
		Node node = first.getNext();
		Node stop = last.getNext();
		while (node != stop) {
			sb.append(((Text) node).getLiteral());
			Node unlink = node;
			node = node.getNext();
			unlink.unlink();
		}
		first.setLiteral(sb.toString());
	}
}

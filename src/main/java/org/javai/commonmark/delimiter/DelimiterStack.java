package org.javai.commonmark.delimiter;

import java.util.HashMap;
import java.util.Map;
import org.javai.commonmark.node.AdjacentTextMerger;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.StringContainer;

/**
 * Ordered stack of pending delimiters for the block being parsed.
 *
 * Delimiters are doubly linked in scan order. {@link #processDelimiters} is the
 * emphasis pairing algorithm. The bracket resolver uses the other operations to
 * find its opener and to discard delimiters a link has consumed.
 */
public final class DelimiterStack {

	private Delimiter top;
	private int size;

	public Delimiter top() {
		return top;
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return top == null;
	}

	/**
	 * Appends a delimiter in scan order.
	 */
	public void push(Delimiter delimiter) {
		if (delimiter.inStack) {
			throw new IllegalStateException("Delimiter is already on the stack: " + delimiter);
		}
		delimiter.previous = top;
		delimiter.next = null;
		if (top != null) {
			top.next = delimiter;
		}
		top = delimiter;
		delimiter.inStack = true;
		size++;
	}

	/**
	 * Nearest delimiter below the top whose character is one of {@code characters}.
	 *
	 * @return the delimiter, or {@code null} if there is none
	 */
	public Delimiter searchByCharacter(char... characters) {
		for (Delimiter delimiter = top; delimiter != null; delimiter = delimiter.previous) {
			for (char c : characters) {
				if (delimiter.getCharacter() == c) {
					return delimiter;
				}
			}
		}
		return null;
	}

	/**
	 * Unlinks a delimiter from the stack. The node tree is left alone. Removing a
	 * delimiter that is no longer on the stack does nothing.
	 */
	public void removeDelimiter(Delimiter delimiter) {
		if (!delimiter.inStack) {
			return;
		}
		if (delimiter.previous != null) {
			delimiter.previous.next = delimiter.next;
		}
		if (delimiter.next == null) {
			top = delimiter.previous;
		} else {
			delimiter.next.previous = delimiter.previous;
		}
		delimiter.previous = null;
		delimiter.next = null;
		delimiter.inStack = false;
		size--;
	}

	/**
	 * Unlinks a delimiter and detaches its placeholder node from the tree.
	 */
	public void removeDelimiterAndNode(Delimiter delimiter) {
		delimiter.getNode().unlink();
		removeDelimiter(delimiter);
	}

	/**
	 * Unlinks every delimiter strictly between {@code opener} and {@code closer}.
	 */
	public void removeDelimitersBetween(Delimiter opener, Delimiter closer) {
		Delimiter delimiter = closer.previous;
		while (delimiter != null && delimiter != opener) {
			Delimiter previous = delimiter.previous;
			removeDelimiter(delimiter);
			delimiter = previous;
		}
	}

	/**
	 * Unlinks every delimiter above {@code stackBottom}; {@code null} empties the stack.
	 */
	public void removeAll(Delimiter stackBottom) {
		while (top != null && top != stackBottom) {
			removeDelimiter(top);
		}
	}

	/**
	 * Deactivates every delimiter with the given character. Used after a link has been
	 * made, because a link may not contain another link.
	 */
	public void removeEarlierMatches(char character) {
		for (Delimiter delimiter = top; delimiter != null; delimiter = delimiter.previous) {
			if (delimiter.getCharacter() == character) {
				delimiter.deactivate();
			}
		}
	}

	/**
	 * Pairs openers and closers above {@code stackBottom} into wrapper nodes.
	 *
	 * Closers are visited in scan order. For each one the nearest compatible
	 * opener below it is paired with it. Afterwards every delimiter above
	 * {@code stackBottom} has been removed.
	 *
	 * @param stackBottom delimiter to stop at, exclusive; {@code null} processes the whole stack
	 * @param processors processors by delimiter character
	 */
	public void processDelimiters(Delimiter stackBottom, DelimiterProcessorCollection processors) {
		Map<Character, Delimiter> openersBottom = new HashMap<>();

		Delimiter closer = findEarliest(stackBottom);
		while (closer != null) {
			char closingCharacter = closer.getCharacter();
			DelimiterProcessor processor = processors.getDelimiterProcessor(closingCharacter);
			if (!closer.canClose() || processor == null || processor.getClosingCharacter() != closingCharacter) {
				closer = closer.next;
				continue;
			}

			char openingCharacter = processor.getOpeningCharacter();
			int useDelims = 0;
			boolean openerFound = false;
			boolean potentialOpenerFound = false;
			Delimiter opener = closer.previous;
			while (opener != null && opener != stackBottom && opener != openersBottom.get(closingCharacter)) {
				if (opener.getCharacter() == openingCharacter && opener.canOpen()) {
					potentialOpenerFound = true;
					if (!violatesMultipleOfThree(processor, opener, closer)) {
						useDelims = processor.getDelimiterUse(opener, closer);
						if (useDelims > 0) {
							openerFound = true;
							break;
						}
					}
				}
				opener = opener.previous;
			}

			if (!openerFound) {
				if (!potentialOpenerFound) {
					// Nothing below can ever open for this closer; later closers need not look further down.
					// Rejected candidates are not a floor, their remaining length may still change.
					openersBottom.put(closingCharacter, closer.previous);
					if (!closer.canOpen()) {
						removeDelimiter(closer);
					}
				}
				closer = closer.next;
				continue;
			}

			Node openerNode = opener.getNode();
			Node closerNode = closer.getNode();

			opener.setLength(opener.getLength() - useDelims);
			closer.setLength(closer.getLength() - useDelims);
			trimLiteral(openerNode, useDelims);
			trimLiteral(closerNode, useDelims);

			removeDelimitersBetween(opener, closer);
			AdjacentTextMerger.mergeTextNodesBetweenExclusive(openerNode, closerNode);
			processor.process(openerNode, closerNode, useDelims);

			if (opener.getLength() == 0) {
				removeDelimiterAndNode(opener);
			}
			if (closer.getLength() == 0) {
				Delimiter next = closer.next;
				removeDelimiterAndNode(closer);
				closer = next;
			}
		}

		removeAll(stackBottom);
	}

	/**
	 * CommonMark's "multiple of 3" rule: if either run can both open and close, the
	 * sum of the original run lengths must not be a multiple of 3 unless both are.
	 */
	static boolean violatesMultipleOfThree(DelimiterProcessor processor, Delimiter opener, Delimiter closer) {
		if (!processor.isMultipleOfThreeSensitive()) {
			return false;
		}
		if (!opener.canClose() && !closer.canOpen()) {
			return false;
		}
		int openerLength = opener.getOriginalLength();
		int closerLength = closer.getOriginalLength();
		return (openerLength + closerLength) % 3 == 0
			&& !(openerLength % 3 == 0 && closerLength % 3 == 0);
	}

	private Delimiter findEarliest(Delimiter stackBottom) {
		Delimiter earliest = null;
		for (Delimiter delimiter = top; delimiter != null && delimiter != stackBottom; delimiter = delimiter.previous) {
			earliest = delimiter;
		}
		return earliest;
	}

	private static void trimLiteral(Node node, int characters) {
		if (node instanceof StringContainer container) {
			String literal = container.getLiteral();
			container.setLiteral(literal.substring(0, Math.max(0, literal.length() - characters)));
		}
	}
}

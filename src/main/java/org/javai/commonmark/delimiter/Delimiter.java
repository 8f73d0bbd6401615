package org.javai.commonmark.delimiter;

import org.javai.commonmark.node.Node;

/**
 * A run of delimiter characters ({@code [}, {@code ![}, {@code *}, {@code _}, ...)
 * that may turn out to open or close a construct.
 *
 * The delimiter points at the placeholder node holding its characters. It is
 * linked into a {@link DelimiterStack} in scan order. Once deactivated it never
 * becomes active again.
 */
public final class Delimiter {

	/**
	 * Marker for delimiters that carry no position in the source text.
	 */
	public static final int NO_INDEX = -1;

	private final char character;
	private final int originalLength;
	private final Node node;
	private final boolean canOpen;
	private final boolean canClose;
	private final int index;

	private int length;
	private boolean active = true;

	Delimiter previous;
	Delimiter next;
	boolean inStack;

	public Delimiter(char character, int length, Node node, boolean canOpen, boolean canClose) {
		this(character, length, node, canOpen, canClose, NO_INDEX);
	}

	/**
	 * @param character the trigger character
	 * @param length the number of characters in the run
	 * @param node the placeholder node holding the run's characters
	 * @param canOpen whether the run can open a construct
	 * @param canClose whether the run can close a construct
	 * @param index position in the source just after the opener, or {@link #NO_INDEX}
	 */
	public Delimiter(char character, int length, Node node, boolean canOpen, boolean canClose, int index) {
		this.character = character;
		this.originalLength = length;
		this.length = length;
		this.node = node;
		this.canOpen = canOpen;
		this.canClose = canClose;
		this.index = index;
	}

	public char getCharacter() {
		return character;
	}

	public int getOriginalLength() {
		return originalLength;
	}

	public int getLength() {
		return length;
	}

	void setLength(int length) {
		this.length = length;
	}

	public Node getNode() {
		return node;
	}

	public boolean canOpen() {
		return canOpen;
	}

	public boolean canClose() {
		return canClose;
	}

	public boolean hasIndex() {
		return index != NO_INDEX;
	}

	public int getIndex() {
		return index;
	}

	public boolean isActive() {
		return active;
	}

	public void deactivate() {
		this.active = false;
	}

	public Delimiter getPrevious() {
		return previous;
	}

	public Delimiter getNext() {
		return next;
	}

	@Override
	public String toString() {
		return "Delimiter{'" + character + "' x" + length + "/" + originalLength
			+ (canOpen ? " open" : "") + (canClose ? " close" : "") + (active ? "" : " inactive") + "}";
	}
}

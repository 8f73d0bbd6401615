package org.javai.commonmark.node;

/**
 * Hyperlink. The link text is held as children.
 */
public class Link extends Node {

	private String destination;
	private String title;

	public Link(String destination, String title) {
		this.destination = destination != null ? destination : "";
		this.title = title != null ? title : "";
	}

	@Override
	public String kind() {
		return "link";
	}

	@Override
	public void accept(Visitor visitor) {
		visitor.visit(this);
	}

	public String getDestination() {
		return destination;
	}

	public void setDestination(String destination) {
		this.destination = destination != null ? destination : "";
	}

	public String getTitle() {
		return title;
	}

	public void setTitle(String title) {
		this.title = title != null ? title : "";
	}

	@Override
	protected String toStringAttributes() {
		return "destination=" + destination + ", title=" + title;
	}
}

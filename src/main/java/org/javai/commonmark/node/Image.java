package org.javai.commonmark.node;

/**
 * Image. Unlike {@link Link} an image has no children: its description is
 * flattened to plain text and kept in {@link #getLabel()}.
 */
public class Image extends Node {

	private String destination;
	private String title;
	private String label;

	public Image(String destination, String label, String title) {
		this.destination = destination != null ? destination : "";
		this.label = label != null ? label : "";
		this.title = title != null ? title : "";
	}

	@Override
	public String kind() {
		return "image";
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

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label != null ? label : "";
	}

	@Override
	protected String toStringAttributes() {
		return "destination=" + destination + ", label=" + label + ", title=" + title;
	}
}

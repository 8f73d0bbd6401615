package org.javai.commonmark.ext.mention;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.Text;

/**
 * A mention such as {@code @colinodell} or {@code #123}.
 *
 * Created without a URL; its {@link MentionGenerator} decides where it points.
 * The only child is the label text, prefix followed by identifier. Once linked,
 * the URL is exported as {@code destination}, the same field a {@link org.javai.commonmark.node.Link} has.
 */
public class Mention extends CustomNode {

	private final String name;
	private final String prefix;
	private final String identifier;
	private String url;

	public Mention(String name, String prefix, String identifier) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
		this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
		appendChild(new Text(prefix + identifier));
	}

	@Override
	public String kind() {
		return "mention";
	}

	/**
	 * Name of the configuration entry that matched, e.g. {@code github_handle}.
	 */
	public String getName() {
		return name;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getIdentifier() {
		return identifier;
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public boolean hasUrl() {
		return url != null;
	}

	public String getLabel() {
		return prefix + identifier;
	}

	@Override
	public Node toLinkContent() {
		return new Text(getLabel());
	}

	@Override
	public Map<String, String> attributes() {
		Map<String, String> attributes = new LinkedHashMap<>();
		attributes.put("name", name);
		attributes.put("prefix", prefix);
		attributes.put("identifier", identifier);
		if (url != null) {
			attributes.put("destination", url);
		}
		return attributes;
	}

	@Override
	protected String toStringAttributes() {
		return "name=" + name + ", label=" + getLabel() + ", url=" + url;
	}
}

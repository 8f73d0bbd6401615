package org.javai.commonmark.ext.mention;

import java.util.Objects;
import org.javai.commonmark.node.Node;

/**
 * Links every mention to a URL built from a template, {@code %s} standing for the identifier.
 */
public class StringTemplateLinkGenerator implements MentionGenerator {

	private final String urlTemplate;

	public StringTemplateLinkGenerator(String urlTemplate) {
		this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate must not be null");
	}

	@Override
	public Node generateMention(Mention mention) {
		mention.setUrl(urlTemplate.replace("%s", mention.getIdentifier()));
		return mention;
	}
}

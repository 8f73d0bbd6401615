package org.javai.commonmark.ext.mention;

import org.javai.commonmark.node.Node;

/**
 * Decides what a matched mention turns into.
 */
@FunctionalInterface
public interface MentionGenerator {

	/**
	 * @param mention the matched mention, without a URL
	 * @return the mention with its URL set, a different node to put in its place,
	 *         or {@code null} to leave the text as it is
	 */
	Node generateMention(Mention mention);
}

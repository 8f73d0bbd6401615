package org.javai.commonmark.ext.mention;

import java.util.Objects;
import java.util.Set;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.CursorState;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.util.Characters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches one configured kind of mention: the prefix, not preceded by a word
 * character, followed by an identifier matching the pattern.
 */
public class MentionParser implements InlineParser {

	private static final Logger logger = LoggerFactory.getLogger(MentionParser.class);

	private final MentionDefinition definition;

	public MentionParser(MentionDefinition definition) {
		this.definition = Objects.requireNonNull(definition, "definition must not be null");
	}

	@Override
	public Set<Character> getCharacters() {
		return Set.of(definition.prefix().charAt(0));
	}

	/**
	 * @throws IllegalStateException if the generator hands back the mention without a URL
	 */
	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		if (Characters.isWordCharacter(cursor.peek(-1))) {
			return false;
		}
		if (!cursor.startsWith(definition.prefix())) {
			return false;
		}

		CursorState start = cursor.saveState();
		cursor.advanceBy(definition.prefix().length());
		String identifier = cursor.match(definition.pattern());
		if (identifier == null || identifier.isEmpty()) {
			cursor.restoreState(start);
			return false;
		}

		Mention mention = new Mention(definition.name(), definition.prefix(), identifier);
		Node result = definition.generator().generateMention(mention);
		if (result == null) {
			logger.debug("Generator for '{}' declined mention {}", definition.name(), mention.getLabel());
			cursor.restoreState(start);
			return false;
		}
		if (result == mention && !mention.hasUrl()) {
			throw new IllegalStateException("Generator for '" + definition.name()
				+ "' returned mention " + mention.getLabel() + " without a URL");
		}

		context.getContainer().appendChild(result);
		return true;
	}
}

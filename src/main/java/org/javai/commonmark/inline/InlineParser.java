package org.javai.commonmark.inline;

import java.util.Set;

/**
 * Handler for constructs that start with one of a fixed set of characters.
 *
 * Parsers are tried in priority order whenever the engine reaches one of
 * their characters. A parser that does not recognize its construct returns
 * {@code false} and leaves the cursor where it found it.
 */
public interface InlineParser {

	/**
	 * Characters that trigger this parser.
	 */
	Set<Character> getCharacters();

	/**
	 * Attempts to parse at the current cursor position.
	 *
	 * @return {@code true} if input was consumed and nodes were added to the container
	 */
	boolean parse(InlineParserContext context);
}

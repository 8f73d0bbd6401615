package org.javai.commonmark.inline.parser;

import java.util.Set;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.HardLineBreak;
import org.javai.commonmark.node.Text;
import org.javai.commonmark.util.Characters;

/**
 * Backslash escapes. An escaped ASCII punctuation character is literal; a
 * backslash at the end of a line is a hard break; any other backslash is literal.
 */
public class BackslashParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('\\');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		char next = cursor.peek(1);

		if (next == '\n') {
			cursor.advanceBy(2);
			context.getContainer().appendChild(new HardLineBreak());
			cursor.advanceToNextNonSpaceOrTab();
		} else if (Characters.isAsciiPunctuation(next)) {
			cursor.advanceBy(2);
			context.getContainer().appendChild(new Text(String.valueOf(next)));
		} else {
			cursor.advance();
			context.getContainer().appendChild(new Text("\\"));
		}
		return true;
	}
}

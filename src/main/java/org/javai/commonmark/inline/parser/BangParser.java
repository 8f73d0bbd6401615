package org.javai.commonmark.inline.parser;

import java.util.Set;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Text;

/**
 * {@code ![}: a possible image opener. A {@code !} not followed by {@code [} is left to plain text.
 */
public class BangParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('!');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		if (cursor.peek(1) != '[') {
			return false;
		}
		cursor.advanceBy(2);

		Text node = new Text("![");
		context.getContainer().appendChild(node);
		context.getDelimiterStack().push(new Delimiter('!', 1, node, true, false, cursor.getPosition()));
		return true;
	}
}

package org.javai.commonmark.inline.parser;

import java.util.Set;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Text;

/**
 * {@code [}: a possible link opener. Pushed onto the delimiter stack with the
 * position of the label start, so a shortcut reference can be resolved later.
 */
public class OpenBracketParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('[');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		cursor.advance();

		Text node = new Text("[");
		context.getContainer().appendChild(node);
		context.getDelimiterStack().push(new Delimiter('[', 1, node, true, false, cursor.getPosition()));
		return true;
	}
}

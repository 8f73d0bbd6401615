package org.javai.commonmark.ext.smartpunct;

import java.util.Set;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.delimiter.Flanking;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;

/**
 * Pushes every straight quote onto the delimiter stack. A quote opens when it
 * is left-flanking only and closes whenever it is right-flanking, so the
 * apostrophe in {@code don't} is a closer.
 */
public class QuoteParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('"', '\'');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		char quote = cursor.getCharacter();
		char before = cursor.peek(-1);
		cursor.advance();
		char after = cursor.getCharacter();

		Flanking flanking = Flanking.of(before, after);
		boolean canOpen = flanking.left() && !flanking.right();
		boolean canClose = flanking.right();

		Quote node = new Quote(String.valueOf(quote));
		context.getContainer().appendChild(node);
		context.getDelimiterStack().push(new Delimiter(quote, 1, node, canOpen, canClose));
		return true;
	}
}

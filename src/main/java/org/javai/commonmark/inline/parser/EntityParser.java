package org.javai.commonmark.inline.parser;

import java.util.Set;
import java.util.regex.Pattern;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.CursorState;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Text;
import org.javai.commonmark.util.Escaping;

/**
 * Named, decimal and hexadecimal character references.
 */
public class EntityParser implements InlineParser {

	private static final Pattern ENTITY = Pattern.compile(Escaping.ENTITY);

	@Override
	public Set<Character> getCharacters() {
		return Set.of('&');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		CursorState start = cursor.saveState();
		String entity = cursor.match(ENTITY);
		if (entity == null) {
			return false;
		}
		String decoded = Escaping.decodeEntity(entity);
		if (decoded.equals(entity)) {
			// Not a known entity name.
			cursor.restoreState(start);
			return false;
		}
		context.getContainer().appendChild(new Text(decoded));
		return true;
	}
}

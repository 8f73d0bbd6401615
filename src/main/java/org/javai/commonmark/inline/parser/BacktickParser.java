package org.javai.commonmark.inline.parser;

import java.util.Set;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Code;
import org.javai.commonmark.node.Text;

/**
 * Code spans. A run of backticks opens a span that is closed by the next run
 * of the same length. Without a closing run the backticks are literal.
 */
public class BacktickParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('`');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		int openerLength = runLength(cursor, 0);
		int contentStart = cursor.getPosition() + openerLength;

		int offset = openerLength;
		while (cursor.peek(offset) != Cursor.END) {
			if (cursor.peek(offset) == '`') {
				int closerLength = runLength(cursor, offset);
				if (closerLength == openerLength) {
					String content = cursor.getSubstring(contentStart, offset - openerLength);
					cursor.advanceBy(offset + closerLength);
					context.getContainer().appendChild(new Code(normalize(content)));
					return true;
				}
				offset += closerLength;
			} else {
				offset++;
			}
		}

		// No matching closer, the opening run is literal text.
		String ticks = cursor.getSubstring(cursor.getPosition(), openerLength);
		cursor.advanceBy(openerLength);
		context.getContainer().appendChild(new Text(ticks));
		return true;
	}

	private static int runLength(Cursor cursor, int offset) {
		int length = 0;
		while (cursor.peek(offset + length) == '`') {
			length++;
		}
		return length;
	}

	private static String normalize(String content) {
		String code = content.replace("\r\n", " ").replace('\n', ' ');
		if (code.length() >= 2 && code.charAt(0) == ' ' && code.charAt(code.length() - 1) == ' '
			&& !code.isBlank()) {
			return code.substring(1, code.length() - 1);
		}
		return code;
	}
}

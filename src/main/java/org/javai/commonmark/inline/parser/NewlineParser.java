package org.javai.commonmark.inline.parser;

import java.util.Set;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.HardLineBreak;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.SoftLineBreak;
import org.javai.commonmark.node.Text;

/**
 * Line endings: a hard break after two or more trailing spaces, a soft break otherwise.
 */
public class NewlineParser implements InlineParser {

	@Override
	public Set<Character> getCharacters() {
		return Set.of('\n');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		cursor.advance();

		int trailingSpaces = 0;
		Node last = context.getContainer().getLastChild();
		if (last instanceof Text text) {
			String literal = text.getLiteral();
			int end = literal.length();
			while (end > 0 && literal.charAt(end - 1) == ' ') {
				end--;
			}
			trailingSpaces = literal.length() - end;
			if (trailingSpaces > 0) {
				if (end == 0) {
					text.unlink();
				} else {
					text.setLiteral(literal.substring(0, end));
				}
			}
		}

		context.getContainer().appendChild(trailingSpaces >= 2 ? new HardLineBreak() : new SoftLineBreak());

		// Leading spaces of the next line are not part of the content.
		cursor.advanceToNextNonSpaceOrTab();
		return true;
	}
}

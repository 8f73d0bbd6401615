package org.javai.commonmark.ext.smartpunct;

import java.util.Set;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Text;

/**
 * Ellipses and dashes.
 *
 * {@code ...} and {@code . . .} become an ellipsis. A run of two or more
 * hyphens becomes dashes: all em dashes if the length is a multiple of three,
 * otherwise all en dashes if it is even, otherwise as many em dashes as
 * possible with one or two en dashes after them.
 */
public class PunctuationParser implements InlineParser {

	static final String ELLIPSIS = "…";
	static final String EN_DASH = "–";
	static final String EM_DASH = "—";

	@Override
	public Set<Character> getCharacters() {
		return Set.of('.', '-');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		if (cursor.getCharacter() == '.') {
			return parseEllipsis(context, cursor);
		}
		return parseDashes(context, cursor);
	}

	private static boolean parseEllipsis(InlineParserContext context, Cursor cursor) {
		int length;
		if (cursor.startsWith("...")) {
			length = 3;
		} else if (cursor.startsWith(". . .")) {
			length = 5;
		} else {
			return false;
		}
		cursor.advanceBy(length);
		context.getContainer().appendChild(new Text(ELLIPSIS));
		return true;
	}

	private static boolean parseDashes(InlineParserContext context, Cursor cursor) {
		int run = 0;
		while (cursor.peek(run) == '-') {
			run++;
		}
		if (run < 2) {
			return false;
		}
		cursor.advanceBy(run);
		context.getContainer().appendChild(new Text(dashes(run)));
		return true;
	}

	static String dashes(int run) {
		int em;
		int en;
		if (run % 3 == 0) {
			em = run / 3;
			en = 0;
		} else if (run % 2 == 0) {
			em = 0;
			en = run / 2;
		} else if (run % 3 == 2) {
			em = (run - 2) / 3;
			en = 1;
		} else {
			em = (run - 4) / 3;
			en = 2;
		}
		return EM_DASH.repeat(em) + EN_DASH.repeat(en);
	}
}

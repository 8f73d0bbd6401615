package org.javai.commonmark.inline.parser;

import java.util.Set;
import java.util.regex.Pattern;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.Link;
import org.javai.commonmark.node.Text;

/**
 * URI and email autolinks in angle brackets: {@code <https://example.com>}, {@code <me@example.com>}.
 */
public class AutolinkParser implements InlineParser {

	private static final Pattern URI = Pattern.compile("<([a-zA-Z][a-zA-Z0-9.+-]{1,31}:[^<>\\x00-\\x20]*)>");

	private static final Pattern EMAIL = Pattern.compile(
		"<([a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
			+ "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*)>");

	@Override
	public Set<Character> getCharacters() {
		return Set.of('<');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		Cursor cursor = context.getCursor();

		String match = cursor.match(EMAIL);
		if (match != null) {
			String address = match.substring(1, match.length() - 1);
			context.getContainer().appendChild(createLink("mailto:" + address, address));
			return true;
		}

		match = cursor.match(URI);
		if (match != null) {
			String uri = match.substring(1, match.length() - 1);
			context.getContainer().appendChild(createLink(uri, uri));
			return true;
		}

		return false;
	}

	private static Link createLink(String destination, String text) {
		Link link = new Link(destination, null);
		link.appendChild(new Text(text));
		return link;
	}
}

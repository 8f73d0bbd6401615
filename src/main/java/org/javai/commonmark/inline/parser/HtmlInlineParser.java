package org.javai.commonmark.inline.parser;

import java.util.Set;
import java.util.regex.Pattern;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.HtmlInline;

/**
 * Raw HTML: open and closing tags, comments, processing instructions,
 * declarations and CDATA sections.
 */
public class HtmlInlineParser implements InlineParser {

	private static final String TAG_NAME = "[A-Za-z][A-Za-z0-9-]*";
	private static final String ATTRIBUTE_NAME = "[a-zA-Z_:][a-zA-Z0-9:._-]*";
	private static final String UNQUOTED_VALUE = "[^\"'=<>`\\x00-\\x20]+";
	private static final String SINGLE_QUOTED_VALUE = "'[^']*'";
	private static final String DOUBLE_QUOTED_VALUE = "\"[^\"]*\"";
	private static final String ATTRIBUTE_VALUE =
		"(?:" + UNQUOTED_VALUE + "|" + SINGLE_QUOTED_VALUE + "|" + DOUBLE_QUOTED_VALUE + ")";
	private static final String ATTRIBUTE_VALUE_SPEC = "(?:\\s*=\\s*" + ATTRIBUTE_VALUE + ")";
	private static final String ATTRIBUTE = "(?:\\s+" + ATTRIBUTE_NAME + ATTRIBUTE_VALUE_SPEC + "?)";

	private static final String OPEN_TAG = "<" + TAG_NAME + ATTRIBUTE + "*\\s*/?>";
	private static final String CLOSE_TAG = "</" + TAG_NAME + "\\s*>";
	private static final String COMMENT = "<!---->|<!--(?:-?[^>-])(?:-?[^-])*-->";
	private static final String PROCESSING_INSTRUCTION = "<\\?[\\s\\S]*?\\?>";
	private static final String DECLARATION = "<![A-Za-z]+[^>]*>";
	private static final String CDATA = "<!\\[CDATA\\[[\\s\\S]*?\\]\\]>";

	private static final Pattern HTML_TAG = Pattern.compile("(?:" + OPEN_TAG + "|" + CLOSE_TAG + "|" + COMMENT
		+ "|" + PROCESSING_INSTRUCTION + "|" + DECLARATION + "|" + CDATA + ")");

	@Override
	public Set<Character> getCharacters() {
		return Set.of('<');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		String html = context.getCursor().match(HTML_TAG);
		if (html == null) {
			return false;
		}
		context.getContainer().appendChild(new HtmlInline(html));
		return true;
	}
}

package org.javai.commonmark;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.commonmark.environment.DocumentProcessor;
import org.javai.commonmark.environment.Environment;
import org.javai.commonmark.inline.InlineParserEngine;
import org.javai.commonmark.node.Document;
import org.javai.commonmark.node.Paragraph;
import org.javai.commonmark.reference.ReferenceMap;

/**
 * Turns Markdown text into a {@link Document}.
 *
 * Block structure is limited to paragraphs separated by blank lines. Each
 * paragraph's text goes through the {@link InlineParserEngine}; the
 * environment's document processors run once all paragraphs are parsed.
 *
 * Example usage:
 *
 * <pre>
 * MarkdownParser parser = new MarkdownParser(Environment.createCommonMarkEnvironment());
 * Document document = parser.parse("Hello *world*");
 * String html = new HtmlRenderer(environment).render(document);
 * </pre>
 */
public class MarkdownParser {

	private final Environment environment;
	private final InlineParserEngine inlineParser;

	public MarkdownParser(Environment environment) {
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
		this.inlineParser = new InlineParserEngine(environment);
	}

	public Document parse(String markdown) {
		return parse(markdown, new ReferenceMap());
	}

	/**
	 * @param markdown the text to parse
	 * @param referenceMap link reference definitions, collected by the caller
	 */
	public Document parse(String markdown, ReferenceMap referenceMap) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		Objects.requireNonNull(referenceMap, "referenceMap must not be null");

		Document document = new Document();
		for (String content : splitParagraphs(normalize(markdown))) {
			Paragraph paragraph = new Paragraph();
			document.appendChild(paragraph);
			inlineParser.parse(content, paragraph, referenceMap);
		}

		for (DocumentProcessor processor : environment.getDocumentProcessors()) {
			processor.process(document);
		}
		return document;
	}

	private static String normalize(String markdown) {
		return markdown
			.replace("\r\n", "\n")
			.replace('\r', '\n')
			.replace('\0', '\uFFFD');
	}

	/**
	 * Paragraph contents: leading spaces and tabs of every line removed,
	 * trailing whitespace of the paragraph removed.
	 */
	static List<String> splitParagraphs(String text) {
		List<String> paragraphs = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		for (String line : text.split("\n", -1)) {
			if (line.isBlank()) {
				flush(current, paragraphs);
				continue;
			}
			if (current.length() > 0) {
				current.append('\n');
			}
			current.append(stripLeading(line));
		}
		flush(current, paragraphs);
		return paragraphs;
	}

	private static void flush(StringBuilder current, List<String> paragraphs) {
		if (current.length() == 0) {
			return;
		}
		int end = current.length();
		while (end > 0 && (current.charAt(end - 1) == ' ' || current.charAt(end - 1) == '\t')) {
			end--;
		}
		paragraphs.add(current.substring(0, end));
		current.setLength(0);
	}

	private static String stripLeading(String line) {
		int start = 0;
		while (start < line.length() && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
			start++;
		}
		return line.substring(start);
	}
}

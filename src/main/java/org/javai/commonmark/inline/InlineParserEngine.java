package org.javai.commonmark.inline;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.delimiter.DelimiterProcessor;
import org.javai.commonmark.delimiter.Flanking;
import org.javai.commonmark.environment.Environment;
import org.javai.commonmark.node.AdjacentTextMerger;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.Text;
import org.javai.commonmark.reference.ReferenceMap;

/**
 * Parses the text of one block into inline nodes.
 *
 * Characters are consumed from left to right. At a trigger character the
 * registered parsers are tried in order. If none of them claims the
 * character and it has a delimiter processor, the run is pushed onto the
 * delimiter stack. Anything left over becomes literal text. Once the whole
 * text is consumed, the remaining delimiters are paired and adjacent text is
 * merged.
 *
 * Example usage:
 *
 * <pre>
 * InlineParserEngine engine = new InlineParserEngine(environment);
 * Paragraph paragraph = new Paragraph();
 * engine.parse("some *inline* [text](/url)", paragraph, references);
 * </pre>
 *
 * An engine holds no per-call state and may be reused.
 */
public class InlineParserEngine {

	private final Environment environment;
	private final Set<Character> specialCharacters;

	public InlineParserEngine(Environment environment) {
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
		this.specialCharacters = environment.getSpecialCharacters();
	}

	/**
	 * Parses {@code content} and appends the resulting inline nodes to {@code block}.
	 *
	 * @param content the raw text of the block
	 * @param block the node to fill
	 * @param referenceMap the references link labels are resolved against
	 */
	public void parse(String content, Node block, ReferenceMap referenceMap) {
		Cursor cursor = new Cursor(content);
		InlineParserContext context = new InlineParserContext(block, cursor, referenceMap,
			environment.getDelimiterProcessors());

		while (!cursor.isAtEnd()) {
			char character = cursor.getCharacter();
			if (!parseCharacter(character, context)) {
				addPlainText(context);
			}
		}

		context.getDelimiterStack().processDelimiters(null, environment.getDelimiterProcessors());
		AdjacentTextMerger.mergeRecursively(block);
	}

	private boolean parseCharacter(char character, InlineParserContext context) {
		List<InlineParser> parsers = environment.getInlineParsersForCharacter(character);
		for (InlineParser parser : parsers) {
			CursorState before = context.getCursor().saveState();
			if (parser.parse(context)) {
				return true;
			}
			// A parser that declines must not leave the cursor moved.
			context.getCursor().restoreState(before);
		}

		DelimiterProcessor processor = environment.getDelimiterProcessors().getDelimiterProcessor(character);
		return processor != null && parseDelimiters(processor, character, context);
	}

	private boolean parseDelimiters(DelimiterProcessor processor, char delimiterChar, InlineParserContext context) {
		Cursor cursor = context.getCursor();
		int start = cursor.getPosition();
		char charBefore = cursor.peek(-1);

		int runLength = 0;
		while (cursor.peek(runLength) == delimiterChar) {
			runLength++;
		}
		if (runLength < processor.getMinLength() || runLength > processor.getMaxLength()) {
			return false;
		}

		cursor.advanceBy(runLength);
		char charAfter = cursor.getCharacter();

		Flanking flanking = Flanking.of(charBefore, charAfter);
		boolean canOpen = flanking.canOpenEmphasis(delimiterChar);
		boolean canClose = flanking.canCloseEmphasis(delimiterChar);

		Text node = new Text(cursor.getSubstring(start, runLength));
		context.getContainer().appendChild(node);

		if (canOpen || canClose) {
			context.getDelimiterStack().push(new Delimiter(delimiterChar, runLength, node, canOpen, canClose));
		}
		return true;
	}

	private void addPlainText(InlineParserContext context) {
		Cursor cursor = context.getCursor();
		int start = cursor.getPosition();
		char first = cursor.getCharacter();
		cursor.advance();
		if (environment.getDelimiterProcessors().getDelimiterProcessor(first) != null) {
			// Keep a rejected run together so its characters are not retried one by one.
			while (cursor.getCharacter() == first) {
				cursor.advance();
			}
		}
		while (!cursor.isAtEnd() && !specialCharacters.contains(cursor.getCharacter())) {
			cursor.advance();
		}
		context.getContainer().appendChild(new Text(cursor.getSubstring(start, cursor.getPosition() - start)));
	}
}

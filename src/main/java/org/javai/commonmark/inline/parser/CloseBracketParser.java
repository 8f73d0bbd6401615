package org.javai.commonmark.inline.parser;

import java.util.Optional;
import java.util.Set;
import org.javai.commonmark.delimiter.Delimiter;
import org.javai.commonmark.delimiter.DelimiterStack;
import org.javai.commonmark.inline.Cursor;
import org.javai.commonmark.inline.CursorState;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.node.AdjacentTextMerger;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.node.Image;
import org.javai.commonmark.node.Link;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.node.NodeWalker;
import org.javai.commonmark.reference.Reference;
import org.javai.commonmark.util.Characters;
import org.javai.commonmark.util.LinkParserHelper;

/**
 * Resolves {@code ]} against the nearest {@code [} or {@code ![} opener.
 *
 * The text after the bracket is tried as an inline destination
 * {@code (dest "title")} first and as a full, collapsed or shortcut reference
 * second. On success everything after the opener becomes the link text (or the
 * image description), emphasis inside it is resolved, and for links every
 * earlier {@code [} opener is deactivated. On failure the opener is dropped
 * and the cursor is left where it was, so the bracket reads as literal text.
 */
public class CloseBracketParser implements InlineParser {

	private record LinkTarget(String destination, String title) {
	}

	@Override
	public Set<Character> getCharacters() {
		return Set.of(']');
	}

	@Override
	public boolean parse(InlineParserContext context) {
		DelimiterStack stack = context.getDelimiterStack();
		Delimiter opener = stack.searchByCharacter('[', '!');
		if (opener == null) {
			return false;
		}
		if (!opener.isActive()) {
			stack.removeDelimiter(opener);
			return false;
		}

		Cursor cursor = context.getCursor();
		int bracketPosition = cursor.getPosition();
		CursorState beforeBracket = cursor.saveState();
		cursor.advance();

		LinkTarget target = tryInlineLink(cursor);
		if (target == null) {
			target = tryReference(cursor, context, opener, bracketPosition);
		}
		if (target == null) {
			stack.removeDelimiter(opener);
			cursor.restoreState(beforeBracket);
			return false;
		}

		boolean isImage = opener.getCharacter() == '!';
		Node inline = isImage
			? new Image(target.destination(), "", target.title())
			: new Link(target.destination(), target.title());

		opener.getNode().replaceWith(inline);
		adoptFollowingSiblings(inline, isImage);

		Delimiter stackBottom = opener.getPrevious();
		stack.processDelimiters(stackBottom, context.getDelimiterProcessors());
		stack.removeAll(stackBottom);
		AdjacentTextMerger.mergeChildNodes(inline);

		if (isImage) {
			flattenDescription((Image) inline);
		} else {
			// Links cannot contain links.
			stack.removeEarlierMatches('[');
		}
		return true;
	}

	private static LinkTarget tryInlineLink(Cursor cursor) {
		if (cursor.getCharacter() != '(') {
			return null;
		}
		CursorState start = cursor.saveState();

		cursor.advance();
		cursor.advanceToNextNonSpaceOrNewline();
		String destination = LinkParserHelper.parseLinkDestination(cursor);
		if (destination == null) {
			cursor.restoreState(start);
			return null;
		}

		cursor.advanceToNextNonSpaceOrNewline();
		String title = null;
		// A title must be separated from the destination.
		if (Characters.isWhitespace(cursor.peek(-1))) {
			title = LinkParserHelper.parseLinkTitle(cursor);
		}
		cursor.advanceToNextNonSpaceOrNewline();

		if (cursor.getCharacter() != ')') {
			cursor.restoreState(start);
			return null;
		}
		cursor.advance();
		return new LinkTarget(destination, title != null ? title : "");
	}

	private static LinkTarget tryReference(Cursor cursor, InlineParserContext context, Delimiter opener,
			int bracketPosition) {
		if (!opener.hasIndex()) {
			return null;
		}

		CursorState afterBracket = cursor.saveState();
		int beforeLabel = cursor.getPosition();
		int labelLength = LinkParserHelper.parseLinkLabel(cursor);

		String label;
		if (labelLength == 0 || labelLength == 2) {
			// Shortcut or collapsed: the bracketed text itself is the label.
			label = cursor.getSubstring(opener.getIndex(), bracketPosition - opener.getIndex());
		} else {
			label = cursor.getSubstring(beforeLabel + 1, labelLength - 2);
		}
		if (labelLength == 0) {
			cursor.restoreState(afterBracket);
		}

		Optional<Reference> reference = context.getReferenceMap().getReference(label);
		return reference
			.map(found -> new LinkTarget(found.destination(), found.title()))
			.orElse(null);
	}

	private static void adoptFollowingSiblings(Node inline, boolean isImage) {
		Node node = inline.getNext();
		while (node != null) {
			Node next = node.getNext();
			Node content = node;
			if (node instanceof CustomNode custom) {
				content = custom.toLinkContent();
				if (content != node) {
					node.replaceWith(content);
				}
			}
			if (!isImage && content instanceof Link nested) {
				// An autolink inside link text keeps only its text.
				for (Node child : nested.children()) {
					inline.appendChild(child);
				}
				nested.unlink();
			} else {
				inline.appendChild(content);
			}
			node = next;
		}
	}

	private static void flattenDescription(Image image) {
		StringBuilder label = new StringBuilder();
		for (Node child : image.children()) {
			label.append(NodeWalker.textContent(child));
		}
		image.removeChildren();
		image.setLabel(label.toString());
	}
}

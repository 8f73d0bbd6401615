package org.javai.commonmark.node;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeTest {

	private Paragraph parent;
	private Text a;
	private Text b;
	private Text c;

	@BeforeEach
	void setUp() {
		parent = new Paragraph();
		a = new Text("a");
		b = new Text("b");
		c = new Text("c");
		parent.appendChild(a);
		parent.appendChild(b);
		parent.appendChild(c);
	}

	private static void assertConsistent(Node parent) {
		Node previous = null;
		for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
			assertThat(child.getParent()).isSameAs(parent);
			assertThat(child.getPrevious()).isSameAs(previous);
			previous = child;
		}
		assertThat(parent.getLastChild()).isSameAs(previous);
	}

	@Nested
	@DisplayName("Structure")
	class Structure {

		@Test
		void appendKeepsOrder() {
			assertThat(parent.children()).containsExactly(a, b, c);
			assertConsistent(parent);
		}

		@Test
		void unlinkFromTheMiddle() {
			b.unlink();

			assertThat(parent.children()).containsExactly(a, c);
			assertThat(b.getParent()).isNull();
			assertThat(b.getNext()).isNull();
			assertThat(b.getPrevious()).isNull();
			assertConsistent(parent);
		}

		@Test
		void unlinkFirstAndLast() {
			a.unlink();
			c.unlink();

			assertThat(parent.getFirstChild()).isSameAs(b);
			assertThat(parent.getLastChild()).isSameAs(b);
			assertConsistent(parent);
		}

		@Test
		void insertBeforeAndAfterMoveANodeBetweenParents() {
			Paragraph other = new Paragraph();
			Text x = new Text("x");
			other.appendChild(x);

			c.insertBefore(x);
			Text y = new Text("y");
			c.insertAfter(y);

			assertThat(parent.children()).containsExactly(a, b, x, c, y);
			assertThat(other.hasChildren()).isFalse();
			assertConsistent(parent);
		}

		@Test
		void prependChild() {
			Text z = new Text("z");
			parent.prependChild(z);

			assertThat(parent.children()).containsExactly(z, a, b, c);
			assertConsistent(parent);
		}

		@Test
		void replaceWithKeepsChildrenOnTheOldNode() {
			Emphasis emphasis = new Emphasis("*");
			Text inner = new Text("inner");
			emphasis.appendChild(inner);
			Link link = new Link("/u", null);

			b.replaceWith(emphasis);
			emphasis.replaceWith(link);

			assertThat(parent.children()).containsExactly(a, link, c);
			assertThat(emphasis.children()).containsExactly(inner);
			assertConsistent(parent);
		}

		@Test
		void removeChildrenDetachesAll() {
			parent.removeChildren();

			assertThat(parent.hasChildren()).isFalse();
			assertThat(a.getParent()).isNull();
			assertThat(c.getPrevious()).isNull();
		}
	}

	@Nested
	@DisplayName("Walking")
	class Walking {

		@Test
		void preAndPostOrder() {
			Emphasis emphasis = new Emphasis("_");
			b.replaceWith(emphasis);
			emphasis.appendChild(b);
			List<String> pre = new ArrayList<>();
			List<String> post = new ArrayList<>();

			NodeWalker.walkPreOrder(parent, n -> pre.add(n.kind()));
			NodeWalker.walkPostOrder(parent, n -> post.add(n.kind()));

			assertThat(pre).containsExactly("paragraph", "text", "emph", "text", "text");
			assertThat(post).containsExactly("text", "text", "emph", "text", "paragraph");
		}

		@Test
		void walkerToleratesUnlinkingTheVisitedNode() {
			List<Node> visited = new ArrayList<>();

			NodeWalker.walkPreOrder(parent, n -> {
				visited.add(n);
				if (n == b) {
					n.unlink();
				}
			});

			assertThat(visited).containsExactly(parent, a, b, c);
			assertThat(parent.children()).containsExactly(a, c);
		}

		@Test
		void textContentReadsThroughMarkup() {
			Paragraph p = new Paragraph();
			Emphasis emphasis = new Emphasis("*");
			emphasis.appendChild(new Text("em"));
			p.appendChild(new Text("a "));
			p.appendChild(emphasis);
			p.appendChild(new SoftLineBreak());
			p.appendChild(new Code("x"));
			p.appendChild(new Image("/i", "pic", null));

			assertThat(NodeWalker.textContent(p)).isEqualTo("a em\nxpic");
		}
	}

	@Test
	void mergerJoinsOnlyAdjacentText() {
		Paragraph p = new Paragraph();
		p.appendChild(new Text("a"));
		p.appendChild(new Text("b"));
		p.appendChild(new Code("c"));
		p.appendChild(new Text("d"));
		p.appendChild(new Text("e"));

		AdjacentTextMerger.mergeChildNodes(p);

		assertThat(p.children()).hasSize(3);
		assertThat(((Text) p.getFirstChild()).getLiteral()).isEqualTo("ab");
		assertThat(((Text) p.getLastChild()).getLiteral()).isEqualTo("de");
	}

	@Test
	void visitorDescendsByDefault() {
		Emphasis emphasis = new Emphasis("*");
		emphasis.appendChild(new Text("x"));
		parent.appendChild(emphasis);
		StringBuilder seen = new StringBuilder();

		parent.accept(new AbstractVisitor() {
			@Override
			public void visit(Text text) {
				seen.append(text.getLiteral());
			}
		});

		assertThat(seen).hasToString("abcx");
	}
}

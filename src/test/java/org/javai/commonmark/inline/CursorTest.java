package org.javai.commonmark.inline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CursorTest {

	@Nested
	@DisplayName("Reading")
	class Reading {

		@Test
		void peekOutsideTheTextAnswersEnd() {
			Cursor cursor = new Cursor("ab");

			assertThat(cursor.peek(-1)).isEqualTo(Cursor.END);
			assertThat(cursor.peek(0)).isEqualTo('a');
			assertThat(cursor.peek(1)).isEqualTo('b');
			assertThat(cursor.peek(2)).isEqualTo(Cursor.END);
			assertThat(cursor.peek(100)).isEqualTo(Cursor.END);
		}

		@Test
		void advanceByStopsAtTheEnd() {
			Cursor cursor = new Cursor("abc");

			cursor.advanceBy(10);

			assertThat(cursor.getPosition()).isEqualTo(3);
			assertThat(cursor.isAtEnd()).isTrue();
			assertThat(cursor.getCharacter()).isEqualTo(Cursor.END);
		}

		@Test
		void substringIsClampedToTheText() {
			Cursor cursor = new Cursor("hello");

			assertThat(cursor.getSubstring(1, 3)).isEqualTo("ell");
			assertThat(cursor.getSubstring(3, 10)).isEqualTo("lo");
			assertThat(cursor.getSubstring(-2, 2)).isEqualTo("he");
		}
	}

	@Nested
	@DisplayName("Whitespace skipping")
	class WhitespaceSkipping {

		@Test
		void crossesAtMostOneLineEnding() {
			Cursor cursor = new Cursor("  \t\n  \nx");

			int skipped = cursor.advanceToNextNonSpaceOrNewline();

			assertThat(skipped).isEqualTo(6);
			assertThat(cursor.getCharacter()).isEqualTo('\n');
		}

		@Test
		void spacesAndTabsOnly() {
			Cursor cursor = new Cursor(" \t \nx");

			cursor.advanceToNextNonSpaceOrTab();

			assertThat(cursor.getCharacter()).isEqualTo('\n');
		}
	}

	@Nested
	@DisplayName("Pattern matching")
	class PatternMatching {

		private final Pattern word = Pattern.compile("[a-z]+");

		@Test
		void matchIsAnchoredAtThePosition() {
			Cursor cursor = new Cursor("12abc");

			assertThat(cursor.match(word)).isNull();
			assertThat(cursor.getPosition()).isZero();

			cursor.advanceBy(2);
			assertThat(cursor.match(word)).isEqualTo("abc");
			assertThat(cursor.isAtEnd()).isTrue();
		}

		@Test
		void lookbehindSeesTextBeforeThePosition() {
			Cursor cursor = new Cursor("x@y");
			cursor.advanceBy(1);

			assertThat(cursor.match(Pattern.compile("(?<=x)@"))).isEqualTo("@");
		}

		@Test
		void noMatchAtTheEnd() {
			Cursor cursor = new Cursor("abc");
			cursor.advanceBy(3);

			assertThat(cursor.match(Pattern.compile("x*"))).isNull();
		}
	}

	@Test
	void restoringStateUndoesEveryAdvance() {
		Cursor cursor = new Cursor("[foo](bar)");
		cursor.advanceBy(2);
		CursorState saved = cursor.saveState();

		cursor.advanceBy(5);
		cursor.advanceToNextNonSpaceOrNewline();
		cursor.match(Pattern.compile(".*"));
		cursor.restoreState(saved);

		assertThat(cursor.getPosition()).isEqualTo(2);
		assertThat(cursor.getRemainder()).isEqualTo("oo](bar)");
		assertThat(cursor.startsWith("oo]")).isTrue();
	}
}

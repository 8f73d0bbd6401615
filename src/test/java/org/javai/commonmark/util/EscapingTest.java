package org.javai.commonmark.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EscapingTest {

	@Test
	void decodesNumericEntities() {
		assertThat(Escaping.decodeEntity("&#65;")).isEqualTo("A");
		assertThat(Escaping.decodeEntity("&#X41;")).isEqualTo("A");
		assertThat(Escaping.decodeEntity("&#x1F600;")).isEqualTo(new String(Character.toChars(0x1F600)));
	}

	@Test
	void outOfRangeCodePointIsReplaced() {
		assertThat(Escaping.decodeEntity("&#1114112;")).isEqualTo("\uFFFD");
	}

	@Test
	void unknownNamedEntityComesBackUnchanged() {
		assertThat(Escaping.decodeEntity("&nosuch;")).isEqualTo("&nosuch;");
		assertThat(Escaping.decodeEntity("&auml;")).isEqualTo("ä");
	}

	@Test
	void unescapeLeavesNonPunctuationEscapesAlone() {
		assertThat(Escaping.unescapeString("\\*a\\b &lt;")).isEqualTo("*a\\b <");
	}

	@Test
	void escapesHtmlSignificantCharacters() {
		assertThat(Escaping.escapeHtml("a & <b> \"c\" 'd'")).isEqualTo("a &amp; &lt;b&gt; &quot;c&quot; 'd'");
		String untouched = "nothing to do";
		assertThat(Escaping.escapeHtml(untouched)).isSameAs(untouched);
	}

	@Test
	void classifiesCharacters() {
		assertThat(Characters.isPunctuation('!')).isTrue();
		assertThat(Characters.isPunctuation('«')).isTrue();
		assertThat(Characters.isPunctuation('a')).isFalse();
		assertThat(Characters.isWhitespace(' ')).isTrue();
		assertThat(Characters.isWordCharacter('_')).isTrue();
		assertThat(Characters.isWordCharacter('-')).isFalse();
	}
}

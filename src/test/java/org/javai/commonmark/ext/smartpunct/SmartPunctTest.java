package org.javai.commonmark.ext.smartpunct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.javai.commonmark.MarkdownParser;
import org.javai.commonmark.config.InvalidConfigurationException;
import org.javai.commonmark.environment.CommonMarkCoreExtension;
import org.javai.commonmark.environment.Environment;
import org.javai.commonmark.environment.EnvironmentBuilder;
import org.javai.commonmark.render.HtmlRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SmartPunctTest {

	private static EnvironmentBuilder builder() {
		return Environment.builder()
			.extension(new CommonMarkCoreExtension())
			.extension(new SmartPunctExtension());
	}

	private static String render(Environment environment, String markdown) {
		return new HtmlRenderer(environment).render(new MarkdownParser(environment).parse(markdown));
	}

	private final Environment environment = builder().build();

	@Nested
	@DisplayName("Quotes")
	class Quotes {

		@Test
		void doubleQuotesPair() {
			assertThat(render(environment, "\"Hello\" there")).isEqualTo("<p>“Hello” there</p>\n");
		}

		@Test
		void singleQuotesPair() {
			assertThat(render(environment, "'Hi'")).isEqualTo("<p>‘Hi’</p>\n");
		}

		@Test
		void apostrophe() {
			assertThat(render(environment, "don't")).isEqualTo("<p>don’t</p>\n");
		}

		@Test
		void unpairedDoubleQuoteOpens() {
			assertThat(render(environment, "\"Hi")).isEqualTo("<p>“Hi</p>\n");
		}

		@Test
		void quotesInsideEmphasis() {
			assertThat(render(environment, "*\"a\"*")).isEqualTo("<p><em>“a”</em></p>\n");
		}

		@Test
		void customGlyphs() {
			Environment custom = builder()
				.mergeConfig(Map.of("smartpunct", Map.of(
					"double_quote_opener", "«",
					"double_quote_closer", "»")))
				.build();

			assertThat(render(custom, "\"Bonjour\" 'toi'")).isEqualTo("<p>«Bonjour» ‘toi’</p>\n");
		}
	}

	@Nested
	@DisplayName("Ellipses and dashes")
	class EllipsesAndDashes {

		@Test
		void ellipsis() {
			assertThat(render(environment, "Wait... what. . . ok.")).isEqualTo("<p>Wait… what… ok.</p>\n");
		}

		@Test
		void enDashBetweenWords() {
			assertThat(render(environment, "pages 10--12")).isEqualTo("<p>pages 10–12</p>\n");
		}

		@Test
		void singleHyphenIsKept() {
			assertThat(render(environment, "well-known")).isEqualTo("<p>well-known</p>\n");
		}

		@ParameterizedTest
		@CsvSource({
			"2, –",
			"3, —",
			"4, ––",
			"5, —–",
			"6, ——",
			"7, —––",
			"8, ––––",
			"10, –––––",
		})
		void dashRuns(int run, String expected) {
			assertThat(PunctuationParser.dashes(run)).isEqualTo(expected);
		}
	}

	@Test
	void unknownOptionIsRejected() {
		EnvironmentBuilder builder = builder().mergeConfig(Map.of("smartpunct", Map.of("ellipsis", "...")));

		assertThatThrownBy(builder::build)
			.isInstanceOfSatisfying(InvalidConfigurationException.class,
				e -> assertThat(e.key()).isEqualTo("smartpunct.ellipsis"));
	}

	@Test
	void glyphMustBeAString() {
		EnvironmentBuilder builder = builder().mergeConfig(Map.of("smartpunct", Map.of("double_quote_opener", 1)));

		assertThatThrownBy(builder::build)
			.isInstanceOfSatisfying(InvalidConfigurationException.class,
				e -> assertThat(e.key()).isEqualTo("smartpunct.double_quote_opener"));
	}
}

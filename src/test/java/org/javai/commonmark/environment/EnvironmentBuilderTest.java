package org.javai.commonmark.environment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.Level;
import org.javai.commonmark.config.InvalidConfigurationException;
import org.javai.commonmark.delimiter.EmphasisDelimiterProcessor;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.inline.InlineParserContext;
import org.javai.commonmark.inline.parser.BackslashParser;
import org.javai.commonmark.node.CustomNode;
import org.javai.commonmark.render.NodeRenderer;
import org.javai.commonmark.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnvironmentBuilderTest {

	private static InlineParser parserFor(char c) {
		return new InlineParser() {
			@Override
			public Set<Character> getCharacters() {
				return Set.of(c);
			}

			@Override
			public boolean parse(InlineParserContext context) {
				return false;
			}
		};
	}

	@Nested
	@DisplayName("Registration")
	class Registration {

		@Test
		void higherPriorityParsersComeFirst() {
			InlineParser low = parserFor('\\');
			InlineParser high = parserFor('\\');

			Environment environment = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.extension((builder, config) -> builder.addInlineParser(low, -5).addInlineParser(high, 100))
				.build();

			List<InlineParser> parsers = environment.getInlineParsersForCharacter('\\');
			assertThat(parsers).hasSize(3);
			assertThat(parsers.get(0)).isSameAs(high);
			assertThat(parsers.get(1)).isInstanceOf(BackslashParser.class);
			assertThat(parsers.get(2)).isSameAs(low);
		}

		@Test
		void equalPrioritiesKeepRegistrationOrder() {
			InlineParser first = parserFor('%');
			InlineParser second = parserFor('%');

			Environment environment = Environment.builder()
				.extension((builder, config) -> builder.addInlineParser(first).addInlineParser(second))
				.build();

			assertThat(environment.getInlineParsersForCharacter('%')).containsExactly(first, second);
		}

		@Test
		void specialCharactersCoverParsersAndDelimiters() {
			Environment environment = Environment.createCommonMarkEnvironment();

			assertThat(environment.getSpecialCharacters())
				.contains('\n', '\\', '`', '&', '<', '[', ']', '!', '*', '_')
				.doesNotContain('a', '~');
		}

		@Test
		void duplicateDelimiterCharacterIsAProgrammingError() {
			EnvironmentBuilder builder = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.extension((b, config) -> b.addDelimiterProcessor(new EmphasisDelimiterProcessor('*')));

			assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void failedRegistrationCannotBeRetried() {
			int[] registrations = {0};
			EnvironmentBuilder builder = Environment.builder()
				.extension((b, config) -> registrations[0]++)
				.extension(new CommonMarkCoreExtension())
				.extension((b, config) -> b.addDelimiterProcessor(new EmphasisDelimiterProcessor('_')));

			assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
			assertThat(registrations[0]).isEqualTo(1);
		}

		@Test
		void invalidConfigurationCanBeCorrectedBeforeBuilding() {
			EnvironmentBuilder builder = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.mergeConfig(Map.of("commonmark", Map.of("enable_em", "no")));
			assertThatThrownBy(builder::build).isInstanceOf(InvalidConfigurationException.class);

			Environment environment = builder.mergeConfig(Map.of("commonmark", Map.of("enable_em", false))).build();

			assertThat(environment.getInlineParsersForCharacter('\\')).hasSize(1);
			assertThat(environment.getDelimiterProcessors().size()).isEqualTo(2);
		}

		@Test
		void buildingTwiceIsRejected() {
			EnvironmentBuilder builder = Environment.builder().extension(new CommonMarkCoreExtension());
			builder.build();

			assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> builder.mergeConfig(Map.of())).isInstanceOf(IllegalStateException.class);
		}
	}

	@Nested
	@DisplayName("Configuration")
	class Configuration {

		@Test
		void mergeConfigIsDeep() {
			Environment environment = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.mergeConfig(Map.of("commonmark", Map.of("enable_em", false)))
				.mergeConfig(Map.of("commonmark", Map.of("use_underscore", false)))
				.build();

			CommonMarkOptions options = environment.getConfiguration()
				.get(CommonMarkOptions.SECTION, CommonMarkOptions.class).orElseThrow();
			assertThat(options.enableEm()).isFalse();
			assertThat(options.useUnderscore()).isFalse();
			assertThat(options.enableStrong()).isTrue();
			assertThat(environment.getDelimiterProcessors().getDelimiterProcessor('_')).isNull();
		}

		@Test
		void invalidOptionsFailAtBuild() {
			EnvironmentBuilder builder = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.mergeConfig(Map.of("commonmark", Map.of("enable_em", "yes")));

			assertThatThrownBy(builder::build)
				.isInstanceOfSatisfying(InvalidConfigurationException.class,
					e -> assertThat(e.key()).isEqualTo("commonmark.enable_em"));
		}

		@Test
		void sectionOfAnUnregisteredExtensionIsUnknown() {
			EnvironmentBuilder builder = Environment.builder()
				.extension(new CommonMarkCoreExtension())
				.mergeConfig(Map.of("mentions", Map.of()));

			assertThatThrownBy(builder::build)
				.isInstanceOfSatisfying(InvalidConfigurationException.class,
					e -> assertThat(e.key()).isEqualTo("mentions"));
		}
	}

	@Nested
	@DisplayName("Logging")
	class Logging {

		private static class Widget extends CustomNode {
			@Override
			public String kind() {
				return "widget";
			}
		}

		@Test
		void replacingARendererIsWarnedAbout() {
			NodeRenderer first = (node, context) -> context.raw("1");
			NodeRenderer second = (node, context) -> context.raw("2");

			try (LogCaptorAppender logs = LogCaptorAppender.capture(EnvironmentBuilder.class)) {
				Environment environment = Environment.builder()
					.extension((builder, config) -> builder
						.addNodeRenderer(Widget.class, first)
						.addNodeRenderer(Widget.class, second))
					.build();

				assertThat(environment.getNodeRenderer(Widget.class)).isSameAs(second);
				assertThat(logs.messages(Level.WARN)).anyMatch(msg -> msg.contains("Widget"));
			}
		}

		@Test
		void buildIsLoggedAtDebug() {
			try (LogCaptorAppender logs = LogCaptorAppender.capture(EnvironmentBuilder.class)) {
				Environment.createCommonMarkEnvironment();

				assertThat(logs.messages(Level.DEBUG))
					.anyMatch(msg -> msg.contains("CommonMarkCoreExtension"))
					.anyMatch(msg -> msg.startsWith("Environment built"));
			}
		}
	}
}

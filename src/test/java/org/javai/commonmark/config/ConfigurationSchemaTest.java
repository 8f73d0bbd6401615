package org.javai.commonmark.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigurationSchemaTest {

	private final ConfigurationSchema schema = new ConfigurationSchema()
		.section("greeting", (path, value) -> Options.stringOption(path,
			Options.asMap(path, value), "text", "hello"));

	@Test
	void absentSectionsAreValidatedWithDefaults() {
		MarkdownConfiguration configuration = schema.validate(Map.of());

		assertThat(configuration.get("greeting", String.class)).hasValue("hello");
	}

	@Test
	void presentSectionIsValidated() {
		MarkdownConfiguration configuration = schema.validate(Map.of("greeting", Map.of("text", "hi")));

		assertThat(configuration.get("greeting", String.class)).hasValue("hi");
		assertThat(configuration.exists("greeting")).isTrue();
	}

	@Test
	void unknownSectionIsRejected() {
		assertThatThrownBy(() -> schema.validate(Map.of("bogus", Map.of())))
			.isInstanceOf(InvalidConfigurationException.class)
			.hasMessageContaining("'bogus'");
	}

	@Test
	void wrongValueTypeNamesTheOption() {
		assertThatThrownBy(() -> schema.validate(Map.of("greeting", Map.of("text", 42))))
			.isInstanceOfSatisfying(InvalidConfigurationException.class,
				e -> assertThat(e.key()).isEqualTo("greeting.text"));
	}

	@Test
	void sectionMustBeAMap() {
		assertThatThrownBy(() -> schema.validate(Map.of("greeting", "hi")))
			.isInstanceOfSatisfying(InvalidConfigurationException.class,
				e -> assertThat(e.key()).isEqualTo("greeting"));
	}

	@Test
	void sectionsCannotBeDeclaredTwice() {
		assertThatThrownBy(() -> schema.section("greeting", (path, value) -> value))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void lookupWithTheWrongTypeFails() {
		MarkdownConfiguration configuration = schema.validate(Map.of());

		assertThatThrownBy(() -> configuration.get("greeting", Integer.class))
			.isInstanceOf(IllegalStateException.class);
		assertThat(MarkdownConfiguration.empty().get("greeting", String.class)).isEmpty();
	}
}

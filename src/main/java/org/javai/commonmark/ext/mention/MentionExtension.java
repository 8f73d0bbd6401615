package org.javai.commonmark.ext.mention;

import java.util.List;
import java.util.Map;
import org.javai.commonmark.config.ConfigurationSchema;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.environment.EnvironmentBuilder;
import org.javai.commonmark.environment.Extension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mentions such as {@code @user} or {@code #123}, one parser per entry of the
 * {@code mentions} configuration section. Without configuration nothing is registered.
 */
public class MentionExtension implements Extension {

	private static final Logger logger = LoggerFactory.getLogger(MentionExtension.class);

	@Override
	public void configureSchema(ConfigurationSchema schema) {
		schema.section(MentionOptions.SECTION, MentionOptions::validate);
	}

	@Override
	public void register(EnvironmentBuilder environment, MarkdownConfiguration configuration) {
		MentionOptions options = configuration.get(MentionOptions.SECTION, MentionOptions.class)
			.orElseGet(() -> new MentionOptions(List.of()));

		for (MentionDefinition definition : options.definitions()) {
			logger.debug("Registering mention parser '{}' for prefix '{}'", definition.name(), definition.prefix());
			environment.addInlineParser(new MentionParser(definition));
		}

		environment.addNodeRenderer(Mention.class, (node, context) -> {
			Mention mention = (Mention) node;
			if (mention.hasUrl()) {
				context.tag("a", Map.of("href", mention.getUrl()), false);
				context.renderChildren(mention);
				context.closeTag("a");
			} else {
				context.renderChildren(mention);
			}
		});
	}
}

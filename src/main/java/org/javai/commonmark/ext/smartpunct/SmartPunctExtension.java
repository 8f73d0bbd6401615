package org.javai.commonmark.ext.smartpunct;

import org.javai.commonmark.config.ConfigurationSchema;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.environment.EnvironmentBuilder;
import org.javai.commonmark.environment.Extension;

/**
 * Typographic punctuation: curly quotes, ellipses, en and em dashes.
 */
public class SmartPunctExtension implements Extension {

	@Override
	public void configureSchema(ConfigurationSchema schema) {
		schema.section(SmartPunctOptions.SECTION, SmartPunctOptions::validate);
	}

	@Override
	public void register(EnvironmentBuilder environment, MarkdownConfiguration configuration) {
		SmartPunctOptions options = configuration.get(SmartPunctOptions.SECTION, SmartPunctOptions.class)
			.orElseGet(SmartPunctOptions::defaults);

		environment
			.addInlineParser(new QuoteParser(), 10)
			.addInlineParser(new PunctuationParser(), 10)
			.addDelimiterProcessor(new QuoteProcessor('"', options))
			.addDelimiterProcessor(new QuoteProcessor('\'', options))
			.addDocumentProcessor(new UnpairedQuoteReplacer(options))
			.addNodeRenderer(Quote.class, (node, context) -> context.text(((Quote) node).getLiteral()));
	}
}

package org.javai.commonmark.environment;

import org.javai.commonmark.config.ConfigurationSchema;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.delimiter.EmphasisDelimiterProcessor;
import org.javai.commonmark.inline.parser.AutolinkParser;
import org.javai.commonmark.inline.parser.BacktickParser;
import org.javai.commonmark.inline.parser.BackslashParser;
import org.javai.commonmark.inline.parser.BangParser;
import org.javai.commonmark.inline.parser.CloseBracketParser;
import org.javai.commonmark.inline.parser.EntityParser;
import org.javai.commonmark.inline.parser.HtmlInlineParser;
import org.javai.commonmark.inline.parser.NewlineParser;
import org.javai.commonmark.inline.parser.OpenBracketParser;

/**
 * The CommonMark inline syntax: line breaks, escapes, code spans, entities,
 * autolinks, raw HTML, links, images and emphasis.
 */
public class CommonMarkCoreExtension implements Extension {

	@Override
	public void configureSchema(ConfigurationSchema schema) {
		schema.section(CommonMarkOptions.SECTION, CommonMarkOptions::validate);
	}

	@Override
	public void register(EnvironmentBuilder environment, MarkdownConfiguration configuration) {
		CommonMarkOptions options = configuration.get(CommonMarkOptions.SECTION, CommonMarkOptions.class)
			.orElseGet(CommonMarkOptions::defaults);

		environment
			.addInlineParser(new NewlineParser())
			.addInlineParser(new BackslashParser())
			.addInlineParser(new BacktickParser())
			.addInlineParser(new EntityParser())
			.addInlineParser(new AutolinkParser())
			.addInlineParser(new HtmlInlineParser())
			.addInlineParser(new CloseBracketParser())
			.addInlineParser(new OpenBracketParser())
			.addInlineParser(new BangParser());

		if (options.useAsterisk()) {
			environment.addDelimiterProcessor(
				new EmphasisDelimiterProcessor('*', options.enableEm(), options.enableStrong()));
		}
		if (options.useUnderscore()) {
			environment.addDelimiterProcessor(
				new EmphasisDelimiterProcessor('_', options.enableEm(), options.enableStrong()));
		}
	}
}

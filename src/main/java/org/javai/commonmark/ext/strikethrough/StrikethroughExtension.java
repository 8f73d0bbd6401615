package org.javai.commonmark.ext.strikethrough;

import java.util.Map;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.environment.EnvironmentBuilder;
import org.javai.commonmark.environment.Extension;

/**
 * {@code ~text~} and {@code ~~text~~}, rendered as {@code <del>}.
 */
public class StrikethroughExtension implements Extension {

	@Override
	public void register(EnvironmentBuilder environment, MarkdownConfiguration configuration) {
		environment
			.addDelimiterProcessor(new StrikethroughDelimiterProcessor())
			.addNodeRenderer(Strikethrough.class, (node, context) -> {
				context.tag("del", Map.of(), false);
				context.renderChildren(node);
				context.closeTag("del");
			});
	}
}

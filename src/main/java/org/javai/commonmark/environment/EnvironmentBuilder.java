package org.javai.commonmark.environment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.commonmark.config.ConfigurationSchema;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.delimiter.DelimiterProcessor;
import org.javai.commonmark.delimiter.DelimiterProcessorCollection;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.render.NodeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects extensions and configuration and builds an immutable {@link Environment}.
 *
 * Example usage:
 *
 * <pre>
 * Environment environment = Environment.builder()
 *     .extension(new CommonMarkCoreExtension())
 *     .extension(new MentionExtension())
 *     .mergeConfig(Map.of("mentions", Map.of("github_handle", Map.of(
 *         "prefix", "@",
 *         "pattern", "[a-z\\d](?:[a-z\\d]|-(?=[a-z\\d])){0,38}(?!\\w)",
 *         "generator", "https://github.com/%s"))))
 *     .build();
 * </pre>
 *
 * Configuration is validated in {@link #build()}, so malformed options fail
 * before any document is parsed.
 */
public final class EnvironmentBuilder {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentBuilder.class);

	/**
	 * Priority of the built-in CommonMark parsers. Extension parsers registered
	 * with a higher priority are tried first for the same character.
	 */
	public static final int DEFAULT_PRIORITY = 0;

	private final List<Extension> extensions = new ArrayList<>();
	private final Map<String, Object> rawConfig = new LinkedHashMap<>();

	private final List<PrioritizedParser> inlineParsers = new ArrayList<>();
	private final List<DelimiterProcessor> delimiterProcessors = new ArrayList<>();
	private final List<DocumentProcessor> documentProcessors = new ArrayList<>();
	private final Map<Class<? extends Node>, NodeRenderer> nodeRenderers = new LinkedHashMap<>();

	private boolean built;

	EnvironmentBuilder() {
	}

	public EnvironmentBuilder extension(Extension extension) {
		Objects.requireNonNull(extension, "extension must not be null");
		checkNotBuilt();
		extensions.add(extension);
		return this;
	}

	/**
	 * Deep-merges options into the configuration gathered so far. Nested maps are
	 * merged key by key; any other value replaces what was there.
	 */
	public EnvironmentBuilder mergeConfig(Map<String, ?> options) {
		Objects.requireNonNull(options, "options must not be null");
		checkNotBuilt();
		deepMerge(rawConfig, options);
		return this;
	}

	public EnvironmentBuilder addInlineParser(InlineParser parser) {
		return addInlineParser(parser, DEFAULT_PRIORITY);
	}

	public EnvironmentBuilder addInlineParser(InlineParser parser, int priority) {
		Objects.requireNonNull(parser, "parser must not be null");
		inlineParsers.add(new PrioritizedParser(parser, priority, inlineParsers.size()));
		return this;
	}

	public EnvironmentBuilder addDelimiterProcessor(DelimiterProcessor processor) {
		Objects.requireNonNull(processor, "processor must not be null");
		delimiterProcessors.add(processor);
		return this;
	}

	public EnvironmentBuilder addDocumentProcessor(DocumentProcessor processor) {
		Objects.requireNonNull(processor, "processor must not be null");
		documentProcessors.add(processor);
		return this;
	}

	public EnvironmentBuilder addNodeRenderer(Class<? extends Node> nodeType, NodeRenderer renderer) {
		Objects.requireNonNull(nodeType, "nodeType must not be null");
		Objects.requireNonNull(renderer, "renderer must not be null");
		if (nodeRenderers.put(nodeType, renderer) != null) {
			logger.warn("Renderer for {} replaced by a later registration", nodeType.getSimpleName());
		}
		return this;
	}

	/**
	 * Validates the configuration, lets every extension register itself and
	 * freezes the result.
	 *
	 * @throws org.javai.commonmark.config.InvalidConfigurationException if the configuration is malformed
	 * @throws IllegalArgumentException if two delimiter processors claim the same character
	 * @throws IllegalStateException if the builder has been built, or a previous build failed during registration
	 */
	public Environment build() {
		checkNotBuilt();

		ConfigurationSchema schema = new ConfigurationSchema();
		for (Extension extension : extensions) {
			extension.configureSchema(schema);
		}
		MarkdownConfiguration configuration = schema.validate(rawConfig);

		// Registration appends to this builder, so a failure past this point cannot be retried.
		built = true;
		for (Extension extension : extensions) {
			logger.debug("Registering extension {}", extension.getClass().getSimpleName());
			extension.register(this, configuration);
		}

		DelimiterProcessorCollection processors = new DelimiterProcessorCollection();
		delimiterProcessors.forEach(processors::add);

		Map<Character, List<InlineParser>> parsersByCharacter = new LinkedHashMap<>();
		inlineParsers.stream()
			.sorted(Comparator.comparingInt(PrioritizedParser::priority).reversed()
				.thenComparingInt(PrioritizedParser::order))
			.forEach(p -> {
				for (Character c : p.parser().getCharacters()) {
					parsersByCharacter.computeIfAbsent(c, k -> new ArrayList<>()).add(p.parser());
				}
			});

		logger.debug("Environment built with {} extension(s), {} inline parser(s), {} delimiter character(s)",
			extensions.size(), inlineParsers.size(), processors.size());

		return new Environment(configuration, parsersByCharacter, processors,
			List.copyOf(documentProcessors), nodeRenderers);
	}

	private void checkNotBuilt() {
		if (built) {
			throw new IllegalStateException("Environment has already been built");
		}
	}

	@SuppressWarnings("unchecked")
	private static void deepMerge(Map<String, Object> target, Map<String, ?> source) {
		for (Map.Entry<String, ?> entry : source.entrySet()) {
			Object incoming = entry.getValue();
			Object existing = target.get(entry.getKey());
			if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
				Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existingMap);
				deepMerge(merged, (Map<String, ?>) incomingMap);
				target.put(entry.getKey(), merged);
			} else {
				target.put(entry.getKey(), incoming);
			}
		}
	}

	private record PrioritizedParser(InlineParser parser, int priority, int order) {
	}
}

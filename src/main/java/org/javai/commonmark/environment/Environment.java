package org.javai.commonmark.environment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.commonmark.config.MarkdownConfiguration;
import org.javai.commonmark.delimiter.DelimiterProcessorCollection;
import org.javai.commonmark.inline.InlineParser;
import org.javai.commonmark.node.Node;
import org.javai.commonmark.render.NodeRenderer;

/**
 * Everything the parser and renderer need to know about enabled syntax: inline
 * parsers by trigger character, delimiter processors, document processors,
 * renderers for extension nodes and the validated configuration.
 *
 * Immutable once built, so one environment can serve any number of parses.
 */
public final class Environment {

	private final MarkdownConfiguration configuration;
	private final Map<Character, List<InlineParser>> inlineParsers;
	private final DelimiterProcessorCollection delimiterProcessors;
	private final List<DocumentProcessor> documentProcessors;
	private final Map<Class<? extends Node>, NodeRenderer> nodeRenderers;
	private final Set<Character> specialCharacters;

	Environment(MarkdownConfiguration configuration,
			Map<Character, List<InlineParser>> inlineParsers,
			DelimiterProcessorCollection delimiterProcessors,
			List<DocumentProcessor> documentProcessors,
			Map<Class<? extends Node>, NodeRenderer> nodeRenderers) {
		this.configuration = configuration;
		Map<Character, List<InlineParser>> parsers = new LinkedHashMap<>();
		inlineParsers.forEach((c, list) -> parsers.put(c, List.copyOf(list)));
		this.inlineParsers = Collections.unmodifiableMap(parsers);
		this.delimiterProcessors = delimiterProcessors;
		this.documentProcessors = documentProcessors;
		this.nodeRenderers = Collections.unmodifiableMap(new LinkedHashMap<>(nodeRenderers));

		Set<Character> special = new LinkedHashSet<>(inlineParsers.keySet());
		special.addAll(delimiterProcessors.getDelimiterCharacters());
		this.specialCharacters = Collections.unmodifiableSet(special);
	}

	public static EnvironmentBuilder builder() {
		return new EnvironmentBuilder();
	}

	/**
	 * Environment with only the CommonMark core syntax enabled.
	 */
	public static Environment createCommonMarkEnvironment() {
		return builder().extension(new CommonMarkCoreExtension()).build();
	}

	public MarkdownConfiguration getConfiguration() {
		return configuration;
	}

	/**
	 * Parsers for {@code character}, in the order they should be tried.
	 */
	public List<InlineParser> getInlineParsersForCharacter(char character) {
		return inlineParsers.getOrDefault(character, List.of());
	}

	public DelimiterProcessorCollection getDelimiterProcessors() {
		return delimiterProcessors;
	}

	public List<DocumentProcessor> getDocumentProcessors() {
		return documentProcessors;
	}

	/**
	 * Renderer for an extension node, looked up by the node's exact class and then its superclasses.
	 */
	public NodeRenderer getNodeRenderer(Class<? extends Node> nodeType) {
		for (Class<?> type = nodeType; type != null && Node.class.isAssignableFrom(type); type = type.getSuperclass()) {
			NodeRenderer renderer = nodeRenderers.get(type);
			if (renderer != null) {
				return renderer;
			}
		}
		return null;
	}

	/**
	 * Characters at which plain-text scanning stops because some parser or processor may claim them.
	 */
	public Set<Character> getSpecialCharacters() {
		return specialCharacters;
	}
}

package org.javai.commonmark.ext.mention;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.commonmark.config.InvalidConfigurationException;
import org.javai.commonmark.config.Options;

/**
 * The validated {@code mentions} section: one definition per configured name, in configuration order.
 *
 * A {@code generator} is a URL template string, a {@link MentionGenerator}, or a
 * {@code Function<Mention, Node>}. A function with any other parameter type fails
 * when it is first called.
 */
public record MentionOptions(List<MentionDefinition> definitions) {

	public static final String SECTION = "mentions";

	private static final Set<String> KEYS = Set.of("prefix", "pattern", "generator");

	private static final Pattern DELIMITED_REGEX = Pattern.compile("^/.*/[a-zA-Z]*$", Pattern.DOTALL);

	public MentionOptions {
		definitions = List.copyOf(definitions);
	}

	static MentionOptions validate(String path, Object value) {
		Map<String, Object> section = Options.asMap(path, value);
		List<MentionDefinition> definitions = new ArrayList<>();
		for (Map.Entry<String, Object> entry : section.entrySet()) {
			definitions.add(validateEntry(path + "." + entry.getKey(), entry.getKey(), entry.getValue()));
		}
		return new MentionOptions(definitions);
	}

	private static MentionDefinition validateEntry(String path, String name, Object value) {
		Map<String, Object> options = Options.asMap(path, value);
		if (options.containsKey("symbol")) {
			throw new InvalidConfigurationException(path + ".symbol", "option is no longer supported, use 'prefix' instead");
		}
		Options.rejectUnknownKeys(path, options, KEYS);

		String prefix = Options.requiredString(path, options, "prefix");
		Pattern pattern = compilePattern(path + ".pattern", Options.requiredString(path, options, "pattern"));
		MentionGenerator generator = resolveGenerator(path + ".generator", options.get("generator"));
		return new MentionDefinition(name, prefix, pattern, generator);
	}

	private static Pattern compilePattern(String path, String regex) {
		if (DELIMITED_REGEX.matcher(regex).matches()) {
			throw new InvalidConfigurationException(path,
				"expected a bare regex without delimiters or flags, got " + regex);
		}
		try {
			return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
		} catch (PatternSyntaxException e) {
			throw new InvalidConfigurationException(path, "invalid regex: " + e.getDescription(), e);
		}
	}

	private static MentionGenerator resolveGenerator(String path, Object generator) {
		if (generator == null) {
			throw new InvalidConfigurationException(path, "option is required");
		}
		if (generator instanceof String template) {
			return new StringTemplateLinkGenerator(template);
		}
		if (generator instanceof MentionGenerator mentionGenerator) {
			return mentionGenerator;
		}
		if (generator instanceof Function<?, ?> callback) {
			return new CallbackGenerator(callback);
		}
		throw new InvalidConfigurationException(path,
			"expected a URL template, a Function or a MentionGenerator, got " + Options.typeName(generator));
	}
}

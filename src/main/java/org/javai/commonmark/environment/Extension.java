package org.javai.commonmark.environment;

import org.javai.commonmark.config.ConfigurationSchema;
import org.javai.commonmark.config.MarkdownConfiguration;

/**
 * A bundle of parsers, delimiter processors, document processors and renderers,
 * together with the configuration section that controls them.
 */
public interface Extension {

	/**
	 * Declares the configuration sections this extension reads. Called before
	 * configuration is validated.
	 */
	default void configureSchema(ConfigurationSchema schema) {
	}

	/**
	 * Adds this extension's parts to the environment being built.
	 *
	 * @param environment the builder to register with
	 * @param configuration the validated configuration
	 */
	void register(EnvironmentBuilder environment, MarkdownConfiguration configuration);
}

package org.javai.commonmark.config;

/**
 * Exception thrown when configuration fails validation.
 *
 * Validation happens when the environment is built, before any document is
 * parsed. {@link #key()} names the offending option as a dotted path, for
 * example {@code mentions.github_handle.generator}.
 */
public class InvalidConfigurationException extends RuntimeException {

	private final String key;

	public InvalidConfigurationException(String key, String message) {
		super(key != null ? "Invalid option '" + key + "': " + message : message);
		this.key = key;
	}

	public InvalidConfigurationException(String key, String message, Throwable cause) {
		super(key != null ? "Invalid option '" + key + "': " + message : message, cause);
		this.key = key;
	}

	/**
	 * Dotted path of the offending option, or {@code null} if the document as a whole is invalid.
	 */
	public String key() {
		return key;
	}
}

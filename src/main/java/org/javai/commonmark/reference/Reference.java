package org.javai.commonmark.reference;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A link reference definition: destination and title, looked up by label.
 *
 * @param label the label as written
 * @param destination the link destination
 * @param title the link title, empty when there is none
 */
public record Reference(String label, String destination, String title) {

	private static final Pattern WHITESPACE = Pattern.compile("[ \t\r\n\f\u000B]+");

	public Reference {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(destination, "destination must not be null");
		title = title != null ? title : "";
	}

	/**
	 * Key under which this reference is stored.
	 */
	public String normalizedLabel() {
		return normalizeLabel(label);
	}

	/**
	 * Normalizes a label for matching: trims, collapses internal whitespace to a single
	 * space and folds case.
	 */
	public static String normalizeLabel(String label) {
		String collapsed = WHITESPACE.matcher(label.strip()).replaceAll(" ");
		return collapsed.toLowerCase(Locale.ROOT).toUpperCase(Locale.ROOT);
	}
}

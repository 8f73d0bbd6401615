package org.javai.commonmark.delimiter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Registered delimiter processors, keyed by both their opening and closing character.
 */
public final class DelimiterProcessorCollection {

	private final Map<Character, DelimiterProcessor> processors = new LinkedHashMap<>();

	/**
	 * @throws IllegalArgumentException if a processor for one of the characters is already registered
	 */
	public void add(DelimiterProcessor processor) {
		Objects.requireNonNull(processor, "processor must not be null");
		char opening = processor.getOpeningCharacter();
		char closing = processor.getClosingCharacter();
		register(opening, processor);
		if (closing != opening) {
			register(closing, processor);
		}
	}

	private void register(char character, DelimiterProcessor processor) {
		if (processors.containsKey(character)) {
			throw new IllegalArgumentException(
				"Delimiter processor for character '" + character + "' is already registered");
		}
		processors.put(character, processor);
	}

	public DelimiterProcessor getDelimiterProcessor(char character) {
		return processors.get(character);
	}

	public Set<Character> getDelimiterCharacters() {
		return Collections.unmodifiableSet(processors.keySet());
	}

	public int size() {
		return processors.size();
	}
}

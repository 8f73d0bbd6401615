package org.javai.commonmark.reference;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Label to {@link Reference} lookup.
 *
 * The map is populated before inline parsing starts and is only read while a
 * document is being parsed. When two references normalize to the same label
 * the first one wins.
 */
public final class ReferenceMap {

	private final Map<String, Reference> references = new LinkedHashMap<>();

	public static ReferenceMap of(Reference... references) {
		ReferenceMap map = new ReferenceMap();
		for (Reference reference : references) {
			map.add(reference);
		}
		return map;
	}

	public void add(Reference reference) {
		Objects.requireNonNull(reference, "reference must not be null");
		references.putIfAbsent(reference.normalizedLabel(), reference);
	}

	public boolean contains(String label) {
		return references.containsKey(Reference.normalizeLabel(label));
	}

	/**
	 * Looks up a reference by label. The label is normalized first.
	 */
	public Optional<Reference> getReference(String label) {
		if (label == null) {
			return Optional.empty();
		}
		String normalized = Reference.normalizeLabel(label);
		if (normalized.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(references.get(normalized));
	}

	public int size() {
		return references.size();
	}
}

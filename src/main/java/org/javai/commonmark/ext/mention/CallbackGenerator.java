package org.javai.commonmark.ext.mention;

import java.util.Objects;
import java.util.function.Function;
import org.javai.commonmark.node.Node;

/**
 * Adapts a plain {@link Function} given in configuration to a {@link MentionGenerator}.
 * The function receives the {@link Mention}; its parameter type cannot be checked
 * until it is called.
 */
public class CallbackGenerator implements MentionGenerator {

	private final Function<Object, ?> callback;

	@SuppressWarnings("unchecked")
	public CallbackGenerator(Function<?, ?> callback) {
		this.callback = (Function<Object, ?>) Objects.requireNonNull(callback, "callback must not be null");
	}

	/**
	 * @throws IllegalStateException if the callback does not accept a {@link Mention}, or returns
	 *         something other than a {@link Node} or {@code null}
	 */
	@Override
	public Node generateMention(Mention mention) {
		Object result;
		try {
			result = callback.apply(mention);
		} catch (ClassCastException e) {
			throw new IllegalStateException("Mention callback must accept a " + Mention.class.getName()
				+ " and return a Node or null", e);
		}
		if (result == null) {
			return null;
		}
		if (!(result instanceof Node node)) {
			throw new IllegalStateException("Mention callback must return a Node or null, got "
				+ result.getClass().getName());
		}
		return node;
	}
}

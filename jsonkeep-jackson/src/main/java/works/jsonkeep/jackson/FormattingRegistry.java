package works.jsonkeep.jackson;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonkeep.FormattingDescriptor;
import works.jsonkeep.util.WeakIdentityMap;

import static java.util.Objects.requireNonNull;

/**
 * Remembers the {@link FormattingDescriptor} of each decoded JSON object or array
 * without touching the node itself.
 * <p>
 * Entries are keyed by node identity, so structurally equal nodes decoded from
 * the same text are tracked independently, and editing a node doesn't lose its entry.
 * Entries are held weakly: a node that is otherwise unreachable is collected along with its descriptor.
 * <p>
 * There is one registry per process: {@link #INSTANCE}.
 */
public final class FormattingRegistry {
	public static final FormattingRegistry INSTANCE = new FormattingRegistry();

	private final WeakIdentityMap<JsonNode, FormattingDescriptor> descriptors = new WeakIdentityMap<>();

	private FormattingRegistry() {
	}

	/**
	 * Records <code>descriptor</code> for <code>value</code>, replacing any existing one.
	 *
	 * @throws IllegalArgumentException if <code>value</code> is not an object or array node
	 */
	public void associate(JsonNode value, FormattingDescriptor descriptor) {
		requireNonNull(descriptor);
		if (!isTrackable(value)) {
			throw new IllegalArgumentException("Only object and array nodes can be tracked; got "
				+ (value == null ? "null" : value.getNodeType()));
		}
		descriptors.put(value, descriptor);
	}

	public Optional<FormattingDescriptor> lookup(@Nullable Object value) {
		return Optional.ofNullable(descriptors.get(value));
	}

	public boolean isTracked(@Nullable Object value) {
		return descriptors.containsKey(value);
	}

	/**
	 * @return the number of live entries; mainly of interest to tests
	 */
	int size() {
		return descriptors.size();
	}

	static boolean isTrackable(@Nullable Object value) {
		return value instanceof JsonNode node && (node.isObject() || node.isArray());
	}
}

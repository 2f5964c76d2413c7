package works.jsonkeep.jackson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.MissingNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;
import works.jsonkeep.FormattingDescriptor;
import works.jsonkeep.FormattingDetector;
import works.jsonkeep.exceptions.JsonSyntaxException;
import works.jsonkeep.exceptions.MissingLocationException;

import static java.util.Objects.requireNonNull;

/**
 * Decodes and encodes JSON while keeping the formatting of the original text.
 * <p>
 * {@link #decode} remembers the indentation, line endings, and final newline of the text
 * it was given, and {@link #encode} writes the resulting value the same way,
 * even after it has been edited. This lets you change a JSON file programmatically
 * without reformatting all of it.
 * <pre>
 * JsonNode manifest = JsonKeep.read(Path.of("package.json"));
 * ((ObjectNode) manifest).put("version", "2.0.0");
 * JsonKeep.write(manifest);
 * </pre>
 * Only the formatting of the root object or array is remembered, and it is associated with
 * that node's identity: a copy of the node, or a node built from scratch, encodes like
 * Jackson would encode it by default.
 * The association is invisible to everyone else, and doesn't keep the node from being
 * garbage collected.
 *
 * @see FormattingDetector
 * @see FormattingRegistry
 */
public final class JsonKeep {
	private static final FormattingRegistry REGISTRY = FormattingRegistry.INSTANCE;
	private static final AtomicBoolean IS_MANAGED_WARNING_LOGGED = new AtomicBoolean(false);

	private JsonKeep() {
	}

	public static JsonNode decode(String text) {
		return decode(text, null, JsonKeepSettings.defaults());
	}

	public static JsonNode decode(String text, @Nullable Reviver reviver) {
		return decode(text, reviver, JsonKeepSettings.defaults());
	}

	/**
	 * Parses <code>text</code> and, if the result is an object or array,
	 * remembers how <code>text</code> was formatted.
	 * <p>
	 * Scalars are returned as is, untracked.
	 * If <code>reviver</code> is given, it's the node it returns for the root that gets tracked.
	 * If it returns null for the root, the result is {@link MissingNode}.
	 *
	 * @throws JsonSyntaxException if <code>text</code> is not a single valid JSON value
	 */
	public static JsonNode decode(String text, @Nullable Reviver reviver, JsonKeepSettings settings) {
		requireNonNull(text);
		JsonNode parsed;
		try {
			parsed = settings.mapper().readTree(text);
		} catch (JacksonException e) {
			throw new JsonSyntaxException("Invalid JSON text", e);
		}
		if (parsed == null || parsed.isMissingNode()) {
			throw new JsonSyntaxException("No JSON value in input text");
		}

		JsonNode result;
		if (reviver == null) {
			result = parsed;
		} else {
			JsonNode revived = revive("", parsed, reviver);
			result = (revived == null) ? MissingNode.getInstance() : revived;
		}

		if (FormattingRegistry.isTrackable(result)) {
			FormattingDescriptor descriptor = FormattingDetector.detect(text);
			REGISTRY.associate(result, descriptor);
			LOGGER.debug("Decoded {} with {}", result.getNodeType(), descriptor);
		}
		return result;
	}

	public static String encode(@Nullable Object value) {
		return encode(value, null, null, JsonKeepSettings.defaults());
	}

	public static String encode(@Nullable Object value, @Nullable Replacer replacer) {
		return encode(value, replacer, null, JsonKeepSettings.defaults());
	}

	/**
	 * Like {@link #encode(Object, Replacer, String)} with an indentation of
	 * <code>spaces</code> spaces, at most 10. Less than 1 means no indentation.
	 */
	public static String encode(@Nullable Object value, @Nullable Replacer replacer, int spaces) {
		return encodeWithIndent(value, replacer, Indentation.ofSpaces(spaces), JsonKeepSettings.defaults());
	}

	public static String encode(@Nullable Object value, @Nullable Replacer replacer, @Nullable String space) {
		return encode(value, replacer, space, JsonKeepSettings.defaults());
	}

	/**
	 * Encodes <code>value</code> using the formatting remembered for it, if any.
	 * <p>
	 * A non-null <code>space</code> replaces the remembered indentation
	 * (only its first 10 characters are used, and the empty string means no indentation),
	 * but line endings and the final newline are still those of the original text.
	 * <p>
	 * Values that aren't {@link JsonNode}s are converted with the settings' mapper first.
	 *
	 * @throws IllegalArgumentException if <code>replacer</code> omits the root value
	 */
	public static String encode(@Nullable Object value, @Nullable Replacer replacer, @Nullable String space, JsonKeepSettings settings) {
		String indent = (space == null)
			? Indentation.of(descriptorOf(value).flatMap(FormattingDescriptor::indent).orElse(null))
			: Indentation.of(space);
		return encodeWithIndent(value, replacer, indent, settings);
	}

	private static String encodeWithIndent(@Nullable Object value, @Nullable Replacer replacer, @Nullable String indent, JsonKeepSettings settings) {
		FormattingDescriptor descriptor = descriptorOf(value).orElse(FormattingDescriptor.DEFAULTS);
		JsonMapper mapper = settings.mapper();
		JsonNode tree = toTree(value, mapper);
		if (replacer != null) {
			tree = replace("", tree, replacer);
			if (tree == null) {
				throw new IllegalArgumentException("Replacer omitted the root value");
			}
		}

		String text;
		if (indent == null) {
			text = mapper.writeValueAsString(tree);
		} else {
			text = mapper.writer()
				.with(new IndentingPrettyPrinter(indent))
				.writeValueAsString(tree);
		}
		if (descriptor.hasTrailingNewline()) {
			text += "\n";
		}
		if (descriptor.useCrlf()) {
			text = text.replace("\n", "\r\n");
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Encoded {} chars with indent {} using {}", text.length(), indent == null ? "none" : "\"" + indent + "\"", descriptor);
		}
		return text;
	}

	public static JsonNode read(Path path) throws IOException {
		return read(path, JsonKeepSettings.defaults());
	}

	/**
	 * Decodes the contents of the file at <code>path</code> and,
	 * if the result is tracked, remembers the file's absolute path
	 * so that {@link #write(Object)} can write it back.
	 *
	 * @throws JsonSyntaxException if the file doesn't contain a single valid JSON value
	 */
	public static JsonNode read(Path path, JsonKeepSettings settings) throws IOException {
		Path resolved = path.toAbsolutePath().normalize();
		String text = Files.readString(resolved, settings.charset());
		LOGGER.debug("Read {} chars from {}", text.length(), resolved);
		JsonNode result = decode(text, null, settings);
		REGISTRY.lookup(result).ifPresent(descriptor ->
			REGISTRY.associate(result, descriptor.withSourcePath(resolved)));
		return result;
	}

	/**
	 * Writes <code>value</code> back to the file it was {@link #read} from.
	 *
	 * @throws MissingLocationException if <code>value</code> was not read from a file
	 */
	public static void write(Object value) throws IOException {
		write(value, null, JsonKeepSettings.defaults());
	}

	public static void write(Object value, @Nullable Path path) throws IOException {
		write(value, path, JsonKeepSettings.defaults());
	}

	/**
	 * Encodes <code>value</code> into the file at <code>path</code>, or, if that's null,
	 * the file it was {@link #read} from.
	 * The path remembered for <code>value</code> is not changed.
	 *
	 * @throws MissingLocationException if <code>path</code> is null and
	 * <code>value</code> was not read from a file
	 */
	public static void write(Object value, @Nullable Path path, JsonKeepSettings settings) throws IOException {
		Path target = (path != null)
			? path
			: descriptorOf(value).flatMap(FormattingDescriptor::source).orElseThrow(MissingLocationException::new);
		String text = encode(value, null, null, settings);
		Files.writeString(target, text, settings.charset());
		LOGGER.debug("Wrote {} chars to {}", text.length(), target);
	}

	public static boolean isTracked(@Nullable Object value) {
		return REGISTRY.isTracked(value);
	}

	/**
	 * @deprecated Use {@link #isTracked} instead.
	 */
	@Deprecated
	public static boolean isManaged(@Nullable Object value) {
		if (IS_MANAGED_WARNING_LOGGED.compareAndSet(false, true)) {
			LOGGER.warn("JsonKeep.isManaged() is deprecated; please use JsonKeep.isTracked() instead");
		}
		return isTracked(value);
	}

	/**
	 * @return the formatting remembered for <code>value</code>, if it is tracked
	 */
	public static Optional<FormattingDescriptor> descriptorOf(@Nullable Object value) {
		return REGISTRY.lookup(value);
	}

	private static JsonNode toTree(@Nullable Object value, JsonMapper mapper) {
		if (value == null) {
			return NullNode.getInstance();
		} else if (value instanceof JsonNode node) {
			return node;
		} else {
			JsonNode tree = mapper.valueToTree(value);
			return (tree == null) ? NullNode.getInstance() : tree;
		}
	}

	/**
	 * Children first, in place.
	 */
	private static @Nullable JsonNode revive(String key, JsonNode value, Reviver reviver) {
		if (value instanceof ObjectNode object) {
			List<Map.Entry<String, JsonNode>> members = new ArrayList<>(object.properties());
			for (Map.Entry<String, JsonNode> member : members) {
				JsonNode revived = revive(member.getKey(), member.getValue(), reviver);
				if (revived == null) {
					object.remove(member.getKey());
				} else {
					object.set(member.getKey(), revived);
				}
			}
		} else if (value instanceof ArrayNode array) {
			for (int i = 0; i < array.size(); i++) {
				JsonNode revived = revive(Integer.toString(i), array.get(i), reviver);
				array.set(i, (revived == null) ? NullNode.getInstance() : revived);
			}
		}
		return reviver.revive(key, value);
	}

	/**
	 * Container first, into a new tree.
	 */
	private static @Nullable JsonNode replace(String key, JsonNode value, Replacer replacer) {
		JsonNode replaced = replacer.replace(key, value);
		if (replaced instanceof ObjectNode object) {
			ObjectNode result = JsonNodeFactory.instance.objectNode();
			for (Map.Entry<String, JsonNode> member : object.properties()) {
				JsonNode child = replace(member.getKey(), member.getValue(), replacer);
				if (child != null) {
					result.set(member.getKey(), child);
				}
			}
			return result;
		} else if (replaced instanceof ArrayNode array) {
			ArrayNode result = JsonNodeFactory.instance.arrayNode(array.size());
			for (int i = 0; i < array.size(); i++) {
				JsonNode child = replace(Integer.toString(i), array.get(i), replacer);
				result.add((child == null) ? NullNode.getInstance() : child);
			}
			return result;
		} else {
			return replaced;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonKeep.class);
}

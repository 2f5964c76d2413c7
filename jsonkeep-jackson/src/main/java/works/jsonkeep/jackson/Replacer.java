package works.jsonkeep.jackson;

import tools.jackson.databind.JsonNode;

/**
 * Transforms each value of a document as it is encoded,
 * outermost values first, starting with the root.
 * The children visited are those of the value returned for their container.
 *
 * @see JsonKeep#encode(Object, Replacer)
 */
@FunctionalInterface
public interface Replacer {
	/**
	 * @param key the member name, the array index in decimal, or the empty string for the root
	 * @param value the value about to be encoded
	 * @return the value to encode instead, or null to omit it
	 * (an array element is written as JSON null instead)
	 */
	JsonNode replace(String key, JsonNode value);
}

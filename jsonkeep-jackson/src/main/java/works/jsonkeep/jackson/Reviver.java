package works.jsonkeep.jackson;

import tools.jackson.databind.JsonNode;

/**
 * Transforms each value of a freshly decoded document,
 * innermost values first and the root last.
 *
 * @see JsonKeep#decode(String, Reviver)
 */
@FunctionalInterface
public interface Reviver {
	/**
	 * @param key the member name, the array index in decimal, or the empty string for the root
	 * @param value the value, whose own children have already been revived
	 * @return the value to keep in its place, or null to remove it
	 * (an array element is replaced by JSON null instead, so indexes don't shift)
	 */
	JsonNode revive(String key, JsonNode value);
}

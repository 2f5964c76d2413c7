/**
 * Format-preserving JSON decoding and encoding on top of Jackson.
 * <p>
 * See {@link works.jsonkeep.jackson.JsonKeep} for the main entry point.
 */
package works.jsonkeep.jackson;

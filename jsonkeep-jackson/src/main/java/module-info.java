/**
 * Format-preserving JSON decoding and encoding using the Jackson library.
 * <p>
 * See {@link works.jsonkeep.jackson.JsonKeep} for the main entry point.
 */
module works.jsonkeep.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.jsonkeep.core;

	requires static lombok;

	exports works.jsonkeep.jackson;
}

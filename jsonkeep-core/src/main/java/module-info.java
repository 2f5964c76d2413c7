/**
 * Formatting inference for JSON text, independent of any JSON library.
 * <p>
 * Start with {@link works.jsonkeep.FormattingDetector}.
 */
module works.jsonkeep.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	exports works.jsonkeep;
	exports works.jsonkeep.exceptions;
	exports works.jsonkeep.util;
}

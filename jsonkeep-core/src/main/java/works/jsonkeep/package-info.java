/**
 * Inference of the formatting conventions of JSON text.
 * <p>
 * {@link works.jsonkeep.FormattingDetector} scans text and produces a
 * {@link works.jsonkeep.FormattingDescriptor}. Associating descriptors with
 * decoded values, and replaying them, is up to a JSON library binding
 * such as {@code works.jsonkeep.jackson}.
 */
package works.jsonkeep;

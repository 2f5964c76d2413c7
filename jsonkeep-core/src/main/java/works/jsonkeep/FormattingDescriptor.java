package works.jsonkeep;

import java.nio.file.Path;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The formatting conventions inferred from a piece of JSON text,
 * to be replayed when the value decoded from that text is encoded again.
 *
 * @param indentUnit the string representing one level of indentation,
 *                   or null if no consistent indentation was found
 * @param useCrlf true if CRLF line endings outnumber bare LF line endings
 * @param hasTrailingNewline true if the text ends with a line ending
 * @param sourcePath the absolute path the text was read from, if any
 */
public record FormattingDescriptor(
	@Nullable String indentUnit,
	boolean useCrlf,
	boolean hasTrailingNewline,
	@Nullable Path sourcePath
) {
	/**
	 * What we assume for values that were never decoded:
	 * no indentation, LF, no trailing newline.
	 */
	public static final FormattingDescriptor DEFAULTS = new FormattingDescriptor(null, false, false, null);

	public FormattingDescriptor(@Nullable String indentUnit, boolean useCrlf, boolean hasTrailingNewline) {
		this(indentUnit, useCrlf, hasTrailingNewline, null);
	}

	public Optional<String> indent() {
		return Optional.ofNullable(indentUnit);
	}

	public Optional<Path> source() {
		return Optional.ofNullable(sourcePath);
	}

	public String lineEnding() {
		return useCrlf ? "\r\n" : "\n";
	}

	public FormattingDescriptor withSourcePath(Path sourcePath) {
		return new FormattingDescriptor(indentUnit, useCrlf, hasTrailingNewline, requireNonNull(sourcePath));
	}

	@Override
	public String toString() {
		return "FormattingDescriptor("
			+ "indentUnit=" + (indentUnit == null ? "none" : "\"" + indentUnit.replace("\t", "\\t") + "\"")
			+ ", lineEnding=" + (useCrlf ? "CRLF" : "LF")
			+ ", hasTrailingNewline=" + hasTrailingNewline
			+ (sourcePath == null ? "" : ", sourcePath=" + sourcePath)
			+ ")";
	}
}

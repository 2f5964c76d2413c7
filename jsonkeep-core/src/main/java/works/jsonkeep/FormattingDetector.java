package works.jsonkeep;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Infers the indentation unit and line-ending conventions of JSON text.
 * <p>
 * The text is scanned once, line by line.
 * Line endings are tallied as CRLF or LF, and CRLF wins only with a strict majority.
 * <p>
 * For indentation, each indented line is compared with the previous indented line.
 * If the two leading runs are identical, the previous line's unit candidate gets another vote.
 * If they are made of the same character but differ in length, the difference is the candidate,
 * so that a nested structure votes for one level of indentation rather than for its full prefix.
 * Otherwise, the whole leading run is the candidate.
 * The candidate with the most votes wins, with ties going to the one seen first.
 * <p>
 * This never rejects text. The worst outcome is {@link FormattingDescriptor#DEFAULTS}.
 */
public final class FormattingDetector {
	private FormattingDetector() {
	}

	public static FormattingDescriptor detect(CharSequence text) {
		requireNonNull(text);
		Map<String, Integer> votes = new LinkedHashMap<>();
		int lfCount = 0;
		int crlfCount = 0;
		boolean hasTrailingNewline = false;
		String previousIndent = "";
		String candidate = null;

		int end = text.length() - 1;
		for (int pos = 0, nextEol; pos <= end; pos = nextEol + 1) {
			int lineEnd;
			nextEol = indexOfLinefeed(text, pos);
			if (nextEol >= 0) {
				if (nextEol > pos && text.charAt(nextEol - 1) == '\r') {
					crlfCount++;
					lineEnd = nextEol - 1;
				} else {
					lfCount++;
					lineEnd = nextEol;
				}
				if (nextEol == end) {
					hasTrailingNewline = true;
				}
			} else {
				nextEol = end;
				lineEnd = text.length();
			}

			if (lineEnd == pos) {
				// Blank lines carry no information and don't break the chain
				continue;
			}
			char first = text.charAt(pos);
			if (first != ' ' && first != '\t') {
				previousIndent = "";
				continue;
			}
			int runEnd = pos + 1;
			while (runEnd < lineEnd && text.charAt(runEnd) == first) {
				runEnd++;
			}
			if (runEnd < lineEnd && isIndentChar(text.charAt(runEnd))) {
				LOGGER.trace("Ignoring mixed indentation at offset {}", pos);
				continue;
			}

			String lineIndent = text.subSequence(pos, runEnd).toString();
			if (lineIndent.equals(previousIndent)) {
				votes.merge(candidate, 1, Integer::sum);
			} else {
				if (!previousIndent.isEmpty() && previousIndent.charAt(0) == first) {
					candidate = String.valueOf(first).repeat(Math.abs(lineIndent.length() - previousIndent.length()));
				} else {
					candidate = lineIndent;
				}
				votes.merge(candidate, 1, Integer::sum);
			}
			previousIndent = lineIndent;
		}

		String indentUnit = null;
		int max = 0;
		for (Map.Entry<String, Integer> entry : votes.entrySet()) {
			if (entry.getValue() > max) {
				max = entry.getValue();
				indentUnit = entry.getKey();
			}
		}

		FormattingDescriptor result = new FormattingDescriptor(indentUnit, crlfCount > lfCount, hasTrailingNewline);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Indent votes {}, LF={} CRLF={}: {}", votes, lfCount, crlfCount, result);
		}
		return result;
	}

	private static int indexOfLinefeed(CharSequence text, int from) {
		for (int i = from; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				return i;
			}
		}
		return -1;
	}

	private static boolean isIndentChar(char c) {
		return c == ' ' || c == '\t';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FormattingDetector.class);
}

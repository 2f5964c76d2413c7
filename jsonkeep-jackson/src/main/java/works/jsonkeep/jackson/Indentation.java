package works.jsonkeep.jackson;

import org.jetbrains.annotations.Nullable;

/**
 * Turns an indentation request into the string written for each nesting level,
 * with the same limits as JavaScript's <code>JSON.stringify</code>.
 * A null result means no indentation at all.
 */
final class Indentation {
	static final int MAX_LENGTH = 10;

	private Indentation() {
	}

	static @Nullable String ofSpaces(int count) {
		int length = Math.min(MAX_LENGTH, count);
		return length < 1 ? null : " ".repeat(length);
	}

	static @Nullable String of(@Nullable String unit) {
		if (unit == null || unit.isEmpty()) {
			return null;
		} else if (unit.length() > MAX_LENGTH) {
			return unit.substring(0, MAX_LENGTH);
		} else {
			return unit;
		}
	}
}

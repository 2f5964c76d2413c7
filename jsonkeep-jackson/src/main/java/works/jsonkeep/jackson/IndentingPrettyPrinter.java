package works.jsonkeep.jackson;

import tools.jackson.core.JsonGenerator;
import tools.jackson.core.PrettyPrinter;

/**
 * Lays out JSON the way JavaScript's <code>JSON.stringify(value, null, indent)</code> does:
 * one entry per line, <code>"name": value</code> with a single space after the colon,
 * and no whitespace at all inside empty objects and arrays.
 * <p>
 * Line endings are always LF; converting to CRLF is left to the caller.
 * <p>
 * Keeps track of nesting, so each instance must be used for one document only.
 */
final class IndentingPrettyPrinter implements PrettyPrinter {
	private final String indentUnit;
	private int nesting = 0;

	IndentingPrettyPrinter(String indentUnit) {
		if (indentUnit.isEmpty()) {
			throw new IllegalArgumentException("Indent unit must not be empty");
		}
		this.indentUnit = indentUnit;
	}

	@Override
	public void writeRootValueSeparator(JsonGenerator g) {
		// We only ever write one root value
	}

	@Override
	public void writeStartObject(JsonGenerator g) {
		g.writeRaw('{');
		++nesting;
	}

	@Override
	public void beforeObjectEntries(JsonGenerator g) {
		newline(g);
	}

	@Override
	public void writeObjectNameValueSeparator(JsonGenerator g) {
		g.writeRaw(": ");
	}

	@Override
	public void writeObjectEntrySeparator(JsonGenerator g) {
		g.writeRaw(',');
		newline(g);
	}

	@Override
	public void writeEndObject(JsonGenerator g, int nrOfEntries) {
		--nesting;
		if (nrOfEntries > 0) {
			newline(g);
		}
		g.writeRaw('}');
	}

	@Override
	public void writeStartArray(JsonGenerator g) {
		g.writeRaw('[');
		++nesting;
	}

	@Override
	public void beforeArrayValues(JsonGenerator g) {
		newline(g);
	}

	@Override
	public void writeArrayValueSeparator(JsonGenerator g) {
		g.writeRaw(',');
		newline(g);
	}

	@Override
	public void writeEndArray(JsonGenerator g, int nrOfValues) {
		--nesting;
		if (nrOfValues > 0) {
			newline(g);
		}
		g.writeRaw(']');
	}

	private void newline(JsonGenerator g) {
		g.writeRaw('\n');
		for (int i = 0; i < nesting; i++) {
			g.writeRaw(indentUnit);
		}
	}
}

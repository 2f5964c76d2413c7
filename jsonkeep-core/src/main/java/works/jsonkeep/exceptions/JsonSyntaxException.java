package works.jsonkeep.exceptions;

/**
 * The input text is not valid JSON.
 * <p>
 * The cause, when present, is the error reported by the underlying decoder.
 */
public final class JsonSyntaxException extends RuntimeException {
	public JsonSyntaxException(String message) {
		super(message);
	}

	public JsonSyntaxException(Throwable cause) {
		super(cause);
	}

	public JsonSyntaxException(String message, Throwable cause) {
		super(message, cause);
	}
}

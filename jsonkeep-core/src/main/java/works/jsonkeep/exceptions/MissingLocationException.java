package works.jsonkeep.exceptions;

/**
 * A value was to be written back to where it came from,
 * but no location was given and none had been recorded.
 */
public class MissingLocationException extends IllegalStateException {
	public MissingLocationException() {
		super("no location available");
	}

	public MissingLocationException(String message) {
		super(message);
	}
}

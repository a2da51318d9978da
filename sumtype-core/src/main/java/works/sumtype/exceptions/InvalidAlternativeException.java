package works.sumtype.exceptions;

/**
 * Indicates that a set of alternatives, or a request made against one, can never be valid:
 * a type that can't be an alternative, a by-type request for a type that isn't unique,
 * an index out of range, a value no alternative accepts, or a visitor missing a case.
 *
 * <p>
 * These are programming errors. They're reported before any stored value is touched,
 * so a variant that rejects a request this way is left exactly as it was.
 */
@SuppressWarnings("serial")
public class InvalidAlternativeException extends IllegalArgumentException {
	public InvalidAlternativeException(String message) { super(message); }
	public InvalidAlternativeException(String message, Throwable cause) { super(message, cause); }
}

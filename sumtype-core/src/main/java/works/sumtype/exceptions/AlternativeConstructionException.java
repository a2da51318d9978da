package works.sumtype.exceptions;

import java.lang.reflect.InvocationTargetException;

/**
 * Wraps an exception thrown while building the new value of a variant during an
 * assignment that switches alternatives, or during an emplacement.
 * The old value had already been destroyed, so the variant is left valueless.
 *
 * <p>
 * Basically a {@link RuntimeException} version of {@link
 * InvocationTargetException}.  {@link #getCause()} returns the original
 * exception; same as {@link InvocationTargetException#getCause()}.
 */
@SuppressWarnings("serial")
public class AlternativeConstructionException extends RuntimeException {
	public AlternativeConstructionException(String message, Throwable cause) { super(message, cause); }
}

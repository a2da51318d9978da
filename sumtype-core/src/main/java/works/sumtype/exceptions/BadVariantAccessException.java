package works.sumtype.exceptions;

import lombok.Getter;

import static works.sumtype.Variant.VALUELESS;

/**
 * Thrown when a variant's value is requested as an alternative other than
 * the one it currently holds, or when it holds no value at all.
 */
@Getter
@SuppressWarnings("serial")
public class BadVariantAccessException extends RuntimeException {
	/**
	 * The index the caller asked for, or {@link works.sumtype.Variant#VALUELESS VALUELESS} if they didn't ask for one.
	 */
	private final int requestedIndex;

	/**
	 * The variant's index at the time of the request; {@link works.sumtype.Variant#VALUELESS VALUELESS} if it held nothing.
	 */
	private final int actualIndex;

	public BadVariantAccessException(int requestedIndex, int actualIndex, String description) {
		super(message(requestedIndex, actualIndex, description));
		this.requestedIndex = requestedIndex;
		this.actualIndex = actualIndex;
	}

	private BadVariantAccessException(String message) {
		super(message);
		this.requestedIndex = VALUELESS;
		this.actualIndex = VALUELESS;
	}

	/**
	 * For operations that need a value, but don't ask for any particular alternative.
	 */
	public static BadVariantAccessException valueless(String operation) {
		return new BadVariantAccessException("Can't " + operation + " a valueless variant");
	}

	public boolean isValueless() {
		return actualIndex == VALUELESS;
	}

	private static String message(int requestedIndex, int actualIndex, String description) {
		if (actualIndex == VALUELESS) {
			return "Variant is valueless; requested alternative " + requestedIndex + " (" + description + ")";
		} else {
			return "Variant holds alternative " + actualIndex + "; requested alternative " + requestedIndex + " (" + description + ")";
		}
	}
}

package works.sumtype;

/**
 * Selects, by position, the alternative to construct in place.
 * Unlike {@link InPlaceType}, this works even if the alternative's type occurs more than once.
 *
 * @see Variant#inPlace(Alternatives, InPlaceIndex, Object...)
 */
public record InPlaceIndex(int index) {
	public static InPlaceIndex of(int index) {
		return new InPlaceIndex(index);
	}
}

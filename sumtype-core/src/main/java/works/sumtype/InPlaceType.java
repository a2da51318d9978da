package works.sumtype;

import static java.util.Objects.requireNonNull;

/**
 * Selects, by type, the alternative to construct in place.
 * The type must occur exactly once among the alternatives.
 *
 * @see Variant#inPlace(Alternatives, InPlaceType, Object...)
 */
public record InPlaceType<T>(Class<T> type) {
	public InPlaceType {
		requireNonNull(type);
	}

	public static <TT> InPlaceType<TT> of(Class<TT> type) {
		return new InPlaceType<>(type);
	}
}

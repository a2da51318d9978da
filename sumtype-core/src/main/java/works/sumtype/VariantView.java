package works.sumtype;

import java.util.Optional;
import works.sumtype.exceptions.BadVariantAccessException;
import works.sumtype.exceptions.InvalidAlternativeException;

/**
 * Read-only access to a {@link Variant}.
 *
 * <p>
 * Hand out a <code>VariantView</code> when the recipient should be able to inspect
 * a variant but not reassign it. Note that the values returned by the accessors are the
 * variant's own, not copies, so a mutable value can still be modified through them.
 *
 * <p>
 * By-type accessors require the type to occur exactly once among the {@link #alternatives()},
 * and by-index accessors require the index to be in range; otherwise they throw
 * {@link InvalidAlternativeException}.
 */
public interface VariantView {
	Alternatives alternatives();

	/**
	 * @return the position of the held alternative, or {@link Variant#VALUELESS} if there is none.
	 */
	int index();

	default boolean isValueless() {
		return index() == Variant.VALUELESS;
	}

	/**
	 * @throws BadVariantAccessException if the variant doesn't hold alternative <code>index</code>
	 */
	Object get(int index);

	/**
	 * @throws BadVariantAccessException if the variant doesn't hold the alternative of type <code>type</code>
	 */
	<T> T get(Class<T> type);

	/**
	 * Like {@link #get(int)}, with the result cast to <code>type</code>,
	 * for alternatives whose type occurs more than once.
	 */
	default <T> T get(int index, Class<T> type) {
		return type.cast(get(index));
	}

	Optional<Object> getIf(int index);

	<T> Optional<T> getIf(Class<T> type);

	default boolean holdsAlternative(Class<?> type) {
		return getIf(type).isPresent();
	}

	/**
	 * Equivalent to <code>Visitation.visit(visitor, this)</code>.
	 */
	default <R> R visit(Visitor<R> visitor) {
		return Visitation.visit(visitor, this);
	}
}

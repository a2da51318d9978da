package works.sumtype;

import java.util.List;
import java.util.function.BiPredicate;
import works.sumtype.exceptions.InvalidAlternativeException;

/**
 * Stateless queries over an ordered list of alternative types.
 *
 * <p>
 * Each predicate is called as <code>predicate.test(type, entry)</code>, where <code>type</code>
 * is the type being looked up and <code>entry</code> is one element of the list.
 */
public final class AlternativeRegistry {
	private AlternativeRegistry() {}

	public static final BiPredicate<Class<?>, Class<?>> SAME_TYPE = (type, entry) -> type.equals(entry);

	/**
	 * A value of <code>type</code> can be passed where <code>entry</code> is expected
	 * using only the language's own conversions.
	 * {@link Alternatives} extends this with each alternative's {@link works.sumtype.annotations.Implicit @Implicit} conversions.
	 */
	public static final BiPredicate<Class<?>, Class<?>> IS_CONVERTIBLE = Conversions::isConvertible;

	/**
	 * @return the index of the first occurrence of <code>type</code>, or <code>list.size()</code> if it doesn't occur.
	 */
	public static int position(Class<?> type, List<? extends Class<?>> list) {
		for (int i = 0; i < list.size(); i++) {
			if (SAME_TYPE.test(type, list.get(i))) {
				return i;
			}
		}
		return list.size();
	}

	public static int occurrenceCount(BiPredicate<? super Class<?>, ? super Class<?>> predicate, Class<?> type, List<? extends Class<?>> list) {
		int result = 0;
		for (Class<?> entry: list) {
			if (predicate.test(type, entry)) {
				++result;
			}
		}
		return result;
	}

	public static boolean isUnique(Class<?> type, List<? extends Class<?>> list) {
		return occurrenceCount(SAME_TYPE, type, list) == 1;
	}

	public static boolean isInRange(int index, int size) {
		return 0 <= index && index < size;
	}

	/**
	 * Note that this returns the first match in declaration order, even if other entries also match.
	 *
	 * @throws InvalidAlternativeException if no entry matches.
	 */
	public static int findMatchingType(BiPredicate<? super Class<?>, ? super Class<?>> predicate, Class<?> type, List<? extends Class<?>> list) {
		for (int i = 0; i < list.size(); i++) {
			if (predicate.test(type, list.get(i))) {
				return i;
			}
		}
		throw new InvalidAlternativeException("No alternative matches " + type.getSimpleName() + " among " + names(list));
	}

	/**
	 * @throws InvalidAlternativeException if no entry matches, or if more than one does.
	 */
	public static int findUniqueMatchingType(BiPredicate<? super Class<?>, ? super Class<?>> predicate, Class<?> type, List<? extends Class<?>> list) {
		int first = findMatchingType(predicate, type, list);
		for (int i = first + 1; i < list.size(); i++) {
			if (predicate.test(type, list.get(i))) {
				throw new InvalidAlternativeException("Ambiguous: " + type.getSimpleName()
					+ " matches both alternative " + first + " (" + list.get(first).getSimpleName()
					+ ") and alternative " + i + " (" + list.get(i).getSimpleName() + ")");
			}
		}
		return first;
	}

	static String names(List<? extends Class<?>> list) {
		StringBuilder sb = new StringBuilder("[");
		String separator = "";
		for (Class<?> entry: list) {
			sb.append(separator).append(entry.getSimpleName());
			separator = ", ";
		}
		return sb.append("]").toString();
	}
}

package works.sumtype.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An imperfect, non-idiomatic way to describe parameterized alternative types.
 *
 * <p>
 * Alternatives are identified by their raw class, so a variant can't tell
 * <code>List&lt;String></code> from <code>List&lt;Integer></code>.
 * These methods let callers still get a properly typed result from
 * {@link works.sumtype.VariantView#get(Class) get}: write
 * <code>v.get(list(String.class))</code> to get a <code>List&lt;String></code>.
 */
@SuppressWarnings({"unchecked","rawtypes","unused"})
public final class Classes {
	private Classes() {}

	public static <E> Class<List<E>> list(Class<E> entryClass) {
		return (Class)List.class;
	}

	public static <E> Class<ArrayList<E>> arrayList(Class<E> entryClass) {
		return (Class)ArrayList.class;
	}

	public static <E> Class<Set<E>> set(Class<E> entryClass) {
		return (Class)Set.class;
	}

	public static <K,V> Class<Map<K,V>> map(Class<K> keyClass, Class<V> valueClass) {
		return (Class)Map.class;
	}

	public static <T> Class<Optional<T>> optional(Class<T> valueClass) {
		return (Class)Optional.class;
	}
}

package works.sumtype;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.sumtype.exceptions.InvalidAlternativeException;

import static java.util.Objects.requireNonNull;

/**
 * One case per combination of alternative types, for use with {@link Visitation#visit}.
 *
 * <p>
 * Each case is keyed by the list of declared alternative types it handles, one per
 * variant being visited; so a visitor for a single variant has cases keyed by one type,
 * and a visitor for two variants has cases keyed by pairs of types.
 * Cases are matched by exact type: a case for <code>Number</code> does not
 * handle an <code>Integer</code> alternative. An {@link Builder#otherwise otherwise}
 * case, if given, handles every combination that has no case of its own.
 *
 * <pre>{@code
 * Visitor<String> describe = Visitor.<String>builder()
 *     .on(Integer.class, i -> "int " + i)
 *     .on(String.class, s -> "string " + s)
 *     .build();
 * }</pre>
 *
 * Visitors are immutable and can be shared between threads.
 */
public final class Visitor<R> {
	private final PMap<List<Class<?>>, Function<List<Object>, ? extends R>> cases;
	private final @Nullable Function<List<Object>, ? extends R> fallback;

	/**
	 * Sets of alternatives already known to be covered.
	 */
	private final Map<List<Alternatives>, Boolean> verified = new ConcurrentHashMap<>();

	private Visitor(PMap<List<Class<?>>, Function<List<Object>, ? extends R>> cases, @Nullable Function<List<Object>, ? extends R> fallback) {
		this.cases = cases;
		this.fallback = fallback;
	}

	public static <RR> Builder<RR> builder() {
		return new Builder<>();
	}

	/**
	 * Checks that this visitor has a case for every combination of alternatives
	 * that variants over the given sets could hold.
	 *
	 * @throws InvalidAlternativeException listing the missing combinations, if any
	 */
	public void checkCoverage(List<Alternatives> alternativeSets) {
		if (verified.containsKey(alternativeSets)) {
			return;
		}
		List<List<Class<?>>> missing = new ArrayList<>();
		if (fallback == null) {
			for (PVector<Class<?>> combination: combinations(alternativeSets)) {
				if (!cases.containsKey(combination)) {
					missing.add(combination);
				}
			}
		}
		if (!missing.isEmpty()) {
			throw new InvalidAlternativeException("Visitor has no case for " + missing.size()
				+ " combination" + (missing.size() >= 2 ? "s" : "") + " of " + alternativeSets + ": " + describe(missing));
		}
		LOGGER.debug("Visitor covers {}", alternativeSets);
		verified.put(TreePVector.from(alternativeSets), true);
	}

	/**
	 * Calls the case for the given combination of types.
	 */
	R dispatch(List<Class<?>> combination, List<Object> values) {
		Function<List<Object>, ? extends R> handler = cases.get(combination);
		if (handler == null) {
			handler = requireNonNull(fallback, "Coverage was already checked");
		}
		return handler.apply(values);
	}

	/**
	 * Every way of picking one type from each set, in declaration order.
	 * A type that occurs more than once in a set yields only one combination.
	 */
	static List<PVector<Class<?>>> combinations(List<Alternatives> alternativeSets) {
		List<PVector<Class<?>>> result = List.of(TreePVector.empty());
		for (Alternatives set: alternativeSets) {
			List<PVector<Class<?>>> extended = new ArrayList<>();
			for (PVector<Class<?>> prefix: result) {
				for (Class<?> type: set.types().stream().distinct().toList()) {
					extended.add(prefix.plus(type));
				}
			}
			result = extended;
		}
		return result;
	}

	private static String describe(List<List<Class<?>>> combinations) {
		List<String> result = new ArrayList<>();
		for (List<Class<?>> combination: combinations) {
			result.add(AlternativeRegistry.names(combination));
		}
		return String.join(", ", result);
	}

	public static final class Builder<R> {
		private PMap<List<Class<?>>, Function<List<Object>, ? extends R>> cases = HashTreePMap.empty();
		private @Nullable Function<List<Object>, ? extends R> fallback;

		private Builder() { }

		public <A> Builder<R> on(Class<A> type, Function<? super A, ? extends R> handler) {
			requireNonNull(handler);
			return onTuple(List.of(type), values -> handler.apply(type.cast(values.get(0))));
		}

		public <A, B> Builder<R> on(Class<A> first, Class<B> second, BiFunction<? super A, ? super B, ? extends R> handler) {
			requireNonNull(handler);
			return onTuple(List.of(first, second), values -> handler.apply(first.cast(values.get(0)), second.cast(values.get(1))));
		}

		/**
		 * A case for any number of variants.
		 * The handler receives the variants' values in the same order as <code>types</code>.
		 *
		 * @throws InvalidAlternativeException if there is already a case for <code>types</code>
		 */
		public Builder<R> onTuple(List<? extends Class<?>> types, Function<List<Object>, ? extends R> handler) {
			List<Class<?>> key = TreePVector.from(types);
			if (cases.containsKey(key)) {
				throw new InvalidAlternativeException("Visitor already has a case for " + AlternativeRegistry.names(key));
			}
			cases = cases.plus(key, requireNonNull(handler));
			return this;
		}

		/**
		 * The case for every combination not handled by a more specific case.
		 */
		public Builder<R> otherwise(Function<List<Object>, ? extends R> handler) {
			this.fallback = requireNonNull(handler);
			return this;
		}

		public Visitor<R> build() {
			return new Visitor<>(cases, fallback);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Visitor.class);
}

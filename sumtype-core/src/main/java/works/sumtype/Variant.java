package works.sumtype;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.sumtype.exceptions.AlternativeConstructionException;
import works.sumtype.exceptions.BadVariantAccessException;
import works.sumtype.exceptions.InvalidAlternativeException;

import static java.util.Objects.requireNonNull;

/**
 * A mutable container holding exactly one value drawn from a fixed set of {@link Alternatives},
 * along with the index of the alternative it belongs to.
 *
 * <p>
 * A variant can also be <em>valueless</em>: this happens when an operation that
 * switches it to a different alternative has already disposed of the old value
 * and then fails to produce the new one. The failure is reported by an
 * {@link AlternativeConstructionException}, and any later assignment or emplacement
 * makes the variant whole again. A variant is also valueless after it has been
 * {@link #close closed} or {@link #moveFrom moved from}.
 *
 * <p>
 * Values are selected one of three ways:
 * <ul>
 *     <li>
 *         By value: {@link #of(Alternatives, Object)} and {@link #assign(Object)} pick the alternative
 *         according to the value's class, as described in {@link Alternatives#resolve}.
 *     </li>
 *     <li>
 *         By type: {@link InPlaceType} and the <code>Class</code> overloads, which require the type to
 *         occur exactly once among the alternatives.
 *     </li>
 *     <li>
 *         By index: {@link InPlaceIndex} and the <code>int</code> overloads.
 *     </li>
 * </ul>
 * Requests that can never succeed throw {@link InvalidAlternativeException} before the
 * variant is disturbed.
 *
 * <p>
 * Assigning a value of the alternative the variant already holds is done in place
 * (see {@link Assignable}), and never disposes of the held value.
 * Anything else that changes the alternative first disposes of the old value
 * (see {@link Alternative#destroy}) and then constructs the new one.
 *
 * <p>
 * Like any ordinary mutable object, a variant has no internal synchronization.
 */
public final class Variant implements VariantView, Comparable<Variant>, AutoCloseable {
	/**
	 * The {@link #index()} of a valueless variant.
	 */
	public static final int VALUELESS = -1;

	private final Alternatives alternatives;

	// Mutable state
	private int index;
	private @Nullable Object value;

	private Variant(Alternatives alternatives, int index, @Nullable Object value) {
		this.alternatives = requireNonNull(alternatives);
		this.index = index;
		this.value = value;
	}

	/**
	 * @return a variant holding the default value of the first alternative
	 * @throws InvalidAlternativeException if the first alternative is not default-constructible
	 */
	public static Variant of(Alternatives alternatives) {
		Supplier<?> factory = alternatives.alternative(0).defaultInstantiator();
		return new Variant(alternatives, 0, construct(alternatives, 0, factory));
	}

	/**
	 * @return a variant holding <code>value</code>, converted if necessary to the alternative
	 * chosen by {@link Alternatives#resolve}
	 */
	public static Variant of(Alternatives alternatives, Object value) {
		int newIndex = resolve(alternatives, value);
		Alternative<?> alternative = alternatives.alternative(newIndex);
		return new Variant(alternatives, newIndex, construct(alternatives, newIndex, () -> alternative.convert(value)));
	}

	public static Variant inPlace(Alternatives alternatives, InPlaceType<?> tag, Object... args) {
		return inPlace(alternatives, alternatives.indexOf(tag.type()), Arrays.asList(args));
	}

	/**
	 * @param sequence passed, as an unmodifiable list, as the first constructor argument, followed by <code>args</code>
	 */
	public static Variant inPlace(Alternatives alternatives, InPlaceType<?> tag, List<?> sequence, Object... args) {
		return inPlace(alternatives, alternatives.indexOf(tag.type()), withSequence(sequence, args));
	}

	public static Variant inPlace(Alternatives alternatives, InPlaceIndex tag, Object... args) {
		alternatives.checkIndex(tag.index());
		return inPlace(alternatives, tag.index(), Arrays.asList(args));
	}

	/**
	 * @param sequence passed, as an unmodifiable list, as the first constructor argument, followed by <code>args</code>
	 */
	public static Variant inPlace(Alternatives alternatives, InPlaceIndex tag, List<?> sequence, Object... args) {
		alternatives.checkIndex(tag.index());
		return inPlace(alternatives, tag.index(), withSequence(sequence, args));
	}

	private static Variant inPlace(Alternatives alternatives, int newIndex, List<?> args) {
		Supplier<?> instantiator = alternatives.alternative(newIndex).instantiator(args);
		return new Variant(alternatives, newIndex, construct(alternatives, newIndex, instantiator));
	}

	/**
	 * @return a variant holding the same alternative as <code>source</code>,
	 * with a {@link Alternative#copy copy} of its value
	 * @throws InvalidAlternativeException if that alternative can't be copied
	 */
	public static Variant copyOf(Variant source) {
		if (source.isValueless()) {
			return new Variant(source.alternatives, VALUELESS, null);
		}
		Object sourceValue = source.value;
		Alternative<Object> alternative = source.alternative(source.index);
		alternative.checkCopyable();
		return new Variant(source.alternatives, source.index,
			construct(source.alternatives, source.index, () -> alternative.copy(sourceValue)));
	}

	/**
	 * @return a variant holding <code>source</code>'s value itself, without copying.
	 * <code>source</code> is left valueless.
	 */
	public static Variant moveFrom(Variant source) {
		Variant result = new Variant(source.alternatives, source.index, source.value);
		source.clear();
		return result;
	}

	@Override
	public Alternatives alternatives() {
		return alternatives;
	}

	@Override
	public int index() {
		return index;
	}

	/**
	 * Copy assignment: this variant ends up holding the same alternative as <code>other</code>,
	 * with a value equal to <code>other</code>'s.
	 *
	 * @throws InvalidAlternativeException if <code>other</code>'s value would need to be copied
	 * and its alternative can't be copied. The variant is left unchanged.
	 */
	public void assign(Variant other) {
		checkCompatible(other);
		if (other == this) {
			return;
		} else if (other.isValueless()) {
			destroyCurrent();
		} else if (other.index == index) {
			value = alternative(index).assignCopy(value, other.value);
		} else {
			Object sourceValue = other.value;
			Alternative<Object> alternative = alternative(other.index);
			alternative.checkCopyable();
			replace(other.index, () -> alternative.copy(sourceValue));
		}
	}

	/**
	 * Move assignment: like {@link #assign(Variant)}, except that <code>other</code>'s value
	 * is taken rather than copied, and <code>other</code> is left valueless.
	 */
	public void moveAssign(Variant other) {
		checkCompatible(other);
		if (other == this) {
			return;
		} else if (other.isValueless()) {
			destroyCurrent();
		} else if (other.index == index) {
			value = alternative(index).assign(value, other.value);
		} else {
			destroyCurrent();
			value = other.value;
			index = other.index;
		}
		other.clear();
	}

	/**
	 * Converting assignment: selects the alternative the same way as {@link #of(Alternatives, Object)}.
	 */
	public void assign(Object newValue) {
		int newIndex = resolve(alternatives, newValue);
		Alternative<Object> alternative = alternative(newIndex);
		if (newIndex == index) {
			value = alternative.assign(value, alternative.convert(newValue));
		} else {
			replace(newIndex, () -> alternative.convert(newValue));
		}
	}

	/**
	 * Disposes of the current value, if any, and constructs alternative <code>type</code> from <code>args</code>.
	 *
	 * @return the new value
	 */
	public <T> T emplace(Class<T> type, Object... args) {
		return type.cast(emplaceAt(alternatives.indexOf(type), Arrays.asList(args)));
	}

	public <T> T emplace(Class<T> type, List<?> sequence, Object... args) {
		return type.cast(emplaceAt(alternatives.indexOf(type), withSequence(sequence, args)));
	}

	public Object emplace(int index, Object... args) {
		alternatives.checkIndex(index);
		return emplaceAt(index, Arrays.asList(args));
	}

	public Object emplace(int index, List<?> sequence, Object... args) {
		alternatives.checkIndex(index);
		return emplaceAt(index, withSequence(sequence, args));
	}

	/**
	 * Disposes of the current value, if any, and replaces it with the one returned by <code>factory</code>.
	 */
	public <T> T emplaceWith(Class<T> type, Supplier<? extends T> factory) {
		requireNonNull(factory);
		int newIndex = alternatives.indexOf(type);
		replace(newIndex, factory);
		return type.cast(value);
	}

	public Object emplaceWith(int index, Supplier<?> factory) {
		requireNonNull(factory);
		alternatives.checkIndex(index);
		replace(index, factory);
		return value;
	}

	private Object emplaceAt(int newIndex, List<?> args) {
		Supplier<?> instantiator = alternative(newIndex).instantiator(args);
		replace(newIndex, instantiator);
		return value;
	}

	/**
	 * Exchanges the contents of this variant with those of <code>other</code>.
	 */
	public void swap(Variant other) {
		checkCompatible(other);
		int otherIndex = other.index;
		Object otherValue = other.value;
		other.index = this.index;
		other.value = this.value;
		this.index = otherIndex;
		this.value = otherValue;
	}

	/**
	 * Disposes of the current value, if any, leaving the variant valueless.
	 */
	@Override
	public void close() {
		destroyCurrent();
	}

	@Override
	public Object get(int index) {
		alternatives.checkIndex(index);
		if (this.index != index) {
			throw new BadVariantAccessException(index, this.index, alternatives.typeAt(index).getSimpleName());
		}
		return value;
	}

	@Override
	public <T> T get(Class<T> type) {
		return type.cast(get(alternatives.indexOf(type)));
	}

	@Override
	public Optional<Object> getIf(int index) {
		alternatives.checkIndex(index);
		if (this.index == index) {
			return Optional.of(value);
		} else {
			return Optional.empty();
		}
	}

	@Override
	public <T> Optional<T> getIf(Class<T> type) {
		return getIf(alternatives.indexOf(type)).map(type::cast);
	}

	/**
	 * Two variants are equal if they have equal {@link Alternatives},
	 * hold the same alternative, and have equal values.
	 * Valueless variants are equal to each other.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (obj instanceof Variant other) {
			return alternatives.equals(other.alternatives)
				&& index == other.index
				&& Objects.equals(value, other.value);
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(alternatives, index, value);
	}

	/**
	 * Orders first by index, with valueless variants first,
	 * and then by the value, using the alternative's own ordering.
	 *
	 * @throws InvalidAlternativeException if the variants have different {@link Alternatives},
	 * or if they hold the same alternative and it has no ordering.
	 */
	@Override
	public int compareTo(Variant other) {
		checkCompatible(other);
		if (index != other.index) {
			return Integer.compare(index, other.index);
		} else if (index == VALUELESS) {
			return 0;
		} else {
			return alternative(index).compare(value, other.value);
		}
	}

	@Override
	public String toString() {
		if (index == VALUELESS) {
			return "Variant(valueless)";
		} else {
			return "Variant(" + index + ": " + value + ")";
		}
	}

	private void checkCompatible(Variant other) {
		if (!alternatives.equals(other.alternatives)) {
			throw new InvalidAlternativeException("Variants have different alternatives: " + alternatives + " and " + other.alternatives);
		}
	}

	@SuppressWarnings("unchecked")
	private Alternative<Object> alternative(int index) {
		return (Alternative<Object>) alternatives.alternative(index);
	}

	private void clear() {
		index = VALUELESS;
		value = null;
	}

	/**
	 * Leaves the variant valueless even if the disposal throws.
	 */
	private void destroyCurrent() {
		if (index != VALUELESS) {
			Alternative<Object> alternative = alternative(index);
			Object oldValue = value;
			clear();
			alternative.destroy(oldValue);
		}
	}

	private void replace(int newIndex, Supplier<?> factory) {
		destroyCurrent();
		try {
			value = construct(alternatives, newIndex, factory);
		} catch (AlternativeConstructionException e) {
			LOGGER.debug("Variant over {} is valueless after failing to construct alternative {}", alternatives, newIndex, e);
			throw e;
		}
		index = newIndex;
	}

	private static Object construct(Alternatives alternatives, int index, Supplier<?> factory) {
		Class<?> type = alternatives.typeAt(index);
		try {
			Object result = factory.get();
			if (result == null) {
				throw new NullPointerException("Construction of " + type.getSimpleName() + " produced null");
			}
			return type.cast(result);
		} catch (AlternativeConstructionException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new AlternativeConstructionException("Unable to construct alternative " + index + " (" + type.getSimpleName() + ")", e);
		}
	}

	private static int resolve(Alternatives alternatives, Object value) {
		requireNonNull(value, "Variants can't hold null");
		if (value instanceof InPlaceType<?> || value instanceof InPlaceIndex) {
			throw new InvalidAlternativeException(value.getClass().getSimpleName() + " is for in-place construction; use Variant.inPlace or emplace");
		} else if (value instanceof VariantView) {
			throw new InvalidAlternativeException("A variant can't be converted to one of its own alternatives; use copyOf or assign(Variant)");
		}
		return alternatives.resolve(value.getClass());
	}

	private static List<Object> withSequence(List<?> sequence, Object[] args) {
		List<Object> result = new ArrayList<>(1 + args.length);
		result.add(List.copyOf(sequence));
		result.addAll(Arrays.asList(args));
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Variant.class);
}

package works.sumtype;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.sumtype.exceptions.InvalidAlternativeException;

import static java.util.Objects.requireNonNull;
import static works.sumtype.AlternativeRegistry.SAME_TYPE;
import static works.sumtype.AlternativeRegistry.findMatchingType;
import static works.sumtype.AlternativeRegistry.findUniqueMatchingType;
import static works.sumtype.AlternativeRegistry.isInRange;
import static works.sumtype.AlternativeRegistry.isUnique;
import static works.sumtype.AlternativeRegistry.occurrenceCount;
import static works.sumtype.AlternativeRegistry.position;
import static works.sumtype.TypeValidation.validateAlternatives;

/**
 * The fixed, ordered list of types a {@link Variant} may hold.
 *
 * <p>
 * Every question about which alternative a type, an index, or a value refers to
 * is answered here, and every answer that can't be valid is an
 * {@link InvalidAlternativeException}.
 *
 * <p>
 * Two sets are equal if they list {@link Alternative#equals equal} alternatives in the same order
 * and have the same {@link ConversionPolicy};
 * variants over equal sets can be assigned, swapped and compared with each other.
 * The same type may appear more than once, in which case it can be selected only by index.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Alternatives {
	@EqualsAndHashCode.Include private final PVector<Alternative<?>> entries;
	private final PVector<Class<?>> types;
	@Getter @EqualsAndHashCode.Include private final ConversionPolicy conversionPolicy;

	private Alternatives(PVector<Alternative<?>> entries, ConversionPolicy conversionPolicy) {
		List<Class<?>> types = new ArrayList<>(entries.size());
		for (Alternative<?> entry: entries) {
			types.add(entry.type());
		}
		validateAlternatives(types);
		this.entries = entries;
		this.types = TreePVector.from(types);
		this.conversionPolicy = requireNonNull(conversionPolicy);
		LOGGER.debug("Defined alternatives {} with {}", this, conversionPolicy);
	}

	public static Alternatives of(Class<?>... types) {
		Builder builder = builder();
		for (Class<?> type: types) {
			builder.add(type);
		}
		return builder.build();
	}

	public static Alternatives of(Alternative<?>... alternatives) {
		Builder builder = builder();
		for (Alternative<?> alternative: alternatives) {
			builder.add(alternative);
		}
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int size() {
		return entries.size();
	}

	public List<Class<?>> types() {
		return types;
	}

	/**
	 * @throws InvalidAlternativeException if <code>index</code> is out of range
	 */
	public Alternative<?> alternative(int index) {
		checkIndex(index);
		return entries.get(index);
	}

	/**
	 * @throws InvalidAlternativeException if <code>index</code> is out of range
	 */
	public Class<?> typeAt(int index) {
		return alternative(index).type();
	}

	public boolean contains(Class<?> type) {
		return position(type, types) < size();
	}

	/**
	 * @return the number of alternatives of exactly the given type
	 */
	public int count(Class<?> type) {
		return occurrenceCount(SAME_TYPE, type, types);
	}

	/**
	 * @throws InvalidAlternativeException if <code>index</code> is out of range
	 */
	public void checkIndex(int index) {
		if (!isInRange(index, size())) {
			throw new InvalidAlternativeException("Alternative index " + index + " is out of range for " + this);
		}
	}

	/**
	 * @return the index of <code>type</code>
	 * @throws InvalidAlternativeException unless <code>type</code> occurs exactly once
	 */
	public int indexOf(Class<?> type) {
		if (isUnique(type, types)) {
			return position(type, types);
		} else if (contains(type)) {
			throw new InvalidAlternativeException(type.getSimpleName() + " occurs " + count(type) + " times in " + this + "; select it by index");
		} else {
			throw new InvalidAlternativeException(type.getSimpleName() + " is not one of " + this);
		}
	}

	/**
	 * A value of <code>valueType</code> can be converted to <code>alternativeType</code>,
	 * either by the language's own conversions or by one the alternative declares.
	 */
	public boolean isConvertible(Class<?> valueType, Class<?> alternativeType) {
		int index = position(alternativeType, types);
		return index < size() && entries.get(index).isConvertibleFrom(valueType);
	}

	/**
	 * Picks the alternative that should hold a value of the given type
	 * when it's passed to a variant without an explicit selection.
	 * A unique alternative of exactly that type wins; otherwise the
	 * {@link #conversionPolicy() conversion policy} decides among those
	 * the value {@link #isConvertible can be converted} to.
	 *
	 * @throws InvalidAlternativeException if no alternative can accept the value,
	 * or if the policy is {@link ConversionPolicy#UNIQUE_MATCH UNIQUE_MATCH} and more than one can.
	 */
	public int resolve(Class<?> valueType) {
		int result;
		if (contains(valueType)) {
			result = indexOf(valueType);
		} else {
			BiPredicate<Class<?>, Class<?>> isConvertible = this::isConvertible;
			result = switch (conversionPolicy) {
				case UNIQUE_MATCH -> findUniqueMatchingType(isConvertible, valueType, types);
				case FIRST_MATCH -> findMatchingType(isConvertible, valueType, types);
			};
		}
		LOGGER.trace("Resolved {} to alternative {} of {}", valueType.getSimpleName(), result, this);
		return result;
	}

	@Override
	public String toString() {
		return AlternativeRegistry.names(types);
	}

	public static final class Builder {
		private PVector<Alternative<?>> entries = TreePVector.empty();
		private ConversionPolicy conversionPolicy = ConversionPolicy.UNIQUE_MATCH;

		private Builder() { }

		public Builder add(Class<?> type) {
			return add(Alternative.of(type));
		}

		public Builder add(Alternative<?> alternative) {
			entries = entries.plus(requireNonNull(alternative));
			return this;
		}

		public Builder conversionPolicy(ConversionPolicy conversionPolicy) {
			this.conversionPolicy = requireNonNull(conversionPolicy);
			return this;
		}

		/**
		 * @throws InvalidAlternativeException if there are no alternatives
		 */
		public Alternatives build() {
			return new Alternatives(entries, conversionPolicy);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Alternatives.class);
}

package works.sumtype;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.sumtype.annotations.Implicit;
import works.sumtype.exceptions.AlternativeConstructionException;
import works.sumtype.exceptions.InvalidAlternativeException;

import static java.util.Objects.requireNonNull;
import static works.sumtype.TypeValidation.validateAlternativeType;
import static works.sumtype.util.ReflectionHelpers.isConcrete;
import static works.sumtype.util.ReflectionHelpers.setAccessible;
import static works.sumtype.util.ReflectionHelpers.signature;
import static works.sumtype.util.ReflectionHelpers.unwrap;

/**
 * Describes one alternative type of a {@link Variant}: how to make a default instance,
 * how to copy one, what it can be implicitly converted from, how to construct it in place,
 * how to assign to it, how to dispose of it, and how to order two instances.
 *
 * <p>
 * {@link #of(Class)} works all of this out by inspecting the class:
 * <ul>
 *     <li>
 *         Boxed primitives default to zero; other classes default to the result of
 *         their public no-argument constructor, if they have one.
 *     </li>
 *     <li>
 *         Boxed primitives, strings, enums and records are shared rather than copied.
 *         Other classes are copied with a public constructor taking one argument
 *         of their own type (or a supertype other than <code>Object</code>).
 *         Anything else can't be copied unless given a {@link Builder#copier copier}.
 *     </li>
 *     <li>
 *         Public one-argument constructors and static factories annotated {@link Implicit @Implicit}
 *         become implicit conversions.
 *     </li>
 *     <li>
 *         {@link Assignable} types are assigned in place; others are replaced.
 *     </li>
 *     <li>
 *         {@link AutoCloseable} types are closed when the variant lets go of them.
 *         They must also be {@link Assignable}.
 *     </li>
 *     <li>
 *         {@link Comparable} types are ordered naturally.
 *     </li>
 * </ul>
 * Use {@link #builder(Class)} to supply any of these explicitly instead.
 *
 * <p>
 * Two alternatives are equal if they have the same type and were given
 * the same explicit settings; whatever is discovered from the class itself is
 * the same for both.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Alternative<T> {
	@Getter @EqualsAndHashCode.Include private final Class<T> type;
	private final @Nullable Supplier<? extends T> defaultFactory;
	private final @Nullable UnaryOperator<T> copier;
	private final PVector<Conversion<T>> conversions;
	private final @Nullable Comparator<? super T> comparator;

	// As given to the builder
	@EqualsAndHashCode.Include private final @Nullable Supplier<? extends T> explicitDefault;
	@EqualsAndHashCode.Include private final @Nullable UnaryOperator<T> explicitCopier;
	@EqualsAndHashCode.Include private final PVector<Map.Entry<Class<?>, Function<?, ? extends T>>> explicitConversions;
	@EqualsAndHashCode.Include private final @Nullable Comparator<? super T> explicitComparator;

	private Alternative(
		Builder<T> builder,
		@Nullable Supplier<? extends T> defaultFactory,
		@Nullable UnaryOperator<T> copier,
		PVector<Conversion<T>> conversions,
		@Nullable Comparator<? super T> comparator
	) {
		this.type = builder.type;
		this.defaultFactory = defaultFactory;
		this.copier = copier;
		this.conversions = conversions;
		this.comparator = comparator;
		this.explicitDefault = builder.defaultFactory;
		this.explicitCopier = builder.copier;
		this.explicitConversions = builder.explicitConversions;
		this.explicitComparator = builder.comparator;
	}

	public static <TT> Alternative<TT> of(Class<TT> type) {
		return builder(type).build();
	}

	public static <TT> Builder<TT> builder(Class<TT> type) {
		return new Builder<>(type);
	}

	public boolean isDefaultConstructible() {
		return defaultFactory != null;
	}

	/**
	 * @throws InvalidAlternativeException if this type has no default value
	 */
	public Supplier<? extends T> defaultInstantiator() {
		if (defaultFactory == null) {
			throw new InvalidAlternativeException(type.getSimpleName() + " is not default-constructible; consider putting "
				+ Monostate.class.getSimpleName() + " first among the alternatives");
		}
		return defaultFactory;
	}

	public boolean isCopyable() {
		return copier != null;
	}

	/**
	 * @throws InvalidAlternativeException if this alternative is not {@link #isCopyable copyable}
	 */
	public void checkCopyable() {
		if (copier == null) {
			throw new InvalidAlternativeException(type.getSimpleName()
				+ " can't be copied; give it a public copy constructor, or supply a copier to Alternative.builder");
		}
	}

	/**
	 * @throws InvalidAlternativeException if this alternative is not {@link #isCopyable copyable}
	 */
	public T copy(T value) {
		checkCopyable();
		return copier.apply(value);
	}

	public boolean isConvertibleFrom(Class<?> valueType) {
		return Conversions.isConvertible(valueType, type) || conversionFrom(valueType) != null;
	}

	/**
	 * Produces an instance of this alternative from a value that {@link #isConvertibleFrom can be converted}.
	 * An instance of the type itself is returned as-is.
	 */
	public T convert(Object value) {
		Class<?> valueType = value.getClass();
		if (type.isInstance(value)) {
			return type.cast(value);
		} else if (Conversions.isConvertible(valueType, type)) {
			return type.cast(Conversions.convert(value, type));
		}
		Conversion<T> conversion = conversionFrom(valueType);
		if (conversion == null) {
			throw new InvalidAlternativeException("No implicit conversion from " + valueType.getSimpleName() + " to " + type.getSimpleName());
		}
		return conversion.function().apply(value);
	}

	/**
	 * An exact source type wins; otherwise, the first conversion that accepts
	 * the value, in the order they were registered.
	 */
	private @Nullable Conversion<T> conversionFrom(Class<?> valueType) {
		Conversion<T> firstApplicable = null;
		for (Conversion<T> conversion: conversions) {
			if (conversion.sourceType().equals(Conversions.boxed(valueType))) {
				return conversion;
			} else if (firstApplicable == null && Conversions.isConvertible(valueType, conversion.sourceType())) {
				firstApplicable = conversion;
			}
		}
		return firstApplicable;
	}

	/**
	 * Works out how to construct this alternative from the given arguments, without doing it yet,
	 * so that a request that can never succeed is rejected before anything is disturbed.
	 *
	 * @throws InvalidAlternativeException if no public constructor accepts <code>args</code>,
	 * or if more than one does and none is more specific than the others.
	 */
	public Supplier<T> instantiator(List<?> args) {
		if (Conversions.isBoxedPrimitive(type)) {
			if (args.isEmpty()) {
				return () -> type.cast(Conversions.zeroValue(type));
			} else if (args.size() == 1 && args.get(0) != null && Conversions.isConvertible(args.get(0).getClass(), type)) {
				T result = type.cast(Conversions.convert(args.get(0), type));
				return () -> result;
			} else {
				throw notConstructible(args);
			}
		} else if (!isConcrete(type)) {
			if (args.size() == 1 && type.isInstance(args.get(0))) {
				T result = type.cast(args.get(0));
				return () -> result;
			} else {
				throw notConstructible(args);
			}
		}

		List<Constructor<?>> candidates = applicable(Arrays.asList(type.getConstructors()), args);
		if (candidates.isEmpty()) {
			throw notConstructible(args);
		} else if (candidates.size() >= 2) {
			throw new InvalidAlternativeException("Ambiguous construction of " + type.getSimpleName()
				+ " from " + argumentTypes(args) + "; candidates: "
				+ candidates.stream().map(c -> signature(c)).collect(Collectors.joining(", ")));
		}
		@SuppressWarnings("unchecked")
		Constructor<T> constructor = setAccessible((Constructor<T>) candidates.get(0));
		Object[] arguments = args.toArray();
		return () -> newInstance(constructor, arguments);
	}

	/**
	 * @return <code>source</code>'s state, held in the object that will represent it from now on:
	 * <code>current</code> itself if it's {@link Assignable}, or else <code>source</code>.
	 */
	@SuppressWarnings("unchecked")
	public T assign(T current, T source) {
		if (current instanceof Assignable<?> assignable) {
			((Assignable<T>) assignable).assignFrom(source);
			return current;
		} else {
			return source;
		}
	}

	/**
	 * Like {@link #assign}, except that <code>source</code> remains in use elsewhere,
	 * so if it can't be assigned in place, a {@link #copy} of it is returned instead.
	 */
	@SuppressWarnings("unchecked")
	public T assignCopy(T current, T source) {
		if (current instanceof Assignable<?> assignable) {
			((Assignable<T>) assignable).assignFrom(source);
			return current;
		} else {
			return copy(source);
		}
	}

	/**
	 * Ends the lifetime of <code>value</code> as far as its variant is concerned.
	 */
	public void destroy(T value) {
		if (value instanceof AutoCloseable closeable) {
			try {
				closeable.close();
			} catch (RuntimeException e) {
				throw e;
			} catch (Exception e) {
				throw new IllegalStateException("Unable to close " + type.getSimpleName() + " value", e);
			}
		}
	}

	public boolean isOrdered() {
		return comparator != null;
	}

	/**
	 * @throws InvalidAlternativeException if this alternative is not {@link #isOrdered ordered}
	 */
	public int compare(T a, T b) {
		if (comparator == null) {
			throw new InvalidAlternativeException(type.getSimpleName() + " has no ordering; it must be Comparable or be given a comparator");
		}
		return comparator.compare(a, b);
	}

	@Override
	public String toString() {
		return type.getSimpleName();
	}

	private InvalidAlternativeException notConstructible(List<?> args) {
		return new InvalidAlternativeException(type.getSimpleName() + " has no public constructor accepting " + argumentTypes(args));
	}

	private static String argumentTypes(List<?> args) {
		return args.stream()
			.map(a -> a == null ? "null" : a.getClass().getSimpleName())
			.collect(Collectors.joining(", ", "(", ")"));
	}

	/**
	 * Follows the spirit of Java's own overload resolution: executables that accept the
	 * arguments without unboxing or widening are preferred; among those remaining,
	 * the most specific are returned.
	 */
	static <E extends Executable> List<E> applicable(List<E> executables, List<?> args) {
		List<E> strict = new ArrayList<>();
		List<E> loose = new ArrayList<>();
		for (E executable: executables) {
			Class<?>[] parameterTypes = executable.getParameterTypes();
			if (parameterTypes.length != args.size()) {
				continue;
			}
			boolean isStrict = true;
			boolean isLoose = true;
			for (int i = 0; i < parameterTypes.length; i++) {
				Object arg = args.get(i);
				isStrict &= (arg == null) ? !parameterTypes[i].isPrimitive() : parameterTypes[i].isInstance(arg);
				isLoose &= Conversions.isApplicable(arg, parameterTypes[i]);
			}
			if (isStrict) {
				strict.add(executable);
			} else if (isLoose) {
				loose.add(executable);
			}
		}
		return mostSpecific(strict.isEmpty() ? loose : strict);
	}

	private static <E extends Executable> List<E> mostSpecific(List<E> candidates) {
		return candidates.stream()
			.filter(c -> candidates.stream().allMatch(other -> other == c || isAtLeastAsSpecific(c, other)))
			.collect(Collectors.toList());
	}

	private static boolean isAtLeastAsSpecific(Executable a, Executable b) {
		Class<?>[] aTypes = a.getParameterTypes();
		Class<?>[] bTypes = b.getParameterTypes();
		for (int i = 0; i < aTypes.length; i++) {
			if (!Conversions.isConvertible(aTypes[i], bTypes[i])) {
				return false;
			}
		}
		return true;
	}

	private static <T> T newInstance(Constructor<T> constructor, Object... arguments) {
		try {
			return constructor.newInstance(arguments);
		} catch (InvocationTargetException e) {
			Throwable cause = unwrap(e);
			throw new AlternativeConstructionException(signature(constructor) + " threw " + cause.getClass().getSimpleName(), cause);
		} catch (InstantiationException | IllegalAccessException e) {
			throw new InvalidAlternativeException("Unable to call " + signature(constructor), e);
		}
	}

	private static Object invokeFactory(Method factory, Object argument) {
		try {
			return factory.invoke(null, argument);
		} catch (InvocationTargetException e) {
			Throwable cause = unwrap(e);
			throw new AlternativeConstructionException(signature(factory) + " threw " + cause.getClass().getSimpleName(), cause);
		} catch (IllegalAccessException e) {
			throw new InvalidAlternativeException("Unable to call " + signature(factory), e);
		}
	}

	/**
	 * @param sourceType the (boxed) type of value this conversion accepts
	 */
	record Conversion<T>(Class<?> sourceType, Function<Object, ? extends T> function) { }

	public static final class Builder<T> {
		private final Class<T> type;
		private @Nullable Supplier<? extends T> defaultFactory;
		private @Nullable UnaryOperator<T> copier;
		private PVector<Conversion<T>> conversions = TreePVector.empty();
		private PVector<Map.Entry<Class<?>, Function<?, ? extends T>>> explicitConversions = TreePVector.empty();
		private @Nullable Comparator<? super T> comparator;

		private Builder(Class<T> type) {
			this.type = requireNonNull(type);
		}

		public Builder<T> defaultValue(Supplier<? extends T> factory) {
			this.defaultFactory = requireNonNull(factory);
			return this;
		}

		public Builder<T> copier(UnaryOperator<T> copier) {
			this.copier = requireNonNull(copier);
			return this;
		}

		/**
		 * Registers an implicit conversion. Conversions registered here are consulted
		 * before any discovered from {@link Implicit @Implicit} annotations.
		 */
		public <S> Builder<T> convertingFrom(Class<S> sourceType, Function<? super S, ? extends T> conversion) {
			requireNonNull(conversion);
			@SuppressWarnings("unchecked")
			Class<S> boxedSource = (Class<S>) Conversions.boxed(sourceType);
			conversions = conversions.plus(new Conversion<>(boxedSource, value ->
				conversion.apply(boxedSource.cast(Conversions.convert(value, boxedSource)))));
			explicitConversions = explicitConversions.plus(Map.entry(boxedSource, conversion));
			return this;
		}

		public Builder<T> comparator(Comparator<? super T> comparator) {
			this.comparator = requireNonNull(comparator);
			return this;
		}

		/**
		 * @throws InvalidAlternativeException if the type can't be an alternative,
		 * if it's {@link AutoCloseable} but not {@link Assignable},
		 * or if it has a misplaced {@link Implicit @Implicit} annotation.
		 */
		public Alternative<T> build() {
			validateAlternativeType(type);
			if (AutoCloseable.class.isAssignableFrom(type) && !Assignable.class.isAssignableFrom(type)) {
				// Otherwise, same-index assignment would drop the held value without closing it
				throw new InvalidAlternativeException(type.getSimpleName() + " is AutoCloseable, so it must also implement "
					+ Assignable.class.getSimpleName());
			}
			Supplier<? extends T> effectiveDefault = (defaultFactory == null) ? discoverDefaultFactory(type) : defaultFactory;
			UnaryOperator<T> effectiveCopier = (copier == null) ? discoverCopier(type) : copier;
			PVector<Conversion<T>> effectiveConversions = conversions.plusAll(discoverImplicitConversions(type));
			Comparator<? super T> effectiveComparator = comparator;
			if (effectiveComparator == null && Comparable.class.isAssignableFrom(type)) {
				effectiveComparator = naturalOrder();
			}
			return new Alternative<>(this, effectiveDefault, effectiveCopier, effectiveConversions, effectiveComparator);
		}

		@SuppressWarnings("unchecked")
		private static <T> Comparator<T> naturalOrder() {
			return (a, b) -> ((Comparable<Object>) a).compareTo(b);
		}
	}

	private static <T> @Nullable Supplier<? extends T> discoverDefaultFactory(Class<T> type) {
		Object zero = Conversions.zeroValue(type);
		if (zero != null) {
			T result = type.cast(zero);
			return () -> result;
		} else if (!isConcrete(type)) {
			return null;
		}
		try {
			Constructor<T> constructor = setAccessible(type.getConstructor());
			return () -> newInstance(constructor);
		} catch (NoSuchMethodException e) {
			return null;
		}
	}

	private static <T> @Nullable UnaryOperator<T> discoverCopier(Class<T> type) {
		if (isShareable(type)) {
			return UnaryOperator.identity();
		} else if (!isConcrete(type)) {
			return null;
		}
		List<Constructor<?>> copyConstructors = new ArrayList<>();
		for (Constructor<?> constructor: type.getConstructors()) {
			Class<?>[] parameterTypes = constructor.getParameterTypes();
			if (parameterTypes.length == 1
				&& parameterTypes[0] != Object.class
				&& parameterTypes[0].isAssignableFrom(type)) {
				copyConstructors.add(constructor);
			}
		}
		List<Constructor<?>> best = mostSpecific(copyConstructors);
		if (best.size() != 1) {
			return null;
		}
		@SuppressWarnings("unchecked")
		Constructor<T> copyConstructor = setAccessible((Constructor<T>) best.get(0));
		return value -> newInstance(copyConstructor, value);
	}

	private static boolean isShareable(Class<?> type) {
		return Conversions.isBoxedPrimitive(type)
			|| type == String.class
			|| type.isEnum()
			|| type.isRecord();
	}

	private static <T> List<Conversion<T>> discoverImplicitConversions(Class<T> type) {
		List<Conversion<T>> result = new ArrayList<>();
		for (Constructor<?> c: type.getDeclaredConstructors()) {
			if (c.isAnnotationPresent(Implicit.class)) {
				checkImplicitSignature(c);
				@SuppressWarnings("unchecked")
				Constructor<T> constructor = setAccessible((Constructor<T>) c);
				result.add(new Conversion<>(Conversions.boxed(constructor.getParameterTypes()[0]),
					value -> newInstance(constructor, value)));
			}
		}
		for (Method m: type.getDeclaredMethods()) {
			if (m.isAnnotationPresent(Implicit.class)) {
				checkImplicitSignature(m);
				if (!Modifier.isStatic(m.getModifiers()) || !type.isAssignableFrom(m.getReturnType())) {
					throw new InvalidAlternativeException("@" + Implicit.class.getSimpleName() + " method " + signature(m)
						+ " must be static and return " + type.getSimpleName());
				}
				Method factory = setAccessible(m);
				result.add(new Conversion<>(Conversions.boxed(factory.getParameterTypes()[0]),
					value -> type.cast(invokeFactory(factory, value))));
			}
		}
		return result;
	}

	private static void checkImplicitSignature(Executable executable) {
		if (!Modifier.isPublic(executable.getModifiers()) || executable.getParameterCount() != 1) {
			throw new InvalidAlternativeException("@" + Implicit.class.getSimpleName() + " " + signature(executable)
				+ " must be public and take exactly one parameter");
		}
	}
}

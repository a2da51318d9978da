package works.sumtype;

import java.lang.invoke.MethodType;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The conversions Java applies implicitly when passing an argument:
 * boxing, unboxing, widening primitive conversions, and reference assignability.
 *
 * <p>
 * Because alternatives are always reference types, widening is expressed
 * here in terms of the boxed classes: an {@link Integer} is convertible to
 * a {@link Long} because an <code>int</code> widens to a <code>long</code>.
 */
public final class Conversions {
	private Conversions() {}

	public static Class<?> boxed(Class<?> type) {
		if (type.isPrimitive()) {
			return MethodType.methodType(type).wrap().returnType();
		} else {
			return type;
		}
	}

	public static boolean isBoxedPrimitive(Class<?> type) {
		return WIDENINGS.containsKey(type);
	}

	/**
	 * @return true if a value of <code>from</code> can be passed where
	 * <code>to</code> is expected with no explicit conversion.
	 * Either argument may be primitive.
	 */
	public static boolean isConvertible(Class<?> from, Class<?> to) {
		Class<?> boxedFrom = boxed(from);
		Class<?> boxedTo = boxed(to);
		return boxedTo.isAssignableFrom(boxedFrom) || isWidening(boxedFrom, boxedTo);
	}

	/**
	 * @return true if <code>from</code> and <code>to</code> are boxed primitive classes
	 * and the corresponding primitives are related by a widening primitive conversion.
	 */
	public static boolean isWidening(Class<?> from, Class<?> to) {
		List<Class<?>> targets = WIDENINGS.get(from);
		return targets != null && targets.contains(to);
	}

	/**
	 * @return true if an argument (possibly null) is acceptable for a parameter of the given type.
	 */
	public static boolean isApplicable(@Nullable Object argument, Class<?> parameterType) {
		if (argument == null) {
			return !parameterType.isPrimitive();
		} else {
			return isConvertible(argument.getClass(), parameterType);
		}
	}

	/**
	 * Converts <code>value</code> to the boxed class <code>target</code>, applying
	 * a widening primitive conversion if needed.
	 *
	 * @throws IllegalArgumentException if {@link #isConvertible} would return false.
	 */
	public static Object convert(Object value, Class<?> target) {
		requireNonNull(value);
		Class<?> boxedTarget = boxed(target);
		if (boxedTarget.isInstance(value)) {
			return value;
		} else if (!isWidening(value.getClass(), boxedTarget)) {
			throw new IllegalArgumentException("No implicit conversion from " + value.getClass().getSimpleName() + " to " + boxedTarget.getSimpleName());
		}
		Number number = (value instanceof Character c)? Integer.valueOf(c.charValue()) : (Number) value;
		if (boxedTarget == Short.class) {
			return number.shortValue();
		} else if (boxedTarget == Integer.class) {
			return number.intValue();
		} else if (boxedTarget == Long.class) {
			return number.longValue();
		} else if (boxedTarget == Float.class) {
			return number.floatValue();
		} else if (boxedTarget == Double.class) {
			return number.doubleValue();
		} else {
			throw new AssertionError("Unexpected widening target: " + boxedTarget.getSimpleName());
		}
	}

	/**
	 * @return the value a default-initialized primitive field of the corresponding
	 * type would have, or null if <code>type</code> is not a boxed primitive class.
	 */
	public static @Nullable Object zeroValue(Class<?> type) {
		return ZERO_VALUES.get(boxed(type));
	}

	private static final Map<Class<?>, List<Class<?>>> WIDENINGS = Map.of(
		Byte.class,      List.of(Short.class, Integer.class, Long.class, Float.class, Double.class),
		Short.class,     List.of(Integer.class, Long.class, Float.class, Double.class),
		Character.class, List.of(Integer.class, Long.class, Float.class, Double.class),
		Integer.class,   List.of(Long.class, Float.class, Double.class),
		Long.class,      List.of(Float.class, Double.class),
		Float.class,     List.of(Double.class),
		Double.class,    List.of(),
		Boolean.class,   List.of());

	private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
		Byte.class, (byte) 0,
		Short.class, (short) 0,
		Character.class, '\0',
		Integer.class, 0,
		Long.class, 0L,
		Float.class, 0.0f,
		Double.class, 0.0,
		Boolean.class, false);
}

package works.sumtype;

import java.lang.invoke.MethodType;
import java.util.List;
import works.sumtype.exceptions.InvalidAlternativeException;

/**
 * Checks that a given type can serve as one of the alternatives of a {@link Variant}.
 */
public final class TypeValidation {
	private TypeValidation() {}

	public static void validateAlternatives(List<? extends Class<?>> types) throws InvalidAlternativeException {
		if (types.isEmpty()) {
			throw new InvalidAlternativeException("A variant must have at least one alternative");
		}
		for (int i = 0; i < types.size(); i++) {
			// For troubleshooting reasons, say which alternative was wrong
			try {
				validateAlternativeType(types.get(i));
			} catch (InvalidAlternativeException e) {
				throw new InvalidAlternativeException("Alternative " + i + ": " + e.getMessage(), e);
			}
		}
	}

	public static void validateAlternativeType(Class<?> theClass) throws InvalidAlternativeException {
		if (theClass == void.class || theClass == Void.class) {
			throw new InvalidAlternativeException("Void can't be an alternative; use " + Monostate.class.getSimpleName() + " for an alternative with no data");
		} else if (theClass.isPrimitive()) {
			Class<?> wrapped = MethodType.methodType(theClass).wrap().returnType();
			throw new InvalidAlternativeException("Primitive types can't be alternatives; use boxed " + wrapped.getSimpleName() + " instead of primitive " + theClass.getSimpleName());
		} else if (theClass.isArray()) {
			throw new InvalidAlternativeException("Array types can't be alternatives; use a List instead of " + theClass.getSimpleName());
		} else if (InPlaceType.class.equals(theClass) || InPlaceIndex.class.equals(theClass)) {
			throw new InvalidAlternativeException(theClass.getSimpleName() + " selects an alternative; it can't be one");
		} else if (Variant.class.equals(theClass) || VariantView.class.equals(theClass)) {
			// Nested variants would make converting construction hopelessly confusing.
			// Wrap one in a record if you really need it.
			throw new InvalidAlternativeException(theClass.getSimpleName() + " can't be an alternative of a variant");
		}
	}

}

package works.sumtype.util;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.stream.Collectors;

import static java.lang.reflect.Modifier.isPrivate;

public final class ReflectionHelpers {
	private ReflectionHelpers() {}

	public static <T extends Executable> T setAccessible(T method) {
		makeAccessible(method, method.getModifiers());
		return method;
	}

	private static void makeAccessible(AccessibleObject object, int modifiers) {
		// Let's honour "private" modifiers so people can know that private
		// constructors and factories aren't being called by us. That allows them to
		// refactor them freely without concern for breaking some variant magic.
		//
		if (isPrivate(modifiers)) {
			throw new IllegalArgumentException("Access to private " + object.getClass().getSimpleName() + " is forbidden: " + object);
		}

		//... but otherwise, it's open season.
		object.setAccessible(true);
	}

	public static boolean isConcrete(Class<?> type) {
		return !type.isInterface() && !Modifier.isAbstract(type.getModifiers());
	}

	/**
	 * @return the exception that a reflective call actually threw.
	 */
	public static Throwable unwrap(Throwable e) {
		Throwable result = e;
		while (result instanceof InvocationTargetException && result.getCause() != null) {
			result = result.getCause();
		}
		return result;
	}

	/**
	 * @return a compact rendering like <code>Foo(int, String)</code>, for error messages.
	 */
	public static String signature(Executable executable) {
		return executable.getDeclaringClass().getSimpleName()
			+ (executable instanceof java.lang.reflect.Method ? "." + executable.getName() : "")
			+ Arrays.stream(executable.getParameterTypes())
				.map(Class::getSimpleName)
				.collect(Collectors.joining(", ", "(", ")"));
	}
}

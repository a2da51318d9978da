package works.sumtype.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.CONSTRUCTOR;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a public one-argument constructor, or a public static one-argument
 * factory method returning the declaring class, as an implicit conversion.
 *
 * <p>
 * When a value is handed to a <code>Variant</code> whose alternatives don't include
 * the value's own class, implicit conversions are among the ways an alternative can
 * accept it. Constructors without this annotation are only used for
 * in-place construction, where the caller names the alternative explicitly.
 */
@Retention(RUNTIME)
@Target({ CONSTRUCTOR, METHOD })
public @interface Implicit {

}

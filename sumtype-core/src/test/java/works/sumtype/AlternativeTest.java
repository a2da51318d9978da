package works.sumtype;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import works.sumtype.annotations.Implicit;
import works.sumtype.exceptions.AlternativeConstructionException;
import works.sumtype.exceptions.InvalidAlternativeException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlternativeTest {

	@Test
	void boxedPrimitive_defaultsToZero() {
		Alternative<Integer> alternative = Alternative.of(Integer.class);
		assertTrue(alternative.isDefaultConstructible());
		assertThat(alternative.defaultInstantiator().get(), equalTo(0));
		assertThat(Alternative.of(Boolean.class).defaultInstantiator().get(), equalTo(false));
	}

	@Test
	void noArgConstructor_isDefault() {
		Supplier<? extends ArrayList> factory = Alternative.of(ArrayList.class).defaultInstantiator();
		assertTrue(factory.get().isEmpty());
		assertNotSame(factory.get(), factory.get());
	}

	@Test
	void notDefaultConstructible_throws() {
		Alternative<Celsius> alternative = Alternative.of(Celsius.class);
		assertFalse(alternative.isDefaultConstructible());
		InvalidAlternativeException e = assertThrows(InvalidAlternativeException.class, alternative::defaultInstantiator);
		assertThat(e.getMessage(), containsString("Monostate"));
	}

	@Test
	void interface_isNotDefaultConstructible() {
		assertFalse(Alternative.of(CharSequence.class).isDefaultConstructible());
	}

	@Test
	void explicitDefault() {
		Alternative<Celsius> alternative = Alternative.builder(Celsius.class)
			.defaultValue(() -> new Celsius(37.0))
			.build();
		assertEquals(new Celsius(37.0), alternative.defaultInstantiator().get());
	}

	@Test
	void immutableTypes_areShared() {
		String string = "shared";
		assertSame(string, Alternative.of(String.class).copy(string));
		Celsius celsius = new Celsius(1.0);
		assertSame(celsius, Alternative.of(Celsius.class).copy(celsius));
	}

	@Test
	void copyConstructor_isUsed() {
		ArrayList<String> original = new ArrayList<>(List.of("a", "b"));
		ArrayList<?> copy = Alternative.of(ArrayList.class).copy(original);
		assertNotSame(original, copy);
		assertEquals(original, copy);

		Resource.Counters counters = new Resource.Counters();
		Resource resource = new Resource(counters, "r");
		Resource resourceCopy = Alternative.of(Resource.class).copy(resource);
		assertNotSame(resource, resourceCopy);
		assertEquals("r", resourceCopy.label());
		assertEquals(1, counters.copies());
	}

	@Test
	void explicitCopier() {
		Alternative<StringBuilder> alternative = Alternative.builder(StringBuilder.class)
			.copier(sb -> new StringBuilder(sb.toString().toUpperCase()))
			.build();
		assertEquals("ABC", alternative.copy(new StringBuilder("abc")).toString());
	}

	@Test
	void implicitFactory_convertsWithWidening() {
		Alternative<Celsius> alternative = Alternative.of(Celsius.class);
		assertTrue(alternative.isConvertibleFrom(Double.class));
		assertTrue(alternative.isConvertibleFrom(Integer.class));
		assertFalse(alternative.isConvertibleFrom(String.class));
		assertEquals(new Celsius(21.5), alternative.convert(21.5));
		assertEquals(new Celsius(21.0), alternative.convert(21));
	}

	@Test
	void implicitConstructor_converts() {
		Alternative<Label> alternative = Alternative.of(Label.class);
		assertTrue(alternative.isConvertibleFrom(String.class));
		assertEquals("hello", alternative.convert("hello").text());
	}

	@Test
	void implicitConversion_exactSourceTypeWins() {
		Alternative<Label> alternative = Alternative.of(Label.class);
		assertEquals("int 7", alternative.convert(7).text());
		assertEquals("long 7", alternative.convert(7L).text());
	}

	@Test
	void explicitConversion_consultedFirst() {
		Alternative<Label> alternative = Alternative.builder(Label.class)
			.convertingFrom(Integer.class, i -> new Label("explicit " + i))
			.build();
		assertEquals("explicit 3", alternative.convert(3).text());
	}

	@Test
	void explicitConversion_fromPrimitive() {
		Alternative<Celsius> alternative = Alternative.builder(Celsius.class)
			.convertingFrom(long.class, kelvin -> new Celsius(kelvin - 273.0))
			.build();
		assertEquals(new Celsius(0.0), alternative.convert(273L));
	}

	@Test
	void convert_throwingConversion_wrapsCause() {
		AlternativeConstructionException e = assertThrows(AlternativeConstructionException.class, () ->
			Alternative.of(Celsius.class).convert(-300.0));
		assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
	}

	@Test
	void convert_unrelated_throws() {
		assertThrows(InvalidAlternativeException.class, () -> Alternative.of(Celsius.class).convert("warm"));
	}

	@Test
	void misplacedImplicit_rejected() {
		assertThrows(InvalidAlternativeException.class, () -> Alternative.of(InstanceImplicit.class));
		assertThrows(InvalidAlternativeException.class, () -> Alternative.of(TwoParameterImplicit.class));
	}

	@Test
	void instantiator_picksMatchingConstructor() {
		Alternative<Label> alternative = Alternative.of(Label.class);
		assertEquals("x!", alternative.instantiator(List.of("x", '!')).get().text());
		assertEquals("xxx", alternative.instantiator(List.of("x", 3)).get().text());
	}

	@Test
	void instantiator_prefersNoUnboxing() {
		Alternative<Label> alternative = Alternative.of(Label.class);
		assertEquals("boxed 5", alternative.instantiator(List.of(5, 5)).get().text());
	}

	@Test
	void instantiator_noMatch_throwsEagerly() {
		Alternative<Label> alternative = Alternative.of(Label.class);
		assertThrows(InvalidAlternativeException.class, () -> alternative.instantiator(List.of(1.5, "x", "y")));
	}

	@Test
	void instantiator_ambiguous_throws() {
		InvalidAlternativeException e = assertThrows(InvalidAlternativeException.class, () ->
			Alternative.of(Ambiguous.class).instantiator(List.of("text")));
		assertThat(e.getMessage(), containsString("Ambiguous"));
	}

	@Test
	void instantiator_boxed() {
		Alternative<Long> alternative = Alternative.of(Long.class);
		assertThat(alternative.instantiator(List.of()).get(), equalTo(0L));
		assertThat(alternative.instantiator(List.of(5)).get(), equalTo(5L));
		assertThrows(InvalidAlternativeException.class, () -> alternative.instantiator(List.of(5.0)));
	}

	@Test
	void instantiator_interface_takesInstance() {
		Alternative<CharSequence> alternative = Alternative.of(CharSequence.class);
		assertEquals("abc", alternative.instantiator(List.of("abc")).get());
		assertThrows(InvalidAlternativeException.class, () -> alternative.instantiator(List.of()));
	}

	@Test
	void instantiator_constructorThrows_wrapsCause() {
		Supplier<Label> instantiator = Alternative.of(Label.class).instantiator(List.of("x", -1));
		AlternativeConstructionException e = assertThrows(AlternativeConstructionException.class, instantiator::get);
		assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
	}

	@Test
	void assign_assignable_inPlace() {
		Resource.Counters counters = new Resource.Counters();
		Resource current = new Resource(counters, "old");
		Resource result = Alternative.of(Resource.class).assign(current, new Resource(counters, "new"));
		assertSame(current, result);
		assertEquals("new", current.label());
		assertEquals(1, counters.assignments());
	}

	@Test
	void assign_notAssignable_replaces() {
		Alternative<ArrayList> alternative = Alternative.of(ArrayList.class);
		ArrayList<String> source = new ArrayList<>(List.of("a"));
		assertSame(source, alternative.assign(new ArrayList<>(), source));
		ArrayList<?> copied = alternative.assignCopy(new ArrayList<>(), source);
		assertNotSame(source, copied);
		assertEquals(source, copied);
	}

	@Test
	void destroy_closes() {
		Resource.Counters counters = new Resource.Counters();
		Alternative.of(Resource.class).destroy(new Resource(counters, "r"));
		assertEquals(1, counters.closes());
	}

	@Test
	void destroy_checkedException_wrapped() {
		assertThrows(IllegalStateException.class, () -> Alternative.of(Stubborn.class).destroy(new Stubborn()));
	}

	@Test
	void naturalOrdering() {
		Alternative<String> alternative = Alternative.of(String.class);
		assertTrue(alternative.isOrdered());
		assertTrue(alternative.compare("a", "b") < 0);
	}

	@Test
	void explicitComparator() {
		Alternative<Celsius> alternative = Alternative.builder(Celsius.class)
			.comparator(Comparator.comparingDouble(Celsius::degrees))
			.build();
		assertTrue(alternative.compare(new Celsius(30.0), new Celsius(10.0)) > 0);
	}

	@Test
	void unordered_compareThrows() {
		Alternative<Celsius> alternative = Alternative.of(Celsius.class);
		assertFalse(alternative.isOrdered());
		assertThrows(InvalidAlternativeException.class, () -> alternative.compare(new Celsius(1.0), new Celsius(2.0)));
	}

	@Test
	void invalidType_rejected() {
		assertThrows(InvalidAlternativeException.class, () -> Alternative.of(int.class));
	}

	@Test
	void closeableWithoutAssignable_rejected() {
		InvalidAlternativeException e = assertThrows(InvalidAlternativeException.class, () -> Alternative.of(Unassignable.class));
		assertThat(e.getMessage(), containsString("Assignable"));
		assertThrows(InvalidAlternativeException.class, () -> Alternative.of(Closeable.class));
	}

	@Test
	void noCopyConstructor_notCopyable() {
		Alternative<Tally> alternative = Alternative.of(Tally.class);
		assertFalse(alternative.isCopyable());
		assertThrows(InvalidAlternativeException.class, () -> alternative.copy(new Tally()));
		assertFalse(Alternative.of(CharSequence.class).isCopyable());
		assertFalse(Alternative.of(Resource.Counters.class).isCopyable());
	}

	@Test
	void explicitCopier_makesCopyable() {
		Alternative<Tally> alternative = Alternative.builder(Tally.class)
			.copier(t -> {
				Tally result = new Tally();
				result.count = t.count;
				return result;
			})
			.build();
		Tally original = new Tally();
		original.count = 3;
		Tally copy = alternative.copy(original);
		assertNotSame(original, copy);
		assertEquals(3, copy.count);
	}

	@Test
	void equality_discoveredSettingsAgree() {
		assertEquals(Alternative.of(Label.class), Alternative.of(Label.class));
		assertEquals(Alternative.of(Label.class).hashCode(), Alternative.of(Label.class).hashCode());
		assertNotEquals(Alternative.of(String.class), Alternative.of(CharSequence.class));
	}

	@Test
	void equality_explicitSettingsCompared() {
		Comparator<Celsius> byDegrees = Comparator.comparingDouble(Celsius::degrees);
		assertEquals(
			Alternative.builder(Celsius.class).comparator(byDegrees).build(),
			Alternative.builder(Celsius.class).comparator(byDegrees).build());
		assertNotEquals(
			Alternative.builder(Celsius.class).comparator(byDegrees).build(),
			Alternative.builder(Celsius.class).comparator(byDegrees.reversed()).build());
		assertNotEquals(
			Alternative.of(Celsius.class),
			Alternative.builder(Celsius.class).comparator(byDegrees).build());
	}

	@Test
	void builder_canBuildRepeatedly() {
		Alternative.Builder<StringBuilder> builder = Alternative.builder(StringBuilder.class)
			.convertingFrom(Integer.class, i -> new StringBuilder("#" + i));
		Alternative<StringBuilder> first = builder.build();
		Alternative<StringBuilder> second = builder.build();
		assertEquals(first, second);
		assertEquals("#7", second.convert(7).toString());
		assertEquals("", second.defaultInstantiator().get().toString());
		assertTrue(second.isCopyable());
		assertTrue(second.isOrdered());
	}

	public record Celsius(double degrees) {
		public Celsius {
			if (degrees < -273.15) {
				throw new IllegalArgumentException("Below absolute zero: " + degrees);
			}
		}

		@Implicit
		public static Celsius fromDegrees(double degrees) {
			return new Celsius(degrees);
		}
	}

	public static final class Label {
		private final String text;

		@Implicit
		public Label(String text) {
			this.text = text;
		}

		@Implicit
		public Label(Integer value) {
			this("int " + value);
		}

		@Implicit
		public Label(Long value) {
			this("long " + value);
		}

		public Label(String text, char suffix) {
			this(text + suffix);
		}

		public Label(String text, int repeat) {
			this(repeatOrThrow(text, repeat));
		}

		public Label(Integer first, Integer second) {
			this("boxed " + first);
		}

		public Label(int first, int second) {
			this("primitive " + first);
		}

		public String text() {
			return text;
		}

		private static String repeatOrThrow(String text, int repeat) {
			if (repeat < 0) {
				throw new IllegalArgumentException("Negative repeat: " + repeat);
			}
			return text.repeat(repeat);
		}
	}

	public static final class Ambiguous {
		public Ambiguous(CharSequence text) { }
		public Ambiguous(Comparable<?> value) { }
	}

	public static final class InstanceImplicit {
		@Implicit
		public InstanceImplicit from(String text) {
			return this;
		}
	}

	public static final class TwoParameterImplicit {
		@Implicit
		public TwoParameterImplicit(String a, String b) { }
	}

	public static final class Stubborn implements AutoCloseable, Assignable<Stubborn> {
		@Override
		public void assignFrom(Stubborn source) { }

		@Override
		public void close() throws Exception {
			throw new Exception("Won't close");
		}
	}

	public static final class Unassignable implements AutoCloseable {
		@Override
		public void close() { }
	}

	public static final class Tally {
		public int count;
	}
}

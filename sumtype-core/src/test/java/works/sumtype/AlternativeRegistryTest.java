package works.sumtype;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.sumtype.exceptions.InvalidAlternativeException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.sumtype.AlternativeRegistry.IS_CONVERTIBLE;
import static works.sumtype.AlternativeRegistry.SAME_TYPE;
import static works.sumtype.AlternativeRegistry.findMatchingType;
import static works.sumtype.AlternativeRegistry.findUniqueMatchingType;
import static works.sumtype.AlternativeRegistry.isInRange;
import static works.sumtype.AlternativeRegistry.isUnique;
import static works.sumtype.AlternativeRegistry.occurrenceCount;
import static works.sumtype.AlternativeRegistry.position;

class AlternativeRegistryTest {
	static final List<Class<?>> TYPES = List.of(Integer.class, String.class, Long.class, String.class);

	@Test
	void position_findsFirstOccurrence() {
		assertEquals(0, position(Integer.class, TYPES));
		assertEquals(1, position(String.class, TYPES));
		assertEquals(2, position(Long.class, TYPES));
	}

	@Test
	void position_absent_returnsSize() {
		assertEquals(TYPES.size(), position(Double.class, TYPES));
	}

	@Test
	void occurrenceCount_countsMatches() {
		assertEquals(2, occurrenceCount(SAME_TYPE, String.class, TYPES));
		assertEquals(1, occurrenceCount(SAME_TYPE, Integer.class, TYPES));
		assertEquals(0, occurrenceCount(SAME_TYPE, Double.class, TYPES));

		// Integer widens to Integer and Long
		assertEquals(2, occurrenceCount(IS_CONVERTIBLE, Integer.class, TYPES));
	}

	@Test
	void isUnique_requiresExactlyOne() {
		assertTrue(AlternativeRegistry.isUnique(Integer.class, TYPES));
		assertFalse(AlternativeRegistry.isUnique(String.class, TYPES));
		assertFalse(AlternativeRegistry.isUnique(Double.class, TYPES));
	}

	@Test
	void isInRange_bounds() {
		assertFalse(AlternativeRegistry.isInRange(-1, 4));
		assertTrue (AlternativeRegistry.isInRange(0, 4));
		assertTrue (AlternativeRegistry.isInRange(3, 4));
		assertFalse(AlternativeRegistry.isInRange(4, 4));
	}

	@Test
	void findMatchingType_returnsFirstMatch() {
		assertEquals(0, findMatchingType(IS_CONVERTIBLE, Short.class, TYPES));
		assertEquals(2, findMatchingType(IS_CONVERTIBLE, Long.class, TYPES));
		assertEquals(1, findMatchingType(IS_CONVERTIBLE, String.class, TYPES));
	}

	@Test
	void findMatchingType_noMatch_throws() {
		InvalidAlternativeException e = assertThrows(InvalidAlternativeException.class, () ->
			findMatchingType(IS_CONVERTIBLE, Double.class, TYPES));
		assertThat(e.getMessage(), containsString("Double"));
	}

	@Test
	void findUniqueMatchingType_ambiguous_throws() {
		InvalidAlternativeException e = assertThrows(InvalidAlternativeException.class, () ->
			findUniqueMatchingType(IS_CONVERTIBLE, Short.class, TYPES));
		assertThat(e.getMessage(), containsString("Ambiguous"));
	}

	@Test
	void findUniqueMatchingType_uniqueMatch_returnsIt() {
		assertEquals(2, findUniqueMatchingType(IS_CONVERTIBLE, Long.class, TYPES));
		assertEquals(0, findUniqueMatchingType(SAME_TYPE, Integer.class, TYPES));
	}

	@Test
	void isConvertible_followsJavaRules() {
		assertTrue(IS_CONVERTIBLE.test(Integer.class, Number.class));
		assertTrue(IS_CONVERTIBLE.test(int.class, Long.class));
		assertTrue(IS_CONVERTIBLE.test(Character.class, Integer.class));
		assertTrue(IS_CONVERTIBLE.test(String.class, CharSequence.class));
		assertFalse(IS_CONVERTIBLE.test(Long.class, Integer.class));
		assertFalse(IS_CONVERTIBLE.test(Double.class, Float.class));
		assertFalse(IS_CONVERTIBLE.test(Boolean.class, Integer.class));
		assertFalse(IS_CONVERTIBLE.test(CharSequence.class, String.class));
		assertTrue(isUnique(Long.class, TYPES));
		assertTrue(isInRange(position(Long.class, TYPES), TYPES.size()));
	}
}

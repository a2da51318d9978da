package works.sumtype;

import java.util.ArrayList;
import java.util.List;
import works.sumtype.exceptions.BadVariantAccessException;
import works.sumtype.exceptions.InvalidAlternativeException;

/**
 * Multi-way dispatch on the alternatives currently held by one or more variants.
 */
public final class Visitation {
	private Visitation() {}

	/**
	 * Calls the one case of <code>visitor</code> that matches the types of the alternatives
	 * the given variants currently hold, passing it their values, and returns its result.
	 *
	 * <p>
	 * The visitor must be able to handle any combination of alternatives the variants
	 * could hold, not just the current one. This is checked before any case is called,
	 * and the result is remembered, so a visitor that's missing a case fails on first use
	 * no matter what the variants hold at the time.
	 *
	 * @throws InvalidAlternativeException if <code>visitor</code> lacks a case for some combination
	 * @throws BadVariantAccessException if any of the variants is valueless
	 */
	public static <R> R visit(Visitor<R> visitor, VariantView... variants) {
		List<Alternatives> alternativeSets = new ArrayList<>(variants.length);
		for (VariantView variant: variants) {
			alternativeSets.add(variant.alternatives());
		}
		visitor.checkCoverage(alternativeSets);

		List<Class<?>> combination = new ArrayList<>(variants.length);
		List<Object> values = new ArrayList<>(variants.length);
		for (VariantView variant: variants) {
			int index = variant.index();
			if (index == Variant.VALUELESS) {
				throw BadVariantAccessException.valueless("visit");
			}
			combination.add(variant.alternatives().typeAt(index));
			values.add(variant.get(index));
		}
		return visitor.dispatch(combination, values);
	}
}

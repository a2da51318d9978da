package works.sumtype;

/**
 * How {@link Alternatives} picks an alternative for a value whose class
 * is not exactly one of the alternative types.
 * An exact match always wins under either policy.
 */
public enum ConversionPolicy {
	/**
	 * The value must be convertible to exactly one alternative;
	 * if several could accept it, the request is rejected as ambiguous.
	 */
	UNIQUE_MATCH,

	/**
	 * The first convertible alternative in declaration order is chosen,
	 * even if later ones could also accept the value.
	 */
	FIRST_MATCH,
}

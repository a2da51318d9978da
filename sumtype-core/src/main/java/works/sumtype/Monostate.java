package works.sumtype;

/**
 * An alternative with no data.
 *
 * <p>
 * A variant is default-constructed as its first alternative, so a set of alternatives
 * none of which can be default-constructed can be made default-constructible by
 * putting <code>Monostate</code> first.
 * All instances are equal, and compare as equal.
 */
public record Monostate() implements Comparable<Monostate> {
	public static final Monostate INSTANCE = new Monostate();

	@Override
	public int compareTo(Monostate other) {
		return 0;
	}

	@Override
	public String toString() {
		return "Monostate";
	}
}

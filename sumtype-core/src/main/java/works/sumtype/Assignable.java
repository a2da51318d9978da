package works.sumtype;

/**
 * Implemented by alternative types whose instances can take on the state of
 * another instance in place.
 *
 * <p>
 * When a variant is assigned a value of the alternative it already holds, it calls
 * {@link #assignFrom} on the value it holds instead of discarding it.
 * The held object keeps its identity, and is never {@link AutoCloseable#close closed}
 * as a result of the assignment. If <code>assignFrom</code> throws, the variant still
 * holds the same object, in whatever state <code>assignFrom</code> left it.
 *
 * <p>
 * Alternatives that don't implement this are simply replaced by the assigned value.
 * {@link AutoCloseable} alternatives must implement it, since a replaced value would never be closed.
 */
public interface Assignable<T> {
	void assignFrom(T source);
}

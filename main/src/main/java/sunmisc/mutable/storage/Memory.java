package sunmisc.mutable.storage;

/**
 * A fixed-length buffer of element slots laid out by a {@link Storage}.
 * <p>Slots are addressed by index in {@code [0, length())}; indexes
 * outside that range are a caller error and implementations are not
 * required to detect them.
 * <p>A write never cleans up the previous occupant: callers that
 * own the occupant must {@link #release} it first, callers that moved
 * it elsewhere must {@link #clear} it.
 *
 * @param <E> the type of elements held in this buffer
 */
public interface Memory<E> {

    E fetch(int index) throws IndexOutOfBoundsException;

    void store(int index, E value) throws IndexOutOfBoundsException;

    int length();

    /**
     * Forgets the occupant of the slot without releasing it,
     * the occupant has been handed over to someone else
     */
    default void clear(final int index) throws IndexOutOfBoundsException { }

    /**
     * Clears the slot, then releases its former occupant
     */
    default void release(final int index) throws IndexOutOfBoundsException {
        final E payload = this.fetch(index);
        this.clear(index);
        if (payload != null) {
            this.dispose(payload);
        }
    }

    /**
     * Runs the release action of this layout on a payload that
     * is no longer held by any slot
     */
    default void dispose(final E payload) { }

    /**
     * Releases every occupant still held by this buffer. A failing
     * release does not stop the others, the first failure is rethrown
     * with the rest suppressed
     */
    default void free() {
        RuntimeException failure = null;
        for (int i = 0, n = this.length(); i < n; ++i) {
            try {
                this.release(i);
            } catch (final RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}

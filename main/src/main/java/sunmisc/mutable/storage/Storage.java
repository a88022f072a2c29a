package sunmisc.mutable.storage;

/**
 * Element layout policy: decides how a buffer of a fixed element
 * type is laid out and how its slots are read and written.
 * <p>For any slot, a {@link Memory#fetch} following a {@link Memory#store}
 * with no intervening write returns an equivalent element:
 * bit-for-bit for value layouts, the same reference for {@link Indirected}.
 *
 * @param <E> the type of elements
 */
public interface Storage<E> {

    int MAXIMUM_CAPACITY = 1 << 30;

    /**
     * @param capacity number of slots
     * @return a buffer with exactly {@code capacity} slots
     * @throws OutOfMemoryError if the buffer cannot be allocated
     */
    Memory<E> allocate(int capacity) throws OutOfMemoryError;

    /**
     * @return bytes occupied by one element in a buffer
     */
    int width();
}

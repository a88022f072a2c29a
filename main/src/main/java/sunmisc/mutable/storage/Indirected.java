package sunmisc.mutable.storage;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * Stores references to heap-allocated payloads, so any element type
 * is accepted. The buffer owns every payload it holds: the release
 * action runs when a payload is {@link Memory#release released}, never when
 * it is {@link Memory#clear cleared} or overwritten.
 *
 * @param <E> the type of elements
 */
public final class Indirected<E> implements Storage<E> {
    /**
     * Width of a compressed reference, the common case on 64-bit VMs
     */
    public static final int REFERENCE_WIDTH = 4;

    private static final Indirected<?> RETAINING = new Indirected<>(x -> { });

    private final Consumer<? super E> releaser;

    public Indirected(@NotNull final Consumer<? super E> releaser) {
        this.releaser = Objects.requireNonNull(releaser);
    }

    /**
     * @return a strategy whose release action does nothing,
     * payloads are left to the garbage collector
     */
    @SuppressWarnings("unchecked")
    public static <E> Indirected<E> retaining() {
        return (Indirected<E>) RETAINING;
    }

    /**
     * @return a strategy that closes {@link AutoCloseable} payloads on release
     */
    public static <E> Indirected<E> closing() {
        return new Indirected<>(payload -> {
            if (payload instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (final Exception e) {
                    throw new ReleaseException(payload, e);
                }
            }
        });
    }

    @Override
    public Memory<E> allocate(final int capacity) {
        if (capacity < 0 || capacity > MAXIMUM_CAPACITY) {
            throw new OutOfMemoryError("Required array size too large");
        }
        return new Handles<>(new Object[capacity], this.releaser);
    }

    @Override
    public int width() {
        return REFERENCE_WIDTH;
    }

    @Override
    public String toString() {
        return "Indirected";
    }

    @SuppressWarnings("unchecked")
    private record Handles<E>(
            Object[] array,
            Consumer<? super E> releaser
    ) implements Memory<E> {

        @Override
        public int length() {
            return this.array.length;
        }

        @Override
        public E fetch(final int index) {
            return (E) this.array[index];
        }

        @Override
        public void store(final int index, final E value) {
            this.array[index] = Objects.requireNonNull(value);
        }

        @Override
        public void clear(final int index) {
            this.array[index] = null;
        }

        @Override
        public void dispose(final E payload) {
            this.releaser.accept(payload);
        }

        @Override
        public String toString() {
            final StringJoiner joiner = new StringJoiner(
                    ", ", "[", "]");
            for (final Object x : this.array) {
                joiner.add(Objects.toString(x));
            }
            return joiner.toString();
        }
    }
}

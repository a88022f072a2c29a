package sunmisc.mutable.storage;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Serializes every element into a fixed-size slot of a single byte buffer,
 * slot {@code i} occupies bytes {@code [i * width, (i + 1) * width)}.
 *
 * @param <E> the type of elements
 */
public final class Marshalled<E> implements Storage<E> {
    private final Marshaller<E> marshaller;

    public Marshalled(final Marshaller<E> marshaller) {
        if (marshaller.width() <= 0) {
            throw new IllegalArgumentException(
                    "Marshalled width must be positive: " + marshaller.width());
        }
        this.marshaller = marshaller;
    }

    @Override
    public Memory<E> allocate(final int capacity) {
        final long bytes = (long) capacity * this.marshaller.width();
        if (capacity < 0 || bytes > Integer.MAX_VALUE) {
            throw new OutOfMemoryError("Required array size too large");
        }
        return new Area<>(this.marshaller, ByteBuffer.allocate((int) bytes), capacity);
    }

    @Override
    public int width() {
        return this.marshaller.width();
    }

    @Override
    public String toString() {
        return "Marshalled[" + this.marshaller.width() + ']';
    }

    private record Area<E>(
            Marshaller<E> marshaller,
            ByteBuffer bytes,
            int length
    ) implements Memory<E> {

        @Override
        public E fetch(final int index) {
            return this.marshaller.read(slot(index));
        }

        @Override
        public void store(final int index, final E value) {
            Objects.requireNonNull(value);
            final ByteBuffer slot = slot(index);
            this.marshaller.write(value, slot);
            if (slot.hasRemaining()) {
                throw new IllegalStateException(String.format(
                        "Marshaller left %s of %s bytes unwritten",
                        slot.remaining(), this.marshaller.width()
                ));
            }
        }

        @Override
        public void release(final int index) { }

        @Override
        public void free() { }

        private ByteBuffer slot(final int index) {
            final int width = this.marshaller.width();
            Objects.checkIndex(index, this.length);
            return this.bytes.slice(index * width, width);
        }

        @Override
        public String toString() {
            final StringJoiner joiner = new StringJoiner(
                    ", ", "[", "]");
            for (int i = 0; i < this.length; ++i) {
                joiner.add(Objects.toString(fetch(i)));
            }
            return joiner.toString();
        }
    }
}

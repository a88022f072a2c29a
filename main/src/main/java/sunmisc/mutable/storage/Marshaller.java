package sunmisc.mutable.storage;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Deterministic fixed-width byte encoding of an element.
 * <p>{@link #write} receives a buffer positioned at the start of the slot
 * with exactly {@link #width()} bytes remaining, {@link #read} receives
 * the same window.
 *
 * @param <E> the type of elements
 */
public interface Marshaller<E> {

    Marshaller<Integer> INT = new Marshaller<>() {
        @Override public int width() { return Integer.BYTES; }

        @Override public void write(final Integer value, final ByteBuffer slot) { slot.putInt(value); }

        @Override public Integer read(final ByteBuffer slot) { return slot.getInt(); }
    };

    Marshaller<Long> LONG = new Marshaller<>() {
        @Override public int width() { return Long.BYTES; }

        @Override public void write(final Long value, final ByteBuffer slot) { slot.putLong(value); }

        @Override public Long read(final ByteBuffer slot) { return slot.getLong(); }
    };

    Marshaller<Double> DOUBLE = new Marshaller<>() {
        @Override public int width() { return Double.BYTES; }

        @Override public void write(final Double value, final ByteBuffer slot) {
            slot.putLong(Double.doubleToRawLongBits(value));
        }

        @Override public Double read(final ByteBuffer slot) {
            return Double.longBitsToDouble(slot.getLong());
        }
    };

    int width();

    void write(@NotNull E value, @NotNull ByteBuffer slot);

    @NotNull E read(@NotNull ByteBuffer slot);

    /**
     * Length-prefixed UTF-8 text padded with zeros up to
     * {@code Integer.BYTES + maxBytes}
     *
     * @param maxBytes the largest encoded length accepted
     */
    static Marshaller<String> utf8(final int maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes < 0: " + maxBytes);
        }
        return new Utf8(maxBytes);
    }

    record Utf8(int maxBytes) implements Marshaller<String> {

        @Override
        public int width() {
            return Integer.BYTES + this.maxBytes;
        }

        @Override
        public void write(final String value, final ByteBuffer slot) {
            final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            if (bytes.length > this.maxBytes) {
                throw new IllegalArgumentException(String.format(
                        "Encoded length %s exceeds slot width %s",
                        bytes.length, this.maxBytes
                ));
            }
            slot.putInt(bytes.length).put(bytes);
            for (int i = bytes.length; i < this.maxBytes; ++i) {
                slot.put((byte) 0);
            }
        }

        @Override
        public String read(final ByteBuffer slot) {
            final byte[] bytes = new byte[slot.getInt()];
            slot.get(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}

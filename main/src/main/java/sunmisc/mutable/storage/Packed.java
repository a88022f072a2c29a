package sunmisc.mutable.storage;

import java.util.Arrays;
import java.util.StringJoiner;
import java.util.function.IntFunction;

/**
 * Packs elements in their native primitive layout, one array slot per
 * element with no indirection.
 * <p>Supported component types: {@code byte, short, char, int, long,
 * float, double, boolean}. Floating point values are stored through their
 * raw bits so that every NaN payload survives a round trip.
 *
 * @author Sunmisc Unsafe
 * @param <E> the boxed counterpart of the component type
 */
@SuppressWarnings("unchecked")
public final class Packed<E> implements Storage<E> {
    private final Class<E> componentType;
    private final int width;
    private final IntFunction<Memory<E>> mapping;

    private Packed(final Class<E> componentType,
                   final int width,
                   final IntFunction<Memory<E>> mapping) {
        this.componentType = componentType;
        this.width = width;
        this.mapping = mapping;
    }

    public static <E> Packed<E> of(final Class<E> componentType) {
        final IntFunction<Memory<E>> map;
        final int width;
        if (componentType == byte.class || componentType == Byte.class) {
            map = len -> (Memory<E>) new AreaBytes(new byte[len]);
            width = Byte.BYTES;
        } else if (componentType == short.class || componentType == Short.class) {
            map = len -> (Memory<E>) new AreaShorts(new short[len]);
            width = Short.BYTES;
        } else if (componentType == char.class || componentType == Character.class) {
            map = len -> (Memory<E>) new AreaChars(new char[len]);
            width = Character.BYTES;
        } else if (componentType == int.class || componentType == Integer.class) {
            map = len -> (Memory<E>) new AreaInts(new int[len]);
            width = Integer.BYTES;
        } else if (componentType == long.class || componentType == Long.class) {
            map = len -> (Memory<E>) new AreaLongs(new long[len]);
            width = Long.BYTES;
        } else if (componentType == float.class || componentType == Float.class) {
            map = len -> (Memory<E>) new AreaFloats(new int[len]);
            width = Float.BYTES;
        } else if (componentType == double.class || componentType == Double.class) {
            map = len -> (Memory<E>) new AreaDoubles(new long[len]);
            width = Double.BYTES;
        } else if (componentType == boolean.class || componentType == Boolean.class) {
            map = len -> (Memory<E>) new AreaBooleans(new boolean[len]);
            width = 1;
        } else {
            throw new IllegalArgumentException(
                    String.format("Component type %s cannot be packed", componentType));
        }
        return new Packed<>(componentType, width, map);
    }

    @Override
    public Memory<E> allocate(final int capacity) {
        if (capacity < 0 || capacity > MAXIMUM_CAPACITY) {
            throw new OutOfMemoryError("Required array size too large");
        }
        return this.mapping.apply(capacity);
    }

    @Override
    public int width() {
        return this.width;
    }

    @Override
    public String toString() {
        return "Packed[" + this.componentType.getSimpleName() + ']';
    }

    private interface Area<E> extends Memory<E> {
        @Override
        default void release(final int index) { }

        @Override
        default void free() { }
    }

    private record AreaBytes(byte[] array) implements Area<Byte> {

        @Override public int length()
        { return this.array.length; }

        @Override public Byte fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Byte value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
    private record AreaShorts(short[] array) implements Area<Short> {

        @Override public int length()
        { return this.array.length; }

        @Override public Short fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Short value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
    private record AreaChars(char[] array) implements Area<Character> {

        @Override public int length()
        { return this.array.length; }

        @Override public Character fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Character value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
    private record AreaInts(int[] array) implements Area<Integer> {

        @Override public int length()
        { return this.array.length; }

        @Override public Integer fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Integer value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
    private record AreaLongs(long[] array) implements Area<Long> {

        @Override public int length()
        { return this.array.length; }

        @Override public Long fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Long value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
    private record AreaFloats(int[] bits) implements Area<Float> {

        @Override public int length()
        { return this.bits.length; }

        @Override public Float fetch(final int index)
        { return Float.intBitsToFloat(this.bits[index]); }

        @Override public void store(final int index, final Float value)
        { this.bits[index] = Float.floatToRawIntBits(value); }

        @Override public String toString() {
            final StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (int i = 0; i < this.bits.length; ++i) {
                joiner.add(String.valueOf(fetch(i)));
            }
            return joiner.toString();
        }
    }
    private record AreaDoubles(long[] bits) implements Area<Double> {

        @Override public int length()
        { return this.bits.length; }

        @Override public Double fetch(final int index)
        { return Double.longBitsToDouble(this.bits[index]); }

        @Override public void store(final int index, final Double value)
        { this.bits[index] = Double.doubleToRawLongBits(value); }

        @Override public String toString() {
            final StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (int i = 0; i < this.bits.length; ++i) {
                joiner.add(String.valueOf(fetch(i)));
            }
            return joiner.toString();
        }
    }
    private record AreaBooleans(boolean[] array) implements Area<Boolean> {

        @Override public int length()
        { return this.array.length; }

        @Override public Boolean fetch(final int index)
        { return this.array[index]; }

        @Override public void store(final int index, final Boolean value)
        { this.array[index] = value; }

        @Override public String toString()
        { return Arrays.toString(this.array); }
    }
}

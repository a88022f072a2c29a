package sunmisc.mutable.storage;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Single-slot buffer over a reference cell supplied by the host,
 * e.g. an {@link java.util.concurrent.atomic.AtomicReference} or
 * a field accessor pair
 *
 * @param <E> the type of the element
 */
public final class SlotMemory<E> implements Memory<E> {
    private final Supplier<? extends E> getter;
    private final Consumer<? super E> setter;

    public SlotMemory(final Supplier<? extends E> getter,
                      final Consumer<? super E> setter) {
        this.getter = Objects.requireNonNull(getter);
        this.setter = Objects.requireNonNull(setter);
    }

    @Override
    public E fetch(final int index) {
        Objects.checkIndex(index, 1);
        return this.getter.get();
    }

    @Override
    public void store(final int index, final E value) {
        Objects.checkIndex(index, 1);
        this.setter.accept(value);
    }

    @Override
    public int length() {
        return 1;
    }

    @Override
    public void free() { }

    @Override
    public String toString() {
        return "[" + this.getter.get() + ']';
    }
}

package sunmisc.mutable.cell;

import org.jetbrains.annotations.NotNull;
import sunmisc.mutable.scope.Scope;
import sunmisc.mutable.storage.Memory;
import sunmisc.mutable.storage.SlotMemory;
import sunmisc.mutable.storage.Storage;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A single mutable slot laid out by a {@link Storage}.
 * <p>Updates are plain read-modify-write sequences, a cell has one owner
 * and is confined to the {@link Scope} it was created in. The element is
 * released when the cell is closed, or when its scope closes.
 *
 * @param <E> the type of the element
 */
public final class Cell<E> implements AutoCloseable {
    private final Memory<E> memory;
    private final Scope scope;
    private boolean closed;

    public Cell(@NotNull final Storage<E> storage, @NotNull final E initial) {
        this(storage.allocate(1));
        this.memory.store(0, Objects.requireNonNull(initial));
    }

    private Cell(final Memory<E> memory) {
        this.memory = memory;
        this.scope = Scope.current();
        this.scope.onClose(this::close);
    }

    /**
     * Wraps a reference cell owned by the host, the current value of the
     * host cell is kept
     */
    public static <E> Cell<E> over(final Supplier<? extends E> getter,
                                   final Consumer<? super E> setter) {
        return new Cell<>(new SlotMemory<>(getter, setter));
    }

    public E get() {
        checkOpen();
        return this.memory.fetch(0);
    }

    /**
     * Replaces the element, then releases the previous one
     */
    public void set(@NotNull final E value) {
        Objects.requireNonNull(value);
        checkOpen();
        replace(value);
    }

    /**
     * Replaces the element and hands the previous one to the caller
     * without releasing it
     */
    public E swap(@NotNull final E value) {
        Objects.requireNonNull(value);
        checkOpen();
        final E old = this.memory.fetch(0);
        this.memory.clear(0);
        this.memory.store(0, value);
        return old;
    }

    /**
     * @return the new element
     */
    public E modify(@NotNull final UnaryOperator<E> operator) {
        checkOpen();
        final E value = Objects.requireNonNull(
                operator.apply(this.memory.fetch(0)));
        replace(value);
        return value;
    }

    public Scope scope() {
        return this.scope;
    }

    /**
     * Releases the element, a closed cell rejects every further access
     */
    @Override
    public void close() {
        this.scope.check();
        if (!this.closed) {
            this.closed = true;
            this.memory.free();
        }
    }

    // the new element is in place before foreign release code runs
    private void replace(final E value) {
        final E old = this.memory.fetch(0);
        if (old != value) {
            this.memory.clear(0);
            this.memory.store(0, value);
            this.memory.dispose(old);
        }
    }

    private void checkOpen() {
        this.scope.check();
        if (this.closed) {
            throw new IllegalStateException("Cell is closed");
        }
    }

    @Override
    public String toString() {
        return this.closed ? "Cell[closed]" : "Cell[" + this.memory.fetch(0) + ']';
    }
}

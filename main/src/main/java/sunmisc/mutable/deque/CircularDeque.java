package sunmisc.mutable.deque;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sunmisc.mutable.Cursor;
import sunmisc.mutable.capability.Collection;
import sunmisc.mutable.capability.DoubleEnded;
import sunmisc.mutable.scope.Scope;
import sunmisc.mutable.storage.Memory;
import sunmisc.mutable.storage.Storage;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * A growable double-ended queue over a circular buffer laid out
 * by a {@link Storage}.
 * <p>Pushes and pops at both ends run in amortized O(1): the buffer
 * doubles when full and halves when at most a quarter of it is in use,
 * never dropping below the minimum capacity.
 * <p>The deque has a single owner and is confined to the {@link Scope}
 * it was created in.
 *
 * @author Sunmisc Unsafe
 * @param <E> the type of elements held in this deque
 */
public final class CircularDeque<E>
        implements DoubleEnded<E>, Iterable<E>, AutoCloseable {
    /*
     * Overview:
     *
     * Logical element i lives in slot (head + i) & (capacity - 1),
     * the capacity is always zero or a power of two
     *
     * The buffer is allocated lazily, a fresh deque holds an empty
     * buffer until the first push
     *
     * Relocation (grow or shrink) allocates the new buffer first,
     * so an allocation failure leaves the deque untouched; then moves
     * the live elements to slots 0..size-1 in logical order, clearing
     * each old slot so that an Indirected payload is owned by exactly
     * one buffer at any time, and finally frees the old buffer
     *
     * Popped slots are cleared, not released: the element is handed
     * over to the caller. Shrinking is optional, a failed shrink keeps
     * the larger buffer
     *
     * clear detaches the buffer before releasing its payloads, so a
     * failing release action cannot leave a released element live
     */
    private static final Logger LOG = LoggerFactory.getLogger(CircularDeque.class);

    /* ---------------- Constants -------------- */

    public static final int DEFAULT_MIN_CAPACITY = 4;

    /* ---------------- Field -------------- */
    private final Storage<E> storage;
    private final int minCapacity;
    private final Scope scope;
    private Memory<E> memory;
    private int head, size;

    public CircularDeque(@NotNull final Storage<E> storage) {
        this(storage, DEFAULT_MIN_CAPACITY);
    }

    /**
     * @param minCapacity rounded up to a power of two
     */
    public CircularDeque(@NotNull final Storage<E> storage,
                         final int minCapacity) {
        if (minCapacity <= 0 || minCapacity > Storage.MAXIMUM_CAPACITY) {
            throw new IllegalArgumentException(
                    "Illegal minimum capacity: " + minCapacity);
        }
        this.storage = Objects.requireNonNull(storage);
        this.minCapacity = tableSizeFor(minCapacity);
        this.scope = Scope.current();
        this.memory = storage.allocate(0);
        this.scope.onClose(this::close);
    }

    public static <E> Collection.Factory<E, CircularDeque<E>>
    factory(@NotNull final Storage<E> storage) {
        Objects.requireNonNull(storage);
        return () -> new CircularDeque<>(storage);
    }

    private static int tableSizeFor(final int c) {
        return c <= 1 ? 1 : (-1 >>> Integer.numberOfLeadingZeros(c - 1)) + 1;
    }

    @Override
    public void pushFront(@NotNull final E element) {
        Objects.requireNonNull(element);
        this.scope.check();
        if (this.size == this.memory.length()) {
            grow();
        }
        final int h = (this.head - 1) & (this.memory.length() - 1);
        this.memory.store(h, element);
        this.head = h;
        ++this.size;
    }

    @Override
    public void pushBack(@NotNull final E element) {
        Objects.requireNonNull(element);
        this.scope.check();
        if (this.size == this.memory.length()) {
            grow();
        }
        this.memory.store(slot(this.size), element);
        ++this.size;
    }

    @Override
    public Optional<E> popFront() {
        this.scope.check();
        if (this.size == 0) {
            return Optional.empty();
        }
        final int h = this.head;
        final E element = this.memory.fetch(h);
        this.memory.clear(h);
        this.head = (h + 1) & (this.memory.length() - 1);
        --this.size;
        shrinkIfSparse();
        return Optional.of(element);
    }

    @Override
    public Optional<E> popBack() {
        this.scope.check();
        if (this.size == 0) {
            return Optional.empty();
        }
        final int t = slot(this.size - 1);
        final E element = this.memory.fetch(t);
        this.memory.clear(t);
        --this.size;
        shrinkIfSparse();
        return Optional.of(element);
    }

    @Override
    public Optional<E> peekFront() {
        this.scope.check();
        return this.size == 0
                ? Optional.empty()
                : Optional.of(this.memory.fetch(this.head));
    }

    @Override
    public Optional<E> peekBack() {
        this.scope.check();
        return this.size == 0
                ? Optional.empty()
                : Optional.of(this.memory.fetch(slot(this.size - 1)));
    }

    /**
     * @param index logical position counted from the front
     */
    public E get(final int index) throws IndexOutOfBoundsException {
        this.scope.check();
        Objects.checkIndex(index, this.size);
        return this.memory.fetch(slot(index));
    }

    @Override
    public int size() {
        this.scope.check();
        return this.size;
    }

    public int capacity() {
        this.scope.check();
        return this.memory.length();
    }

    public int minCapacity() {
        return this.minCapacity;
    }

    public Scope scope() {
        return this.scope;
    }

    /**
     * Releases every element and drops the buffer. The deque is empty
     * afterwards even if a release action fails, the first failure is
     * rethrown with the rest suppressed
     */
    public void clear() {
        this.scope.check();
        final Memory<E> old = this.memory;
        this.memory = this.storage.allocate(0);
        this.head = this.size = 0;
        // moved and popped slots are cleared, only live payloads remain
        old.free();
    }

    /**
     * Same as {@link #clear()}, runs when the owning scope closes
     */
    @Override
    public void close() {
        clear();
    }

    /**
     * @return a cursor from front to back, valid until the next mutation
     */
    public Cursor<E> origin() {
        this.scope.check();
        return this.size == 0
                ? Cursor.empty()
                : new CursorImpl<>(this, 0);
    }

    @Override
    public Iterator<E> iterator() {
        return new Cursor.CursorAsIterator<>(origin());
    }

    private int slot(final int index) {
        return (this.head + index) & (this.memory.length() - 1);
    }

    private void grow() {
        final int n = this.memory.length();
        if (n >= Storage.MAXIMUM_CAPACITY) {
            throw new OutOfMemoryError("Required array size too large");
        }
        relocate(n == 0 ? this.minCapacity : n << 1);
    }

    private void shrinkIfSparse() {
        final int n = this.memory.length();
        if (n > this.minCapacity && this.size <= (n >>> 2)) {
            try {
                relocate(n >>> 1);
            } catch (final OutOfMemoryError e) {
                LOG.debug("Keeping {} slots for {} elements, shrink failed: {}",
                        n, this.size, e.getMessage());
            }
        }
    }

    private void relocate(final int capacity) {
        final Memory<E> old = this.memory;
        final Memory<E> fresh = this.storage.allocate(capacity);
        for (int i = 0, n = this.size; i < n; ++i) {
            final int from = slot(i);
            fresh.store(i, old.fetch(from));
            old.clear(from);
        }
        LOG.trace("Relocated {} elements: {} -> {} slots",
                this.size, old.length(), capacity);
        this.memory = fresh;
        this.head = 0;
        old.free();
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(
                ", ", "[", "]");
        for (int i = 0; i < this.size; ++i) {
            joiner.add(Objects.toString(this.memory.fetch(slot(i))));
        }
        return joiner.toString();
    }

    private record CursorImpl<E>(
            CircularDeque<E> deque,
            int index
    ) implements Cursor<E> {

        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public E element() {
            return this.deque.get(this.index);
        }

        @Override
        public Cursor<E> next() {
            final int nextIndex = this.index + 1;
            return nextIndex < this.deque.size()
                    ? new CursorImpl<>(this.deque, nextIndex)
                    : Cursor.empty();
        }
    }
}

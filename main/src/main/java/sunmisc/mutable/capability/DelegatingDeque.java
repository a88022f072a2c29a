package sunmisc.mutable.capability;

import org.jetbrains.annotations.NotNull;
import sunmisc.mutable.cell.Cell;
import sunmisc.mutable.storage.Indirected;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Exposes an existing {@link Deque} through the capability set,
 * the deque is held in a {@link Cell} so it can be swapped out whole
 *
 * @param <E> the type of elements
 */
public final class DelegatingDeque<E> implements DoubleEnded<E> {
    private final Cell<Deque<E>> cell;

    public DelegatingDeque() {
        this(new ArrayDeque<>());
    }

    public DelegatingDeque(@NotNull final Deque<E> deque) {
        this.cell = new Cell<>(Indirected.retaining(), deque);
    }

    public static <E> Collection.Factory<E, DelegatingDeque<E>> factory() {
        return DelegatingDeque::new;
    }

    /**
     * Replaces the backing deque
     *
     * @return the previous backing deque
     */
    public Deque<E> swap(@NotNull final Deque<E> deque) {
        return this.cell.swap(deque);
    }

    @Override
    public void pushFront(@NotNull final E element) {
        this.cell.get().addFirst(Objects.requireNonNull(element));
    }

    @Override
    public void pushBack(@NotNull final E element) {
        this.cell.get().addLast(Objects.requireNonNull(element));
    }

    @Override
    public Optional<E> popFront() {
        return Optional.ofNullable(this.cell.get().pollFirst());
    }

    @Override
    public Optional<E> popBack() {
        return Optional.ofNullable(this.cell.get().pollLast());
    }

    @Override
    public Optional<E> peekFront() {
        return Optional.ofNullable(this.cell.get().peekFirst());
    }

    @Override
    public Optional<E> peekBack() {
        return Optional.ofNullable(this.cell.get().peekLast());
    }

    @Override
    public int size() {
        return this.cell.get().size();
    }

    @Override
    public String toString() {
        return this.cell.get().toString();
    }
}

package sunmisc.mutable.capability;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Algorithms written once against the capability interfaces, so that
 * any container implementing them can be swapped in
 */
public final class Sequences {

    private Sequences() { }

    /**
     * Pops from the front until the source is empty
     *
     * @return the number of elements drained
     */
    public static <E> int drainFront(final PopFront<? extends E> source,
                                     final Consumer<? super E> action) {
        Objects.requireNonNull(action);
        int count = 0;
        for (Optional<? extends E> e; (e = source.popFront()).isPresent(); ++count) {
            action.accept(e.get());
        }
        return count;
    }

    public static <E> int drainBack(final PopBack<? extends E> source,
                                    final Consumer<? super E> action) {
        Objects.requireNonNull(action);
        int count = 0;
        for (Optional<? extends E> e; (e = source.popBack()).isPresent(); ++count) {
            action.accept(e.get());
        }
        return count;
    }

    /**
     * Moves every element from the front of the source to the
     * back of the target, preserving order
     */
    public static <E> int transfer(final PopFront<? extends E> source,
                                   final PushBack<? super E> target) {
        return drainFront(source, target::pushBack);
    }

    /**
     * Empties the source into a new collection holding its
     * elements in reverse order
     */
    public static <E, C extends Collection<E> & PushFront<E>>
    C reversed(final PopFront<? extends E> source,
               final Collection.Factory<E, C> factory) {
        final C target = factory.empty();
        drainFront(source, target::pushFront);
        return target;
    }

    /**
     * Rotates the sequence so that the element at {@code distance}
     * from the front becomes the front; a negative distance rotates
     * the other way
     */
    public static <E, C extends Collection<E> & PopFront<E> & PushBack<E>
            & PopBack<E> & PushFront<E>>
    void rotate(final C sequence, final int distance) {
        final int size = sequence.size();
        if (size == 0) {
            return;
        }
        final int steps = Math.floorMod(distance, size);
        if (steps <= size - steps) {
            for (int i = 0; i < steps; ++i) {
                sequence.popFront().ifPresent(sequence::pushBack);
            }
        } else {
            for (int i = steps; i < size; ++i) {
                sequence.popBack().ifPresent(sequence::pushFront);
            }
        }
    }

    @SafeVarargs
    public static <E, C extends PushBack<E>> C fill(final C target,
                                                    final E... elements) {
        for (final E e : elements) {
            target.pushBack(e);
        }
        return target;
    }
}

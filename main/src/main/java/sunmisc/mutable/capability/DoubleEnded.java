package sunmisc.mutable.capability;

import java.util.Optional;

/**
 * The full capability set of a double-ended sequence
 *
 * @param <E> the type of elements
 */
public interface DoubleEnded<E> extends Collection<E>,
        PushFront<E>, PushBack<E>,
        PopFront<E>, PopBack<E> {

    Optional<E> peekFront();

    Optional<E> peekBack();
}

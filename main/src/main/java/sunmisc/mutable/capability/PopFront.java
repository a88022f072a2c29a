package sunmisc.mutable.capability;

import java.util.Optional;

@FunctionalInterface
public interface PopFront<E> {

    /**
     * @return the removed front element, empty if there is none
     */
    Optional<E> popFront();
}

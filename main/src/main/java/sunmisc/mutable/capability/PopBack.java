package sunmisc.mutable.capability;

import java.util.Optional;

@FunctionalInterface
public interface PopBack<E> {

    /**
     * @return the removed back element, empty if there is none
     */
    Optional<E> popBack();
}

package sunmisc.mutable.capability;

/**
 * Root capability of every mutable sequence: an element type
 * and empty construction through a {@link Factory}
 *
 * @param <E> the type of elements
 */
public interface Collection<E> {

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }

    /**
     * Empty construction of a concrete collection, usually a
     * constructor reference
     *
     * @param <E> the type of elements
     * @param <C> the concrete collection
     */
    @FunctionalInterface
    interface Factory<E, C extends Collection<E>> {

        C empty();
    }
}

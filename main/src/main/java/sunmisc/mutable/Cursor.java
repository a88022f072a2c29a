package sunmisc.mutable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Immutable traversal position over a container. A cursor taken from a
 * container is valid until the container is next mutated.
 *
 * @param <E> the type of elements
 */
public interface Cursor<E> {

    Cursor<?> EMPTY = new Cursor<>() {
        @Override
        public boolean exists() {
            return false;
        }

        @Override
        public Cursor<Object> next() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Object element() {
            throw new NoSuchElementException();
        }
    };

    boolean exists();

    E element();

    Cursor<E> next();

    default void forEach(final Consumer<? super E> action) {
        for (Cursor<E> cursor = this; cursor.exists(); cursor = cursor.next()) {
            action.accept(cursor.element());
        }
    }

    @SuppressWarnings("unchecked")
    static <E> Cursor<E> empty() {
        return (Cursor<E>) EMPTY;
    }

    final class CursorAsIterator<E> implements Iterator<E> {
        private Cursor<E> cursor;

        public CursorAsIterator(final Cursor<E> origin) {
            this.cursor = origin;
        }

        @Override
        public boolean hasNext() {
            return this.cursor.exists();
        }

        @Override
        public E next() {
            final Cursor<E> prev = this.cursor;
            if (!prev.exists()) {
                throw new NoSuchElementException();
            }
            this.cursor = prev.next();
            return prev.element();
        }
    }
}

package sunmisc.mutable.list;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
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
 * A double-ended queue over a chain of nodes, each node keeps its
 * element in a one-slot buffer laid out by a {@link Storage}.
 * <p>Every operation runs in O(1) worst case, with no amortization
 * spikes. Nodes linked with {@link #linkFirst}/{@link #linkLast} can be
 * removed in O(1) through their {@link Handle}.
 * <p>The list has a single owner and is confined to the {@link Scope}
 * it was created in.
 *
 * @param <E> the type of elements held in this list
 */
public final class LinkedDeque<E>
        implements DoubleEnded<E>, Iterable<E>, AutoCloseable {
    /*
     * The list owns first, each node owns its next; prev links only
     * navigate. A node's owner field is the identity tag checked by
     * remove: it is set on link and nulled on unlink, so a handle that
     * outlived its node or came from another list is rejected before
     * any link is touched
     *
     *  first -> a -> b -> c   (owning)
     *           a <- b <- c = last
     */
    private static final Logger LOG = LoggerFactory.getLogger(LinkedDeque.class);

    private final Storage<E> storage;
    private final Scope scope;
    private Node<E> first, last;
    private int size;

    public LinkedDeque(@NotNull final Storage<E> storage) {
        this.storage = Objects.requireNonNull(storage);
        this.scope = Scope.current();
        this.scope.onClose(this::close);
    }

    public static <E> Collection.Factory<E, LinkedDeque<E>>
    factory(@NotNull final Storage<E> storage) {
        Objects.requireNonNull(storage);
        return () -> new LinkedDeque<>(storage);
    }

    @Override
    public void pushFront(@NotNull final E element) {
        linkFirst(element);
    }

    @Override
    public void pushBack(@NotNull final E element) {
        linkLast(element);
    }

    public Handle<E> linkFirst(@NotNull final E element) {
        this.scope.check();
        final Node<E> node = newNode(element);
        final Node<E> f = this.first;
        node.next = f;
        if (f == null) {
            this.last = node;
        } else {
            f.prev = node;
        }
        this.first = node;
        ++this.size;
        return node;
    }

    public Handle<E> linkLast(@NotNull final E element) {
        this.scope.check();
        final Node<E> node = newNode(element);
        final Node<E> l = this.last;
        node.prev = l;
        if (l == null) {
            this.first = node;
        } else {
            l.next = node;
        }
        this.last = node;
        ++this.size;
        return node;
    }

    @Override
    public Optional<E> popFront() {
        this.scope.check();
        final Node<E> f = this.first;
        return f == null
                ? Optional.empty()
                : Optional.of(unlink(f));
    }

    @Override
    public Optional<E> popBack() {
        this.scope.check();
        final Node<E> l = this.last;
        return l == null
                ? Optional.empty()
                : Optional.of(unlink(l));
    }

    @Override
    public Optional<E> peekFront() {
        this.scope.check();
        final Node<E> f = this.first;
        return f == null
                ? Optional.empty()
                : Optional.of(f.element());
    }

    @Override
    public Optional<E> peekBack() {
        this.scope.check();
        final Node<E> l = this.last;
        return l == null
                ? Optional.empty()
                : Optional.of(l.element());
    }

    /**
     * Unlinks the node behind the handle
     *
     * @return the element of the removed node, handed over to the caller
     * @throws InvalidHandleException if the handle does not belong
     * to a node currently linked into this list
     */
    public E remove(@NotNull final Handle<E> handle) {
        this.scope.check();
        if (!(handle instanceof Node<E> node) || node.owner != this) {
            LOG.debug("Rejected handle {} for list of {} nodes", handle, this.size);
            throw new InvalidHandleException(handle);
        }
        return unlink(node);
    }

    @Override
    public int size() {
        this.scope.check();
        return this.size;
    }

    public Scope scope() {
        return this.scope;
    }

    /**
     * Unlinks and releases every node. The list is empty afterwards
     * even if a release action fails, the first failure is rethrown
     * with the rest suppressed
     */
    public void clear() {
        this.scope.check();
        Node<E> p = this.first;
        this.first = this.last = null;
        this.size = 0;
        RuntimeException failure = null;
        for (Node<E> next; p != null; p = next) {
            next = p.next;
            p.next = p.prev = null;
            p.owner = null;
            try {
                p.memory.release(0);
            } catch (final RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
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
        return cursorAt(this.first, true);
    }

    /**
     * @return a cursor from back to front, valid until the next mutation
     */
    public Cursor<E> reverse() {
        this.scope.check();
        return cursorAt(this.last, false);
    }

    @Override
    public Iterator<E> iterator() {
        return new Cursor.CursorAsIterator<>(origin());
    }

    private Node<E> newNode(final E element) {
        Objects.requireNonNull(element);
        final Memory<E> memory = this.storage.allocate(1);
        memory.store(0, element);
        return new Node<>(this, memory);
    }

    private E unlink(final Node<E> node) {
        final Node<E> prev = node.prev, next = node.next;
        if (prev == null) {
            this.first = next;
        } else {
            prev.next = next;
        }
        if (next == null) {
            this.last = prev;
        } else {
            next.prev = prev;
        }
        node.next = node.prev = null;
        node.owner = null;
        --this.size;

        final E element = node.memory.fetch(0);
        node.memory.clear(0);
        return element;
    }

    private static <E> Cursor<E> cursorAt(final Node<E> node,
                                          final boolean forward) {
        return node == null
                ? Cursor.empty()
                : new CursorImpl<>(node, forward);
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(
                ", ", "[", "]");
        for (Node<E> p = this.first; p != null; p = p.next) {
            joiner.add(Objects.toString(p.memory.fetch(0)));
        }
        return joiner.toString();
    }

    /**
     * Opaque reference to a node, valid only for the list that
     * produced it and only while the node stays linked
     *
     * @param <E> the type of the element
     */
    public sealed interface Handle<E> permits Node {

        /**
         * @throws InvalidHandleException if the node has been unlinked
         */
        E element();

        boolean attached();
    }

    private static final class Node<E> implements Handle<E> {
        final Memory<E> memory;
        @Nullable LinkedDeque<E> owner;
        @Nullable Node<E> prev, next;

        Node(final LinkedDeque<E> owner, final Memory<E> memory) {
            this.owner = owner;
            this.memory = memory;
        }

        @Override
        public E element() {
            final LinkedDeque<E> o = this.owner;
            if (o == null) {
                throw new InvalidHandleException(this);
            }
            o.scope.check();
            return this.memory.fetch(0);
        }

        @Override
        public boolean attached() {
            return this.owner != null;
        }

        @Override
        public String toString() {
            return this.owner == null
                    ? "Node[detached]"
                    : "Node[" + this.memory.fetch(0) + ']';
        }
    }

    private record CursorImpl<E>(
            Node<E> node,
            boolean forward
    ) implements Cursor<E> {

        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public E element() {
            return this.node.memory.fetch(0);
        }

        @Override
        public Cursor<E> next() {
            return cursorAt(
                    this.forward ? this.node.next : this.node.prev,
                    this.forward
            );
        }
    }
}

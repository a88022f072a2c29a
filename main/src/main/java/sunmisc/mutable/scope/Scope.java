package sunmisc.mutable.scope;

import org.jetbrains.annotations.Contract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of an isolated computation. Containers remember the scope
 * that was current when they were created and refuse to be touched from
 * any other one.
 * <p>Scopes nest per thread: {@link #open()} makes a fresh scope current
 * until it is closed, after which the enclosing scope is current again.
 * Outside of any opened scope the {@link #global()} scope is current.
 * <p>Containers created in a scope register their release with
 * {@link #onClose}, closing the scope releases whatever they still hold.
 * <pre>{@code
 * try (Scope scope = Scope.open()) {
 *     CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
 *     deque.pushBack(1);
 * }
 * }</pre>
 * A scope is not a lock: handing it to another thread with {@link #enter()}
 * is only safe under external synchronization.
 */
public final class Scope implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Scope.class);

    private static final AtomicLong IDS = new AtomicLong();
    private static final Scope GLOBAL = new Scope(0, null);
    private static final ThreadLocal<Scope> CURRENT
            = ThreadLocal.withInitial(() -> GLOBAL);

    private final long id;
    private final Scope enclosing;
    private final Deque<Runnable> releases = new ArrayDeque<>();
    private volatile boolean closed;

    private Scope(final long id, final Scope enclosing) {
        this.id = id;
        this.enclosing = enclosing;
    }

    /**
     * Opens a new scope and makes it current for the calling thread
     */
    public static Scope open() {
        final Scope scope = new Scope(IDS.incrementAndGet(), CURRENT.get());
        CURRENT.set(scope);
        return scope;
    }

    public static Scope current() {
        return CURRENT.get();
    }

    public static Scope global() {
        return GLOBAL;
    }

    public long id() {
        return this.id;
    }

    public boolean closed() {
        return this.closed;
    }

    /**
     * Registers an action to run when this scope closes, actions run
     * in reverse order of registration. The global scope never closes
     * and ignores registrations
     *
     * @throws ScopeViolationException if this scope has been closed
     */
    public void onClose(final Runnable release) {
        Objects.requireNonNull(release);
        if (this == GLOBAL) {
            return;
        }
        if (this.closed) {
            throw new ScopeViolationException(this + " is closed");
        }
        this.releases.push(release);
    }

    /**
     * Binds this scope to the calling thread until the returned
     * guard is closed
     *
     * @throws ScopeViolationException if this scope has been closed
     */
    @Contract("-> new")
    public Entered enter() {
        if (this.closed) {
            throw new ScopeViolationException(this + " is closed");
        }
        final Scope previous = CURRENT.get();
        CURRENT.set(this);
        return () -> CURRENT.set(previous);
    }

    /**
     * @throws ScopeViolationException if this scope is not current for the
     * calling thread or has been closed
     */
    public void check() {
        final Scope current = CURRENT.get();
        if (current != this) {
            LOG.debug("Rejected access to {} from {}", this, current);
            throw new ScopeViolationException(String.format(
                    "Container owned by %s accessed from %s", this, current
            ));
        }
        if (this.closed) {
            LOG.debug("Rejected access to closed {}", this);
            throw new ScopeViolationException(this + " is closed");
        }
    }

    /**
     * Runs the registered release actions, then closes this scope and
     * makes the enclosing scope current again. The scope is closed even
     * if an action fails: the first failure is rethrown with the rest
     * suppressed
     *
     * @throws ScopeViolationException if this is the global scope or
     * this scope is not current for the calling thread
     */
    @Override
    public void close() {
        if (this == GLOBAL) {
            throw new ScopeViolationException("The global scope cannot be closed");
        }
        if (CURRENT.get() != this) {
            throw new ScopeViolationException(String.format(
                    "%s closed while %s is current", this, CURRENT.get()
            ));
        }
        RuntimeException failure = null;
        for (Runnable release; (release = this.releases.poll()) != null; ) {
            try {
                release.run();
            } catch (final RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        this.closed = true;
        CURRENT.set(this.enclosing);
        if (failure != null) {
            LOG.debug("Releases of {} failed", this, failure);
            throw failure;
        }
    }

    @Override
    public String toString() {
        return this == GLOBAL ? "Scope[global]" : "Scope[" + this.id + ']';
    }

    @FunctionalInterface
    public interface Entered extends AutoCloseable {
        @Override
        void close();
    }
}

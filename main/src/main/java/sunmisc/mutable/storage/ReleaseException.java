package sunmisc.mutable.storage;

import java.io.Serial;

/**
 * Thrown when the release action of an {@link Indirected} payload fails
 */
public final class ReleaseException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3725467310289446513L;

    public ReleaseException(final Object payload, final Throwable cause) {
        super(String.format("Failed to release %s", payload), cause);
    }
}

package sunmisc.mutable.scope;

import java.io.Serial;

/**
 * Thrown when a container is used outside the scope it was created in,
 * or after that scope has been closed
 */
public final class ScopeViolationException extends IllegalStateException {
    @Serial
    private static final long serialVersionUID = -4016310574820372517L;

    public ScopeViolationException(final String message) {
        super(message);
    }
}

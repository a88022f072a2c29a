package sunmisc.mutable.list;

import java.io.Serial;

/**
 * Thrown when a node handle is used with a list that does not
 * currently hold its node
 */
public final class InvalidHandleException extends IllegalArgumentException {
    @Serial
    private static final long serialVersionUID = 8850272463910836211L;

    public InvalidHandleException(final Object handle) {
        super(String.format("%s is not linked into this list", handle));
    }
}

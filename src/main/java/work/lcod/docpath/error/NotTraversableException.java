package work.lcod.docpath.error;

/**
 * Raised when the walk has to descend into {@code null} or into a scalar.
 */
public final class NotTraversableException extends DocumentPathException {
    public NotTraversableException(String reason) {
        super("not_traversable", "Not a traversable type: " + reason);
    }
}

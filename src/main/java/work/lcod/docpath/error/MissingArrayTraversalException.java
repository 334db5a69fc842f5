package work.lcod.docpath.error;

/**
 * An array was reached but the next segment is neither an index nor {@code -}.
 */
public final class MissingArrayTraversalException extends DocumentPathException {
    private final String segment;

    public MissingArrayTraversalException(String segment) {
        super("missing_array_traversal", "Array traversal indicator missing: " + segment);
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}

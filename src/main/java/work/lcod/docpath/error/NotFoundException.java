package work.lcod.docpath.error;

/**
 * A key, index or traversal did not resolve, or a match predicate rejected the value.
 */
public final class NotFoundException extends DocumentPathException {
    private final String segment;

    public NotFoundException(String segment) {
        super("not_found", "Not found: " + segment);
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}

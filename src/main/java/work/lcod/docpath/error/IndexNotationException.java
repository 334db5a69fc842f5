package work.lcod.docpath.error;

/**
 * Extending a path would require an array of a given length to exist already.
 * Only {@code -} can grow arrays.
 */
public final class IndexNotationException extends DocumentPathException {
    public IndexNotationException() {
        super("index_notation", "Cannot append to array using index notation");
    }
}

package work.lcod.docpath.error;

/**
 * Array notation was used on an object.
 */
public final class NotAnArrayException extends DocumentPathException {
    private final String segment;

    public NotAnArrayException(String segment) {
        super("not_an_array", "Not an array: " + segment);
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }
}

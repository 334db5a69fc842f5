package work.lcod.docpath.error;

/**
 * Base type for every failure raised while reading, mutating or hashing a document.
 * The {@link #code()} is stable and meant for callers that branch on the failure kind.
 */
public class DocumentPathException extends RuntimeException {
    private final String code;

    protected DocumentPathException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

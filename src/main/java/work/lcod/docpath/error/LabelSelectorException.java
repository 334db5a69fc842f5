package work.lcod.docpath.error;

/**
 * A label selector section holds a value of the wrong shape.
 */
public final class LabelSelectorException extends DocumentPathException {
    public LabelSelectorException(String message) {
        super("invalid_label_selector", message);
    }
}

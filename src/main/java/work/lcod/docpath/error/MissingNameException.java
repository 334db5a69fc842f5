package work.lcod.docpath.error;

/**
 * The document carries neither {@code metadata.name} nor {@code metadata.generateName}.
 */
public final class MissingNameException extends DocumentPathException {
    public MissingNameException() {
        super("missing_name", "Object does not have a name set");
    }
}

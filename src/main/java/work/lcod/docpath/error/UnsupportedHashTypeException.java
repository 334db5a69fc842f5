package work.lcod.docpath.error;

public final class UnsupportedHashTypeException extends DocumentPathException {
    private final String key;
    private final String type;

    public UnsupportedHashTypeException(String key, String type) {
        super("unsupported_hash_type", "cannot create hash for field " + key + " of type " + type);
        this.key = key;
        this.type = type;
    }

    public String key() {
        return key;
    }

    public String type() {
        return type;
    }
}

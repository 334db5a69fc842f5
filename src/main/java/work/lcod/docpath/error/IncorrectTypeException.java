package work.lcod.docpath.error;

public final class IncorrectTypeException extends DocumentPathException {
    private final String actualType;

    public IncorrectTypeException(String actualType) {
        super("incorrect_type", "Incorrect type: " + actualType);
        this.actualType = actualType;
    }

    public String actualType() {
        return actualType;
    }
}

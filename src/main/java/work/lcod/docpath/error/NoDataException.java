package work.lcod.docpath.error;

public final class NoDataException extends DocumentPathException {
    public NoDataException() {
        super("no_data", "No data found in raw object");
    }
}

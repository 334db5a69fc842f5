package work.lcod.docpath.path;

/**
 * Kind of array access a single path segment denotes.
 */
public enum ArrayNotation {
    /** Ordinary object key. */
    INVALID,
    /** Explicit, non-negative element index such as {@code 0} or {@code 12}. */
    INDEX,
    /** {@code -}: any element on read, append on write. */
    TRAVERSAL;

    public static final String TRAVERSAL_MARKER = "-";

    /**
     * Classifies a segment purely by its text.
     */
    public static ArrayNotation of(String segment) {
        if (segment == null || segment.isEmpty()) {
            return INVALID;
        }
        if (TRAVERSAL_MARKER.equals(segment)) {
            return TRAVERSAL;
        }
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            if (ch < '0' || ch > '9') {
                return INVALID;
            }
        }
        return INDEX;
    }

    public boolean isArray() {
        return this != INVALID;
    }
}

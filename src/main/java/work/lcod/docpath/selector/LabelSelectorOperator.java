package work.lcod.docpath.selector;

import work.lcod.docpath.error.LabelSelectorException;

public enum LabelSelectorOperator {
    IN("In"),
    NOT_IN("NotIn"),
    EXISTS("Exists"),
    DOES_NOT_EXIST("DoesNotExist");

    private final String wireName;

    LabelSelectorOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean requiresValues() {
        return this == IN || this == NOT_IN;
    }

    public static LabelSelectorOperator from(String value) {
        for (LabelSelectorOperator operator : values()) {
            if (operator.wireName.equals(value)) {
                return operator;
            }
        }
        throw new LabelSelectorException("Unsupported label selector operator: " + value);
    }
}

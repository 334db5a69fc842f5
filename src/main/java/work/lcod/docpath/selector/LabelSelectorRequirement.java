package work.lcod.docpath.selector;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single {@code matchExpressions} entry.
 */
public record LabelSelectorRequirement(String key, LabelSelectorOperator operator, List<String> values) {
    public LabelSelectorRequirement {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean matches(Map<String, String> labels) {
        return switch (operator) {
            case IN -> labels.containsKey(key) && values.contains(labels.get(key));
            case NOT_IN -> !labels.containsKey(key) || !values.contains(labels.get(key));
            case EXISTS -> labels.containsKey(key);
            case DOES_NOT_EXIST -> !labels.containsKey(key);
        };
    }
}

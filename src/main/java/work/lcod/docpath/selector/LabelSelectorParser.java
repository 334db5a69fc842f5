package work.lcod.docpath.selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.docpath.error.LabelSelectorException;

/**
 * Reads label selectors out of generic documents, e.g. {@code spec.selector} of a Deployment or
 * {@code namespaceSelector} of a webhook.
 *
 * <pre>
 * matchLabels:
 *   app.kubernetes.io/name: test
 * matchExpressions:
 *   - key: app.kubernetes.io/instance
 *     operator: In
 *     values: [test]
 * </pre>
 *
 * <p>Without {@code matchLabels} and {@code matchExpressions} the map itself is read as
 * {@code matchLabels}, which is the form Services use.
 */
public final class LabelSelectorParser {
    private static final String MATCH_LABELS = "matchLabels";
    private static final String MATCH_EXPRESSIONS = "matchExpressions";

    private LabelSelectorParser() {}

    public static LabelSelector parse(Map<String, ?> selector) {
        if (selector == null) {
            return new LabelSelector(Map.of(), List.of());
        }
        boolean hasMatchLabels = selector.containsKey(MATCH_LABELS);
        boolean hasMatchExpressions = selector.containsKey(MATCH_EXPRESSIONS);
        if (!hasMatchLabels && !hasMatchExpressions) {
            return new LabelSelector(readStringMap(selector, "selector"), List.of());
        }

        Map<String, String> matchLabels = Map.of();
        if (hasMatchLabels) {
            if (!(selector.get(MATCH_LABELS) instanceof Map<?, ?> labels)) {
                throw new LabelSelectorException("failed to parse matchLabels as map: " + selector.get(MATCH_LABELS));
            }
            matchLabels = readStringMap(labels, MATCH_LABELS);
        }

        List<LabelSelectorRequirement> requirements = List.of();
        if (hasMatchExpressions) {
            if (!(selector.get(MATCH_EXPRESSIONS) instanceof List<?> expressions)) {
                throw new LabelSelectorException(
                    "failed to parse matchExpressions as list: " + selector.get(MATCH_EXPRESSIONS));
            }
            requirements = new ArrayList<>(expressions.size());
            for (int i = 0; i < expressions.size(); i++) {
                if (!(expressions.get(i) instanceof Map<?, ?> expression)) {
                    throw new LabelSelectorException(
                        "failed to parse matchExpressions[" + i + "] as map: " + expressions.get(i));
                }
                requirements.add(readRequirement(expression, MATCH_EXPRESSIONS + "[" + i + "]"));
            }
        }
        return new LabelSelector(matchLabels, requirements);
    }

    private static Map<String, String> readStringMap(Map<?, ?> source, String location) {
        var result = new LinkedHashMap<String, String>();
        for (var entry : source.entrySet()) {
            if (!(entry.getValue() instanceof String value)) {
                throw new LabelSelectorException(
                    "failed to parse " + location + "[" + entry.getKey() + "] as string: " + entry.getValue());
            }
            result.put(String.valueOf(entry.getKey()), value);
        }
        return result;
    }

    private static LabelSelectorRequirement readRequirement(Map<?, ?> expression, String location) {
        if (!(expression.get("key") instanceof String key)) {
            throw new LabelSelectorException("failed to parse " + location + ".key as string: " + expression.get("key"));
        }
        if (!(expression.get("operator") instanceof String operatorName)) {
            throw new LabelSelectorException(
                "failed to parse " + location + ".operator as string: " + expression.get("operator"));
        }
        LabelSelectorOperator operator = LabelSelectorOperator.from(operatorName);

        Object rawValues = expression.get("values");
        var values = new ArrayList<String>();
        if (rawValues == null) {
            if (operator.requiresValues()) {
                throw new LabelSelectorException(location + ".values is required for operator " + operatorName);
            }
        } else if (rawValues instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof String value)) {
                    throw new LabelSelectorException(
                        "failed to parse " + location + ".values[" + i + "] as string: " + list.get(i));
                }
                values.add(value);
            }
        } else {
            throw new LabelSelectorException("failed to parse " + location + ".values as list: " + rawValues);
        }
        return new LabelSelectorRequirement(key, operator, values);
    }
}

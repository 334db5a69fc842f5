package work.lcod.docpath.clean;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.docpath.shared.DocumentValues;

/**
 * Describes keys to strip from a document: a list of keys removed at this level plus nested
 * cleaners applied to the sub-objects of the same name. A nested cleaner without fields and
 * without nested entries removes its whole sub-tree.
 */
public final class FieldCleaner {
    static final String MANAGED_FIELDS_RESOURCE = "managed-fields.toml";

    private static final FieldCleaner REMOVE_ALL = new FieldCleaner(List.of(), Map.of());

    private final List<String> fields;
    private final Map<String, FieldCleaner> nested;

    public FieldCleaner(List<String> fields, Map<String, FieldCleaner> nested) {
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.nested = nested == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(nested));
    }

    public static FieldCleaner removeAll() {
        return REMOVE_ALL;
    }

    /**
     * Server-managed bookkeeping of Kubernetes objects: managed fields, timestamps, generation and
     * revision markers, plus the whole {@code status} section.
     */
    public static FieldCleaner kubernetesManagedFields() {
        return ManagedFieldsHolder.INSTANCE;
    }

    public List<String> fields() {
        return fields;
    }

    public Map<String, FieldCleaner> nested() {
        return nested;
    }

    public boolean removesWholesale() {
        return fields.isEmpty() && nested.isEmpty();
    }

    /**
     * Removes the described keys from {@code object} in place and returns it.
     */
    public Map<String, Object> clean(Map<String, Object> object) {
        for (String key : fields) {
            object.remove(key);
        }
        for (var entry : nested.entrySet()) {
            FieldCleaner cleaner = entry.getValue();
            if (cleaner.removesWholesale()) {
                object.remove(entry.getKey());
                continue;
            }
            if (object.get(entry.getKey()) instanceof Map<?, ?> subTree) {
                cleaner.clean(DocumentValues.asObject(subTree));
            }
        }
        return object;
    }

    @Override
    public String toString() {
        return "FieldCleaner{fields=" + fields + ", nested=" + nested.keySet() + "}";
    }

    private static final class ManagedFieldsHolder {
        private static final FieldCleaner INSTANCE = FieldCleanerLoader.fromResource(MANAGED_FIELDS_RESOURCE);
    }
}

package work.lcod.docpath.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.docpath.clean.FieldCleaner;
import work.lcod.docpath.error.DocumentPathException;
import work.lcod.docpath.error.IncorrectTypeException;
import work.lcod.docpath.error.MissingNameException;
import work.lcod.docpath.error.NotFoundException;
import work.lcod.docpath.hash.DocumentHasher;
import work.lcod.docpath.patch.GeneratedPatch;
import work.lcod.docpath.patch.PatchGenerator;
import work.lcod.docpath.patch.PatchOperation;
import work.lcod.docpath.path.ArrayNotation;
import work.lcod.docpath.path.Path;
import work.lcod.docpath.selector.LabelSelector;
import work.lcod.docpath.selector.LabelSelectorParser;
import work.lcod.docpath.shared.DocumentValues;
import work.lcod.docpath.walk.DocumentWalker;
import work.lcod.docpath.walk.WalkArgs;

/**
 * A named document (typically a Kubernetes object) backed by a mutable map.
 *
 * <p>All mutating operations change the wrapped map in place. Reads that cannot resolve their
 * path raise {@link NotFoundException}; the metadata helpers return an empty string instead.
 */
public final class Document {
    private final Map<String, Object> object;

    private Document(Map<String, Object> object) {
        this.object = Objects.requireNonNull(object, "object");
    }

    /**
     * Wraps {@code object} without copying it.
     */
    public static Document of(Map<String, Object> object) {
        return new Document(object);
    }

    public static Document named(String name) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("name", name);
        var object = new LinkedHashMap<String, Object>();
        object.put("metadata", metadata);
        return new Document(object);
    }

    public static Document fromJson(String json) {
        return new Document(DocumentCodec.readDocument(json, DocumentCodec.Format.JSON));
    }

    public static Document fromYaml(String yaml) {
        return new Document(DocumentCodec.readDocument(yaml, DocumentCodec.Format.YAML));
    }

    /**
     * Parses JSON or YAML, whichever the text looks like.
     */
    public static Document parse(String text) {
        return new Document(DocumentCodec.readDocument(text, DocumentCodec.Format.AUTO));
    }

    /**
     * Wraps {@code object} after checking it carries a name or a name prefix.
     *
     * @throws MissingNameException when neither {@code metadata.name} nor
     *     {@code metadata.generateName} exists
     */
    public static Document requireNamed(Map<String, Object> object) {
        var document = new Document(object);
        if (!document.has(DocumentPaths.METADATA_NAME) && !document.has(DocumentPaths.METADATA_GENERATE_NAME)) {
            throw new MissingNameException();
        }
        return document;
    }

    public Map<String, Object> asMap() {
        return object;
    }

    public Object walk(Path path, WalkArgs args) {
        return DocumentWalker.walk(object, path, args);
    }

    /**
     * Value at {@code path}; with {@code -} segments the first element that resolves is used.
     */
    public Object get(Path path) {
        return walk(path, WalkArgs.none());
    }

    public boolean has(Path path) {
        try {
            get(path);
            return true;
        } catch (DocumentPathException ex) {
            return false;
        }
    }

    /**
     * Writes {@code value} at {@code path}, creating missing objects and arrays on the way.
     * A trailing {@code -} appends to the addressed array. Setting {@code null} removes the key.
     */
    public void set(Path path, Object value) {
        if (path.isEmpty()) {
            replaceContent(value);
            return;
        }
        GeneratedPatch patch = PatchGenerator.generate(object, path, value);
        walk(patch.path(), WalkArgs.builder().mutateFunction(current -> patch.value()).build());
    }

    /**
     * Removes the value at {@code path}. With {@code -} segments the first element that holds
     * the value is the one removed; a missing last key is a no-op.
     */
    public void delete(Path path) {
        Path target = path;
        if (path.segments().contains(ArrayNotation.TRAVERSAL_MARKER)) {
            target = findFirst(path, null).orElse(path);
        }
        walk(target, WalkArgs.builder().mutateFunction(current -> null).build());
    }

    /**
     * Concrete paths of every resolution of {@code path} whose value equals {@code value}, or of
     * every resolution when {@code value} is {@code null}. Empty when nothing matches.
     */
    public List<Path> findAll(Path path, Object value) {
        var matched = new ArrayList<Path>();
        var args = WalkArgs.builder()
            .matchAll(true)
            .matchFunction((candidate, resolved) -> {
                if (value == null || Objects.equals(candidate, value)) {
                    matched.add(resolved);
                    return true;
                }
                return false;
            })
            .build();
        try {
            walk(path, args);
        } catch (NotFoundException ex) {
            return List.of();
        }
        return matched;
    }

    public Optional<Path> findFirst(Path path, Object value) {
        Path[] matched = {null};
        var args = WalkArgs.builder()
            .matchFunction((candidate, resolved) -> {
                if (value == null || Objects.equals(candidate, value)) {
                    matched[0] = resolved;
                    return true;
                }
                return false;
            })
            .build();
        try {
            walk(path, args);
        } catch (NotFoundException ex) {
            return Optional.empty();
        }
        return Optional.ofNullable(matched[0]);
    }

    public String getString(Path path) {
        Object value = get(path);
        if (!(value instanceof String text)) {
            throw new IncorrectTypeException(DocumentValues.typeName(value));
        }
        return text;
    }

    public Map<String, Object> getSection(Path path) {
        Object value = get(path);
        if (!(value instanceof Map<?, ?> section)) {
            throw new IncorrectTypeException(DocumentValues.typeName(value));
        }
        return DocumentValues.asObject(section);
    }

    public List<Object> getList(Path path) {
        Object value = get(path);
        if (!(value instanceof List<?> list)) {
            throw new IncorrectTypeException(DocumentValues.typeName(value));
        }
        return DocumentValues.asList(list);
    }

    public GeneratedPatch generatePatch(Path path, Object value) {
        return PatchGenerator.generate(object, path, value);
    }

    public long hash() {
        return DocumentHasher.hash(object);
    }

    public String hashString() {
        return DocumentHasher.hashString(object);
    }

    public String toJson() {
        return DocumentCodec.toJson(object);
    }

    public String toYaml() {
        return DocumentCodec.toYaml(object);
    }

    public Document copy() {
        return new Document(DocumentValues.asObject(DocumentValues.deepCopy(object)));
    }

    /**
     * Object name, or the name prefix for objects that have not been named by their controller
     * yet. Empty when neither is set.
     */
    public String name() {
        String name = stringOrEmpty(DocumentPaths.METADATA_NAME);
        return name.isEmpty() ? stringOrEmpty(DocumentPaths.METADATA_GENERATE_NAME) : name;
    }

    public String namespace() {
        return stringOrEmpty(DocumentPaths.METADATA_NAMESPACE);
    }

    public String kind() {
        return stringOrEmpty(DocumentPaths.KIND);
    }

    public String apiVersion() {
        return stringOrEmpty(DocumentPaths.API_VERSION);
    }

    public String uid() {
        return stringOrEmpty(DocumentPaths.METADATA_UID);
    }

    /**
     * Kind of the first owner, e.g. {@code ReplicaSet} for a pod managed by one.
     */
    public String ownerKind() {
        return stringOrEmpty(DocumentPaths.OWNER_REFERENCE_KIND);
    }

    public Optional<String> label(String key) {
        return optionalString(DocumentPaths.LABELS.append(key));
    }

    public Optional<String> annotation(String key) {
        return optionalString(DocumentPaths.ANNOTATIONS.append(key));
    }

    /**
     * String-valued labels; non-string entries are skipped.
     */
    public Map<String, String> labels() {
        var labels = new LinkedHashMap<String, String>();
        if (!hasLabels()) {
            return labels;
        }
        getSection(DocumentPaths.LABELS).forEach((key, value) -> {
            if (value instanceof String text) {
                labels.put(key, text);
            }
        });
        return labels;
    }

    public boolean hasLabels() {
        return has(DocumentPaths.LABELS);
    }

    public boolean hasAnnotations() {
        return has(DocumentPaths.ANNOTATIONS);
    }

    /**
     * Case-insensitive comparison; {@code false} when the label is missing.
     */
    public boolean isLabelSetTo(String key, String value) {
        return label(key).map(actual -> actual.equalsIgnoreCase(value)).orElse(false);
    }

    public boolean isLabelNotSetTo(String key, String value) {
        return label(key).map(actual -> !actual.equalsIgnoreCase(value)).orElse(true);
    }

    public boolean isAnnotationSetTo(String key, String value) {
        return annotation(key).map(actual -> actual.equalsIgnoreCase(value)).orElse(false);
    }

    public boolean isAnnotationNotSetTo(String key, String value) {
        return annotation(key).map(actual -> !actual.equalsIgnoreCase(value)).orElse(true);
    }

    public void setName(String name) {
        set(DocumentPaths.METADATA_NAME, name);
    }

    public void setNamespace(String namespace) {
        set(DocumentPaths.METADATA_NAMESPACE, namespace);
    }

    public void setLabel(String key, String value) {
        set(DocumentPaths.LABELS.append(key), value);
    }

    public void setAnnotation(String key, String value) {
        set(DocumentPaths.ANNOTATIONS.append(key), value);
    }

    /**
     * Case-insensitive kind / apiVersion check; an empty or {@code null} argument matches any.
     */
    public boolean isOfKind(String kind, String apiVersion) {
        if (kind != null && !kind.isEmpty() && !kind.equalsIgnoreCase(kind())) {
            return false;
        }
        return apiVersion == null || apiVersion.isEmpty() || apiVersion.equalsIgnoreCase(apiVersion());
    }

    /**
     * Parses the label selector stored at {@code path}.
     */
    public LabelSelector labelSelector(Path path) {
        return LabelSelectorParser.parse(getSection(path));
    }

    public boolean matchesSelector(LabelSelector selector) {
        return selector.matches(labels());
    }

    public PatchOperation createAddPatch(Path path, Object value) {
        return PatchOperation.add(path.toJsonPointer(), value);
    }

    public PatchOperation createReplacePatch(Path path, Object value) {
        return PatchOperation.replace(path.toJsonPointer(), value);
    }

    public PatchOperation createRemovePatch(Path path) {
        return PatchOperation.remove(path.toJsonPointer());
    }

    public void removeManagedFields() {
        removeFields(FieldCleaner.kubernetesManagedFields());
    }

    public void removeFields(FieldCleaner cleaner) {
        cleaner.clean(object);
    }

    private void replaceContent(Object value) {
        if (!(value instanceof Map<?, ?> replacement)) {
            throw new IncorrectTypeException(DocumentValues.typeName(value));
        }
        var content = new LinkedHashMap<String, Object>(DocumentValues.asObject(replacement));
        object.clear();
        object.putAll(content);
    }

    private String stringOrEmpty(Path path) {
        return optionalString(path).orElse("");
    }

    private Optional<String> optionalString(Path path) {
        try {
            return Optional.of(getString(path));
        } catch (DocumentPathException ex) {
            return Optional.empty();
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Document document && object.equals(document.object);
    }

    @Override
    public int hashCode() {
        return object.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}

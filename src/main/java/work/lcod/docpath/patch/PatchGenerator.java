package work.lcod.docpath.patch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.docpath.error.DocumentPathException;
import work.lcod.docpath.error.IndexNotationException;
import work.lcod.docpath.error.NotFoundException;
import work.lcod.docpath.path.ArrayNotation;
import work.lcod.docpath.path.Path;
import work.lcod.docpath.shared.DocumentValues;
import work.lcod.docpath.walk.DocumentWalker;
import work.lcod.docpath.walk.WalkArgs;

/**
 * Computes a single "add" that makes a possibly non-existing path resolve to a value.
 *
 * <p>The path is reduced to the longest prefix that exists in the document and the value is
 * wrapped in the objects and one-element arrays the missing segments describe. Missing arrays can
 * only be created through {@code -}; an explicit index on a missing array raises
 * {@link IndexNotationException}.
 */
public final class PatchGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(PatchGenerator.class);

    private PatchGenerator() {}

    public static GeneratedPatch generate(Object root, Path path, Object value) {
        if (path.isEmpty()) {
            return new GeneratedPatch(path, value);
        }

        boolean appendsAtEnd = ArrayNotation.of(path.last()) == ArrayNotation.TRAVERSAL;
        Path[] validPath = {Path.empty()};
        var args = WalkArgs.builder()
            .matchFunction((resolvedValue, resolvedPath) -> {
                // keep "-" so a later write appends instead of overwriting the matched element
                validPath[0] = appendsAtEnd ? resolvedPath.withLast(ArrayNotation.TRAVERSAL_MARKER) : resolvedPath;
                return true;
            })
            .notFoundFunction(walked -> validPath[0] = walked)
            .build();

        try {
            DocumentWalker.walk(root, path, args);
            return new GeneratedPatch(validPath[0], value);
        } catch (DocumentPathException ex) {
            // only the last key is missing: a direct write creates it
            if (validPath[0].size() == path.size()) {
                return new GeneratedPatch(validPath[0], value);
            }
            if (!(ex instanceof NotFoundException)) {
                throw ex;
            }
        }

        Path existing = validPath[0];
        LOG.debug("Extending {} below existing prefix {}", path, existing);
        return new GeneratedPatch(existing, synthesize(path, existing.size(), value));
    }

    private static Object synthesize(Path path, int firstMissing, Object value) {
        var tail = new Tail();
        int firstIdx = firstMissing;
        switch (path.arrayNotationAt(firstMissing - 1)) {
            case INVALID -> tail.start(new LinkedHashMap<String, Object>());
            case TRAVERSAL -> {
                // the array field itself is missing: the value starts as a fresh array
                if (ArrayNotation.TRAVERSAL_MARKER.equals(path.get(firstIdx))) {
                    tail.start(singleSlot());
                    firstIdx++;
                }
            }
            case INDEX -> throw new IndexNotationException();
        }

        // the last segment carries the value itself
        for (int idx = firstIdx; idx < path.size(); idx++) {
            String key = path.get(idx);
            switch (path.arrayNotationAt(idx)) {
                case INVALID -> {
                    if (idx < path.size() - 1) {
                        tail.descend(key, new LinkedHashMap<String, Object>());
                    }
                }
                case TRAVERSAL -> {
                    tail.descend(key, singleSlot());
                    if (!ArrayNotation.TRAVERSAL_MARKER.equals(key)) {
                        idx++;
                    }
                }
                case INDEX -> throw new IndexNotationException();
            }
        }

        tail.attach(path.last(), value);
        return tail.root;
    }

    private static List<Object> singleSlot() {
        var slot = new ArrayList<Object>(1);
        slot.add(null);
        return slot;
    }

    /**
     * Value under construction: {@code root} is what gets added, {@code parent} the node that
     * receives the next segment.
     */
    private static final class Tail {
        private Object root;
        private Object parent;

        void start(Object node) {
            root = node;
            parent = node;
        }

        void descend(String key, Object node) {
            attach(key, node);
            parent = node;
        }

        void attach(String key, Object node) {
            boolean traversal = ArrayNotation.TRAVERSAL_MARKER.equals(key);
            if (parent instanceof List<?> list) {
                DocumentValues.asList(list).set(0, traversal ? node : singleEntry(key, node));
            } else if (parent instanceof Map<?, ?> map) {
                DocumentValues.asObject(map).put(key, node);
            } else if (traversal) {
                // the prefix ends in an existing array: the value becomes a new element
                var element = singleSlot();
                element.set(0, node);
                root = element;
            } else {
                root = singleEntry(key, node);
            }
        }

        private static Map<String, Object> singleEntry(String key, Object node) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put(key, node);
            return entry;
        }
    }
}

package work.lcod.docpath.walk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.docpath.error.DocumentPathException;
import work.lcod.docpath.error.MissingArrayTraversalException;
import work.lcod.docpath.error.NotAnArrayException;
import work.lcod.docpath.error.NotFoundException;
import work.lcod.docpath.error.NotTraversableException;
import work.lcod.docpath.path.ArrayNotation;
import work.lcod.docpath.path.Path;
import work.lcod.docpath.shared.DocumentValues;

/**
 * Resolves a {@link Path} against a document built from maps, lists and scalars, optionally
 * matching and mutating the resolved values in place.
 *
 * <p>Objects are entered by key. Arrays must always be entered through array notation: an
 * explicit index, or {@code -} which tries every element in order. With
 * {@link WalkArgs#matchAll()} unset the first element that resolves wins; otherwise every
 * resolution is collected (a single one is returned unwrapped, several as a list).
 *
 * <p>Mutations are written back into the parent container of the resolved node. A missing key
 * in the last position is created when a mutate function is present.
 */
public final class DocumentWalker {
    private DocumentWalker() {}

    public static Object walk(Object root, Path path, WalkArgs args) {
        return walk(root, path, 0, args == null ? WalkArgs.none() : args, WalkFrame.root());
    }

    private static Object walk(Object node, Path path, int depth, WalkArgs args, WalkFrame frame) {
        if (depth == path.size()) {
            return resolve(node, false, args, frame);
        }
        if (node == null) {
            throw new NotTraversableException(frame.key() + " is nil");
        }
        if (node instanceof Map<?, ?> map) {
            return walkObject(DocumentValues.asObject(map), path, depth, args, frame);
        }
        if (node instanceof List<?> list) {
            return walkArray(DocumentValues.asList(list), path, depth, args, frame);
        }
        throw new NotTraversableException(frame.key() + " is " + DocumentValues.typeName(node));
    }

    private static Object walkObject(Map<String, Object> object, Path path, int depth, WalkArgs args, WalkFrame frame) {
        String key = path.get(depth);
        if (ArrayNotation.of(key).isArray()) {
            throw new NotAnArrayException(frame.key());
        }
        if (!object.containsKey(key)) {
            if (depth == path.size() - 1 && args.mutates()) {
                return resolve(null, true, args, frame.push(key, object));
            }
            throw notFound(args, frame, key);
        }
        return walk(object.get(key), path, depth + 1, args, frame.push(key, object));
    }

    private static Object walkArray(List<Object> array, Path path, int depth, WalkArgs args, WalkFrame frame) {
        String segment = path.get(depth);
        return switch (ArrayNotation.of(segment)) {
            case INDEX -> {
                int index = parseIndex(segment);
                if (index < 0 || index >= array.size()) {
                    throw notFound(args, frame, segment);
                }
                yield walk(array.get(index), path, depth + 1, args, frame.push(segment, array));
            }
            case TRAVERSAL -> args.matchAll()
                ? traverseAll(array, path, depth, args, frame)
                : traverseFirst(array, path, depth, args, frame);
            case INVALID -> throw new MissingArrayTraversalException(frame.key());
        };
    }

    private static Object traverseFirst(List<Object> array, Path path, int depth, WalkArgs args, WalkFrame frame) {
        boolean appendsHere = depth == path.size() - 1 && args.mutates();
        if (array.isEmpty() && appendsHere) {
            return resolve(null, true, args, frame.pushAppend("0", array));
        }
        var failures = new ArrayList<DocumentPathException>();
        for (int idx = 0; idx < array.size(); idx++) {
            try {
                return walk(array.get(idx), path, depth + 1, args, frame.pushAppend(Integer.toString(idx), array));
            } catch (DocumentPathException ex) {
                failures.add(ex);
            }
        }
        NotFoundException notFound = notFound(args, frame, ArrayNotation.TRAVERSAL_MARKER);
        failures.forEach(notFound::addSuppressed);
        throw notFound;
    }

    private static Object traverseAll(List<Object> array, Path path, int depth, WalkArgs args, WalkFrame frame) {
        var values = new ArrayList<Object>();
        var failures = new ArrayList<DocumentPathException>();
        int idx = 0;
        while (idx < array.size()) {
            int sizeBefore = array.size();
            try {
                values.add(walk(array.get(idx), path, depth + 1, args, frame.push(Integer.toString(idx), array)));
            } catch (DocumentPathException ex) {
                // sub-path errors only exclude this element
                failures.add(ex);
            }
            if (array.size() >= sizeBefore) {
                idx++;
            }
        }
        if (values.isEmpty()) {
            NotFoundException notFound = notFound(args, frame, ArrayNotation.TRAVERSAL_MARKER);
            failures.forEach(notFound::addSuppressed);
            throw notFound;
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        return values;
    }

    private static Object resolve(Object node, boolean absent, WalkArgs args, WalkFrame frame) {
        Object value = node;
        if (args.mutateFunction() != null) {
            value = args.mutateFunction().apply(absent ? null : node);
            writeBack(frame, value, absent);
        }
        if (args.matchFunction() != null && !args.matchFunction().test(value, frame.walkedPath())) {
            throw notFound(args, frame, "");
        }
        return value;
    }

    private static void writeBack(WalkFrame frame, Object value, boolean absent) {
        Object parent = frame.parent();
        if (parent instanceof Map<?, ?> map) {
            Map<String, Object> object = DocumentValues.asObject(map);
            if (value == null) {
                object.remove(frame.key());
            } else {
                object.put(frame.key(), value);
            }
            return;
        }
        if (parent instanceof List<?> list) {
            List<Object> array = DocumentValues.asList(list);
            if (value == null) {
                if (!absent) {
                    array.remove(parseIndex(frame.key()));
                }
            } else if (frame.appendOnMutate()) {
                array.add(value);
            } else {
                array.set(parseIndex(frame.key()), value);
            }
        }
        // the root has no parent to write into
    }

    private static NotFoundException notFound(WalkArgs args, WalkFrame frame, String segment) {
        if (args.notFoundFunction() != null) {
            Path walked = segment.isEmpty() ? frame.walkedPath() : frame.walkedPath().append(segment);
            args.notFoundFunction().accept(walked);
        }
        return new NotFoundException(segment);
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}

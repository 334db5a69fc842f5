package work.lcod.docpath.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable address of a location inside a document.
 *
 * <p>Arrays are addressed with two segments: the key naming the array followed by either an
 * index ({@code "0"}) or the traversal marker {@code "-"}. Nested arrays simply chain array
 * segments ({@code ["matrix", "0", "1"]}).
 *
 * <p>Two textual notations are supported:
 * <ul>
 *   <li>JQ-like: {@code spec.containers[].name}, {@code items[2]}, {@code metadata.'app.kubernetes.io/name'}.
 *       Single quotes protect {@code .}, {@code [} and {@code ]}.</li>
 *   <li>JSON pointer (RFC 6901): {@code /spec/containers/-/name} with {@code ~0}/{@code ~1} escapes.</li>
 * </ul>
 */
public final class Path implements Iterable<String> {
    private static final Path EMPTY = new Path(List.of());

    private final List<String> segments;

    private Path(List<String> segments) {
        this.segments = segments;
    }

    public static Path empty() {
        return EMPTY;
    }

    public static Path of(String... segments) {
        return of(Arrays.asList(segments));
    }

    public static Path of(List<String> segments) {
        if (segments == null || segments.isEmpty()) {
            return EMPTY;
        }
        return new Path(List.copyOf(segments));
    }

    /**
     * Reads {@code text} as a JSON pointer when it starts with {@code /}, as a JQ-like path otherwise.
     */
    public static Path parse(String text) {
        if (text != null && text.startsWith("/")) {
            return fromJsonPointer(text);
        }
        return fromJq(text);
    }

    /**
     * Parses a JQ-like path. {@code name[]} yields {@code name, -}, {@code name[3]} yields
     * {@code name, 3}, and a quoted {@code 'name[]'} stays one literal key.
     */
    public static Path fromJq(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        var parsed = new ArrayList<String>();
        int start = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\'' -> {
                    if (quoted) {
                        addJqElement(parsed, text, start, i, ch);
                    }
                    quoted = !quoted;
                    start = i + 1;
                }
                case '.', '[', ']' -> {
                    if (!quoted) {
                        addJqElement(parsed, text, start, i, ch);
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        addJqElement(parsed, text, start, text.length(), '\0');
        return of(parsed);
    }

    private static void addJqElement(List<String> parsed, String text, int start, int end, char delimiter) {
        if (end > start) {
            parsed.add(text.substring(start, end));
        } else if (delimiter == ']') {
            parsed.add(ArrayNotation.TRAVERSAL_MARKER);
        }
    }

    /**
     * Parses an RFC 6901 pointer; {@code ""} and {@code "/"} address the root.
     */
    public static Path fromJsonPointer(String text) {
        if (text == null || text.isEmpty() || "/".equals(text)) {
            return EMPTY;
        }
        String[] raw = text.split("/", -1);
        int from = raw[0].isEmpty() ? 1 : 0;
        var parsed = new ArrayList<String>(raw.length);
        for (int i = from; i < raw.length; i++) {
            parsed.add(unescape(raw[i]));
        }
        return of(parsed);
    }

    private static String unescape(String segment) {
        if (segment.indexOf('~') < 0) {
            return segment;
        }
        var builder = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            if (ch == '~' && i + 1 < segment.length()) {
                char next = segment.charAt(i + 1);
                if (next == '1') {
                    builder.append('/');
                    i++;
                    continue;
                }
                if (next == '0') {
                    builder.append('~');
                    i++;
                    continue;
                }
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    /**
     * Renders the path as a JSON pointer. The empty path renders as {@code /}.
     */
    public String toJsonPointer() {
        if (segments.isEmpty()) {
            return "/";
        }
        int capacity = 0;
        for (String segment : segments) {
            capacity += segment.length() + 1;
        }
        var builder = new StringBuilder(capacity);
        for (String segment : segments) {
            builder.append('/');
            for (int i = 0; i < segment.length(); i++) {
                char ch = segment.charAt(i);
                if (ch == '~') {
                    builder.append("~0");
                } else if (ch == '/') {
                    builder.append("~1");
                } else {
                    builder.append(ch);
                }
            }
        }
        return builder.toString();
    }

    /**
     * New path with {@code keys} appended. The receiver is left untouched.
     */
    public Path append(String... keys) {
        if (keys.length == 0) {
            return this;
        }
        var joined = new ArrayList<String>(segments.size() + keys.length);
        joined.addAll(segments);
        joined.addAll(Arrays.asList(keys));
        return new Path(Collections.unmodifiableList(joined));
    }

    public Path concat(Path other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var joined = new ArrayList<String>(segments.size() + other.size());
        joined.addAll(segments);
        joined.addAll(other.segments);
        return new Path(Collections.unmodifiableList(joined));
    }

    /**
     * Strips trailing array notation together with the key it belongs to.
     * {@code [a, b, -]} splits into prefix {@code [a]} and key {@code b}.
     */
    public KeySplit splitKey() {
        if (segments.isEmpty()) {
            return new KeySplit(EMPTY, "");
        }
        int keyIdx = segments.size() - 1;
        String key = segments.get(keyIdx);
        while (keyIdx > 0 && ArrayNotation.of(key).isArray()) {
            keyIdx--;
            key = segments.get(keyIdx);
        }
        return new KeySplit(subPath(0, keyIdx), key);
    }

    /**
     * Array notation in effect at {@code index}: either the segment itself is array notation
     * (unnamed array) or the following one is (named array).
     */
    public ArrayNotation arrayNotationAt(int index) {
        if (index < 0 || index >= segments.size()) {
            return ArrayNotation.INVALID;
        }
        ArrayNotation own = ArrayNotation.of(segments.get(index));
        if (own.isArray()) {
            return own;
        }
        if (index + 1 >= segments.size()) {
            return ArrayNotation.INVALID;
        }
        return ArrayNotation.of(segments.get(index + 1));
    }

    public boolean isArray(int index) {
        return arrayNotationAt(index).isArray();
    }

    public Path subPath(int fromIndex, int toIndex) {
        if (fromIndex == 0 && toIndex == segments.size()) {
            return this;
        }
        return of(segments.subList(fromIndex, toIndex));
    }

    public Path withLast(String segment) {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Cannot replace the last segment of an empty path");
        }
        var copy = new ArrayList<>(segments);
        copy.set(copy.size() - 1, segment);
        return new Path(Collections.unmodifiableList(copy));
    }

    public String get(int index) {
        return segments.get(index);
    }

    public String last() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public Iterator<String> iterator() {
        return segments.iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Path path && segments.equals(path.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return segments.toString();
    }

    /**
     * Result of {@link #splitKey()}.
     */
    public record KeySplit(Path prefix, String key) {}
}

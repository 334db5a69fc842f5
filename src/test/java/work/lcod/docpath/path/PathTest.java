package work.lcod.docpath.path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathTest {
    private static final Map<String, List<String>> JQ_CASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> POINTER_CASES = new LinkedHashMap<>();

    static {
        JQ_CASES.put("", List.of());
        JQ_CASES.put("a", List.of("a"));
        JQ_CASES.put("'a'", List.of("a"));
        JQ_CASES.put("a[]", List.of("a", "-"));
        JQ_CASES.put("'a[]'", List.of("a[]"));
        JQ_CASES.put("a[1]", List.of("a", "1"));
        JQ_CASES.put("'a[1]'", List.of("a[1]"));
        JQ_CASES.put("a.b", List.of("a", "b"));
        JQ_CASES.put("a.'b'", List.of("a", "b"));
        JQ_CASES.put("a.b[]", List.of("a", "b", "-"));
        JQ_CASES.put("a.'b[]'", List.of("a", "b[]"));
        JQ_CASES.put("a.b[1]", List.of("a", "b", "1"));
        JQ_CASES.put("a.'b[1]'", List.of("a", "b[1]"));
        JQ_CASES.put("a.b.c", List.of("a", "b", "c"));
        JQ_CASES.put("a.'b'.c", List.of("a", "b", "c"));
        JQ_CASES.put("a.b[].c", List.of("a", "b", "-", "c"));
        JQ_CASES.put("a.'b[]'.c", List.of("a", "b[]", "c"));
        JQ_CASES.put("a.b[1].c", List.of("a", "b", "1", "c"));
        JQ_CASES.put("a.'b[1]'.c", List.of("a", "b[1]", "c"));
        JQ_CASES.put("a.'b.c'", List.of("a", "b.c"));
        JQ_CASES.put("a.'b.c'[]", List.of("a", "b.c", "-"));
        JQ_CASES.put("a.'b.c'[1]", List.of("a", "b.c", "1"));
        JQ_CASES.put("a.'b.c[]'", List.of("a", "b.c[]"));
        JQ_CASES.put("a.'b.c[1]'", List.of("a", "b.c[1]"));
        JQ_CASES.put("matrix[][0]", List.of("matrix", "-", "0"));

        POINTER_CASES.put("/", List.of());
        POINTER_CASES.put("/a", List.of("a"));
        POINTER_CASES.put("/a/-", List.of("a", "-"));
        POINTER_CASES.put("/a/1", List.of("a", "1"));
        POINTER_CASES.put("/a/b/c", List.of("a", "b", "c"));
        POINTER_CASES.put("/a/b/-/c", List.of("a", "b", "-", "c"));
        POINTER_CASES.put("/a/b~1c", List.of("a", "b/c"));
        POINTER_CASES.put("/a/b~1c/-", List.of("a", "b/c", "-"));
        POINTER_CASES.put("/a/b~0c/1", List.of("a", "b~c", "1"));
        POINTER_CASES.put("/a/b~0c~1d", List.of("a", "b~c/d"));
        POINTER_CASES.put("/a/b~0c~1d/e", List.of("a", "b~c/d", "e"));
    }

    @Test
    void parsesJqNotation() {
        JQ_CASES.forEach((text, expected) -> assertEquals(expected, Path.fromJq(text).segments(), text));
    }

    @Test
    void parsesJsonPointers() {
        POINTER_CASES.forEach((text, expected) ->
            assertEquals(expected, Path.fromJsonPointer(text).segments(), text));
    }

    @Test
    void rendersJsonPointers() {
        POINTER_CASES.forEach((text, segments) -> assertEquals(text, Path.of(segments).toJsonPointer()));
    }

    @Test
    void escapesTildeBeforeSlash() {
        assertEquals("/metadata/annotations/a~0~1b", Path.of("metadata", "annotations", "a~/b").toJsonPointer());
        assertEquals(List.of("a~1"), Path.fromJsonPointer("/a~01").segments());
    }

    @Test
    void parseChoosesNotationFromLeadingSlash() {
        assertEquals(Path.of("spec", "containers", "-", "name"), Path.parse("/spec/containers/-/name"));
        assertEquals(Path.of("spec", "containers", "-", "name"), Path.parse("spec.containers[].name"));
        assertTrue(Path.parse(null).isEmpty());
    }

    @Test
    void splitKeyDropsTrailingArrayNotation() {
        assertEquals(new Path.KeySplit(Path.empty(), ""), Path.empty().splitKey());
        assertEquals(new Path.KeySplit(Path.empty(), "a"), Path.of("a").splitKey());
        assertEquals(new Path.KeySplit(Path.of("a"), "b"), Path.of("a", "b").splitKey());
        assertEquals(new Path.KeySplit(Path.of("a"), "b"), Path.of("a", "b", "-").splitKey());
        assertEquals(new Path.KeySplit(Path.of("a"), "b"), Path.of("a", "b", "1").splitKey());
        assertEquals(new Path.KeySplit(Path.of("a"), "b"), Path.of("a", "b", "-", "-").splitKey());
        assertEquals(new Path.KeySplit(Path.of("a", "-"), "b"), Path.of("a", "-", "b", "-").splitKey());
    }

    @Test
    void appendLeavesReceiverUntouched() {
        var segments = new ArrayList<>(List.of("a", "b"));
        var original = Path.of(segments);
        var extended = original.append("c");

        segments.set(0, "x");

        assertEquals(Path.of("a", "b"), original);
        assertEquals(Path.of("a", "b", "c"), extended);
        assertNotSame(original, extended);
    }

    @Test
    void concatJoinsSegments() {
        var joined = Path.of("a", "b").concat(Path.of("c", "d"));
        assertEquals(List.of("a", "b", "c", "d"), joined.segments());
        assertEquals(Path.of("a"), Path.of("a").concat(Path.empty()));
    }

    @Test
    void arrayNotationLooksAtSegmentAndSuccessor() {
        var path = Path.of("a", "b", "-", "c", "9");

        assertFalse(path.isArray(0));
        assertEquals(ArrayNotation.INVALID, path.arrayNotationAt(0));
        assertEquals(ArrayNotation.TRAVERSAL, path.arrayNotationAt(1));
        assertEquals(ArrayNotation.TRAVERSAL, path.arrayNotationAt(2));
        assertEquals(ArrayNotation.INDEX, path.arrayNotationAt(3));
        assertEquals(ArrayNotation.INDEX, path.arrayNotationAt(4));
        assertEquals(ArrayNotation.INVALID, path.arrayNotationAt(5));
        assertEquals(ArrayNotation.INVALID, path.arrayNotationAt(-1));
    }

    @Test
    void classifiesSegmentsTextually() {
        assertEquals(ArrayNotation.INDEX, ArrayNotation.of("0"));
        assertEquals(ArrayNotation.INDEX, ArrayNotation.of("0042"));
        assertEquals(ArrayNotation.TRAVERSAL, ArrayNotation.of("-"));
        assertEquals(ArrayNotation.INVALID, ArrayNotation.of("--"));
        assertEquals(ArrayNotation.INVALID, ArrayNotation.of("-1"));
        assertEquals(ArrayNotation.INVALID, ArrayNotation.of(""));
        assertEquals(ArrayNotation.INVALID, ArrayNotation.of("1a"));
    }

    @Test
    void withLastReplacesFinalSegment() {
        assertEquals(Path.of("a", "-"), Path.of("a", "0").withLast("-"));
        assertThrows(IllegalStateException.class, () -> Path.empty().withLast("-"));
    }
}

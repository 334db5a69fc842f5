package work.lcod.docpath.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.docpath.error.IndexNotationException;
import work.lcod.docpath.error.MissingArrayTraversalException;
import work.lcod.docpath.error.NotAnArrayException;
import work.lcod.docpath.path.Path;
import work.lcod.docpath.support.DocumentFixtures;

class PatchGeneratorTest {
    private Map<String, Object> root;

    @BeforeEach
    void loadDocument() {
        root = DocumentFixtures.map("testcases.json");
    }

    private GeneratedPatch generate(String jq, Object value) {
        return PatchGenerator.generate(root, Path.fromJq(jq), value);
    }

    @Test
    void wrapsValueBelowMissingObject() {
        var patch = generate("spec.field", "newValue");

        assertEquals(Path.of("spec"), patch.path());
        assertEquals(Map.of("field", "newValue"), patch.value());
    }

    @Test
    void missingLastKeyIsWrittenDirectly() {
        assertEquals(new GeneratedPatch(Path.of("kind"), "test"), generate("kind", "test"));
        assertEquals(new GeneratedPatch(Path.of("obj", "test"), "value"), generate("obj.test", "value"));
    }

    @Test
    void missingArrayBecomesSingleElementArray() {
        var patch = generate("a.test[]", "value");

        assertEquals(Path.of("a", "test"), patch.path());
        assertEquals(List.of("value"), patch.value());
    }

    @Test
    void existingArrayKeepsAppendMarker() {
        var patch = generate("a.obj.array[]", "c");

        assertEquals(Path.of("a", "obj", "array", "-"), patch.path());
        assertEquals("c", patch.value());
    }

    @Test
    void existingValueIsOverwritten() {
        assertEquals(new GeneratedPatch(Path.of("a", "obj", "array"), "value"), generate("a.obj.array", "value"));
        assertEquals(
            new GeneratedPatch(Path.of("array", "0", "obj", "value"), "newValue"),
            generate("array[].obj.value", "newValue"));
    }

    @Test
    void structuralErrorsPropagate() {
        assertThrows(NotAnArrayException.class, () -> generate("a.obj[].value", "value"));
        assertThrows(NotAnArrayException.class, () -> generate("a.obj[]", "value"));
        assertThrows(MissingArrayTraversalException.class, () -> generate("a.obj.array.key", "value"));
    }

    @Test
    void appendsNewElementWhenNoElementResolves() {
        var patch = generate("array[].obj.test", "newValue");

        assertEquals(Path.of("array", "-"), patch.path());
        assertEquals(Map.of("obj", Map.of("test", "newValue")), patch.value());
    }

    @Test
    void resolvesIndicesThroughTraversal() {
        assertEquals(Path.of("a", "array", "0", "array", "0"), generate("a.array[].array[0]", "newValue").path());
        assertEquals(Path.of("arrayInArray", "0", "0"), generate("arrayInArray[][0]", "newValue").path());
    }

    @Test
    void synthesizesNestedArrays() {
        var intoEmpty = generate("emptyArray[][]", "newValue");
        assertEquals(Path.of("emptyArray", "-"), intoEmpty.path());
        assertEquals(List.of("newValue"), intoEmpty.value());

        var fresh = generate("newArray[][]", "newValue");
        assertEquals(Path.of("newArray"), fresh.path());
        assertEquals(List.of(List.of("newValue")), fresh.value());
    }

    @Test
    void synthesizesArraysOfObjects() {
        var inNewObject = generate("a.newObj.newArray[].key", "newValue");
        assertEquals(Path.of("a", "newObj"), inNewObject.path());
        assertEquals(Map.of("newArray", List.of(Map.of("key", "newValue"))), inNewObject.value());

        var newArray = generate("a.newArray[].key", "newValue");
        assertEquals(Path.of("a", "newArray"), newArray.path());
        assertEquals(List.of(Map.of("key", "newValue")), newArray.value());
    }

    @Test
    void refusesToInventIndices() {
        assertThrows(IndexNotationException.class, () -> generate("array[3].foo", "value"));
        assertThrows(IndexNotationException.class, () -> generate("fresh.list[0].name", "value"));
    }

    @Test
    void emptyPathReturnsValue() {
        assertEquals(new GeneratedPatch(Path.empty(), "value"), PatchGenerator.generate(root, Path.empty(), "value"));
    }

    @Test
    void leavesDocumentUntouched() {
        var before = DocumentFixtures.map("testcases.json");

        generate("a.newObj.newArray[].key", "newValue");
        generate("a.obj.array[]", "c");

        assertEquals(before, root);
    }

    @Test
    void rendersAddOperation() {
        var operation = generate("metadata.labels.'app.kubernetes.io/name'", "demo").toAddOperation();

        assertEquals(PatchOperation.add("/metadata/labels", Map.of("app.kubernetes.io/name", "demo")), operation);
    }
}

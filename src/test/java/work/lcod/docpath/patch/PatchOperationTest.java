package work.lcod.docpath.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PatchOperationTest {
    @Test
    void omitsUnusedFields() {
        var json = PatchOperation.toJson(List.of(
            PatchOperation.add("/metadata/labels", Map.of("app", "demo")),
            PatchOperation.remove("/status"),
            PatchOperation.replace("/spec/replicas", 3),
            PatchOperation.copy("/a", "/b"),
            PatchOperation.move("/c", "/d")
        ));

        assertEquals(
            "[{\"op\":\"add\",\"path\":\"/metadata/labels\",\"value\":{\"app\":\"demo\"}},"
                + "{\"op\":\"remove\",\"path\":\"/status\"},"
                + "{\"op\":\"replace\",\"path\":\"/spec/replicas\",\"value\":3},"
                + "{\"op\":\"copy\",\"path\":\"/b\",\"from\":\"/a\"},"
                + "{\"op\":\"move\",\"path\":\"/d\",\"from\":\"/c\"}]",
            json);
    }

    @Test
    void keepsEmptyStringValues() {
        assertEquals(
            "[{\"op\":\"add\",\"path\":\"/metadata/annotations/x\",\"value\":\"\"}]",
            PatchOperation.toJson(List.of(PatchOperation.add("/metadata/annotations/x", ""))));
    }

    @Test
    void requiresOperationAndPath() {
        assertThrows(NullPointerException.class, () -> new PatchOperation(null, "/a", null, null));
        assertThrows(NullPointerException.class, () -> PatchOperation.remove(null));
    }
}

package work.lcod.docpath.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.docpath.error.IncorrectTypeException;

class DocumentCodecTest {
    @Test
    void readsYamlIntoMutableContainers() {
        var document = DocumentCodec.readDocument(
            "metadata:\n  name: web\nspec:\n  ports:\n    - 80\n    - 443\n",
            DocumentCodec.Format.AUTO);

        assertTrue(document instanceof LinkedHashMap<?, ?>);
        var ports = ((Map<?, ?>) document.get("spec")).get("ports");
        assertTrue(ports instanceof ArrayList<?>);
        assertEquals(List.of(80, 443), ports);
    }

    @Test
    void detectsJson() {
        var document = DocumentCodec.readDocument("  {\"a\": [1, true, null]}", DocumentCodec.Format.AUTO);

        var expected = new ArrayList<Object>();
        expected.add(1);
        expected.add(true);
        expected.add(null);
        assertEquals(expected, document.get("a"));
    }

    @Test
    void readsScalarValues() {
        assertEquals("plain", DocumentCodec.readValue("plain", DocumentCodec.Format.YAML));
        assertEquals(3, DocumentCodec.readValue("3", DocumentCodec.Format.YAML));
        assertEquals(Map.of("k", "v"), DocumentCodec.readValue("{\"k\": \"v\"}", DocumentCodec.Format.YAML));
        assertNull(DocumentCodec.readValue("", DocumentCodec.Format.JSON));
    }

    @Test
    void rootMustBeObject() {
        var error = assertThrows(
            IncorrectTypeException.class,
            () -> DocumentCodec.readDocument("[1, 2]", DocumentCodec.Format.JSON));
        assertEquals("list", error.actualType());
    }

    @Test
    void wrapsParseFailures() {
        assertThrows(UncheckedIOException.class, () -> DocumentCodec.readDocument("{\"a\":", DocumentCodec.Format.JSON));
    }

    @Test
    void parsesFormatNames() {
        assertEquals(DocumentCodec.Format.YAML, DocumentCodec.Format.from(" yaml "));
        assertEquals(DocumentCodec.Format.AUTO, DocumentCodec.Format.from(null));
        assertThrows(IllegalArgumentException.class, () -> DocumentCodec.Format.from("xml"));
    }
}

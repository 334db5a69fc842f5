package work.lcod.docpath.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.docpath.error.IncorrectTypeException;
import work.lcod.docpath.error.NoDataException;
import work.lcod.docpath.shared.DocumentValues;

/**
 * JSON / YAML reading into mutable maps and lists, and rendering back.
 */
public final class DocumentCodec {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectWriter PRETTY_WRITER = JSON_MAPPER.writerWithDefaultPrettyPrinter();

    private DocumentCodec() {}

    public enum Format {
        AUTO,
        JSON,
        YAML;

        public static Format from(String value) {
            if (value == null || value.isBlank()) {
                return AUTO;
            }
            try {
                return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported document format: " + value, ex);
            }
        }
    }

    /**
     * Reads a document whose root must be an object.
     *
     * @throws NoDataException when the input is blank
     * @throws IncorrectTypeException when the root is not an object
     */
    public static Map<String, Object> readDocument(String text, Format format) {
        Object value = readValue(text, format);
        if (value == null) {
            throw new NoDataException();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IncorrectTypeException(DocumentValues.typeName(value));
        }
        return DocumentValues.asObject(map);
    }

    /**
     * Reads any value; blank input yields {@code null}.
     */
    public static Object readValue(String text, Format format) {
        if (text == null || text.isBlank()) {
            return null;
        }
        ObjectMapper mapper = mapperFor(text, format);
        try {
            JsonNode root = mapper.readTree(text);
            return root == null || root.isMissingNode() ? null : convertNode(root);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to parse " + describe(mapper) + " document", ex);
        }
    }

    public static String toJson(Object value) {
        return write(JSON_MAPPER.writer(), value);
    }

    public static String toPrettyJson(Object value) {
        return write(PRETTY_WRITER, value);
    }

    public static String toYaml(Object value) {
        return write(YAML_MAPPER.writer(), value);
    }

    private static String write(ObjectWriter writer, Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to render document", ex);
        }
    }

    private static ObjectMapper mapperFor(String text, Format format) {
        return switch (format == null ? Format.AUTO : format) {
            case JSON -> JSON_MAPPER;
            case YAML -> YAML_MAPPER;
            case AUTO -> {
                String trimmed = text.stripLeading();
                yield trimmed.startsWith("{") || trimmed.startsWith("[") ? JSON_MAPPER : YAML_MAPPER;
            }
        };
    }

    private static String describe(ObjectMapper mapper) {
        return mapper == JSON_MAPPER ? "JSON" : "YAML";
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>(node.size());
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isBinary()) {
            return node.asText();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}

package work.lcod.docpath.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * One RFC 6902 JSON patch operation.
 */
public record PatchOperation(
    String op,
    String path,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) String from,
    @JsonInclude(JsonInclude.Include.NON_NULL) Object value
) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String ADD = "add";
    public static final String REMOVE = "remove";
    public static final String REPLACE = "replace";
    public static final String COPY = "copy";
    public static final String MOVE = "move";

    public PatchOperation {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(path, "path");
    }

    public static PatchOperation add(String path, Object value) {
        return new PatchOperation(ADD, path, null, value);
    }

    public static PatchOperation remove(String path) {
        return new PatchOperation(REMOVE, path, null, null);
    }

    public static PatchOperation replace(String path, Object value) {
        return new PatchOperation(REPLACE, path, null, value);
    }

    public static PatchOperation copy(String from, String path) {
        return new PatchOperation(COPY, path, from, null);
    }

    public static PatchOperation move(String from, String path) {
        return new PatchOperation(MOVE, path, from, null);
    }

    /**
     * Encodes the operations as a JSON patch document.
     */
    public static String toJson(List<PatchOperation> operations) {
        try {
            return JSON.writeValueAsString(operations);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("failed to encode patches", ex);
        }
    }
}

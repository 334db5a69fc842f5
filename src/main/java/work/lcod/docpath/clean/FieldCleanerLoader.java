package work.lcod.docpath.clean;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link FieldCleaner} descriptors from TOML.
 *
 * <pre>
 * [metadata]
 * fields = ["managedFields", "uid"]
 *
 * [metadata.labels]
 * fields = ["app.kubernetes.io/managed-by"]
 *
 * [status]
 * remove = true
 * </pre>
 */
public final class FieldCleanerLoader {
    private static final Logger LOG = LoggerFactory.getLogger(FieldCleanerLoader.class);
    private static final String FIELDS_KEY = "fields";
    private static final String REMOVE_KEY = "remove";

    private FieldCleanerLoader() {}

    public static FieldCleaner load(Path descriptor) {
        try {
            FieldCleaner cleaner = parse(Files.readString(descriptor), descriptor.toString());
            LOG.debug("Loaded field cleaner from {}", descriptor);
            return cleaner;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read field cleaner: " + descriptor, ex);
        }
    }

    public static FieldCleaner fromResource(String resource) {
        try (InputStream in = FieldCleanerLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing field cleaner resource: " + resource);
            }
            FieldCleaner cleaner = parse(Toml.parse(in), resource);
            LOG.debug("Loaded field cleaner from classpath:{}", resource);
            return cleaner;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read field cleaner resource: " + resource, ex);
        }
    }

    public static FieldCleaner parse(String toml, String source) {
        return parse(Toml.parse(toml), source);
    }

    private static FieldCleaner parse(TomlParseResult result, String source) {
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid field cleaner " + source + ": " + errors);
        }
        return fromTable(result, source);
    }

    private static FieldCleaner fromTable(TomlTable table, String location) {
        if (Boolean.TRUE.equals(table.getBoolean(List.of(REMOVE_KEY)))) {
            return FieldCleaner.removeAll();
        }
        List<String> fields = readFields(table, location);
        Map<String, FieldCleaner> nested = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            if (FIELDS_KEY.equals(key) || REMOVE_KEY.equals(key)) {
                continue;
            }
            Object value = table.get(List.of(key));
            if (!(value instanceof TomlTable child)) {
                throw new IllegalArgumentException("Unexpected entry " + key + " in field cleaner " + location);
            }
            FieldCleaner cleaner = fromTable(child, location + "." + key);
            if (cleaner.removesWholesale() && cleaner != FieldCleaner.removeAll()) {
                throw new IllegalArgumentException(
                    "Field cleaner " + location + "." + key + " removes nothing; use remove = true to drop it");
            }
            nested.put(key, cleaner);
        }
        return new FieldCleaner(fields, nested);
    }

    private static List<String> readFields(TomlTable table, String location) {
        Object raw = table.get(List.of(FIELDS_KEY));
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof TomlArray array)) {
            throw new IllegalArgumentException("fields of " + location + " must be an array");
        }
        var fields = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof String field)) {
                throw new IllegalArgumentException("fields of " + location + " must only contain strings");
            }
            fields.add(field);
        }
        return fields;
    }
}

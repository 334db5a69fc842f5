package work.lcod.docpath.patch;

import work.lcod.docpath.path.Path;

/**
 * Existing path prefix plus the value to add there so that the requested path resolves.
 */
public record GeneratedPatch(Path path, Object value) {
    public PatchOperation toAddOperation() {
        return PatchOperation.add(path.toJsonPointer(), value);
    }
}

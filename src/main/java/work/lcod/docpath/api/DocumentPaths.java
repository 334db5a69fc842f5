package work.lcod.docpath.api;

import work.lcod.docpath.path.Path;

/**
 * Paths of well-known Kubernetes object fields.
 */
public final class DocumentPaths {
    public static final Path METADATA = Path.of("metadata");
    public static final Path METADATA_NAME = METADATA.append("name");
    public static final Path METADATA_GENERATE_NAME = METADATA.append("generateName");
    public static final Path METADATA_NAMESPACE = METADATA.append("namespace");
    public static final Path METADATA_UID = METADATA.append("uid");
    public static final Path LABELS = METADATA.append("labels");
    public static final Path ANNOTATIONS = METADATA.append("annotations");
    public static final Path OWNER_REFERENCES = METADATA.append("ownerReferences");
    public static final Path OWNER_REFERENCE_KIND = OWNER_REFERENCES.append("-", "kind");
    public static final Path KIND = Path.of("kind");
    public static final Path API_VERSION = Path.of("apiVersion");
    public static final Path SPEC = Path.of("spec");

    private DocumentPaths() {}
}

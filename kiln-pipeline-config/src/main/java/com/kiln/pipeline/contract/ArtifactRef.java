package com.kiln.pipeline.contract;

import java.util.Map;

/**
 * One entry of a contract's {@code requires} or {@code produces} list.
 * <p>
 * Accepted shapes: a bare string (the artifact id), or a mapping with {@code artifact} (or legacy
 * {@code artifactId}), {@code optional}, {@code schema} (a type string such as {@code json}, or
 * {@code {type, ref}}), {@code from_link} and {@code path} (legacy output location relative to the link's
 * output directory).
 */
public final class ArtifactRef {

    private final String artifactId;
    private final boolean optional;
    private final String schemaType;
    private final String schemaRef;
    private final String fromLink;
    private final String path;

    public ArtifactRef(String artifactId, boolean optional, String schemaType, String schemaRef,
                       String fromLink, String path) {
        this.artifactId = artifactId;
        this.optional = optional;
        this.schemaType = schemaType;
        this.schemaRef = schemaRef;
        this.fromLink = fromLink;
        this.path = path;
    }

    public static ArtifactRef of(String artifactId) {
        return new ArtifactRef(artifactId, false, null, null, null, null);
    }

    /**
     * @param strictIds reject the legacy {@code artifactId} key
     */
    static ArtifactRef fromRaw(Object raw, boolean strictIds) {
        if (raw instanceof String) {
            return of((String) raw);
        }
        if (!(raw instanceof Map)) {
            throw new InvalidContractException("Artifact reference must be a string or mapping, got: " + raw);
        }
        Map<?, ?> m = (Map<?, ?>) raw;
        Object id = m.get("artifact");
        if (id == null && m.get("artifactId") != null) {
            if (strictIds) {
                throw new InvalidContractException("Legacy key 'artifactId' is not allowed in strict mode; use 'artifact' (" + m.get("artifactId") + ")");
            }
            id = m.get("artifactId");
        }
        if (id == null || String.valueOf(id).isBlank()) {
            throw new InvalidContractException("Artifact reference without an id: " + raw);
        }
        String schemaType = null;
        String schemaRef = null;
        Object schema = m.get("schema");
        if (schema instanceof String) {
            schemaType = (String) schema;
        } else if (schema instanceof Map) {
            Object type = ((Map<?, ?>) schema).get("type");
            Object ref = ((Map<?, ?>) schema).get("ref");
            schemaType = type != null ? String.valueOf(type) : null;
            schemaRef = ref != null ? String.valueOf(ref) : null;
        }
        return new ArtifactRef(
                String.valueOf(id),
                Boolean.TRUE.equals(m.get("optional")),
                schemaType,
                schemaRef,
                m.get("from_link") != null ? String.valueOf(m.get("from_link")) : null,
                m.get("path") != null ? String.valueOf(m.get("path")) : null);
    }

    public String getArtifactId() {
        return artifactId;
    }

    public boolean isOptional() {
        return optional;
    }

    public String getSchemaType() {
        return schemaType;
    }

    /** Name of a registered structural schema, e.g. {@code project.ir}; null when none. */
    public String getSchemaRef() {
        return schemaRef;
    }

    public String getFromLink() {
        return fromLink;
    }

    public String getPath() {
        return path;
    }

    public boolean isJson() {
        return "json".equalsIgnoreCase(schemaType);
    }

    @Override
    public String toString() {
        return artifactId + (optional ? "?" : "");
    }
}

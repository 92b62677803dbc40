package com.kiln.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * A registered artifact: id, absolute path, SHA-256 digest of the file at registration time, schema tag and
 * producing link. {@code digest} is null only when the file did not exist when it was registered.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"artifact_id", "path", "digest", "schema", "producer_link_id", "blob_uri"})
public final class ArtifactRecord {

    private final String artifactId;
    private final String path;
    private final String digest;
    private final String schema;
    private final String producerLinkId;
    private final String blobUri;

    @JsonCreator
    public ArtifactRecord(
            @JsonProperty("artifact_id") String artifactId,
            @JsonProperty("path") String path,
            @JsonProperty("digest") String digest,
            @JsonProperty("schema") String schema,
            @JsonProperty("producer_link_id") String producerLinkId,
            @JsonProperty("blob_uri") String blobUri) {
        this.artifactId = Objects.requireNonNull(artifactId, "artifactId");
        this.path = Objects.requireNonNull(path, "path");
        this.digest = digest;
        this.schema = schema;
        this.producerLinkId = producerLinkId;
        this.blobUri = blobUri;
    }

    @JsonProperty("artifact_id")
    public String getArtifactId() {
        return artifactId;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    public Path toPath() {
        return Paths.get(path);
    }

    @JsonProperty("digest")
    public String getDigest() {
        return digest;
    }

    @JsonProperty("schema")
    public String getSchema() {
        return schema;
    }

    @JsonProperty("producer_link_id")
    public String getProducerLinkId() {
        return producerLinkId;
    }

    /** Optional pointer to an externally stored copy (object store, blob service). */
    @JsonProperty("blob_uri")
    public String getBlobUri() {
        return blobUri;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArtifactRecord)) return false;
        ArtifactRecord that = (ArtifactRecord) o;
        return artifactId.equals(that.artifactId) && path.equals(that.path)
                && Objects.equals(digest, that.digest) && Objects.equals(schema, that.schema)
                && Objects.equals(producerLinkId, that.producerLinkId) && Objects.equals(blobUri, that.blobUri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(artifactId, path, digest, schema, producerLinkId, blobUri);
    }

    @Override
    public String toString() {
        return "ArtifactRecord{" + artifactId + " <- " + producerLinkId + ", digest=" + digest + "}";
    }
}

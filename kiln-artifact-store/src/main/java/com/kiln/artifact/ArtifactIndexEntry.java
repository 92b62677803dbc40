package com.kiln.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/** Entry of the project artifact index: where an artifact lives, its digest, and which run produced it. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"path", "digest", "link_id", "run_id", "created_at"})
public final class ArtifactIndexEntry {

    private final String path;
    private final String digest;
    private final String linkId;
    private final String runId;
    private final String createdAt;

    @JsonCreator
    public ArtifactIndexEntry(
            @JsonProperty("path") String path,
            @JsonProperty("digest") String digest,
            @JsonProperty("link_id") String linkId,
            @JsonProperty("run_id") String runId,
            @JsonProperty("created_at") String createdAt) {
        this.path = path;
        this.digest = digest;
        this.linkId = linkId;
        this.runId = runId;
        this.createdAt = createdAt;
    }

    /** Entry for a record just validated in the given pipeline run, stamped with the current UTC time. */
    public static ArtifactIndexEntry of(ArtifactRecord record, String digest, String runId) {
        return new ArtifactIndexEntry(record.getPath(), digest, record.getProducerLinkId(), runId, nowIso());
    }

    /** ISO-8601 UTC with a {@code Z} suffix, millisecond precision. */
    public static String nowIso() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS).toString();
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("digest")
    public String getDigest() {
        return digest;
    }

    @JsonProperty("link_id")
    public String getLinkId() {
        return linkId;
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("created_at")
    public String getCreatedAt() {
        return createdAt;
    }
}

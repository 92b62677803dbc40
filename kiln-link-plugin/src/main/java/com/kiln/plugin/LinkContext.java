package com.kiln.plugin;

import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.sandbox.Sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a link may see of the run that invokes it. Immutable; built by the orchestrator per link
 * execution. Artifact lookups are read-only; outputs go through {@link #getSandbox()}.
 */
public final class LinkContext {

    private final String projectId;
    private final Path projectRoot;
    private final String pipelineId;
    private final String pipelineRunId;
    private final String linkRunId;
    private final String linkId;
    private final String workerId;
    private final String profile;
    private final String policyVersion;
    private final String policyDigest;
    private final ArtifactStore artifactStore;
    private final Map<String, ArtifactIndexEntry> artifactIndex;
    private final Sandbox sandbox;

    private LinkContext(Builder b) {
        this.projectId = Objects.requireNonNull(b.projectId, "projectId");
        this.projectRoot = Objects.requireNonNull(b.projectRoot, "projectRoot");
        this.pipelineId = b.pipelineId;
        this.pipelineRunId = b.pipelineRunId;
        this.linkRunId = b.linkRunId;
        this.linkId = Objects.requireNonNull(b.linkId, "linkId");
        this.workerId = b.workerId;
        this.profile = b.profile;
        this.policyVersion = b.policyVersion;
        this.policyDigest = b.policyDigest;
        this.artifactStore = Objects.requireNonNull(b.artifactStore, "artifactStore");
        this.artifactIndex = b.artifactIndex != null ? Map.copyOf(b.artifactIndex) : Map.of();
        this.sandbox = Objects.requireNonNull(b.sandbox, "sandbox");
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getProjectId() {
        return projectId;
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    /** Run id shared by every link of this pipeline run. */
    public String getPipelineRunId() {
        return pipelineRunId;
    }

    /** Run id of this link execution; matches the ledger events it produces. */
    public String getLinkRunId() {
        return linkRunId;
    }

    public String getLinkId() {
        return linkId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getProfile() {
        return profile;
    }

    public String getPolicyVersion() {
        return policyVersion;
    }

    public String getPolicyDigest() {
        return policyDigest;
    }

    /** Registered artifact by id (this run's registrations and rehydrated ones). */
    public Optional<ArtifactRecord> getArtifact(String artifactId) {
        return artifactStore.get(artifactId);
    }

    public List<ArtifactRecord> listArtifacts() {
        return artifactStore.list();
    }

    /** Snapshot of the project artifact index taken when the link started. */
    public Map<String, ArtifactIndexEntry> getArtifactIndex() {
        return artifactIndex;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    public static final class Builder {
        private String projectId;
        private Path projectRoot;
        private String pipelineId;
        private String pipelineRunId;
        private String linkRunId;
        private String linkId;
        private String workerId;
        private String profile;
        private String policyVersion;
        private String policyDigest;
        private ArtifactStore artifactStore;
        private Map<String, ArtifactIndexEntry> artifactIndex;
        private Sandbox sandbox;

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public Builder pipelineId(String pipelineId) {
            this.pipelineId = pipelineId;
            return this;
        }

        public Builder pipelineRunId(String pipelineRunId) {
            this.pipelineRunId = pipelineRunId;
            return this;
        }

        public Builder linkRunId(String linkRunId) {
            this.linkRunId = linkRunId;
            return this;
        }

        public Builder linkId(String linkId) {
            this.linkId = linkId;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder policy(String version, String digest) {
            this.policyVersion = version;
            this.policyDigest = digest;
            return this;
        }

        public Builder artifactStore(ArtifactStore artifactStore) {
            this.artifactStore = artifactStore;
            return this;
        }

        public Builder artifactIndex(Map<String, ArtifactIndexEntry> artifactIndex) {
            this.artifactIndex = artifactIndex;
            return this;
        }

        public Builder sandbox(Sandbox sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public LinkContext build() {
            return new LinkContext(this);
        }
    }
}

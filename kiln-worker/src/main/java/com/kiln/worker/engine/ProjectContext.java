package com.kiln.worker.engine;

import com.kiln.artifact.ArtifactIndex;
import com.kiln.artifact.ArtifactStore;
import com.kiln.ledger.RunLedger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Run-scoped state for one pipeline execution: identities, the project artifact index, the status of each link
 * so far, per-link run records for the summary, and budget violations. Owned by the orchestrator thread; links
 * see it only through their {@code LinkContext}.
 */
public final class ProjectContext {

    private final String projectId;
    private final Path projectRoot;
    private final String pipelineId;
    private final String pipelineRunId;
    private final String workerId;
    private final String profile;
    private final long lockWaitTimeMs;
    private final ArtifactStore artifactStore;
    private final ArtifactIndex artifactIndex;
    private final RunLedger ledger;

    private final Map<String, LinkStatus> statusIndex = new LinkedHashMap<>();
    private final Set<String> reusedLinks = new LinkedHashSet<>();
    private final Map<String, Map<String, Object>> linkRecords = new LinkedHashMap<>();
    private final List<Map<String, Object>> budgetViolations = new ArrayList<>();

    ProjectContext(String projectId, Path projectRoot, String pipelineId, String pipelineRunId, String workerId,
                   String profile, long lockWaitTimeMs, ArtifactStore artifactStore, ArtifactIndex artifactIndex,
                   RunLedger ledger) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        this.pipelineId = pipelineId;
        this.pipelineRunId = pipelineRunId;
        this.workerId = workerId;
        this.profile = profile;
        this.lockWaitTimeMs = lockWaitTimeMs;
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore");
        this.artifactIndex = Objects.requireNonNull(artifactIndex, "artifactIndex");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
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

    public String getPipelineRunId() {
        return pipelineRunId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getProfile() {
        return profile;
    }

    public long getLockWaitTimeMs() {
        return lockWaitTimeMs;
    }

    public ArtifactStore getArtifactStore() {
        return artifactStore;
    }

    public ArtifactIndex getArtifactIndex() {
        return artifactIndex;
    }

    public RunLedger getLedger() {
        return ledger;
    }

    void markStatus(String linkId, LinkStatus status) {
        statusIndex.put(linkId, status);
    }

    void markReused(String linkId) {
        statusIndex.put(linkId, LinkStatus.SKIPPED);
        reusedLinks.add(linkId);
    }

    public LinkStatus getStatus(String linkId) {
        return statusIndex.get(linkId);
    }

    public Map<String, LinkStatus> getStatusIndex() {
        return Collections.unmodifiableMap(statusIndex);
    }

    /** True when the link succeeded in this run or was skipped because its previous outputs were reused. */
    public boolean hasSucceeded(String linkId) {
        return statusIndex.get(linkId) == LinkStatus.SUCCEEDED || reusedLinks.contains(linkId);
    }

    public boolean hasFailed(String linkId) {
        return statusIndex.get(linkId) == LinkStatus.FAILED;
    }

    public boolean isReused(String linkId) {
        return reusedLinks.contains(linkId);
    }

    void recordLink(String linkId, Map<String, Object> record) {
        linkRecords.put(linkId, record);
    }

    /** Per-link records for the run summary: duration, skipped flag, reason or error, metrics. */
    public Map<String, Map<String, Object>> getLinkRecords() {
        return Collections.unmodifiableMap(linkRecords);
    }

    void addBudgetViolation(Map<String, Object> violation) {
        budgetViolations.add(violation);
    }

    public List<Map<String, Object>> getBudgetViolations() {
        return Collections.unmodifiableList(budgetViolations);
    }
}

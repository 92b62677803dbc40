package com.kiln.worker.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactStore;
import com.kiln.policy.RuntimePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code artifacts/package.metrics/run_summary.json}, the canonical record of one pipeline run, and
 * indexes it as {@value #SUMMARY_ARTIFACT_ID}.
 */
final class RunSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final String SUMMARY_ARTIFACT_ID = "kiln.metrics.run_summary";
    static final String METRICS_LINK_ID = "package.metrics";
    static final String SUMMARY_FILE = "run_summary.json";

    private final RuntimePolicy policy;

    RunSummaryWriter(RuntimePolicy policy) {
        this.policy = policy;
    }

    /**
     * @param startedAt   epoch seconds
     * @param endedAt     epoch seconds
     * @param failureLink null when the run succeeded
     */
    Path write(ProjectContext context, Path pipelinePath, double startedAt, double endedAt, long durationMs,
               String failureLink, String failureError) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", context.getPipelineRunId());
        summary.put("worker_id", context.getWorkerId());
        summary.put("project_id", context.getProjectId());
        summary.put("pipeline_id", context.getPipelineId());
        summary.put("pipeline_path", pipelinePath != null ? pipelinePath.toString() : null);
        summary.put("pipeline_digest", pipelineDigest(pipelinePath));
        summary.put("profile", context.getProfile());

        Map<String, Object> policyInfo = new LinkedHashMap<>();
        policyInfo.put("version", policy.getVersion());
        policyInfo.put("digest", policy.getDigest());
        summary.put("policy", policyInfo);

        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("started_at", startedAt);
        timing.put("ended_at", endedAt);
        timing.put("duration_ms", durationMs);
        timing.put("lock_wait_time_ms", context.getLockWaitTimeMs());
        summary.put("timing", timing);

        summary.put("links", context.getLinkRecords());
        summary.put("status", failureLink != null ? "FAILED" : "SUCCEEDED");
        if (failureLink != null) {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("link_id", failureLink);
            failure.put("error", failureError);
            summary.put("failure", failure);
        } else {
            summary.put("failure", null);
        }
        summary.put("budget_violations", context.getBudgetViolations());

        Map<String, Object> perLink = new LinkedHashMap<>();
        perLink.put("max_wall_time_sec", policy.getMaxWallTimeSec());
        perLink.put("max_output_bytes", policy.getMaxOutputBytes());
        Map<String, Object> perProject = new LinkedHashMap<>();
        perProject.put("max_project_bytes", policy.getMaxProjectBytes());
        Map<String, Object> enforced = new LinkedHashMap<>();
        enforced.put("per_link", perLink);
        enforced.put("per_project", perProject);
        summary.put("budgets_enforced", enforced);

        Path file = context.getProjectRoot().resolve(ArtifactStore.ARTIFACTS_DIR).resolve(METRICS_LINK_ID).resolve(SUMMARY_FILE);
        try {
            Files.createDirectories(file.getParent());
            MAPPER.writeValue(file.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run summary " + file, e);
        }
        context.getArtifactIndex().put(SUMMARY_ARTIFACT_ID, new ArtifactIndexEntry(
                file.toAbsolutePath().normalize().toString(), ArtifactDigests.sha256(file), METRICS_LINK_ID,
                context.getPipelineRunId(), ArtifactIndexEntry.nowIso()));
        log.debug("Run summary written | runId={} | path={}", context.getPipelineRunId(), file);
        return file;
    }

    static String pipelineDigest(Path pipelinePath) {
        if (pipelinePath == null || !Files.isRegularFile(pipelinePath)) {
            return "unknown";
        }
        return ArtifactDigests.sha256(pipelinePath);
    }
}

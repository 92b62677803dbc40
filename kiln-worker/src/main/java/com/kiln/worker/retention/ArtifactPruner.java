package com.kiln.worker.retention;

import com.kiln.artifact.ArtifactIndex;
import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactStore;
import com.kiln.ledger.JsonLinesLedgerStore;
import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.policy.RetentionRules;
import com.kiln.sandbox.DiskUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Deletes indexed artifacts that no retained run needs. Runs are reconstructed from the ledger; the ledger itself
 * is never modified.
 */
public final class ArtifactPruner {

    private static final Logger log = LoggerFactory.getLogger(ArtifactPruner.class);

    public static final String EVIDENCE_PACK_ARTIFACT_ID = "kiln.evidence.pack";
    static final String PROJECT_ERROR_ID = "__project__";
    static final String STEP_LINK_COMPLETE = "link_complete";

    private final Path projectsDir;
    private final RetentionRules rules;

    public ArtifactPruner(Path projectsDir, RetentionRules rules) {
        this.projectsDir = projectsDir;
        this.rules = rules;
    }

    public PruningReport pruneProject(String projectId, boolean dryRun) {
        PruningReport report = new PruningReport(projectId);
        Path projectRoot = projectsDir.resolve(projectId);
        if (!Files.isDirectory(projectRoot)) {
            report.addError(PROJECT_ERROR_ID, "Project not found: " + projectId, projectRoot.toString());
            return report;
        }

        List<RunHistory> runs = runHistory(new JsonLinesLedgerStore(projectRoot).readAll());
        Set<String> keptRuns = runsToKeep(runs, System.currentTimeMillis() / 1000.0);
        ArtifactIndex index = ArtifactIndex.load(projectRoot);
        Set<String> removed = new HashSet<>();

        for (Map.Entry<String, ArtifactIndexEntry> e : index.asMap().entrySet()) {
            String artifactId = e.getKey();
            ArtifactIndexEntry entry = e.getValue();
            String keepReason = keepReason(artifactId, entry, keptRuns);
            if (keepReason != null) {
                report.addPreserved(artifactId, keepReason, entry.getPath());
                continue;
            }
            Path file = Paths.get(entry.getPath());
            if (!Files.exists(file)) {
                removed.add(artifactId);
                continue;
            }
            long size = DiskUsage.totalBytes(file);
            if (dryRun) {
                report.addDeleted(artifactId, "retention_policy (dry-run)", entry.getPath(), size);
                continue;
            }
            try {
                deleteRecursively(file);
                report.addDeleted(artifactId, "retention_policy", entry.getPath(), size);
                removed.add(artifactId);
            } catch (IOException ex) {
                log.warn("Failed to delete artifact | projectId={} | artifactId={} | path={} | error={}",
                        projectId, artifactId, file, ex.getMessage());
                report.addError(artifactId, ex.toString(), entry.getPath());
            }
        }

        if (!dryRun) {
            if (!removed.isEmpty()) {
                removed.forEach(index::remove);
                index.save(projectRoot);
            }
            removeEmptyDirs(projectRoot.resolve(ArtifactStore.ARTIFACTS_DIR));
        }
        log.info("Pruned project | projectId={} | dryRun={} | preserved={} | deleted={} | errors={} | freedBytes={}",
                projectId, dryRun, report.getPreserved().size(), report.getDeleted().size(),
                report.getErrors().size(), report.getSpaceFreedBytes());
        return report;
    }

    /** Prunes every project directory; names starting with a dot are skipped. */
    public List<PruningReport> pruneAllProjects(boolean dryRun) {
        List<PruningReport> reports = new ArrayList<>();
        if (!Files.isDirectory(projectsDir)) {
            log.warn("Projects directory not found | path={}", projectsDir);
            return reports;
        }
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectsDir, Files::isDirectory)) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list projects in " + projectsDir, e);
        }
        dirs.sort(Comparator.comparing(p -> p.getFileName().toString()));
        for (Path dir : dirs) {
            String name = dir.getFileName().toString();
            if (!name.startsWith(".")) {
                reports.add(pruneProject(name, dryRun));
            }
        }
        return reports;
    }

    private String keepReason(String artifactId, ArtifactIndexEntry entry, Set<String> keptRuns) {
        if (rules.getProtectedArtifacts().contains(artifactId)) {
            return "protected_artifact_type";
        }
        if (EVIDENCE_PACK_ARTIFACT_ID.equals(artifactId) && rules.shouldKeepEvidencePack()) {
            return "always_keep_evidence_pack";
        }
        if (entry.getRunId() == null || entry.getRunId().isEmpty()) {
            return "no_run_tracking";
        }
        if (keptRuns.contains(entry.getRunId())) {
            return "retained_run";
        }
        return null;
    }

    Set<String> runsToKeep(List<RunHistory> runs, double nowEpochSec) {
        Set<String> keep = new HashSet<>();
        double cutoff = nowEpochSec - rules.getKeepFailedRunsDays() * 24.0 * 60 * 60;
        int successful = 0;
        for (RunHistory run : runs) {
            if (run.status == LedgerStatus.SUCCEEDED) {
                if (successful < rules.getKeepLastNRuns()) {
                    keep.add(run.runId);
                    successful++;
                }
            } else if (run.status == LedgerStatus.FAILED && run.endedAt > cutoff) {
                keep.add(run.runId);
            }
        }
        return keep;
    }

    /**
     * Groups events by pipeline run ({@code metrics.run_id}, else the event's {@code run_id}), newest first. A run's
     * status is its last SUCCEEDED or FAILED {@code link_complete}; without one it is FAILED if any event failed,
     * SUCCEEDED otherwise.
     */
    static List<RunHistory> runHistory(List<LedgerEvent> events) {
        Map<String, RunHistory> byRun = new LinkedHashMap<>();
        for (LedgerEvent event : events) {
            Object metricsRunId = event.getMetrics().get("run_id");
            String runId = metricsRunId != null && !String.valueOf(metricsRunId).isEmpty()
                    ? String.valueOf(metricsRunId) : event.getRunId();
            if (runId == null || runId.isEmpty()) {
                continue;
            }
            byRun.computeIfAbsent(runId, RunHistory::new).add(event);
        }
        List<RunHistory> runs = new ArrayList<>(byRun.values());
        runs.sort(Comparator.comparingDouble((RunHistory r) -> r.startedAt).reversed());
        return runs;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            List<Path> nested;
            try (Stream<Path> walk = Files.walk(path)) {
                nested = new ArrayList<>();
                walk.sorted(Comparator.reverseOrder()).forEach(nested::add);
            }
            for (Path p : nested) {
                Files.deleteIfExists(p);
            }
        } else {
            Files.deleteIfExists(path);
        }
    }

    private static void removeEmptyDirs(Path artifactsRoot) {
        if (!Files.isDirectory(artifactsRoot)) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(artifactsRoot, Files::isDirectory)) {
            for (Path linkDir : stream) {
                if (isEmpty(linkDir)) {
                    Files.delete(linkDir);
                    log.debug("Removed empty link directory | path={}", linkDir);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to clean empty link directories | path={} | error={}", artifactsRoot, e.getMessage());
        }
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    static final class RunHistory {
        final String runId;
        LedgerStatus status;
        double startedAt = Double.MAX_VALUE;
        double endedAt;
        private LedgerStatus lastComplete;
        private boolean anyFailed;

        RunHistory(String runId) {
            this.runId = runId;
        }

        void add(LedgerEvent event) {
            startedAt = Math.min(startedAt, event.getTimestamp());
            endedAt = Math.max(endedAt, event.getTimestamp());
            if (event.getStatus() == LedgerStatus.FAILED) {
                anyFailed = true;
            }
            if (STEP_LINK_COMPLETE.equals(event.getStepId())
                    && (event.getStatus() == LedgerStatus.SUCCEEDED || event.getStatus() == LedgerStatus.FAILED)) {
                lastComplete = event.getStatus();
            }
            status = lastComplete != null ? lastComplete : anyFailed ? LedgerStatus.FAILED : LedgerStatus.SUCCEEDED;
        }
    }
}

package com.kiln.worker.retention;

import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactIndex;
import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.ledger.JsonLinesLedgerStore;
import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.policy.RetentionRules;
import com.kiln.worker.ProjectFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactPrunerTest {

    @TempDir
    Path projectsDir;

    private Path projectRoot;
    private ArtifactPruner pruner;

    @BeforeEach
    void setUp() throws Exception {
        projectRoot = Files.createDirectories(projectsDir.resolve(ProjectFixture.PROJECT_ID));
        RetentionRules rules = ProjectFixture.policy(30, 1_000, 1_000, 1).getRetention();
        pruner = new ArtifactPruner(projectsDir, rules);

        JsonLinesLedgerStore ledger = new JsonLinesLedgerStore(projectRoot);
        ledger.append(complete("r1", 1_000, LedgerStatus.SUCCEEDED));
        ledger.append(complete("r2", 2_000, LedgerStatus.SUCCEEDED));
        ledger.append(complete("r3", 3_000, LedgerStatus.FAILED));

        ArtifactIndex index = ArtifactIndex.empty();
        index.put("a1", entry("a", "a1.txt", "r1", 10));
        index.put("b2", entry("b", "b2.txt", "r2", 20));
        index.put("c3", entry("c", "c3.txt", "r3", 30));
        index.put(ArtifactPruner.EVIDENCE_PACK_ARTIFACT_ID, entry("e", "pack.zip", "r1", 40));
        index.put("untracked", entry("n", "n.txt", "", 50));
        index.save(projectRoot);
    }

    private static LedgerEvent complete(String runId, double timestamp, LedgerStatus status) {
        return new LedgerEvent(timestamp, ProjectFixture.PROJECT_ID, "build", "gen", "link-" + runId,
                "link_complete", status, null, null, Map.of("run_id", runId), null, null, null, null);
    }

    private ArtifactIndexEntry entry(String linkId, String name, String runId, int size) throws Exception {
        Path file = Files.createDirectories(projectRoot.resolve("artifacts").resolve(linkId)).resolve(name);
        Files.write(file, new byte[size]);
        return new ArtifactIndexEntry(file.toString(), ArtifactDigests.sha256(file), linkId, runId,
                ArtifactIndexEntry.nowIso());
    }

    private static Set<String> ids(List<Map<String, Object>> rows) {
        return rows.stream().map(r -> (String) r.get("artifact_id")).collect(Collectors.toSet());
    }

    @Test
    void pruneProject_deletesArtifactsOfRunsOutsideTheRetentionWindow() {
        PruningReport report = pruner.pruneProject(ProjectFixture.PROJECT_ID, false);

        assertEquals(Set.of("a1", "c3"), ids(report.getDeleted()));
        assertEquals(Set.of("b2", ArtifactPruner.EVIDENCE_PACK_ARTIFACT_ID, "untracked"), ids(report.getPreserved()));
        assertTrue(report.getErrors().isEmpty());
        assertEquals(40L, report.getSpaceFreedBytes());

        assertFalse(Files.exists(projectRoot.resolve("artifacts/a/a1.txt")));
        assertFalse(Files.exists(projectRoot.resolve("artifacts/a")));
        assertFalse(Files.exists(projectRoot.resolve("artifacts/c")));
        assertTrue(Files.exists(projectRoot.resolve("artifacts/b/b2.txt")));
        ArtifactIndex index = ArtifactIndex.load(projectRoot);
        assertFalse(index.contains("a1"));
        assertFalse(index.contains("c3"));
        assertEquals(3, index.size());
        assertTrue(Files.exists(new JsonLinesLedgerStore(projectRoot).getEventsFile()));
    }

    @Test
    void pruneProject_recordsWhyArtifactsWereKept() {
        PruningReport report = pruner.pruneProject(ProjectFixture.PROJECT_ID, false);

        Map<String, Object> reasons = report.getPreserved().stream()
                .collect(Collectors.toMap(r -> (String) r.get("artifact_id"), r -> r.get("reason")));
        assertEquals("retained_run", reasons.get("b2"));
        assertEquals("protected_artifact_type", reasons.get(ArtifactPruner.EVIDENCE_PACK_ARTIFACT_ID));
        assertEquals("no_run_tracking", reasons.get("untracked"));
    }

    @Test
    void pruneProject_dryRunReportsWithoutTouchingFiles() {
        PruningReport report = pruner.pruneProject(ProjectFixture.PROJECT_ID, true);

        assertEquals(Set.of("a1", "c3"), ids(report.getDeleted()));
        assertEquals("retention_policy (dry-run)", report.getDeleted().get(0).get("reason"));
        assertTrue(Files.exists(projectRoot.resolve("artifacts/a/a1.txt")));
        assertEquals(5, ArtifactIndex.load(projectRoot).size());
    }

    @Test
    void pruneProject_unknownProjectIsReportedAsAnError() {
        PruningReport report = pruner.pruneProject("ghost", false);

        assertEquals(1, report.getErrors().size());
        assertEquals(ArtifactPruner.PROJECT_ERROR_ID, report.getErrors().get(0).get("artifact_id"));
    }

    @Test
    void pruneAllProjects_skipsHiddenDirectories() throws Exception {
        Files.createDirectories(projectsDir.resolve(".trash"));
        Files.createDirectories(projectsDir.resolve("empty"));

        List<PruningReport> reports = pruner.pruneAllProjects(true);

        assertEquals(List.of(ProjectFixture.PROJECT_ID, "empty"),
                reports.stream().map(PruningReport::getProjectId).collect(Collectors.toList()));
    }

    @Test
    void runsToKeep_keepsRecentFailuresAndTheNewestSuccesses() {
        double now = 10_000_000;
        List<ArtifactPruner.RunHistory> runs = ArtifactPruner.runHistory(List.of(
                complete("old-ok", 100, LedgerStatus.SUCCEEDED),
                complete("new-ok", now - 60, LedgerStatus.SUCCEEDED),
                complete("fresh-fail", now - 3_600, LedgerStatus.FAILED),
                complete("stale-fail", now - 30 * 86_400, LedgerStatus.FAILED)));

        assertEquals(Set.of("new-ok", "fresh-fail"), pruner.runsToKeep(runs, now));
    }

    @Test
    void runHistory_usesTheLastLinkCompleteAsTheRunStatus() {
        List<ArtifactPruner.RunHistory> runs = ArtifactPruner.runHistory(List.of(
                complete("r", 1, LedgerStatus.FAILED),
                complete("r", 2, LedgerStatus.SUCCEEDED)));

        assertEquals(1, runs.size());
        assertEquals(LedgerStatus.SUCCEEDED, runs.get(0).status);
        assertEquals(1.0, runs.get(0).startedAt, 1e-9);
        assertEquals(2.0, runs.get(0).endedAt, 1e-9);
    }
}

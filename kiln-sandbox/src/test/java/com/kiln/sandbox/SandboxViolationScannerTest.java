package com.kiln.sandbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SandboxViolationScannerTest {

    @TempDir
    Path projectRoot;

    @Test
    void findLeaks_reportsOnlyNewOrChangedFilesOutsideAllowedRoots() throws Exception {
        write("src/main.py", "print(1)");
        write("notes.txt", "keep");
        FilesystemSnapshot before = FilesystemSnapshot.capture(projectRoot);

        write("artifacts/gen/out.json", "{}");
        write("ledger/events.jsonl", "{}");
        write("inputs/extra.txt", "ok");
        write("src/hack.py", "evil");
        write("artifacts/other/out.json", "{}");
        touch("src/main.py");
        FilesystemSnapshot after = FilesystemSnapshot.capture(projectRoot);

        List<String> leaks = SandboxViolationScanner.forLink("artifacts/gen", false).findLeaks(before, after);

        assertEquals(List.of("artifacts/other/out.json", "src/hack.py", "src/main.py"), leaks);
    }

    @Test
    void findLeaks_srcAllowedWhenGranted() throws Exception {
        FilesystemSnapshot before = FilesystemSnapshot.capture(projectRoot);
        write("src/patched.py", "x");

        List<String> leaks = SandboxViolationScanner.forLink("artifacts/impl.apply_patchset", true)
                .findLeaks(before, FilesystemSnapshot.capture(projectRoot));

        assertTrue(leaks.isEmpty());
    }

    @Test
    void findLeaks_reportsFilesNamedLikeOrchestratorStateAnywhere() throws Exception {
        write("src/main.py", "print(1)");
        FilesystemSnapshot before = FilesystemSnapshot.capture(projectRoot);
        write("artifact_index.json", "{}");
        write("pipeline.yaml", "links: []");
        write("artifacts/package.metrics/run_summary.json", "{}");
        write("src/package.metrics/evil.py", "x");
        write("shadow/maturity.json", "{}");

        List<String> leaks = SandboxViolationScanner.forLink("artifacts/gen", false)
                .findLeaks(before, FilesystemSnapshot.capture(projectRoot));

        assertEquals(List.of("artifact_index.json", "artifacts/package.metrics/run_summary.json", "pipeline.yaml",
                "shadow/maturity.json", "src/package.metrics/evil.py"), leaks);
    }

    @Test
    void findLeaks_reportsManifestWritesEvenInsideTheOwnOutputDirectory() throws Exception {
        write("artifacts/gen/.kiln_artifacts.json", "{}");
        FilesystemSnapshot before = FilesystemSnapshot.capture(projectRoot);
        write("artifacts/gen/out.json", "{}");
        write("artifacts/other/.kiln_artifacts.json", "{}");
        write("artifacts/gen/.kiln_artifacts.json", "{\"forged\": {}}");
        touch("artifacts/gen/.kiln_artifacts.json");

        List<String> leaks = SandboxViolationScanner.forLink("artifacts/gen", true)
                .findLeaks(before, FilesystemSnapshot.capture(projectRoot));

        assertEquals(List.of("artifacts/gen/.kiln_artifacts.json", "artifacts/other/.kiln_artifacts.json"), leaks);
    }

    @Test
    void findLeaks_ledgerAndRunsStayWritable() throws Exception {
        FilesystemSnapshot before = FilesystemSnapshot.capture(projectRoot);
        write("ledger/events.jsonl", "{}");
        write("runs/r1/log.txt", "x");

        List<String> leaks = SandboxViolationScanner.forLink("artifacts/gen", false)
                .findLeaks(before, FilesystemSnapshot.capture(projectRoot));

        assertTrue(leaks.isEmpty(), leaks.toString());
    }

    @Test
    void prefixTrie_matchesWholeSegmentsOnly() {
        AllowedPrefixTrie trie = new AllowedPrefixTrie().add("artifacts/gen").add("ledger");

        assertTrue(trie.matches("artifacts/gen/out.json"));
        assertTrue(trie.matches("ledger/events.jsonl"));
        assertFalse(trie.matches("artifacts/generator/out.json"));
        assertFalse(trie.matches("artifacts"));
        assertFalse(trie.matches("ledger.txt"));
    }

    @Test
    void diskUsage_sumsNestedFiles() throws Exception {
        write("artifacts/gen/a.bin", "12345");
        write("artifacts/gen/sub/b.bin", "123");

        assertEquals(8L, DiskUsage.totalBytes(projectRoot.resolve("artifacts/gen")));
        assertEquals(0L, DiskUsage.totalBytes(projectRoot.resolve("nothing")));
    }

    private void write(String relative, String content) throws Exception {
        Path p = projectRoot.resolve(relative);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content);
    }

    private void touch(String relative) throws Exception {
        Path p = projectRoot.resolve(relative);
        Files.setLastModifiedTime(p, FileTime.from(Instant.now().plusSeconds(60)));
    }
}

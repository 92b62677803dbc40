package com.kiln.worker.shadow;

import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactIndexEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParityComparatorTest {

    @TempDir
    Path dir;

    private final ParityComparator comparator = new ParityComparator();

    private ArtifactIndexEntry entry(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return new ArtifactIndexEntry(file.toString(), ArtifactDigests.sha256(file), "link", "run", "now");
    }

    @Test
    void compare_irsWithTheSameNodeNamesAreAtParity() throws Exception {
        ArtifactIndexEntry stable = entry("a.json", "{\"nodes\":[{\"name\":\"x\",\"role\":\"db\"},{\"name\":\"y\"}]}");
        ArtifactIndexEntry shadow = entry("b.json", "{\"nodes\":[{\"name\":\"y\"},{\"name\":\"x\",\"role\":\"cache\"}]}");

        ParityResult result = comparator.compare(Map.of("ir", stable), Map.of("ir", shadow));

        assertTrue(result.isParity());
        assertEquals(1.0, result.getOverlap(), 1e-9);
        assertTrue(result.getMismatches().isEmpty());
    }

    @Test
    void compare_nodeOverlapIsJaccard() throws Exception {
        ArtifactIndexEntry stable = entry("a.json", "{\"nodes\":[{\"name\":\"x\"},{\"name\":\"y\"}]}");
        ArtifactIndexEntry shadow = entry("b.json", "{\"nodes\":[{\"name\":\"y\"},{\"name\":\"z\"}]}");

        ParityResult result = comparator.compare(Map.of("ir", stable), Map.of("ir", shadow));

        assertFalse(result.isParity());
        assertEquals(1.0 / 3.0, result.getOverlap(), 1e-9);
        assertEquals(1, result.getMismatches().size());
    }

    @Test
    void compare_otherJsonNeedsEqualDocuments() throws Exception {
        ArtifactIndexEntry stable = entry("a.json", "{\"k\": 1, \"v\": [1, 2]}");
        ArtifactIndexEntry same = entry("b.json", "{\"v\": [1, 2], \"k\": 1}");
        ArtifactIndexEntry different = entry("c.json", "{\"k\": 2}");

        assertEquals(1.0, comparator.overlap(stable, same), 1e-9);
        assertEquals(0.0, comparator.overlap(stable, different), 1e-9);
    }

    @Test
    void compare_nonJsonFallsBackToDigests() throws Exception {
        ArtifactIndexEntry stable = entry("a.txt", "plain text");
        ArtifactIndexEntry same = entry("b.txt", "plain text");
        ArtifactIndexEntry different = entry("c.txt", "other text");

        assertEquals(1.0, comparator.overlap(stable, same), 1e-9);
        assertEquals(0.0, comparator.overlap(stable, different), 1e-9);
    }

    @Test
    void compare_missingShadowOutputIsAMismatch() throws Exception {
        ArtifactIndexEntry stable = entry("a.json", "{\"nodes\":[]}");

        ParityResult result = comparator.compare(Map.of("ir", stable), Map.of());

        assertFalse(result.isParity());
        assertEquals(List.of("ir: not produced by shadow"), result.getMismatches());
    }

    @Test
    void compare_noStableOutputsIsTrivialParity() {
        assertTrue(comparator.compare(Map.of(), Map.of()).isParity());
    }
}

package com.kiln.artifact;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactIndexTest {

    @TempDir
    Path projectRoot;

    @Test
    void saveThenLoad_preservesEntries() {
        ArtifactIndex index = ArtifactIndex.empty();
        index.put("b", new ArtifactIndexEntry("/p/b.json", "bb", "gen", "run-1", "2026-01-01T00:00:00Z"));
        index.put("a", new ArtifactIndexEntry("/p/a.json", "aa", "gen", "run-1", "2026-01-01T00:00:00Z"));

        index.save(projectRoot);
        ArtifactIndex loaded = ArtifactIndex.load(projectRoot);

        assertEquals(2, loaded.size());
        assertEquals("aa", loaded.get("a").getDigest());
        assertEquals("run-1", loaded.get("b").getRunId());
        assertFalse(Files.exists(projectRoot.resolve(ArtifactIndex.INDEX_FILE + ".tmp")));
    }

    @Test
    void load_missingFileIsEmpty() {
        assertEquals(0, ArtifactIndex.load(projectRoot).size());
    }

    @Test
    void replaceLinkOutputs_dropsStaleEntriesOfThatLinkOnly() {
        ArtifactIndex index = ArtifactIndex.empty();
        index.put("old", new ArtifactIndexEntry("/p/old", "1", "gen", "r1", null));
        index.put("keep", new ArtifactIndexEntry("/p/keep", "2", "other", "r1", null));

        index.replaceLinkOutputs("gen", Map.of("new", new ArtifactIndexEntry("/p/new", "3", "gen", "r2", null)));

        assertFalse(index.contains("old"));
        assertTrue(index.contains("keep"));
        assertTrue(index.contains("new"));
    }

    @Test
    void nowIso_isUtcWithZSuffix() {
        assertTrue(ArtifactIndexEntry.nowIso().endsWith("Z"));
    }
}

package com.kiln.pipeline.load;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkRegistryTest {

    @TempDir
    Path linksDir;

    private void writeLink(String dir, String yaml) throws Exception {
        Path d = Files.createDirectories(linksDir.resolve(dir));
        Files.writeString(d.resolve(LinkRegistry.MANIFEST_FILE), yaml);
    }

    @Test
    void discover_keysLinksByMetadataName() throws Exception {
        writeLink("ingest_dir", """
                metadata:
                  name: ingest
                spec:
                  produces:
                    - kiln.project.intent_ir
                """);
        writeLink("plan", """
                metadata:
                  name: plan
                spec:
                  requires: [kiln.project.intent_ir]
                  when:
                    condition: on_success(ingest)
                """);

        LinkRegistry registry = LinkRegistry.discover(linksDir, false);

        assertEquals(2, registry.size());
        LinkDefinition ingest = registry.get("ingest").orElseThrow();
        assertEquals(linksDir.resolve("ingest_dir"), ingest.getDirectory());
        assertEquals("kiln.project.intent_ir", ingest.getContract().getProduces().get(0).getArtifactId());
        assertEquals("on_success(ingest)", registry.get("plan").orElseThrow().getContract().getWhen().toString());
    }

    @Test
    void discover_silentlyExcludesDirectoriesWithoutManifest() throws Exception {
        writeLink("real", "metadata: {name: real}\n");
        Files.createDirectories(linksDir.resolve("scratch"));
        Files.writeString(linksDir.resolve("scratch/notes.txt"), "wip");

        LinkRegistry registry = LinkRegistry.discover(linksDir, false);

        assertEquals(1, registry.size());
        assertFalse(registry.contains("scratch"));
    }

    @Test
    void discover_failsOnUnparseableManifest() throws Exception {
        writeLink("broken", "metadata: [unclosed\n");

        LinkManifestException e = assertThrows(LinkManifestException.class, () -> LinkRegistry.discover(linksDir, false));
        assertTrue(e.getManifestPath().endsWith("broken/link.yaml"));
    }

    @Test
    void discover_failsOnMalformedCondition() throws Exception {
        writeLink("bad", """
                metadata: {name: bad}
                spec:
                  when: {condition: "on_success("}
                """);

        assertThrows(LinkManifestException.class, () -> LinkRegistry.discover(linksDir, false));
    }

    @Test
    void discover_missingDirectoryYieldsEmptyRegistry() {
        assertEquals(0, LinkRegistry.discover(linksDir.resolve("absent"), false).size());
    }
}

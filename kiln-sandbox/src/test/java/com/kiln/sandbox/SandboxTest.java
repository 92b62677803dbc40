package com.kiln.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SandboxTest {

    @TempDir
    Path projectRoot;

    @Test
    void writeJson_sortsKeysAndIndents() throws Exception {
        Sandbox sandbox = new Sandbox("gen", ArtifactStore.forProject(projectRoot));
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("zeta", 1);
        value.put("alpha", 2);

        Path written = sandbox.writeJson("out.json", value);

        String text = Files.readString(written);
        assertTrue(text.indexOf("alpha") < text.indexOf("zeta"));
        assertTrue(text.contains("\n"));
        assertEquals(projectRoot.resolve("artifacts/gen/out.json").toAbsolutePath().normalize(), written);
    }

    @Test
    void publish_registersWithDigestOfWrittenFile() throws Exception {
        ArtifactStore store = ArtifactStore.forProject(projectRoot);
        Sandbox sandbox = new Sandbox("gen", store);

        ArtifactRecord record = sandbox.publish("kiln.project.ir", "ir.json", Map.of("name", "demo"));

        assertEquals("json", record.getSchema());
        assertEquals("gen", record.getProducerLinkId());
        assertEquals(ArtifactDigests.sha256Hex(Files.readAllBytes(record.toPath())), record.getDigest());
        assertEquals("demo", new ObjectMapper().readTree(record.toPath().toFile()).get("name").asText());
        assertEquals(record, store.get("kiln.project.ir").orElseThrow());
    }

    @Test
    void publishText_usesTextSchema() {
        ArtifactStore store = ArtifactStore.forProject(projectRoot);

        ArtifactRecord record = new Sandbox("report", store).publishText("report.md", "nested/report.md", "# hi");

        assertEquals("text", record.getSchema());
        assertTrue(record.getPath().endsWith("report.md"));
    }

    @Test
    void copyIn_copiesExternalFile() throws Exception {
        Path external = Files.writeString(projectRoot.resolve("seed.txt"), "seed");
        Sandbox sandbox = new Sandbox("ingest", ArtifactStore.forProject(projectRoot));

        Path copied = sandbox.copyIn(external, "seed-copy.txt");

        assertEquals("seed", Files.readString(copied));
    }

    @Test
    void resolve_rejectsEscapes() {
        Sandbox sandbox = new Sandbox("gen", ArtifactStore.forProject(projectRoot));

        assertThrows(IllegalArgumentException.class, () -> sandbox.writeText("../other/x.txt", "x"));
        assertThrows(IllegalArgumentException.class, () -> sandbox.writeText(projectRoot.resolve("src/x").toString(), "x"));
        assertThrows(IllegalArgumentException.class, () -> sandbox.publishExisting("nope", "missing.json", "json"));
    }
}

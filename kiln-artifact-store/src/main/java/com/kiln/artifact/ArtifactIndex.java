package com.kiln.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Project-level index {@code artifact_index.json}: artifact id to {@link ArtifactIndexEntry}. Survives across
 * runs so already-produced artifacts remain resolvable. Not thread-safe; owned by one pipeline run at a time.
 */
public final class ArtifactIndex {

    public static final String INDEX_FILE = "artifact_index.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, ArtifactIndexEntry> entries = new TreeMap<>();

    public static ArtifactIndex empty() {
        return new ArtifactIndex();
    }

    /** Loads {@code <projectRoot>/artifact_index.json}, or an empty index if absent. */
    public static ArtifactIndex load(Path projectRoot) {
        ArtifactIndex index = new ArtifactIndex();
        Path file = projectRoot.resolve(INDEX_FILE);
        if (!Files.isRegularFile(file)) {
            return index;
        }
        try {
            Map<String, ArtifactIndexEntry> read = MAPPER.readValue(file.toFile(),
                    new TypeReference<Map<String, ArtifactIndexEntry>>() { });
            if (read != null) {
                index.entries.putAll(read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact index " + file, e);
        }
        return index;
    }

    /** Writes the index to a temp file and moves it over {@code artifact_index.json}. */
    public Path save(Path projectRoot) {
        Path file = projectRoot.resolve(INDEX_FILE);
        Path tmp = projectRoot.resolve(INDEX_FILE + ".tmp");
        try {
            MAPPER.writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact index " + file, e);
        }
        return file;
    }

    public ArtifactIndexEntry get(String artifactId) {
        return entries.get(artifactId);
    }

    public boolean contains(String artifactId) {
        return entries.containsKey(artifactId);
    }

    public void put(String artifactId, ArtifactIndexEntry entry) {
        entries.put(artifactId, entry);
    }

    /**
     * Replaces everything previously indexed for {@code linkId} with the given outputs, so the index reflects only
     * the link's most recent successful execution.
     */
    public void replaceLinkOutputs(String linkId, Map<String, ArtifactIndexEntry> outputs) {
        entries.values().removeIf(e -> linkId.equals(e.getLinkId()));
        entries.putAll(outputs);
    }

    /** @return the removed entry, or null if the id was not indexed */
    public ArtifactIndexEntry remove(String artifactId) {
        return entries.remove(artifactId);
    }

    public Map<String, ArtifactIndexEntry> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}

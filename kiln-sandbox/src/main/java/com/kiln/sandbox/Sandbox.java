package com.kiln.sandbox;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Per-link write facade rooted at the link's own output directory. Links are expected to write only through
 * their sandbox; the orchestrator's post-run violation scan catches those that do not.
 * <p>
 * File names are resolved inside the output directory; absolute names and names that climb out of it
 * ({@code ../x}) are rejected.
 */
public final class Sandbox {

    public static final String SCHEMA_JSON = "json";
    public static final String SCHEMA_TEXT = "text";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private final String linkId;
    private final ArtifactStore artifactStore;
    private final Path outputDir;

    /**
     * @param linkId        link whose output directory this sandbox owns
     * @param artifactStore store that {@code publish*} registers into; also determines the output root
     */
    public Sandbox(String linkId, ArtifactStore artifactStore) {
        this.linkId = Objects.requireNonNull(linkId, "linkId");
        this.artifactStore = Objects.requireNonNull(artifactStore, "artifactStore");
        this.outputDir = artifactStore.getLinkDir(linkId).toAbsolutePath().normalize();
    }

    public String getLinkId() {
        return linkId;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /** Writes {@code value} as indented JSON with sorted keys. */
    public Path writeJson(String filename, Object value) {
        Path target = resolve(filename);
        try {
            Files.createDirectories(target.getParent());
            MAPPER.writeValue(target.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        return target;
    }

    public Path writeText(String filename, String text) {
        Path target = resolve(filename);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        return target;
    }

    /** Copies an external file into the sandbox under {@code filename}. */
    public Path copyIn(Path source, String filename) {
        Path target = resolve(filename);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy " + source + " into sandbox of " + linkId, e);
        }
        return target;
    }

    /** Writes JSON and registers it as {@code artifactId} with schema {@value #SCHEMA_JSON}. */
    public ArtifactRecord publish(String artifactId, String filename, Object value) {
        return publish(artifactId, filename, value, SCHEMA_JSON);
    }

    public ArtifactRecord publish(String artifactId, String filename, Object value, String schema) {
        Path written = writeJson(filename, value);
        return artifactStore.register(artifactId, written, schema, linkId);
    }

    /** Writes text and registers it as {@code artifactId} with schema {@value #SCHEMA_TEXT}. */
    public ArtifactRecord publishText(String artifactId, String filename, String text) {
        Path written = writeText(filename, text);
        return artifactStore.register(artifactId, written, SCHEMA_TEXT, linkId);
    }

    /** Registers a file the link already wrote inside its sandbox. */
    public ArtifactRecord publishExisting(String artifactId, String filename, String schema) {
        Path target = resolve(filename);
        if (!Files.isRegularFile(target)) {
            throw new IllegalArgumentException("Cannot publish " + artifactId + ": no file at " + target);
        }
        return artifactStore.register(artifactId, target, schema, linkId);
    }

    /** Absolute path of {@code filename} inside the output directory. */
    public Path resolve(String filename) {
        Objects.requireNonNull(filename, "filename");
        Path candidate = outputDir.resolve(filename).normalize();
        if (!candidate.startsWith(outputDir) || candidate.equals(outputDir)) {
            throw new IllegalArgumentException("Path escapes sandbox of " + linkId + ": " + filename);
        }
        return candidate;
    }
}

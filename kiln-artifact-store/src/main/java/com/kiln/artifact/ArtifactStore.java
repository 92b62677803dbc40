package com.kiln.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory registry of produced artifacts for one project, plus the per-link manifests that let a later run
 * rebuild it without re-executing links.
 * <p>
 * <b>Trust boundary:</b> the digest of a record is always computed here from the bytes on disk at
 * registration time. Callers cannot supply one.
 * <p>
 * Layout: {@code <artifactsRoot>/<linkId>/...} with the manifest at
 * {@code <artifactsRoot>/<linkId>/.kiln_artifacts.json}. Re-registering an id replaces the earlier record.
 */
public final class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String ARTIFACTS_DIR = "artifacts";
    public static final String MANIFEST_FILE = ".kiln_artifacts.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path artifactsRoot;
    private final Map<String, ArtifactRecord> records = new LinkedHashMap<>();

    private ArtifactStore(Path artifactsRoot) {
        this.artifactsRoot = artifactsRoot;
    }

    /** Store rooted at {@code <projectRoot>/artifacts}. */
    public static ArtifactStore forProject(Path projectRoot) {
        return new ArtifactStore(projectRoot.resolve(ARTIFACTS_DIR));
    }

    /** Store rooted at an explicit artifacts directory, e.g. a parallel shadow root. */
    public static ArtifactStore rootedAt(Path artifactsRoot) {
        return new ArtifactStore(artifactsRoot);
    }

    public Path getArtifactsRoot() {
        return artifactsRoot;
    }

    public ArtifactRecord register(String artifactId, Path path, String schema, String producerLinkId) {
        return register(artifactId, path, schema, producerLinkId, null);
    }

    /**
     * Registers (or replaces) an artifact. The digest is computed from {@code path} if the file exists.
     */
    public ArtifactRecord register(String artifactId, Path path, String schema, String producerLinkId, String blobUri) {
        Objects.requireNonNull(artifactId, "artifactId");
        Path absolute = path.toAbsolutePath().normalize();
        String digest = Files.isRegularFile(absolute) ? ArtifactDigests.sha256(absolute) : null;
        ArtifactRecord record = new ArtifactRecord(artifactId, absolute.toString(), digest, schema, producerLinkId, blobUri);
        synchronized (records) {
            ArtifactRecord previous = records.put(artifactId, record);
            if (previous != null && !Objects.equals(previous.getProducerLinkId(), producerLinkId)) {
                log.warn("Artifact {} re-registered by {} (was produced by {})", artifactId, producerLinkId, previous.getProducerLinkId());
            }
        }
        log.debug("Registered artifact | id={} | producer={} | digest={}", artifactId, producerLinkId, digest);
        return record;
    }

    public Optional<ArtifactRecord> get(String artifactId) {
        synchronized (records) {
            return Optional.ofNullable(records.get(artifactId));
        }
    }

    public List<ArtifactRecord> list() {
        synchronized (records) {
            return List.copyOf(records.values());
        }
    }

    /** Output directory for the link, created if missing. */
    public Path getLinkDir(String linkId) {
        Path dir = artifactsRoot.resolve(linkId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create link directory " + dir, e);
        }
        return dir;
    }

    /** Writes raw bytes to {@code <linkDir>/<filename>} without registering them. */
    public Path writeArtifact(String linkId, String filename, byte[] content) {
        Path target = getLinkDir(linkId).resolve(filename);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact " + target, e);
        }
        return target;
    }

    public String getDigest(Path file) {
        return ArtifactDigests.sha256(file);
    }

    /** Persists every record produced by {@code linkId} to the link's manifest file. */
    public Path saveManifest(String linkId) {
        Map<String, ArtifactRecord> produced = new TreeMap<>();
        synchronized (records) {
            for (ArtifactRecord r : records.values()) {
                if (linkId.equals(r.getProducerLinkId())) {
                    produced.put(r.getArtifactId(), r);
                }
            }
        }
        Path manifest = getLinkDir(linkId).resolve(MANIFEST_FILE);
        try {
            MAPPER.writeValue(manifest.toFile(), produced);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact manifest " + manifest, e);
        }
        return manifest;
    }

    /**
     * Re-registers the records in the link's manifest whose files still exist. Digests are recomputed from
     * disk, not copied from the manifest.
     *
     * @return number of records restored; 0 when the manifest is missing or unreadable
     */
    public int rehydrateFromLinkDir(String linkId) {
        return rehydrate(linkId).size();
    }

    /**
     * Restores the link's manifest records that still match what the link produced. A record is rejected when
     * its file is gone, lies outside {@code <artifactsRoot>/<linkId>}, names another producer, or no longer
     * hashes to the digest the manifest recorded.
     *
     * @return the restored records; empty when the manifest is missing or unreadable
     */
    public List<ArtifactRecord> rehydrate(String linkId) {
        Path linkDir = artifactsRoot.resolve(linkId).toAbsolutePath().normalize();
        Path manifest = linkDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            return List.of();
        }
        Map<String, ArtifactRecord> saved;
        try {
            saved = MAPPER.readValue(manifest.toFile(), new TypeReference<Map<String, ArtifactRecord>>() { });
        } catch (IOException e) {
            log.warn("Artifact manifest unreadable, nothing rehydrated | linkId={} | manifest={} | error={}", linkId, manifest, e.getMessage());
            return List.of();
        }
        List<String> missing = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        List<ArtifactRecord> restored = new ArrayList<>();
        for (ArtifactRecord r : saved.values()) {
            if (r.getPath() == null) {
                rejected.add(r.getArtifactId());
                continue;
            }
            Path file = r.toPath().toAbsolutePath().normalize();
            if (!file.startsWith(linkDir) || !linkId.equals(r.getProducerLinkId())) {
                rejected.add(r.getArtifactId());
            } else if (!Files.isRegularFile(file)) {
                missing.add(r.getArtifactId());
            } else if (r.getDigest() != null && !r.getDigest().equals(ArtifactDigests.sha256(file))) {
                rejected.add(r.getArtifactId());
            } else {
                restored.add(register(r.getArtifactId(), file, r.getSchema(), linkId, r.getBlobUri()));
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Rehydration skipped artifacts whose files are gone | linkId={} | missing={}", linkId, missing);
        }
        if (!rejected.isEmpty()) {
            log.warn("Rehydration rejected artifacts that no longer match the manifest | linkId={} | rejected={}", linkId, rejected);
        }
        return restored;
    }
}

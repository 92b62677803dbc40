package com.kiln.worker.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Idempotency key of a link execution: link id, a digest of its effective config, and the project bundle hash
 * when a bundle artifact is registered. Two executions with the same signature are interchangeable.
 */
public final class InputSignature {

    private static final Logger log = LoggerFactory.getLogger(InputSignature.class);

    public static final String BUNDLE_ARTIFACT_ID = "kiln.project.bundle";
    static final String BUNDLE_SHA_FIELD = "bundle_sha256";

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private InputSignature() {
    }

    /**
     * @return first 32 hex characters of SHA-256 over {@code link=<id>|cfg=<cfgHash>[|bundle=<sha>]}
     */
    public static String compute(String linkId, Map<String, Object> config, ArtifactStore store) {
        StringBuilder parts = new StringBuilder("link=").append(linkId);
        parts.append("|cfg=").append(configHash(config));
        bundleSha(store).ifPresent(sha -> parts.append("|bundle=").append(sha));
        return ArtifactDigests.sha256Hex(parts.toString()).substring(0, 32);
    }

    /** First 16 hex characters of SHA-256 over the canonical (sorted-key, compact) JSON of the config. */
    static String configHash(Map<String, Object> config) {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(config != null ? config : Map.of());
            return ArtifactDigests.sha256Hex(canonical).substring(0, 16);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Link config is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static Optional<String> bundleSha(ArtifactStore store) {
        Optional<ArtifactRecord> bundle = store.get(BUNDLE_ARTIFACT_ID);
        if (bundle.isEmpty()) {
            return Optional.empty();
        }
        Path file = bundle.get().toPath();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = CANONICAL_MAPPER.readTree(file.toFile());
            JsonNode sha = node != null ? node.get(BUNDLE_SHA_FIELD) : null;
            return sha != null && sha.isTextual() && !sha.asText().isEmpty()
                    ? Optional.of(sha.asText()) : Optional.empty();
        } catch (IOException e) {
            log.warn("Project bundle unreadable, signature computed without it | path={} | error={}", file, e.getMessage());
            return Optional.empty();
        }
    }
}

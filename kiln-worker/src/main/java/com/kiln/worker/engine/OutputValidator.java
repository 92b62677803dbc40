package com.kiln.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiln.artifact.ArtifactDigests;
import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.pipeline.contract.ArtifactRef;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.worker.failure.FailureKind;
import com.kiln.worker.schema.SchemaRegistry;
import com.networknt.schema.JsonSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Post-execution check of a link's {@code produces}. Each produced artifact must be registered (or, for legacy
 * contracts, present at its declared path, in which case it is registered here) and its file must exist.
 * JSON-typed artifacts must parse and, when their schema ref is known, validate against that JSON Schema. The digest in the
 * returned index entries is recomputed from the final file.
 */
final class OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputValidator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String STEP = "validate_outputs";

    private final SchemaRegistry schemas;

    OutputValidator(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    /** @return artifact id to index entry for every produced artifact, in contract order */
    Map<String, ArtifactIndexEntry> validate(LinkContract contract, ArtifactStore store, String runId,
                                             LinkEventRecorder recorder) {
        String linkId = recorder.getLinkId();
        Map<String, ArtifactIndexEntry> outputs = new LinkedHashMap<>();
        for (ArtifactRef ref : contract.getProduces()) {
            String artifactId = ref.getArtifactId();
            Optional<ArtifactRecord> registered = store.get(artifactId);
            ArtifactRecord record;
            if (registered.isPresent()) {
                Path file = registered.get().toPath();
                if (!Files.isRegularFile(file)) {
                    throw recorder.fail(STEP, FailureKind.VALIDATION_ERROR,
                            "Artifact " + artifactId + " registered but file missing: " + file, Map.of("step_id", STEP));
                }
                record = registered.get();
            } else if (ref.getPath() != null) {
                Path file = store.getArtifactsRoot().resolve(linkId).resolve(ref.getPath());
                if (!Files.isRegularFile(file)) {
                    if (ref.isOptional()) {
                        continue;
                    }
                    throw recorder.fail(STEP, FailureKind.PRODUCED_ARTIFACT_MISSING,
                            "PRODUCED_ARTIFACT_MISSING: " + artifactId + " at " + ref.getPath(), Map.of("step_id", STEP));
                }
                record = store.register(artifactId, file, ref.getSchemaType(), linkId);
                log.debug("Auto-registered legacy output | linkId={} | artifactId={} | path={}", linkId, artifactId, file);
            } else {
                if (ref.isOptional()) {
                    continue;
                }
                throw recorder.fail(STEP, FailureKind.PRODUCED_ARTIFACT_MISSING,
                        "PRODUCED_ARTIFACT_MISSING: " + artifactId + "\nLink " + linkId
                                + " did not call sandbox.publish('" + artifactId + "', ...) and no path was provided in contract.",
                        Map.of("step_id", STEP));
            }
            if (ref.isJson()) {
                validateJson(ref, record.toPath(), recorder);
            }
            String digest = ArtifactDigests.sha256(record.toPath());
            if (!digest.equals(record.getDigest())) {
                // written again after registration; the manifest must carry the final bytes
                record = store.register(artifactId, record.toPath(), record.getSchema(), record.getProducerLinkId(),
                        record.getBlobUri());
            }
            outputs.put(artifactId, ArtifactIndexEntry.of(record, digest, runId));
        }
        return outputs;
    }

    private void validateJson(ArtifactRef ref, Path file, LinkEventRecorder recorder) {
        JsonNode document;
        try {
            document = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw recorder.fail(STEP, FailureKind.SCHEMA_INVALID,
                    "SCHEMA_INVALID: " + ref.getArtifactId() + " is not valid JSON. " + e.getMessage(),
                    Map.of("step_id", STEP));
        }
        if (document == null || document.isMissingNode()) {
            throw recorder.fail(STEP, FailureKind.SCHEMA_INVALID,
                    "SCHEMA_INVALID: " + ref.getArtifactId() + " is not valid JSON. Empty document",
                    Map.of("step_id", STEP));
        }
        String schemaRef = ref.getSchemaRef();
        if (schemaRef == null) {
            return;
        }
        Optional<JsonSchema> schema = schemas.find(schemaRef);
        if (schema.isEmpty()) {
            log.warn("Unknown schema ref, schema validation skipped | artifactId={} | ref={}", ref.getArtifactId(), schemaRef);
            return;
        }
        List<String> problems = SchemaRegistry.violations(schema.get(), document);
        if (!problems.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step_id", STEP);
            details.put("schema_ref", schemaRef);
            details.put("violations", problems);
            throw recorder.fail(STEP, FailureKind.SCHEMA_INVALID,
                    "SCHEMA_INVALID: " + ref.getArtifactId() + " failed validation against '" + schemaRef + "': "
                            + problems.get(0), details);
        }
    }
}

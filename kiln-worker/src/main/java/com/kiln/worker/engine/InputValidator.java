package com.kiln.worker.engine;

import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.pipeline.contract.ArtifactRef;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.worker.failure.FailureKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Pre-execution check that every required input resolves to a registered artifact whose file exists. */
final class InputValidator {

    static final String STEP = "validate_inputs";

    private InputValidator() {
    }

    static void validate(LinkContract contract, ArtifactStore store, LinkEventRecorder recorder) {
        for (ArtifactRef ref : contract.getRequires()) {
            Optional<ArtifactRecord> record = store.get(ref.getArtifactId());
            if (record.isPresent()) {
                Path file = record.get().toPath();
                if (!Files.isRegularFile(file)) {
                    throw recorder.fail(STEP, FailureKind.VALIDATION_ERROR,
                            "Artifact " + ref.getArtifactId() + " registered but file missing: " + file,
                            Map.of("step_id", STEP));
                }
                continue;
            }
            if (ref.isOptional()) {
                continue;
            }
            String message = "MISSING_REQUIRED_ARTIFACT: " + ref.getArtifactId();
            if (ref.getFromLink() != null) {
                message += " (expected from " + ref.getFromLink() + ")";
            }
            throw recorder.fail(STEP, FailureKind.MISSING_REQUIRED_ARTIFACT, message, Map.of("step_id", STEP));
        }
    }
}

package com.kiln.worker.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.ledger.LedgerStatus;
import com.kiln.pipeline.contract.ArtifactRef;
import com.kiln.pipeline.contract.CoherencePolicy;
import com.kiln.pipeline.contract.DriftAction;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.worker.coherence.CoherenceScore;
import com.kiln.worker.coherence.CoherenceScorer;
import com.kiln.worker.failure.FailureKind;
import com.kiln.worker.failure.LinkFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores a link's output against the project intent when its contract declares a coherence policy, and applies
 * the policy's drift action.
 */
final class CoherenceCheck {

    private static final Logger log = LoggerFactory.getLogger(CoherenceCheck.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final String STEP = "coherence_check";
    static final String REFLECTION_STEP = "reflection";
    static final String EVIDENCE_FILE = "drift_evidence.json";

    private final CoherenceScorer scorer;

    CoherenceCheck(CoherenceScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Runs the check and, for {@code reflect}, adds the drift evidence artifact to {@code outputs}.
     *
     * @throws LinkFailureException {@code COHERENCE_DRIFT} when drift is detected and the action is {@code fail}
     */
    void apply(LinkContract contract, ArtifactStore store, ProjectContext context,
               Map<String, ArtifactIndexEntry> outputs, LinkEventRecorder recorder) {
        CoherencePolicy policy = contract.getCoherencePolicy();
        if (policy == null) {
            return;
        }
        String linkId = recorder.getLinkId();
        String artifactId = policy.getArtifact() != null ? policy.getArtifact() : firstJsonOutput(contract, outputs);
        JsonNode current = artifactId != null ? readJson(pathOf(artifactId, store, context, outputs)) : null;
        JsonNode intent = readJson(pathOf(policy.getIntentArtifact(), store, context, outputs));
        CoherenceScore score = scorer.score(current, intent);

        Map<String, Object> metrics = recorder.runMetrics();
        metrics.put("artifact", artifactId);
        metrics.put("intent_artifact", policy.getIntentArtifact());
        if (score.getScore() >= policy.getThreshold()) {
            recorder.log(recorder.event(STEP, LedgerStatus.SUCCEEDED).driftScore(score.getScore()).metrics(metrics));
            log.debug("Coherence within threshold | linkId={} | score={} | threshold={}", linkId, score.getScore(), policy.getThreshold());
            return;
        }

        Map<String, Object> driftMetadata = new LinkedHashMap<>();
        driftMetadata.put("threshold", policy.getThreshold());
        driftMetadata.put("evidence", score.getEvidence());
        driftMetadata.put("on_drift", policy.getOnDrift().wireName());
        recorder.log(recorder.event(STEP, LedgerStatus.DRIFT_DETECTED).drift(score.getScore(), driftMetadata).metrics(metrics));
        log.warn("Coherence drift detected | linkId={} | score={} | threshold={} | action={} | evidence={}",
                linkId, score.getScore(), policy.getThreshold(), policy.getOnDrift().wireName(), score.getEvidence());

        if (policy.getOnDrift() == DriftAction.FAIL) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step_id", STEP);
            details.put("drift_score", score.getScore());
            details.put("threshold", policy.getThreshold());
            throw recorder.fail(STEP, FailureKind.COHERENCE_DRIFT,
                    "COHERENCE_DRIFT: Link " + linkId + " scored " + score.getScore() + " below threshold "
                            + policy.getThreshold() + ". " + score.getEvidence(), details);
        }
        if (policy.getOnDrift() == DriftAction.REFLECT) {
            reflect(linkId, artifactId, policy, score, store, context, outputs, recorder);
        }
    }

    private void reflect(String linkId, String artifactId, CoherencePolicy policy, CoherenceScore score,
                         ArtifactStore store, ProjectContext context, Map<String, ArtifactIndexEntry> outputs,
                         LinkEventRecorder recorder) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("link_id", linkId);
        evidence.put("run_id", context.getPipelineRunId());
        evidence.put("artifact", artifactId);
        evidence.put("intent_artifact", policy.getIntentArtifact());
        evidence.put("drift_score", score.getScore());
        evidence.put("threshold", policy.getThreshold());
        evidence.put("evidence", score.getEvidence());
        evidence.put("created_at", ArtifactIndexEntry.nowIso());
        byte[] content;
        try {
            content = MAPPER.writeValueAsBytes(evidence);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize drift evidence for " + linkId, e);
        }
        Path file = store.writeArtifact(linkId, EVIDENCE_FILE, content);
        String evidenceId = linkId + ".drift_evidence";
        ArtifactRecord record = store.register(evidenceId, file, "json", linkId);
        outputs.put(evidenceId, ArtifactIndexEntry.of(record, record.getDigest(), context.getPipelineRunId()));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put(evidenceId, record.getPath());
        recorder.log(recorder.event(REFLECTION_STEP, LedgerStatus.SUCCEEDED).outputs(out).metrics(recorder.runMetrics()));
        log.info("Drift evidence captured | linkId={} | artifactId={} | path={}", linkId, evidenceId, file);
    }

    private static String firstJsonOutput(LinkContract contract, Map<String, ArtifactIndexEntry> outputs) {
        for (ArtifactRef ref : contract.getProduces()) {
            if (ref.isJson() && outputs.containsKey(ref.getArtifactId())) {
                return ref.getArtifactId();
            }
        }
        return outputs.isEmpty() ? null : outputs.keySet().iterator().next();
    }

    private static Path pathOf(String artifactId, ArtifactStore store, ProjectContext context,
                               Map<String, ArtifactIndexEntry> outputs) {
        ArtifactIndexEntry produced = outputs.get(artifactId);
        if (produced != null) {
            return Paths.get(produced.getPath());
        }
        return store.get(artifactId).map(ArtifactRecord::toPath)
                .orElseGet(() -> {
                    ArtifactIndexEntry indexed = context.getArtifactIndex().get(artifactId);
                    return indexed != null ? Paths.get(indexed.getPath()) : null;
                });
    }

    private static JsonNode readJson(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return null;
        }
        try {
            return MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Coherence input is not valid JSON, scored as missing | path={} | error={}", file, e.getMessage());
            return null;
        }
    }
}

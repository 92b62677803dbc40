package com.kiln.pipeline.contract;

import java.util.Map;

/**
 * {@code spec.coherence_policy}: compare a produced representation against the project's original intent and
 * act on drift. {@code artifact} defaults to the link's first JSON output.
 */
public final class CoherencePolicy {

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final String DEFAULT_INTENT_ARTIFACT = "kiln.project.intent_ir";

    private final double threshold;
    private final DriftAction onDrift;
    private final String artifact;
    private final String intentArtifact;

    public CoherencePolicy(double threshold, DriftAction onDrift, String artifact, String intentArtifact) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new InvalidContractException("coherence_policy.threshold must be within [0, 1], got " + threshold);
        }
        this.threshold = threshold;
        this.onDrift = onDrift;
        this.artifact = artifact;
        this.intentArtifact = intentArtifact != null ? intentArtifact : DEFAULT_INTENT_ARTIFACT;
    }

    static CoherencePolicy fromRaw(Object raw) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map)) {
            throw new InvalidContractException("coherence_policy must be a mapping, got: " + raw);
        }
        Map<?, ?> m = (Map<?, ?>) raw;
        Object threshold = m.get("threshold");
        if (threshold != null && !(threshold instanceof Number)) {
            throw new InvalidContractException("coherence_policy.threshold must be a number, got: " + threshold);
        }
        return new CoherencePolicy(
                threshold != null ? ((Number) threshold).doubleValue() : DEFAULT_THRESHOLD,
                DriftAction.parse(m.get("on_drift") != null ? String.valueOf(m.get("on_drift")) : null),
                m.get("artifact") != null ? String.valueOf(m.get("artifact")) : null,
                m.get("intent_artifact") != null ? String.valueOf(m.get("intent_artifact")) : null);
    }

    public double getThreshold() {
        return threshold;
    }

    public DriftAction getOnDrift() {
        return onDrift;
    }

    /** Artifact id to score, or null to use the link's first JSON output. */
    public String getArtifact() {
        return artifact;
    }

    public String getIntentArtifact() {
        return intentArtifact;
    }
}

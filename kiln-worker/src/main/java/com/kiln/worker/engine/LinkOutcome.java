package com.kiln.worker.engine;

import com.kiln.artifact.ArtifactIndexEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Result of a link that did not fail: either executed now, or reused from an earlier run with the same signature. */
public final class LinkOutcome {

    public static final String REASON_ALREADY_DONE = "ALREADY_DONE";

    private final boolean reused;
    private final Map<String, ArtifactIndexEntry> outputs;
    private final Map<String, Object> metrics;
    private final long durationMs;
    private final int rehydratedArtifacts;

    private LinkOutcome(boolean reused, Map<String, ArtifactIndexEntry> outputs, Map<String, Object> metrics,
                        long durationMs, int rehydratedArtifacts) {
        this.reused = reused;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.durationMs = durationMs;
        this.rehydratedArtifacts = rehydratedArtifacts;
    }

    static LinkOutcome executed(Map<String, ArtifactIndexEntry> outputs, Map<String, Object> metrics, long durationMs) {
        return new LinkOutcome(false, outputs, metrics, durationMs, 0);
    }

    static LinkOutcome reused(int rehydratedArtifacts) {
        return new LinkOutcome(true, Map.of(), Map.of(), 0L, rehydratedArtifacts);
    }

    public boolean isReused() {
        return reused;
    }

    /** Validated outputs of an executed link; empty when reused. */
    public Map<String, ArtifactIndexEntry> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getRehydratedArtifacts() {
        return rehydratedArtifacts;
    }
}

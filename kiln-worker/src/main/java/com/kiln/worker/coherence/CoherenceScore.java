package com.kiln.worker.coherence;

/** Coherence of a produced representation with the project intent: a score in [0, 1] and a human-readable reason. */
public final class CoherenceScore {

    private final double score;
    private final String evidence;

    public CoherenceScore(double score, String evidence) {
        this.score = Math.max(0.0, Math.min(1.0, score));
        this.evidence = evidence;
    }

    public double getScore() {
        return score;
    }

    public String getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return "CoherenceScore{" + score + ", " + evidence + "}";
    }
}

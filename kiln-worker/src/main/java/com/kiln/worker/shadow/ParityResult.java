package com.kiln.worker.shadow;

import java.util.List;

/** Outcome of comparing a shadow link's outputs with its stable counterpart's. */
public final class ParityResult {

    private final boolean parity;
    private final double overlap;
    private final List<String> mismatches;

    public ParityResult(boolean parity, double overlap, List<String> mismatches) {
        this.parity = parity;
        this.overlap = overlap;
        this.mismatches = mismatches != null ? List.copyOf(mismatches) : List.of();
    }

    public static ParityResult miss(String reason) {
        return new ParityResult(false, 0.0, List.of(reason));
    }

    public boolean isParity() {
        return parity;
    }

    /** Mean overlap in [0, 1] across compared artifacts. */
    public double getOverlap() {
        return overlap;
    }

    public List<String> getMismatches() {
        return mismatches;
    }

    @Override
    public String toString() {
        return "ParityResult{parity=" + parity + ", overlap=" + overlap + ", mismatches=" + mismatches + "}";
    }
}

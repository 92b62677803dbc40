package com.kiln.pipeline.contract;

import java.util.Locale;

/** What the orchestrator does when a coherence score falls below threshold. */
public enum DriftAction {
    /** Record the drift and fail the run. */
    FAIL,
    /** Record the drift and continue. */
    WARN,
    /** Record the drift, snapshot the evidence as an artifact, and continue. */
    REFLECT;

    public static DriftAction parse(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidContractException("Unknown on_drift action '" + value + "' (expected fail, warn or reflect)");
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.kiln.worker.coherence;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Strategy comparing a link's produced representation with the original project intent.
 * Implementations must tolerate either side being null (artifact absent or unreadable).
 */
@FunctionalInterface
public interface CoherenceScorer {

    CoherenceScore score(JsonNode current, JsonNode intent);
}

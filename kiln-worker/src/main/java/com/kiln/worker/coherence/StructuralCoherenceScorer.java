package com.kiln.worker.coherence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Default scorer: share of the intent's nodes (by {@code nodes[].name}) still present in the current
 * representation. A large influx of new nodes (more than twice the original count) halves the score.
 */
public final class StructuralCoherenceScorer implements CoherenceScorer {

    @Override
    public CoherenceScore score(JsonNode current, JsonNode intent) {
        if (isEmpty(current) || isEmpty(intent)) {
            return new CoherenceScore(0.0, "Missing IR for comparison");
        }
        JsonNode originalNodes = nodes(intent);
        JsonNode currentNodes = nodes(current);
        if (originalNodes.size() == 0) {
            return new CoherenceScore(1.0, "No original nodes to compare against");
        }
        Set<String> originalNames = new HashSet<>();
        for (JsonNode n : originalNodes) {
            originalNames.add(n.path("name").asText(null));
        }
        int overlap = 0;
        for (JsonNode n : currentNodes) {
            if (originalNames.contains(n.path("name").asText(null))) {
                overlap++;
            }
        }
        int originalCount = originalNodes.size();
        double score = (double) overlap / originalCount;
        StringBuilder evidence = new StringBuilder()
                .append("Preserved ").append(overlap).append(" out of ").append(originalCount).append(" original nodes.");
        int newNodes = currentNodes.size() - overlap;
        if (newNodes > originalCount * 2) {
            score *= 0.5;
            evidence.append(" Warning: High entropy detected with ").append(newNodes).append(" new nodes.");
        }
        return new CoherenceScore(score, evidence.toString());
    }

    private static boolean isEmpty(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() || node.size() == 0;
    }

    private static JsonNode nodes(JsonNode ir) {
        JsonNode nodes = ir.path("nodes");
        return nodes.isArray() ? nodes : JsonNodeFactory.instance.arrayNode();
    }
}

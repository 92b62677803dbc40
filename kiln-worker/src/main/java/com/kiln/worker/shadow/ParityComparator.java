package com.kiln.worker.shadow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiln.artifact.ArtifactIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural parity between stable and shadow outputs. Every artifact the stable link produced must be produced by
 * the shadow under the same id. JSON artifacts with a {@code nodes} array compare by node-name set (Jaccard
 * overlap), other JSON by structural equality, anything else by digest.
 */
public class ParityComparator {

    private static final Logger log = LoggerFactory.getLogger(ParityComparator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ParityResult compare(Map<String, ArtifactIndexEntry> stable, Map<String, ArtifactIndexEntry> shadow) {
        if (stable.isEmpty()) {
            return new ParityResult(true, 1.0, List.of());
        }
        List<String> mismatches = new ArrayList<>();
        double total = 0.0;
        for (Map.Entry<String, ArtifactIndexEntry> e : stable.entrySet()) {
            String artifactId = e.getKey();
            ArtifactIndexEntry candidate = shadow.get(artifactId);
            if (candidate == null) {
                mismatches.add(artifactId + ": not produced by shadow");
                continue;
            }
            double overlap = overlap(e.getValue(), candidate);
            total += overlap;
            if (overlap < 1.0) {
                mismatches.add(artifactId + ": overlap " + overlap);
            }
        }
        return new ParityResult(mismatches.isEmpty(), total / stable.size(), mismatches);
    }

    double overlap(ArtifactIndexEntry stable, ArtifactIndexEntry shadow) {
        JsonNode a = readJson(Paths.get(stable.getPath()));
        JsonNode b = readJson(Paths.get(shadow.getPath()));
        if (a == null || b == null) {
            return Objects.equals(stable.getDigest(), shadow.getDigest()) ? 1.0 : 0.0;
        }
        if (a.path("nodes").isArray() && b.path("nodes").isArray()) {
            return jaccard(nodeNames(a), nodeNames(b));
        }
        return a.equals(b) ? 1.0 : 0.0;
    }

    static Set<String> nodeNames(JsonNode ir) {
        Set<String> names = new HashSet<>();
        for (JsonNode node : ir.path("nodes")) {
            JsonNode name = node.get("name");
            if (name != null && !name.isNull()) {
                names.add(name.asText());
            }
        }
        return names;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    private static JsonNode readJson(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(file.toFile());
            return node == null || node.isMissingNode() ? null : node;
        } catch (IOException e) {
            log.debug("Not JSON, comparing by digest | path={} | error={}", file, e.getMessage());
            return null;
        }
    }
}

package com.kiln.worker.shadow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kiln.artifact.ArtifactIndexEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rolling parity counters for shadow links, persisted in {@code <projectRoot>/shadow/maturity.json}.
 * A parity hit extends the streak; a miss or a shadow failure resets it and clears readiness.
 */
public final class MaturityTracker {

    public static final String SHADOW_DIR = "shadow";
    public static final String MATURITY_FILE = "maturity.json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Map<String, MaturityState> states;

    private MaturityTracker(Path file, Map<String, MaturityState> states) {
        this.file = file;
        this.states = states;
    }

    public static MaturityTracker load(Path projectRoot) {
        Path file = projectRoot.resolve(SHADOW_DIR).resolve(MATURITY_FILE);
        Map<String, MaturityState> states = new TreeMap<>();
        if (Files.isRegularFile(file)) {
            try {
                Map<String, MaturityState> read = MAPPER.readValue(file.toFile(),
                        new TypeReference<Map<String, MaturityState>>() { });
                if (read != null) {
                    states.putAll(read);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read shadow maturity " + file, e);
            }
        }
        return new MaturityTracker(file, states);
    }

    public Optional<MaturityState> get(String shadowLinkId) {
        return Optional.ofNullable(states.get(shadowLinkId));
    }

    /**
     * Records one comparison. Readiness is set when the streak reaches {@code parityWindow}.
     *
     * @return true only on the comparison that made the shadow ready, so readiness is announced once per streak
     */
    public boolean recordParity(String shadowLinkId, String stableLinkId, ParityResult parity, int parityWindow) {
        MaturityState state = stateFor(shadowLinkId, stableLinkId);
        state.setTotalRuns(state.getTotalRuns() + 1);
        state.setLastOverlap(parity.getOverlap());
        state.setParityWindow(parityWindow);
        boolean becameReady = false;
        if (parity.isParity()) {
            state.setConsecutiveParity(state.getConsecutiveParity() + 1);
            if (!state.isPromotionReady() && state.getConsecutiveParity() >= parityWindow) {
                state.setPromotionReady(true);
                becameReady = true;
            }
        } else {
            reset(state);
        }
        touch(state);
        return becameReady;
    }

    public void recordFailure(String shadowLinkId, String stableLinkId) {
        MaturityState state = stateFor(shadowLinkId, stableLinkId);
        state.setTotalRuns(state.getTotalRuns() + 1);
        state.setLastOverlap(0.0);
        reset(state);
        touch(state);
    }

    void markApproved(MaturityState state, String approver) {
        state.setApproved(true);
        state.setApprovedBy(approver);
        state.setApprovedAt(ArtifactIndexEntry.nowIso());
        touch(state);
    }

    public void save() {
        try {
            Files.createDirectories(file.getParent());
            MAPPER.writeValue(file.toFile(), states);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write shadow maturity " + file, e);
        }
    }

    private MaturityState stateFor(String shadowLinkId, String stableLinkId) {
        MaturityState state = states.computeIfAbsent(shadowLinkId, id -> new MaturityState(id, stableLinkId));
        state.setStableLink(stableLinkId);
        return state;
    }

    private static void reset(MaturityState state) {
        state.setConsecutiveParity(0);
        state.setPromotionReady(false);
        state.setApproved(false);
        state.setApprovedBy(null);
        state.setApprovedAt(null);
    }

    private static void touch(MaturityState state) {
        state.setLastUpdated(ArtifactIndexEntry.nowIso());
    }
}

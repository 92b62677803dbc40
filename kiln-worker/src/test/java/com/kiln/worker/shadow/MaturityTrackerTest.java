package com.kiln.worker.shadow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaturityTrackerTest {

    private static final ParityResult HIT = new ParityResult(true, 1.0, List.of());

    @TempDir
    Path projectRoot;

    @Test
    void recordParity_reportsReadinessOnlyOnTheRunThatReachedTheWindow() {
        MaturityTracker tracker = MaturityTracker.load(projectRoot);

        assertFalse(tracker.recordParity("plan_v2", "plan", HIT, 2));
        assertTrue(tracker.recordParity("plan_v2", "plan", HIT, 2));
        assertFalse(tracker.recordParity("plan_v2", "plan", HIT, 2));

        MaturityState state = tracker.get("plan_v2").orElseThrow();
        assertTrue(state.isPromotionReady());
        assertEquals(3, state.getConsecutiveParity());
        assertEquals("plan", state.getStableLink());
    }

    @Test
    void recordParity_missRestartsTheStreak() {
        MaturityTracker tracker = MaturityTracker.load(projectRoot);
        tracker.recordParity("plan_v2", "plan", HIT, 2);
        tracker.recordParity("plan_v2", "plan", HIT, 2);

        tracker.recordParity("plan_v2", "plan", ParityResult.miss("ir: not produced by shadow"), 2);

        MaturityState state = tracker.get("plan_v2").orElseThrow();
        assertEquals(0, state.getConsecutiveParity());
        assertFalse(state.isPromotionReady());
        assertFalse(tracker.recordParity("plan_v2", "plan", HIT, 2));
        assertTrue(tracker.recordParity("plan_v2", "plan", HIT, 2));
    }

    @Test
    void save_roundTripsThroughTheMaturityFile() {
        MaturityTracker tracker = MaturityTracker.load(projectRoot);
        tracker.recordParity("plan_v2", "plan", new ParityResult(true, 0.9, List.of()), 3);
        tracker.recordFailure("lint_v2", "lint");
        tracker.save();

        assertTrue(Files.isRegularFile(projectRoot.resolve("shadow/maturity.json")));
        MaturityTracker reloaded = MaturityTracker.load(projectRoot);
        MaturityState plan = reloaded.get("plan_v2").orElseThrow();
        assertEquals(1, plan.getConsecutiveParity());
        assertEquals(3, plan.getParityWindow());
        assertEquals(0.9, plan.getLastOverlap(), 1e-9);
        MaturityState lint = reloaded.get("lint_v2").orElseThrow();
        assertEquals(1, lint.getTotalRuns());
        assertEquals(0, lint.getConsecutiveParity());
    }
}

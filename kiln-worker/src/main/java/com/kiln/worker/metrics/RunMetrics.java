package com.kiln.worker.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for pipeline runs: link outcomes and durations, run outcomes and budget violations.
 * Tags stay low-cardinality (link and pipeline ids, never run ids).
 */
public final class RunMetrics {

    public static final String LINK_EXECUTIONS = "kiln.link.executions";
    public static final String LINK_DURATION = "kiln.link.duration";
    public static final String PIPELINE_RUNS = "kiln.pipeline.runs";
    public static final String BUDGET_VIOLATIONS = "kiln.budget.violations";

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void linkSucceeded(String linkId, long durationMs) {
        outcome(linkId, "succeeded");
        duration(linkId, true, durationMs);
    }

    public void linkFailed(String linkId, long durationMs) {
        outcome(linkId, "failed");
        duration(linkId, false, durationMs);
    }

    public void linkReused(String linkId) {
        outcome(linkId, "reused");
    }

    public void linkSkipped(String linkId) {
        outcome(linkId, "skipped");
    }

    public void pipelineFinished(String pipelineId, boolean succeeded, List<Map<String, Object>> budgetViolations) {
        registry.counter(PIPELINE_RUNS, "pipeline", nullToUnknown(pipelineId),
                "status", succeeded ? "succeeded" : "failed").increment();
        for (Map<String, Object> violation : budgetViolations) {
            Object type = violation.get("type");
            registry.counter(BUDGET_VIOLATIONS, "type", nullToUnknown(type != null ? type.toString() : null)).increment();
        }
    }

    private void outcome(String linkId, String outcome) {
        registry.counter(LINK_EXECUTIONS, "link", nullToUnknown(linkId), "outcome", outcome).increment();
    }

    private void duration(String linkId, boolean success, long durationMs) {
        Timer.builder(LINK_DURATION)
                .tag("link", nullToUnknown(linkId))
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}

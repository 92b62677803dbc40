package com.kiln.worker.engine;

import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.worker.failure.FailureKind;
import com.kiln.worker.failure.LinkFailureException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the ledger events of one link execution. Every event carries the link run id and the policy versions;
 * failures are recorded here before the matching {@link LinkFailureException} is raised.
 */
public final class LinkEventRecorder {

    private final ProjectContext context;
    private final String linkId;
    private final String linkRunId;
    private final Map<String, Object> policyVersions;

    LinkEventRecorder(ProjectContext context, String linkId, String linkRunId, Map<String, Object> policyVersions) {
        this.context = context;
        this.linkId = linkId;
        this.linkRunId = linkRunId;
        this.policyVersions = policyVersions;
    }

    public String getLinkId() {
        return linkId;
    }

    public String getLinkRunId() {
        return linkRunId;
    }

    public ProjectContext getContext() {
        return context;
    }

    public LedgerEvent.Builder event(String stepId, LedgerStatus status) {
        return LedgerEvent.builder(context.getProjectId(), context.getPipelineId(), linkId, linkRunId, stepId, status)
                .policyVersions(policyVersions);
    }

    public void log(LedgerEvent.Builder event) {
        context.getLedger().logEvent(event.build());
    }

    /** {@code run_id} (pipeline run) and {@code worker_id}, present on every link event's metrics. */
    public Map<String, Object> runMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("run_id", context.getPipelineRunId());
        metrics.put("worker_id", context.getWorkerId());
        return metrics;
    }

    /**
     * Records a FAILED event for {@code stepId} with errors {@code {type, message, ...details}} and returns the
     * exception to throw, already marked as recorded.
     */
    public LinkFailureException fail(String stepId, FailureKind kind, String message, Map<String, Object> details) {
        Map<String, Object> errors = new LinkedHashMap<>();
        errors.put("type", kind.name());
        errors.put("message", message);
        if (details != null) {
            errors.putAll(details);
        }
        log(event(stepId, LedgerStatus.FAILED).errors(errors).metrics(runMetrics()));
        return new LinkFailureException(linkId, kind, message, errors, true);
    }

    public LinkFailureException fail(String stepId, FailureKind kind, String message) {
        return fail(stepId, kind, message, null);
    }
}

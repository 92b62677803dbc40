package com.kiln.worker.engine;

import com.kiln.policy.RuntimePolicy;
import com.kiln.sandbox.DiskUsage;
import com.kiln.worker.failure.FailureKind;
import com.kiln.worker.failure.LinkFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Byte budgets: whole project before the run, each link's output directory after it executes. */
final class BudgetEnforcer {

    private static final Logger log = LoggerFactory.getLogger(BudgetEnforcer.class);

    static final String STEP = "budget_check";
    static final String PREFLIGHT_LINK_ID = "__preflight__";

    private final RuntimePolicy policy;

    BudgetEnforcer(RuntimePolicy policy) {
        this.policy = policy;
    }

    /**
     * @throws LinkFailureException {@code BUDGET_PROJECT_LIMIT}, recorded against {@value #PREFLIGHT_LINK_ID}
     */
    void checkProjectSize(ProjectContext context, LinkEventRecorder preflight) {
        Long limit = policy.getMaxProjectBytes();
        if (limit == null) {
            return;
        }
        long measured = DiskUsage.totalBytes(context.getProjectRoot());
        if (measured <= limit) {
            log.debug("Project size within budget | projectId={} | bytes={} | limit={}", context.getProjectId(), measured, limit);
            return;
        }
        String message = "BUDGET_PROJECT_LIMIT: Project size " + measured + " bytes exceeds limit of " + limit + " bytes";
        context.addBudgetViolation(violation(FailureKind.BUDGET_PROJECT_LIMIT, PREFLIGHT_LINK_ID, measured, limit));
        log.error("Project size budget exceeded | projectId={} | bytes={} | limit={}", context.getProjectId(), measured, limit);
        throw preflight.fail(STEP, FailureKind.BUDGET_PROJECT_LIMIT, message, sizes(measured, limit));
    }

    /**
     * @throws LinkFailureException {@code BUDGET_OUTPUT_LIMIT}
     */
    void checkOutputSize(Path outputDir, LinkEventRecorder recorder) {
        Long limit = policy.getMaxOutputBytes();
        if (limit == null) {
            return;
        }
        long measured = DiskUsage.totalBytes(outputDir);
        if (measured <= limit) {
            return;
        }
        String linkId = recorder.getLinkId();
        String message = "BUDGET_OUTPUT_LIMIT: Link " + linkId + " output " + measured + " bytes exceeds limit of " + limit + " bytes";
        recorder.getContext().addBudgetViolation(violation(FailureKind.BUDGET_OUTPUT_LIMIT, linkId, measured, limit));
        throw recorder.fail(STEP, FailureKind.BUDGET_OUTPUT_LIMIT, message, sizes(measured, limit));
    }

    static Map<String, Object> violation(FailureKind kind, String linkId, Object measured, Object limit) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("type", kind.name());
        v.put("link_id", linkId);
        v.put("measured", measured);
        v.put("limit", limit);
        return v;
    }

    private static Map<String, Object> sizes(long measured, long limit) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("measured_bytes", measured);
        details.put("limit_bytes", limit);
        return details;
    }
}

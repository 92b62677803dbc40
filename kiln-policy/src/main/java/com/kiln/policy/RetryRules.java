package com.kiln.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The {@code retry} section of the runtime policy. The orchestrator never retries on its own; these
 * values are for the calling layer (queue or executor) that decides whether to re-run a failed pipeline.
 */
public final class RetryRules {

    private static final int DEFAULT_MAX_RETRIES_PER_LINK = 3;
    private static final int DEFAULT_MAX_RETRIES_PER_PROJECT = 10;
    private static final List<Integer> DEFAULT_BACKOFF_SCHEDULE = List.of(1, 5, 30);
    private static final int EMPTY_SCHEDULE_DELAY = 30;

    private final int maxRetriesPerLink;
    private final int maxRetriesPerProject;
    private final List<Integer> backoffSchedule;
    private final List<String> retryableErrors;
    private final List<String> nonRetryableErrors;

    private RetryRules(int maxRetriesPerLink, int maxRetriesPerProject, List<Integer> backoffSchedule,
                       List<String> retryableErrors, List<String> nonRetryableErrors) {
        this.maxRetriesPerLink = maxRetriesPerLink;
        this.maxRetriesPerProject = maxRetriesPerProject;
        this.backoffSchedule = List.copyOf(backoffSchedule);
        this.retryableErrors = retryableErrors;
        this.nonRetryableErrors = nonRetryableErrors;
    }

    static RetryRules fromMap(Map<String, Object> raw) {
        List<Integer> schedule = DEFAULT_BACKOFF_SCHEDULE;
        Object rawSchedule = raw.get("backoff_schedule");
        if (rawSchedule instanceof List) {
            schedule = new ArrayList<>();
            for (Object o : (List<?>) rawSchedule) {
                if (o instanceof Number) schedule.add(((Number) o).intValue());
            }
        }
        return new RetryRules(
                PolicyValues.asInt(raw.get("max_retries_per_link"), DEFAULT_MAX_RETRIES_PER_LINK),
                PolicyValues.asInt(raw.get("max_retries_per_project"), DEFAULT_MAX_RETRIES_PER_PROJECT),
                schedule,
                PolicyValues.asStringList(raw.get("retryable_errors")),
                PolicyValues.asStringList(raw.get("non_retryable_errors")));
    }

    public int getMaxRetriesPerLink() {
        return maxRetriesPerLink;
    }

    public int getMaxRetriesPerProject() {
        return maxRetriesPerProject;
    }

    public List<Integer> getBackoffSchedule() {
        return backoffSchedule;
    }

    /**
     * Delay in seconds before the given retry attempt (0-based). Attempts past the end of the schedule reuse
     * its last entry.
     */
    public int getBackoffDelay(int retryAttempt) {
        if (backoffSchedule.isEmpty()) {
            return EMPTY_SCHEDULE_DELAY;
        }
        if (retryAttempt >= 0 && retryAttempt < backoffSchedule.size()) {
            return backoffSchedule.get(retryAttempt);
        }
        return backoffSchedule.get(backoffSchedule.size() - 1);
    }

    /**
     * Whether a failure of the given kind may be retried. {@code non_retryable_errors} wins over
     * {@code retryable_errors}; a kind in neither list is not retryable.
     */
    public boolean isErrorRetryable(String errorType) {
        if (errorType == null) return false;
        if (nonRetryableErrors.contains(errorType)) return false;
        return retryableErrors.contains(errorType);
    }
}

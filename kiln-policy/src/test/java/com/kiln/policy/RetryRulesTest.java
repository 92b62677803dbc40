package com.kiln.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryRulesTest {

    @Test
    void defaults_whenRetrySectionAbsent() {
        RuntimePolicy policy = PolicyLoader.parse(PolicyLoaderTest.VALID_POLICY, "inline");
        RetryRules retry = policy.getRetry();

        assertEquals(3, retry.getMaxRetriesPerLink());
        assertEquals(10, retry.getMaxRetriesPerProject());
        assertEquals(1, retry.getBackoffDelay(0));
        assertEquals(5, retry.getBackoffDelay(1));
        assertEquals(30, retry.getBackoffDelay(2));
        assertEquals(30, retry.getBackoffDelay(9));
        assertFalse(retry.isErrorRetryable("RUNTIME_ERROR"));
    }

    @Test
    void nonRetryableListWinsAndUnlistedKindsAreNotRetryable() {
        String yaml = PolicyLoaderTest.VALID_POLICY + """
                retry:
                  backoff_schedule: [2, 4]
                  retryable_errors: [BUDGET_TIMEOUT, POLICY_VIOLATION]
                  non_retryable_errors: [POLICY_VIOLATION]
                """;
        RuntimePolicy policy = PolicyLoader.parse(yaml, "inline");

        assertTrue(policy.isErrorRetryable("BUDGET_TIMEOUT"));
        assertFalse(policy.isErrorRetryable("POLICY_VIOLATION"));
        assertFalse(policy.isErrorRetryable("SCHEMA_INVALID"));
        assertFalse(policy.isErrorRetryable(null));
        assertEquals(4, policy.getRetry().getBackoffDelay(5));
    }

    @Test
    void emptyScheduleFallsBackToThirtySeconds() {
        RuntimePolicy policy = PolicyLoader.parse(PolicyLoaderTest.VALID_POLICY + "retry:\n  backoff_schedule: []\n", "inline");
        assertEquals(30, policy.getRetry().getBackoffDelay(0));
    }

    @Test
    void retentionDefaults() {
        RetentionRules retention = PolicyLoader.parse(PolicyLoaderTest.VALID_POLICY, "inline").getRetention();

        assertEquals(3, retention.getKeepLastNRuns());
        assertEquals(7, retention.getKeepFailedRunsDays());
        assertTrue(retention.shouldKeepEvidencePack());
        assertTrue(retention.shouldPreserveLedger());
        assertEquals(RetentionRules.DEFAULT_PROTECTED_ARTIFACTS, retention.getProtectedArtifacts());
    }
}

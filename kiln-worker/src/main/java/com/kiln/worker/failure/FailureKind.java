package com.kiln.worker.failure;

/**
 * Failure taxonomy recorded as {@code errors.type} on ledger events. Every kind is fatal to the run.
 */
public enum FailureKind {
    BUDGET_PROJECT_LIMIT,
    BUDGET_TIMEOUT,
    BUDGET_OUTPUT_LIMIT,
    POLICY_VIOLATION,
    MISSING_REQUIRED_ARTIFACT,
    PRODUCED_ARTIFACT_MISSING,
    SCHEMA_INVALID,
    REHYDRATION_FAILED,
    /** Registered artifact whose file has disappeared, and other contract checks without a dedicated kind. */
    VALIDATION_ERROR,
    COHERENCE_DRIFT,
    /** Uncaught exception in link code, or a link that reported FAILED. */
    RUNTIME_ERROR,
    /** Raised by audit links that detect a contract breach; never produced by the orchestrator itself. */
    CONTRACT_VIOLATION
}

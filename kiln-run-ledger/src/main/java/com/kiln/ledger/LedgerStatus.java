package com.kiln.ledger;

/** Status recorded on a ledger event. */
public enum LedgerStatus {
    STARTED,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    /** Coherence check scored the link's output below its threshold. */
    DRIFT_DETECTED
}

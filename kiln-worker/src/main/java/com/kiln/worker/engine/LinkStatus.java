package com.kiln.worker.engine;

/** Outcome of a link within the current run, as seen by {@code when} conditions. */
public enum LinkStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}

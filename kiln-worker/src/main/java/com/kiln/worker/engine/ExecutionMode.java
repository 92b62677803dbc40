package com.kiln.worker.engine;

/** How a link execution is treated by the engine. */
public enum ExecutionMode {
    /** Pipeline link: may be skipped when already done, feeds the project index, subject to coherence checks. */
    STABLE,
    /** Shadow candidate: always executes, writes to the shadow artifact root, never touches the project index. */
    SHADOW
}

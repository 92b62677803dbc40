package com.kiln.worker.failure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A link failed. Carries the failure kind and the error context written to the ledger. When
 * {@link #isLedgerRecorded()} is true the failure event has already been appended and the pipeline loop must not
 * record it again.
 */
public class LinkFailureException extends RuntimeException {

    private final String linkId;
    private final FailureKind kind;
    private final Map<String, Object> errorContext;
    private final boolean ledgerRecorded;

    public LinkFailureException(String linkId, FailureKind kind, String message, Map<String, Object> errorContext,
                                boolean ledgerRecorded) {
        this(linkId, kind, message, errorContext, ledgerRecorded, null);
    }

    public LinkFailureException(String linkId, FailureKind kind, String message, Map<String, Object> errorContext,
                                boolean ledgerRecorded, Throwable cause) {
        super(message, cause);
        this.linkId = linkId;
        this.kind = kind;
        this.errorContext = errorContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(errorContext)) : Map.of();
        this.ledgerRecorded = ledgerRecorded;
    }

    public String getLinkId() {
        return linkId;
    }

    public FailureKind getKind() {
        return kind;
    }

    /** {@code errors} map as recorded on the ledger ({@code type}, {@code message}, plus kind-specific keys). */
    public Map<String, Object> getErrorContext() {
        return errorContext;
    }

    public boolean isLedgerRecorded() {
        return ledgerRecorded;
    }
}

package com.kiln.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Facade over a {@link LedgerStore}. Unlike a metrics sink, the ledger is the audit record: a failed write
 * propagates so the caller never proceeds with an unrecorded lifecycle step.
 */
public final class RunLedger {

    private static final Logger log = LoggerFactory.getLogger(RunLedger.class);

    private final LedgerStore store;

    public RunLedger(LedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public void logEvent(LedgerEvent event) {
        store.append(event);
        if (log.isDebugEnabled()) {
            log.debug("Ledger event | linkId={} | step={} | status={} | runId={}",
                    event.getLinkId(), event.getStepId(), event.getStatus(), event.getRunId());
        }
    }

    public List<LedgerEvent> getEvents() {
        return store.readAll();
    }

    /** Full replay filtered to one link; null returns every event. */
    public List<LedgerEvent> getEvents(String linkId) {
        List<LedgerEvent> all = store.readAll();
        if (linkId == null) {
            return all;
        }
        List<LedgerEvent> filtered = new ArrayList<>();
        for (LedgerEvent e : all) {
            if (linkId.equals(e.getLinkId())) filtered.add(e);
        }
        return filtered;
    }

    /** Most recent event for the link with the given step id. */
    public Optional<LedgerEvent> lastEvent(String linkId, String stepId) {
        List<LedgerEvent> events = getEvents(linkId);
        for (int i = events.size() - 1; i >= 0; i--) {
            if (stepId.equals(events.get(i).getStepId())) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }
}

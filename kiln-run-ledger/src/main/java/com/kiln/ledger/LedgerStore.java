package com.kiln.ledger;

import java.util.List;

/**
 * Append-only storage for ledger events. Implementations never rewrite or delete history.
 */
public interface LedgerStore {

    /** Appends one event; the write is durable (flushed) when this returns. */
    void append(LedgerEvent event);

    /** Replays every event in append order. */
    List<LedgerEvent> readAll();
}

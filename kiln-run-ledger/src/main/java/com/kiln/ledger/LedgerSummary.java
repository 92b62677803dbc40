package com.kiln.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-link digest of a ledger: latest status, duration, number of outputs and last error message.
 * Built by folding events in order, so later events overwrite earlier ones.
 */
public final class LedgerSummary {

    private final Map<String, LinkRow> rows;

    private LedgerSummary(Map<String, LinkRow> rows) {
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static LedgerSummary fromEvents(Iterable<LedgerEvent> events) {
        Map<String, LinkRow> rows = new LinkedHashMap<>();
        for (LedgerEvent event : events) {
            LinkRow row = rows.computeIfAbsent(event.getLinkId(), id -> new LinkRow());
            switch (event.getStatus()) {
                case STARTED:
                    row.status = "STARTED";
                    break;
                case SUCCEEDED:
                    row.status = "SUCCEEDED";
                    Object duration = event.getMetrics().get("duration_ms");
                    row.durationMs = duration instanceof Number ? ((Number) duration).longValue() : 0L;
                    row.outputs = event.getOutputs().size();
                    break;
                case FAILED:
                    row.status = "FAILED";
                    Object message = event.getErrors().get("message");
                    row.lastError = message != null ? String.valueOf(message) : "Unknown error";
                    break;
                case SKIPPED:
                    row.status = "SKIPPED";
                    break;
                case DRIFT_DETECTED:
                    row.status = "DRIFT_DETECTED";
                    break;
                default:
                    break;
            }
        }
        return new LedgerSummary(rows);
    }

    public Map<String, LinkRow> getRows() {
        return rows;
    }

    /** Fixed-width table, one row per link in first-seen order. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-25s | %-14s | %-10s | %-7s | %s%n", "link_id", "status", "duration", "outputs", "last_error"));
        sb.append("-".repeat(80)).append(System.lineSeparator());
        for (Map.Entry<String, LinkRow> e : rows.entrySet()) {
            LinkRow r = e.getValue();
            sb.append(String.format("%-25s | %-14s | %-10s | %-7d | %s%n",
                    e.getKey(), r.status, r.durationMs + "ms", r.outputs, r.lastError));
        }
        return sb.toString();
    }

    public static final class LinkRow {
        private String status = "UNKNOWN";
        private long durationMs;
        private int outputs;
        private String lastError = "";

        public String getStatus() {
            return status;
        }

        public long getDurationMs() {
            return durationMs;
        }

        public int getOutputs() {
            return outputs;
        }

        public String getLastError() {
            return lastError;
        }
    }
}

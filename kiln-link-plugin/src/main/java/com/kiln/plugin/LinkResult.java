package com.kiln.plugin;

import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome reported by a {@link LinkPlugin}. */
public final class LinkResult {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    private final Status status;
    private final Map<String, Object> metrics;
    private final Map<String, Object> errors;

    private LinkResult(Status status, Map<String, Object> metrics, Map<String, Object> errors) {
        this.status = status;
        this.metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
        this.errors = errors != null ? Map.copyOf(errors) : Map.of();
    }

    public static LinkResult succeeded() {
        return new LinkResult(Status.SUCCEEDED, null, null);
    }

    public static LinkResult succeeded(Map<String, Object> metrics) {
        return new LinkResult(Status.SUCCEEDED, metrics, null);
    }

    /** Failed result with {@code errors = {type, message}}. */
    public static LinkResult failed(String type, String message) {
        Map<String, Object> errors = new LinkedHashMap<>();
        errors.put("type", type != null ? type : "RUNTIME_ERROR");
        errors.put("message", message != null ? message : "");
        return new LinkResult(Status.FAILED, null, errors);
    }

    public static LinkResult failed(Map<String, Object> errors, Map<String, Object> metrics) {
        return new LinkResult(Status.FAILED, metrics, errors);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public Map<String, Object> getErrors() {
        return errors;
    }

    /** {@code errors.message}, or a generic message when the plugin supplied none. */
    public String getErrorMessage() {
        Object m = errors.get("message");
        return m != null && !String.valueOf(m).isEmpty() ? String.valueOf(m) : "Link reported FAILED";
    }

    @Override
    public String toString() {
        return "LinkResult{" + status + (errors.isEmpty() ? "" : ", errors=" + errors) + "}";
    }
}

package com.kiln.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One line of the project ledger. Immutable; maps default to empty objects, drift fields are omitted
 * unless a coherence check produced them.
 * <p>
 * Timestamp is epoch seconds with a fractional part.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "project_id", "pipeline_id", "link_id", "run_id", "step_id", "status",
        "inputs", "outputs", "metrics", "errors", "policy_versions", "drift_score", "drift_metadata"})
public final class LedgerEvent {

    private final double timestamp;
    private final String projectId;
    private final String pipelineId;
    private final String linkId;
    private final String runId;
    private final String stepId;
    private final LedgerStatus status;
    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs;
    private final Map<String, Object> metrics;
    private final Map<String, Object> errors;
    private final Map<String, Object> policyVersions;
    private final Double driftScore;
    private final Map<String, Object> driftMetadata;

    @JsonCreator
    public LedgerEvent(
            @JsonProperty("timestamp") double timestamp,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("pipeline_id") String pipelineId,
            @JsonProperty("link_id") String linkId,
            @JsonProperty("run_id") String runId,
            @JsonProperty("step_id") String stepId,
            @JsonProperty("status") LedgerStatus status,
            @JsonProperty("inputs") Map<String, Object> inputs,
            @JsonProperty("outputs") Map<String, Object> outputs,
            @JsonProperty("metrics") Map<String, Object> metrics,
            @JsonProperty("errors") Map<String, Object> errors,
            @JsonProperty("policy_versions") Map<String, Object> policyVersions,
            @JsonProperty("drift_score") Double driftScore,
            @JsonProperty("drift_metadata") Map<String, Object> driftMetadata) {
        this.timestamp = timestamp;
        this.projectId = projectId;
        this.pipelineId = pipelineId;
        this.linkId = linkId;
        this.runId = runId != null ? runId : "";
        this.stepId = stepId;
        this.status = Objects.requireNonNull(status, "status");
        this.inputs = copy(inputs);
        this.outputs = copy(outputs);
        this.metrics = copy(metrics);
        this.errors = copy(errors);
        this.policyVersions = copy(policyVersions);
        this.driftScore = driftScore;
        this.driftMetadata = driftMetadata != null ? copy(driftMetadata) : null;
    }

    private static Map<String, Object> copy(Map<String, Object> m) {
        return m == null || m.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    public static Builder builder(String projectId, String pipelineId, String linkId, String runId,
                                  String stepId, LedgerStatus status) {
        return new Builder(projectId, pipelineId, linkId, runId, stepId, status);
    }

    @JsonProperty("timestamp")
    public double getTimestamp() {
        return timestamp;
    }

    @JsonProperty("project_id")
    public String getProjectId() {
        return projectId;
    }

    @JsonProperty("pipeline_id")
    public String getPipelineId() {
        return pipelineId;
    }

    @JsonProperty("link_id")
    public String getLinkId() {
        return linkId;
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("step_id")
    public String getStepId() {
        return stepId;
    }

    @JsonProperty("status")
    public LedgerStatus getStatus() {
        return status;
    }

    @JsonProperty("inputs")
    public Map<String, Object> getInputs() {
        return inputs;
    }

    @JsonProperty("outputs")
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    @JsonProperty("metrics")
    public Map<String, Object> getMetrics() {
        return metrics;
    }

    @JsonProperty("errors")
    public Map<String, Object> getErrors() {
        return errors;
    }

    @JsonProperty("policy_versions")
    public Map<String, Object> getPolicyVersions() {
        return policyVersions;
    }

    @JsonProperty("drift_score")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Double getDriftScore() {
        return driftScore;
    }

    @JsonProperty("drift_metadata")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Map<String, Object> getDriftMetadata() {
        return driftMetadata;
    }

    /** {@code errors.type}, or null when the event carries no error. */
    @JsonIgnore
    public String getErrorType() {
        Object type = errors.get("type");
        return type != null ? String.valueOf(type) : null;
    }

    @Override
    public String toString() {
        return "LedgerEvent{link=" + linkId + ", step=" + stepId + ", status=" + status + ", runId=" + runId + "}";
    }

    public static final class Builder {
        private final String projectId;
        private final String pipelineId;
        private final String linkId;
        private final String runId;
        private final String stepId;
        private final LedgerStatus status;
        private Map<String, Object> inputs;
        private Map<String, Object> outputs;
        private Map<String, Object> metrics;
        private Map<String, Object> errors;
        private Map<String, Object> policyVersions;
        private Double driftScore;
        private Map<String, Object> driftMetadata;

        private Builder(String projectId, String pipelineId, String linkId, String runId,
                        String stepId, LedgerStatus status) {
            this.projectId = projectId;
            this.pipelineId = pipelineId;
            this.linkId = linkId;
            this.runId = runId;
            this.stepId = stepId;
            this.status = status;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder metrics(Map<String, Object> metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder errors(Map<String, Object> errors) {
            this.errors = errors;
            return this;
        }

        public Builder policyVersions(Map<String, Object> policyVersions) {
            this.policyVersions = policyVersions;
            return this;
        }

        public Builder drift(double score, Map<String, Object> metadata) {
            this.driftScore = score;
            this.driftMetadata = metadata;
            return this;
        }

        public Builder driftScore(double score) {
            this.driftScore = score;
            return this;
        }

        /** Stamps the event with the current wall-clock time. */
        public LedgerEvent build() {
            double now = System.currentTimeMillis() / 1000.0;
            return new LedgerEvent(now, projectId, pipelineId, linkId, runId, stepId, status,
                    inputs, outputs, metrics, errors, policyVersions, driftScore, driftMetadata);
        }
    }
}

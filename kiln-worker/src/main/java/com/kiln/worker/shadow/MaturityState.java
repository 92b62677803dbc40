package com.kiln.worker.shadow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Persisted maturity of one shadow link. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"shadow_link", "stable_link", "consecutive_parity", "total_runs", "last_overlap",
        "parity_window", "promotion_ready", "approved", "approved_by", "approved_at", "last_updated"})
public final class MaturityState {

    @JsonProperty("shadow_link")
    private String shadowLink;
    @JsonProperty("stable_link")
    private String stableLink;
    @JsonProperty("consecutive_parity")
    private int consecutiveParity;
    @JsonProperty("total_runs")
    private int totalRuns;
    @JsonProperty("last_overlap")
    private double lastOverlap;
    @JsonProperty("parity_window")
    private int parityWindow;
    @JsonProperty("promotion_ready")
    private boolean promotionReady;
    @JsonProperty("approved")
    private boolean approved;
    @JsonProperty("approved_by")
    private String approvedBy;
    @JsonProperty("approved_at")
    private String approvedAt;
    @JsonProperty("last_updated")
    private String lastUpdated;

    public MaturityState() {
    }

    MaturityState(String shadowLink, String stableLink) {
        this.shadowLink = shadowLink;
        this.stableLink = stableLink;
    }

    public String getShadowLink() {
        return shadowLink;
    }

    public String getStableLink() {
        return stableLink;
    }

    void setStableLink(String stableLink) {
        this.stableLink = stableLink;
    }

    public int getConsecutiveParity() {
        return consecutiveParity;
    }

    void setConsecutiveParity(int consecutiveParity) {
        this.consecutiveParity = consecutiveParity;
    }

    public int getTotalRuns() {
        return totalRuns;
    }

    void setTotalRuns(int totalRuns) {
        this.totalRuns = totalRuns;
    }

    public double getLastOverlap() {
        return lastOverlap;
    }

    void setLastOverlap(double lastOverlap) {
        this.lastOverlap = lastOverlap;
    }

    public int getParityWindow() {
        return parityWindow;
    }

    void setParityWindow(int parityWindow) {
        this.parityWindow = parityWindow;
    }

    /** Window reached in the current streak; cleared when the streak breaks. */
    public boolean isPromotionReady() {
        return promotionReady;
    }

    void setPromotionReady(boolean promotionReady) {
        this.promotionReady = promotionReady;
    }

    public boolean isApproved() {
        return approved;
    }

    void setApproved(boolean approved) {
        this.approved = approved;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    void setApprovedBy(String approvedBy) {
        this.approvedBy = approvedBy;
    }

    public String getApprovedAt() {
        return approvedAt;
    }

    void setApprovedAt(String approvedAt) {
        this.approvedAt = approvedAt;
    }

    public String getLastUpdated() {
        return lastUpdated;
    }

    void setLastUpdated(String lastUpdated) {
        this.lastUpdated = lastUpdated;
    }
}

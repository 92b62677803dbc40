package com.kiln.policy;

import java.util.List;
import java.util.Map;

/** The {@code retention} section of the runtime policy, read by artifact pruning. */
public final class RetentionRules {

    static final List<String> DEFAULT_PROTECTED_ARTIFACTS = List.of(
            "kiln.evidence.pack",
            "kiln.release.bundle",
            "kiln.metrics.run_summary");

    private final int keepLastNRuns;
    private final int keepFailedRunsDays;
    private final boolean alwaysKeepEvidencePack;
    private final boolean preserveLedger;
    private final List<String> protectedArtifacts;

    private RetentionRules(int keepLastNRuns, int keepFailedRunsDays, boolean alwaysKeepEvidencePack,
                           boolean preserveLedger, List<String> protectedArtifacts) {
        this.keepLastNRuns = keepLastNRuns;
        this.keepFailedRunsDays = keepFailedRunsDays;
        this.alwaysKeepEvidencePack = alwaysKeepEvidencePack;
        this.preserveLedger = preserveLedger;
        this.protectedArtifacts = protectedArtifacts;
    }

    static RetentionRules fromMap(Map<String, Object> raw) {
        return new RetentionRules(
                PolicyValues.asInt(raw.get("keep_last_n_runs"), 3),
                PolicyValues.asInt(raw.get("keep_failed_runs_days"), 7),
                PolicyValues.asBoolean(raw.get("always_keep_evidence_pack"), true),
                PolicyValues.asBoolean(raw.get("preserve_ledger"), true),
                raw.containsKey("protected_artifacts")
                        ? PolicyValues.asStringList(raw.get("protected_artifacts"))
                        : DEFAULT_PROTECTED_ARTIFACTS);
    }

    public int getKeepLastNRuns() {
        return keepLastNRuns;
    }

    public int getKeepFailedRunsDays() {
        return keepFailedRunsDays;
    }

    public boolean shouldKeepEvidencePack() {
        return alwaysKeepEvidencePack;
    }

    public boolean shouldPreserveLedger() {
        return preserveLedger;
    }

    /** Artifact ids never deleted by pruning. */
    public List<String> getProtectedArtifacts() {
        return protectedArtifacts;
    }
}

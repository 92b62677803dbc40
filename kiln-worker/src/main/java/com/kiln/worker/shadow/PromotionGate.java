package com.kiln.worker.shadow;

import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.ledger.RunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Human approval of a shadow link that reached its parity window. Approval is recorded on the ledger and in
 * the maturity state; swapping the stable link for the shadow in pipeline specs is left to the operator.
 */
public final class PromotionGate {

    private static final Logger log = LoggerFactory.getLogger(PromotionGate.class);

    static final String STEP_APPROVED = "shadow_promotion_approved";

    private final String projectId;
    private final Path projectRoot;
    private final RunLedger ledger;

    public PromotionGate(String projectId, Path projectRoot, RunLedger ledger) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * @throws IllegalStateException when the shadow link is unknown or has not reached its parity window
     */
    public MaturityState approve(String pipelineId, String shadowLinkId, String approver) {
        MaturityTracker tracker = MaturityTracker.load(projectRoot);
        MaturityState state = tracker.get(shadowLinkId)
                .orElseThrow(() -> new IllegalStateException("No maturity record for shadow link " + shadowLinkId));
        if (!state.isPromotionReady()) {
            throw new IllegalStateException("Shadow link " + shadowLinkId + " is not ready for promotion ("
                    + state.getConsecutiveParity() + "/" + state.getParityWindow() + " consecutive parity runs)");
        }
        tracker.markApproved(state, approver);
        tracker.save();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("stable_link", state.getStableLink());
        metrics.put("shadow_link", shadowLinkId);
        metrics.put("approved_by", approver);
        metrics.put("consecutive_parity", state.getConsecutiveParity());
        ledger.logEvent(LedgerEvent.builder(projectId, pipelineId, shadowLinkId, "", STEP_APPROVED, LedgerStatus.SUCCEEDED)
                .metrics(metrics).build());
        log.info("Shadow promotion approved | projectId={} | shadowLink={} | stableLink={} | approver={}",
                projectId, shadowLinkId, state.getStableLink(), approver);
        return state;
    }
}

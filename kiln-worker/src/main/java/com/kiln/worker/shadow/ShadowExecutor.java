package com.kiln.worker.shadow;

import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.pipeline.load.ResolvedLink;
import com.kiln.worker.engine.ExecutionMode;
import com.kiln.worker.engine.LinkExecutor;
import com.kiln.worker.engine.LinkOutcome;
import com.kiln.worker.engine.ProjectContext;
import com.kiln.worker.failure.LinkFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a stable link's shadow candidate right after the stable link succeeded, against the same inputs but
 * writing under {@code shadow/artifacts}, then updates the candidate's maturity. Shadow problems are logged and
 * recorded; they never fail the pipeline.
 */
public final class ShadowExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShadowExecutor.class);

    public static final String SHADOW_ARTIFACTS_DIR = "artifacts";
    static final String STEP_PARITY = "shadow_parity";
    static final String STEP_READY = "shadow_promotion_ready";

    private final LinkExecutor executor;
    private final ParityComparator comparator;
    private final int defaultParityWindow;

    public ShadowExecutor(LinkExecutor executor, ParityComparator comparator, int defaultParityWindow) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.defaultParityWindow = defaultParityWindow;
    }

    public static Path shadowArtifactsRoot(Path projectRoot) {
        return projectRoot.resolve(MaturityTracker.SHADOW_DIR).resolve(SHADOW_ARTIFACTS_DIR);
    }

    public void run(ProjectContext context, ResolvedLink link, LinkOutcome stableOutcome) {
        LinkContract shadowContract = link.getShadowContract();
        if (shadowContract == null) {
            return;
        }
        String stableId = link.getLinkId();
        String shadowId = shadowContract.getId();
        int window = link.getShadowParityWindow() != null ? link.getShadowParityWindow() : defaultParityWindow;
        ArtifactStore shadowStore = seededStore(context, stableId);
        MaturityTracker tracker = MaturityTracker.load(context.getProjectRoot());

        LinkOutcome shadowOutcome;
        try {
            shadowOutcome = executor.execute(context, shadowContract, shadowStore, ExecutionMode.SHADOW);
        } catch (LinkFailureException e) {
            tracker.recordFailure(shadowId, stableId);
            tracker.save();
            log.warn("Shadow link failed, maturity reset | stableLink={} | shadowLink={} | kind={} | error={}",
                    stableId, shadowId, e.getKind(), e.getMessage());
            return;
        }

        ParityResult parity = comparator.compare(stableOutcome.getOutputs(), shadowOutcome.getOutputs());
        boolean becameReady = tracker.recordParity(shadowId, stableId, parity, window);
        tracker.save();
        MaturityState state = tracker.get(shadowId).orElseThrow();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("stable_link", stableId);
        metrics.put("parity", parity.isParity());
        metrics.put("overlap", parity.getOverlap());
        metrics.put("consecutive_parity", state.getConsecutiveParity());
        metrics.put("parity_window", window);
        metrics.put("mismatches", parity.getMismatches());
        metrics.put("run_id", context.getPipelineRunId());
        metrics.put("worker_id", context.getWorkerId());
        context.getLedger().logEvent(event(context, shadowId, STEP_PARITY).metrics(metrics).build());
        log.info("Shadow parity | stableLink={} | shadowLink={} | parity={} | overlap={} | streak={}/{}",
                stableId, shadowId, parity.isParity(), parity.getOverlap(), state.getConsecutiveParity(), window);

        if (becameReady) {
            Map<String, Object> ready = new LinkedHashMap<>();
            ready.put("stable_link", stableId);
            ready.put("shadow_link", shadowId);
            ready.put("consecutive_parity", state.getConsecutiveParity());
            ready.put("parity_window", window);
            ready.put("requires_approval", true);
            ready.put("run_id", context.getPipelineRunId());
            context.getLedger().logEvent(event(context, shadowId, STEP_READY).metrics(ready).build());
            log.info("Shadow ready for promotion, awaiting approval | stableLink={} | shadowLink={}", stableId, shadowId);
        }
    }

    /** Shadow store that sees every project artifact except the stable link's own outputs. */
    private static ArtifactStore seededStore(ProjectContext context, String stableId) {
        ArtifactStore shadowStore = ArtifactStore.rootedAt(shadowArtifactsRoot(context.getProjectRoot()));
        for (ArtifactRecord r : context.getArtifactStore().list()) {
            if (!stableId.equals(r.getProducerLinkId())) {
                shadowStore.register(r.getArtifactId(), r.toPath(), r.getSchema(), r.getProducerLinkId(), r.getBlobUri());
            }
        }
        return shadowStore;
    }

    private static LedgerEvent.Builder event(ProjectContext context, String shadowId, String step) {
        return LedgerEvent.builder(context.getProjectId(), context.getPipelineId(), shadowId,
                context.getPipelineRunId(), step, LedgerStatus.SUCCEEDED);
    }
}

package com.kiln.worker.engine;

import com.kiln.artifact.ArtifactIndexEntry;
import com.kiln.artifact.ArtifactRecord;
import com.kiln.artifact.ArtifactStore;
import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.pipeline.contract.ArtifactRef;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.plugin.LinkContext;
import com.kiln.plugin.LinkPlugin;
import com.kiln.plugin.LinkPluginRegistry;
import com.kiln.plugin.LinkResult;
import com.kiln.policy.RuntimePolicy;
import com.kiln.sandbox.FilesystemSnapshot;
import com.kiln.sandbox.Sandbox;
import com.kiln.sandbox.SandboxViolationScanner;
import com.kiln.worker.coherence.CoherenceScorer;
import com.kiln.worker.failure.FailureKind;
import com.kiln.worker.failure.LinkFailureException;
import com.kiln.worker.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Executes one link: reuse check, input validation, timeout-bounded plugin invocation between two filesystem
 * snapshots, sandbox and output budget checks, output validation, coherence check, manifest persistence and the
 * terminal ledger event. Every failure is on the ledger before the {@link LinkFailureException} leaves this class.
 */
public final class LinkExecutor {

    private static final Logger log = LoggerFactory.getLogger(LinkExecutor.class);

    static final String STEP_START = "link_start";
    static final String STEP_COMPLETE = "link_complete";
    static final String STEP_FAILED = "link_failed";
    static final String STEP_SKIP = "skip";
    static final String STEP_VALIDATE_SKIP = "validate_skip";
    static final String STEP_SANDBOX = "sandbox_check";

    private final RuntimePolicy policy;
    private final LinkPluginRegistry plugins;
    private final BudgetEnforcer budgets;
    private final OutputValidator outputValidator;
    private final CoherenceCheck coherenceCheck;

    public LinkExecutor(RuntimePolicy policy, LinkPluginRegistry plugins, SchemaRegistry schemas, CoherenceScorer scorer) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.budgets = new BudgetEnforcer(policy);
        this.outputValidator = new OutputValidator(schemas);
        this.coherenceCheck = new CoherenceCheck(scorer);
    }

    /**
     * @param store artifact store the link reads inputs from and publishes into; its root decides the sandbox
     *              prefix the violation scan allows
     * @throws LinkFailureException on any failure, always already recorded on the ledger
     */
    public LinkOutcome execute(ProjectContext context, LinkContract contract, ArtifactStore store, ExecutionMode mode) {
        String linkId = contract.getId();
        LinkEventRecorder recorder = new LinkEventRecorder(context, linkId, UUID.randomUUID().toString(),
                policyVersions(contract, context));
        String signature = InputSignature.compute(linkId, contract.getConfig(), store);

        if (mode == ExecutionMode.STABLE && !contract.isAlwaysRun()) {
            Optional<LinkOutcome> reused = tryReuse(context, contract, store, signature, recorder);
            if (reused.isPresent()) {
                return reused.get();
            }
        }

        long startNanos = System.nanoTime();
        Map<String, Object> startMetrics = new LinkedHashMap<>();
        startMetrics.put("input_signature", signature);
        startMetrics.putAll(recorder.runMetrics());
        recorder.log(recorder.event(STEP_START, LedgerStatus.STARTED).metrics(startMetrics));
        log.info("Link started | linkId={} | mode={} | signature={}", linkId, mode, signature);

        try {
            return run(context, contract, store, mode, signature, recorder, startNanos);
        } catch (LinkFailureException e) {
            if (e.isLedgerRecorded()) {
                throw e;
            }
            throw recordUnexpected(recorder, e);
        } catch (Exception e) {
            throw recordUnexpected(recorder, e);
        }
    }

    private LinkOutcome run(ProjectContext context, LinkContract contract, ArtifactStore store, ExecutionMode mode,
                            String signature, LinkEventRecorder recorder, long startNanos) throws Exception {
        String linkId = contract.getId();
        InputValidator.validate(contract, store, recorder);

        LinkPlugin plugin = plugins.getPlugin(contract.getPluginId())
                .orElseThrow(() -> recorder.fail(STEP_FAILED, FailureKind.RUNTIME_ERROR,
                        "No plugin registered for link " + linkId + " (plugin " + contract.getPluginId() + ")"));
        Sandbox sandbox = new Sandbox(linkId, store);
        LinkContext linkContext = LinkContext.builder()
                .projectId(context.getProjectId())
                .projectRoot(context.getProjectRoot())
                .pipelineId(context.getPipelineId())
                .pipelineRunId(context.getPipelineRunId())
                .linkRunId(recorder.getLinkRunId())
                .linkId(linkId)
                .workerId(context.getWorkerId())
                .profile(context.getProfile())
                .policy(policy.getVersion(), policy.getDigest())
                .artifactStore(store)
                .artifactIndex(context.getArtifactIndex().asMap())
                .sandbox(sandbox)
                .build();
        int timeoutSec = contract.getMaxWallTimeSec() != null
                ? contract.getMaxWallTimeSec() : policy.getEffectiveTimeout(context.getProfile());

        FilesystemSnapshot before = FilesystemSnapshot.capture(context.getProjectRoot());
        AtomicLong cpuNanos = new AtomicLong();
        LinkResult result;
        try {
            result = TimeoutInvoker.invoke(() -> {
                ThreadMXBean threads = ManagementFactory.getThreadMXBean();
                boolean cpuSupported = threads.isCurrentThreadCpuTimeSupported();
                long cpuStart = cpuSupported ? threads.getCurrentThreadCpuTime() : 0L;
                try {
                    return plugin.run(linkContext, contract.getConfig());
                } finally {
                    if (cpuSupported) {
                        cpuNanos.set(threads.getCurrentThreadCpuTime() - cpuStart);
                    }
                }
            }, timeoutSec, "kiln-link-" + linkId);
        } catch (TimeoutException e) {
            context.addBudgetViolation(BudgetEnforcer.violation(FailureKind.BUDGET_TIMEOUT, linkId, timeoutSec, timeoutSec));
            log.error("Link exceeded wall time, cancelled | linkId={} | timeoutSec={}", linkId, timeoutSec);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step_id", "run");
            details.put("timeout_sec", timeoutSec);
            throw recorder.fail(STEP_COMPLETE, FailureKind.BUDGET_TIMEOUT,
                    "BUDGET_TIMEOUT: Link " + linkId + " exceeded wall time limit of " + timeoutSec + "s", details);
        }
        if (result == null) {
            result = LinkResult.succeeded();
        }

        FilesystemSnapshot after = FilesystemSnapshot.capture(context.getProjectRoot());
        String outputPrefix = relativePrefix(context.getProjectRoot(), sandbox.getOutputDir());
        boolean srcAllowed = policy.isSrcWriteAllowed(linkId, context.getProfile());
        List<String> leaks = SandboxViolationScanner.forLink(outputPrefix, srcAllowed).findLeaks(before, after);
        if (!leaks.isEmpty()) {
            log.error("Sandbox violation | linkId={} | leakedPaths={}", linkId, leaks);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step_id", STEP_SANDBOX);
            details.put("leaked_paths", leaks);
            throw recorder.fail(STEP_SANDBOX, FailureKind.POLICY_VIOLATION,
                    "POLICY_VIOLATION: Link " + linkId + " modified files outside allowed sandbox roots: " + leaks, details);
        }
        budgets.checkOutputSize(sandbox.getOutputDir(), recorder);

        if (!result.isSucceeded()) {
            throw reportedFailure(linkId, result, recorder);
        }

        Map<String, ArtifactIndexEntry> outputs = outputValidator.validate(contract, store, context.getPipelineRunId(), recorder);
        if (mode == ExecutionMode.STABLE) {
            coherenceCheck.apply(contract, store, context, outputs, recorder);
        }
        store.saveManifest(linkId);
        if (mode == ExecutionMode.STABLE) {
            context.getArtifactIndex().replaceLinkOutputs(linkId, outputs);
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        Map<String, Object> metrics = new LinkedHashMap<>(result.getMetrics());
        metrics.put("input_signature", signature);
        metrics.putAll(recorder.runMetrics());
        metrics.put("duration_ms", durationMs);
        metrics.put("cpu_sec", cpuNanos.get() / 1_000_000_000.0);
        metrics.put("mem_mb_peak", usedHeapMb());
        Map<String, Object> ledgerOutputs = new LinkedHashMap<>();
        for (Map.Entry<String, ArtifactIndexEntry> e : outputs.entrySet()) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("path", e.getValue().getPath());
            out.put("digest", e.getValue().getDigest());
            ledgerOutputs.put(e.getKey(), out);
        }
        recorder.log(recorder.event(STEP_COMPLETE, LedgerStatus.SUCCEEDED).outputs(ledgerOutputs).metrics(metrics));
        log.info("Link succeeded | linkId={} | durationMs={} | outputs={}", linkId, durationMs, outputs.keySet());
        return LinkOutcome.executed(outputs, metrics, durationMs);
    }

    private Optional<LinkOutcome> tryReuse(ProjectContext context, LinkContract contract, ArtifactStore store,
                                           String signature, LinkEventRecorder recorder) {
        String linkId = contract.getId();
        Optional<LedgerEvent> last = lastExecution(context, linkId);
        if (last.isEmpty() || !STEP_COMPLETE.equals(last.get().getStepId())
                || last.get().getStatus() != LedgerStatus.SUCCEEDED
                || !signature.equals(last.get().getMetrics().get("input_signature"))) {
            return Optional.empty();
        }
        List<ArtifactRecord> restored = store.rehydrate(linkId);
        Set<String> restoredIds = restored.stream().map(ArtifactRecord::getArtifactId).collect(Collectors.toSet());
        List<String> expected = contract.getRequiredOutputs().stream()
                .map(ArtifactRef::getArtifactId).collect(Collectors.toList());
        List<String> absent = expected.stream().filter(id -> !restoredIds.contains(id)).collect(Collectors.toList());
        if (!absent.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step_id", STEP_VALIDATE_SKIP);
            details.put("missing_artifacts", absent);
            throw recorder.fail(STEP_VALIDATE_SKIP, FailureKind.REHYDRATION_FAILED,
                    "Link " + linkId + " marked ALREADY_DONE but artifacts " + absent + " could not be rehydrated. "
                            + "Expected artifacts from contract: " + expected
                            + ". This suggests artifact manifest is missing or corrupted.", details);
        }
        refreshIndex(context, restored);
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("reason", LinkOutcome.REASON_ALREADY_DONE);
        metrics.put("rehydrated_artifacts", restored.size());
        metrics.put("input_signature", signature);
        metrics.putAll(recorder.runMetrics());
        recorder.log(recorder.event(STEP_SKIP, LedgerStatus.SKIPPED).metrics(metrics));
        log.info("Link skipped, already done | linkId={} | rehydrated={}", linkId, restored.size());
        return Optional.of(LinkOutcome.reused(restored.size()));
    }

    /**
     * Latest {@code link_start} or {@code link_complete} of the link. A start that is newer than every completion
     * means the last execution never finished successfully, and whatever it left on disk is not reusable.
     */
    private static Optional<LedgerEvent> lastExecution(ProjectContext context, String linkId) {
        List<LedgerEvent> events = context.getLedger().getEvents(linkId);
        for (int i = events.size() - 1; i >= 0; i--) {
            String step = events.get(i).getStepId();
            if (STEP_START.equals(step) || STEP_COMPLETE.equals(step)) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    /** Points the index at the rehydrated bytes; the run that produced them stays the recorded producer. */
    private static void refreshIndex(ProjectContext context, List<ArtifactRecord> restored) {
        for (ArtifactRecord record : restored) {
            ArtifactIndexEntry existing = context.getArtifactIndex().get(record.getArtifactId());
            if (existing == null || !Objects.equals(existing.getPath(), record.getPath())
                    || !Objects.equals(existing.getDigest(), record.getDigest())) {
                String runId = existing != null ? existing.getRunId() : context.getPipelineRunId();
                context.getArtifactIndex().put(record.getArtifactId(), ArtifactIndexEntry.of(record, record.getDigest(), runId));
            }
        }
    }

    private LinkFailureException reportedFailure(String linkId, LinkResult result, LinkEventRecorder recorder) {
        Map<String, Object> errors = new LinkedHashMap<>(result.getErrors());
        errors.putIfAbsent("type", FailureKind.RUNTIME_ERROR.name());
        errors.putIfAbsent("message", result.getErrorMessage());
        errors.putIfAbsent("step_id", "run");
        Map<String, Object> metrics = new LinkedHashMap<>(result.getMetrics());
        metrics.putAll(recorder.runMetrics());
        recorder.log(recorder.event(STEP_COMPLETE, LedgerStatus.FAILED).errors(errors).metrics(metrics));
        String message = "Link " + linkId + " reported failure: " + result.getErrorMessage();
        log.error("Link reported failure | linkId={} | errors={}", linkId, errors);
        return new LinkFailureException(linkId, kindOf(errors.get("type")), message, errors, true);
    }

    private static LinkFailureException recordUnexpected(LinkEventRecorder recorder, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        log.error("Link raised | linkId={} | error={}", recorder.getLinkId(), message, e);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", e.getClass().getName());
        LinkFailureException recorded = recorder.fail(STEP_FAILED, FailureKind.RUNTIME_ERROR, message, details);
        return new LinkFailureException(recorder.getLinkId(), FailureKind.RUNTIME_ERROR, message,
                recorded.getErrorContext(), true, e);
    }

    static FailureKind kindOf(Object type) {
        if (type != null) {
            for (FailureKind kind : FailureKind.values()) {
                if (kind.name().equals(String.valueOf(type))) {
                    return kind;
                }
            }
        }
        return FailureKind.RUNTIME_ERROR;
    }

    private Map<String, Object> policyVersions(LinkContract contract, ProjectContext context) {
        Map<String, Object> versions = new LinkedHashMap<>();
        versions.put("contractVersion", contract.getContractVersion());
        versions.put("policyVersion", policy.getVersion());
        versions.put("policyDigest", policy.getDigest());
        versions.put("profile", context.getProfile());
        return versions;
    }

    static String relativePrefix(Path projectRoot, Path outputDir) {
        Path root = projectRoot.toAbsolutePath().normalize();
        return root.relativize(outputDir.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static double usedHeapMb() {
        Runtime rt = Runtime.getRuntime();
        return Math.round((rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0) * 10.0) / 10.0;
    }
}

package com.kiln.worker.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kiln.artifact.ArtifactIndex;
import com.kiln.artifact.ArtifactStore;
import com.kiln.config.KilnConfig;
import com.kiln.ledger.JsonLinesLedgerStore;
import com.kiln.ledger.LedgerEvent;
import com.kiln.ledger.LedgerStatus;
import com.kiln.ledger.RunLedger;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.pipeline.contract.WhenCondition;
import com.kiln.pipeline.load.LinkRegistry;
import com.kiln.pipeline.load.PipelineResolver;
import com.kiln.pipeline.load.PipelineSpecLoader;
import com.kiln.pipeline.load.ResolvedLink;
import com.kiln.pipeline.spec.PipelineEntry;
import com.kiln.pipeline.spec.PipelineSpec;
import com.kiln.plugin.LinkPluginRegistry;
import com.kiln.policy.RuntimePolicy;
import com.kiln.worker.coherence.CoherenceScorer;
import com.kiln.worker.coherence.StructuralCoherenceScorer;
import com.kiln.worker.failure.LinkFailureException;
import com.kiln.worker.failure.PipelineFailedException;
import com.kiln.worker.failure.ProjectBusyException;
import com.kiln.worker.logging.MdcContext;
import com.kiln.worker.metrics.RunMetrics;
import com.kiln.worker.schema.SchemaRegistry;
import com.kiln.worker.shadow.ParityComparator;
import com.kiln.worker.shadow.ShadowExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Runs pipelines against projects under a projects directory. One run per project at a time (file lock); links
 * execute sequentially in pipeline order and the first failure stops the run. The artifact index, a copy of the
 * pipeline and the run summary are persisted whether the run succeeds or fails.
 * <p>
 * The policy is fixed at construction; there is no process-wide policy state.
 */
public final class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String PIPELINE_COPY_FILE = "pipeline.yaml";
    static final String STEP_EVALUATE_CONDITION = "evaluate_condition";

    private final Path projectsDir;
    private final RuntimePolicy policy;
    private final String profile;
    private final String workerId;
    private final PipelineResolver resolver;
    private final LinkExecutor linkExecutor;
    private final ShadowExecutor shadowExecutor;
    private final BudgetEnforcer budgets;
    private final RunSummaryWriter summaryWriter;
    private final RunMetrics metrics;

    private Orchestrator(Builder b) {
        this.projectsDir = Objects.requireNonNull(b.projectsDir, "projectsDir");
        this.policy = Objects.requireNonNull(b.policy, "policy");
        this.profile = b.profile != null && !b.profile.isBlank() ? b.profile : policy.getDefaultProfile();
        this.workerId = b.workerId != null ? b.workerId : defaultWorkerId();
        this.resolver = new PipelineResolver(Objects.requireNonNull(b.linkRegistry, "linkRegistry"), b.strictArtifactIds);
        this.linkExecutor = new LinkExecutor(policy, Objects.requireNonNull(b.pluginRegistry, "pluginRegistry"),
                b.schemaRegistry != null ? b.schemaRegistry : new SchemaRegistry(),
                b.coherenceScorer != null ? b.coherenceScorer : new StructuralCoherenceScorer());
        this.shadowExecutor = new ShadowExecutor(linkExecutor, new ParityComparator(), b.shadowParityWindow);
        this.budgets = new BudgetEnforcer(policy);
        this.summaryWriter = new RunSummaryWriter(policy);
        this.metrics = new RunMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled from worker configuration. */
    public static Builder builder(KilnConfig config) {
        return new Builder()
                .projectsDir(config.getProjectsDir())
                .profile(config.getProfile())
                .strictArtifactIds(config.isStrictArtifactId())
                .shadowParityWindow(config.getShadowParityWindow());
    }

    public String getProfile() {
        return profile;
    }

    public String getWorkerId() {
        return workerId;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.getRegistry();
    }

    public Path getProjectRoot(String projectId) {
        return projectsDir.resolve(projectId);
    }

    public ProjectContext runPipeline(String projectId, Path pipelinePath) {
        return runPipeline(projectId, PipelineSpecLoader.load(pipelinePath));
    }

    /**
     * @throws ProjectBusyException    when another run holds the project lock
     * @throws PipelineFailedException when the preflight or any link failed
     */
    public ProjectContext runPipeline(String projectId, PipelineSpec spec) {
        Path projectRoot = getProjectRoot(projectId);
        List<ResolvedLink> links = resolver.resolve(spec);
        long lockStart = System.nanoTime();
        try (ProjectLock lock = ProjectLock.acquire(projectRoot, projectId)) {
            long lockWaitMs = (System.nanoTime() - lockStart) / 1_000_000L;
            return runLocked(projectId, projectRoot, spec, links, lockWaitMs);
        } finally {
            MdcContext.clear();
        }
    }

    private ProjectContext runLocked(String projectId, Path projectRoot, PipelineSpec spec, List<ResolvedLink> links,
                                     long lockWaitMs) {
        String runId = UUID.randomUUID().toString();
        double startedAt = System.currentTimeMillis() / 1000.0;
        long startNanos = System.nanoTime();
        MdcContext.setRun(projectId, spec.getPipelineId(), runId);

        RunLedger ledger = new RunLedger(new JsonLinesLedgerStore(projectRoot));
        ProjectContext context = new ProjectContext(projectId, projectRoot, spec.getPipelineId(), runId, workerId,
                profile, lockWaitMs, ArtifactStore.forProject(projectRoot), ArtifactIndex.load(projectRoot), ledger);
        log.info("Pipeline run started | projectId={} | pipelineId={} | runId={} | profile={} | links={}",
                projectId, spec.getPipelineId(), runId, profile, links.size());

        try {
            budgets.checkProjectSize(context, new LinkEventRecorder(context, BudgetEnforcer.PREFLIGHT_LINK_ID, runId,
                    preflightVersions()));
        } catch (LinkFailureException e) {
            metrics.pipelineFinished(spec.getPipelineId(), false, context.getBudgetViolations());
            throw new PipelineFailedException(BudgetEnforcer.PREFLIGHT_LINK_ID, e.getMessage(), context, e);
        }

        String failureLink = null;
        String failureError = null;
        RuntimeException failure = null;
        for (ResolvedLink link : links) {
            String linkId = link.getLinkId();
            MdcContext.setLink(linkId);
            long linkStart = System.nanoTime();
            try {
                if (!conditionHolds(context, link.getContract())) {
                    continue;
                }
                LinkOutcome outcome = linkExecutor.execute(context, link.getContract(), context.getArtifactStore(),
                        ExecutionMode.STABLE);
                if (outcome.isReused()) {
                    context.markReused(linkId);
                    metrics.linkReused(linkId);
                    Map<String, Object> record = new LinkedHashMap<>();
                    record.put("duration_ms", 0L);
                    record.put("skipped", true);
                    record.put("reason", LinkOutcome.REASON_ALREADY_DONE);
                    record.put("rehydrated_artifacts", outcome.getRehydratedArtifacts());
                    context.recordLink(linkId, record);
                    continue;
                }
                context.markStatus(linkId, LinkStatus.SUCCEEDED);
                metrics.linkSucceeded(linkId, outcome.getDurationMs());
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("duration_ms", outcome.getDurationMs());
                record.put("skipped", false);
                record.put("metrics", outcome.getMetrics());
                context.recordLink(linkId, record);
                if (link.hasShadow()) {
                    runShadow(context, link, outcome);
                }
            } catch (RuntimeException e) {
                context.markStatus(linkId, LinkStatus.FAILED);
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                long linkDurationMs = (System.nanoTime() - linkStart) / 1_000_000L;
                metrics.linkFailed(linkId, linkDurationMs);
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("duration_ms", linkDurationMs);
                record.put("skipped", false);
                record.put("error", error);
                context.recordLink(linkId, record);
                failureLink = linkId;
                failureError = error;
                failure = e;
                log.error("Link failed, stopping pipeline | linkId={} | error={}", linkId, error);
                break;
            } finally {
                MdcContext.clearLink();
            }
        }

        double endedAt = System.currentTimeMillis() / 1000.0;
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        RuntimeException persistFailure = null;
        try {
            writePipelineCopy(projectRoot, spec);
            summaryWriter.write(context, spec.getSourcePath(), startedAt, endedAt, durationMs, failureLink, failureError);
            context.getArtifactIndex().save(projectRoot);
        } catch (RuntimeException e) {
            if (failureLink == null) {
                metrics.pipelineFinished(spec.getPipelineId(), false, context.getBudgetViolations());
                throw e;
            }
            // the link failure stays the reported cause
            persistFailure = e;
            log.error("Run state not persisted after link failure | projectId={} | runId={} | linkId={} | error={}",
                    projectId, runId, failureLink, e.getMessage(), e);
        }
        metrics.pipelineFinished(spec.getPipelineId(), failureLink == null, context.getBudgetViolations());

        if (failureLink != null) {
            log.error("Pipeline run failed | projectId={} | runId={} | linkId={} | durationMs={}",
                    projectId, runId, failureLink, durationMs);
            PipelineFailedException failed = new PipelineFailedException(failureLink, failureError, context, failure);
            if (persistFailure != null) {
                failed.addSuppressed(persistFailure);
            }
            throw failed;
        }
        log.info("Pipeline run succeeded | projectId={} | runId={} | durationMs={}", projectId, runId, durationMs);
        return context;
    }

    private boolean conditionHolds(ProjectContext context, LinkContract contract) {
        WhenCondition when = contract.getWhen();
        ArtifactIndex index = context.getArtifactIndex();
        if (when.evaluate(context::hasSucceeded, context::hasFailed, index::contains)) {
            return true;
        }
        String linkId = contract.getId();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("condition", when.toString());
        metrics.put("run_id", context.getPipelineRunId());
        metrics.put("worker_id", context.getWorkerId());
        for (String step : List.of(STEP_EVALUATE_CONDITION, LinkExecutor.STEP_COMPLETE)) {
            context.getLedger().logEvent(LedgerEvent.builder(context.getProjectId(), context.getPipelineId(), linkId,
                    "", step, LedgerStatus.SKIPPED).metrics(metrics).build());
        }
        context.markStatus(linkId, LinkStatus.SKIPPED);
        this.metrics.linkSkipped(linkId);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("duration_ms", 0L);
        record.put("skipped", true);
        record.put("reason", when.toString());
        context.recordLink(linkId, record);
        log.info("Link skipped by condition | linkId={} | condition={}", linkId, when);
        return false;
    }

    private void runShadow(ProjectContext context, ResolvedLink link, LinkOutcome stableOutcome) {
        try {
            shadowExecutor.run(context, link, stableOutcome);
        } catch (RuntimeException e) {
            log.warn("Shadow execution aborted | linkId={} | shadowLink={} | error={}",
                    link.getLinkId(), link.getShadowContract().getId(), e.getMessage(), e);
        }
    }

    private Map<String, Object> preflightVersions() {
        Map<String, Object> versions = new LinkedHashMap<>();
        versions.put("policyVersion", policy.getVersion());
        versions.put("policyDigest", policy.getDigest());
        versions.put("profile", profile);
        return versions;
    }

    private static void writePipelineCopy(Path projectRoot, PipelineSpec spec) {
        Map<String, Object> document = spec.getDocument();
        if (document.isEmpty()) {
            List<String> ids = new ArrayList<>();
            for (PipelineEntry entry : spec.getEntries()) {
                ids.add(entry.getLinkId());
            }
            document = new LinkedHashMap<>();
            document.put("pipelineId", spec.getPipelineId());
            document.put("links", ids);
        }
        Path file = projectRoot.resolve(PIPELINE_COPY_FILE);
        try {
            YAML_MAPPER.writeValue(file.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write pipeline copy " + file, e);
        }
    }

    static String defaultWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Hostname unresolvable, using localhost in worker id | error={}", e.getMessage());
            host = "localhost";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    public static final class Builder {
        private Path projectsDir;
        private RuntimePolicy policy;
        private LinkRegistry linkRegistry;
        private LinkPluginRegistry pluginRegistry;
        private String profile;
        private String workerId;
        private boolean strictArtifactIds;
        private SchemaRegistry schemaRegistry;
        private CoherenceScorer coherenceScorer;
        private int shadowParityWindow = KilnConfig.DEFAULT_SHADOW_PARITY_WINDOW;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        public Builder projectsDir(Path projectsDir) {
            this.projectsDir = projectsDir;
            return this;
        }

        public Builder policy(RuntimePolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder linkRegistry(LinkRegistry linkRegistry) {
            this.linkRegistry = linkRegistry;
            return this;
        }

        public Builder pluginRegistry(LinkPluginRegistry pluginRegistry) {
            this.pluginRegistry = pluginRegistry;
            return this;
        }

        /** Security profile; null or blank selects the policy's default profile. */
        public Builder profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder strictArtifactIds(boolean strictArtifactIds) {
            this.strictArtifactIds = strictArtifactIds;
            return this;
        }

        public Builder schemaRegistry(SchemaRegistry schemaRegistry) {
            this.schemaRegistry = schemaRegistry;
            return this;
        }

        public Builder coherenceScorer(CoherenceScorer coherenceScorer) {
            this.coherenceScorer = coherenceScorer;
            return this;
        }

        public Builder shadowParityWindow(int shadowParityWindow) {
            this.shadowParityWindow = shadowParityWindow;
            return this;
        }

        /** Registry for run meters; a private {@code SimpleMeterRegistry} when unset. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}

package com.kiln.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kiln.config.KilnConfig;
import com.kiln.pipeline.load.LinkRegistry;
import com.kiln.plugin.LinkPluginRegistry;
import com.kiln.plugin.PluginManager;
import com.kiln.policy.PolicyLoader;
import com.kiln.policy.RuntimePolicy;
import com.kiln.worker.engine.Orchestrator;
import com.kiln.worker.engine.ProjectContext;
import com.kiln.worker.failure.PipelineFailedException;
import com.kiln.worker.failure.ProjectBusyException;
import com.kiln.worker.retention.ArtifactPruner;
import com.kiln.worker.retention.PruningReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;

/**
 * Kiln worker entry point.
 * <pre>
 *   kiln-worker &lt;projectId&gt; &lt;pipeline.yaml&gt;
 *   kiln-worker prune (&lt;projectId&gt; | --all) [--dry-run]
 * </pre>
 * Settings come from {@code KILN_*} environment variables (see {@link KilnConfig}). Exit code 0 on success,
 * 1 when the pipeline failed, 2 on usage errors, 3 when the project is busy.
 */
public final class KilnWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(KilnWorkerApplication.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BUSY = 3;

    private KilnWorkerApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, KilnConfig.fromEnvironment()));
    }

    static int run(String[] args, KilnConfig config) {
        if (args.length >= 2 && "prune".equals(args[0])) {
            return prune(args, config);
        }
        if (args.length != 2) {
            log.error("Usage: kiln-worker <projectId> <pipeline.yaml> | kiln-worker prune (<projectId>|--all) [--dry-run]");
            return EXIT_USAGE;
        }
        RuntimePolicy policy = loadPolicy(config);
        LinkRegistry links = LinkRegistry.discover(config.getLinksDir(), config.isStrictArtifactId());
        LinkPluginRegistry plugins = loadPlugins(config);
        Orchestrator orchestrator = Orchestrator.builder(config)
                .policy(policy)
                .linkRegistry(links)
                .pluginRegistry(plugins)
                .build();
        try {
            ProjectContext context = orchestrator.runPipeline(args[0], Paths.get(args[1]));
            log.info("Pipeline completed | projectId={} | runId={} | links={}",
                    context.getProjectId(), context.getPipelineRunId(), context.getStatusIndex());
            return EXIT_OK;
        } catch (ProjectBusyException e) {
            log.error(e.getMessage());
            return EXIT_BUSY;
        } catch (PipelineFailedException e) {
            log.error("{} | kind={}", e.getMessage(), e.getKind());
            return EXIT_FAILED;
        }
    }

    static RuntimePolicy loadPolicy(KilnConfig config) {
        PolicyLoader loader = config.getPolicyPath() != null
                ? new PolicyLoader(config.getPolicyPath()) : PolicyLoader.forDefaultPolicy();
        RuntimePolicy policy = loader.load();
        log.info("Runtime policy loaded | version={} | digest={}", policy.getVersion(), policy.getDigest());
        return policy;
    }

    /** Internal providers from the class path are fatal on failure; community JARs follow KILN_PLUGINS_REQUIRED. */
    static LinkPluginRegistry loadPlugins(KilnConfig config) {
        PluginManager manager = new PluginManager(config.isPluginsRequired());
        manager.loadInternalProviders(KilnWorkerApplication.class.getClassLoader());
        manager.loadCommunityPlugins(config.getPluginsDir());
        LinkPluginRegistry registry = new LinkPluginRegistry();
        int count = registry.registerAll(manager.getInternalProviders(), true, true)
                + registry.registerAll(manager.getCommunityProviders(), false, config.isPluginsRequired());
        if (count == 0) {
            log.warn("No link plugins registered; check the class path and KILN_PLUGINS_DIR for plugin JARs");
        }
        return registry;
    }

    private static int prune(String[] args, KilnConfig config) {
        boolean dryRun = args.length > 2 && "--dry-run".equals(args[2]);
        ArtifactPruner pruner = new ArtifactPruner(config.getProjectsDir(), loadPolicy(config).getRetention());
        List<PruningReport> reports = "--all".equals(args[1])
                ? pruner.pruneAllProjects(dryRun) : List.of(pruner.pruneProject(args[1], dryRun));
        int errors = 0;
        for (PruningReport report : reports) {
            errors += report.getErrors().size();
            try {
                log.info("Pruning report\n{}", MAPPER.writeValueAsString(report.toMap()));
            } catch (JsonProcessingException e) {
                log.warn("Pruning report not serializable | projectId={} | error={}", report.getProjectId(), e.getMessage());
            }
        }
        return errors == 0 ? EXIT_OK : EXIT_FAILED;
    }
}

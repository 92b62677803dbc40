package com.kiln.pipeline.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A link's declared contract, parsed from its manifest (with pipeline overrides already merged in).
 * Immutable for the duration of a run.
 * <p>
 * Manifest layout:
 * <pre>
 * metadata: { name: &lt;link id&gt; }
 * contractVersion: 1.0.0            # optional
 * max_wall_time_sec: 30             # optional per-link timeout override
 * config: { ... }                   # passed to the plugin, part of the input signature
 * spec:
 *   requires: [ ... ]               # see {@link ArtifactRef}
 *   produces: [ ... ]
 *   when: { condition: on_success(ingest) }
 *   runtime: { alwaysRun: false, plugin: &lt;plugin id&gt; }
 *   coherence_policy: { threshold: 0.7, on_drift: warn }
 * </pre>
 */
public final class LinkContract {

    public static final String DEFAULT_CONTRACT_VERSION = "1.0.0";

    private final String id;
    private final String contractVersion;
    private final List<ArtifactRef> requires;
    private final List<ArtifactRef> produces;
    private final WhenCondition when;
    private final boolean alwaysRun;
    private final String pluginId;
    private final Integer maxWallTimeSec;
    private final Map<String, Object> config;
    private final CoherencePolicy coherencePolicy;
    private final Map<String, Object> manifest;

    private LinkContract(String id, String contractVersion, List<ArtifactRef> requires, List<ArtifactRef> produces,
                         WhenCondition when, boolean alwaysRun, String pluginId, Integer maxWallTimeSec,
                         Map<String, Object> config, CoherencePolicy coherencePolicy, Map<String, Object> manifest) {
        this.id = id;
        this.contractVersion = contractVersion;
        this.requires = Collections.unmodifiableList(requires);
        this.produces = Collections.unmodifiableList(produces);
        this.when = when;
        this.alwaysRun = alwaysRun;
        this.pluginId = pluginId;
        this.maxWallTimeSec = maxWallTimeSec;
        this.config = config;
        this.coherencePolicy = coherencePolicy;
        this.manifest = manifest;
    }

    /**
     * @param strictIds reject the legacy {@code artifactId} key in artifact references
     * @throws InvalidContractException when the manifest has no {@code metadata.name}, an unparseable
     *                                  condition, an artifact reference without id, or a bad coherence policy
     */
    public static LinkContract fromManifest(Map<String, Object> manifest, boolean strictIds) {
        Map<String, Object> metadata = ConfigTrees.asMap(manifest.get("metadata"));
        Object name = metadata.get("name");
        if (name == null || String.valueOf(name).isBlank()) {
            throw new InvalidContractException("Link manifest has no metadata.name");
        }
        String id = String.valueOf(name);
        Map<String, Object> spec = ConfigTrees.asMap(manifest.get("spec"));
        Map<String, Object> runtime = ConfigTrees.asMap(spec.get("runtime"));
        Object whenExpr = ConfigTrees.asMap(spec.get("when")).get("condition");
        Object contractVersion = manifest.get("contractVersion");
        Object plugin = runtime.get("plugin");
        Object maxWall = manifest.get("max_wall_time_sec");
        if (maxWall != null && !(maxWall instanceof Number)) {
            throw new InvalidContractException("max_wall_time_sec must be a number in link " + id + ", got: " + maxWall);
        }

        return new LinkContract(
                id,
                contractVersion != null ? String.valueOf(contractVersion) : DEFAULT_CONTRACT_VERSION,
                refs(spec.get("requires"), strictIds),
                refs(spec.get("produces"), strictIds),
                WhenCondition.parse(whenExpr != null ? String.valueOf(whenExpr) : null),
                Boolean.TRUE.equals(runtime.get("alwaysRun")),
                plugin != null ? String.valueOf(plugin) : id,
                maxWall != null && ((Number) maxWall).intValue() > 0 ? ((Number) maxWall).intValue() : null,
                ConfigTrees.freeze(ConfigTrees.asMap(manifest.get("config"))),
                CoherencePolicy.fromRaw(spec.get("coherence_policy")),
                ConfigTrees.freeze(manifest));
    }

    private static List<ArtifactRef> refs(Object raw, boolean strictIds) {
        List<ArtifactRef> out = new ArrayList<>();
        for (Object o : ConfigTrees.asList(raw)) {
            out.add(ArtifactRef.fromRaw(o, strictIds));
        }
        return out;
    }

    public String getId() {
        return id;
    }

    public String getContractVersion() {
        return contractVersion;
    }

    public List<ArtifactRef> getRequires() {
        return requires;
    }

    public List<ArtifactRef> getProduces() {
        return produces;
    }

    public WhenCondition getWhen() {
        return when;
    }

    /** Never skip on a matching input signature. */
    public boolean isAlwaysRun() {
        return alwaysRun;
    }

    /** Plugin id that implements this link; defaults to the link id. */
    public String getPluginId() {
        return pluginId;
    }

    /** Per-link wall-time override in seconds, or null to use the policy's effective timeout. */
    public Integer getMaxWallTimeSec() {
        return maxWallTimeSec;
    }

    /** Unmodifiable plugin configuration. */
    public Map<String, Object> getConfig() {
        return config;
    }

    public CoherencePolicy getCoherencePolicy() {
        return coherencePolicy;
    }

    /** Full (merged) manifest tree this contract was parsed from. */
    public Map<String, Object> getManifest() {
        return manifest;
    }

    /** Non-optional entries of {@code produces}. */
    public List<ArtifactRef> getRequiredOutputs() {
        List<ArtifactRef> out = new ArrayList<>();
        for (ArtifactRef ref : produces) {
            if (!ref.isOptional()) out.add(ref);
        }
        return out;
    }
}

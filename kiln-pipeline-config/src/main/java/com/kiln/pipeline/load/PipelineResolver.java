package com.kiln.pipeline.load;

import com.kiln.pipeline.contract.ConfigTrees;
import com.kiln.pipeline.contract.InvalidContractException;
import com.kiln.pipeline.contract.LinkContract;
import com.kiln.pipeline.spec.PipelineEntry;
import com.kiln.pipeline.spec.PipelineSpec;
import com.kiln.pipeline.spec.ShadowSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds every pipeline entry to its installed link and merges overrides, before any link runs. Merge order per
 * link: top-level {@code overrides[linkId]} onto the manifest, then the entry's {@code config} onto the
 * manifest's {@code config}, then the entry's {@code overrides} onto the manifest.
 */
public final class PipelineResolver {

    private static final Logger log = LoggerFactory.getLogger(PipelineResolver.class);

    private final LinkRegistry registry;
    private final boolean strictIds;

    public PipelineResolver(LinkRegistry registry, boolean strictIds) {
        this.registry = registry;
        this.strictIds = strictIds;
    }

    /**
     * @return resolved links in pipeline order; entries naming an uninstalled link are left out
     * @throws PipelineDefinitionException when a merged contract is invalid
     */
    public List<ResolvedLink> resolve(PipelineSpec spec) {
        List<ResolvedLink> out = new ArrayList<>();
        for (PipelineEntry entry : spec.getEntries()) {
            Optional<LinkDefinition> def = registry.get(entry.getLinkId());
            if (def.isEmpty()) {
                log.error("Link not found in registry; skipping | pipelineId={} | linkId={}", spec.getPipelineId(), entry.getLinkId());
                continue;
            }
            LinkContract contract = toContract(entry.getLinkId(),
                    merge(def.get().getManifest(), spec.getOverrides(entry.getLinkId()), entry.getConfig(), entry.getOverrides()));

            LinkContract shadowContract = null;
            Integer window = null;
            ShadowSpec shadow = entry.getShadow();
            if (shadow != null) {
                Optional<LinkDefinition> shadowDef = registry.get(shadow.getLinkId());
                if (shadowDef.isEmpty()) {
                    log.warn("Shadow link not found in registry; shadow disabled | linkId={} | shadowId={}",
                            entry.getLinkId(), shadow.getLinkId());
                } else {
                    shadowContract = toContract(shadow.getLinkId(),
                            merge(shadowDef.get().getManifest(), spec.getOverrides(shadow.getLinkId()), entry.getConfig(), Map.of()));
                    window = shadow.getParityWindow();
                }
            }
            out.add(new ResolvedLink(entry, def.get(), contract, shadowContract, window));
        }
        return out;
    }

    static Map<String, Object> merge(Map<String, Object> manifest, Map<String, Object> topLevelOverrides,
                                     Map<String, Object> entryConfig, Map<String, Object> entryOverrides) {
        Map<String, Object> merged = ConfigTrees.deepMerge(manifest, topLevelOverrides);
        if (!entryConfig.isEmpty()) {
            merged.put("config", ConfigTrees.deepMerge(ConfigTrees.asMap(merged.get("config")), entryConfig));
        }
        return ConfigTrees.deepMerge(merged, entryOverrides);
    }

    private LinkContract toContract(String linkId, Map<String, Object> merged) {
        try {
            return LinkContract.fromManifest(merged, strictIds);
        } catch (InvalidContractException e) {
            throw new PipelineDefinitionException(linkId, "Invalid contract for link " + linkId + " after overrides: " + e.getMessage(), e);
        }
    }
}

package com.kiln.pipeline.load;

import com.kiln.pipeline.contract.LinkContract;
import com.kiln.pipeline.spec.PipelineEntry;

/**
 * A pipeline entry bound to its installed link, with pipeline overrides merged into the contract. The shadow
 * contract is null when the entry declares no shadow or the shadow link is not installed.
 */
public final class ResolvedLink {

    private final PipelineEntry entry;
    private final LinkDefinition definition;
    private final LinkContract contract;
    private final LinkContract shadowContract;
    private final Integer shadowParityWindow;

    ResolvedLink(PipelineEntry entry, LinkDefinition definition, LinkContract contract,
                 LinkContract shadowContract, Integer shadowParityWindow) {
        this.entry = entry;
        this.definition = definition;
        this.contract = contract;
        this.shadowContract = shadowContract;
        this.shadowParityWindow = shadowParityWindow;
    }

    public static ResolvedLink of(LinkDefinition definition) {
        return new ResolvedLink(PipelineEntry.of(definition.getId()), definition, definition.getContract(), null, null);
    }

    public String getLinkId() {
        return contract.getId();
    }

    public PipelineEntry getEntry() {
        return entry;
    }

    public LinkDefinition getDefinition() {
        return definition;
    }

    public LinkContract getContract() {
        return contract;
    }

    public LinkContract getShadowContract() {
        return shadowContract;
    }

    public boolean hasShadow() {
        return shadowContract != null;
    }

    /** Window declared on the entry, or null for the process default. */
    public Integer getShadowParityWindow() {
        return shadowParityWindow;
    }
}

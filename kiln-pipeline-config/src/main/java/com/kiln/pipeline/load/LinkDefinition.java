package com.kiln.pipeline.load;

import com.kiln.pipeline.contract.LinkContract;

import java.nio.file.Path;
import java.util.Map;

/** An installed link: its directory, the manifest as read, and the contract parsed from it. */
public final class LinkDefinition {

    private final String id;
    private final Path directory;
    private final Map<String, Object> manifest;
    private final LinkContract contract;

    public LinkDefinition(Path directory, Map<String, Object> manifest, LinkContract contract) {
        this.id = contract.getId();
        this.directory = directory;
        this.manifest = manifest;
        this.contract = contract;
    }

    public String getId() {
        return id;
    }

    public Path getDirectory() {
        return directory;
    }

    /** Unmodifiable manifest tree without pipeline overrides. */
    public Map<String, Object> getManifest() {
        return manifest;
    }

    /** Contract as declared by the manifest alone. */
    public LinkContract getContract() {
        return contract;
    }
}

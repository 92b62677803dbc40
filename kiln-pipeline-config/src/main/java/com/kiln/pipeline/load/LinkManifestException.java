package com.kiln.pipeline.load;

import java.nio.file.Path;

/**
 * A {@code link.yaml} that exists but cannot be read, is not a mapping, or declares an invalid contract.
 */
public class LinkManifestException extends RuntimeException {

    private final Path manifestPath;

    public LinkManifestException(Path manifestPath, String message) {
        super(message);
        this.manifestPath = manifestPath;
    }

    public LinkManifestException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }

    public Path getManifestPath() {
        return manifestPath;
    }
}

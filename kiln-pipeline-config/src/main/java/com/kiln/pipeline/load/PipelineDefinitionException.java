package com.kiln.pipeline.load;

/**
 * Pipeline spec that cannot be read or resolved: unreadable YAML, an entry without id, or a link whose
 * contract becomes invalid once overrides are merged in. Raised before any link executes.
 */
public class PipelineDefinitionException extends RuntimeException {

    private final String linkId;

    public PipelineDefinitionException(String message) {
        this(null, message, null);
    }

    public PipelineDefinitionException(String linkId, String message, Throwable cause) {
        super(message, cause);
        this.linkId = linkId;
    }

    /** Link whose resolution failed; null when the failure is not link-specific. */
    public String getLinkId() {
        return linkId;
    }
}

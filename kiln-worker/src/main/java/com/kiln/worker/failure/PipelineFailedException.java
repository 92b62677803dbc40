package com.kiln.worker.failure;

import com.kiln.worker.engine.ProjectContext;

/**
 * A pipeline run stopped at a failed link or failed the project-size preflight. For link failures this is raised
 * after the artifact index, pipeline copy and run summary have been persisted; the cause is the
 * {@link LinkFailureException} (or the unexpected exception) that stopped the run.
 */
public class PipelineFailedException extends RuntimeException {

    private final String linkId;
    private final transient ProjectContext context;

    public PipelineFailedException(String linkId, String error, ProjectContext context, Throwable cause) {
        super("Pipeline failed at link " + linkId + ": " + error, cause);
        this.linkId = linkId;
        this.context = context;
    }

    public String getLinkId() {
        return linkId;
    }

    /** Run state at the point of failure. */
    public ProjectContext getContext() {
        return context;
    }

    /** Failure kind of the cause, or {@link FailureKind#RUNTIME_ERROR} when the cause is not a link failure. */
    public FailureKind getKind() {
        return getCause() instanceof LinkFailureException
                ? ((LinkFailureException) getCause()).getKind() : FailureKind.RUNTIME_ERROR;
    }
}

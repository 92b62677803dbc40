package com.kiln.worker.failure;

/**
 * Another process holds the project lock. Raised immediately; the orchestrator does not wait or queue.
 */
public class ProjectBusyException extends RuntimeException {

    private final String projectId;

    public ProjectBusyException(String projectId) {
        super("Project " + projectId + " is currently locked by another process (BUSY)");
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}

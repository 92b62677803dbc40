package com.kiln.worker.retention;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What a pruning pass kept, deleted (or would delete, in dry run) and failed to delete for one project. */
public final class PruningReport {

    private final String projectId;
    private final List<Map<String, Object>> preserved = new ArrayList<>();
    private final List<Map<String, Object>> deleted = new ArrayList<>();
    private final List<Map<String, Object>> errors = new ArrayList<>();
    private long spaceFreedBytes;

    public PruningReport(String projectId) {
        this.projectId = projectId;
    }

    void addPreserved(String artifactId, String reason, String path) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("artifact_id", artifactId);
        m.put("reason", reason);
        m.put("path", path);
        preserved.add(m);
    }

    void addDeleted(String artifactId, String reason, String path, long sizeBytes) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("artifact_id", artifactId);
        m.put("reason", reason);
        m.put("path", path);
        m.put("size_bytes", sizeBytes);
        deleted.add(m);
        spaceFreedBytes += sizeBytes;
    }

    void addError(String artifactId, String error, String path) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("artifact_id", artifactId);
        m.put("error", error);
        m.put("path", path);
        errors.add(m);
    }

    public String getProjectId() {
        return projectId;
    }

    public List<Map<String, Object>> getPreserved() {
        return Collections.unmodifiableList(preserved);
    }

    public List<Map<String, Object>> getDeleted() {
        return Collections.unmodifiableList(deleted);
    }

    public List<Map<String, Object>> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long getSpaceFreedBytes() {
        return spaceFreedBytes;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("project_id", projectId);
        m.put("timestamp", LocalDateTime.now().toString());
        m.put("preserved_count", preserved.size());
        m.put("deleted_count", deleted.size());
        m.put("error_count", errors.size());
        m.put("space_freed_bytes", spaceFreedBytes);
        m.put("space_freed_mb", Math.round(spaceFreedBytes / (1024.0 * 1024.0) * 100.0) / 100.0);
        m.put("preserved", getPreserved());
        m.put("deleted", getDeleted());
        m.put("errors", getErrors());
        return m;
    }
}

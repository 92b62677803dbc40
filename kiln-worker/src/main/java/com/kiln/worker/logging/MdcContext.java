package com.kiln.worker.logging;

import org.slf4j.MDC;

/**
 * Kiln MDC keys for structured logging; printed by the logback pattern.
 */
public final class MdcContext {

    public static final String PROJECT_ID = "projectId";
    public static final String PIPELINE_ID = "pipelineId";
    public static final String RUN_ID = "runId";
    public static final String LINK_ID = "linkId";

    private MdcContext() {}

    public static void setRun(String projectId, String pipelineId, String runId) {
        MDC.put(PROJECT_ID, projectId);
        MDC.put(PIPELINE_ID, pipelineId);
        MDC.put(RUN_ID, runId);
    }

    public static void setLink(String linkId) {
        MDC.put(LINK_ID, linkId);
    }

    public static void clearLink() {
        MDC.remove(LINK_ID);
    }

    public static void clear() {
        MDC.remove(PROJECT_ID);
        MDC.remove(PIPELINE_ID);
        MDC.remove(RUN_ID);
        MDC.remove(LINK_ID);
    }
}

package com.kiln.plugin;

import java.util.Map;

/**
 * Work performed by one link. Implementations write outputs through {@link LinkContext#getSandbox()} and
 * publish every declared artifact there.
 * <p>
 * <b>Threading:</b> the orchestrator invokes {@link #run} on a dedicated thread and interrupts it when the
 * link's wall-time budget expires. Long-running implementations should check
 * {@link Thread#isInterrupted()} and return promptly; work that ignores the interrupt may keep running after
 * the link has been recorded as timed out.
 */
@FunctionalInterface
public interface LinkPlugin {

    /**
     * @param context run identity, artifact lookup, and the link's sandbox; never null
     * @param config  merged link configuration (unmodifiable); never null
     * @return result; null counts as {@link LinkResult.Status#SUCCEEDED}
     * @throws Exception on failure; recorded as the link's failure
     */
    LinkResult run(LinkContext context, Map<String, Object> config) throws Exception;
}

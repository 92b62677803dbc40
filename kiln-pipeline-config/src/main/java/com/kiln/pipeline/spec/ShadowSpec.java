package com.kiln.pipeline.spec;

/**
 * Shadow candidate attached to a pipeline entry: {@code shadow: <link id>} or
 * {@code shadow: {link: <link id>, parity_window: 5}}.
 */
public final class ShadowSpec {

    private final String linkId;
    private final Integer parityWindow;

    public ShadowSpec(String linkId, Integer parityWindow) {
        this.linkId = linkId;
        this.parityWindow = parityWindow;
    }

    public String getLinkId() {
        return linkId;
    }

    /** Consecutive parity hits required before promotion readiness; null for the process default. */
    public Integer getParityWindow() {
        return parityWindow;
    }

    @Override
    public String toString() {
        return "ShadowSpec{" + linkId + (parityWindow != null ? ", window=" + parityWindow : "") + "}";
    }
}

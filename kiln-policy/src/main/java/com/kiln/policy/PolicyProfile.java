package com.kiln.policy;

import java.util.List;
import java.util.Map;

/**
 * Named bundle of isolation settings from the {@code profiles} section of the runtime policy.
 * {@code allowSrcWrites} is a ceiling: source writes also need the link id in
 * {@code security.allow_src_writes}.
 */
public final class PolicyProfile {

    private static final double DEFAULT_TIMEOUT_MULTIPLIER = 1.0;

    private final String name;
    private final boolean allowSrcWrites;
    private final boolean artifactOnlyOutputs;
    private final double timeoutMultiplier;
    private final List<String> allowedSubprocessCommands;

    PolicyProfile(String name, boolean allowSrcWrites, boolean artifactOnlyOutputs,
                  double timeoutMultiplier, List<String> allowedSubprocessCommands) {
        this.name = name;
        this.allowSrcWrites = allowSrcWrites;
        this.artifactOnlyOutputs = artifactOnlyOutputs;
        this.timeoutMultiplier = timeoutMultiplier;
        this.allowedSubprocessCommands = allowedSubprocessCommands != null ? List.copyOf(allowedSubprocessCommands) : null;
    }

    static PolicyProfile fromMap(String name, Map<String, Object> raw) {
        return new PolicyProfile(
                name,
                PolicyValues.asBoolean(raw.get("allow_src_writes"), true),
                PolicyValues.asBoolean(raw.get("artifact_only_outputs"), false),
                PolicyValues.asDouble(raw.get("timeout_multiplier"), DEFAULT_TIMEOUT_MULTIPLIER),
                raw.containsKey("allowed_subprocess_commands")
                        ? PolicyValues.asStringList(raw.get("allowed_subprocess_commands"))
                        : null);
    }

    public String getName() {
        return name;
    }

    public boolean isAllowSrcWrites() {
        return allowSrcWrites;
    }

    public boolean isArtifactOnlyOutputs() {
        return artifactOnlyOutputs;
    }

    public double getTimeoutMultiplier() {
        return timeoutMultiplier;
    }

    /** Profile-level subprocess allowlist, or null when the profile defers to {@code security}. */
    public List<String> getAllowedSubprocessCommands() {
        return allowedSubprocessCommands;
    }
}

package com.kiln.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable runtime policy: budgets, security allowlists, profiles, retry and retention rules.
 * Produced by {@link PolicyLoader} and passed explicitly to whatever enforces it.
 * <p>
 * The {@link #getDigest() digest} is the SHA-256 of the canonical (sorted-key, compact) JSON form of the
 * document, so two documents that differ only in key order share a digest. It is stamped on every ledger
 * event so an audit can prove which policy governed a run.
 */
public final class RuntimePolicy {

    private static final long DEFAULT_MAX_WALL_TIME_SEC = 60L;

    private final Map<String, Object> document;
    private final String digest;
    private final Map<String, PolicyProfile> profiles;
    private final RetryRules retry;
    private final RetentionRules retention;

    RuntimePolicy(Map<String, Object> document, String digest) {
        this.document = document;
        this.digest = digest;
        Map<String, PolicyProfile> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : PolicyValues.asMap(document.get("profiles")).entrySet()) {
            parsed.put(e.getKey(), PolicyProfile.fromMap(e.getKey(), PolicyValues.asMap(e.getValue())));
        }
        this.profiles = Collections.unmodifiableMap(parsed);
        this.retry = RetryRules.fromMap(PolicyValues.asMap(document.get("retry")));
        this.retention = RetentionRules.fromMap(PolicyValues.asMap(document.get("retention")));
    }

    public String getVersion() {
        Object v = document.get("version");
        return v != null ? String.valueOf(v) : "unknown";
    }

    public String getDigest() {
        return digest;
    }

    public String getDefaultProfile() {
        return String.valueOf(document.get("default_profile"));
    }

    public Map<String, PolicyProfile> getProfiles() {
        return profiles;
    }

    /**
     * Returns the named profile, or the default profile when {@code name} is null.
     *
     * @throws IllegalArgumentException if the name is not a declared profile
     */
    public PolicyProfile getProfile(String name) {
        String key = name != null ? name : getDefaultProfile();
        PolicyProfile profile = profiles.get(key);
        if (profile == null) {
            throw new IllegalArgumentException("Profile '" + key + "' not found in policy (declared: " + profiles.keySet() + ")");
        }
        return profile;
    }

    /** Raw budget value, e.g. {@code getBudget("per_link", "max_output_bytes")}; null when absent. */
    public Long getBudget(String scope, String key) {
        Map<String, Object> budgets = PolicyValues.asMap(document.get("budgets"));
        return PolicyValues.asLong(PolicyValues.asMap(budgets.get(scope)).get(key));
    }

    public Long getMaxWallTimeSec() {
        return getBudget("per_link", "max_wall_time_sec");
    }

    public Long getMaxOutputBytes() {
        return getBudget("per_link", "max_output_bytes");
    }

    public Long getMaxProjectBytes() {
        return getBudget("per_project", "max_project_bytes");
    }

    /** {@code max_wall_time_sec} (default 60) scaled by the profile's {@code timeout_multiplier}, floored. */
    public int getEffectiveTimeout(String profileName) {
        Long base = getMaxWallTimeSec();
        long seconds = base != null && base > 0 ? base : DEFAULT_MAX_WALL_TIME_SEC;
        return (int) Math.floor(seconds * getProfile(profileName).getTimeoutMultiplier());
    }

    /**
     * True only when the profile permits source writes and the link is listed in
     * {@code security.allow_src_writes}. The profile is a ceiling; the list is the grant.
     */
    public boolean isSrcWriteAllowed(String linkId, String profileName) {
        if (!getProfile(profileName).isAllowSrcWrites()) {
            return false;
        }
        return getSecurityList("allow_src_writes").contains(linkId);
    }

    /** Profile-level allowlist when the profile declares one, otherwise {@code security.allowed_subprocess_commands}. */
    public List<String> getAllowedSubprocessCommands(String profileName) {
        List<String> fromProfile = getProfile(profileName).getAllowedSubprocessCommands();
        return fromProfile != null ? fromProfile : getSecurityList("allowed_subprocess_commands");
    }

    public List<String> getSecurityList(String key) {
        return PolicyValues.asStringList(PolicyValues.asMap(document.get("security")).get(key));
    }

    public RetryRules getRetry() {
        return retry;
    }

    public boolean isErrorRetryable(String errorType) {
        return retry.isErrorRetryable(errorType);
    }

    public RetentionRules getRetention() {
        return retention;
    }

    /** Unmodifiable view of the whole validated document. */
    public Map<String, Object> asMap() {
        return document;
    }

    /** Compact description for run summaries: version, digest, default profile, budgets, retry, retention. */
    public Map<String, Object> toSummary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", getVersion());
        out.put("digest", digest);
        out.put("default_profile", getDefaultProfile());
        out.put("budgets", PolicyValues.asMap(document.get("budgets")));
        out.put("retry", PolicyValues.asMap(document.get("retry")));
        out.put("retention", PolicyValues.asMap(document.get("retention")));
        return out;
    }
}

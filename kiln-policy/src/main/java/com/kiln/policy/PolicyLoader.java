package com.kiln.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Loads, validates and digests the versioned runtime policy (YAML).
 * <p>
 * <b>Validation</b> (fails with {@link PolicyValidationException}):
 * <ul>
 *   <li>file absent, empty, or not a YAML mapping</li>
 *   <li>missing top-level key: {@code version, budgets, security, profiles, default_profile}</li>
 *   <li>missing {@code budgets.per_link.{max_wall_time_sec,max_output_bytes}} or
 *       {@code budgets.per_project.max_project_bytes}</li>
 *   <li>{@code default_profile} not declared under {@code profiles}; a profile without
 *       {@code allow_src_writes} or {@code artifact_only_outputs}</li>
 *   <li>a {@code 1.x} version or a legacy {@code limits} block</li>
 * </ul>
 * A loader whose last {@link #load()} failed holds no policy.
 */
public final class PolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    /** Classpath resource holding the bundled policy. */
    public static final String DEFAULT_RESOURCE = "runtime_policy.yaml";

    static final List<String> REQUIRED_KEYS = List.of("version", "budgets", "security", "profiles", "default_profile");
    static final List<String> REQUIRED_BUDGET_SECTIONS = List.of("per_link", "per_project");
    static final List<String> REQUIRED_PER_LINK_KEYS = List.of("max_wall_time_sec", "max_output_bytes");
    static final List<String> REQUIRED_PER_PROJECT_KEYS = List.of("max_project_bytes");
    static final List<String> REQUIRED_PROFILE_KEYS = List.of("allow_src_writes", "artifact_only_outputs");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Path policyPath;
    private volatile RuntimePolicy policy;

    /**
     * @param policyPath policy file; null to read the bundled {@value #DEFAULT_RESOURCE} resource
     */
    public PolicyLoader(Path policyPath) {
        this.policyPath = policyPath;
    }

    public static PolicyLoader forDefaultPolicy() {
        return new PolicyLoader(null);
    }

    /**
     * Reads and validates the policy, replacing any previously loaded one. On failure the loader is left
     * empty and the exception propagates.
     */
    public RuntimePolicy load() {
        policy = null;
        String source = policyPath != null ? policyPath.toString() : "classpath:" + DEFAULT_RESOURCE;
        RuntimePolicy loaded = parse(readSource(source), source);
        policy = loaded;
        log.info("Loaded runtime policy | source={} | version={} | digest={}", source, loaded.getVersion(), loaded.getDigest());
        return loaded;
    }

    /** The last successfully loaded policy. */
    public RuntimePolicy getPolicy() {
        RuntimePolicy p = policy;
        if (p == null) {
            throw new IllegalStateException("Runtime policy not loaded");
        }
        return p;
    }

    public boolean isLoaded() {
        return policy != null;
    }

    /** Validates and digests a policy document already in memory. */
    public static RuntimePolicy parse(String yaml, String source) {
        if (yaml == null || yaml.isBlank()) {
            throw new PolicyValidationException(source, "Policy file is empty: " + source);
        }
        Map<String, Object> raw;
        try {
            raw = YAML_MAPPER.readValue(yaml, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new PolicyValidationException(source, "Invalid YAML in policy file " + source + ": " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new PolicyValidationException(source, "Policy file is empty: " + source);
        }
        validate(raw, source);
        @SuppressWarnings("unchecked")
        Map<String, Object> frozen = (Map<String, Object>) PolicyValues.freeze(raw);
        return new RuntimePolicy(frozen, digest(frozen));
    }

    /** SHA-256 of the canonical JSON form (sorted keys, no whitespace). */
    static String digest(Map<String, Object> document) {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(document);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Policy document is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void validate(Map<String, Object> raw, String source) {
        for (String key : REQUIRED_KEYS) {
            if (!raw.containsKey(key)) {
                throw new PolicyValidationException(source, "Missing required key: " + key);
            }
        }

        Map<String, Object> budgets = PolicyValues.asMap(raw.get("budgets"));
        for (String section : REQUIRED_BUDGET_SECTIONS) {
            if (!budgets.containsKey(section)) {
                throw new PolicyValidationException(source, "Missing required budget section: budgets." + section);
            }
        }
        Map<String, Object> perLink = PolicyValues.asMap(budgets.get("per_link"));
        for (String key : REQUIRED_PER_LINK_KEYS) {
            if (!perLink.containsKey(key)) {
                throw new PolicyValidationException(source, "Missing required budget key: budgets.per_link." + key);
            }
        }
        Map<String, Object> perProject = PolicyValues.asMap(budgets.get("per_project"));
        for (String key : REQUIRED_PER_PROJECT_KEYS) {
            if (!perProject.containsKey(key)) {
                throw new PolicyValidationException(source, "Missing required budget key: budgets.per_project." + key);
            }
        }

        Map<String, Object> profiles = PolicyValues.asMap(raw.get("profiles"));
        Object defaultProfile = raw.get("default_profile");
        if (defaultProfile == null || !profiles.containsKey(String.valueOf(defaultProfile))) {
            throw new PolicyValidationException(source, "default_profile '" + defaultProfile + "' not found in profiles");
        }
        for (Map.Entry<String, Object> e : profiles.entrySet()) {
            Map<String, Object> profile = PolicyValues.asMap(e.getValue());
            for (String key : REQUIRED_PROFILE_KEYS) {
                if (!profile.containsKey(key)) {
                    throw new PolicyValidationException(source, "Missing required key in profile '" + e.getKey() + "': " + key);
                }
            }
        }

        String version = String.valueOf(raw.get("version"));
        if (version.startsWith("1.")) {
            throw new PolicyValidationException(source, "Policy version " + version + " uses deprecated schema. "
                    + "Migrate to version 2.0.0 (remove 'limits' block, use 'budgets' instead).");
        }
        if (raw.containsKey("limits")) {
            throw new PolicyValidationException(source, "Deprecated 'limits' block found. "
                    + "Remove it and use 'budgets' block instead (v2.0.0 schema).");
        }
    }

    private String readSource(String source) {
        try {
            if (policyPath != null) {
                if (!Files.isRegularFile(policyPath)) {
                    throw new PolicyValidationException(source, "Policy file not found: " + source);
                }
                return Files.readString(policyPath, StandardCharsets.UTF_8);
            }
            try (InputStream in = PolicyLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new PolicyValidationException(source, "Policy file not found: " + source);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new PolicyValidationException(source, "Policy file could not be read: " + source, e);
        }
    }
}

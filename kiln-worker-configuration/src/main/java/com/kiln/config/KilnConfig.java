package com.kiln.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the kiln worker.
 * <p>
 * Layout: KILN_PROJECTS_DIR (one subdirectory per project), KILN_LINKS_DIR (one subdirectory per
 * installed link, each holding a {@code link.yaml}). Policy: KILN_POLICY_PATH; when unset the bundled
 * {@code runtime_policy.yaml} is used. KILN_PROFILE selects the security profile; when unset the
 * policy's {@code default_profile} applies.
 * <p>
 * Plugins: KILN_PLUGINS_DIR holds community plugin JARs; KILN_PLUGINS_REQUIRED=true makes a community
 * plugin load failure fatal instead of log-and-skip.
 */
public final class KilnConfig {

    private static final String ENV_PROJECTS_DIR = "KILN_PROJECTS_DIR";
    private static final String ENV_LINKS_DIR = "KILN_LINKS_DIR";
    private static final String ENV_POLICY_PATH = "KILN_POLICY_PATH";
    private static final String ENV_PROFILE = "KILN_PROFILE";
    private static final String ENV_STRICT_ARTIFACT_ID = "KILN_STRICT_ARTIFACT_ID";
    private static final String ENV_PLUGINS_DIR = "KILN_PLUGINS_DIR";
    private static final String ENV_PLUGINS_REQUIRED = "KILN_PLUGINS_REQUIRED";
    private static final String ENV_SHADOW_PARITY_WINDOW = "KILN_SHADOW_PARITY_WINDOW";

    private static final String DEFAULT_PROJECTS_DIR = "projects";
    private static final String DEFAULT_LINKS_DIR = "links";
    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    /** Consecutive parity hits a shadow link needs before it is flagged promotion-ready. */
    public static final int DEFAULT_SHADOW_PARITY_WINDOW = 3;

    private final Path projectsDir;
    private final Path linksDir;
    private final Path policyPath;
    private final String profile;
    private final boolean strictArtifactId;
    private final Path pluginsDir;
    private final boolean pluginsRequired;
    private final int shadowParityWindow;

    private KilnConfig(Builder b) {
        this.projectsDir = b.projectsDir;
        this.linksDir = b.linksDir;
        this.policyPath = b.policyPath;
        this.profile = b.profile;
        this.strictArtifactId = b.strictArtifactId;
        this.pluginsDir = b.pluginsDir;
        this.pluginsRequired = b.pluginsRequired;
        this.shadowParityWindow = b.shadowParityWindow;
    }

    /** Root directory holding one subdirectory per project. Default {@code projects}. */
    public Path getProjectsDir() {
        return projectsDir;
    }

    /** Directory scanned for installed links. Default {@code links}. */
    public Path getLinksDir() {
        return linksDir;
    }

    /** Policy file path, or null to use the bundled default policy. */
    public Path getPolicyPath() {
        return policyPath;
    }

    /** Profile override, or null to use the policy's default profile. */
    public String getProfile() {
        return profile;
    }

    /**
     * When true, contracts must name artifacts with {@code artifact}; the legacy {@code artifactId} key is
     * rejected at load time.
     */
    public boolean isStrictArtifactId() {
        return strictArtifactId;
    }

    public Path getPluginsDir() {
        return pluginsDir;
    }

    public boolean isPluginsRequired() {
        return pluginsRequired;
    }

    /** Default consecutive-parity window for shadow links that do not declare their own. Default 3. */
    public int getShadowParityWindow() {
        return shadowParityWindow;
    }

    public static KilnConfig fromEnvironment() {
        String policy = getEnv(ENV_POLICY_PATH, null);
        return builder()
                .projectsDir(Paths.get(getEnv(ENV_PROJECTS_DIR, DEFAULT_PROJECTS_DIR)))
                .linksDir(Paths.get(getEnv(ENV_LINKS_DIR, DEFAULT_LINKS_DIR)))
                .policyPath(policy != null ? Paths.get(policy) : null)
                .profile(getEnv(ENV_PROFILE, null))
                .strictArtifactId(parseBoolean(System.getenv(ENV_STRICT_ARTIFACT_ID), false))
                .pluginsDir(Paths.get(getEnv(ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR)))
                .pluginsRequired(parseBoolean(System.getenv(ENV_PLUGINS_REQUIRED), false))
                .shadowParityWindow(parseInt(System.getenv(ENV_SHADOW_PARITY_WINDOW), DEFAULT_SHADOW_PARITY_WINDOW))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path projectsDir = Paths.get(DEFAULT_PROJECTS_DIR);
        private Path linksDir = Paths.get(DEFAULT_LINKS_DIR);
        private Path policyPath;
        private String profile;
        private boolean strictArtifactId;
        private Path pluginsDir = Paths.get(DEFAULT_PLUGINS_DIR);
        private boolean pluginsRequired;
        private int shadowParityWindow = DEFAULT_SHADOW_PARITY_WINDOW;

        public Builder projectsDir(Path projectsDir) {
            this.projectsDir = Objects.requireNonNull(projectsDir, "projectsDir");
            return this;
        }

        public Builder linksDir(Path linksDir) {
            this.linksDir = Objects.requireNonNull(linksDir, "linksDir");
            return this;
        }

        public Builder policyPath(Path policyPath) {
            this.policyPath = policyPath;
            return this;
        }

        public Builder profile(String profile) {
            this.profile = profile != null && !profile.isBlank() ? profile.trim() : null;
            return this;
        }

        public Builder strictArtifactId(boolean strictArtifactId) {
            this.strictArtifactId = strictArtifactId;
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir != null ? pluginsDir : Paths.get(DEFAULT_PLUGINS_DIR);
            return this;
        }

        public Builder pluginsRequired(boolean pluginsRequired) {
            this.pluginsRequired = pluginsRequired;
            return this;
        }

        public Builder shadowParityWindow(int shadowParityWindow) {
            this.shadowParityWindow = shadowParityWindow > 0 ? shadowParityWindow : DEFAULT_SHADOW_PARITY_WINDOW;
            return this;
        }

        public KilnConfig build() {
            return new KilnConfig(this);
        }
    }
}

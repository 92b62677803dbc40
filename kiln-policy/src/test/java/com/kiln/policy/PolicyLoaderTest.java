package com.kiln.policy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyLoaderTest {

    static final String VALID_POLICY = """
            version: "2.0.0"
            budgets:
              per_link:
                max_wall_time_sec: 120
                max_output_bytes: 5000
              per_project:
                max_project_bytes: 100000
            security:
              allow_src_writes: [impl.apply_patchset]
              allowed_subprocess_commands: [python3, git]
            profiles:
              normal:
                allow_src_writes: true
                artifact_only_outputs: false
              isolation:
                allow_src_writes: false
                artifact_only_outputs: true
                timeout_multiplier: 0.5
                allowed_subprocess_commands: []
            default_profile: normal
            """;

    /** Same content as {@link #VALID_POLICY}, keys in a different order. */
    private static final String REORDERED_POLICY = """
            default_profile: normal
            profiles:
              isolation:
                timeout_multiplier: 0.5
                allowed_subprocess_commands: []
                artifact_only_outputs: true
                allow_src_writes: false
              normal:
                artifact_only_outputs: false
                allow_src_writes: true
            security:
              allowed_subprocess_commands: [python3, git]
              allow_src_writes: [impl.apply_patchset]
            budgets:
              per_project:
                max_project_bytes: 100000
              per_link:
                max_output_bytes: 5000
                max_wall_time_sec: 120
            version: "2.0.0"
            """;

    @TempDir
    Path tempDir;

    @Test
    void load_validPolicyExposesBudgetsAndDigest() throws Exception {
        PolicyLoader loader = new PolicyLoader(write("policy.yaml", VALID_POLICY));

        RuntimePolicy policy = loader.load();

        assertTrue(loader.isLoaded());
        assertEquals("2.0.0", policy.getVersion());
        assertEquals(64, policy.getDigest().length());
        assertEquals(5000L, policy.getMaxOutputBytes());
        assertEquals(100000L, policy.getMaxProjectBytes());
        assertEquals("normal", policy.getDefaultProfile());
    }

    @Test
    void digest_ignoresKeyOrder() throws Exception {
        RuntimePolicy a = new PolicyLoader(write("a.yaml", VALID_POLICY)).load();
        RuntimePolicy b = new PolicyLoader(write("b.yaml", REORDERED_POLICY)).load();

        assertEquals(a.getDigest(), b.getDigest());
    }

    @Test
    void digest_changesWithContent() throws Exception {
        RuntimePolicy a = new PolicyLoader(write("a.yaml", VALID_POLICY)).load();
        RuntimePolicy b = new PolicyLoader(write("b.yaml", VALID_POLICY.replace("5000", "5001"))).load();

        assertNotEquals(a.getDigest(), b.getDigest());
    }

    @Test
    void load_rejectsEveryMissingRequiredKey() throws Exception {
        for (String key : PolicyLoader.REQUIRED_KEYS) {
            String broken = removeTopLevelKey(VALID_POLICY, key);
            PolicyLoader loader = new PolicyLoader(write("missing-" + key + ".yaml", broken));

            PolicyValidationException e = assertThrows(PolicyValidationException.class, loader::load, key);

            assertFalse(loader.isLoaded(), key);
            assertThrows(IllegalStateException.class, loader::getPolicy);
            assertTrue(e.getMessage().contains(key) || key.equals("profiles"), e.getMessage());
        }
    }

    @Test
    void load_rejectsMissingBudgetKeys() throws Exception {
        PolicyLoader loader = new PolicyLoader(write("p.yaml", VALID_POLICY.replace("    max_output_bytes: 5000\n", "")));
        PolicyValidationException e = assertThrows(PolicyValidationException.class, loader::load);
        assertEquals("Missing required budget key: budgets.per_link.max_output_bytes", e.getMessage());

        PolicyLoader noProjectBudget = new PolicyLoader(write("q.yaml",
                VALID_POLICY.replace("  per_project:\n    max_project_bytes: 100000\n", "")));
        e = assertThrows(PolicyValidationException.class, noProjectBudget::load);
        assertEquals("Missing required budget section: budgets.per_project", e.getMessage());
    }

    @Test
    void load_rejectsProfileWithoutRequiredKeys() throws Exception {
        String broken = VALID_POLICY.replace("    artifact_only_outputs: true\n", "");
        PolicyValidationException e = assertThrows(PolicyValidationException.class,
                () -> new PolicyLoader(write("p.yaml", broken)).load());
        assertEquals("Missing required key in profile 'isolation': artifact_only_outputs", e.getMessage());
    }

    @Test
    void load_rejectsUndeclaredDefaultProfile() throws Exception {
        String broken = VALID_POLICY.replace("default_profile: normal", "default_profile: turbo");
        PolicyValidationException e = assertThrows(PolicyValidationException.class,
                () -> new PolicyLoader(write("p.yaml", broken)).load());
        assertTrue(e.getMessage().contains("turbo"));
    }

    @Test
    void load_rejectsDeprecatedVersionAndLimitsBlock() throws Exception {
        PolicyLoader oldVersion = new PolicyLoader(write("v1.yaml", VALID_POLICY.replace("\"2.0.0\"", "\"1.4.0\"")));
        assertTrue(assertThrows(PolicyValidationException.class, oldVersion::load).getMessage().contains("deprecated"));

        PolicyLoader limits = new PolicyLoader(write("limits.yaml", VALID_POLICY + "limits:\n  cpu: 2\n"));
        assertTrue(assertThrows(PolicyValidationException.class, limits::load).getMessage().contains("limits"));
    }

    @Test
    void load_rejectsAbsentEmptyAndMalformedFiles() throws Exception {
        assertThrows(PolicyValidationException.class, () -> new PolicyLoader(tempDir.resolve("nope.yaml")).load());
        assertThrows(PolicyValidationException.class, () -> new PolicyLoader(write("empty.yaml", "  \n")).load());
        assertThrows(PolicyValidationException.class, () -> new PolicyLoader(write("bad.yaml", "version: [unclosed\n")).load());
    }

    @Test
    void load_failureClearsPreviouslyLoadedPolicy() throws Exception {
        Path path = write("p.yaml", VALID_POLICY);
        PolicyLoader loader = new PolicyLoader(path);
        loader.load();
        Files.writeString(path, "");

        assertThrows(PolicyValidationException.class, loader::load);
        assertFalse(loader.isLoaded());
    }

    @Test
    void effectiveTimeout_appliesProfileMultiplierAndFloors() throws Exception {
        RuntimePolicy policy = new PolicyLoader(write("p.yaml", VALID_POLICY.replace("120", "121"))).load();

        assertEquals(121, policy.getEffectiveTimeout("normal"));
        assertEquals(60, policy.getEffectiveTimeout("isolation"));
        assertEquals(121, policy.getEffectiveTimeout(null));
    }

    @Test
    void getProfile_unknownNameFails() throws Exception {
        RuntimePolicy policy = new PolicyLoader(write("p.yaml", VALID_POLICY)).load();
        assertThrows(IllegalArgumentException.class, () -> policy.getProfile("turbo"));
        assertEquals("normal", policy.getProfile(null).getName());
    }

    @Test
    void srcWrites_needProfileCeilingAndWhitelistGrant() throws Exception {
        RuntimePolicy policy = new PolicyLoader(write("p.yaml", VALID_POLICY)).load();

        assertTrue(policy.isSrcWriteAllowed("impl.apply_patchset", "normal"));
        assertFalse(policy.isSrcWriteAllowed("impl.apply_patchset", "isolation"));
        assertFalse(policy.isSrcWriteAllowed("test.unauthorized_src_write", "normal"));
    }

    @Test
    void subprocessCommands_profileListOverridesSecurityList() throws Exception {
        RuntimePolicy policy = new PolicyLoader(write("p.yaml", VALID_POLICY)).load();

        assertEquals(List.of("python3", "git"), policy.getAllowedSubprocessCommands("normal"));
        assertEquals(List.of(), policy.getAllowedSubprocessCommands("isolation"));
    }

    @Test
    void asMap_isImmutable() throws Exception {
        RuntimePolicy policy = new PolicyLoader(write("p.yaml", VALID_POLICY)).load();
        assertThrows(UnsupportedOperationException.class, () -> policy.asMap().put("limits", 1));
    }

    @Test
    void defaultPolicy_loadsFromClasspath() {
        RuntimePolicy policy = PolicyLoader.forDefaultPolicy().load();

        assertEquals("2.0.0", policy.getVersion());
        assertEquals(300, policy.getEffectiveTimeout("normal"));
        assertEquals(150, policy.getEffectiveTimeout("isolation"));
        assertEquals(List.of("kiln.evidence.pack", "kiln.release.bundle", "kiln.metrics.run_summary"),
                policy.getRetention().getProtectedArtifacts());
    }

    private Path write(String name, String content) throws Exception {
        Path p = tempDir.resolve(name);
        Files.writeString(p, content);
        return p;
    }

    /** Drops a top-level key together with its indented block. */
    private static String removeTopLevelKey(String yaml, String key) {
        StringBuilder out = new StringBuilder();
        boolean skipping = false;
        for (String line : yaml.split("\n", -1)) {
            if (line.startsWith(key + ":")) {
                skipping = true;
                continue;
            }
            if (skipping && (line.startsWith(" ") || line.isEmpty())) {
                continue;
            }
            skipping = false;
            out.append(line).append('\n');
        }
        return out.toString();
    }
}

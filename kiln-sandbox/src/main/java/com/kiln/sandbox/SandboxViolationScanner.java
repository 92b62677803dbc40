package com.kiln.sandbox;

import com.kiln.artifact.ArtifactStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds files a link created or modified outside the paths it may write.
 * <p>
 * Allowed: the link's own output prefix, the shared roots {@code ledger}, {@code runs}, {@code healing},
 * {@code inputs}, and {@code src} when source writes are granted. Artifact manifests are written by the
 * orchestrator only after the scan, so a manifest created or changed while the link ran is always a leak,
 * including the one in the link's own output directory. Nothing else is exempt: the project index, pipeline
 * copy, run summary and shadow maturity state are all written outside link execution.
 */
public final class SandboxViolationScanner {

    static final List<String> SHARED_ROOTS = List.of("ledger", "runs", "healing", "inputs");
    public static final String SRC_ROOT = "src";

    private final AllowedPrefixTrie allowed;

    private SandboxViolationScanner(AllowedPrefixTrie allowed) {
        this.allowed = allowed;
    }

    /**
     * @param linkOutputPrefix project-relative output directory of the link, e.g. {@code artifacts/gen}
     * @param srcWritesAllowed whether the profile and the security whitelist both grant {@code src/} writes
     */
    public static SandboxViolationScanner forLink(String linkOutputPrefix, boolean srcWritesAllowed) {
        AllowedPrefixTrie trie = new AllowedPrefixTrie().add(linkOutputPrefix);
        for (String root : SHARED_ROOTS) {
            trie.add(root);
        }
        if (srcWritesAllowed) {
            trie.add(SRC_ROOT);
        }
        return new SandboxViolationScanner(trie);
    }

    /** Sorted project-relative paths created or changed between the snapshots and not allowed. */
    public List<String> findLeaks(FilesystemSnapshot before, FilesystemSnapshot after) {
        List<String> leaks = new ArrayList<>();
        for (String path : before.changedIn(after)) {
            if (isManifest(path) || !allowed.matches(path)) {
                leaks.add(path);
            }
        }
        return leaks;
    }

    static boolean isManifest(String path) {
        int slash = path.lastIndexOf('/');
        return ArtifactStore.MANIFEST_FILE.equals(slash < 0 ? path : path.substring(slash + 1));
    }
}

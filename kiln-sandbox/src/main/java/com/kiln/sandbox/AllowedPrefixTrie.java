package com.kiln.sandbox;

import java.util.HashMap;
import java.util.Map;

/**
 * Set of allowed relative path prefixes, matched segment by segment. {@code artifacts/gen} admits
 * {@code artifacts/gen/out.json} but not {@code artifacts/generator/out.json}.
 */
public final class AllowedPrefixTrie {

    private final Node root = new Node();

    public AllowedPrefixTrie add(String prefix) {
        Node node = root;
        for (String segment : segments(prefix)) {
            node = node.children.computeIfAbsent(segment, s -> new Node());
        }
        node.terminal = true;
        return this;
    }

    /** True when some leading run of the path's segments is a registered prefix. */
    public boolean matches(String path) {
        Node node = root;
        for (String segment : segments(path)) {
            node = node.children.get(segment);
            if (node == null) {
                return false;
            }
            if (node.terminal) {
                return true;
            }
        }
        return false;
    }

    private static String[] segments(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("/")) normalized = normalized.substring(1);
        while (normalized.endsWith("/")) normalized = normalized.substring(0, normalized.length() - 1);
        return normalized.isEmpty() ? new String[0] : normalized.split("/+");
    }

    private static final class Node {
        private final Map<String, Node> children = new HashMap<>();
        private boolean terminal;
    }
}

package com.kiln.pipeline.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Operations on the untyped map/list trees read from YAML manifests and pipeline specs. */
public final class ConfigTrees {

    private ConfigTrees() {
    }

    /**
     * Returns a new tree: {@code base} with {@code override} merged in. Nested maps merge recursively; any other
     * collision (scalar, list, or type mismatch) takes the override's value. Neither argument is modified.
     */
    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = mutableCopy(base);
        if (override == null) {
            return merged;
        }
        for (Map.Entry<String, Object> e : override.entrySet()) {
            Object existing = merged.get(e.getKey());
            Object incoming = e.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                merged.put(e.getKey(), deepMerge(asMap(existing), asMap(incoming)));
            } else {
                merged.put(e.getKey(), copyValue(incoming));
            }
        }
        return merged;
    }

    /** Deep, mutable copy preserving key order. */
    public static Map<String, Object> mutableCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, Object> e : source.entrySet()) {
                copy.put(e.getKey(), copyValue(e.getValue()));
            }
        }
        return copy;
    }

    /** Deep, unmodifiable copy preserving key order. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> freeze(Map<String, Object> source) {
        return (Map<String, Object>) freezeValue(source != null ? source : Map.of());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    public static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : List.of();
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return mutableCopy(asMap(value));
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object o : (List<?>) value) copy.add(copyValue(o));
            return copy;
        }
        return value;
    }

    private static Object freezeValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : asMap(value).entrySet()) {
                copy.put(e.getKey(), freezeValue(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object o : (List<?>) value) copy.add(freezeValue(o));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}

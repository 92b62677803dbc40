package com.kiln.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Coercions for values read out of the untyped policy tree. */
final class PolicyValues {

    private PolicyValues() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    static List<String> asStringList(Object value) {
        if (!(value instanceof List)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) value) {
            if (o != null) out.add(String.valueOf(o));
        }
        return List.copyOf(out);
    }

    static boolean asBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof String) return Boolean.parseBoolean((String) value);
        return defaultValue;
    }

    static double asDouble(Object value, double defaultValue) {
        return value instanceof Number ? ((Number) value).doubleValue() : defaultValue;
    }

    static int asInt(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    static Long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    /** Recursively copies maps and lists into unmodifiable collections, preserving key order. */
    @SuppressWarnings("unchecked")
    static Object freeze(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : ((Map<String, Object>) value).entrySet()) {
                copy.put(e.getKey(), freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object o : (List<Object>) value) {
                copy.add(freeze(o));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}

package com.kiln.pipeline.contract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigTreesTest {

    @Test
    void deepMerge_mergesNestedMapsAndOverrideWinsOnScalars() {
        Map<String, Object> base = Map.of("config", Map.of("depth", 1, "mode", "fast"), "tags", List.of("a"));
        Map<String, Object> override = Map.of("config", Map.of("depth", 3), "tags", List.of("b"));

        Map<String, Object> merged = ConfigTrees.deepMerge(base, override);

        assertEquals(Map.of("depth", 3, "mode", "fast"), merged.get("config"));
        assertEquals(List.of("b"), merged.get("tags"));
        assertEquals(1, ConfigTrees.asMap(base.get("config")).get("depth"));
    }

    @Test
    void deepMerge_replacesWhenTypesDiffer() {
        Map<String, Object> merged = ConfigTrees.deepMerge(Map.of("x", Map.of("a", 1)), Map.of("x", "flat"));

        assertEquals("flat", merged.get("x"));
    }

    @Test
    void freeze_isDeeplyUnmodifiable() {
        Map<String, Object> frozen = ConfigTrees.freeze(ConfigTrees.deepMerge(Map.of("x", Map.of("a", 1)), null));

        assertThrows(UnsupportedOperationException.class, () -> frozen.put("y", 2));
        assertThrows(UnsupportedOperationException.class, () -> ConfigTrees.asMap(frozen.get("x")).put("b", 2));
    }
}

package com.kiln.pipeline.load;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kiln.pipeline.contract.ConfigTrees;
import com.kiln.pipeline.spec.PipelineEntry;
import com.kiln.pipeline.spec.PipelineSpec;
import com.kiln.pipeline.spec.ShadowSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads pipeline YAML:
 * <pre>
 * pipelineId: build
 * links:
 *   - ingest
 *   - id: plan
 *     config: { depth: 2 }
 *     overrides: { max_wall_time_sec: 30 }
 *     shadow: { link: plan_v2, parity_window: 5 }
 * overrides:
 *   ingest: { config: { source: fixtures } }
 * </pre>
 */
public final class PipelineSpecLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private PipelineSpecLoader() {
    }

    public static PipelineSpec load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PipelineDefinitionException("Pipeline spec not found: " + path);
        }
        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (IOException e) {
            throw new PipelineDefinitionException(null, "Cannot read pipeline spec " + path + ": " + e.getMessage(), e);
        }
        return parse(yaml, path);
    }

    /**
     * @param source file the text came from, or null
     */
    public static PipelineSpec parse(String yaml, Path source) {
        Object parsed;
        try {
            parsed = yaml == null || yaml.isBlank() ? null : YAML_MAPPER.readValue(yaml, new TypeReference<Object>() { });
        } catch (IOException e) {
            throw new PipelineDefinitionException(null, "Malformed pipeline spec " + source + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new PipelineDefinitionException("Pipeline spec " + source + " must be a mapping");
        }
        Map<String, Object> doc = ConfigTrees.asMap(parsed);

        List<PipelineEntry> entries = new ArrayList<>();
        int i = 0;
        for (Object raw : ConfigTrees.asList(doc.get("links"))) {
            entries.add(parseEntry(raw, i++));
        }

        Map<String, Map<String, Object>> overrides = new LinkedHashMap<>();
        Object rawOverrides = doc.get("overrides");
        if (rawOverrides != null && !(rawOverrides instanceof Map)) {
            throw new PipelineDefinitionException("Pipeline 'overrides' must be a mapping keyed by link id");
        }
        for (Map.Entry<String, Object> e : ConfigTrees.asMap(rawOverrides).entrySet()) {
            overrides.put(e.getKey(), ConfigTrees.freeze(ConfigTrees.asMap(e.getValue())));
        }

        Object pipelineId = doc.get("pipelineId");
        return PipelineSpec.builder()
                .pipelineId(pipelineId != null ? String.valueOf(pipelineId) : null)
                .entries(entries)
                .overrides(overrides)
                .document(ConfigTrees.freeze(doc))
                .sourcePath(source)
                .build();
    }

    private static PipelineEntry parseEntry(Object raw, int index) {
        if (raw instanceof String) {
            return PipelineEntry.of((String) raw);
        }
        if (!(raw instanceof Map)) {
            throw new PipelineDefinitionException("links[" + index + "] must be a link id or mapping, got: " + raw);
        }
        Map<String, Object> m = ConfigTrees.asMap(raw);
        Object id = m.get("id");
        if (id == null || String.valueOf(id).isBlank()) {
            throw new PipelineDefinitionException("links[" + index + "] has no id");
        }
        return new PipelineEntry(
                String.valueOf(id),
                ConfigTrees.freeze(ConfigTrees.asMap(m.get("config"))),
                ConfigTrees.freeze(ConfigTrees.asMap(m.get("overrides"))),
                parseShadow(m.get("shadow"), String.valueOf(id)));
    }

    private static ShadowSpec parseShadow(Object raw, String stableId) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String) {
            return new ShadowSpec((String) raw, null);
        }
        Map<String, Object> m = ConfigTrees.asMap(raw);
        Object link = m.get("link");
        if (link == null) {
            throw new PipelineDefinitionException(stableId, "Shadow of " + stableId + " has no link id", null);
        }
        Object window = m.get("parity_window");
        if (window != null && (!(window instanceof Number) || ((Number) window).intValue() <= 0)) {
            throw new PipelineDefinitionException(stableId, "Shadow parity_window must be a positive integer, got: " + window, null);
        }
        return new ShadowSpec(String.valueOf(link), window != null ? ((Number) window).intValue() : null);
    }
}

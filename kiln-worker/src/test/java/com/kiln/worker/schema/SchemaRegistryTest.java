package com.kiln.worker.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.networknt.schema.JsonSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void get_loadsBundledSchemasOnceAndCachesThem() {
        SchemaRegistry registry = new SchemaRegistry();

        assertTrue(registry.get("project.ir").isPresent());
        assertSame(registry.get("project.ir").orElseThrow(), registry.get("project.ir").orElseThrow());
        assertEquals("object", registry.get("project.ir").orElseThrow().path("type").asText());
        assertSame(registry.find("project.ir").orElseThrow(), registry.find("project.ir").orElseThrow());
    }

    @Test
    void get_unknownOrBlankRefIsEmpty() {
        SchemaRegistry registry = new SchemaRegistry();

        assertTrue(registry.get("no.such.schema").isEmpty());
        assertTrue(registry.get(" ").isEmpty());
        assertTrue(registry.get(null).isEmpty());
        assertTrue(registry.find("no.such.schema").isEmpty());
    }

    @Test
    void register_overridesBundledSchemasAndRecompiles() throws Exception {
        SchemaRegistry registry = new SchemaRegistry();
        registry.find("project.ir").orElseThrow();
        registry.register("project.ir", JsonNodeFactory.instance.objectNode().put("type", "array"));

        assertEquals("array", registry.get("project.ir").orElseThrow().path("type").asText());
        assertTrue(SchemaRegistry.violations(registry.find("project.ir").orElseThrow(), json("[]")).isEmpty());
    }

    @Test
    void violations_acceptAConformingProjectIr() throws Exception {
        JsonSchema schema = new SchemaRegistry().find("project.ir").orElseThrow();
        JsonNode ir = json("""
                {"name": "demo",
                 "nodes": [{"name": "web", "role": "frontend", "node_type": "service", "parent_group": null}],
                 "connections": [{"source_node": "web", "target_node": "db", "confidence": 1}],
                 "groups": [{"name": "edge", "member_nodes": ["web"]}]}
                """);

        assertTrue(SchemaRegistry.violations(schema, ir).isEmpty());
    }

    @Test
    void violations_nameEachMissingPropertyAtItsLocation() throws Exception {
        JsonSchema schema = new SchemaRegistry().find("project.ir").orElseThrow();
        JsonNode ir = json("""
                {"name": "demo", "nodes": [{"name": "web"}], "connections": [], "groups": []}
                """);

        List<String> errors = SchemaRegistry.violations(schema, ir);

        assertEquals(2, errors.size(), errors.toString());
        assertTrue(errors.stream().allMatch(e -> e.startsWith("$.nodes[0]")), errors.toString());
        assertTrue(errors.stream().anyMatch(e -> e.contains("role")), errors.toString());
        assertTrue(errors.stream().anyMatch(e -> e.contains("node_type")), errors.toString());
    }

    @Test
    void violations_reportTypeMismatchesInsideArrays() throws Exception {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register("counted", json("""
                {"type": "object", "properties": {"count": {"type": "integer"}, "tags": {"type": "array", "items": {"type": "string"}}}}
                """));
        JsonSchema schema = registry.find("counted").orElseThrow();

        List<String> errors = SchemaRegistry.violations(schema, json("{\"count\": 1.5, \"tags\": [\"a\", 2]}"));

        assertEquals(2, errors.size(), errors.toString());
        assertTrue(errors.get(0).startsWith("$.count"), errors.get(0));
        assertTrue(errors.get(1).startsWith("$.tags[1]"), errors.get(1));
    }
}

package com.kiln.worker.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Named JSON Schemas referenced by {@code produces[].schema.ref}. Schemas are read lazily from the class path at
 * {@code schemas/<ref>.json}, compiled once as draft 2020-12 unless they declare {@code $schema}, and cached;
 * schemas may also be registered in code.
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    static final String RESOURCE_DIR = "schemas/";

    private final ClassLoader classLoader;
    private final Map<String, Optional<JsonNode>> sources = new ConcurrentHashMap<>();
    private final Map<String, Optional<JsonSchema>> compiled = new ConcurrentHashMap<>();

    public SchemaRegistry() {
        this(SchemaRegistry.class.getClassLoader());
    }

    public SchemaRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public void register(String ref, JsonNode schema) {
        sources.put(ref, Optional.of(schema));
        compiled.remove(ref);
    }

    /** Schema document for the ref; empty when neither registered nor bundled. */
    public Optional<JsonNode> get(String ref) {
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        return sources.computeIfAbsent(ref, this::loadResource);
    }

    /** Compiled schema for the ref; empty when neither registered nor bundled. */
    public Optional<JsonSchema> find(String ref) {
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        return compiled.computeIfAbsent(ref, r -> get(r).map(FACTORY::getSchema));
    }

    /**
     * @return sorted violation messages, each prefixed with the instance location; empty when the document conforms
     */
    public static List<String> violations(JsonSchema schema, JsonNode document) {
        Set<ValidationMessage> messages = schema.validate(document);
        return messages.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
    }

    private Optional<JsonNode> loadResource(String ref) {
        String resource = RESOURCE_DIR + ref + ".json";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No bundled schema | ref={}", ref);
                return Optional.empty();
            }
            return Optional.of(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema resource " + resource, e);
        }
    }
}

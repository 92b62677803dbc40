package com.kiln.pipeline.load;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kiln.pipeline.contract.ConfigTrees;
import com.kiln.pipeline.contract.InvalidContractException;
import com.kiln.pipeline.contract.LinkContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Installed links, discovered once from a links directory. Each immediate subdirectory holding a
 * {@value #MANIFEST_FILE} is one link, keyed by its {@code metadata.name}. Subdirectories without a manifest are
 * ignored; a manifest that is present but unreadable or invalid fails discovery.
 */
public final class LinkRegistry {

    private static final Logger log = LoggerFactory.getLogger(LinkRegistry.class);

    public static final String MANIFEST_FILE = "link.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, LinkDefinition> links;

    private LinkRegistry(Map<String, LinkDefinition> links) {
        this.links = Collections.unmodifiableMap(links);
    }

    public static LinkRegistry empty() {
        return new LinkRegistry(new LinkedHashMap<>());
    }

    /** Registry over the given definitions, in order. Duplicate ids are rejected. */
    public static LinkRegistry of(List<LinkDefinition> definitions) {
        Map<String, LinkDefinition> map = new LinkedHashMap<>();
        for (LinkDefinition d : definitions) {
            if (map.putIfAbsent(d.getId(), d) != null) {
                throw new IllegalArgumentException("Duplicate link id: " + d.getId());
            }
        }
        return new LinkRegistry(map);
    }

    /**
     * Scans {@code linksDir} (non-recursively, in name order).
     *
     * @param strictIds reject the legacy {@code artifactId} key in contracts
     * @throws LinkManifestException when a manifest cannot be parsed or declares an invalid contract
     */
    public static LinkRegistry discover(Path linksDir, boolean strictIds) {
        Map<String, LinkDefinition> map = new LinkedHashMap<>();
        if (!Files.isDirectory(linksDir)) {
            log.warn("Links directory not found | path={}", linksDir);
            return new LinkRegistry(map);
        }
        List<Path> dirs;
        try (Stream<Path> s = Files.list(linksDir)) {
            dirs = s.filter(Files::isDirectory).sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list links directory " + linksDir, e);
        }
        for (Path dir : dirs) {
            Path manifestPath = dir.resolve(MANIFEST_FILE);
            if (!Files.isRegularFile(manifestPath)) {
                log.debug("Skipping directory without manifest | path={}", dir);
                continue;
            }
            LinkDefinition def = readDefinition(dir, manifestPath, strictIds);
            LinkDefinition previous = map.put(def.getId(), def);
            if (previous != null) {
                log.warn("Link id declared twice; later directory wins | linkId={} | first={} | second={}",
                        def.getId(), previous.getDirectory(), dir);
            }
        }
        log.info("Discovered links | dir={} | count={} | ids={}", linksDir, map.size(), map.keySet());
        return new LinkRegistry(map);
    }

    /** Parses one manifest file into a definition. */
    public static LinkDefinition readDefinition(Path dir, Path manifestPath, boolean strictIds) {
        Map<String, Object> manifest = readManifest(manifestPath);
        try {
            LinkContract contract = LinkContract.fromManifest(manifest, strictIds);
            return new LinkDefinition(dir, contract.getManifest(), contract);
        } catch (InvalidContractException e) {
            throw new LinkManifestException(manifestPath, "Invalid link manifest " + manifestPath + ": " + e.getMessage(), e);
        }
    }

    static Map<String, Object> readManifest(Path manifestPath) {
        Object parsed;
        try {
            parsed = YAML_MAPPER.readValue(manifestPath.toFile(), new TypeReference<Object>() { });
        } catch (IOException e) {
            throw new LinkManifestException(manifestPath, "Cannot parse link manifest " + manifestPath + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new LinkManifestException(manifestPath, "Link manifest " + manifestPath + " is not a mapping");
        }
        return ConfigTrees.mutableCopy(ConfigTrees.asMap(parsed));
    }

    public Optional<LinkDefinition> get(String id) {
        return Optional.ofNullable(links.get(id));
    }

    public boolean contains(String id) {
        return links.containsKey(id);
    }

    public List<LinkDefinition> list() {
        return new ArrayList<>(links.values());
    }

    public int size() {
        return links.size();
    }
}

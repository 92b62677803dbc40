package com.kiln.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered link plugins by plugin id. One instance per orchestrator; duplicate ids are rejected.
 */
public final class LinkPluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(LinkPluginRegistry.class);

    private final Map<String, PluginEntry> plugins = new ConcurrentHashMap<>();

    /**
     * Registers a provider under its own plugin id.
     *
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public void register(LinkPluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        put(new PluginEntry(normalizeId(provider.getPluginId()), provider.getVersion(), provider.getCapabilityMetadata(), null, provider));
    }

    /**
     * Registers a plugin instance directly.
     *
     * @throws IllegalArgumentException if the id is blank or already registered
     */
    public void register(String pluginId, String version, LinkPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        put(new PluginEntry(normalizeId(pluginId), version, null, plugin, null));
    }

    private void put(PluginEntry entry) {
        if (plugins.putIfAbsent(entry.getId(), entry) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + entry.getId());
        }
        log.debug("Registered link plugin | pluginId={} | version={}", entry.getId(), entry.getVersion());
    }

    /**
     * Registers every enabled provider. Failures of {@code internal} providers propagate; others are logged
     * and skipped unless {@code required} is set.
     *
     * @return number of providers registered
     */
    public int registerAll(List<LinkPluginProvider> providers, boolean internal, boolean required) {
        int count = 0;
        for (LinkPluginProvider provider : providers) {
            try {
                if (!provider.isEnabled()) continue;
                register(provider);
                count++;
                log.info("Registered plugin {} (version={}, {})", provider.getPluginId(), provider.getVersion(),
                        internal ? "internal" : "community");
            } catch (RuntimeException e) {
                if (internal || required) {
                    throw e;
                }
                log.error("Community plugin failed to register (skipping): pluginId={}, error={}",
                        provider != null ? provider.getPluginId() : "?", e.getMessage(), e);
            }
        }
        return count;
    }

    private static String normalizeId(String id) {
        String pid = Objects.requireNonNull(id, "id").trim();
        if (pid.isEmpty()) {
            throw new IllegalArgumentException("Plugin id must be non-blank");
        }
        return pid;
    }

    public Optional<PluginEntry> get(String pluginId) {
        if (pluginId == null || pluginId.isBlank()) return Optional.empty();
        return Optional.ofNullable(plugins.get(pluginId.trim()));
    }

    /** Plugin instance for the id, or empty when nothing is registered under it. */
    public Optional<LinkPlugin> getPlugin(String pluginId) {
        return get(pluginId).map(PluginEntry::getPlugin);
    }

    public boolean contains(String pluginId) {
        return get(pluginId).isPresent();
    }

    public Set<String> getPluginIds() {
        return Collections.unmodifiableSet(new TreeSet<>(plugins.keySet()));
    }

    public int size() {
        return plugins.size();
    }

    /** Registered plugin: id, version, capability metadata, and a singleton instance or its provider. */
    public static final class PluginEntry {
        private final String id;
        private final String version;
        private final Map<String, Object> capabilityMetadata;
        private final LinkPlugin plugin;
        private final LinkPluginProvider provider;

        PluginEntry(String id, String version, Map<String, Object> capabilityMetadata,
                    LinkPlugin plugin, LinkPluginProvider provider) {
            this.id = id;
            this.version = version;
            this.capabilityMetadata = capabilityMetadata != null ? Map.copyOf(capabilityMetadata) : Map.of();
            this.plugin = plugin;
            this.provider = provider;
        }

        public String getId() {
            return id;
        }

        /** Plugin version; null = unknown. */
        public String getVersion() {
            return version;
        }

        public Map<String, Object> getCapabilityMetadata() {
            return capabilityMetadata;
        }

        public LinkPlugin getPlugin() {
            return provider != null ? provider.getPlugin() : plugin;
        }
    }
}

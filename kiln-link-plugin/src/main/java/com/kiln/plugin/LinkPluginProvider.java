package com.kiln.plugin;

import java.util.Collections;
import java.util.Map;

/**
 * SPI for link implementations. Providers are discovered via {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.kiln.plugin.LinkPluginProvider}); a link manifest names its provider with
 * {@code spec.runtime.plugin} (default: the link id).
 */
public interface LinkPluginProvider {

    /** Plugin id referenced by link manifests. */
    String getPluginId();

    /** Plugin instance. Invoked once per link execution. */
    LinkPlugin getPlugin();

    /** Implementation version, recorded for audit. */
    default String getVersion() {
        return "1.0";
    }

    /** Optional capability metadata (e.g. vendor, supported schemas). Empty by default. */
    default Map<String, Object> getCapabilityMetadata() {
        return Collections.emptyMap();
    }

    /** Whether this provider should be registered. Override to skip registration when its environment is unset. */
    default boolean isEnabled() {
        return true;
    }
}

package com.kiln.plugin;

import java.util.Map;

/** Test provider registered through META-INF/services; publishes its config as {@code echo.out}. */
public class EchoPluginProvider implements LinkPluginProvider {

    @Override
    public String getPluginId() {
        return "echo";
    }

    @Override
    public String getVersion() {
        return "0.1";
    }

    @Override
    public LinkPlugin getPlugin() {
        return (context, config) -> {
            context.getSandbox().publish("echo.out", "echo.json", config);
            return LinkResult.succeeded(Map.of("keys", config.size()));
        };
    }
}

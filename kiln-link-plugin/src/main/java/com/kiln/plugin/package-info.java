/**
 * Link plugin contract and registry. Each link's work is a {@link com.kiln.plugin.LinkPlugin} registered by
 * plugin id; the orchestrator resolves a link's {@code spec.runtime.plugin} against the
 * {@link com.kiln.plugin.LinkPluginRegistry} and invokes it with an immutable {@link com.kiln.plugin.LinkContext}.
 * <ul>
 *   <li>{@link com.kiln.plugin.LinkPlugin}: run(context, config) → {@link com.kiln.plugin.LinkResult}</li>
 *   <li>{@link com.kiln.plugin.LinkPluginProvider}: SPI for discovery (ServiceLoader)</li>
 *   <li>{@link com.kiln.plugin.PluginManager}: internal providers from the class path and community JARs from a controlled directory</li>
 *   <li>{@link com.kiln.plugin.RestrictedPluginClassLoader}: hardened parent for community JARs</li>
 * </ul>
 */
package com.kiln.plugin;

package com.kiln.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Collects link plugin providers from two places: internal providers on the worker class path
 * (via {@link ServiceLoader}, or registered explicitly) and community JARs in one controlled directory, each
 * loaded under a {@link RestrictedPluginClassLoader}.
 * <p>
 * Community load failures (bad JAR, provider constructor failure) are logged and skipped unless the manager
 * was created with {@code communityRequired}, in which case they propagate as {@link IllegalStateException}.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final boolean communityRequired;
    private final List<LinkPluginProvider> internalProviders = new ArrayList<>();
    private final List<LinkPluginProvider> communityProviders = new ArrayList<>();
    @SuppressWarnings("unused") // keep references so classloaders are not GC'd
    private final List<ClassLoader> communityLoaders = new ArrayList<>();

    public PluginManager() {
        this(false);
    }

    public PluginManager(boolean communityRequired) {
        this.communityRequired = communityRequired;
    }

    /** Registers an internal provider (must be on the worker class path). */
    public void registerInternal(LinkPluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Adds every {@link LinkPluginProvider} declared under {@code META-INF/services} on the given class loader.
     *
     * @return number of providers found
     */
    public int loadInternalProviders(ClassLoader classLoader) {
        int n = 0;
        for (LinkPluginProvider provider : ServiceLoader.load(LinkPluginProvider.class, classLoader)) {
            registerInternal(provider);
            n++;
        }
        log.info("Loaded {} internal link plugin provider(s) from class path", n);
        return n;
    }

    /**
     * Loads community plugins from {@code pluginsDir}. Only {@code *.jar} files directly in that directory are
     * considered.
     */
    public void loadCommunityPlugins(Path pluginsDir) {
        if (pluginsDir == null) {
            return;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Community plugins directory does not exist: {}", pluginsDir);
            return;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Community plugins path is not a directory: {}", pluginsDir);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                loadCommunityJar(jar);
            }
        } catch (IOException e) {
            fail("Failed to list community plugins directory " + pluginsDir, e);
        }
    }

    private void loadCommunityJar(Path jar) {
        try {
            URL jarUrl = jar.toUri().toURL();
            URLClassLoader loader = new URLClassLoader(new URL[]{jarUrl}, new RestrictedPluginClassLoader());
            communityLoaders.add(loader);

            int n = 0;
            for (LinkPluginProvider provider : ServiceLoader.load(LinkPluginProvider.class, loader)) {
                communityProviders.add(provider);
                n++;
            }
            if (n > 0) {
                log.info("Loaded {} provider(s) from community JAR: {}", n, jar.getFileName());
            }
        } catch (Exception | ServiceConfigurationError e) {
            fail("Failed to load community plugin JAR " + jar, e);
        }
    }

    private void fail(String message, Throwable cause) {
        if (communityRequired) {
            throw new IllegalStateException(message + ": " + cause.getMessage(), cause);
        }
        log.error("{} (skipping): {}", message, cause.getMessage(), cause);
    }

    /** Internal providers only (registration failures are fatal). */
    public List<LinkPluginProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    /** Community providers only (registration failures are log-and-skip). */
    public List<LinkPluginProvider> getCommunityProviders() {
        return new ArrayList<>(communityProviders);
    }

    public boolean isCommunityRequired() {
        return communityRequired;
    }

    public int getInternalCount() {
        return internalProviders.size();
    }

    public int getCommunityCount() {
        return communityProviders.size();
    }
}

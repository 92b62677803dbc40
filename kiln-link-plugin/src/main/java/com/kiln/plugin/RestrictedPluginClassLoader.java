package com.kiln.plugin;

/**
 * Restricted parent classloader for community plugin JARs. Exposes only the plugin API and the libraries it
 * is expressed in; every other class throws {@link ClassNotFoundException}, including through
 * {@code Class.forName}.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.kiln.plugin.*}, {@code com.kiln.sandbox.*},
 * {@code com.kiln.artifact.*}, {@code com.fasterxml.jackson.*}, {@code org.slf4j.*}
 * <p>
 * <b>Denied (non-exhaustive):</b> {@code com.kiln.worker.*}, {@code com.kiln.ledger.*},
 * {@code com.kiln.policy.*}, {@code com.kiln.config.*}. A plugin cannot write the ledger or read the
 * process configuration.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.kiln.plugin.",
            "com.kiln.sandbox.",
            "com.kiln.artifact.",
            "com.fasterxml.jackson.",
            "org.slf4j."
    };

    private final ClassLoader kernelLoader;

    /**
     * Creates a restricted classloader with no parent. Delegates to the loader that loaded
     * {@link LinkPluginProvider} only for allowed package prefixes.
     */
    public RestrictedPluginClassLoader() {
        super(null);
        this.kernelLoader = LinkPluginProvider.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = kernelLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (community plugins may only use java.*, javax.*, com.kiln.plugin.*, com.kiln.sandbox.*, "
                    + "com.kiln.artifact.*, com.fasterxml.jackson.*, org.slf4j.*)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}

package com.tyron.nanodi.api.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Locates the {@link ProviderFactory} that backs {@link ServiceProvider#create} and {@link ServiceRegistry#builder()}.
 * <p>
 * The first lookup loads {@code ProviderFactoryBootstrap} from the implementation module by name, which registers
 * the container implementation through {@link #set(ProviderFactory)}.
 */
public final class ProviderFactoryHolder {

    private static final String BOOTSTRAP_CLASS = "com.tyron.nanodi.core.service.ProviderFactoryBootstrap";

    private static final AtomicReference<ProviderFactory> FACTORY = new AtomicReference<>();

    private ProviderFactoryHolder() {
    }

    /**
     * Replaces the registered factory. Called by the implementation's bootstrap class.
     */
    public static void set(ProviderFactory factory) {
        if (factory == null) throw new IllegalArgumentException("factory == null");
        FACTORY.set(factory);
    }

    public static ProviderFactory get() {
        ProviderFactory factory = FACTORY.get();
        if (factory == null) {
            loadBootstrap();
            factory = FACTORY.get();
        }
        if (factory == null) {
            throw new IllegalStateException("Cannot create a service provider: " + BOOTSTRAP_CLASS
                    + " was not found. Add the nanodi-core artifact (module ':core') to the classpath.");
        }
        return factory;
    }

    private static void loadBootstrap() {
        try {
            Class.forName(BOOTSTRAP_CLASS, true, ProviderFactoryHolder.class.getClassLoader());
        } catch (ClassNotFoundException ignored) {
            // reported by get() as a missing implementation
        }
    }
}

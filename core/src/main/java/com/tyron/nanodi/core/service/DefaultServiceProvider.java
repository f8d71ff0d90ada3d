package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ServiceProvider;
import com.tyron.nanodi.api.service.ServiceProviderOptions;
import com.tyron.nanodi.api.service.ServiceRegistry;
import com.tyron.nanodi.api.service.ServiceScope;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ServiceProvider}.
 * <p>
 * Holds the singleton cache shared by all of its scopes. Performs no resolution itself.
 * Not thread-safe: callers sharing a provider across threads must serialize access.
 */
public final class DefaultServiceProvider implements ServiceProvider {

    private static final Logger LOG = Logger.getLogger(DefaultServiceProvider.class.getName());

    private final ServiceRegistry registry;
    private final ServiceProviderOptions options;

    private final Map<String, Object> singletons = new HashMap<>();

    public DefaultServiceProvider(ServiceRegistry registry, ServiceProviderOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public @NotNull ServiceRegistry getRegistry() {
        return registry;
    }

    @Override
    public @NotNull ServiceProviderOptions getOptions() {
        return options;
    }

    @Override
    public @NotNull ServiceScope beginScope() {
        DefaultServiceScope scope = new DefaultServiceScope(registry, singletons, options);
        scope.setName(options.getDefaultScopeName());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Scope begun: registrySize=" + registry.size() + ", cachedSingletons=" + singletons.size());
        }
        return scope;
    }
}

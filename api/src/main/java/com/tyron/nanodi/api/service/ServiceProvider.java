package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/**
 * Root object of a container: owns the registry and the cache of singleton instances.
 * <p>
 * Singletons constructed in one scope are reused by every other scope begun from the same provider.
 * Independent providers never share instances.
 */
public interface ServiceProvider {

    static ServiceProvider create(Consumer<ServiceRegistry.Builder> build) {
        return create(ServiceRegistry.build(build), ServiceProviderOptions.defaults());
    }

    static ServiceProvider create(Consumer<ServiceRegistry.Builder> build, ServiceProviderOptions options) {
        return create(ServiceRegistry.build(build), options);
    }

    static ServiceProvider create(ServiceRegistry registry) {
        return create(registry, ServiceProviderOptions.defaults());
    }

    static ServiceProvider create(ServiceRegistry registry, ServiceProviderOptions options) {
        if (registry == null) throw new IllegalArgumentException("registry == null");
        if (options == null) throw new IllegalArgumentException("options == null");
        return ProviderFactoryHolder.get().createProvider(registry, options);
    }

    @NotNull ServiceRegistry getRegistry();

    @NotNull ServiceProviderOptions getOptions();

    /**
     * Begins a new scope with its own cache of scoped instances.
     */
    @NotNull ServiceScope beginScope();

    default @NotNull ServiceScope beginScope(@Nullable String name) {
        ServiceScope scope = beginScope();
        scope.setName(name);
        return scope;
    }

    /**
     * Shorthand for {@code beginScope().createContext()}.
     */
    default @NotNull ServiceContext begin() {
        return beginScope().createContext();
    }
}

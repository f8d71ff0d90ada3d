package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Immutable {@code (lifetime, factory)} pair registered under a service name.
 */
public final class ServiceDescriptor {

    private final Lifetime lifetime;
    private final ServiceFactory<?> factory;

    public ServiceDescriptor(@NotNull Lifetime lifetime, @NotNull ServiceFactory<?> factory) {
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @NotNull ServiceFactory<?> getFactory() {
        return factory;
    }

    @Override
    public String toString() {
        return "ServiceDescriptor{" + lifetime + ", " + factory + '}';
    }
}

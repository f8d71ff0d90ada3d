package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A resolution boundary: caches scoped instances and tracks the services currently under construction.
 * <p>
 * A scope lives as long as it is referenced; there is no close step.
 */
public interface ServiceScope {

    /**
     * @return the debug name shown in resolution errors, or null.
     */
    @Nullable String getName();

    void setName(@Nullable String name);

    /**
     * Resolves {@code name}, reusing a cached instance where its lifetime allows.
     *
     * @param context the context handed to factories constructed during this call
     * @throws ResolveException on an unknown name, a circular dependency or a lifetime violation
     */
    Object resolve(String name, @NotNull ServiceContext context);

    @NotNull ServiceContext createContext();

    /**
     * Creates a context whose lookups consult {@code exoticContext} before the registry.
     */
    @NotNull ServiceContext createContext(@Nullable ExoticContext exoticContext);
}

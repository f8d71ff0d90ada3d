package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Lazy, name-indexed view of a {@link ServiceScope}.
 * <p>
 * Reading a name triggers resolution. The context keeps no cache of its own, so every factory receives the
 * same context the caller holds and sees the same caching.
 */
public interface ServiceContext {

    /**
     * Always reads as {@code null}. Script bridges probe objects for a {@code then} member to detect
     * promise-like values; the probe must not resolve a service.
     */
    String NON_AWAITABLE_PROBE = "then";

    /**
     * @throws ResolveException if the name is null, unknown, or cannot be resolved in this scope
     */
    Object get(String name);

    /**
     * Typed variant of {@link #get(String)}.
     *
     * @throws ResolveException with {@link ResolveException.Reason#TYPE_MISMATCH} if the instance is not a {@code type}
     */
    <T> T get(String name, @NotNull Class<T> type);

    /**
     * @return true if {@code name} is an exotic entry or a registered service.
     */
    boolean has(String name);

    /**
     * Resolves every registered service, in registration order, followed by exotic-only entries.
     * Exotic values replace registered ones of the same name.
     */
    @NotNull Map<String, Object> asMap();

    @NotNull ServiceScope getScope();
}

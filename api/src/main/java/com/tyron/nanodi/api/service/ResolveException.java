package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Thrown when a service name cannot be resolved.
 * <p>
 * These are programmer errors: an unknown name, a circular dependency, or a singleton that would capture a
 * scoped instance. The message carries the scope's debug name and the resolution path, with the offending
 * entries marked, e.g. {@code /request/ Invalid service resolution: a -> [b] -> c -> [b]}.
 */
public class ResolveException extends RuntimeException {

    public enum Reason {
        /** The name is not registered. */
        UNREGISTERED,
        /** The name itself is not usable as a lookup key. */
        INVALID_NAME,
        /** The name is already being resolved further down the current path. */
        CIRCULAR,
        /** A singleton on the current path would depend on a scoped service. */
        LIFETIME,
        /** The resolved instance is not of the requested type. */
        TYPE_MISMATCH
    }

    private final Reason reason;
    private final String scopeName;
    private final List<String> path;

    public ResolveException(@NotNull Reason reason, String message) {
        this(reason, message, null, List.of());
    }

    public ResolveException(@NotNull Reason reason, String message, @Nullable String scopeName, @NotNull List<String> path) {
        super(message);
        this.reason = reason;
        this.scopeName = scopeName;
        this.path = List.copyOf(path);
    }

    public @NotNull Reason getReason() {
        return reason;
    }

    /**
     * @return the debug name of the scope the failure happened in, or null if unnamed or not scope-related.
     */
    public @Nullable String getScopeName() {
        return scopeName;
    }

    /**
     * @return the resolution path ending with the requested name, or an empty list if no path was involved.
     */
    public @NotNull List<String> getPath() {
        return path;
    }
}

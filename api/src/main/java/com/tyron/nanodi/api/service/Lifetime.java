package com.tyron.nanodi.api.service;

/**
 * How long a resolved service instance is reused.
 */
public enum Lifetime {

    /**
     * One instance per {@link ServiceProvider}, shared by every scope it creates.
     */
    SINGLETON,

    /**
     * One instance per {@link ServiceScope}.
     */
    SCOPED,

    /**
     * A new instance on every access.
     */
    TRANSIENT;

    /**
     * Whether a service with this lifetime may hold on to a dependency with the given lifetime.
     * <p>
     * A singleton outlives every scope, so it must never capture a scoped instance.
     */
    public boolean mayDependOn(Lifetime dependency) {
        if (dependency == null) throw new IllegalArgumentException("dependency == null");
        return this != SINGLETON || dependency != SCOPED;
    }
}

package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

/**
 * Creates a service instance.
 * <p>
 * Dependencies are pulled explicitly from the given context; each {@link ServiceContext#get(String)}
 * call made here is resolved on demand, depth-first.
 *
 * @param <T> the service type
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(@NotNull ServiceContext context);

    /**
     * Adapts a constructor-shaped class into a factory.
     * <p>
     * A public {@code (ServiceContext)} constructor is preferred; a public no-arg constructor is used otherwise.
     * The constructor is looked up eagerly, so a class with neither fails here rather than on first access.
     *
     * @throws IllegalArgumentException if {@code type} is not a concrete class with a usable constructor
     */
    static <T> ServiceFactory<T> ofConstructor(Class<T> type) {
        return ConstructorServiceFactory.of(type);
    }
}

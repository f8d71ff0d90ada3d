package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.function.Consumer;

/**
 * Immutable table of service descriptors keyed by name.
 * <p>
 * Registration order is preserved and observable through {@link #names()}.
 */
public interface ServiceRegistry {

    static Builder builder() {
        return ProviderFactoryHolder.get().newRegistryBuilder();
    }

    /**
     * Creates a registry from a build callback.
     * <pre>
     * ServiceRegistry registry = ServiceRegistry.build(b -> b
     *         .addSingleton("clock", SystemClock.class)
     *         .addScoped("session", c -> new Session(c.get("clock", Clock.class))));
     * </pre>
     */
    static ServiceRegistry build(Consumer<Builder> build) {
        if (build == null) throw new IllegalArgumentException("build == null");
        Builder builder = builder();
        build.accept(builder);
        return builder.build();
    }

    /**
     * @return the registered names, in registration order.
     */
    @NotNull List<String> names();

    /**
     * @throws ResolveException if {@code name} is not registered
     */
    @NotNull ServiceDescriptor get(String name);

    boolean has(String name);

    int size();

    /**
     * Collects descriptors for a {@link ServiceRegistry}.
     * <p>
     * Every entry point records a descriptor under {@code name}, replacing any earlier registration of the
     * same name. The {@link ServiceFactory} overloads call the factory directly; the {@link Class} overloads
     * construct the class through {@link ServiceFactory#ofConstructor(Class)}.
     */
    interface Builder {

        Builder add(String name, Lifetime lifetime, ServiceFactory<?> factory);

        default Builder addSingleton(String name, ServiceFactory<?> factory) {
            return add(name, Lifetime.SINGLETON, factory);
        }

        default Builder addSingleton(String name, Class<?> type) {
            return add(name, Lifetime.SINGLETON, ServiceFactory.ofConstructor(type));
        }

        default Builder addScoped(String name, ServiceFactory<?> factory) {
            return add(name, Lifetime.SCOPED, factory);
        }

        default Builder addScoped(String name, Class<?> type) {
            return add(name, Lifetime.SCOPED, ServiceFactory.ofConstructor(type));
        }

        default Builder addTransient(String name, ServiceFactory<?> factory) {
            return add(name, Lifetime.TRANSIENT, factory);
        }

        default Builder addTransient(String name, Class<?> type) {
            return add(name, Lifetime.TRANSIENT, ServiceFactory.ofConstructor(type));
        }

        /**
         * Freezes the collected descriptors. The builder may keep being used; later changes do not affect
         * registries already built.
         */
        ServiceRegistry build();
    }
}

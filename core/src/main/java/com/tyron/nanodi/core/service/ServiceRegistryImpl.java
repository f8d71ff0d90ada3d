package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.Lifetime;
import com.tyron.nanodi.api.service.ResolveException;
import com.tyron.nanodi.api.service.ServiceDescriptor;
import com.tyron.nanodi.api.service.ServiceFactory;
import com.tyron.nanodi.api.service.ServiceRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ServiceRegistry}: an insertion-ordered, frozen copy of the builder's descriptors.
 */
public final class ServiceRegistryImpl implements ServiceRegistry {

    private final Map<String, ServiceDescriptor> descriptors;
    private final List<String> names;

    private ServiceRegistryImpl(Map<String, ServiceDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        this.names = List.copyOf(this.descriptors.keySet());
    }

    @Override
    public @NotNull List<String> names() {
        return names;
    }

    @Override
    public @NotNull ServiceDescriptor get(String name) {
        if (name == null) {
            throw new ResolveException(ResolveException.Reason.INVALID_NAME, "Invalid service name: null");
        }
        ServiceDescriptor descriptor = descriptors.get(name);
        if (descriptor == null) {
            throw new ResolveException(ResolveException.Reason.UNREGISTERED, "Invalid service name: " + name);
        }
        return descriptor;
    }

    @Override
    public boolean has(String name) {
        return name != null && descriptors.containsKey(name);
    }

    @Override
    public int size() {
        return descriptors.size();
    }

    @Override
    public String toString() {
        return "ServiceRegistry" + names;
    }

    public static final class Builder implements ServiceRegistry.Builder {

        private final Map<String, ServiceDescriptor> descriptors = new LinkedHashMap<>();

        @Override
        public Builder add(String name, Lifetime lifetime, ServiceFactory<?> factory) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name is blank");
            }
            if (lifetime == null) {
                throw new IllegalArgumentException("lifetime is null");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory is null");
            }
            descriptors.put(name, new ServiceDescriptor(lifetime, factory));
            return this;
        }

        @Override
        public ServiceRegistry build() {
            return new ServiceRegistryImpl(descriptors);
        }
    }
}

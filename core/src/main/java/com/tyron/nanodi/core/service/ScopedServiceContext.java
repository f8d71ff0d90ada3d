package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ExoticContext;
import com.tyron.nanodi.api.service.ResolveException;
import com.tyron.nanodi.api.service.ServiceContext;
import com.tyron.nanodi.api.service.ServiceScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ServiceContext} bound to a {@link DefaultServiceScope}.
 * <p>
 * Lookup order: reserved probe name, exotic entries, then the scope.
 */
final class ScopedServiceContext implements ServiceContext {

    private final DefaultServiceScope scope;
    private final ExoticContext exotic;

    ScopedServiceContext(DefaultServiceScope scope, @Nullable ExoticContext exotic) {
        this.scope = scope;
        this.exotic = exotic;
    }

    @Override
    public Object get(String name) {
        if (name == null) {
            throw new ResolveException(ResolveException.Reason.INVALID_NAME, "Invalid service name: null", scope.getName(), List.of());
        }
        if (NON_AWAITABLE_PROBE.equals(name)) {
            return null;
        }
        if (exotic != null && exotic.contains(name)) {
            return exotic.get(name);
        }
        return scope.resolve(name, this);
    }

    @Override
    public <T> T get(String name, @NotNull Class<T> type) {
        Object instance = get(name);
        if (instance == null) {
            return null;
        }
        if (!type.isInstance(instance)) {
            throw new ResolveException(
                    ResolveException.Reason.TYPE_MISMATCH,
                    "Service '" + name + "' is a " + instance.getClass().getName() + ", not a " + type.getName(),
                    scope.getName(),
                    List.of(name));
        }
        return type.cast(instance);
    }

    @Override
    public boolean has(String name) {
        if (name == null) {
            return false;
        }
        return (exotic != null && exotic.contains(name)) || scope.getRegistry().has(name);
    }

    @Override
    public @NotNull Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String name : scope.getRegistry().names()) {
            out.put(name, get(name));
        }
        if (exotic != null) {
            for (String name : exotic.names()) {
                out.put(name, get(name));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public @NotNull ServiceScope getScope() {
        return scope;
    }

    @Override
    public String toString() {
        return "ServiceContext{" + scope + (exotic != null ? ", exotic=" + exotic.names() : "") + '}';
    }
}

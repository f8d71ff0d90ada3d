package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ExoticContext;
import com.tyron.nanodi.api.service.Lifetime;
import com.tyron.nanodi.api.service.ResolveException;
import com.tyron.nanodi.api.service.ServiceContext;
import com.tyron.nanodi.api.service.ServiceDescriptor;
import com.tyron.nanodi.api.service.ServiceProviderOptions;
import com.tyron.nanodi.api.service.ServiceRegistry;
import com.tyron.nanodi.api.service.ServiceScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ServiceScope} and the resolution engine.
 * <p>
 * - Singletons are cached in the provider-wide map shared with sibling scopes
 * - Scoped instances are cached in this scope only; transients are never cached
 * - Dependencies are resolved on demand, depth-first, in the order factories ask for them
 * - Circular paths and singletons capturing scoped services are rejected before anything is constructed
 */
final class DefaultServiceScope implements ServiceScope {

    private static final Logger LOG = Logger.getLogger(DefaultServiceScope.class.getName());

    private final ServiceRegistry registry;
    private final Map<String, Object> singletons;
    private final boolean validateOnCacheHit;

    private final Map<String, Object> scoped = new HashMap<>();
    private final ResolutionPath path = new ResolutionPath();

    private String name;

    DefaultServiceScope(ServiceRegistry registry, Map<String, Object> singletons, ServiceProviderOptions options) {
        this.registry = registry;
        this.singletons = singletons;
        this.validateOnCacheHit = options.isValidateOnCacheHit();
    }

    @Override
    public @Nullable String getName() {
        return name;
    }

    @Override
    public void setName(@Nullable String name) {
        this.name = name;
    }

    ServiceRegistry getRegistry() {
        return registry;
    }

    @Override
    public Object resolve(String name, @NotNull ServiceContext context) {
        boolean topLevel = path.isEmpty();
        try {
            return resolveInPath(name, context);
        } catch (RuntimeException | Error e) {
            if (topLevel && LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "Failed to resolve '" + name + "' in scope " + label(), e);
            }
            throw e;
        }
    }

    private Object resolveInPath(String name, ServiceContext context) {
        if (name == null) {
            throw new ResolveException(ResolveException.Reason.INVALID_NAME, "Invalid service name: null", this.name, List.of());
        }
        checkNotCircular(name);

        ServiceDescriptor descriptor = lookup(name);
        switch (descriptor.getLifetime()) {
            case SINGLETON:
                return resolveCached(name, descriptor, singletons, context);
            case SCOPED:
                return resolveCached(name, descriptor, scoped, context);
            case TRANSIENT:
            default:
                checkLifetime(name, descriptor.getLifetime());
                return construct(name, descriptor, context);
        }
    }

    private ServiceDescriptor lookup(String name) {
        if (!registry.has(name)) {
            throw new ResolveException(
                    ResolveException.Reason.UNREGISTERED,
                    "Invalid service name: " + name,
                    this.name,
                    path.extendedWith(name));
        }
        return registry.get(name);
    }

    private Object resolveCached(String name, ServiceDescriptor descriptor, Map<String, Object> cache, ServiceContext context) {
        if (cache.containsKey(name)) {
            if (validateOnCacheHit) {
                checkLifetime(name, descriptor.getLifetime());
            }
            if (LOG.isLoggable(Level.FINER)) {
                LOG.finer("Cache hit: '" + name + "' (" + descriptor.getLifetime() + ") in scope " + label());
            }
            return cache.get(name);
        }

        checkLifetime(name, descriptor.getLifetime());
        Object created = construct(name, descriptor, context);
        cache.put(name, created);
        return created;
    }

    private Object construct(String name, ServiceDescriptor descriptor, ServiceContext context) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Creating '" + name + "' (" + descriptor.getLifetime() + ") in scope " + label()
                    + (path.isEmpty() ? "" : " for " + path));
        }

        path.push(name);
        try {
            return descriptor.getFactory().create(context);
        } finally {
            path.pop();
        }
    }

    private void checkNotCircular(String name) {
        int index = path.lastIndexOf(name);
        if (index != -1) {
            throw new ResolveException(
                    ResolveException.Reason.CIRCULAR,
                    path.describe(this.name, "Invalid service resolution", index, name),
                    this.name,
                    path.extendedWith(name));
        }
    }

    /**
     * Walks the path from the most recent entry back and rejects {@code name} if any entry may not hold a
     * dependency with the given lifetime.
     */
    private void checkLifetime(String name, Lifetime lifetime) {
        for (int i = path.size() - 1; i >= 0; i--) {
            Lifetime owner = registry.get(path.get(i)).getLifetime();
            if (!owner.mayDependOn(lifetime)) {
                throw new ResolveException(
                        ResolveException.Reason.LIFETIME,
                        path.describe(this.name, "Invalid service lifetime", i, name),
                        this.name,
                        path.extendedWith(name));
            }
        }
    }

    @Override
    public @NotNull ServiceContext createContext() {
        return createContext(null);
    }

    @Override
    public @NotNull ServiceContext createContext(@Nullable ExoticContext exoticContext) {
        return new ScopedServiceContext(this, exoticContext);
    }

    private String label() {
        return name == null ? "(unnamed)" : name;
    }

    @Override
    public String toString() {
        return "ServiceScope{" + label() + ", scoped=" + scoped.keySet() + '}';
    }
}

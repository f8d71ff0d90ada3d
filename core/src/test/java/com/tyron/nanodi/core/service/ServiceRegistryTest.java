package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.Lifetime;
import com.tyron.nanodi.api.service.ResolveException;
import com.tyron.nanodi.api.service.ServiceProvider;
import com.tyron.nanodi.api.service.ServiceRegistry;
import com.tyron.nanodi.testFramework.BaseProviderTest;
import com.tyron.nanodi.testFramework.sample.SampleServices.A;
import com.tyron.nanodi.testFramework.sample.SampleServices.B;
import com.tyron.nanodi.testFramework.sample.SampleServices.C;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ServiceRegistryTest extends BaseProviderTest {

    @Test
    public void constructorRegistrationKeepsOrder() {
        ServiceProvider p1 = provider(b -> b.addSingleton("a", A.class));
        Assertions.assertEquals(List.of("a"), p1.getRegistry().names());

        ServiceProvider p2 = provider(b -> b
                .addSingleton("a", A.class)
                .addSingleton("b", B.class));
        Assertions.assertEquals(List.of("a", "b"), p2.getRegistry().names());

        ServiceProvider p3 = provider(b -> b
                .addSingleton("a", A.class)
                .addSingleton("b", B.class)
                .addSingleton("c", C.class));
        Assertions.assertEquals(List.of("a", "b", "c"), p3.getRegistry().names());
    }

    @Test
    public void factoryRegistrationKeepsOrder() {
        ServiceProvider p = provider(b -> b
                .addSingleton("c", c -> new C(c))
                .addSingleton("a", c -> new A())
                .addSingleton("b", B::new));

        Assertions.assertEquals(List.of("c", "a", "b"), p.getRegistry().names());
        Assertions.assertEquals(3, p.getRegistry().size());
    }

    @Test
    public void registeredLifetime() {
        ServiceRegistry registry = ServiceRegistry.build(b -> b
                .addSingleton("a", A.class)
                .addScoped("b", B.class)
                .addTransient("c", C.class));

        Assertions.assertEquals(Lifetime.SINGLETON, registry.get("a").getLifetime());
        Assertions.assertEquals(Lifetime.SCOPED, registry.get("b").getLifetime());
        Assertions.assertEquals(Lifetime.TRANSIENT, registry.get("c").getLifetime());
    }

    @Test
    public void reRegistrationOverwritesButKeepsPosition() {
        ServiceRegistry registry = ServiceRegistry.build(b -> b
                .addSingleton("a", A.class)
                .addScoped("b", B.class)
                .addTransient("a", A.class));

        Assertions.assertEquals(List.of("a", "b"), registry.names());
        Assertions.assertEquals(Lifetime.TRANSIENT, registry.get("a").getLifetime());
    }

    @Test
    public void getUnregisteredFails() {
        ServiceRegistry registry = ServiceRegistry.build(b -> b.addSingleton("a", A.class));

        Assertions.assertTrue(registry.has("a"));
        Assertions.assertFalse(registry.has("missing"));
        Assertions.assertFalse(registry.has(null));

        ResolveException e = Assertions.assertThrows(ResolveException.class, () -> registry.get("missing"));
        Assertions.assertEquals(ResolveException.Reason.UNREGISTERED, e.getReason());
        Assertions.assertEquals("Invalid service name: missing", e.getMessage());

        ResolveException nullName = Assertions.assertThrows(ResolveException.class, () -> registry.get(null));
        Assertions.assertEquals(ResolveException.Reason.INVALID_NAME, nullName.getReason());
    }

    @Test
    public void builtRegistryIsFrozen() {
        ServiceRegistry.Builder builder = ServiceRegistry.builder().addSingleton("a", A.class);
        ServiceRegistry registry = builder.build();

        builder.addScoped("b", B.class);

        Assertions.assertEquals(List.of("a"), registry.names());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> registry.names().add("b"));
    }

    @Test
    public void providerAcceptsExistingRegistry() {
        ServiceRegistry registry = ServiceRegistry.build(b -> b.addSingleton("a", A.class));

        ServiceProvider p1 = ServiceProvider.create(registry);
        ServiceProvider p2 = ServiceProvider.create(registry);

        Assertions.assertSame(registry, p1.getRegistry());
        // Same registry, independent singleton caches.
        Assertions.assertNotSame(p1.begin().get("a"), p2.begin().get("a"));
        assertSampleCalls(2, 0, 0);
    }

    @Test
    public void invalidRegistrationsFailFast() {
        ServiceRegistry.Builder builder = ServiceRegistry.builder();

        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.addSingleton("", A.class));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.addSingleton(null, c -> new A()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.add("a", null, c -> new A()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.add("a", Lifetime.SCOPED, null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.addScoped("list", Runnable.class));
        Assertions.assertEquals(0, builder.build().size());
    }
}

package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ExoticContext;
import com.tyron.nanodi.api.service.ServiceContext;
import com.tyron.nanodi.api.service.ServiceProvider;
import com.tyron.nanodi.api.service.ServiceScope;
import com.tyron.nanodi.testFramework.BaseProviderTest;
import com.tyron.nanodi.testFramework.sample.SampleServices;
import com.tyron.nanodi.testFramework.sample.SampleServices.A;
import com.tyron.nanodi.testFramework.sample.SampleServices.B;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class ServiceContextTest extends BaseProviderTest {

    @Test
    public void exoticValueWinsOverRegistration() {
        ServiceProvider p = provider(b -> b.addSingleton("a", A.class));
        // built by hand, so reset the construction counter
        A external = new A();
        SampleServices.reset();

        ServiceContext context = p.beginScope().createContext(ExoticContext.builder().value("a", external).build());

        Assertions.assertSame(external, context.get("a"));
        Assertions.assertSame(external, context.get("a"));
        assertSampleCalls(0, 0, 0);
    }

    @Test
    public void exoticValuesReachFactories() {
        ServiceProvider p = provider(b -> b.addScoped("greeting", c -> "hello " + c.get("user")));
        ServiceContext context = p.beginScope()
                .createContext(ExoticContext.builder().value("user", "alice").build());

        Assertions.assertEquals("hello alice", context.get("greeting"));
    }

    @Test
    public void computedExoticIsTransientLike() {
        AtomicInteger reads = new AtomicInteger();
        ServiceContext context = provider(b -> { }).beginScope()
                .createContext(ExoticContext.builder().computed("tick", reads::incrementAndGet).build());

        Assertions.assertEquals(1, context.get("tick"));
        Assertions.assertEquals(2, context.get("tick"));
    }

    @Test
    public void probeNameNeverResolves() {
        ServiceProvider p = provider(b -> b.addSingleton(ServiceContext.NON_AWAITABLE_PROBE, calls.counting("then")));
        ServiceContext context = p.beginScope()
                .createContext(ExoticContext.builder().value(ServiceContext.NON_AWAITABLE_PROBE, "x").build());

        Assertions.assertNull(context.get(ServiceContext.NON_AWAITABLE_PROBE));
        Assertions.assertEquals(0, calls.count("then"));
    }

    @Test
    public void factoriesReceiveTheCallersContext() {
        List<ServiceContext> seen = new ArrayList<>();
        ServiceProvider p = provider(b -> b
                .addTransient("outer", c -> {
                    seen.add(c);
                    return c.get("inner");
                })
                .addTransient("inner", c -> {
                    seen.add(c);
                    return "inner";
                }));
        ServiceContext context = p.begin();

        context.get("outer");

        Assertions.assertEquals(2, seen.size());
        Assertions.assertSame(context, seen.get(0));
        Assertions.assertSame(context, seen.get(1));
    }

    @Test
    public void has() {
        ServiceContext context = provider(b -> b.addSingleton("a", A.class)).beginScope()
                .createContext(ExoticContext.builder().value("extra", 1).build());

        Assertions.assertTrue(context.has("a"));
        Assertions.assertTrue(context.has("extra"));
        Assertions.assertFalse(context.has("missing"));
        Assertions.assertFalse(context.has(null));
        assertSampleCalls(0, 0, 0);
    }

    @Test
    public void asMapResolvesEverythingInOrder() {
        ServiceProvider p = provider(b -> b
                .addSingleton("a", A.class)
                .addScoped("b", B.class)
                .addTransient("n", c -> 42));
        A external = new A();
        SampleServices.reset();
        ServiceContext context = p.beginScope().createContext(ExoticContext.builder()
                .value("extra", "e")
                .value("a", external)
                .build());

        Map<String, Object> all = context.asMap();

        Assertions.assertEquals(List.of("a", "b", "n", "extra"), List.copyOf(all.keySet()));
        Assertions.assertSame(external, all.get("a"));
        Assertions.assertSame(external, ((B) all.get("b")).getA());
        Assertions.assertEquals(42, all.get("n"));
        Assertions.assertEquals("e", all.get("extra"));
        assertSampleCalls(0, 1, 0);
    }

    @Test
    public void contextBelongsToItsScope() {
        ServiceScope scope = provider(b -> { }).beginScope();

        Assertions.assertSame(scope, scope.createContext().getScope());
    }
}

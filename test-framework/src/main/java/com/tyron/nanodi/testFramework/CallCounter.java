package com.tyron.nanodi.testFramework;

import com.tyron.nanodi.api.service.ServiceFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts factory invocations per service name.
 * <pre>
 * CallCounter calls = new CallCounter();
 * builder.addScoped("session", calls.counting("session", c -> new Session()));
 * ...
 * assertEquals(1, calls.count("session"));
 * </pre>
 */
public final class CallCounter {

    private final Map<String, AtomicInteger> counts = new LinkedHashMap<>();

    public <T> ServiceFactory<T> counting(String name, ServiceFactory<T> delegate) {
        if (delegate == null) throw new IllegalArgumentException("delegate == null");
        AtomicInteger count = counter(name);
        return context -> {
            count.incrementAndGet();
            return delegate.create(context);
        };
    }

    /**
     * Factory that records the call and returns a fresh {@link Object}.
     */
    public ServiceFactory<Object> counting(String name) {
        return counting(name, context -> new Object());
    }

    public int count(String name) {
        AtomicInteger count = counts.get(name);
        return count != null ? count.get() : 0;
    }

    public void reset() {
        counts.values().forEach(c -> c.set(0));
    }

    private AtomicInteger counter(String name) {
        return counts.computeIfAbsent(name, n -> new AtomicInteger());
    }

    @Override
    public String toString() {
        return "CallCounter" + counts;
    }
}

package com.tyron.nanodi.testFramework.sample;

import com.tyron.nanodi.api.service.ServiceContext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small services with construction counters.
 * <p>
 * B depends on {@code a}; C depends on {@code a} and {@code b}.
 */
public final class SampleServices {

    private SampleServices() {
    }

    public static void reset() {
        A.CALLED.set(0);
        B.CALLED.set(0);
        C.CALLED.set(0);
    }

    public static final class A {

        private static final AtomicInteger CALLED = new AtomicInteger();

        public A() {
            CALLED.incrementAndGet();
        }

        public static int called() {
            return CALLED.get();
        }
    }

    public static final class B {

        private static final AtomicInteger CALLED = new AtomicInteger();

        private final A a;

        public B(ServiceContext context) {
            this.a = context.get("a", A.class);
            CALLED.incrementAndGet();
        }

        public A getA() {
            return a;
        }

        public static int called() {
            return CALLED.get();
        }
    }

    public static final class C {

        private static final AtomicInteger CALLED = new AtomicInteger();

        private final A a;
        private final B b;

        public C(ServiceContext context) {
            this.a = context.get("a", A.class);
            this.b = context.get("b", B.class);
            CALLED.incrementAndGet();
        }

        public A getA() {
            return a;
        }

        public B getB() {
            return b;
        }

        public static int called() {
            return CALLED.get();
        }
    }
}

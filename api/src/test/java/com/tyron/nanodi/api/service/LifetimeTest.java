package com.tyron.nanodi.api.service;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LifetimeTest {

    @Test
    public void singletonMayNotDependOnScoped() {
        Assertions.assertFalse(Lifetime.SINGLETON.mayDependOn(Lifetime.SCOPED));
    }

    @Test
    public void everyOtherPairIsAllowed() {
        for (Lifetime owner : Lifetime.values()) {
            for (Lifetime dependency : Lifetime.values()) {
                if (owner == Lifetime.SINGLETON && dependency == Lifetime.SCOPED) {
                    continue;
                }
                Assertions.assertTrue(owner.mayDependOn(dependency), owner + " -> " + dependency);
            }
        }
    }

    @Test
    public void nullDependencyIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Lifetime.SCOPED.mayDependOn(null));
    }
}

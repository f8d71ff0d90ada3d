package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ProviderFactoryHolder;

/**
 * Installed via {@link Class#forName(String)} from {@code :api} when needed.
 */
public final class ProviderFactoryBootstrap {

    static {
        ProviderFactoryHolder.set(new CoreProviderFactory());
    }

    private ProviderFactoryBootstrap() {
    }
}

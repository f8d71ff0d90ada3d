package com.tyron.nanodi.core.service;

import com.tyron.nanodi.api.service.ProviderFactory;
import com.tyron.nanodi.api.service.ServiceProvider;
import com.tyron.nanodi.api.service.ServiceProviderOptions;
import com.tyron.nanodi.api.service.ServiceRegistry;

public final class CoreProviderFactory implements ProviderFactory {

    @Override
    public ServiceRegistry.Builder newRegistryBuilder() {
        return new ServiceRegistryImpl.Builder();
    }

    @Override
    public ServiceProvider createProvider(ServiceRegistry registry, ServiceProviderOptions options) {
        return new DefaultServiceProvider(registry, options);
    }
}

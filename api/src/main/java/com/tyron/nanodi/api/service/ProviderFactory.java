package com.tyron.nanodi.api.service;

/**
 * Bridge between the static entry points of {@code :api} ({@link ServiceProvider#create}, {@link ServiceRegistry#builder()})
 * and the container implementation living in {@code :core}.
 */
public interface ProviderFactory {

    ServiceRegistry.Builder newRegistryBuilder();

    ServiceProvider createProvider(ServiceRegistry registry, ServiceProviderOptions options);
}

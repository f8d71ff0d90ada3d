package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.Nullable;

/**
 * Immutable provider options.
 * <p>
 * {@link #fromSystemProperties()} reads:
 * - nanodi.validateOnCacheHit=true|false
 * - nanodi.defaultScopeName=&lt;name&gt;
 */
public final class ServiceProviderOptions {

    public static final String VALIDATE_ON_CACHE_HIT_KEY = "nanodi.validateOnCacheHit";
    public static final String DEFAULT_SCOPE_NAME_KEY = "nanodi.defaultScopeName";

    private static final ServiceProviderOptions DEFAULTS = builder().build();

    private final boolean validateOnCacheHit;
    private final String defaultScopeName;

    private ServiceProviderOptions(Builder builder) {
        this.validateOnCacheHit = builder.validateOnCacheHit;
        this.defaultScopeName = builder.defaultScopeName;
    }

    public static ServiceProviderOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServiceProviderOptions fromSystemProperties() {
        String validate = System.getProperty(VALIDATE_ON_CACHE_HIT_KEY);
        String scopeName = System.getProperty(DEFAULT_SCOPE_NAME_KEY);

        Builder builder = builder();
        if (validate != null) {
            builder.validateOnCacheHit(Boolean.parseBoolean(validate.trim()));
        }
        if (scopeName != null && !scopeName.isBlank()) {
            builder.defaultScopeName(scopeName.trim());
        }
        return builder.build();
    }

    /**
     * Whether the lifetime check also runs when a cached instance is returned.
     * <p>
     * Off by default: the check runs only before a service is constructed, so a singleton constructed while a
     * scoped dependency is already cached in the current scope is not rejected.
     */
    public boolean isValidateOnCacheHit() {
        return validateOnCacheHit;
    }

    /**
     * @return the debug name given to every new scope, or null.
     */
    public @Nullable String getDefaultScopeName() {
        return defaultScopeName;
    }

    public Builder toBuilder() {
        return builder()
                .validateOnCacheHit(validateOnCacheHit)
                .defaultScopeName(defaultScopeName);
    }

    @Override
    public String toString() {
        return "ServiceProviderOptions{validateOnCacheHit=" + validateOnCacheHit
                + ", defaultScopeName=" + defaultScopeName + '}';
    }

    public static final class Builder {

        private boolean validateOnCacheHit;
        private String defaultScopeName;

        private Builder() {
        }

        public Builder validateOnCacheHit(boolean validateOnCacheHit) {
            this.validateOnCacheHit = validateOnCacheHit;
            return this;
        }

        public Builder defaultScopeName(@Nullable String defaultScopeName) {
            this.defaultScopeName = defaultScopeName;
            return this;
        }

        public ServiceProviderOptions build() {
            return new ServiceProviderOptions(this);
        }
    }
}

package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Ad-hoc entries merged into a {@link ServiceContext}, bypassing the registry.
 * <p>
 * A plain {@linkplain Builder#value value} is returned as is on every read. A {@linkplain Builder#computed
 * computed} entry is re-evaluated on every read.
 */
public final class ExoticContext {

    private final Map<String, Supplier<?>> entries;

    private ExoticContext(Map<String, Supplier<?>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ExoticContext of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        values.forEach(builder::value);
        return builder.build();
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(name);
    }

    public Object get(String name) {
        Supplier<?> supplier = entries.get(name);
        return supplier != null ? supplier.get() : null;
    }

    /**
     * @return the entry names, in insertion order.
     */
    public @NotNull Set<String> names() {
        return entries.keySet();
    }

    public static final class Builder {

        private final Map<String, Supplier<?>> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder value(String name, Object value) {
            checkName(name);
            entries.put(name, () -> value);
            return this;
        }

        public Builder computed(String name, Supplier<?> supplier) {
            checkName(name);
            if (supplier == null) throw new IllegalArgumentException("supplier == null");
            entries.put(name, supplier);
            return this;
        }

        public ExoticContext build() {
            return new ExoticContext(entries);
        }

        private static void checkName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name is blank");
            }
        }
    }
}

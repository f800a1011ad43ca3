package com.trading.sdg.api;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog mapping operation type ids to their {@link OperationMetadata}.
 * <p>
 * Built once at start-up and shared by reference between the compiler, the
 * transform manager and the orchestrator.
 */
public final class MetadataRegistry {

    private final Map<String, OperationMetadata> registry;

    private MetadataRegistry(Map<String, OperationMetadata> registry) {
        this.registry = Map.copyOf(registry);
    }

    public Optional<OperationMetadata> find(String type) {
        return Optional.ofNullable(registry.get(type));
    }

    /**
     * @throws IllegalArgumentException if the type is not registered.
     */
    public OperationMetadata get(String type) {
        OperationMetadata meta = registry.get(type);
        if (meta == null)
            throw new IllegalArgumentException("Unknown operation type: " + type);
        return meta;
    }

    public boolean contains(String type) {
        return registry.containsKey(type);
    }

    public Collection<OperationMetadata> all() {
        return registry.values();
    }

    public int size() {
        return registry.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, OperationMetadata> entries = new LinkedHashMap<>();

        public Builder register(OperationMetadata meta) {
            if (entries.putIfAbsent(meta.getType(), meta) != null)
                throw new IllegalArgumentException("Duplicate operation type: " + meta.getType());
            return this;
        }

        public Builder registerAll(Collection<OperationMetadata> metas) {
            for (OperationMetadata m : metas)
                register(m);
            return this;
        }

        public MetadataRegistry build() {
            return new MetadataRegistry(entries);
        }
    }
}

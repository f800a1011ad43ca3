package com.trading.sdg.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map from operation type id to the factory building its
 * {@link Transform}. Built once and passed by reference to the manager.
 */
public final class TransformCatalog {

    private final Map<String, TransformFactory> factories;

    private TransformCatalog(Map<String, TransformFactory> factories) {
        this.factories = Map.copyOf(factories);
    }

    public boolean contains(String type) {
        return factories.containsKey(type);
    }

    public Set<String> types() {
        return factories.keySet();
    }

    /**
     * @throws IllegalArgumentException if no factory is registered for the node's type.
     */
    public Transform create(ValidatedNode node) {
        TransformFactory f = factories.get(node.type());
        if (f == null)
            throw new IllegalArgumentException("No transform registered for type " + node.type()
                    + " in node " + node.id());
        return f.create(node);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, TransformFactory> factories = new LinkedHashMap<>();

        public Builder register(String type, TransformFactory factory) {
            if (factories.putIfAbsent(type, factory) != null)
                throw new IllegalArgumentException("Duplicate transform for type " + type);
            return this;
        }

        /** Same factory for several types, e.g. the typed variants of one operation. */
        public Builder register(TransformFactory factory, String... types) {
            for (String t : types)
                register(t, factory);
            return this;
        }

        public TransformCatalog build() {
            return new TransformCatalog(factories);
        }
    }
}

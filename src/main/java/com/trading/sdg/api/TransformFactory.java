package com.trading.sdg.api;

/** Creates the {@link Transform} for a validated node. */
@FunctionalInterface
public interface TransformFactory {
    Transform create(ValidatedNode node);
}

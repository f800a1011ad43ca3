package com.trading.sdg.fn;

/**
 * Row-wise computation over one numeric input.
 * <p>
 * Examples:
 * <ul>
 * <li>{@code x -> -x}</li>
 * <li>{@code Math::log}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    double apply(double a);
}

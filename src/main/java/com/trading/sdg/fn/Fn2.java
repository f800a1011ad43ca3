package com.trading.sdg.fn;

/**
 * Row-wise computation over two numeric inputs.
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (a, b) -> a + b}</li>
 * <li>{@code Math::pow}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2 {
    double apply(double a, double b);
}

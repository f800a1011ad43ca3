package com.trading.sdg.fn.finance;

import com.trading.sdg.fn.Fn1;

/**
 * Exponential Moving Average (EWMA).
 *
 * Formula:
 * y[t] = alpha * x[t] + (1 - alpha) * y[t-1]
 *
 * The first value seeds the state. NaN inputs return NaN and leave the
 * state untouched.
 */
public class Ewma implements Fn1 {
    private final double alpha;
    private double state;
    private boolean initialized = false;

    public Ewma(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("Alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    /** Span form used by period-based indicators: {@code alpha = 2 / (period + 1)}. */
    public static Ewma ofPeriod(int period) {
        if (period < 1)
            throw new IllegalArgumentException("Period must be >= 1");
        return new Ewma(2.0 / (period + 1));
    }

    @Override
    public double apply(double input) {
        if (Double.isNaN(input)) {
            return Double.NaN;
        }
        if (!initialized) {
            state = input;
            initialized = true;
            return state;
        }
        state = alpha * input + (1.0 - alpha) * state;
        return state;
    }
}

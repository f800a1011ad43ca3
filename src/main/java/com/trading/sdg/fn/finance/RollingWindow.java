package com.trading.sdg.fn.finance;

/**
 * Fixed-size window over the last {@code size} values, kept in a ring buffer
 * with a running sum.
 * <p>
 * Mean is O(1). Standard deviation subtracts the mean before squaring,
 * which avoids the cancellation of the {@code E[x^2] - mean^2} form when
 * prices are large relative to their variance.
 */
public class RollingWindow {
    private final double[] window;
    private final int size;
    private int head = 0;
    private int count = 0;
    private double sum = 0.0;

    public RollingWindow(int size) {
        if (size < 1)
            throw new IllegalArgumentException("Size must be >= 1");
        this.size = size;
        this.window = new double[size];
    }

    /** Adds a value, evicting the oldest once full. NaN is ignored. */
    public void add(double value) {
        if (Double.isNaN(value))
            return;
        if (count >= size)
            sum -= window[head];
        else
            count++;
        window[head] = value;
        sum += value;
        head++;
        if (head >= size)
            head = 0;
    }

    public boolean isFull() {
        return count == size;
    }

    public int count() {
        return count;
    }

    public double mean() {
        return count == 0 ? Double.NaN : sum / count;
    }

    /** Population standard deviation of the values in the window. */
    public double stdDev() {
        if (count < 2)
            return count == 1 ? 0.0 : Double.NaN;
        double mean = sum / count;
        double sq = 0.0;
        int start = (head + size - count) % size;
        for (int i = 0; i < count; i++) {
            double dev = window[(start + i) % size] - mean;
            sq += dev * dev;
        }
        return Math.sqrt(sq / count);
    }
}

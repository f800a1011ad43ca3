package com.trading.sdg.api;

/**
 * A typed constant. {@code value} is a {@link Long} for integers, a
 * {@link Double} for decimals, a {@link Boolean}, a {@link String}, a
 * {@link Long} epoch-millis for timestamps, or {@code null} for a typed null.
 */
public record Constant(DataType type, Object value) {

    public static Constant integer(long v) {
        return new Constant(DataType.INTEGER, v);
    }

    public static Constant decimal(double v) {
        return new Constant(DataType.DECIMAL, v);
    }

    public static Constant bool(boolean v) {
        return new Constant(DataType.BOOLEAN, v);
    }

    public static Constant string(String v) {
        return new Constant(DataType.STRING, v);
    }

    public static Constant timestamp(long epochMillis) {
        return new Constant(DataType.TIMESTAMP, epochMillis);
    }

    public static Constant nullOf(DataType type) {
        return new Constant(type, null);
    }

    public boolean isNull() {
        return value == null;
    }

    public double asDouble() {
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof Boolean b)
            return b ? 1.0 : 0.0;
        throw new IllegalStateException("Constant " + this + " is not numeric");
    }

    /** Non-zero numbers are true, zero is false. */
    public boolean asBoolean() {
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Number n)
            return n.doubleValue() != 0.0;
        throw new IllegalStateException("Constant " + this + " is not convertible to Boolean");
    }

    /** Stable textual form used for hashing and serialization. */
    public String canonical() {
        return type + ":" + (value == null ? "null" : value.toString());
    }

    @Override
    public String toString() {
        return canonical();
    }
}

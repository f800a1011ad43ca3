package com.trading.sdg.api;

/**
 * Typed value of a node option. Schema options hold their structure as JSON
 * text so that embedded node references can be rewritten textually.
 */
public record OptionValue(Kind kind, Object value) {

    public enum Kind {
        INTEGER, DECIMAL, BOOLEAN, STRING, SELECT, SCHEMA
    }

    public OptionValue {
        if (kind == null)
            throw new IllegalArgumentException("Option kind is required");
        if (value == null)
            throw new IllegalArgumentException("Option value is required");
    }

    public static OptionValue integer(long v) {
        return new OptionValue(Kind.INTEGER, v);
    }

    public static OptionValue decimal(double v) {
        return new OptionValue(Kind.DECIMAL, v);
    }

    public static OptionValue bool(boolean v) {
        return new OptionValue(Kind.BOOLEAN, v);
    }

    public static OptionValue string(String v) {
        return new OptionValue(Kind.STRING, v);
    }

    public static OptionValue select(String v) {
        return new OptionValue(Kind.SELECT, v);
    }

    public static OptionValue schema(String json) {
        return new OptionValue(Kind.SCHEMA, json);
    }

    public double asDouble() {
        if (value instanceof Number n)
            return n.doubleValue();
        return Double.parseDouble(value.toString());
    }

    public long asLong() {
        if (value instanceof Number n)
            return n.longValue();
        return Long.parseLong(value.toString());
    }

    public boolean asBoolean() {
        if (value instanceof Boolean b)
            return b;
        return Boolean.parseBoolean(value.toString());
    }

    public String asString() {
        return value.toString();
    }

    /** Stable textual form used for hashing. */
    public String canonical() {
        return kind + ":" + value;
    }

    @Override
    public String toString() {
        return canonical();
    }
}

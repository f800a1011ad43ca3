package com.trading.sdg.api;

/**
 * Value type carried by an input slot, output slot or literal.
 */
public enum DataType {
    BOOLEAN("Boolean"),
    INTEGER("Integer"),
    DECIMAL("Decimal"),
    NUMBER("Number"),
    STRING("String"),
    TIMESTAMP("Timestamp"),
    ANY("Any");

    private final String displayName;

    DataType(String displayName) {
        this.displayName = displayName;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL || this == NUMBER;
    }

    /**
     * Two types are compatible when either side is {@link #ANY}, they are equal,
     * or both are numeric.
     */
    public boolean isCompatibleWith(DataType other) {
        if (this == ANY || other == ANY || this == other)
            return true;
        return isNumeric() && other.isNumeric();
    }

    /** Suffix used by type-specialized operations such as lag and select. */
    public String kindSuffix() {
        return switch (this) {
            case BOOLEAN -> "boolean";
            case STRING -> "string";
            case TIMESTAMP -> "timestamp";
            default -> "number";
        };
    }

    public static DataType fromString(String s) {
        for (DataType t : values()) {
            if (t.displayName.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s))
                return t;
        }
        throw new IllegalArgumentException("Unknown data type: " + s);
    }

    @Override
    public String toString() {
        return displayName;
    }
}

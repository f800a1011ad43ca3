package com.trading.sdg.api;

/**
 * Declared input or output slot of an operation.
 *
 * @param id            handle name, e.g. {@code SLOT}, {@code SLOT0}, {@code c}.
 * @param type          value type.
 * @param required      whether an input must be wired (ignored for outputs).
 * @param allowMultiple whether the input accepts several values.
 */
public record IOSlot(String id, DataType type, boolean required, boolean allowMultiple) {

    public static IOSlot input(String id, DataType type) {
        return new IOSlot(id, type, true, false);
    }

    public static IOSlot output(String id, DataType type) {
        return new IOSlot(id, type, false, false);
    }

    /** Maps the script shorthand {@code *} to {@code SLOT} and {@code *N} to {@code SLOTN}. */
    public static String normalizeHandle(String handle) {
        if (handle.startsWith("*"))
            return "SLOT" + handle.substring(1);
        return handle;
    }
}

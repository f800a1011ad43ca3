package com.trading.sdg.api;

import java.util.List;

/**
 * Declared option of an operation with its validation rules.
 *
 * @param id            option key.
 * @param kind          value kind.
 * @param required      whether the option must be supplied (or defaulted).
 * @param defaultValue  value used when the option is omitted, may be null.
 * @param selectOptions allowed values for {@link OptionValue.Kind#SELECT}.
 * @param min           inclusive lower bound for numeric kinds, may be null.
 * @param max           inclusive upper bound for numeric kinds, may be null.
 */
public record OptionDefinition(String id, OptionValue.Kind kind, boolean required, OptionValue defaultValue,
        List<String> selectOptions, Double min, Double max) {

    public OptionDefinition {
        selectOptions = selectOptions == null ? List.of() : List.copyOf(selectOptions);
    }

    public static OptionDefinition required(String id, OptionValue.Kind kind) {
        return new OptionDefinition(id, kind, true, null, List.of(), null, null);
    }

    public static OptionDefinition optional(String id, OptionValue.Kind kind, OptionValue defaultValue) {
        return new OptionDefinition(id, kind, false, defaultValue, List.of(), null, null);
    }

    /**
     * Checks a value against kind, select list and bounds.
     *
     * @return an error message, or null when the value is valid.
     */
    public String check(OptionValue value) {
        if (value.kind() != kind)
            return "expected " + kind + " but got " + value.kind();
        if (kind == OptionValue.Kind.SELECT && !selectOptions.isEmpty()
                && !selectOptions.contains(value.asString()))
            return "value '" + value.asString() + "' is not one of " + selectOptions;
        if (kind == OptionValue.Kind.INTEGER || kind == OptionValue.Kind.DECIMAL) {
            double d = value.asDouble();
            if (min != null && d < min)
                return "value " + value.value() + " is below minimum " + min;
            if (max != null && d > max)
                return "value " + value.value() + " is above maximum " + max;
        }
        return null;
    }
}

package com.trading.sdg.fn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.data.Table;

/**
 * Row access shared by the built-in transforms. Inputs may be columns or
 * table scalars; both read the same through {@link #get}.
 */
final class Series {
    static final String RESULT = "result";
    static final String SLOT = "SLOT";
    static final String SLOT0 = "SLOT0";
    static final String SLOT1 = "SLOT1";

    private Series() {
    }

    /** Input value of a row, or null when the input is not wired. */
    static Object get(Table in, String name, int row) {
        return in.has(name) ? in.valueOrScalar(name, row) : null;
    }

    static Double number(Table in, String name, int row) {
        Object v = get(in, name, row);
        if (v == null)
            return null;
        double d = Table.toDouble(v);
        return Double.isNaN(d) ? null : d;
    }

    static Boolean bool(Table in, String name, int row) {
        Object v = get(in, name, row);
        if (v == null || v instanceof Boolean)
            return (Boolean) v;
        if (v instanceof Number n)
            return n.doubleValue() != 0.0;
        throw new IllegalArgumentException("Value is not boolean: " + v);
    }

    /** NaN stays out of result columns; it is reported as a missing value. */
    static Double finite(double d) {
        return Double.isNaN(d) ? null : d;
    }

    /** A result table on the input's index with one column per entry. */
    static Table result(Table in, Map<String, List<Object>> columns) {
        return Table.of(in.timestamps(), columns);
    }

    static Table result(Table in, List<Object> column) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        cols.put(RESULT, column);
        return result(in, cols);
    }
}

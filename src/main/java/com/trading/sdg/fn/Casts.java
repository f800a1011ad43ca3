package com.trading.sdg.fn;

import java.util.List;
import java.util.function.Function;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * Value conversions inserted by the compiler's type checker, and the
 * type-preserving {@code alias_*} and {@code boolean_select_*} families.
 */
final class Casts {

    private Casts() {
    }

    /** Maps {@code SLOT} row by row; nulls pass through. */
    static Transform map(Function<Object, Object> fn) {
        return in -> {
            List<Object> out = Table.columnOf(in.rowCount());
            for (int r = 0; r < in.rowCount(); r++) {
                Object v = Series.get(in, Series.SLOT, r);
                out.set(r, v == null ? null : fn.apply(v));
            }
            return Series.result(in, out);
        };
    }

    static Transform toBoolean() {
        return map(v -> v instanceof Boolean ? v : Table.toDouble(v) != 0.0);
    }

    static Transform toDecimal() {
        return map(v -> Series.finite(Table.toDouble(v)));
    }

    static Transform toInteger() {
        return map(v -> {
            double d = Table.toDouble(v);
            return Double.isNaN(d) ? null : (Object) (long) d;
        });
    }

    static Transform stringify() {
        return map(v -> v instanceof Boolean b ? (b ? "true" : "false") : String.valueOf(v));
    }

    static Transform alias() {
        return map(Function.identity());
    }

    /** {@code condition ? true : false}; a null condition yields null. */
    static Transform booleanSelect() {
        return in -> {
            List<Object> out = Table.columnOf(in.rowCount());
            for (int r = 0; r < in.rowCount(); r++) {
                Boolean c = Series.bool(in, "condition", r);
                if (c != null)
                    out.set(r, Series.get(in, c ? "true" : "false", r));
            }
            return Series.result(in, out);
        };
    }
}

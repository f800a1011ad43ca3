package com.trading.sdg.fn;

import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * Row-wise comparison of {@code SLOT0} with {@code SLOT1}. Numbers compare
 * numerically, other values by equality or natural order. Rows with a null
 * operand stay null.
 */
final class Comparison implements Transform {

    private final IntPredicate test;

    private Comparison(IntPredicate test) {
        this.test = test;
    }

    static Comparison of(String type) {
        return switch (type) {
            case "lt" -> new Comparison(c -> c < 0);
            case "gt" -> new Comparison(c -> c > 0);
            case "lte" -> new Comparison(c -> c <= 0);
            case "gte" -> new Comparison(c -> c >= 0);
            case "eq" -> new Comparison(c -> c == 0);
            case "neq" -> new Comparison(c -> c != 0);
            default -> throw new IllegalArgumentException("Not a comparison: " + type);
        };
    }

    @Override
    public Table transformData(Table in) {
        List<Object> out = Table.columnOf(in.rowCount());
        for (int r = 0; r < in.rowCount(); r++) {
            Object a = Series.get(in, Series.SLOT0, r);
            Object b = Series.get(in, Series.SLOT1, r);
            if (a == null || b == null)
                continue;
            out.set(r, test.test(compare(a, b)));
        }
        return Series.result(in, out);
    }

    @SuppressWarnings("unchecked")
    static int compare(Object a, Object b) {
        if ((a instanceof Number || a instanceof Boolean) && (b instanceof Number || b instanceof Boolean))
            return Double.compare(Table.toDouble(a), Table.toDouble(b));
        if (a instanceof Comparable<?> && a.getClass() == b.getClass())
            return ((Comparable<Object>) a).compareTo(b);
        return Objects.equals(a, b) ? 0 : String.valueOf(a).compareTo(String.valueOf(b));
    }
}

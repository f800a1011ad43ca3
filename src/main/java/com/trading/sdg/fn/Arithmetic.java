package com.trading.sdg.fn;

import java.util.List;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * Binary arithmetic over {@code SLOT0} and {@code SLOT1}. Integer operands
 * keep integer results for {@code + - * %}; everything else is decimal. A
 * null operand yields null, as does division by zero.
 */
final class Arithmetic implements Transform {

    private final Fn2 fn;
    private final boolean integral;

    private Arithmetic(Fn2 fn, boolean integral) {
        this.fn = fn;
        this.integral = integral;
    }

    static Arithmetic of(String type) {
        return switch (type) {
            case "add" -> new Arithmetic((a, b) -> a + b, true);
            case "sub" -> new Arithmetic((a, b) -> a - b, true);
            case "mul" -> new Arithmetic((a, b) -> a * b, true);
            case "div" -> new Arithmetic((a, b) -> b == 0.0 ? Double.NaN : a / b, false);
            case "modulo" -> new Arithmetic((a, b) -> b == 0.0 ? Double.NaN : a % b, true);
            case "power_op" -> new Arithmetic(Math::pow, false);
            default -> throw new IllegalArgumentException("Not an arithmetic operation: " + type);
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
            double v = fn.apply(Table.toDouble(a), Table.toDouble(b));
            if (Double.isNaN(v))
                continue;
            if (integral && a instanceof Long && b instanceof Long)
                out.set(r, (long) v);
            else
                out.set(r, v);
        }
        return Series.result(in, out);
    }
}

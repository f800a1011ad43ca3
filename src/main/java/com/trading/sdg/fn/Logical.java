package com.trading.sdg.fn;

import java.util.List;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/** {@code logical_and}, {@code logical_or} and {@code logical_not}; a null operand yields null. */
final class Logical implements Transform {

    enum Op {
        AND, OR, NOT
    }

    private final Op op;

    Logical(Op op) {
        this.op = op;
    }

    static Logical of(String type) {
        return switch (type) {
            case "logical_and" -> new Logical(Op.AND);
            case "logical_or" -> new Logical(Op.OR);
            case "logical_not" -> new Logical(Op.NOT);
            default -> throw new IllegalArgumentException("Not a logical operation: " + type);
        };
    }

    @Override
    public Table transformData(Table in) {
        List<Object> out = Table.columnOf(in.rowCount());
        for (int r = 0; r < in.rowCount(); r++) {
            if (op == Op.NOT) {
                Boolean v = Series.bool(in, Series.SLOT, r);
                out.set(r, v == null ? null : !v);
                continue;
            }
            Boolean a = Series.bool(in, Series.SLOT0, r);
            Boolean b = Series.bool(in, Series.SLOT1, r);
            if (a == null || b == null)
                continue;
            out.set(r, op == Op.AND ? a && b : a || b);
        }
        return Series.result(in, out);
    }
}

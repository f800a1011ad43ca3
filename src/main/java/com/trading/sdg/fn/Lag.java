package com.trading.sdg.fn;

import java.util.List;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * {@code x[n]}: the value {@code n} rows back. Negative periods look ahead.
 * Rows shifted in from outside the table are null.
 */
final class Lag implements Transform {
    private final int period;

    Lag(int period) {
        if (period == 0)
            throw new IllegalArgumentException("Lag period must be non-zero");
        this.period = period;
    }

    @Override
    public Table transformData(Table in) {
        int n = in.rowCount();
        List<Object> out = Table.columnOf(n);
        for (int r = 0; r < n; r++) {
            int src = r - period;
            if (src >= 0 && src < n)
                out.set(r, Series.get(in, Series.SLOT, src));
        }
        return Series.result(in, out);
    }
}

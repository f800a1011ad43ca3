package com.trading.sdg.fn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * Terminal node handing entry and exit signals to the backtester. Wired
 * signals are published as boolean columns, nulls read as false, so they
 * appear in the final output tables next to the data they were derived from.
 */
final class TradeSignalExecutor implements Transform {

    static final List<String> SIGNALS = List.of("enter_long", "enter_short", "exit_long", "exit_short");

    @Override
    public Table transformData(Table in) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        for (String signal : SIGNALS) {
            if (!in.has(signal))
                continue;
            List<Object> out = Table.columnOf(in.rowCount());
            for (int r = 0; r < in.rowCount(); r++)
                out.set(r, Boolean.TRUE.equals(Series.bool(in, signal, r)));
            cols.put(signal, out);
        }
        return Series.result(in, cols);
    }
}

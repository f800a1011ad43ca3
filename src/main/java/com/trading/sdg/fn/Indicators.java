package com.trading.sdg.fn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;
import com.trading.sdg.fn.finance.Ewma;
import com.trading.sdg.fn.finance.RollingWindow;

/**
 * Per-asset rolling indicators over {@code SLOT}. State is created per call,
 * so one transform instance can serve every asset of a run.
 */
final class Indicators {

    private Indicators() {
    }

    /** Simple moving average; null until {@code period} values were seen. */
    static Transform sma(int period) {
        return in -> {
            RollingWindow w = new RollingWindow(period);
            List<Object> out = Table.columnOf(in.rowCount());
            for (int r = 0; r < in.rowCount(); r++) {
                Double v = Series.number(in, Series.SLOT, r);
                if (v == null)
                    continue;
                w.add(v);
                if (w.isFull())
                    out.set(r, w.mean());
            }
            return Series.result(in, out);
        };
    }

    static Transform ema(int period) {
        return in -> {
            Ewma ewma = Ewma.ofPeriod(period);
            List<Object> out = Table.columnOf(in.rowCount());
            for (int r = 0; r < in.rowCount(); r++) {
                Double v = Series.number(in, Series.SLOT, r);
                if (v != null)
                    out.set(r, Series.finite(ewma.apply(v)));
            }
            return Series.result(in, out);
        };
    }

    /** Middle band is the SMA; outer bands are {@code stddev} population deviations away. */
    static Transform bbands(int period, double stddev) {
        return in -> {
            RollingWindow w = new RollingWindow(period);
            int n = in.rowCount();
            List<Object> lower = Table.columnOf(n), middle = Table.columnOf(n), upper = Table.columnOf(n);
            for (int r = 0; r < n; r++) {
                Double v = Series.number(in, Series.SLOT, r);
                if (v == null)
                    continue;
                w.add(v);
                if (!w.isFull())
                    continue;
                double mean = w.mean(), dev = w.stdDev() * stddev;
                lower.set(r, mean - dev);
                middle.set(r, mean);
                upper.set(r, mean + dev);
            }
            Map<String, List<Object>> cols = new LinkedHashMap<>();
            cols.put("bbands_lower", lower);
            cols.put("bbands_middle", middle);
            cols.put("bbands_upper", upper);
            return Series.result(in, cols);
        };
    }

    /**
     * Volume-weighted average price since the start of each UTC day:
     * {@code sum(price * volume) / sum(volume)}.
     */
    static Transform intradayVwap() {
        return in -> {
            List<Object> out = Table.columnOf(in.rowCount());
            long day = Long.MIN_VALUE;
            double pv = 0.0, vol = 0.0;
            for (int r = 0; r < in.rowCount(); r++) {
                long d = Math.floorDiv(in.timestamp(r), 86_400_000L);
                if (d != day) {
                    day = d;
                    pv = 0.0;
                    vol = 0.0;
                }
                Double p = Series.number(in, "price", r);
                Double v = Series.number(in, "volume", r);
                if (p == null || v == null)
                    continue;
                pv += p * v;
                vol += v;
                if (vol != 0.0)
                    out.set(r, pv / vol);
            }
            return Series.result(in, out);
        };
    }
}

package com.trading.sdg.fn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Transform;
import com.trading.sdg.data.Table;

/**
 * Standardizes each row across assets: {@code (x - mean) / stddev} over the
 * assets with a value in that row. Rows with fewer than two values, or no
 * dispersion, are null.
 */
final class CrossSectionalZScore implements Transform {

    private static final String PREFIX = Series.SLOT + "@";

    @Override
    public Table transformData(Table in) {
        List<String> inputs = new ArrayList<>();
        for (String col : in.columnNames()) {
            if (col.startsWith(PREFIX))
                inputs.add(col);
        }
        int n = in.rowCount();
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        for (String col : inputs)
            cols.put(Transform.assetColumn(Series.RESULT, col.substring(PREFIX.length())), Table.columnOf(n));

        double[] row = new double[inputs.size()];
        for (int r = 0; r < n; r++) {
            int count = 0;
            double sum = 0.0;
            for (int i = 0; i < inputs.size(); i++) {
                Double v = Series.number(in, inputs.get(i), r);
                row[i] = v == null ? Double.NaN : v;
                if (v != null) {
                    count++;
                    sum += v;
                }
            }
            if (count < 2)
                continue;
            double mean = sum / count, sq = 0.0;
            for (double v : row) {
                if (!Double.isNaN(v))
                    sq += (v - mean) * (v - mean);
            }
            double sd = Math.sqrt(sq / count);
            if (sd == 0.0)
                continue;
            for (int i = 0; i < inputs.size(); i++) {
                if (!Double.isNaN(row[i])) {
                    String asset = inputs.get(i).substring(PREFIX.length());
                    cols.get(Transform.assetColumn(Series.RESULT, asset)).set(r, (row[i] - mean) / sd);
                }
            }
        }
        return Series.result(in, cols);
    }
}

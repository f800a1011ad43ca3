package com.trading.sdg.fn;

import java.util.Map;

import com.trading.sdg.api.Transform;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;

/** One summary card aggregating {@code SLOT} over the asset's rows. */
final class NumericCardsReport implements Transform {

    private final String title;
    private final String category;
    private final String agg;

    NumericCardsReport(ValidatedNode node) {
        this.title = node.getString("title", "Summary");
        this.category = node.getString("category", "Statistics");
        this.agg = node.getString("agg", "last");
    }

    @Override
    public Table transformData(Table in) {
        return Table.of(in.timestamps(), Map.of());
    }

    @Override
    public Report getDashboard(Table in) {
        Object value = aggregate(in);
        return new Report().addCard(new Report.Card(category, title, value));
    }

    Object aggregate(Table in) {
        int count = 0;
        double sum = 0.0, min = Double.NaN, max = Double.NaN, last = Double.NaN;
        for (int r = 0; r < in.rowCount(); r++) {
            Double v = Series.number(in, Series.SLOT, r);
            if (v == null)
                continue;
            count++;
            sum += v;
            min = Double.isNaN(min) ? v : Math.min(min, v);
            max = Double.isNaN(max) ? v : Math.max(max, v);
            last = v;
        }
        return switch (agg) {
            case "count" -> (long) count;
            case "sum" -> sum;
            case "mean" -> count == 0 ? null : sum / count;
            case "min" -> Series.finite(min);
            case "max" -> Series.finite(max);
            case "last" -> Series.finite(last);
            default -> throw new IllegalArgumentException("Unknown aggregation '" + agg + "'");
        };
    }
}

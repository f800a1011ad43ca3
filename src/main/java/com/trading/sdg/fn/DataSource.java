package com.trading.sdg.fn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Transform;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.Table;
import com.trading.sdg.engine.InsufficientDataException;

/**
 * Exposes base columns as node outputs. The orchestrator hands over the base
 * table filtered to {@link #getRequiredDataSources()}; each source column is
 * published under the matching output handle.
 */
final class DataSource implements Transform {

    private final List<String> sources;
    private final List<String> handles;

    private DataSource(List<String> sources, List<String> handles) {
        if (sources.size() != handles.size())
            throw new IllegalArgumentException("Sources " + sources + " do not match outputs " + handles);
        this.sources = List.copyOf(sources);
        this.handles = List.copyOf(handles);
    }

    /** OHLCV bars: base columns {@code o h l c v}, published under the same names. */
    static DataSource marketData(ValidatedNode node) {
        List<String> cols = node.metadata().getRequiredDataSources();
        return new DataSource(cols, cols);
    }

    /** One macro series, read from {@code ECON:<category>} and published as {@code value}. */
    static DataSource economicIndicator(ValidatedNode node) {
        return new DataSource(node.expandPlaceholders(node.metadata().getRequiredDataSources()), List.of("value"));
    }

    @Override
    public List<String> getRequiredDataSources() {
        return sources;
    }

    @Override
    public Table transformData(Table in) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        for (int i = 0; i < sources.size(); i++) {
            if (!in.hasColumn(sources.get(i)))
                throw new InsufficientDataException("Base data has no column '" + sources.get(i) + "'");
            cols.put(handles.get(i), in.column(sources.get(i)));
        }
        return Series.result(in, cols);
    }
}

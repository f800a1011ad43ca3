package com.trading.sdg.data;

import java.util.List;

/**
 * Chart annotation derived from the rows of a table where a condition held.
 *
 * @param title      marker title.
 * @param icon       icon hint for the chart, may be null.
 * @param columns    columns shown when a marker is inspected.
 * @param timestamps epoch-millis of the flagged rows.
 */
public record EventMarkerData(String title, String icon, List<String> columns, List<Long> timestamps) {

    public EventMarkerData {
        columns = columns == null ? List.of() : List.copyOf(columns);
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
    }
}

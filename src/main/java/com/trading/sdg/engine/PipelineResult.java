package com.trading.sdg.engine;

import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Timeframe;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;

/**
 * Everything one orchestrator run produced.
 *
 * @param tables       per timeframe and asset: base columns plus every node output column.
 * @param reports      per asset (or {@code ALL}) merged dashboard.
 * @param eventMarkers per asset chart markers.
 * @param errorMessage first fatal error for FAILED runs, otherwise null.
 */
public record PipelineResult(Status status, Map<Timeframe, Map<String, Table>> tables, Map<String, Report> reports,
        Map<String, List<EventMarkerData>> eventMarkers, ExecutionSummary summary, String errorMessage) {

    public enum Status {
        COMPLETED, FAILED, CANCELLED
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    /** Output table of one asset at one timeframe, or null. */
    public Table table(Timeframe timeframe, String asset) {
        Map<String, Table> byAsset = tables.get(timeframe);
        return byAsset == null ? null : byAsset.get(asset);
    }
}

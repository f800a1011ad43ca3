package com.trading.sdg.api;

import java.util.List;

import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;

/**
 * Executable instance of one operation, created per validated node.
 * <p>
 * The input table carries one column per wired input, named by the input
 * handle ({@code SLOT0}, {@code c}, ...). Inputs that take several values are
 * named {@code handle[i]}. Literal and scalar inputs arrive as table scalars.
 * The returned table names its columns by output handle; the orchestrator
 * prefixes them with the node id.
 * <p>
 * Cross-sectional operations receive every asset at once: each column is
 * named {@code handle@asset} (see {@link #assetColumn}) and results must use
 * the same scheme.
 */
@FunctionalInterface
public interface Transform {

    Table transformData(Table input);

    /** Dashboard for reporter operations, computed from the transform's input. */
    default Report getDashboard(Table input) {
        return null;
    }

    /** Chart markers for event-marker operations, computed from the transform's input. */
    default EventMarkerData getEventMarkers(Table input) {
        return null;
    }

    /**
     * Base columns read by operations without node-reference inputs. Entries
     * may contain {@code {option}} placeholders.
     */
    default List<String> getRequiredDataSources() {
        return List.of();
    }

    /** Column name of one asset's value in a cross-sectional table. */
    static String assetColumn(String handle, String asset) {
        return handle + "@" + asset;
    }
}

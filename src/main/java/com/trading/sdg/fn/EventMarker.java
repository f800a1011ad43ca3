package com.trading.sdg.fn;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Transform;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Table;

/**
 * Flags the rows where the schema's {@code select_key} column is true and
 * turns them into chart markers.
 * <p>
 * The schema names columns by node output ({@code "<node_id>#<handle>"}),
 * each of which must also be wired into {@code SLOT}:
 *
 * <pre>
 * {"title": "Breakout", "icon": "flag", "select_key": "gt_0#result",
 *  "schemas": [{"column_id": "src#c"}]}
 * </pre>
 */
final class EventMarker implements Transform {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Schema {
        public String title;
        public String icon;
        @JsonProperty("select_key")
        public String selectKey;
        public List<ColumnSchema> schemas = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ColumnSchema {
        @JsonProperty("column_id")
        public String columnId;
    }

    private final Schema schema;
    private final Map<String, String> inputColumns = new HashMap<>();

    EventMarker(ValidatedNode node) {
        this.schema = parse(node.getString("schema", "{}"), node.id());
        for (var e : node.inputs().entrySet()) {
            List<InputValue> values = e.getValue();
            for (int i = 0; i < values.size(); i++)
                inputColumns.put(values.get(i).canonical(), ValidatedNode.inputColumn(e.getKey(), i, values.size()));
        }
        if (schema.selectKey == null || !inputColumns.containsKey(schema.selectKey))
            throw new IllegalArgumentException("Event marker '" + node.id() + "' selects '" + schema.selectKey
                    + "', which is not wired into the node");
    }

    static Schema parse(String json, String nodeId) {
        try {
            return MAPPER.readValue(json, Schema.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid event marker schema on node '" + nodeId + "'", e);
        }
    }

    @Override
    public Table transformData(Table in) {
        return Table.of(in.timestamps(), Map.of());
    }

    @Override
    public EventMarkerData getEventMarkers(Table in) {
        String select = inputColumns.get(schema.selectKey);
        List<Long> flagged = new ArrayList<>();
        for (int r = 0; r < in.rowCount(); r++) {
            if (Boolean.TRUE.equals(Series.bool(in, select, r)))
                flagged.add(in.timestamp(r));
        }
        List<String> columns = new ArrayList<>();
        for (ColumnSchema c : schema.schemas)
            columns.add(c.columnId);
        return new EventMarkerData(schema.title, schema.icon, columns, flagged);
    }
}

package com.trading.sdg.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Session;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;

import lombok.extern.log4j.Log4j2;

/**
 * Thread-safe store of base data and node outputs for one run.
 * <p>
 * Series outputs are kept per timeframe, asset and output column. Global
 * scalars (one value for the whole run) and per-asset scalars are kept apart
 * and reach consumers as table scalars rather than broadcast columns.
 */
@Log4j2
public final class IntermediateStorage {

    /** Report and marker key used by cross-sectional nodes. */
    public static final String ALL_ASSETS = "ALL";

    // ConcurrentHashMap rejects null values
    private static final Object NULL = new Object();

    private final Map<Timeframe, Map<String, Table>> baseData = new ConcurrentHashMap<>();
    private final Map<Timeframe, Map<String, Map<String, Table>>> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> scalars = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> assetScalars = new ConcurrentHashMap<>();
    private final Map<String, ValidatedNode> producers = new ConcurrentHashMap<>();
    // Keyed by registration rank so read-back follows execution order, not completion order
    private final Map<String, Integer> ranks = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Integer, Report>> reports = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Integer, EventMarkerData>> markers = new ConcurrentHashMap<>();
    private final List<String> assetIds = new ArrayList<>();

    /**
     * Loads the externally supplied tables. Assets outside {@code allowedAssets}
     * are ignored; a null set keeps every asset.
     */
    public void initializeBaseData(Map<Timeframe, Map<String, Table>> data, Set<String> allowedAssets) {
        Set<String> ids = new LinkedHashSet<>();
        for (var tf : data.entrySet()) {
            Map<String, Table> perAsset = new ConcurrentHashMap<>();
            for (var e : tf.getValue().entrySet()) {
                if (allowedAssets == null || allowedAssets.contains(e.getKey())) {
                    perAsset.put(e.getKey(), e.getValue());
                    ids.add(e.getKey());
                }
            }
            baseData.put(tf.getKey(), perAsset);
        }
        if (allowedAssets != null)
            ids.addAll(allowedAssets);
        synchronized (assetIds) {
            assetIds.clear();
            assetIds.addAll(ids);
        }
    }

    public List<String> assetIds() {
        synchronized (assetIds) {
            return List.copyOf(assetIds);
        }
    }

    /** Registers a node; call in execution order. */
    public void register(ValidatedNode node) {
        ranks.putIfAbsent(node.id(), ranks.size());
        for (String out : node.outputIds())
            producers.put(out, node);
    }

    // ── Gathering ───────────────────────────────────────────────────

    /**
     * Builds the input table of {@code node} for one asset: one column per
     * wired reference, aligned as-of onto the node's timeframe index, with
     * literals and scalars attached as table scalars. Nodes without references
     * read the base columns named by {@code dataSources} (all base columns when
     * empty).
     *
     * @return empty if an upstream output is absent for this asset.
     * @throws InsufficientDataException if base data for the node's timeframe is missing.
     */
    public Optional<Table> gatherInputs(String asset, ValidatedNode node, List<String> dataSources) {
        Table base = base(node.timeframe(), asset, node);
        long[] index = base.timestamps();
        Table in;
        if (node.hasNodeReferences())
            in = Table.of(index, Map.of());
        else
            in = dataSources.isEmpty() ? base : base.select(dataSources);
        for (var e : node.inputs().entrySet()) {
            List<InputValue> values = e.getValue();
            for (int i = 0; i < values.size(); i++) {
                String col = ValidatedNode.inputColumn(e.getKey(), i, values.size());
                Optional<Table> next = attach(in, col, values.get(i), asset, index);
                if (next.isEmpty())
                    return Optional.empty();
                in = next.get();
            }
        }
        return Optional.of(node.session() == null ? in : sliceToSession(in, node.session()));
    }

    /** Input table of a node that does not depend on an asset: literals only. */
    public Table gatherScalarInputs(ValidatedNode node) {
        Table in = Table.singleRow(Map.of());
        for (var e : node.inputs().entrySet()) {
            List<InputValue> values = e.getValue();
            for (int i = 0; i < values.size(); i++) {
                String col = ValidatedNode.inputColumn(e.getKey(), i, values.size());
                InputValue v = values.get(i);
                if (v instanceof InputValue.Literal l)
                    in = in.withScalar(col, l.value().value());
                else if (scalars.containsKey(v.canonical()))
                    in = in.withScalar(col, unwrap(scalars.get(v.canonical())));
            }
        }
        return in;
    }

    private Optional<Table> attach(Table in, String col, InputValue value, String asset, long[] index) {
        if (value instanceof InputValue.Literal l)
            return Optional.of(in.withScalar(col, l.value().value()));
        String outputId = value.canonical();
        if (scalars.containsKey(outputId))
            return Optional.of(in.withScalar(col, unwrap(scalars.get(outputId))));
        Map<String, Object> perAsset = assetScalars.get(outputId);
        if (perAsset != null) {
            Object v = perAsset.get(asset);
            return v == null ? Optional.empty() : Optional.of(in.withScalar(col, v));
        }
        Table series = output(outputId, asset);
        if (series == null)
            return Optional.empty();
        Table aligned = series.alignTo(index);
        return Optional.of(in.withColumn(col, aligned.column(outputId)));
    }

    private Table base(Timeframe tf, String asset, ValidatedNode node) {
        Map<String, Table> perAsset = baseData.get(tf);
        if (perAsset == null)
            throw new InsufficientDataException("No base data at timeframe " + tf + " for node '" + node.id() + "'");
        Table t = perAsset.get(asset);
        if (t == null)
            throw new InsufficientDataException("No base data for asset " + asset + " at timeframe " + tf
                    + " (node '" + node.id() + "')");
        return t;
    }

    private Table output(String outputId, String asset) {
        ValidatedNode producer = producers.get(outputId);
        Map<String, Map<String, Table>> byAsset = producer == null ? null : cache.get(producer.timeframe());
        Map<String, Table> cols = byAsset == null ? null : byAsset.get(asset);
        return cols == null ? null : cols.get(outputId);
    }

    /** Keeps rows whose local time in the session's zone falls inside the session. */
    static Table sliceToSession(Table t, Session s) {
        return t.filterTimestamps(ts -> s.contains(Instant.ofEpochMilli(ts).atZone(s.zone()).toLocalTime()));
    }

    // ── Storing ─────────────────────────────────────────────────────

    /**
     * Stores every column of a transform result under {@code <node>#<column>}.
     */
    public void storeOutputs(String asset, ValidatedNode node, Table result) {
        Map<String, Table> cols = cache.computeIfAbsent(node.timeframe(), k -> new ConcurrentHashMap<>())
                .computeIfAbsent(asset, k -> new ConcurrentHashMap<>());
        for (String handle : result.columnNames()) {
            String outputId = node.outputId(handle);
            cols.put(outputId, result.select(List.of(handle)).rename(handle, outputId));
        }
    }

    /** Stores an already named series column. */
    public void storeColumn(String asset, ValidatedNode node, String outputId, Table column) {
        cache.computeIfAbsent(node.timeframe(), k -> new ConcurrentHashMap<>())
                .computeIfAbsent(asset, k -> new ConcurrentHashMap<>())
                .put(outputId, column);
    }

    public void storeScalar(String outputId, Object value) {
        scalars.put(outputId, value == null ? NULL : value);
    }

    public void storeAssetScalar(String asset, String outputId, Object value) {
        assetScalars.computeIfAbsent(outputId, k -> new ConcurrentHashMap<>()).put(asset, value);
    }

    public boolean hasScalar(String outputId) {
        return scalars.containsKey(outputId);
    }

    /** Stored scalar value; null both for absent and null scalars. */
    public Object scalar(String outputId) {
        return unwrap(scalars.get(outputId));
    }

    private static Object unwrap(Object stored) {
        return stored == NULL ? null : stored;
    }

    public Optional<Object> assetScalar(String asset, String outputId) {
        Map<String, Object> perAsset = assetScalars.get(outputId);
        return Optional.ofNullable(perAsset == null ? null : perAsset.get(asset));
    }

    /**
     * Stores the report of {@code node} under the key. Reports of several
     * nodes under one key are merged in registration order on read-back.
     */
    public void storeReport(String key, ValidatedNode node, Report report) {
        reports.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>()).put(rank(node), report.copy());
    }

    public void storeEventMarker(String key, ValidatedNode node, EventMarkerData marker) {
        markers.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>()).put(rank(node), marker);
    }

    private int rank(ValidatedNode node) {
        Integer r = ranks.get(node.id());
        if (r == null)
            throw new IllegalStateException("Node '" + node.id() + "' is not registered");
        return r;
    }

    // ── Read-back ───────────────────────────────────────────────────

    /** Base tables joined with every stored output column. */
    public Map<Timeframe, Map<String, Table>> buildFinalOutput() {
        Map<Timeframe, Map<String, Table>> out = new LinkedHashMap<>();
        Set<Timeframe> tfs = new LinkedHashSet<>(baseData.keySet());
        tfs.addAll(cache.keySet());
        for (Timeframe tf : tfs) {
            Map<String, Table> perAsset = new LinkedHashMap<>();
            Map<String, Table> base = baseData.getOrDefault(tf, Map.of());
            Map<String, Map<String, Table>> outputs = cache.getOrDefault(tf, Map.of());
            Set<String> assets = new LinkedHashSet<>(base.keySet());
            assets.addAll(outputs.keySet());
            for (String asset : assets) {
                Table t = base.getOrDefault(asset, Table.empty());
                Map<String, Table> cols = outputs.get(asset);
                if (cols != null) {
                    for (String name : new TreeSet<>(cols.keySet()))
                        t = t.join(cols.get(name));
                }
                perAsset.put(asset, t);
            }
            out.put(tf, perAsset);
        }
        return out;
    }

    /** Copies of the stored reports with card groups assigned. */
    public Map<String, Report> reports() {
        Map<String, Report> out = new LinkedHashMap<>();
        for (String key : new TreeSet<>(reports.keySet())) {
            Report r = new Report();
            for (Report part : reports.get(key).values())
                r.mergeFrom(part);
            r.assignCardGroups();
            out.put(key, r);
        }
        return out;
    }

    public Map<String, List<EventMarkerData>> eventMarkers() {
        Map<String, List<EventMarkerData>> out = new LinkedHashMap<>();
        for (String key : new TreeSet<>(markers.keySet()))
            out.put(key, List.copyOf(markers.get(key).values()));
        return out;
    }
}

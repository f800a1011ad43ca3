package com.trading.sdg.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.trading.sdg.api.AssetDescriptor;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.Transform;
import com.trading.sdg.api.TransformCatalog;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.config.OrchestratorConfig;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;
import com.trading.sdg.events.DisruptorEventSink;
import com.trading.sdg.events.EventSink;
import com.trading.sdg.events.OrchestratorEvent;
import com.trading.sdg.util.ErrorRateLimiter;

/**
 * Executes a validated graph over per-asset, per-timeframe tables.
 * <p>
 * Every (node, asset) pair is one unit of work, chained with
 * {@link CompletableFuture}s onto the units it reads from, so assets progress
 * independently on a fixed worker pool and each unit runs exactly once.
 * Cross-sectional nodes and global scalars run as a single unit that waits for
 * all assets of their producers, which makes them barriers.
 * <p>
 * A failure is recorded for its (node, asset) pair. Under
 * {@link OrchestratorConfig.FailurePolicy#ISOLATE} only units of the same asset
 * that read the failed node are skipped; under
 * {@link OrchestratorConfig.FailurePolicy#FAIL_FAST} the run stops.
 */
public final class DataflowOrchestrator {
    private static final Logger log = LogManager.getLogger(DataflowOrchestrator.class);

    static final String ASSET_REF_PASSTHROUGH = "asset_ref_passthrough";
    static final String IS_ASSET_REF = "is_asset_ref";
    static final List<String> ASSET_FILTER_KEYS = List.of("ticker", "asset_class", "sector", "industry",
            "base_currency", "counter_currency");

    private static final String ALL = IntermediateStorage.ALL_ASSETS;

    private final List<ValidatedNode> nodes;
    private final TopologicalOrder topology;
    private final Map<String, Transform> transforms;
    private final OrchestratorConfig config;
    private final EventSink events;
    private final CancellationToken cancellation = new CancellationToken();
    private final ErrorRateLimiter failureLog;

    /**
     * @throws IllegalArgumentException if the catalog lacks an operation type.
     * @throws IllegalStateException    if a node references a node that is not
     *                                  part of the graph.
     */
    public DataflowOrchestrator(TransformManager manager, TransformCatalog catalog, OrchestratorConfig config,
            EventSink events) {
        this.config = config.validate();
        this.events = events != null ? events : EventSink.NOOP;
        this.failureLog = new ErrorRateLimiter(log, config.getErrorLogIntervalMillis());
        this.transforms = manager.buildTransforms(catalog);

        TopologicalOrder.Builder b = TopologicalOrder.builder();
        Map<String, ValidatedNode> byId = new LinkedHashMap<>();
        for (ValidatedNode n : manager.nodes()) {
            if (byId.put(n.id(), n) != null)
                throw new IllegalStateException("Duplicate transform id '" + n.id() + "'");
            b.addNode(n.id());
        }
        for (ValidatedNode n : manager.nodes()) {
            for (String ref : n.referencedNodeIds()) {
                if (!byId.containsKey(ref))
                    throw new IllegalStateException("Node '" + n.id() + "' reads from unknown node '" + ref + "'");
                b.addEdge(ref, n.id());
            }
        }
        this.topology = b.build();
        List<ValidatedNode> ordered = new ArrayList<>(byId.size());
        for (String id : topology.ids())
            ordered.add(byId.get(id));
        this.nodes = List.copyOf(ordered);
    }

    public DataflowOrchestrator(TransformManager manager, TransformCatalog catalog) {
        this(manager, catalog, OrchestratorConfig.defaults(), EventSink.NOOP);
    }

    // ── Cancellation ────────────────────────────────────────────────

    /** Requests cancellation of the current run; remaining units are reported as skipped. */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancelled();
    }

    public void resetCancellation() {
        cancellation.reset();
    }

    public CancellationToken cancellationToken() {
        return cancellation;
    }

    /** Nodes in execution order. */
    public List<ValidatedNode> nodes() {
        return nodes;
    }

    // ── Execution ───────────────────────────────────────────────────

    public PipelineResult execute(Map<Timeframe, Map<String, Table>> data) {
        return execute(data, null);
    }

    /**
     * Runs the graph once.
     *
     * @param data   initial tables per timeframe and asset.
     * @param assets asset universe; null means every asset present in {@code data}.
     */
    public PipelineResult execute(Map<Timeframe, Map<String, Table>> data, Set<String> assets) {
        cancellation.reset();
        DisruptorEventSink async = config.isAsyncEvents()
                ? new DisruptorEventSink(events, config.getEventBufferSize()) : null;
        ExecutorService pool = Executors.newFixedThreadPool(config.getParallelism(), DaemonThreadFactory.INSTANCE);
        try {
            Run run = new Run(async != null ? async : events, pool);
            run.storage.initializeBaseData(data, assets);
            for (ValidatedNode n : nodes)
                run.storage.register(n);
            return run.execute();
        } finally {
            pool.shutdown();
            if (async != null)
                async.close();
        }
    }

    /** State of one {@link #execute} call. */
    private final class Run {
        final IntermediateStorage storage = new IntermediateStorage();
        final EventSink sink;
        final ExecutorService pool;
        final ConcurrentLinkedQueue<NodeOutcome> outcomes = new ConcurrentLinkedQueue<>();
        final Map<String, NodeState> states = new ConcurrentHashMap<>();
        final Set<String> running = ConcurrentHashMap.newKeySet();
        final AtomicInteger completedNodes = new AtomicInteger();
        final AtomicLong lastProgress = new AtomicLong();
        final AtomicReference<String> fatalError = new AtomicReference<>();
        long startNanos;

        Run(EventSink sink, ExecutorService pool) {
            this.sink = sink;
            this.pool = pool;
        }

        PipelineResult execute() {
            startNanos = System.nanoTime();
            List<String> assets = storage.assetIds();
            List<String> ids = topology.ids();
            log.info("Pipeline started: {} nodes, {} assets", nodes.size(), assets.size());
            sink.emit(new OrchestratorEvent.PipelineStarted(now(), nodes.size(), assets.size(), ids));

            List<CompletableFuture<Void>> all = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i++) {
                ValidatedNode node = nodes.get(i);
                NodeState st = new NodeState(node, i, isPerAsset(node), assets.size());
                states.put(node.id(), st);
                if (st.perAsset) {
                    st.pending.set(assets.size());
                    for (String asset : assets)
                        st.futures.put(asset, schedule(dependenciesOf(node, asset), () -> runAssetUnit(st, asset)));
                } else {
                    st.pending.set(1);
                    Runnable unit = node.isCrossSectional() ? () -> runCrossSectionalUnit(st, assets)
                            : () -> runGlobalScalarUnit(st);
                    st.futures.put(ALL, schedule(dependenciesOf(node, null), unit));
                }
                if (st.pending.get() == 0)
                    finishNode(st);
                all.addAll(st.futures.values());
            }
            CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();
            return finish(ids);
        }

        private CompletableFuture<Void> schedule(List<CompletableFuture<Void>> deps, Runnable unit) {
            if (deps.isEmpty())
                return CompletableFuture.runAsync(unit, pool);
            return CompletableFuture.allOf(deps.toArray(new CompletableFuture[0])).thenRunAsync(unit, pool);
        }

        /** Futures a unit waits for; {@code asset == null} means every asset. */
        private List<CompletableFuture<Void>> dependenciesOf(ValidatedNode node, String asset) {
            List<CompletableFuture<Void>> deps = new ArrayList<>();
            for (String ref : node.referencedNodeIds()) {
                NodeState parent = states.get(ref);
                if (asset != null && parent.perAsset)
                    deps.add(parent.futures.get(asset));
                else if (asset != null)
                    deps.add(parent.futures.get(ALL));
                else
                    deps.addAll(parent.futures.values());
            }
            return deps;
        }

        private boolean upstreamFailed(ValidatedNode node, String asset) {
            for (String ref : node.referencedNodeIds()) {
                NodeState parent = states.get(ref);
                if (parent.failedFor.contains(parent.perAsset ? asset : ALL))
                    return true;
            }
            return false;
        }

        // ── Units ───────────────────────────────────────────────────

        private void runAssetUnit(NodeState st, String asset) {
            ValidatedNode node = st.node;
            try {
                if (!precheck(st, asset))
                    return;
                if (upstreamFailed(node, asset)) {
                    st.failedFor.add(asset);
                    skip(st, asset, RuntimeErrorKind.UPSTREAM_FAILURE, "An upstream node failed for " + asset);
                    return;
                }
                markStarted(st);
                switch (node.type()) {
                    case IS_ASSET_REF -> {
                        boolean match = AssetDescriptor.fromId(asset).matches(assetFilters(node));
                        storage.storeAssetScalar(asset, node.outputId("result"), match);
                    }
                    case ASSET_REF_PASSTHROUGH -> {
                        Optional<Table> in = storage.gatherInputs(asset, node, List.of());
                        if (in.isEmpty()) {
                            skip(st, asset, RuntimeErrorKind.INSUFFICIENT_INPUT_DATA, "Input not available");
                            return;
                        }
                        if (AssetDescriptor.fromId(asset).matches(assetFilters(node))) {
                            String out = node.outputId("result");
                            String col = passthroughColumn(node);
                            storage.storeColumn(asset, node, out, in.get().select(List.of(col)).rename(col, out));
                        }
                    }
                    default -> {
                        Transform transform = transforms.get(node.id());
                        List<String> sources = node.expandPlaceholders(transform.getRequiredDataSources());
                        Optional<Table> in = storage.gatherInputs(asset, node, sources);
                        if (in.isEmpty()) {
                            skip(st, asset, RuntimeErrorKind.INSUFFICIENT_INPUT_DATA, "Input not available");
                            return;
                        }
                        Table out = transform.transformData(in.get());
                        storage.storeOutputs(asset, node, out);
                        capture(node, transform, in.get(), asset);
                    }
                }
                succeed(st, asset);
            } catch (InsufficientDataException e) {
                fail(st, asset, RuntimeErrorKind.INSUFFICIENT_INPUT_DATA, e);
            } catch (OperationCancelledException e) {
                skip(st, asset, RuntimeErrorKind.CANCELLED, e.getMessage());
            } catch (RuntimeException e) {
                fail(st, asset, RuntimeErrorKind.NODE_EXECUTION_FAILURE, e);
            } finally {
                unitDone(st);
            }
        }

        private void runCrossSectionalUnit(NodeState st, List<String> assets) {
            ValidatedNode node = st.node;
            try {
                if (!precheck(st, ALL))
                    return;
                Transform transform = transforms.get(node.id());
                List<String> sources = node.expandPlaceholders(transform.getRequiredDataSources());
                Map<String, long[]> indexes = new LinkedHashMap<>();
                Table union = Table.empty();
                for (String asset : assets) {
                    if (upstreamFailed(node, asset))
                        continue;
                    Optional<Table> in;
                    try {
                        in = storage.gatherInputs(asset, node, sources);
                    } catch (InsufficientDataException e) {
                        log.debug("Cross-sectional node {} leaves out {}: {}", node.id(), asset, e.getMessage());
                        continue;
                    }
                    if (in.isEmpty())
                        continue;
                    Table t = in.get();
                    for (String col : t.columnNames())
                        t = t.rename(col, Transform.assetColumn(col, asset));
                    union = union.join(t);
                    indexes.put(asset, in.get().timestamps());
                }
                if (indexes.isEmpty()) {
                    skip(st, ALL, RuntimeErrorKind.INSUFFICIENT_INPUT_DATA, "No asset has inputs available");
                    return;
                }
                markStarted(st);
                Table out = transform.transformData(union);
                for (var e : indexes.entrySet()) {
                    String suffix = "@" + e.getKey();
                    for (String col : out.columnNames()) {
                        if (!col.endsWith(suffix))
                            continue;
                        String outputId = node.outputId(col.substring(0, col.length() - suffix.length()));
                        Table series = out.select(List.of(col)).rename(col, outputId).alignTo(e.getValue());
                        storage.storeColumn(e.getKey(), node, outputId, series);
                    }
                }
                capture(node, transform, union, ALL);
                succeed(st, ALL);
            } catch (OperationCancelledException e) {
                skip(st, ALL, RuntimeErrorKind.CANCELLED, e.getMessage());
            } catch (RuntimeException e) {
                fail(st, ALL, RuntimeErrorKind.NODE_EXECUTION_FAILURE, e);
            } finally {
                unitDone(st);
            }
        }

        private void runGlobalScalarUnit(NodeState st) {
            ValidatedNode node = st.node;
            try {
                if (!precheck(st, ALL))
                    return;
                if (upstreamFailed(node, ALL)) {
                    st.failedFor.add(ALL);
                    skip(st, ALL, RuntimeErrorKind.UPSTREAM_FAILURE, "An upstream scalar failed");
                    return;
                }
                markStarted(st);
                Transform transform = transforms.get(node.id());
                Table out = transform.transformData(storage.gatherScalarInputs(node));
                for (String col : out.columnNames())
                    storage.storeScalar(node.outputId(col), out.rowCount() > 0 ? out.value(col, 0) : null);
                for (var e : out.scalars().entrySet())
                    storage.storeScalar(node.outputId(e.getKey()), e.getValue());
                succeed(st, ALL);
            } catch (OperationCancelledException e) {
                skip(st, ALL, RuntimeErrorKind.CANCELLED, e.getMessage());
            } catch (RuntimeException e) {
                fail(st, ALL, RuntimeErrorKind.NODE_EXECUTION_FAILURE, e);
            } finally {
                unitDone(st);
            }
        }

        /** Cancellation and timeframe checks shared by all units; false means the unit was skipped. */
        private boolean precheck(NodeState st, String asset) {
            if (cancellation.isCancelled() || fatalError.get() != null) {
                skip(st, asset, RuntimeErrorKind.CANCELLED, "Pipeline stopped before the node ran");
                return false;
            }
            OperationMetadata meta = st.node.metadata();
            if (meta.isIntradayOnly() && !st.node.timeframe().isIntraday()) {
                if (st.timeframeWarned.compareAndSet(false, true))
                    log.warn("Skipping intraday-only node {} ({}) at timeframe {}", st.node.id(), st.node.type(),
                            st.node.timeframe());
                skip(st, asset, RuntimeErrorKind.UNSUPPORTED_TIMEFRAME, "Intraday-only operation at timeframe "
                        + st.node.timeframe());
                return false;
            }
            return true;
        }

        private void capture(ValidatedNode node, Transform transform, Table input, String key) {
            Report report = transform.getDashboard(input);
            if (report != null && !report.isEmpty())
                storage.storeReport(key, node, report);
            EventMarkerData marker = transform.getEventMarkers(input);
            if (marker != null)
                storage.storeEventMarker(key, node, marker);
        }

        // ── Bookkeeping ─────────────────────────────────────────────

        private void markStarted(NodeState st) {
            if (st.started.compareAndSet(false, true)) {
                st.startNanos = System.nanoTime();
                running.add(st.node.id());
                sink.emit(new OrchestratorEvent.NodeStarted(now(), st.node.id(), st.node.type(),
                        st.node.isCrossSectional(), st.index, nodes.size(), st.node.isScalar() && !st.perAsset ? 1 : st.assetCount));
            }
        }

        private void succeed(NodeState st, String asset) {
            st.processed.incrementAndGet();
            outcomes.add(NodeOutcome.succeeded(st.node.id(), asset));
        }

        private void skip(NodeState st, String asset, RuntimeErrorKind kind, String reason) {
            st.firstSkipReason.compareAndSet(null, reason);
            outcomes.add(NodeOutcome.skipped(st.node.id(), asset, kind, reason));
        }

        private void fail(NodeState st, String asset, RuntimeErrorKind kind, RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            st.failedFor.add(asset);
            st.failed.incrementAndGet();
            outcomes.add(NodeOutcome.failed(st.node.id(), asset, kind, message));
            failureLog.warn("Node " + st.node.id() + " (" + st.node.type() + ") failed for " + asset, e);
            sink.emit(new OrchestratorEvent.NodeFailed(now(), st.node.id(), st.node.type(), message,
                    ALL.equals(asset) ? null : asset));
            if (config.getFailurePolicy() == OrchestratorConfig.FailurePolicy.FAIL_FAST)
                fatalError.compareAndSet(null, "Node '" + st.node.id() + "' failed for " + asset + ": " + message);
        }

        private void unitDone(NodeState st) {
            if (st.pending.decrementAndGet() == 0)
                finishNode(st);
        }

        private void finishNode(NodeState st) {
            running.remove(st.node.id());
            if (st.started.get()) {
                long ms = (System.nanoTime() - st.startNanos) / 1_000_000;
                sink.emit(new OrchestratorEvent.NodeCompleted(now(), st.node.id(), st.node.type(), ms,
                        st.processed.get(), st.failed.get()));
            } else {
                String reason = st.firstSkipReason.get();
                sink.emit(new OrchestratorEvent.NodeSkipped(now(), st.node.id(), st.node.type(),
                        reason != null ? reason : "No asset to process"));
            }
            int done = completedNodes.incrementAndGet();
            if (config.isProgressSummaryEnabled())
                progress(done);
        }

        private void progress(int done) {
            long nowNanos = System.nanoTime();
            long last = lastProgress.get();
            boolean due = nowNanos - last >= config.getProgressSummaryIntervalMillis() * 1_000_000
                    && lastProgress.compareAndSet(last, nowNanos);
            // the last summary is never throttled
            if (due || done == nodes.size()) {
                double pct = nodes.isEmpty() ? 100.0 : 100.0 * done / nodes.size();
                sink.emit(new OrchestratorEvent.ProgressSummary(now(), pct, done, nodes.size(),
                        new ArrayList<>(running)));
            }
        }

        private PipelineResult finish(List<String> ids) {
            ExecutionSummary summary = new ExecutionSummary(ids, new ArrayList<>(outcomes));
            long elapsed = (System.nanoTime() - startNanos) / 1_000_000;
            PipelineResult.Status status;
            String error = fatalError.get();
            if (error != null) {
                status = PipelineResult.Status.FAILED;
                log.error("Pipeline failed after {} ms: {}", elapsed, error);
                sink.emit(new OrchestratorEvent.PipelineFailed(now(), elapsed, error));
            } else if (cancellation.isCancelled()) {
                status = PipelineResult.Status.CANCELLED;
                log.info("Pipeline cancelled after {} ms", elapsed);
                sink.emit(new OrchestratorEvent.PipelineCancelled(now(), elapsed, summary.nodesSucceeded(),
                        nodes.size()));
            } else {
                status = PipelineResult.Status.COMPLETED;
                log.info("Pipeline completed in {} ms: {}", elapsed, summary);
                sink.emit(new OrchestratorEvent.PipelineCompleted(now(), elapsed, summary.nodesSucceeded(),
                        summary.nodesFailed(), summary.nodesSkipped()));
            }
            return new PipelineResult(status, storage.buildFinalOutput(), storage.reports(), storage.eventMarkers(),
                    summary, error);
        }
    }

    /** Per-node execution state of one run. */
    private static final class NodeState {
        final ValidatedNode node;
        final int index;
        final boolean perAsset;
        final int assetCount;
        final Map<String, CompletableFuture<Void>> futures = new ConcurrentHashMap<>();
        final Set<String> failedFor = ConcurrentHashMap.newKeySet();
        final AtomicInteger pending = new AtomicInteger();
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicBoolean started = new AtomicBoolean();
        final AtomicBoolean timeframeWarned = new AtomicBoolean();
        final AtomicReference<String> firstSkipReason = new AtomicReference<>();
        volatile long startNanos;

        NodeState(ValidatedNode node, int index, boolean perAsset, int assetCount) {
            this.node = node;
            this.index = index;
            this.perAsset = perAsset;
            this.assetCount = assetCount;
        }
    }

    /** Scalars other than asset predicates run once per run, not per asset. */
    static boolean isPerAsset(ValidatedNode node) {
        if (node.isCrossSectional())
            return false;
        return !node.isScalar() || IS_ASSET_REF.equals(node.type());
    }

    static Map<String, String> assetFilters(ValidatedNode node) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (String key : ASSET_FILTER_KEYS) {
            Optional<OptionValue> v = node.option(key);
            v.ifPresent(o -> filters.put(key, o.asString()));
        }
        return filters;
    }

    /** Column carrying the single wired input of a passthrough node. */
    static String passthroughColumn(ValidatedNode node) {
        var e = node.inputs().entrySet().iterator().next();
        return ValidatedNode.inputColumn(e.getKey(), 0, e.getValue().size());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}

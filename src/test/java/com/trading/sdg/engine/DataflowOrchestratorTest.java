package com.trading.sdg.engine;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Before;
import org.junit.Test;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.Transform;
import com.trading.sdg.api.TransformCatalog;
import com.trading.sdg.api.TransformFactory;
import com.trading.sdg.compiler.CompilationResult;
import com.trading.sdg.compiler.StrategyCompiler;
import com.trading.sdg.config.OrchestratorConfig;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;
import com.trading.sdg.events.EventDispatcher;
import com.trading.sdg.events.EventType;
import com.trading.sdg.events.OrchestratorEvent;
import com.trading.sdg.fn.BuiltinTransforms;
import com.trading.sdg.io.MetadataLoader;

public class DataflowOrchestratorTest {

    private static final long DAY = 86_400_000L;
    private static final String AAPL = "AAPL-Stock";
    private static final String MSFT = "MSFT-Stock";
    private static final String EURUSD = "EURUSD-FX";

    private MetadataRegistry registry;
    private TransformManager manager;
    private List<OrchestratorEvent> events;
    private EventDispatcher dispatcher;

    @Before
    public void setUp() {
        registry = new MetadataLoader().loadBuiltins();
        manager = new TransformManager(registry);
        events = Collections.synchronizedList(new ArrayList<>());
        dispatcher = new EventDispatcher();
        dispatcher.subscribe(events::add);
    }

    // ── Fixtures ────────────────────────────────────────────────────

    private static Table bars(double... closes) {
        long[] index = new long[closes.length];
        List<Object> c = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            index[i] = i * DAY;
            c.add(closes[i]);
        }
        Map<String, List<?>> cols = new LinkedHashMap<>();
        for (String name : List.of("o", "h", "l", "c"))
            cols.put(name, c);
        cols.put("v", Collections.nCopies(closes.length, 1000.0));
        return Table.of(index, cols);
    }

    private static Map<Timeframe, Map<String, Table>> daily(Object... assetAndTable) {
        Map<String, Table> perAsset = new LinkedHashMap<>();
        for (int i = 0; i < assetAndTable.length; i += 2)
            perAsset.put((String) assetAndTable[i], (Table) assetAndTable[i + 1]);
        return Map.of(Timeframe.ONE_DAY, perAsset);
    }

    private static Node dailyNode(String id, String type) {
        Node n = new Node(id, type);
        n.setTimeframe(Timeframe.ONE_DAY);
        return n;
    }

    /** src, sma(2) over close, close > sma. */
    private void insertCrossoverGraph() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(dailyNode("avg", "sma").option("period", OptionValue.integer(2)).input("SLOT", "src", "c"));
        manager.insert(dailyNode("above", "gt").input("SLOT0", "src", "c").input("SLOT1", "avg", "result"));
    }

    /** Built-ins with one type replaced. */
    private static TransformCatalog catalogWith(String type, TransformFactory factory) {
        TransformCatalog builtins = BuiltinTransforms.catalog();
        TransformCatalog.Builder b = TransformCatalog.builder();
        for (String t : builtins.types())
            b.register(t, t.equals(type) ? factory : builtins::create);
        return b.build();
    }

    /** An sma that throws on prices above 100. */
    private static TransformFactory failingAbove100() {
        return n -> {
            Transform inner = BuiltinTransforms.catalog().create(n);
            return in -> {
                for (int r = 0; r < in.rowCount(); r++) {
                    if (Table.toDouble(in.value("SLOT", r)) > 100)
                        throw new IllegalStateException("price out of range");
                }
                return inner.transformData(in);
            };
        };
    }

    private OrchestratorConfig config(int parallelism, OrchestratorConfig.FailurePolicy policy) {
        OrchestratorConfig c = OrchestratorConfig.defaults();
        c.setParallelism(parallelism);
        c.setFailurePolicy(policy);
        return c;
    }

    private List<EventType> eventTypes() {
        List<EventType> out = new ArrayList<>();
        synchronized (events) {
            for (OrchestratorEvent e : events)
                out.add(e.type());
        }
        return out;
    }

    // ── Tests ───────────────────────────────────────────────────────

    @Test
    public void testCompiledStrategyRunsEndToEnd() {
        StrategyCompiler compiler = new StrategyCompiler(registry);
        CompilationResult compiled = compiler.compileOrThrow(String.join("\n",
                "src = market_data_source(timeframe=\"1D\")",
                "fast = sma(period=2)(src.c)",
                "trade_signal_executor()(enter_long=src.c > fast)"));
        TransformManager m = TransformManager.fromCompilation(registry, compiled);
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(m, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2, 3)));
        assertTrue(result.isCompleted());
        assertNull(result.errorMessage());

        Table t = result.table(Timeframe.ONE_DAY, AAPL);
        assertEquals(List.of(1.0, 2.0, 3.0), t.column("c"));
        assertEquals(Arrays.asList(null, 1.5, 2.5), t.column("fast#result"));

        String exec = compiled.nodesOfType("trade_signal_executor").get(0).getId();
        assertEquals(List.of(false, true, true), t.column(exec + "#enter_long"));
        assertEquals(0, result.summary().nodesFailed());
        assertEquals(compiled.size(), result.summary().nodesSucceeded());
    }

    @Test
    public void testEachNodeRunsOncePerAsset() {
        AtomicInteger sourceCalls = new AtomicInteger();
        TransformFactory counting = n -> {
            Transform inner = BuiltinTransforms.catalog().create(n);
            return new Transform() {
                @Override
                public Table transformData(Table in) {
                    sourceCalls.incrementAndGet();
                    return inner.transformData(in);
                }

                @Override
                public List<String> getRequiredDataSources() {
                    return inner.getRequiredDataSources();
                }
            };
        };
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager,
                catalogWith("market_data_source", counting), config(4, OrchestratorConfig.FailurePolicy.ISOLATE),
                dispatcher);

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2, 3), MSFT, bars(3, 2, 1)));
        assertTrue(result.isCompleted());
        // src feeds both avg and above, yet runs once per asset
        assertEquals(2, sourceCalls.get());
        assertEquals(6, result.summary().count(NodeOutcome.Status.SUCCEEDED));
    }

    @Test
    public void testFailureIsIsolatedToItsAsset() {
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, catalogWith("sma", failingAbove100()),
                config(2, OrchestratorConfig.FailurePolicy.ISOLATE), dispatcher);

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2, 3), MSFT, bars(200, 201, 202)));
        assertEquals(PipelineResult.Status.COMPLETED, result.status());

        ExecutionSummary s = result.summary();
        assertEquals(new ExecutionSummary.Counts(3, 0, 0), s.forAsset(AAPL));
        assertEquals(new ExecutionSummary.Counts(1, 1, 1), s.forAsset(MSFT));
        assertEquals("price out of range", s.firstError("avg").orElseThrow());

        NodeOutcome skipped = s.outcomes().stream()
                .filter(o -> o.nodeId().equals("above") && o.asset().equals(MSFT)).findFirst().orElseThrow();
        assertEquals(NodeOutcome.Status.SKIPPED, skipped.status());
        assertEquals(RuntimeErrorKind.UPSTREAM_FAILURE, skipped.errorKind());

        assertTrue(result.table(Timeframe.ONE_DAY, AAPL).hasColumn("above#result"));
        assertFalse(result.table(Timeframe.ONE_DAY, MSFT).hasColumn("above#result"));

        OrchestratorEvent.NodeFailed failed = (OrchestratorEvent.NodeFailed) events.stream()
                .filter(e -> e.type() == EventType.NODE_FAILED).findFirst().orElseThrow();
        assertEquals("avg", failed.nodeId());
        assertEquals(MSFT, failed.assetId());
    }

    @Test
    public void testFailFastStopsThePipeline() {
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, catalogWith("sma", failingAbove100()),
                config(1, OrchestratorConfig.FailurePolicy.FAIL_FAST), dispatcher);

        PipelineResult result = orchestrator.execute(daily(MSFT, bars(200, 201)));
        assertEquals(PipelineResult.Status.FAILED, result.status());
        assertTrue(result.errorMessage(), result.errorMessage().contains("'avg'"));
        assertEquals(EventType.PIPELINE_FAILED, eventTypes().get(eventTypes().size() - 1));
    }

    @Test
    public void testCancellationSkipsRemainingWork() {
        AtomicReference<DataflowOrchestrator> ref = new AtomicReference<>();
        TransformFactory cancelling = n -> {
            Transform inner = BuiltinTransforms.catalog().create(n);
            return in -> {
                ref.get().cancel();
                return inner.transformData(in);
            };
        };
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, catalogWith("sma", cancelling),
                config(1, OrchestratorConfig.FailurePolicy.ISOLATE), dispatcher);
        ref.set(orchestrator);

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2, 3)));
        assertEquals(PipelineResult.Status.CANCELLED, result.status());
        assertTrue(orchestrator.isCancellationRequested());

        NodeOutcome above = result.summary().outcomes().stream().filter(o -> o.nodeId().equals("above"))
                .findFirst().orElseThrow();
        assertEquals(RuntimeErrorKind.CANCELLED, above.errorKind());
        assertTrue(eventTypes().contains(EventType.PIPELINE_CANCELLED));
    }

    @Test
    public void testCancellationIsResetForTheNextRun() {
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());
        orchestrator.cancel();
        assertTrue(orchestrator.execute(daily(AAPL, bars(1, 2))).isCompleted());
    }

    @Test
    public void testLifecycleEvents() {
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog(),
                config(2, OrchestratorConfig.FailurePolicy.ISOLATE), dispatcher);
        orchestrator.execute(daily(AAPL, bars(1, 2, 3), MSFT, bars(4, 5, 6)));

        List<EventType> types = eventTypes();
        assertEquals(EventType.PIPELINE_STARTED, types.get(0));
        assertEquals(EventType.PIPELINE_COMPLETED, types.get(types.size() - 1));
        assertEquals(3, Collections.frequency(types, EventType.NODE_STARTED));
        assertEquals(3, Collections.frequency(types, EventType.NODE_COMPLETED));

        OrchestratorEvent.PipelineStarted started = (OrchestratorEvent.PipelineStarted) events.get(0);
        assertEquals(List.of("src", "avg", "above"), started.nodeIds());
        assertEquals(2, started.totalAssets());

        OrchestratorEvent.ProgressSummary last = null;
        for (OrchestratorEvent e : events) {
            if (e instanceof OrchestratorEvent.ProgressSummary p)
                last = p;
        }
        assertNotNull(last);
        assertEquals(3, last.nodesCompleted());
        assertEquals(100.0, last.overallProgressPercent(), 1e-9);
    }

    @Test
    public void testAsyncEventsAreDeliveredBeforeReturn() {
        insertCrossoverGraph();
        OrchestratorConfig c = config(2, OrchestratorConfig.FailurePolicy.ISOLATE);
        c.setAsyncEvents(true);
        c.setEventBufferSize(64);
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog(), c,
                dispatcher);
        orchestrator.execute(daily(AAPL, bars(1, 2, 3)));

        List<EventType> types = eventTypes();
        assertEquals(EventType.PIPELINE_STARTED, types.get(0));
        assertEquals(EventType.PIPELINE_COMPLETED, types.get(types.size() - 1));
    }

    @Test
    public void testCrossSectionalZScore() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(dailyNode("z", "cs_zscore").input("SLOT", "src", "c"));
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 1), MSFT, bars(2, 2), EURUSD, bars(3, 3)));
        double z = Math.sqrt(1.5);
        assertEquals(-z, (Double) result.table(Timeframe.ONE_DAY, AAPL).value("z#result", 0), 1e-9);
        assertEquals(0.0, (Double) result.table(Timeframe.ONE_DAY, MSFT).value("z#result", 1), 1e-9);
        assertEquals(z, (Double) result.table(Timeframe.ONE_DAY, EURUSD).value("z#result", 1), 1e-9);
        // one barrier unit for the whole universe
        assertEquals(new ExecutionSummary.Counts(1, 0, 0), result.summary().forNode("z"));
    }

    @Test
    public void testAssetReferences() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(new Node("is_apple", "is_asset_ref").option("ticker", OptionValue.string("aapl")));
        manager.insert(dailyNode("fx_close", "asset_ref_passthrough").option("asset_class", OptionValue.string("FX"))
                .input("SLOT", "src", "c"));
        manager.insert(dailyNode("up", "gt").input("SLOT0", "src", "c")
                .input("SLOT1", InputValue.literal(Constant.integer(0))));
        manager.insert(dailyNode("apple_up", "logical_and").input("SLOT0", "is_apple", "result")
                .input("SLOT1", "up", "result"));
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2), EURUSD, bars(1.1, 1.2)));
        Table apple = result.table(Timeframe.ONE_DAY, AAPL);
        Table fx = result.table(Timeframe.ONE_DAY, EURUSD);
        assertEquals(List.of(true, true), apple.column("apple_up#result"));
        assertEquals(List.of(false, false), fx.column("apple_up#result"));
        assertEquals(List.of(1.1, 1.2), fx.column("fx_close#result"));
        assertFalse(apple.hasColumn("fx_close#result"));
    }

    @Test
    public void testGlobalScalarFeedsEveryAsset() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(new Node("two", "number").option("value", OptionValue.decimal(2.0)));
        manager.insert(dailyNode("doubled", "mul").input("SLOT0", "src", "c").input("SLOT1", "two", "result"));
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2), MSFT, bars(5, 6)));
        assertEquals(List.of(2.0, 4.0), result.table(Timeframe.ONE_DAY, AAPL).column("doubled#result"));
        assertEquals(List.of(10.0, 12.0), result.table(Timeframe.ONE_DAY, MSFT).column("doubled#result"));
        assertEquals(new ExecutionSummary.Counts(1, 0, 0), result.summary().forNode("two"));
    }

    @Test
    public void testIntradayOnlyNodeIsSkippedOnDailyData() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(dailyNode("vwap", "intraday_vwap").input("price", "src", "c").input("volume", "src", "v"));
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog(),
                OrchestratorConfig.defaults(), dispatcher);

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2)));
        assertTrue(result.isCompleted());
        NodeOutcome o = result.summary().outcomes().stream().filter(x -> x.nodeId().equals("vwap")).findFirst()
                .orElseThrow();
        assertEquals(RuntimeErrorKind.UNSUPPORTED_TIMEFRAME, o.errorKind());
        assertTrue(eventTypes().contains(EventType.NODE_SKIPPED));
    }

    @Test
    public void testMissingBaseDataIsInsufficientInput() {
        insertCrossoverGraph();
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(1, 2)), Set.of(AAPL, MSFT));
        assertTrue(result.isCompleted());
        NodeOutcome src = result.summary().outcomes().stream()
                .filter(o -> o.nodeId().equals("src") && o.asset().equals(MSFT)).findFirst().orElseThrow();
        assertEquals(RuntimeErrorKind.INSUFFICIENT_INPUT_DATA, src.errorKind());
        assertEquals(new ExecutionSummary.Counts(3, 0, 0), result.summary().forAsset(AAPL));
    }

    @Test
    public void testReportsAreCollectedPerAsset() {
        manager.insert(dailyNode("src", "market_data_source"));
        manager.insert(dailyNode("card", "numeric_cards_report").option("title", OptionValue.string("Close"))
                .option("agg", OptionValue.select("max")).input("SLOT", "src", "c"));
        DataflowOrchestrator orchestrator = new DataflowOrchestrator(manager, BuiltinTransforms.catalog());

        PipelineResult result = orchestrator.execute(daily(AAPL, bars(3, 7, 5)));
        Report report = result.reports().get(AAPL);
        assertEquals(1, report.getCards().size());
        assertEquals("Close", report.getCards().get(0).getTitle());
        assertEquals(7.0, report.getCards().get(0).getValue());
        assertEquals(1, report.getCards().get(0).getGroupSize());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnknownReferenceIsRejected() {
        manager.insert(dailyNode("avg", "sma").option("period", OptionValue.integer(2)).input("SLOT", "src", "c"));
        new DataflowOrchestrator(manager, BuiltinTransforms.catalog());
    }
}

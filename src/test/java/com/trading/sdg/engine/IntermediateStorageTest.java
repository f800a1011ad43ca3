package com.trading.sdg.engine;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.Session;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;
import com.trading.sdg.io.MetadataLoader;

public class IntermediateStorageTest {

    private static final long HOUR = 3_600_000L;

    private MetadataRegistry registry;
    private IntermediateStorage storage;
    private ValidatedNode src;

    @Before
    public void setUp() {
        registry = new MetadataLoader().loadBuiltins();
        storage = new IntermediateStorage();
        Table hourly = Table.of(new long[] { 0, HOUR, 2 * HOUR },
                Map.of("c", List.of(1.0, 2.0, 3.0), "v", List.of(10.0, 20.0, 30.0)));
        Table daily = Table.of(new long[] { 0 }, Map.of("c", List.of(5.0)));
        storage.initializeBaseData(Map.of(Timeframe.parse("1H"), Map.of("A", hourly),
                Timeframe.ONE_DAY, Map.of("A", daily)), null);
        src = node(new Node("src", "market_data_source"), "1H");
        storage.register(src);
    }

    private ValidatedNode node(Node n, String tf) {
        n.setTimeframe(Timeframe.parse(tf));
        return ValidatedNode.of(n, n.getTimeframe(), registry.find(n.getType()).orElseThrow());
    }

    @Test
    public void testSourceReadsRequestedBaseColumns() {
        Table in = storage.gatherInputs("A", src, List.of("c")).orElseThrow();
        assertEquals(List.of("c"), in.columnNames());
        assertEquals(3, in.rowCount());
    }

    @Test
    public void testReferencesAndLiterals() {
        storage.storeOutputs("A", src, Table.of(new long[] { 0, HOUR, 2 * HOUR }, Map.of("c", List.of(1.0, 2.0, 3.0))));
        ValidatedNode gt = node(new Node("gt_0", "gt").input("SLOT0", "src", "c")
                .input("SLOT1", InputValue.literal(Constant.integer(2))), "1H");
        storage.register(gt);

        Table in = storage.gatherInputs("A", gt, List.of()).orElseThrow();
        assertEquals(List.of(1.0, 2.0, 3.0), in.column("SLOT0"));
        assertEquals(2L, in.scalar("SLOT1"));
    }

    @Test
    public void testMissingUpstreamIsEmpty() {
        ValidatedNode gt = node(new Node("gt_0", "gt").input("SLOT0", "src", "c").input("SLOT1", "src", "v"), "1H");
        assertEquals(Optional.empty(), storage.gatherInputs("A", gt, List.of()));
    }

    @Test(expected = InsufficientDataException.class)
    public void testMissingBaseDataThrows() {
        storage.gatherInputs("B", src, List.of());
    }

    @Test
    public void testCoarserOutputIsAlignedAsOf() {
        ValidatedNode daily = node(new Node("d", "market_data_source"), "1D");
        storage.register(daily);
        storage.storeOutputs("A", daily, Table.of(new long[] { 0 }, Map.of("c", List.of(5.0))));
        ValidatedNode sum = node(new Node("s", "add").input("SLOT0", "src", "c").input("SLOT1", "d", "c"), "1H");
        storage.storeOutputs("A", src, Table.of(new long[] { 0, HOUR, 2 * HOUR }, Map.of("c", List.of(1.0, 2.0, 3.0))));

        Table in = storage.gatherInputs("A", sum, List.of()).orElseThrow();
        assertEquals(List.of(5.0, 5.0, 5.0), in.column("SLOT1"));
    }

    @Test
    public void testScalarsAndAssetScalars() {
        storage.storeScalar("two#result", 2.0);
        storage.storeScalar("none#result", null);
        storage.storeAssetScalar("A", "ref#result", true);

        assertTrue(storage.hasScalar("none#result"));
        assertNull(storage.scalar("none#result"));
        assertEquals(2.0, storage.scalar("two#result"));
        assertEquals(Optional.of(true), storage.assetScalar("A", "ref#result"));
        assertEquals(Optional.empty(), storage.assetScalar("B", "ref#result"));
    }

    @Test
    public void testAssetUniverse() {
        IntermediateStorage s = new IntermediateStorage();
        s.initializeBaseData(Map.of(Timeframe.ONE_DAY, Map.of("A", Table.empty(), "B", Table.empty())), Set.of("A", "C"));
        assertEquals(Set.of("A", "C"), Set.copyOf(s.assetIds()));
    }

    @Test
    public void testSessionRestrictsRows() {
        Node n = new Node("src_early", "market_data_source");
        n.setSession(Session.parse("00:00-02:00"));
        ValidatedNode early = node(n, "1H");
        Table in = storage.gatherInputs("A", early, List.of("c")).orElseThrow();
        assertEquals(Arrays.asList(1.0, 2.0), in.column("c"));
    }

    @Test
    public void testReportsMergePerKey() {
        ValidatedNode first = node(new Node("first", "market_data_source"), "1H");
        ValidatedNode second = node(new Node("second", "market_data_source"), "1H");
        storage.register(first);
        storage.register(second);
        storage.storeReport("A", second, new Report().addCard(new Report.Card("Stats", "b", 1.0)));
        storage.storeReport("A", first, new Report().addCard(new Report.Card("Stats", "a", 2.0)));

        Report r = storage.reports().get("A");
        assertEquals(2, r.getCards().size());
        assertEquals(2, r.getCards().get(0).getGroupSize());
        assertEquals("a", r.getCards().stream().filter(c -> c.getGroup() == 0).findFirst().orElseThrow().getTitle());
    }

    @Test
    public void testMarkersFollowRegistrationOrder() {
        ValidatedNode first = node(new Node("first", "market_data_source"), "1H");
        ValidatedNode second = node(new Node("second", "market_data_source"), "1H");
        storage.register(first);
        storage.register(second);
        storage.storeEventMarker("A", second, new EventMarkerData("late", null, null, List.of(2L)));
        storage.storeEventMarker("A", first, new EventMarkerData("early", null, null, List.of(1L)));

        List<EventMarkerData> markers = storage.eventMarkers().get("A");
        assertEquals(2, markers.size());
        assertEquals("early", markers.get(0).title());
        assertEquals("late", markers.get(1).title());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnregisteredReporterRejected() {
        ValidatedNode stray = node(new Node("stray", "market_data_source"), "1H");
        storage.storeReport("A", stray, new Report().addCard(new Report.Card("Stats", "a", 1.0)));
    }

    @Test
    public void testFinalOutputJoinsOutputs() {
        storage.storeOutputs("A", src, Table.of(new long[] { 0, HOUR, 2 * HOUR }, Map.of("c", List.of(1.0, 2.0, 3.0))));
        Table out = storage.buildFinalOutput().get(Timeframe.parse("1H")).get("A");
        assertTrue(out.hasColumn("c"));
        assertTrue(out.hasColumn("src#c"));
        assertEquals(3, out.rowCount());
    }
}

package com.trading.sdg.compiler;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.io.MetadataLoader;

public class CseOptimizerTest {

    private MetadataRegistry registry;
    private CseOptimizer cse;

    @Before
    public void setUp() {
        registry = new MetadataLoader().loadBuiltins();
        cse = new CseOptimizer(registry);
    }

    private static Node daily(Node n) {
        n.setTimeframe(Timeframe.ONE_DAY);
        return n;
    }

    private static Node src() {
        return daily(new Node("src", "market_data_source"));
    }

    private static Node ema(String id, long period) {
        return daily(new Node(id, "ema").option("period", OptionValue.integer(period)).input("SLOT", "src", "c"));
    }

    private static Node gtOne(String id, String left) {
        return daily(new Node(id, "gt").input("SLOT0", left, "result")
                .input("SLOT1", InputValue.literal(Constant.integer(1))));
    }

    private static List<String> ids(List<Node> nodes) {
        List<String> out = new ArrayList<>();
        for (Node n : nodes)
            out.add(n.getId());
        return out;
    }

    @Test
    public void testDuplicatesCollapseBottomUp() {
        List<Node> nodes = List.of(src(), ema("a", 10), ema("b", 10), gtOne("gt_0", "a"), gtOne("gt_1", "b"),
                daily(new Node("exec", "trade_signal_executor").input("enter_long", "gt_0", "result")
                        .input("exit_long", "gt_1", "result")));

        CseOptimizer.Result r = cse.optimize(nodes);
        assertEquals(2, r.removedCount());
        assertEquals("a", r.redirects().get("b"));
        assertEquals("gt_0", r.redirects().get("gt_1"));
        assertEquals(List.of("src", "a", "gt_0", "exec"), ids(r.nodes()));

        Node exec = r.nodes().get(3);
        assertEquals(InputValue.ref("gt_0", "result"), exec.getInputs().get("exit_long").get(0));
    }

    @Test
    public void testDifferentOptionsAreKept() {
        CseOptimizer.Result r = cse.optimize(List.of(src(), ema("a", 10), ema("b", 20)));
        assertEquals(0, r.removedCount());
    }

    @Test
    public void testDifferentTimeframesAreKept() {
        Node a = ema("a", 10);
        Node b = ema("b", 10);
        b.setTimeframe(Timeframe.parse("1H"));
        assertEquals(0, cse.optimize(List.of(src(), a, b)).removedCount());
    }

    @Test
    public void testScalarsMergeAcrossTimeframes() {
        Node x = new Node("x", "number").option("value", OptionValue.decimal(2.0));
        Node y = new Node("y", "number").option("value", OptionValue.decimal(2.0));
        x.setTimeframe(Timeframe.ONE_DAY);
        y.setTimeframe(Timeframe.parse("5Min"));
        CseOptimizer.Result r = cse.optimize(List.of(x, y));
        assertEquals("x", r.redirects().get("y"));
    }

    @Test
    public void testExecutorsAreNeverMerged() {
        Node e1 = daily(new Node("e1", "trade_signal_executor").input("enter_long", "src", "c"));
        Node e2 = daily(new Node("e2", "trade_signal_executor").input("enter_long", "src", "c"));
        assertEquals(0, cse.optimize(List.of(src(), e1, e2)).removedCount());
    }

    @Test
    public void testHashCollisionDoesNotMerge() {
        CseOptimizer colliding = new CseOptimizer(registry, n -> 42L);
        CseOptimizer.Result r = colliding.optimize(List.of(src(), ema("a", 10), ema("b", 20), ema("c", 10)));
        assertEquals(1, r.removedCount());
        assertEquals("a", r.redirects().get("c"));
        assertTrue(r.nodes().stream().anyMatch(n -> n.getId().equals("b")));
    }

    @Test
    public void testIdempotent() {
        List<Node> nodes = List.of(src(), ema("a", 10), ema("b", 10), gtOne("gt_0", "a"), gtOne("gt_1", "b"));
        CseOptimizer.Result first = cse.optimize(nodes);
        CseOptimizer.Result second = cse.optimize(new ArrayList<>(first.nodes()));
        assertEquals(0, second.removedCount());
        assertEquals(ids(first.nodes()), ids(second.nodes()));
    }

    @Test
    public void testEqualNodesHashEqually() {
        assertEquals(cse.semanticHash(ema("a", 10)), cse.semanticHash(ema("b", 10)));
        assertNotEquals(cse.semanticHash(ema("a", 10)), cse.semanticHash(ema("a", 11)));
    }

    @Test
    public void testSchemaReferencesAreRewritten() {
        Node marker = daily(new Node("m", "event_marker")
                .option("schema", OptionValue.schema("{\"select_key\":\"gt_1#result\"}"))
                .input("SLOT", "gt_1", "result"));
        List<Node> nodes = List.of(src(), ema("a", 10), gtOne("gt_0", "a"), gtOne("gt_1", "a"), marker);

        cse.optimize(nodes);
        assertEquals("{\"select_key\":\"gt_0#result\"}", marker.getOptions().get("schema").asString());
        assertEquals(InputValue.ref("gt_0", "result"), marker.getInputs().get("SLOT").get(0));
    }

    @Test
    public void testSchemaReferenceVisitedBeforeItsDuplicate() {
        Node marker = daily(new Node("m", "event_marker")
                .option("schema", OptionValue.schema("{\"select_key\":\"gt_1#result\"}"))
                .input("SLOT", "a", "result"));
        List<Node> nodes = List.of(src(), ema("a", 10), marker, gtOne("gt_0", "a"), gtOne("gt_1", "a"));

        CseOptimizer.Result r = cse.optimize(nodes);
        assertEquals("gt_0", r.redirects().get("gt_1"));
        assertEquals("{\"select_key\":\"gt_0#result\"}", marker.getOptions().get("schema").asString());
    }

    @Test
    public void testRemovedIdsArePurged() {
        Set<String> used = new HashSet<>(Set.of("src", "a", "b"));
        cse.optimize(List.of(src(), ema("a", 10), ema("b", 10)), used);
        assertEquals(Set.of("src", "a"), used);
    }
}

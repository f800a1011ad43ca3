package com.trading.sdg.compiler;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.io.MetadataLoader;

public class TimeframeResolverTest {

    private MetadataRegistry registry;
    private TimeframeResolver resolver;

    @Before
    public void setUp() {
        registry = new MetadataLoader().loadBuiltins();
        resolver = new TimeframeResolver(registry);
    }

    private static Node source(String id, String tf) {
        Node n = new Node(id, "market_data_source");
        n.setTimeframe(Timeframe.parse(tf));
        return n;
    }

    private static InputValue lit(boolean b) {
        return InputValue.literal(Constant.bool(b));
    }

    @Test
    public void testCoarsestProducerWins() {
        Node daily = source("daily", "1D");
        Node minute = source("minute", "1Min");
        Node gt = new Node("gt_0", "gt").input("SLOT0", "daily", "c").input("SLOT1", "minute", "c");
        resolver.resolve(List.of(daily, minute, gt), false);
        assertEquals(Timeframe.ONE_DAY, gt.getTimeframe());
        assertEquals(Timeframe.ONE_MINUTE, minute.getTimeframe());
    }

    @Test
    public void testLiteralOnlyNodeInheritsFromConsumer() {
        Node src = source("src", "5Min");
        Node flag = new Node("flag", "logical_and").input("SLOT0", lit(true)).input("SLOT1", lit(false));
        Node gt = new Node("gt_0", "gt").input("SLOT0", "src", "c")
                .input("SLOT1", InputValue.literal(Constant.integer(0)));
        Node both = new Node("both", "logical_and").input("SLOT0", "flag", "result").input("SLOT1", "gt_0", "result");

        resolver.resolve(List.of(src, flag, gt, both), false);
        Timeframe five = Timeframe.parse("5Min");
        assertEquals(five, gt.getTimeframe());
        assertEquals(five, both.getTimeframe());
        assertEquals(five, flag.getTimeframe());
    }

    @Test
    public void testMultiHopBackwardPropagation() {
        Node src = source("src", "1H");
        Node first = new Node("first", "logical_not").input("SLOT", lit(true));
        Node second = new Node("second", "logical_not").input("SLOT", "first", "result");
        Node cond = new Node("cond", "static_cast_to_boolean").input("SLOT", "src", "c");
        Node both = new Node("both", "logical_and").input("SLOT0", "second", "result").input("SLOT1", "cond",
                "result");

        resolver.resolve(List.of(src, first, second, cond, both), false);
        Timeframe hour = Timeframe.parse("1H");
        assertEquals(hour, first.getTimeframe());
        assertEquals(hour, second.getTimeframe());
    }

    @Test
    public void testScalarsDoNotPropagate() {
        Node src = source("src", "1W");
        Node number = new Node("two", "number").option("value", OptionValue.decimal(2.0));
        Node mul = new Node("mul_0", "mul").input("SLOT0", "src", "c").input("SLOT1", "two", "result");

        resolver.resolve(List.of(src, number, mul), false);
        assertNull(number.getTimeframe());
        assertEquals(Timeframe.parse("1W"), mul.getTimeframe());
    }

    @Test
    public void testScalarOnlyInputsAreUnresolvable() {
        Node number = new Node("two", "number").option("value", OptionValue.decimal(2.0));
        Node mul = new Node("mul_0", "mul").input("SLOT0", "two", "result")
                .input("SLOT1", InputValue.literal(Constant.integer(3)));
        try {
            resolver.resolve(List.of(number, mul), false);
            fail("Nothing to resolve mul_0 from");
        } catch (CompileException e) {
            assertEquals(CompileErrorKind.MISSING_TIMEFRAME, e.kind());
            assertEquals("Could not resolve timeframe for node 'mul_0' (type: mul)", e.error().message());
        }
    }

    @Test
    public void testUnresolvedAllowedForFragments() {
        Node not = new Node("not_0", "logical_not").input("SLOT", lit(true));
        resolver.resolve(List.of(not), true);
        assertNull(not.getTimeframe());
    }

    @Test
    public void testIntradayOnlyDefaultsToOneMinute() {
        Node vwap = new Node("vwap", "intraday_vwap")
                .input("price", InputValue.literal(Constant.decimal(1.0)))
                .input("volume", InputValue.literal(Constant.decimal(1.0)));
        resolver.resolve(List.of(vwap), false);
        assertEquals(Timeframe.ONE_MINUTE, vwap.getTimeframe());
    }

    @Test
    public void testExplicitTimeframeIsKept() {
        Node src = source("src", "1D");
        Node sma = new Node("sma_0", "sma").option("period", OptionValue.integer(3)).input("SLOT", "src", "c");
        sma.setTimeframe(Timeframe.parse("1W"));
        resolver.resolve(List.of(src, sma), false);
        assertEquals(Timeframe.parse("1W"), sma.getTimeframe());
    }
}

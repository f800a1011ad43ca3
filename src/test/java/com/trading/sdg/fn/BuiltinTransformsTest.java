package com.trading.sdg.fn;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.TransformCatalog;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.EventMarkerData;
import com.trading.sdg.data.Report;
import com.trading.sdg.data.Table;
import com.trading.sdg.io.MetadataLoader;

public class BuiltinTransformsTest {

    private final MetadataRegistry registry = new MetadataLoader().loadBuiltins();

    private ValidatedNode validated(Node n) {
        return ValidatedNode.of(n, Timeframe.ONE_DAY, registry.get(n.getType()));
    }

    @Test
    public void testEveryOperationHasATransform() {
        TransformCatalog catalog = BuiltinTransforms.catalog();
        for (OperationMetadata meta : registry.all())
            assertTrue(meta.getType(), catalog.contains(meta.getType()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateRegistration() {
        BuiltinTransforms.builder().register("sma", n -> in -> in);
    }

    @Test
    public void testNumberScalar() {
        ValidatedNode two = validated(new Node("two", "number").option("value", OptionValue.decimal(2.0)));
        Table out = BuiltinTransforms.catalog().create(two).transformData(Table.singleRow(Map.of()));
        assertEquals(2.0, out.value("result", 0));
    }

    @Test
    public void testEconomicIndicatorReadsCategoryColumn() {
        ValidatedNode gdp = validated(new Node("gdp", "economic_indicator")
                .option("category", OptionValue.select("GDP")));
        var t = BuiltinTransforms.catalog().create(gdp);
        assertEquals(List.of("ECON:GDP"), gdp.expandPlaceholders(t.getRequiredDataSources()));
    }

    @Test
    public void testReportAggregates() {
        ValidatedNode card = validated(new Node("card", "numeric_cards_report")
                .option("title", OptionValue.string("Mean close")).option("agg", OptionValue.select("mean"))
                .input("SLOT", "src", "c"));
        Table in = Table.of(new long[] { 0, 1, 2 }, Map.of("SLOT", Arrays.asList(1.0, null, 3.0)));
        Report r = BuiltinTransforms.catalog().create(card).getDashboard(in);
        assertEquals("Mean close", r.getCards().get(0).getTitle());
        assertEquals("Statistics", r.getCards().get(0).getCategory());
        assertEquals(2.0, r.getCards().get(0).getValue());
    }

    @Test
    public void testEventMarkerFlagsRows() {
        String schema = "{\"title\":\"Breakout\",\"icon\":\"flag\",\"select_key\":\"gt_0#result\","
                + "\"schemas\":[{\"column_id\":\"src#c\"}]}";
        ValidatedNode marker = validated(new Node("m", "event_marker").option("schema", OptionValue.schema(schema))
                .input("SLOT", "gt_0", "result"));
        Table in = Table.of(new long[] { 10, 20, 30 }, Map.of("SLOT", Arrays.asList(false, true, null)));

        EventMarkerData data = BuiltinTransforms.catalog().create(marker).getEventMarkers(in);
        assertEquals("Breakout", data.title());
        assertEquals("flag", data.icon());
        assertEquals(List.of("src#c"), data.columns());
        assertEquals(List.of(20L), data.timestamps());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEventMarkerSelectMustBeWired() {
        ValidatedNode marker = validated(new Node("m", "event_marker")
                .option("schema", OptionValue.schema("{\"select_key\":\"other#result\"}"))
                .input("SLOT", "gt_0", "result"));
        BuiltinTransforms.catalog().create(marker);
    }
}

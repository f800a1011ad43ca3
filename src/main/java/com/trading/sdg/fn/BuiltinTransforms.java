package com.trading.sdg.fn;

import com.trading.sdg.api.TransformCatalog;

/**
 * Catalog of the operations bundled in {@code operations.json}.
 */
public final class BuiltinTransforms {

    private static final TransformCatalog CATALOG = build();

    private BuiltinTransforms() {
    }

    public static TransformCatalog catalog() {
        return CATALOG;
    }

    /** Builder preloaded with the built-ins, for callers that add their own operations. */
    public static TransformCatalog.Builder builder() {
        TransformCatalog.Builder b = TransformCatalog.builder();

        // ── Sources and scalars ─────────────────────────────────────
        b.register("market_data_source", DataSource::marketData);
        b.register("economic_indicator", DataSource::economicIndicator);
        b.register("number", Scalars::number);
        b.register("text", Scalars::text);
        b.register("bool_true", n -> Scalars.constant(Boolean.TRUE));
        b.register("bool_false", n -> Scalars.constant(Boolean.FALSE));
        b.register("null_number", n -> Scalars.constant(null));

        // ── Operators ───────────────────────────────────────────────
        for (String t : new String[] { "add", "sub", "mul", "div", "modulo", "power_op" })
            b.register(t, n -> Arithmetic.of(n.type()));
        for (String t : new String[] { "lt", "gt", "lte", "gte", "eq", "neq" })
            b.register(t, n -> Comparison.of(n.type()));
        b.register(n -> Logical.of(n.type()), "logical_and", "logical_or", "logical_not");

        // ── Utilities ───────────────────────────────────────────────
        b.register("static_cast_to_boolean", n -> Casts.toBoolean());
        b.register("static_cast_to_decimal", n -> Casts.toDecimal());
        b.register("static_cast_to_integer", n -> Casts.toInteger());
        b.register("stringify", n -> Casts.stringify());
        b.register(n -> Casts.booleanSelect(), "boolean_select_number", "boolean_select_string",
                "boolean_select_boolean", "boolean_select_timestamp");
        b.register(n -> new Lag(n.getInt("period", 1)), "lag_number", "lag_string", "lag_boolean",
                "lag_timestamp");
        b.register(n -> Casts.alias(), "alias", "alias_decimal", "alias_integer", "alias_boolean", "alias_string",
                "alias_timestamp");
        // evaluated by the orchestrator itself
        b.register(n -> Casts.alias(), "asset_ref_passthrough", "is_asset_ref");

        // ── Indicators ──────────────────────────────────────────────
        b.register("sma", n -> Indicators.sma(n.getInt("period", 1)));
        b.register("ema", n -> Indicators.ema(n.getInt("period", 1)));
        b.register("bbands", n -> Indicators.bbands(n.getInt("period", 20), n.getDouble("stddev", 2.0)));
        b.register("cs_zscore", n -> new CrossSectionalZScore());
        b.register("intraday_vwap", n -> Indicators.intradayVwap());

        // ── Sinks ───────────────────────────────────────────────────
        b.register("trade_signal_executor", n -> new TradeSignalExecutor());
        b.register("numeric_cards_report", NumericCardsReport::new);
        b.register("event_marker", EventMarker::new);
        return b;
    }

    private static TransformCatalog build() {
        return builder().build();
    }
}

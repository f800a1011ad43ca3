package com.trading.sdg.fn;

import java.util.Collections;

import com.trading.sdg.api.Transform;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.data.Table;

/** Constant-producing operations. Each run evaluates them once, as a one-row table. */
final class Scalars {

    private Scalars() {
    }

    static Transform constant(Object value) {
        return in -> Table.singleRow(Collections.singletonMap(Series.RESULT, value));
    }

    static Transform number(ValidatedNode node) {
        return constant(node.option("value").orElseThrow().value());
    }

    static Transform text(ValidatedNode node) {
        return constant(node.getString("value", ""));
    }
}

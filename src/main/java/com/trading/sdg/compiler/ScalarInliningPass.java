package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.DataType;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OptionValue;

/**
 * Replaces references to constant-producing scalar nodes with literals and
 * drops those nodes.
 */
final class ScalarInliningPass {

    static final Set<String> INLINABLE = Set.of("number", "text", "bool_true", "bool_false", "null_number");

    List<Node> inline(List<Node> nodes) {
        Map<String, Constant> constants = new HashMap<>();
        for (Node n : nodes) {
            Constant c = constantOf(n);
            if (c != null)
                constants.put(n.getId(), c);
        }
        // Nodes named inside schema options keep existing
        for (Node n : nodes) {
            for (var opt : n.getOptions().values()) {
                if (opt.kind() == OptionValue.Kind.SCHEMA)
                    constants.keySet().removeIf(id -> opt.asString().contains("\"" + id + "#"));
            }
        }
        if (constants.isEmpty())
            return nodes;

        List<Node> kept = new ArrayList<>(nodes.size());
        for (Node n : nodes) {
            if (constants.containsKey(n.getId()))
                continue;
            for (List<InputValue> values : n.getInputs().values()) {
                for (int i = 0; i < values.size(); i++) {
                    if (values.get(i) instanceof InputValue.NodeReference r && constants.containsKey(r.nodeId()))
                        values.set(i, InputValue.literal(constants.get(r.nodeId())));
                }
            }
            kept.add(n);
        }
        return kept;
    }

    private static Constant constantOf(Node n) {
        if (!INLINABLE.contains(n.getType()))
            return null;
        return switch (n.getType()) {
            case "number" -> n.getOptions().containsKey("value")
                    ? Constant.decimal(n.getOptions().get("value").asDouble()) : null;
            case "text" -> n.getOptions().containsKey("value")
                    ? Constant.string(n.getOptions().get("value").asString()) : null;
            case "bool_true" -> Constant.bool(true);
            case "bool_false" -> Constant.bool(false);
            default -> Constant.nullOf(DataType.DECIMAL);
        };
    }
}

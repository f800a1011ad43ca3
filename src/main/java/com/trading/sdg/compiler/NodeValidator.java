package com.trading.sdg.compiler;

import java.util.List;
import java.util.Map;

import com.trading.sdg.api.IOSlot;
import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionDefinition;
import com.trading.sdg.api.OptionValue;
import com.trading.sdg.api.Session;

/**
 * Final structural check of every compiled node against its metadata, plus the
 * registered {@link SpecialNodeValidator}s.
 */
final class NodeValidator {

    private final MetadataRegistry registry;
    private final List<SpecialNodeValidator> special;
    private final SpecialNodeValidator.NodeTypes types;

    NodeValidator(MetadataRegistry registry, List<SpecialNodeValidator> special, SpecialNodeValidator.NodeTypes types) {
        this.registry = registry;
        this.special = special;
        this.types = types;
    }

    void validateAll(List<Node> nodes) {
        for (Node n : nodes)
            validate(n);
    }

    /**
     * Input wiring checks only. Runs before timeframe resolution, since an
     * unwired node can never inherit a timeframe.
     */
    void validateInputs(List<Node> nodes) {
        for (Node n : nodes)
            checkInputs(n, metadata(n), where(n));
    }

    void validate(Node node) {
        OperationMetadata meta = metadata(node);
        String where = where(node);

        for (String key : node.getOptions().keySet()) {
            if (meta.option(key).isEmpty())
                throw CompileException.forNode(CompileErrorKind.UNKNOWN_OPTION, "Unknown option '" + key + "'"
                        + where, node.getId(), node.getType(), key);
        }
        for (OptionDefinition def : meta.getOptions()) {
            OptionValue v = node.getOptions().get(def.id());
            if (v == null) {
                if (def.required() && def.defaultValue() == null)
                    throw CompileException.forNode(CompileErrorKind.MISSING_REQUIRED_OPTION, "Missing required option '"
                            + def.id() + "'" + where, node.getId(), node.getType(), def.id());
                continue;
            }
            String err = def.check(v);
            if (err != null)
                throw CompileException.forNode(CompileErrorKind.INVALID_OPTION_VALUE, "Invalid value for option '"
                        + def.id() + "'" + where + ": " + err, node.getId(), node.getType(), def.id());
        }

        checkInputs(node, meta, where);

        Session s = node.getSession();
        if (s != null && s.start().isAfter(s.end()))
            throw CompileException.forNode(CompileErrorKind.INVALID_SESSION_RANGE, "Session start " + s.start()
                    + " is after end " + s.end() + where, node.getId(), node.getType(), "session");

        for (SpecialNodeValidator v : special) {
            if (v.supports(node.getType()))
                v.validate(node, meta, types);
        }
    }

    private OperationMetadata metadata(Node node) {
        return registry.find(node.getType()).orElseThrow(() -> CompileException.forNode(
                CompileErrorKind.UNKNOWN_OPERATION_TYPE, "Unknown component '" + node.getType() + "'",
                node.getId(), node.getType(), null));
    }

    private static String where(Node node) {
        return " for node '" + node.getId() + "' (type: " + node.getType() + ")";
    }

    private static void checkInputs(Node node, OperationMetadata meta, String where) {
        for (Map.Entry<String, List<InputValue>> e : node.getInputs().entrySet()) {
            IOSlot slot = meta.input(e.getKey()).orElseThrow(() -> CompileException.forNode(
                    CompileErrorKind.UNKNOWN_INPUT, "Unknown input handle '" + e.getKey() + "'" + where,
                    node.getId(), node.getType(), e.getKey()));
            if (!slot.allowMultiple() && e.getValue().size() > 1)
                throw CompileException.forNode(CompileErrorKind.ARGUMENT_COUNT, "Input '" + e.getKey()
                        + "' takes a single value" + where, node.getId(), node.getType(), e.getKey());
        }
        if (meta.isAtLeastOneInputRequired()) {
            if (node.inputCount() == 0)
                throw CompileException.forNode(CompileErrorKind.MISSING_REQUIRED_INPUT,
                        "At least one input is required" + where, node.getId(), node.getType(), null);
        } else {
            for (IOSlot slot : meta.getInputs()) {
                List<InputValue> wired = node.getInputs().get(slot.id());
                if (slot.required() && (wired == null || wired.isEmpty()))
                    throw CompileException.forNode(CompileErrorKind.MISSING_REQUIRED_INPUT, "Missing required input '"
                            + slot.id() + "'" + where, node.getId(), node.getType(), slot.id());
            }
        }
    }
}

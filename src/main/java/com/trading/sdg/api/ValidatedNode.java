package com.trading.sdg.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link Node} bound to its {@link OperationMetadata} after option, input
 * and session checks passed. Immutable; shared read-only by the worker
 * threads of one execution.
 */
public final class ValidatedNode {

    private final String id;
    private final String type;
    private final Map<String, OptionValue> options;
    private final Map<String, List<InputValue>> inputs;
    private final Timeframe timeframe;
    private final Session session;
    private final OperationMetadata metadata;

    private ValidatedNode(Node node, Timeframe timeframe, OperationMetadata metadata) {
        this.id = node.getId();
        this.type = node.getType();
        this.timeframe = timeframe;
        this.session = node.getSession();
        this.metadata = metadata;

        Map<String, OptionValue> opts = new LinkedHashMap<>();
        for (OptionDefinition def : metadata.getOptions()) {
            if (def.defaultValue() != null)
                opts.put(def.id(), def.defaultValue());
        }
        opts.putAll(node.getOptions());
        this.options = Collections.unmodifiableMap(opts);

        Map<String, List<InputValue>> in = new LinkedHashMap<>();
        for (var e : node.getInputs().entrySet())
            in.put(e.getKey(), List.copyOf(e.getValue()));
        this.inputs = Collections.unmodifiableMap(in);
    }

    /**
     * Checks the node against its metadata and freezes it.
     *
     * @param timeframe final timeframe; may be a filler for scalar-category types.
     * @throws IllegalArgumentException if a required option or input is
     *                                  missing, an option is invalid or the
     *                                  session range is inverted.
     */
    public static ValidatedNode of(Node node, Timeframe timeframe, OperationMetadata metadata) {
        String where = " for node '" + node.getId() + "' (type: " + node.getType() + ")";
        for (OptionDefinition def : metadata.getOptions()) {
            OptionValue v = node.getOptions().get(def.id());
            if (v == null) {
                if (def.required() && def.defaultValue() == null)
                    throw new IllegalArgumentException("Missing required option '" + def.id() + "'" + where);
                continue;
            }
            String err = def.check(v);
            if (err != null)
                throw new IllegalArgumentException("Invalid option '" + def.id() + "'" + where + ": " + err);
        }
        for (IOSlot slot : metadata.getInputs()) {
            List<InputValue> wired = node.getInputs().get(slot.id());
            if (slot.required() && !metadata.isAtLeastOneInputRequired() && (wired == null || wired.isEmpty()))
                throw new IllegalArgumentException("Missing required input '" + slot.id() + "'" + where);
        }
        if (metadata.isAtLeastOneInputRequired() && node.inputCount() == 0)
            throw new IllegalArgumentException("At least one input is required" + where);
        Session s = node.getSession();
        if (s != null && s.start().isAfter(s.end()))
            throw new IllegalArgumentException("Session start is after end" + where);
        return new ValidatedNode(node, timeframe, metadata);
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Map<String, OptionValue> options() {
        return options;
    }

    public Map<String, List<InputValue>> inputs() {
        return inputs;
    }

    public Timeframe timeframe() {
        return timeframe;
    }

    public Session session() {
        return session;
    }

    public OperationMetadata metadata() {
        return metadata;
    }

    public boolean isScalar() {
        return metadata.isScalarCategory();
    }

    public boolean isCrossSectional() {
        return metadata.isCrossSectional();
    }

    /** Output column name of a handle: {@code <id>#<handle>}. */
    public String outputId(String handle) {
        return id + "#" + handle;
    }

    public List<String> outputIds() {
        List<String> out = new ArrayList<>(metadata.getOutputs().size());
        for (IOSlot slot : metadata.getOutputs())
            out.add(outputId(slot.id()));
        return out;
    }

    public Set<String> referencedNodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (List<InputValue> values : inputs.values()) {
            for (InputValue v : values) {
                if (v instanceof InputValue.NodeReference r)
                    ids.add(r.nodeId());
            }
        }
        return ids;
    }

    public boolean hasNodeReferences() {
        return !referencedNodeIds().isEmpty();
    }

    public Optional<OptionValue> option(String key) {
        return Optional.ofNullable(options.get(key));
    }

    public double getDouble(String key, double def) {
        OptionValue v = options.get(key);
        return v == null ? def : v.asDouble();
    }

    public int getInt(String key, int def) {
        OptionValue v = options.get(key);
        return v == null ? def : (int) v.asLong();
    }

    public String getString(String key, String def) {
        OptionValue v = options.get(key);
        return v == null ? def : v.asString();
    }

    public boolean getBoolean(String key, boolean def) {
        OptionValue v = options.get(key);
        return v == null ? def : v.asBoolean();
    }

    /** Column name under which an input value reaches the transform. */
    public static String inputColumn(String handle, int position, int count) {
        return count == 1 ? handle : handle + "[" + position + "]";
    }

    /** Replaces {@code {option}} placeholders with option values. */
    public List<String> expandPlaceholders(List<String> templates) {
        List<String> out = new ArrayList<>(templates.size());
        for (String t : templates) {
            String s = t;
            for (var e : options.entrySet())
                s = s.replace("{" + e.getKey() + "}", e.getValue().asString());
            out.add(s);
        }
        return out;
    }

    /** Mutable copy, used when merging managers or serializing. */
    public Node toNode() {
        Node n = new Node(id, type);
        n.setOptions(options);
        n.setInputs(inputs);
        n.setTimeframe(metadata.isScalarCategory() ? null : timeframe);
        n.setSession(session);
        return n;
    }

    @Override
    public String toString() {
        return "ValidatedNode[" + id + ": " + type + (timeframe != null ? " @" + timeframe : "") + "]";
    }
}

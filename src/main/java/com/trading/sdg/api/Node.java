package com.trading.sdg.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One operation instance of a compiled strategy graph.
 * <p>
 * Nodes are created by the compiler, get their timeframe filled in by the
 * timeframe resolver and their references rewritten by the CSE optimizer.
 * Once handed to the {@code TransformManager} they are copied into immutable
 * {@code ValidatedNode}s.
 */
@Data
@NoArgsConstructor
public final class Node {
    private String id;
    private String type;
    private Map<String, OptionValue> options = new LinkedHashMap<>();
    private Map<String, List<InputValue>> inputs = new LinkedHashMap<>();
    private Timeframe timeframe;
    private Session session;

    public Node(String id, String type) {
        this.id = id;
        this.type = type;
    }

    public Node option(String key, OptionValue value) {
        options.put(key, value);
        return this;
    }

    public Node input(String handle, InputValue value) {
        inputs.computeIfAbsent(handle, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Node input(String handle, String nodeId, String outputHandle) {
        return input(handle, InputValue.ref(nodeId, outputHandle));
    }

    public int inputCount() {
        int n = 0;
        for (List<InputValue> values : inputs.values())
            n += values.size();
        return n;
    }

    /** Ids of nodes referenced by this node's inputs, in wiring order. */
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

    public boolean references(String nodeId) {
        return referencedNodeIds().contains(nodeId);
    }

    /**
     * Redirects node references using {@code oldId -> newId}. Handles are kept.
     *
     * @return true if any reference changed.
     */
    public boolean redirectReferences(Map<String, String> redirects) {
        boolean changed = false;
        for (List<InputValue> values : inputs.values()) {
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) instanceof InputValue.NodeReference r) {
                    String target = redirects.get(r.nodeId());
                    if (target != null) {
                        values.set(i, r.withNodeId(target));
                        changed = true;
                    }
                }
            }
        }
        return changed;
    }

    /** Deep copy; option and input values are immutable and shared. */
    public Node copy() {
        Node n = new Node(id, type);
        n.options = new LinkedHashMap<>(options);
        for (var e : inputs.entrySet())
            n.inputs.put(e.getKey(), new ArrayList<>(e.getValue()));
        n.timeframe = timeframe;
        n.session = session;
        return n;
    }

    public void setOptions(Map<String, OptionValue> options) {
        this.options = new LinkedHashMap<>(options);
    }

    public void setInputs(Map<String, List<InputValue>> inputs) {
        this.inputs = new LinkedHashMap<>();
        for (var e : inputs.entrySet())
            this.inputs.put(e.getKey(), new ArrayList<>(e.getValue()));
    }
}

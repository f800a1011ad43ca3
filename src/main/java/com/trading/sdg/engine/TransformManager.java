package com.trading.sdg.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.api.Transform;
import com.trading.sdg.api.TransformCatalog;
import com.trading.sdg.api.ValidatedNode;
import com.trading.sdg.compiler.CompilationResult;

import lombok.extern.log4j.Log4j2;

/**
 * Keyed set of {@link ValidatedNode}s ready for execution, indexed by node id
 * and by output column ({@code <id>#<handle>}).
 * <p>
 * Built once per compilation and read-only during execution.
 */
@Log4j2
public final class TransformManager {

    /** Placeholder timeframe for scalar nodes; never read at runtime. */
    static final Timeframe SCALAR_FILLER = Timeframe.ONE_DAY;

    private final MetadataRegistry registry;
    private final Map<String, ValidatedNode> nodes = new LinkedHashMap<>();
    private final Map<String, ValidatedNode> byOutput = new HashMap<>();

    public TransformManager(MetadataRegistry registry) {
        this.registry = registry;
    }

    public static TransformManager fromCompilation(MetadataRegistry registry, CompilationResult result) {
        TransformManager m = new TransformManager(registry);
        for (Node n : result.nodes())
            m.insert(n);
        return m;
    }

    /**
     * Validates and stores a node. Inserting an id that is already present
     * returns the existing entry unchanged.
     *
     * @throws IllegalArgumentException if the type is unknown or the node is invalid.
     * @throws IllegalStateException    if a non-scalar node has no timeframe.
     */
    public ValidatedNode insert(Node node) {
        ValidatedNode existing = nodes.get(node.getId());
        if (existing != null)
            return existing;
        return store(validate(node));
    }

    /**
     * Inserts a copy of {@code node} under {@code name}.
     *
     * @throws IllegalStateException if the name is already taken.
     */
    public ValidatedNode insertNamed(String name, Node node) {
        if (nodes.containsKey(name))
            throw new IllegalStateException("Transform '" + name + "' is already registered");
        Node copy = node.copy();
        copy.setId(name);
        return store(validate(copy));
    }

    /**
     * Copies every node of {@code other} into this manager.
     *
     * @throws IllegalStateException if an id exists in both managers.
     */
    public void merge(TransformManager other) {
        for (ValidatedNode v : other.nodes.values())
            insertNamed(v.id(), v.toNode());
    }

    private ValidatedNode validate(Node node) {
        OperationMetadata meta = registry.find(node.getType()).orElseThrow(() -> new IllegalArgumentException(
                "Unknown operation type '" + node.getType() + "' for node '" + node.getId() + "'"));
        Timeframe tf = node.getTimeframe();
        if (tf == null) {
            if (!meta.isScalarCategory())
                throw new IllegalStateException("Node '" + node.getId() + "' (type: " + node.getType()
                        + ") has no timeframe. This indicates a compiler bug");
            tf = SCALAR_FILLER;
        }
        return ValidatedNode.of(node, tf, meta);
    }

    private ValidatedNode store(ValidatedNode v) {
        nodes.put(v.id(), v);
        for (String out : v.outputIds())
            byOutput.put(out, v);
        log.debug("Registered {}", v);
        return v;
    }

    public Optional<ValidatedNode> get(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /** Node producing the given output column. */
    public Optional<ValidatedNode> byOutputColumn(String column) {
        return Optional.ofNullable(byOutput.get(column));
    }

    public Collection<ValidatedNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Creates one executable instance per node.
     *
     * @throws IllegalArgumentException if the catalog lacks a node's type.
     */
    public Map<String, Transform> buildTransforms(TransformCatalog catalog) {
        Map<String, Transform> out = new LinkedHashMap<>();
        for (ValidatedNode v : nodes.values())
            out.put(v.id(), catalog.create(v));
        return out;
    }

    /** Mutable copies of the stored nodes, for serialization. */
    public List<Node> toNodes() {
        List<Node> out = new ArrayList<>(nodes.size());
        for (ValidatedNode v : nodes.values())
            out.add(v.toNode());
        return out;
    }
}

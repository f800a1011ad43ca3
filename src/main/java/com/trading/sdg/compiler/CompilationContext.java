package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.trading.sdg.api.Constant;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;

/**
 * Mutable state shared by the passes of one compilation: the nodes built so
 * far, the ids in use and the variable bindings of the script.
 */
final class CompilationContext {

    /** What a script variable stands for. */
    record Binding(Kind kind, String nodeId, String handle, Constant literal) {
        enum Kind {
            /** Whole node; usable bare only if it has a single output. */
            NODE,
            /** One output handle of a node. */
            HANDLE,
            LITERAL
        }

        static Binding node(String nodeId) {
            return new Binding(Kind.NODE, nodeId, null, null);
        }

        static Binding handle(String nodeId, String handle) {
            return new Binding(Kind.HANDLE, nodeId, handle, null);
        }

        static Binding literal(Constant value) {
            return new Binding(Kind.LITERAL, null, null, value);
        }
    }

    private final MetadataRegistry registry;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Integer> lines = new HashMap<>();
    private final Set<String> usedIds = new HashSet<>();
    private final Map<String, Binding> bindings = new HashMap<>();

    CompilationContext(MetadataRegistry registry) {
        this.registry = registry;
    }

    MetadataRegistry registry() {
        return registry;
    }

    /**
     * @throws CompileException UNKNOWN_OPERATION_TYPE if the type is not registered.
     */
    OperationMetadata metadata(String type, int line) {
        return registry.find(type).orElseThrow(() -> new CompileException(CompileErrorKind.UNKNOWN_OPERATION_TYPE,
                "Unknown component '" + type + "'", line));
    }

    boolean hasOperation(String type) {
        return registry.contains(type);
    }

    /** Lowest free {@code <base>_<n>}. */
    String uniqueId(String base) {
        int n = 0;
        while (usedIds.contains(base + "_" + n))
            n++;
        String id = base + "_" + n;
        usedIds.add(id);
        return id;
    }

    boolean isUsed(String id) {
        return usedIds.contains(id);
    }

    Set<String> usedIds() {
        return usedIds;
    }

    Node addNode(String id, String type, int line) {
        usedIds.add(id);
        Node node = new Node(id, type);
        nodes.put(id, node);
        lines.put(id, line);
        return node;
    }

    Node node(String id) {
        return nodes.get(id);
    }

    Collection<Node> nodes() {
        return nodes.values();
    }

    List<Node> nodeList() {
        return new ArrayList<>(nodes.values());
    }

    int lineOf(String id) {
        return lines.getOrDefault(id, 0);
    }

    Binding binding(String name) {
        return bindings.get(name);
    }

    /**
     * @throws CompileException VARIABLE_REBOUND if the name is already bound.
     */
    void bind(String name, Binding binding, int line) {
        if ("_".equals(name))
            return;
        if (bindings.containsKey(name))
            throw new CompileException(CompileErrorKind.VARIABLE_REBOUND, "Variable '" + name + "' already bound",
                    line);
        bindings.put(name, binding);
    }

    void checkUnbound(String name, int line) {
        if (!"_".equals(name) && (bindings.containsKey(name) || usedIds.contains(name)))
            throw new CompileException(CompileErrorKind.VARIABLE_REBOUND, "Variable '" + name + "' already bound",
                    line);
    }
}

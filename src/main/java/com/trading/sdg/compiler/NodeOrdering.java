package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.trading.sdg.api.Node;
import com.trading.sdg.engine.TopologicalOrder;

/** Sorts compiled nodes so that producers come before their consumers. */
final class NodeOrdering {

    private NodeOrdering() {
    }

    static TopologicalOrder order(List<Node> nodes) {
        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (Node n : nodes) {
            try {
                b.addNode(n.getId());
            } catch (IllegalArgumentException e) {
                throw CompileException.forNode(CompileErrorKind.VARIABLE_REBOUND, "Duplicate node id '" + n.getId()
                        + "'", n.getId(), n.getType(), null);
            }
        }
        for (Node n : nodes) {
            for (String ref : n.referencedNodeIds()) {
                if (!b.contains(ref))
                    throw CompileException.forNode(CompileErrorKind.UNBOUND_VARIABLE, "Node '" + n.getId()
                            + "' references unknown node '" + ref + "'", n.getId(), n.getType(), null);
                try {
                    b.addEdge(ref, n.getId());
                } catch (TopologicalOrder.CycleDetectedException e) {
                    throw cycle(e);
                }
            }
        }
        try {
            return b.build();
        } catch (TopologicalOrder.CycleDetectedException e) {
            throw cycle(e);
        }
    }

    /** Returns the nodes in dependency order. */
    static List<Node> sort(List<Node> nodes) {
        TopologicalOrder topo = order(nodes);
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node n : nodes)
            byId.put(n.getId(), n);
        List<Node> sorted = new ArrayList<>(nodes.size());
        for (String id : topo.ids())
            sorted.add(byId.get(id));
        return sorted;
    }

    private static CompileException cycle(TopologicalOrder.CycleDetectedException e) {
        return new CompileException(CompileErrorKind.CIRCULAR_DEPENDENCY, "Circular dependency between nodes "
                + e.remaining());
    }
}

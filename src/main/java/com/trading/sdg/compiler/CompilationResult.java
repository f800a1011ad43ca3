package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.trading.sdg.api.Node;

/**
 * Ordered, deduplicated node list produced by the compiler. Equality ignores
 * node order.
 */
public final class CompilationResult {

    private final List<Node> nodes;
    private final Map<String, Node> byId;

    public CompilationResult(List<Node> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        Map<String, Node> m = new HashMap<>();
        for (Node n : nodes) {
            if (m.put(n.getId(), n) != null)
                throw new IllegalArgumentException("Duplicate node id: " + n.getId());
        }
        this.byId = m;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> nodesOfType(String type) {
        List<Node> out = new ArrayList<>();
        for (Node n : nodes) {
            if (n.getType().equals(type))
                out.add(n);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CompilationResult other))
            return false;
        return byId.equals(other.byId);
    }

    @Override
    public int hashCode() {
        return byId.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CompilationResult[");
        for (int i = 0; i < nodes.size(); i++) {
            Node n = nodes.get(i);
            if (i > 0)
                sb.append(", ");
            sb.append(n.getId()).append(':').append(n.getType());
        }
        return sb.append(']').toString();
    }
}

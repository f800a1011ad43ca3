package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.ToLongFunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.sdg.api.InputValue;
import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.OptionValue;

/**
 * Common-subexpression elimination over a compiled node list.
 * <p>
 * Nodes are visited in dependency order. Before a node is hashed, its
 * references to already-removed duplicates are redirected to their canonical
 * node, so equal subtrees collapse bottom-up in a single pass. A hash match is
 * only a candidate: nodes merge when their type, options, inputs and (for
 * non-scalar types) timeframe and session are equal.
 * <p>
 * Executors and alias nodes are never merged: each one stands for a
 * user-visible binding.
 */
public final class CseOptimizer {
    private static final Logger log = LogManager.getLogger(CseOptimizer.class);

    private static final long SEED = 0xcbf29ce484222325L;
    private static final long GOLDEN = 0x9E3779B97F4A7C15L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final MetadataRegistry registry;
    private final ToLongFunction<Node> hasher;

    public CseOptimizer(MetadataRegistry registry) {
        this.registry = registry;
        this.hasher = this::semanticHash;
    }

    /** Uses a custom hash, so tests can force collisions. */
    CseOptimizer(MetadataRegistry registry, ToLongFunction<Node> hasher) {
        this.registry = registry;
        this.hasher = hasher;
    }

    /**
     * Outcome of one optimization run.
     *
     * @param nodes     surviving nodes, in their original relative order.
     * @param redirects removed id to canonical id.
     */
    public record Result(List<Node> nodes, Map<String, String> redirects) {
        public int removedCount() {
            return redirects.size();
        }
    }

    public Result optimize(List<Node> nodes) {
        return optimize(nodes, null);
    }

    /**
     * Merges duplicates in place.
     *
     * @param usedIds id registry of the compilation; removed ids are purged
     *                from it. May be null.
     */
    public Result optimize(List<Node> nodes, Set<String> usedIds) {
        Map<String, String> redirects = new LinkedHashMap<>();
        Map<Long, List<Node>> buckets = new HashMap<>();

        for (Node node : NodeOrdering.sort(nodes)) {
            if (!redirects.isEmpty()) {
                node.redirectReferences(redirects);
                rewriteSchemaOptions(node, redirects);
            }
            if (isExcluded(node))
                continue;
            long h = hasher.applyAsLong(node);
            List<Node> bucket = buckets.computeIfAbsent(h, k -> new ArrayList<>(1));
            Node canonical = null;
            for (Node candidate : bucket) {
                if (structurallyEqual(candidate, node)) {
                    canonical = candidate;
                    break;
                }
            }
            if (canonical == null) {
                bucket.add(node);
            } else {
                redirects.put(node.getId(), canonical.getId());
                log.debug("CSE: {} duplicates {}", node.getId(), canonical.getId());
            }
        }

        // Schema references carry no edge, so their owner may precede the duplicate they name
        List<Node> survivors = new ArrayList<>(nodes.size() - redirects.size());
        for (Node n : nodes) {
            if (redirects.containsKey(n.getId()))
                continue;
            if (!redirects.isEmpty()) {
                n.redirectReferences(redirects);
                rewriteSchemaOptions(n, redirects);
            }
            survivors.add(n);
        }
        if (usedIds != null)
            usedIds.removeAll(redirects.keySet());
        if (!redirects.isEmpty())
            log.debug("CSE removed {} of {} nodes", redirects.size(), nodes.size());
        return new Result(Collections.unmodifiableList(survivors), Collections.unmodifiableMap(redirects));
    }

    private boolean isExcluded(Node node) {
        if (node.getType().startsWith("alias"))
            return true;
        OperationMetadata meta = registry.find(node.getType()).orElse(null);
        return meta != null && meta.getCategory() == OperationMetadata.Category.EXECUTOR;
    }

    private boolean isScalar(Node node) {
        return registry.find(node.getType()).map(OperationMetadata::isScalarCategory).orElse(false);
    }

    /** Schema options may embed {@code "<id>#handle"} references inside their JSON text. */
    static void rewriteSchemaOptions(Node node, Map<String, String> redirects) {
        for (Map.Entry<String, OptionValue> e : node.getOptions().entrySet()) {
            if (e.getValue().kind() != OptionValue.Kind.SCHEMA)
                continue;
            String json = e.getValue().asString();
            String rewritten = json;
            for (Map.Entry<String, String> r : redirects.entrySet())
                rewritten = rewritten.replace("\"" + r.getKey() + "#", "\"" + r.getValue() + "#");
            if (!rewritten.equals(json))
                e.setValue(OptionValue.schema(rewritten));
        }
    }

    // ── Hashing ─────────────────────────────────────────────────────

    long semanticHash(Node node) {
        long h = SEED;
        h = fold(h, fnv1a(node.getType()));
        for (Map.Entry<String, OptionValue> e : new TreeMap<>(node.getOptions()).entrySet()) {
            h = fold(h, fnv1a(e.getKey()));
            h = fold(h, fnv1a(e.getValue().canonical()));
        }
        for (Map.Entry<String, List<InputValue>> e : new TreeMap<>(node.getInputs()).entrySet()) {
            h = fold(h, fnv1a(e.getKey()));
            for (InputValue v : e.getValue())
                h = fold(h, fnv1a(v.canonical()));
        }
        if (!isScalar(node)) {
            h = fold(h, fnv1a(node.getTimeframe() == null ? "" : node.getTimeframe().toString()));
            h = fold(h, node.getSession() == null ? 0 : node.getSession().hashCode());
        }
        return h;
    }

    private static long fold(long h, long v) {
        return h ^ (v + GOLDEN + (h << 6) + (h >>> 2));
    }

    static long fnv1a(String s) {
        long h = SEED;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    boolean structurallyEqual(Node a, Node b) {
        if (!a.getType().equals(b.getType()))
            return false;
        if (!a.getOptions().equals(b.getOptions()) || !sameInputs(a, b))
            return false;
        if (isScalar(a))
            return true;
        return Objects.equals(a.getTimeframe(), b.getTimeframe()) && Objects.equals(a.getSession(), b.getSession());
    }

    private static boolean sameInputs(Node a, Node b) {
        Set<String> keys = new HashSet<>(a.getInputs().keySet());
        keys.addAll(b.getInputs().keySet());
        for (String k : keys) {
            List<InputValue> x = a.getInputs().getOrDefault(k, List.of());
            List<InputValue> y = b.getInputs().getOrDefault(k, List.of());
            if (!x.equals(y))
                return false;
        }
        return true;
    }
}

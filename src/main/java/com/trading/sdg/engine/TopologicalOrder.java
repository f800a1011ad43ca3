package com.trading.sdg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable dependency order over string node ids. Producers come before
 * consumers; ties keep insertion order, which makes the order deterministic for
 * a given node list.
 * <p>
 * Edges are stored CSR-style: {@code childrenOffset[i]} points at the first
 * dependent of node {@code i} in {@code childrenList}, {@code childrenOffset[i+1]}
 * one past the last.
 */
public final class TopologicalOrder {
    private final String[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.nameToIndex = nameToIndex;
    }

    /** Node ids, producers first. */
    public List<String> ids() {
        return List.of(topoOrder);
    }

    public int topoIndex(String id) {
        Integer idx = nameToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    /** Ids of the direct dependents of a node. */
    public List<String> dependents(String id) {
        int ti = topoIndex(id);
        List<String> out = new ArrayList<>(childrenOffset[ti + 1] - childrenOffset[ti]);
        for (int i = childrenOffset[ti]; i < childrenOffset[ti + 1]; i++)
            out.add(topoOrder[childrenList[i]]);
        return out;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Thrown by {@link Builder#build()} when the edges contain a cycle. */
    public static final class CycleDetectedException extends IllegalStateException {
        private final List<String> remaining;

        CycleDetectedException(int processed, int total, List<String> remaining) {
            super("Cycle detected! Processed " + processed + " of " + total + ". Nodes on or behind a cycle: "
                    + remaining);
            this.remaining = List.copyOf(remaining);
        }

        public List<String> remaining() {
            return remaining;
        }
    }

    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String id) {
            if (nameToIdx.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            nameToIdx.put(id, nodes.size());
            nodes.add(id);
            forwardEdges.add(new LinkedHashSet<>());
            return this;
        }

        /** Edge from producer to consumer. Repeated edges collapse into one. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new CycleDetectedException(0, nodes.size(), List.of(from));
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public boolean contains(String id) {
            return nameToIdx.containsKey(id);
        }

        private int requireIndex(String id) {
            Integer idx = nameToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Kahn's algorithm.
         *
         * @throws CycleDetectedException if not every node could be ordered.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            for (Set<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            String[] ordered = new String[n];
            int[] topoMap = new int[n], reverseMap = new int[n];
            Map<String, Integer> index = new HashMap<>(n * 2);
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                ordered[topoIdx] = nodes.get(curr);
                index.put(ordered[topoIdx], topoIdx);
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                List<String> remaining = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        remaining.add(nodes.get(i));
                throw new CycleDetectedException(topoIdx, n, remaining);
            }

            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();
            int[] flat = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                int j = offsets[ti];
                for (int child : forwardEdges.get(reverseMap[ti]))
                    flat[j++] = topoMap[child];
            }
            return new TopologicalOrder(ordered, offsets, flat, Collections.unmodifiableMap(index));
        }
    }
}

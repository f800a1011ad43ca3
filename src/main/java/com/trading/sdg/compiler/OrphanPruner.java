package com.trading.sdg.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;

/**
 * Drops nodes that no sink depends on. A sink is an operation without outputs:
 * an executor, a report or an event marker.
 */
final class OrphanPruner {
    private static final Logger log = LogManager.getLogger(OrphanPruner.class);

    static final String NO_OUTPUT_MESSAGE = "Script has no output. Add at least one report or executor node "
            + "(e.g. trade_signal_executor)";

    private final MetadataRegistry registry;

    OrphanPruner(MetadataRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param skipSinkValidation keep every node when the script has no sink.
     * @throws CompileException NO_OUTPUT if there is no sink and validation is on.
     */
    List<Node> prune(List<Node> nodes, boolean skipSinkValidation, Set<String> usedIds) {
        Map<String, Node> byId = new HashMap<>();
        Deque<String> work = new ArrayDeque<>();
        for (Node n : nodes) {
            byId.put(n.getId(), n);
            if (registry.find(n.getType()).map(m -> m.isSink()).orElse(false))
                work.add(n.getId());
        }
        if (work.isEmpty()) {
            if (skipSinkValidation)
                return nodes;
            throw new CompileException(CompileErrorKind.NO_OUTPUT, NO_OUTPUT_MESSAGE);
        }
        Set<String> live = new HashSet<>();
        while (!work.isEmpty()) {
            String id = work.poll();
            Node n = byId.get(id);
            if (n == null || !live.add(id))
                continue;
            work.addAll(n.referencedNodeIds());
        }
        List<Node> kept = new ArrayList<>(live.size());
        for (Node n : nodes) {
            if (live.contains(n.getId())) {
                kept.add(n);
            } else {
                log.debug("Pruned orphan node {} ({})", n.getId(), n.getType());
                if (usedIds != null)
                    usedIds.remove(n.getId());
            }
        }
        return kept;
    }
}

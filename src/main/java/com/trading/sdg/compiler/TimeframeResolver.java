package com.trading.sdg.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.trading.sdg.api.MetadataRegistry;
import com.trading.sdg.api.Node;
import com.trading.sdg.api.OperationMetadata;
import com.trading.sdg.api.Timeframe;
import com.trading.sdg.engine.TopologicalOrder;

/**
 * Fills in the timeframe of nodes that were not given one.
 * <p>
 * A node takes the coarsest timeframe of the nodes it reads from (forward
 * pass). A node with nothing resolved upstream, for instance one fed only by
 * literals, takes the coarsest timeframe of its resolved consumers (backward
 * pass). Both passes walk the nodes in dependency order and repeat until
 * nothing changes, so long chains resolve regardless of declaration order.
 * Scalar-category nodes never get a timeframe and do not propagate one.
 */
public final class TimeframeResolver {
    private static final Logger log = LogManager.getLogger(TimeframeResolver.class);

    private final MetadataRegistry registry;

    public TimeframeResolver(MetadataRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolves timeframes in place.
     *
     * @param allowUnresolved leave nodes unresolved instead of failing, used
     *                        when compiling graph fragments without sinks.
     * @throws CompileException MISSING_TIMEFRAME for a node that requires an
     *                          explicit timeframe or cannot be resolved.
     */
    public void resolve(List<Node> nodes, boolean allowUnresolved) {
        TopologicalOrder topo = NodeOrdering.order(nodes);
        Map<String, Node> byId = new HashMap<>();
        for (Node n : nodes)
            byId.put(n.getId(), n);

        List<Node> pending = new ArrayList<>();
        for (String id : topo.ids()) {
            Node n = byId.get(id);
            OperationMetadata meta = metadata(n);
            if (meta.isScalarCategory() || n.getTimeframe() != null)
                continue;
            if (meta.isRequiresTimeFrame()) {
                if (!meta.isIntradayOnly())
                    throw CompileException.forNode(CompileErrorKind.MISSING_TIMEFRAME, "Node '" + n.getId()
                            + "' (type: " + n.getType() + ") requires a 'timeframe' parameter", n.getId(),
                            n.getType(), "timeframe");
                n.setTimeframe(Timeframe.ONE_MINUTE);
                continue;
            }
            pending.add(n);
        }

        boolean changed = true;
        int rounds = 0;
        while (changed && !pending.isEmpty()) {
            changed = false;
            rounds++;
            // Forward: coarsest resolved producer
            for (Node n : pending) {
                if (n.getTimeframe() != null)
                    continue;
                Timeframe tf = null;
                for (String ref : n.referencedNodeIds())
                    tf = Timeframe.coarsest(tf, periodic(byId.get(ref)));
                if (tf != null) {
                    n.setTimeframe(tf);
                    changed = true;
                }
            }
            // Backward: coarsest resolved consumer, visited consumers first
            for (int i = pending.size() - 1; i >= 0; i--) {
                Node n = pending.get(i);
                if (n.getTimeframe() != null)
                    continue;
                Timeframe tf = null;
                for (String dep : topo.dependents(n.getId()))
                    tf = Timeframe.coarsest(tf, periodic(byId.get(dep)));
                if (tf != null) {
                    n.setTimeframe(tf);
                    changed = true;
                }
            }
        }

        for (Node n : pending) {
            if (n.getTimeframe() != null) {
                log.debug("Resolved timeframe of {} to {}", n.getId(), n.getTimeframe());
                continue;
            }
            if (metadata(n).isIntradayOnly()) {
                n.setTimeframe(Timeframe.ONE_MINUTE);
                continue;
            }
            if (!allowUnresolved)
                throw CompileException.forNode(CompileErrorKind.MISSING_TIMEFRAME, "Could not resolve timeframe for node '"
                        + n.getId() + "' (type: " + n.getType() + ")", n.getId(), n.getType(), "timeframe");
            log.debug("Leaving timeframe of {} unresolved", n.getId());
        }
        log.debug("Timeframe resolution finished after {} round(s)", rounds);
    }

    /** Timeframe of a node, ignoring scalars which never carry a meaningful one. */
    private Timeframe periodic(Node n) {
        return metadata(n).isScalarCategory() ? null : n.getTimeframe();
    }

    private OperationMetadata metadata(Node n) {
        return registry.find(n.getType()).orElseThrow(() -> CompileException.forNode(
                CompileErrorKind.UNKNOWN_OPERATION_TYPE, "Unknown component '" + n.getType() + "'", n.getId(),
                n.getType(), null));
    }
}

package com.behandlingflow.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Raw flow graph reachable from one entry activity.
 *
 * @param entryActivity the entry activity
 * @param nodes visited activities in visit order, each exactly once
 * @param edges raw edges in traversal order, parallel duplicates included
 * @param missingProcessors visited activities without a processor
 */
public record FlowGraph(
    String entryActivity,
    List<String> nodes,
    List<FlowEdge> edges,
    Set<String> missingProcessors
) {
    /** Synthetic node reached when a processor completes the flow. */
    public static final String END_NODE = "END";

    /**
     * Compact constructor with validation.
     */
    public FlowGraph {
        Objects.requireNonNull(entryActivity, "entryActivity must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        missingProcessors = missingProcessors == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(missingProcessors));
    }

    public boolean contains(String activity) {
        return nodes.contains(activity);
    }

    public boolean isProcessorMissing(String activity) {
        return missingProcessors.contains(activity);
    }

    /**
     * Returns the raw edges leaving an activity, in traversal order.
     *
     * @param activity source activity
     * @return outbound edges
     */
    public List<FlowEdge> outgoing(String activity) {
        return edges.stream().filter(e -> e.from().equals(activity)).toList();
    }
}

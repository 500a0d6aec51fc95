package com.behandlingflow.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a generator needs to draw the flow of one entry point.
 *
 * @param behandlingName name of the entry class, used for the title and file name
 * @param graph raw traversal result
 * @param cycles back-edges and cycle clusters
 * @param edges edges to draw (consolidated unless consolidation is disabled)
 * @param iterationGroups per-item loops outside cycle clusters
 * @param manualTaskActivities activities whose processor creates a manual task
 * @param supertypesByActivity supertypes of activity classes known to the index
 */
public record FlowDiagramModel(
    String behandlingName,
    FlowGraph graph,
    CycleAnalysis cycles,
    List<FlowEdge> edges,
    List<IterationGroup> iterationGroups,
    Set<String> manualTaskActivities,
    Map<String, List<String>> supertypesByActivity
) {
    /**
     * Compact constructor with validation.
     */
    public FlowDiagramModel {
        Objects.requireNonNull(behandlingName, "behandlingName must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        if (cycles == null) {
            cycles = CycleAnalysis.none();
        }
        edges = edges == null ? graph.edges() : List.copyOf(edges);
        iterationGroups = iterationGroups == null ? List.of() : List.copyOf(iterationGroups);
        manualTaskActivities = manualTaskActivities == null ? Set.of() : Set.copyOf(manualTaskActivities);
        supertypesByActivity = supertypesByActivity == null ? Map.of() : Map.copyOf(supertypesByActivity);
    }

    public String entryActivity() {
        return graph.entryActivity();
    }

    public boolean createsManualTask(String activity) {
        return manualTaskActivities.contains(activity);
    }

    public List<String> supertypesOf(String activity) {
        return supertypesByActivity.getOrDefault(activity, List.of());
    }
}

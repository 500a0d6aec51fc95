package com.behandlingflow.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Result of cycle detection over one flow graph.
 *
 * @param backEdges back-edges in discovery order
 * @param clusters disjoint cycle clusters in discovery order
 */
public record CycleAnalysis(
    Set<EdgeKey> backEdges,
    List<CycleCluster> clusters
) {
    /**
     * Compact constructor with validation.
     */
    public CycleAnalysis {
        backEdges = backEdges == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(backEdges));
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }

    /**
     * Analysis of an acyclic graph.
     *
     * @return empty analysis
     */
    public static CycleAnalysis none() {
        return new CycleAnalysis(Set.of(), List.of());
    }

    public boolean isBackEdge(String from, String to) {
        return backEdges.contains(new EdgeKey(from, to));
    }

    public boolean hasCycles() {
        return !backEdges.isEmpty();
    }

    /**
     * Finds the cluster containing an activity.
     *
     * @param activity activity name
     * @return the cluster, or empty if the activity is not on a cycle
     */
    public Optional<CycleCluster> clusterOf(String activity) {
        return clusters.stream().filter(c -> c.contains(activity)).findFirst();
    }
}

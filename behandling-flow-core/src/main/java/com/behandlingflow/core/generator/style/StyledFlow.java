package com.behandlingflow.core.generator.style;

import java.util.List;
import java.util.Objects;

import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.IterationGroup;
import com.behandlingflow.core.model.RenderedEdge;
import com.behandlingflow.core.model.RenderedNode;

/**
 * Styled flow, ready to be serialized by a generator.
 *
 * @param title diagram title
 * @param nodes styled nodes in visit order
 * @param edges styled edges in consolidated order
 * @param clusters cycle clusters, members validated against the nodes
 * @param iterationGroups iteration groups, members validated against the nodes
 */
public record StyledFlow(
    String title,
    List<RenderedNode> nodes,
    List<RenderedEdge> edges,
    List<CycleCluster> clusters,
    List<IterationGroup> iterationGroups
) {
    /**
     * Compact constructor with validation.
     */
    public StyledFlow {
        Objects.requireNonNull(title, "title must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        iterationGroups = iterationGroups == null ? List.of() : List.copyOf(iterationGroups);
    }
}

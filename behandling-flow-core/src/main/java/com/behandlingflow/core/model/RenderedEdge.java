package com.behandlingflow.core.model;

import java.util.Objects;

/**
 * Styled edge ready for serialization.
 *
 * @param from source node id
 * @param to target node id
 * @param label final label text (not escaped), may be empty
 * @param kind how the edge is drawn
 * @param color edge color as hex string, or null for the default
 * @param penWidth pen width, or null for the default
 * @param style line style (bold, dashed), or null for the default
 * @param constraint whether the edge takes part in rank assignment
 */
public record RenderedEdge(
    String from,
    String to,
    String label,
    EdgeKind kind,
    String color,
    String penWidth,
    String style,
    boolean constraint
) {
    /**
     * Compact constructor with validation.
     */
    public RenderedEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (label == null) {
            label = "";
        }
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }
}

package com.behandlingflow.core.model;

import java.util.Objects;

/**
 * Styled node ready for serialization.
 *
 * @param id activity name used as node identifier
 * @param label display label (already shortened and prefixed, not escaped)
 * @param fillColor fill color as hex string
 * @param shape node shape (box, circle, diamond)
 * @param style node style (e.g. "rounded,filled")
 * @param category category that selected the style
 */
public record RenderedNode(
    String id,
    String label,
    String fillColor,
    String shape,
    String style,
    NodeCategory category
) {
    /**
     * Compact constructor with validation.
     */
    public RenderedNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(fillColor, "fillColor must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (style == null) {
            style = "";
        }
    }
}

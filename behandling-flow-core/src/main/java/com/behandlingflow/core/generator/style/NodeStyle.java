package com.behandlingflow.core.generator.style;

import java.util.Objects;

import com.behandlingflow.core.model.NodeCategory;

/**
 * Visual attributes selected by a {@link NodeStyleRule}.
 *
 * @param category category shown in the legend
 * @param fillColor fill color as hex string
 * @param shape node shape
 * @param labelPrefix text put in front of the display label, may be empty
 */
public record NodeStyle(
    NodeCategory category,
    String fillColor,
    String shape,
    String labelPrefix
) {
    public static final String SHAPE_BOX = "box";
    public static final String SHAPE_CIRCLE = "circle";
    public static final String SHAPE_DIAMOND = "diamond";

    /**
     * Compact constructor with validation.
     */
    public NodeStyle {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(fillColor, "fillColor must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        if (labelPrefix == null) {
            labelPrefix = "";
        }
    }

    static NodeStyle box(NodeCategory category, String fillColor) {
        return new NodeStyle(category, fillColor, SHAPE_BOX, "");
    }
}

package com.behandlingflow.core.generator.style;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A predicate over a node paired with the style it selects.
 *
 * @param name rule name, for diagnostics
 * @param predicate condition the node must satisfy
 * @param style style applied when the predicate holds
 */
public record NodeStyleRule(
    String name,
    Predicate<NodeContext> predicate,
    NodeStyle style
) {
    /**
     * Compact constructor with validation.
     */
    public NodeStyleRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(style, "style must not be null");
    }

    public boolean matches(NodeContext node) {
        return predicate.test(node);
    }
}

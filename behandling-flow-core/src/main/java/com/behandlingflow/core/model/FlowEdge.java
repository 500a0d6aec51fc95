package com.behandlingflow.core.model;

import java.util.Objects;

/**
 * A directed edge between two activities.
 *
 * <p>Edges produced by traversal have multiplicity 1. Summary edges produced by
 * consolidation record how many parallel edges they stand for.
 *
 * @param from source activity
 * @param to target activity
 * @param label condition text, fallback marker, summary text or empty
 * @param featureFlag feature toggle guarding the edge, or null
 * @param collection whether the target is created once per collection item
 * @param multiplicity number of raw edges represented
 */
public record FlowEdge(
    String from,
    String to,
    String label,
    String featureFlag,
    boolean collection,
    int multiplicity
) {
    /**
     * Compact constructor with validation.
     */
    public FlowEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (label == null) {
            label = "";
        }
        if (multiplicity < 1) {
            throw new IllegalArgumentException("multiplicity must be positive: " + multiplicity);
        }
    }

    /**
     * Creates a plain edge.
     *
     * @param from source activity
     * @param to target activity
     * @param label edge label
     * @return edge with multiplicity 1
     */
    public static FlowEdge of(String from, String to, String label) {
        return new FlowEdge(from, to, label, null, false, 1);
    }

    public EdgeKey key() {
        return new EdgeKey(from, to);
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }

    public boolean isSummary() {
        return multiplicity > 1;
    }
}

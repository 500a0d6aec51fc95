package com.behandlingflow.core.model;

import java.util.Objects;

/**
 * Two facts claiming the same key; the later one replaced the earlier one.
 *
 * @param type what kind of fact collided
 * @param key the contested class name or activity name
 * @param replaced description of the overwritten fact
 * @param winner description of the fact that was kept
 */
public record FactConflict(
    ConflictType type,
    String key,
    String replaced,
    String winner
) {
    /**
     * Compact constructor with validation.
     */
    public FactConflict {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    /**
     * Kinds of fact collisions.
     */
    public enum ConflictType {
        /** Two classes with the same simple name */
        DUPLICATE_CLASS,

        /** Two processors handling the same activity */
        DUPLICATE_PROCESSOR
    }

    /**
     * Human-readable one-line description.
     *
     * @return description
     */
    public String describe() {
        return switch (type) {
            case DUPLICATE_CLASS -> "Duplicate class " + key + ": " + winner + " replaces " + replaced;
            case DUPLICATE_PROCESSOR -> "Duplicate processor for " + key + ": " + winner + " replaces " + replaced;
        };
    }
}

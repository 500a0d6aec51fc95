package com.behandlingflow.core.engine;

import java.util.Objects;

import com.behandlingflow.core.generator.GeneratedDiagram;

/**
 * Outcome of generating the diagram of one entry point.
 *
 * @param behandlingName entry class name
 * @param success whether a diagram was produced
 * @param diagram the diagram, or null on failure
 * @param errorMessage why generation failed, or null on success
 */
public record EntryPointResult(
    String behandlingName,
    boolean success,
    GeneratedDiagram diagram,
    String errorMessage
) {
    /**
     * Compact constructor with validation.
     */
    public EntryPointResult {
        Objects.requireNonNull(behandlingName, "behandlingName must not be null");
        if (success) {
            Objects.requireNonNull(diagram, "diagram must not be null for a successful result");
        } else if (errorMessage == null) {
            errorMessage = "unknown error";
        }
    }

    /**
     * Creates a successful result.
     *
     * @param behandlingName entry class name
     * @param diagram generated diagram
     * @return successful result
     */
    public static EntryPointResult success(String behandlingName, GeneratedDiagram diagram) {
        return new EntryPointResult(behandlingName, true, diagram, null);
    }

    /**
     * Creates a failed result.
     *
     * @param behandlingName entry class name
     * @param errorMessage failure description
     * @return failed result
     */
    public static EntryPointResult failed(String behandlingName, String errorMessage) {
        return new EntryPointResult(behandlingName, false, null, errorMessage);
    }
}

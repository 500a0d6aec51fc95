package com.behandlingflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Flow logic owned by one processor class: given an activity, decide the next one(s).
 *
 * <p>An empty transition list means the processor completes the flow explicitly.
 *
 * @param processedActivityName the activity this processor handles (edge source)
 * @param processorName processor class name
 * @param transitions outbound transitions in source order
 * @param createsManualTask whether the processor opens a manual task
 */
public record ProcessorFact(
    String processedActivityName,
    String processorName,
    List<Transition> transitions,
    boolean createsManualTask
) {
    /**
     * Compact constructor with validation.
     */
    public ProcessorFact {
        Objects.requireNonNull(processedActivityName, "processedActivityName must not be null");
        if (processorName == null) {
            processorName = processedActivityName + "Processor";
        }
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    /**
     * Returns whether the processor signals "flow complete" instead of a next activity.
     *
     * @return true if there are no transitions
     */
    public boolean completesFlow() {
        return transitions.isEmpty();
    }
}

package com.behandlingflow.core.model;

/**
 * Visual category assigned to an activity node. Each category has its own color in the legend.
 */
public enum NodeCategory {
    ENTRY("Start/Entry"),
    HIGHLIGHTED("Highlighted supertype"),
    MANUAL_TASK("Creates manual task"),
    WAITING("Waiting"),
    MANUAL("Manual intervention"),
    ABORT("Abort/Rejection"),
    DECISION("Decision/Execution"),
    END("End"),
    NOT_FOUND("Processor not found"),
    DEFAULT("Activity");

    private final String description;

    NodeCategory(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

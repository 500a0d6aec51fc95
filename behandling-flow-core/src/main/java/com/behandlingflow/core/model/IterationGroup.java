package com.behandlingflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Activities repeated once per item after a collection edge.
 *
 * @param triggerNode activity whose processor creates the per-item activities
 * @param members activities executed per item, in path order
 */
public record IterationGroup(
    String triggerNode,
    List<String> members
) {
    /**
     * Compact constructor with validation.
     */
    public IterationGroup {
        Objects.requireNonNull(triggerNode, "triggerNode must not be null");
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("An iteration group must contain at least one activity");
        }
        members = List.copyOf(members);
    }
}

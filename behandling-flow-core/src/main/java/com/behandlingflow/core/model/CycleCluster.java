package com.behandlingflow.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A maximal group of activities connected through cycles, rendered as one visual group.
 *
 * @param members activity names in discovery order, never empty
 */
public record CycleCluster(List<String> members) {

    /**
     * Compact constructor with validation. Duplicates are removed, order is kept.
     */
    public CycleCluster {
        Objects.requireNonNull(members, "members must not be null");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cycle cluster must contain at least one activity");
        }
        members = List.copyOf(new LinkedHashSet<>(members));
    }

    public boolean contains(String activity) {
        return members.contains(activity);
    }

    public int size() {
        return members.size();
    }
}

package com.behandlingflow.core.model;

import java.util.Objects;

/**
 * Directed node pair identifying all parallel edges between two activities.
 *
 * @param from source activity
 * @param to target activity
 */
public record EdgeKey(String from, String to) {

    public EdgeKey {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}

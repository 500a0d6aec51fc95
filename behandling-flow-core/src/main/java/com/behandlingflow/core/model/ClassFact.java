package com.behandlingflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A class discovered by the source extractor.
 *
 * <p>Only classes that define an initial activity factory carry an
 * {@code initialActivityName}; those classes are the entry points of a flow.
 *
 * @param name simple class name, used as the lookup key
 * @param sourceLocation where the class was found (opaque to the engine)
 * @param supertypeNames direct supertypes in declaration order
 * @param initialActivityName activity returned by the initial activity factory, or null
 */
public record ClassFact(
    String name,
    String sourceLocation,
    List<String> supertypeNames,
    String initialActivityName
) {
    /**
     * Compact constructor with validation.
     */
    public ClassFact {
        Objects.requireNonNull(name, "name must not be null");
        supertypeNames = supertypeNames == null ? List.of() : List.copyOf(supertypeNames);
        if (initialActivityName != null && initialActivityName.isBlank()) {
            initialActivityName = null;
        }
    }

    /**
     * Returns whether this class starts a flow.
     *
     * @return true if an initial activity is known
     */
    public boolean isEntryPoint() {
        return initialActivityName != null;
    }
}

package com.behandlingflow.core.extractor;

import java.nio.file.Path;
import java.util.Objects;

import com.behandlingflow.core.model.FactSet;

/**
 * Facts read from one file.
 *
 * @param source file the facts came from
 * @param facts facts in document order
 */
public record FactDocument(Path source, FactSet facts) {

    public FactDocument {
        Objects.requireNonNull(source, "source must not be null");
        if (facts == null) {
            facts = FactSet.empty();
        }
    }
}

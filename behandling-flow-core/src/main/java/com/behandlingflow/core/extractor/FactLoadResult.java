package com.behandlingflow.core.extractor;

import java.nio.file.Path;
import java.util.List;

import com.behandlingflow.core.model.FactSet;

/**
 * Merged outcome of all fact extractors.
 *
 * @param facts facts in source path order, then document order
 * @param sources files facts were read from, in merge order
 * @param warnings skipped files or entries
 * @param errors extractor failures
 */
public record FactLoadResult(
    FactSet facts,
    List<Path> sources,
    List<String> warnings,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public FactLoadResult {
        if (facts == null) {
            facts = FactSet.empty();
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasDocuments() {
        return !sources.isEmpty();
    }
}

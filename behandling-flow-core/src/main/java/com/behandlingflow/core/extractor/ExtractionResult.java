package com.behandlingflow.core.extractor;

import java.util.List;
import java.util.Objects;

import com.behandlingflow.core.model.FactSet;

/**
 * Result returned by a fact extractor.
 *
 * @param extractorId ID of the extractor that produced this result
 * @param success whether extraction completed
 * @param documents facts per file, in path order
 * @param warnings non-fatal issues (skipped files or entries)
 * @param errors fatal errors that prevented extraction
 */
public record ExtractionResult(
    String extractorId,
    boolean success,
    List<FactDocument> documents,
    List<String> warnings,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public ExtractionResult {
        Objects.requireNonNull(extractorId, "extractorId must not be null");
        documents = documents == null ? List.of() : List.copyOf(documents);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a successful result with no documents.
     *
     * @param extractorId extractor ID
     * @return empty result
     */
    public static ExtractionResult empty(String extractorId) {
        return new ExtractionResult(extractorId, true, List.of(), List.of(), List.of());
    }

    /**
     * Creates a failed result.
     *
     * @param extractorId extractor ID
     * @param errors error messages
     * @return failed result
     */
    public static ExtractionResult failed(String extractorId, List<String> errors) {
        return new ExtractionResult(extractorId, false, List.of(), List.of(), errors);
    }

    /**
     * Merges the facts of all documents in order.
     *
     * @return combined facts
     */
    public FactSet facts() {
        FactSet facts = FactSet.empty();
        for (FactDocument document : documents) {
            facts = facts.merge(document.facts());
        }
        return facts;
    }
}

package com.behandlingflow.core.extractor;

import java.util.Set;

/**
 * Interface for components that supply class and processor facts.
 *
 * <p>The flow engine never reads source code. Extractors bridge that gap: each one finds the
 * files it understands below the root path and turns them into {@link com.behandlingflow.core.model.ClassFact}
 * and {@link com.behandlingflow.core.model.ProcessorFact} records.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.behandlingflow.core.extractor.FactExtractor}
 *
 * @see ExtractionContext
 * @see ExtractionResult
 */
public interface FactExtractor {

    /**
     * Returns unique identifier for this extractor (e.g., "json-facts").
     *
     * @return unique extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this extractor.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns glob patterns of the files this extractor reads, relative to the root path.
     *
     * @return file patterns
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Returns execution priority; lower values run first.
     *
     * @return priority
     */
    int getPriority();

    /**
     * Checks whether the extractor has anything to read below the root path.
     *
     * @param context extraction context
     * @return true if matching files exist
     */
    boolean appliesTo(ExtractionContext context);

    /**
     * Extracts facts from every supported file.
     *
     * <p>Unreadable files are reported as warnings and skipped; the result stays successful.
     *
     * @param context extraction context
     * @return extraction result with one document per file read
     */
    ExtractionResult extract(ExtractionContext context);
}

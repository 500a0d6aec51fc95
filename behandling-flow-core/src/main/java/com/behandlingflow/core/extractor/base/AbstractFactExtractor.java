package com.behandlingflow.core.extractor.base;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.extractor.ExtractionContext;
import com.behandlingflow.core.extractor.ExtractionResult;
import com.behandlingflow.core.extractor.FactDocument;
import com.behandlingflow.core.extractor.FactExtractor;

/**
 * Base class for fact extractors with logging, file reading and result helpers.
 *
 * <p>Subclasses implement {@link #getId()}, {@link #getDisplayName()},
 * {@link #getSupportedFilePatterns()} and {@link #extract(ExtractionContext)}.
 * {@link #appliesTo(ExtractionContext)} defaults to "any supported file exists".
 */
public abstract class AbstractFactExtractor implements FactExtractor {

    protected final Logger log;

    protected AbstractFactExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(ExtractionContext context) {
        return !findSupportedFiles(context).isEmpty();
    }

    // ==================== File Utilities ====================

    /**
     * Finds all files matching {@link #getSupportedFilePatterns()}.
     *
     * @param context extraction context
     * @return files sorted by path
     */
    protected List<Path> findSupportedFiles(ExtractionContext context) {
        return context.findFiles(getSupportedFilePatterns().toArray(String[]::new));
    }

    /**
     * Reads file content as a string.
     *
     * @param file file to read
     * @return file content
     * @throws IOException if the file cannot be read
     */
    protected String readFileContent(Path file) throws IOException {
        return Files.readString(file);
    }

    // ==================== Result Helpers ====================

    protected ExtractionResult emptyResult() {
        return ExtractionResult.empty(getId());
    }

    protected ExtractionResult failedResult(List<String> errors) {
        return ExtractionResult.failed(getId(), errors);
    }

    protected ExtractionResult successResult(List<FactDocument> documents, List<String> warnings) {
        return new ExtractionResult(getId(), true, documents, warnings, List.of());
    }
}

package com.behandlingflow.core.extractor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.model.FactSet;

/**
 * Runs all applicable fact extractors and merges their documents.
 *
 * <p>Documents from all extractors are merged in source path order, then document order, so
 * "last one wins" conflicts in the {@link com.behandlingflow.core.index.FactIndex} resolve the
 * same way on every run regardless of extractor order.
 */
public class FactLoader {

    private static final Logger log = LoggerFactory.getLogger(FactLoader.class);

    private final List<FactExtractor> extractors;

    /**
     * Creates a loader using extractors discovered via {@link ServiceLoader}.
     */
    public FactLoader() {
        this(discoverExtractors());
    }

    public FactLoader(List<FactExtractor> extractors) {
        Objects.requireNonNull(extractors, "extractors must not be null");
        this.extractors = extractors.stream()
            .sorted(Comparator.comparingInt(FactExtractor::getPriority).thenComparing(FactExtractor::getId))
            .toList();
    }

    /**
     * Discovers extractors registered in {@code META-INF/services}.
     *
     * @return extractors sorted by priority
     */
    public static List<FactExtractor> discoverExtractors() {
        log.debug("Discovering fact extractors via ServiceLoader");
        ServiceLoader<FactExtractor> loader = ServiceLoader.load(FactExtractor.class);
        List<FactExtractor> extractors = new ArrayList<>();
        loader.forEach(extractors::add);
        extractors.sort(Comparator.comparingInt(FactExtractor::getPriority));

        log.debug("Discovered {} fact extractors", extractors.size());
        if (log.isDebugEnabled()) {
            extractors.forEach(e -> log.debug("  - {} ({})", e.getId(), e.getDisplayName()));
        }
        return extractors;
    }

    public List<FactExtractor> getExtractors() {
        return extractors;
    }

    /**
     * Loads facts below the context root.
     *
     * @param context extraction context
     * @return merged facts with the documents read and any problems
     */
    public FactLoadResult load(ExtractionContext context) {
        Objects.requireNonNull(context, "context must not be null");

        List<FactDocument> documents = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (FactExtractor extractor : extractors) {
            if (!extractor.appliesTo(context)) {
                log.debug("Extractor {} does not apply to {}", extractor.getId(), context.rootPath());
                continue;
            }
            try {
                ExtractionResult result = extractor.extract(context);
                documents.addAll(result.documents());
                warnings.addAll(result.warnings());
                errors.addAll(result.errors());
            } catch (RuntimeException e) {
                log.error("Extractor {} failed: {}", extractor.getId(), e.getMessage(), e);
                errors.add(extractor.getId() + ": " + e.getMessage());
            }
        }

        documents.sort(Comparator.comparing(FactDocument::source));

        FactSet facts = FactSet.empty();
        for (FactDocument document : documents) {
            facts = facts.merge(document.facts());
        }
        return new FactLoadResult(facts, documents.stream().map(FactDocument::source).toList(), warnings, errors);
    }
}

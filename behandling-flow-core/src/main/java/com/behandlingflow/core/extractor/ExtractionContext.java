package com.behandlingflow.core.extractor;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context provided to fact extractors.
 *
 * @param rootPath root directory to search
 * @param settings extractor-specific settings
 */
public record ExtractionContext(
    Path rootPath,
    Map<String, String> settings
) {
    private static final Logger log = LoggerFactory.getLogger(ExtractionContext.class);

    /**
     * Compact constructor with validation.
     */
    public ExtractionContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    public static ExtractionContext of(Path rootPath) {
        return new ExtractionContext(rootPath, Map.of());
    }

    /**
     * Finds files below the root whose relative path matches any of the glob patterns.
     *
     * <p>A pattern such as {@code *.facts.json} only matches files directly in the root;
     * prefix it with a double-star directory segment to match files in subdirectories.
     *
     * @param patterns glob patterns relative to the root
     * @return matching regular files, sorted by path, without duplicates
     */
    public List<Path> findFiles(String... patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }

        TreeSet<Path> matches = new TreeSet<>();
        try (Stream<Path> files = Files.walk(rootPath)) {
            files.filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matchers.stream().anyMatch(m -> m.matches(relativePath));
                })
                .forEach(matches::add);
        } catch (IOException e) {
            log.warn("Failed to walk directory {}: {}", rootPath, e.getMessage());
        }
        return new ArrayList<>(matches);
    }

    public String getSetting(String key) {
        return settings.get(key);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}

package com.behandlingflow.core.renderer;

import java.util.Objects;

import com.behandlingflow.core.generator.GeneratedDiagram;

/**
 * A file to be rendered.
 *
 * @param relativePath path relative to the output directory
 * @param content file content
 * @param contentType content type hint (e.g. "text/vnd.graphviz")
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Wraps a generated diagram.
     *
     * @param diagram generated diagram
     * @return file named after the diagram
     */
    public static GeneratedFile of(GeneratedDiagram diagram) {
        return new GeneratedFile(diagram.fileName(), diagram.content(), contentTypeFor(diagram.fileExtension()));
    }

    public boolean isDot() {
        return relativePath.endsWith(".dot");
    }

    private static String contentTypeFor(String extension) {
        return switch (extension) {
            case "dot" -> "text/vnd.graphviz";
            case "md" -> "text/markdown";
            default -> "text/plain";
        };
    }
}

package com.behandlingflow.core.renderer;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for delivering generated diagrams to their destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.behandlingflow.core.renderer.OutputRenderer}
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "filesystem", "graphviz").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Renders the output.
     *
     * @param output files to render
     * @param context output directory and settings
     * @return files written to disk, empty for non-file renderers
     * @throws IllegalStateException if writing fails
     */
    List<Path> render(GeneratedOutput output, RenderContext context);
}

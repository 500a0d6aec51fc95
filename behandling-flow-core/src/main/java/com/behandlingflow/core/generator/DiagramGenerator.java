package com.behandlingflow.core.generator;

import com.behandlingflow.core.model.FlowDiagramModel;

/**
 * Interface for generators that serialize an analyzed flow into a diagram description.
 *
 * <p>Generators receive a fully analyzed {@link FlowDiagramModel} (traversal, cycles,
 * consolidated edges, iteration groups) and turn it into text in a specific syntax, such as
 * Graphviz DOT or Mermaid. Generators are pure: they perform no I/O and produce identical output
 * for identical input.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()} from configuration or the command line.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class DotGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Graphviz DOT Generator";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "dot";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(FlowDiagramModel model, GeneratorConfig config) {
 *         String content = ...;
 *         return new GeneratedDiagram(model.behandlingName() + "_flow", content, "dot");
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.behandlingflow.core.generator.DiagramGenerator}
 *
 * @see FlowDiagramModel
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration. Should be lowercase
     * (e.g., "dot", "mermaid", "text").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates a diagram for one entry point.
     *
     * @param model the analyzed flow
     * @param config configuration settings for generation
     * @return generated diagram content
     * @throws IllegalStateException if the model violates a structural invariant
     */
    GeneratedDiagram generate(FlowDiagramModel model, GeneratorConfig config);
}

package com.behandlingflow.core.config;

import java.util.List;
import java.util.Map;

import com.behandlingflow.core.consolidate.EdgeConsolidator;
import com.behandlingflow.core.generator.EdgeRouting;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.style.NodeStyleSettings;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration record loaded from {@code behandling-flow.yaml}.
 *
 * <p>Every section and every value is optional; missing values take their defaults.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * project:
 *   name: pensjon-behandlinger
 * diagram:
 *   generator: dot
 *   edgeStyle: orthogonal
 *   showConditions: true
 *   showLegend: true
 *   summaryThreshold: 2
 *   heavyThreshold: 4
 * styles:
 *   waitingKeywords: [Vent, Wait, Pause]
 *   highlightSupertypes: [AldeAktivitet]
 * output:
 *   directory: ./flows
 *   format: svg
 *   keepDot: false
 *   renderer: graphviz
 * }</pre>
 *
 * @param project project metadata
 * @param diagram diagram generation settings
 * @param styles node styling and label settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("diagram") DiagramSettings diagram,
    @JsonProperty("styles") StyleSettings styles,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor; missing sections take their defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo(null, null);
        }
        if (diagram == null) {
            diagram = new DiagramSettings(null, null, null, null, null, null, null);
        }
        if (styles == null) {
            styles = new StyleSettings(null, null, null, null, null, null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null, null, null);
        }
    }

    /**
     * Creates default configuration.
     *
     * @return default config
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Builds the generator configuration described by the diagram and styles sections.
     *
     * @return generator config
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(
            EdgeRouting.parse(diagram.edgeStyle()),
            diagram.showConditions(),
            diagram.showLegend(),
            diagram.deduplicate(),
            diagram.summaryThreshold(),
            diagram.heavyThreshold(),
            styles.toNodeStyleSettings(),
            Map.of());
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param description project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {
        public ProjectInfo {
            if (name == null) {
                name = "project";
            }
        }
    }

    /**
     * Diagram generation settings.
     *
     * @param generator generator id (dot, mermaid, text)
     * @param edgeStyle straight, curved or orthogonal
     * @param showConditions whether condition labels are drawn
     * @param showLegend whether a legend is appended
     * @param deduplicate whether parallel edges are consolidated
     * @param summaryThreshold smallest summarized edge count
     * @param heavyThreshold smallest heavy summary edge count
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("generator") String generator,
        @JsonProperty("edgeStyle") String edgeStyle,
        @JsonProperty("showConditions") Boolean showConditions,
        @JsonProperty("showLegend") Boolean showLegend,
        @JsonProperty("deduplicate") Boolean deduplicate,
        @JsonProperty("summaryThreshold") Integer summaryThreshold,
        @JsonProperty("heavyThreshold") Integer heavyThreshold
    ) {
        public DiagramSettings {
            if (generator == null) {
                generator = "dot";
            }
            if (edgeStyle == null) {
                edgeStyle = "straight";
            }
            if (showConditions == null) {
                showConditions = false;
            }
            if (showLegend == null) {
                showLegend = false;
            }
            if (deduplicate == null) {
                deduplicate = true;
            }
            if (summaryThreshold == null) {
                summaryThreshold = EdgeConsolidator.DEFAULT_SUMMARY_THRESHOLD;
            }
            if (heavyThreshold == null) {
                heavyThreshold = EdgeConsolidator.DEFAULT_HEAVY_THRESHOLD;
            }
        }
    }

    /**
     * Node styling and label settings. Missing lists keep the built-in defaults.
     *
     * @param highlightSupertypes supertype markers drawn as highlighted
     * @param waitingKeywords waiting activity name fragments
     * @param manualKeywords manual intervention name fragments
     * @param abortKeywords abort/rejection name fragments
     * @param decisionKeywords decision/execution name fragments
     * @param stripTokens fragments removed from node labels
     * @param conditionPrefixes prefixes removed from condition labels
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StyleSettings(
        @JsonProperty("highlightSupertypes") List<String> highlightSupertypes,
        @JsonProperty("waitingKeywords") List<String> waitingKeywords,
        @JsonProperty("manualKeywords") List<String> manualKeywords,
        @JsonProperty("abortKeywords") List<String> abortKeywords,
        @JsonProperty("decisionKeywords") List<String> decisionKeywords,
        @JsonProperty("stripTokens") List<String> stripTokens,
        @JsonProperty("conditionPrefixes") List<String> conditionPrefixes
    ) {
        public NodeStyleSettings toNodeStyleSettings() {
            return new NodeStyleSettings(highlightSupertypes, waitingKeywords, manualKeywords,
                abortKeywords, decisionKeywords, stripTokens, conditionPrefixes);
        }
    }

    /**
     * Output settings.
     *
     * @param directory target directory
     * @param format Graphviz output format (svg, png, pdf)
     * @param keepDot whether DOT sources are kept after conversion
     * @param renderer output renderer id (graphviz, filesystem, console)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("format") String format,
        @JsonProperty("keepDot") Boolean keepDot,
        @JsonProperty("renderer") String renderer
    ) {
        public OutputConfig {
            if (directory == null) {
                directory = ".";
            }
            if (format == null) {
                format = "svg";
            }
            if (keepDot == null) {
                keepDot = false;
            }
            if (renderer == null) {
                renderer = "graphviz";
            }
        }
    }
}

package com.behandlingflow.core.generator;

import java.util.Map;

import com.behandlingflow.core.consolidate.EdgeConsolidator;
import com.behandlingflow.core.generator.style.NodeStyleSettings;

/**
 * Configuration for flow analysis and diagram generation.
 *
 * @param edgeRouting global edge routing style
 * @param showConditions whether condition labels are drawn on edges
 * @param showLegend whether a color legend is appended
 * @param deduplicate whether parallel edges are consolidated
 * @param summaryThreshold smallest parallel-edge count that is summarized
 * @param heavyThreshold smallest parallel-edge count drawn as a heavy summary
 * @param nodeStyles keyword sets and label shortening rules
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    EdgeRouting edgeRouting,
    boolean showConditions,
    boolean showLegend,
    boolean deduplicate,
    int summaryThreshold,
    int heavyThreshold,
    NodeStyleSettings nodeStyles,
    Map<String, Object> customSettings
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (edgeRouting == null) {
            edgeRouting = EdgeRouting.STRAIGHT;
        }
        if (summaryThreshold < 2) {
            summaryThreshold = EdgeConsolidator.DEFAULT_SUMMARY_THRESHOLD;
        }
        if (heavyThreshold <= summaryThreshold) {
            heavyThreshold = Math.max(EdgeConsolidator.DEFAULT_HEAVY_THRESHOLD, summaryThreshold + 1);
        }
        if (nodeStyles == null) {
            nodeStyles = NodeStyleSettings.defaults();
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration: straight edges, no conditions, no legend, consolidation on.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(EdgeRouting.STRAIGHT, false, false, true,
            EdgeConsolidator.DEFAULT_SUMMARY_THRESHOLD, EdgeConsolidator.DEFAULT_HEAVY_THRESHOLD,
            NodeStyleSettings.defaults(), Map.of());
    }

    public GeneratorConfig withShowConditions(boolean value) {
        return new GeneratorConfig(edgeRouting, value, showLegend, deduplicate,
            summaryThreshold, heavyThreshold, nodeStyles, customSettings);
    }

    public GeneratorConfig withShowLegend(boolean value) {
        return new GeneratorConfig(edgeRouting, showConditions, value, deduplicate,
            summaryThreshold, heavyThreshold, nodeStyles, customSettings);
    }

    public GeneratorConfig withDeduplicate(boolean value) {
        return new GeneratorConfig(edgeRouting, showConditions, showLegend, value,
            summaryThreshold, heavyThreshold, nodeStyles, customSettings);
    }

    public GeneratorConfig withEdgeRouting(EdgeRouting value) {
        return new GeneratorConfig(value, showConditions, showLegend, deduplicate,
            summaryThreshold, heavyThreshold, nodeStyles, customSettings);
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}

package com.behandlingflow.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Where diagrams are rendered to, and how.
 *
 * @param outputDirectory directory that receives diagram files; ignored by the console renderer
 * @param settings Graphviz options keyed by {@code graphviz.*} names; missing means empty
 */
public record RenderContext(String outputDirectory, Map<String, String> settings) {

    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Looks up a renderer option.
     *
     * @param key option name, e.g. {@code graphviz.format}
     * @param defaultValue value used when the option is not set
     * @return configured or default value
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}

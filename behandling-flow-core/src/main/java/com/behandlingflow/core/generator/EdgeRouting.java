package com.behandlingflow.core.generator;

import java.util.Locale;

/**
 * Global edge routing hint passed to the layout engine.
 */
public enum EdgeRouting {
    STRAIGHT("polyline"),
    CURVED("spline"),
    ORTHOGONAL("ortho");

    private final String splines;

    EdgeRouting(String splines) {
        this.splines = splines;
    }

    /**
     * Returns the Graphviz {@code splines} attribute value.
     *
     * @return splines value
     */
    public String getSplines() {
        return splines;
    }

    /**
     * Parses a routing name. Accepts the enum names in any case and the Graphviz values.
     * Unknown or missing values fall back to {@link #STRAIGHT}.
     *
     * @param value routing name, may be null
     * @return routing
     */
    public static EdgeRouting parse(String value) {
        if (value == null || value.isBlank()) {
            return STRAIGHT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "curved", "spline", "splines", "curve" -> CURVED;
            case "orthogonal", "ortho" -> ORTHOGONAL;
            default -> STRAIGHT;
        };
    }
}

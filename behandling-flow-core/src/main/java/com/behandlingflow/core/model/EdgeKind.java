package com.behandlingflow.core.model;

/**
 * How an edge is drawn.
 */
public enum EdgeKind {
    /** Ordinary transition */
    NORMAL,

    /** Edge closing a cycle; does not constrain layout */
    BACK,

    /** Target created once per collection item */
    COLLECTION,

    /** Summary of a few parallel edges */
    SUMMARY,

    /** Summary of many parallel edges, drawn heavier */
    HEAVY_SUMMARY
}

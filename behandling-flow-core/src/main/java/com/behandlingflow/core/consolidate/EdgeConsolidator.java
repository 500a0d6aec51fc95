package com.behandlingflow.core.consolidate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.flow.FlowTraverser;
import com.behandlingflow.core.model.CycleAnalysis;
import com.behandlingflow.core.model.FlowEdge;

/**
 * Collapses parallel edges between the same pair of activities into summary edges.
 *
 * <p>Edges are grouped by source, target and back-edge flag, in order of first appearance.
 * Each group is then reduced by these rules, applied in order:
 * <ol>
 *   <li>With conditions hidden, {@value FlowTraverser#FALLBACK_LABEL} edges are dropped from a
 *       group that has other edges. A group of only fallback edges keeps its first edge.</li>
 *   <li>A single remaining edge is kept as is.</li>
 *   <li>A count from the summary threshold up to (excluding) the heavy threshold becomes one
 *       edge labelled {@code "<n> paths: <example>"}, the example passed through the
 *       condition formatter before it is shortened.</li>
 *   <li>A count at or above the heavy threshold becomes one edge labelled {@code "<n> paths"}.</li>
 * </ol>
 * Counts are sums of multiplicities, so a consolidated list consolidates to itself.
 * Back-edges never share a group with forward edges.
 */
public class EdgeConsolidator {

    private static final Logger log = LoggerFactory.getLogger(EdgeConsolidator.class);

    public static final int DEFAULT_SUMMARY_THRESHOLD = 2;
    public static final int DEFAULT_HEAVY_THRESHOLD = 4;

    private static final int EXAMPLE_MAX_LENGTH = 40;
    private static final String ELLIPSIS = "...";

    private final int summaryThreshold;
    private final int heavyThreshold;
    private final UnaryOperator<String> exampleFormatter;

    public EdgeConsolidator() {
        this(DEFAULT_SUMMARY_THRESHOLD, DEFAULT_HEAVY_THRESHOLD);
    }

    public EdgeConsolidator(int summaryThreshold, int heavyThreshold) {
        this(summaryThreshold, heavyThreshold, UnaryOperator.identity());
    }

    /**
     * Creates a consolidator with custom thresholds.
     *
     * @param summaryThreshold smallest count that is summarized, at least 2
     * @param heavyThreshold smallest count summarized without an example, above summaryThreshold
     * @param exampleFormatter display formatting applied to the summary example
     * @throws IllegalArgumentException if the thresholds are out of range
     */
    public EdgeConsolidator(int summaryThreshold, int heavyThreshold, UnaryOperator<String> exampleFormatter) {
        if (summaryThreshold < 2) {
            throw new IllegalArgumentException("summaryThreshold must be at least 2: " + summaryThreshold);
        }
        if (heavyThreshold <= summaryThreshold) {
            throw new IllegalArgumentException(
                "heavyThreshold must exceed summaryThreshold: " + heavyThreshold + " <= " + summaryThreshold);
        }
        this.summaryThreshold = summaryThreshold;
        this.heavyThreshold = heavyThreshold;
        this.exampleFormatter = Objects.requireNonNull(exampleFormatter, "exampleFormatter must not be null");
    }

    /**
     * Consolidates a raw or already consolidated edge list.
     *
     * @param edges edges in traversal order
     * @param cycles cycle analysis of the same graph
     * @param showConditions whether condition labels are displayed
     * @return consolidated edges, one group after another in first-appearance order
     */
    public List<FlowEdge> consolidate(List<FlowEdge> edges, CycleAnalysis cycles, boolean showConditions) {
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(cycles, "cycles must not be null");

        Map<GroupKey, List<FlowEdge>> groups = new LinkedHashMap<>();
        for (FlowEdge edge : edges) {
            GroupKey key = new GroupKey(edge.from(), edge.to(), cycles.isBackEdge(edge.from(), edge.to()));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(edge);
        }

        List<FlowEdge> result = new ArrayList<>();
        for (List<FlowEdge> group : groups.values()) {
            result.addAll(reduce(group, showConditions));
        }

        if (result.size() != edges.size()) {
            log.debug("Consolidated {} edges into {}", edges.size(), result.size());
        }
        return result;
    }

    public int getSummaryThreshold() {
        return summaryThreshold;
    }

    public int getHeavyThreshold() {
        return heavyThreshold;
    }

    /**
     * Returns whether an edge stands for at least the heavy threshold of raw edges.
     *
     * @param edge edge to check
     * @return true for heavy summaries
     */
    public boolean isHeavy(FlowEdge edge) {
        return edge.multiplicity() >= heavyThreshold;
    }

    private List<FlowEdge> reduce(List<FlowEdge> group, boolean showConditions) {
        List<FlowEdge> remaining = group;
        if (!showConditions) {
            remaining = dropFallbackEdges(group);
        }

        if (remaining.size() == 1) {
            return remaining;
        }

        int count = remaining.stream().mapToInt(FlowEdge::multiplicity).sum();
        if (count < summaryThreshold) {
            return remaining;
        }

        String label = count >= heavyThreshold
            ? count + " paths"
            : summaryLabel(count, remaining, showConditions);

        FlowEdge first = remaining.get(0);
        return List.of(new FlowEdge(first.from(), first.to(), label,
            commonFeatureFlag(remaining), allCollection(remaining), count));
    }

    private List<FlowEdge> dropFallbackEdges(List<FlowEdge> group) {
        List<FlowEdge> kept = group.stream()
            .filter(e -> !FlowTraverser.FALLBACK_LABEL.equals(e.label()))
            .toList();
        return kept.isEmpty() ? List.of(group.get(0)) : kept;
    }

    private String summaryLabel(int count, List<FlowEdge> edges, boolean showConditions) {
        String prefix = count + " paths";
        if (!showConditions) {
            return prefix;
        }
        return edges.stream()
            .map(FlowEdge::label)
            .filter(l -> !l.isEmpty() && !FlowTraverser.FALLBACK_LABEL.equals(l))
            .findFirst()
            .map(exampleFormatter)
            .filter(example -> !example.isEmpty())
            .map(example -> prefix + ": " + truncate(example))
            .orElse(prefix);
    }

    private String truncate(String text) {
        if (text.codePointCount(0, text.length()) <= EXAMPLE_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, EXAMPLE_MAX_LENGTH)) + ELLIPSIS;
    }

    private String commonFeatureFlag(List<FlowEdge> edges) {
        String flag = edges.get(0).featureFlag();
        return edges.stream().allMatch(e -> Objects.equals(flag, e.featureFlag())) ? flag : null;
    }

    private boolean allCollection(List<FlowEdge> edges) {
        return edges.stream().allMatch(FlowEdge::collection);
    }

    private record GroupKey(String from, String to, boolean backEdge) {
    }
}

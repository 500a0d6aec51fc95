package com.behandlingflow.core.generator.style;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.EdgeKind;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.IterationGroup;
import com.behandlingflow.core.model.RenderedEdge;
import com.behandlingflow.core.model.RenderedNode;

/**
 * Maps an analyzed flow to styled nodes and edges.
 *
 * <p>Node styles come from {@link NodeStyleRules}. Edge styles are chosen in this order:
 * back-edge, collection edge, heavy summary, summary, ordinary edge. Summary labels are always
 * shown, prefixed by a feature flag shared by all their paths; condition labels only when
 * enabled; feature flags always.
 *
 * <p>The styler also checks that every cluster and iteration group member is a node of the
 * graph and throws {@link IllegalStateException} otherwise.
 */
public class FlowStyler {

    // Edge colors and widths
    public static final String BACK_EDGE_COLOR = "#FF6B6B";
    public static final String COLLECTION_EDGE_COLOR = "#4CAF50";
    static final String BOLD = "bold";
    static final String DASHED = "dashed";
    static final String WIDE_PEN = "2";
    static final String HEAVY_PEN = "2.5";

    // Node styles
    private static final String BOX_STYLE = "rounded,filled";
    private static final String FILLED_STYLE = "filled";

    static final String COLLECTION_LABEL = "multiple";

    private final GeneratorConfig config;
    private final NodeStyleRules rules;
    private final LabelFormatter labels;

    public FlowStyler(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.rules = NodeStyleRules.defaults(config.nodeStyles());
        this.labels = new LabelFormatter(config.nodeStyles());
    }

    /**
     * Styles a flow.
     *
     * @param model analyzed flow
     * @return styled flow
     * @throws IllegalStateException if a cluster or group refers to a node outside the graph
     */
    public StyledFlow style(FlowDiagramModel model) {
        Objects.requireNonNull(model, "model must not be null");
        validateGroups(model);

        List<RenderedNode> nodes = new ArrayList<>();
        for (String activity : model.graph().nodes()) {
            nodes.add(styleNode(model, activity));
        }

        List<RenderedEdge> edges = new ArrayList<>();
        for (FlowEdge edge : model.edges()) {
            edges.add(styleEdge(model, edge));
        }

        return new StyledFlow(model.behandlingName() + " Flow", nodes, edges,
            model.cycles().clusters(), model.iterationGroups());
    }

    public NodeStyleRules getRules() {
        return rules;
    }

    /**
     * Styles one node.
     *
     * @param model analyzed flow
     * @param activity activity name
     * @return styled node
     */
    public RenderedNode styleNode(FlowDiagramModel model, String activity) {
        NodeStyle style = rules.styleFor(NodeContext.of(model, activity));
        String label = style.labelPrefix() + labels.displayName(activity);
        String nodeStyle = NodeStyle.SHAPE_BOX.equals(style.shape()) ? BOX_STYLE : FILLED_STYLE;
        return new RenderedNode(activity, label, style.fillColor(), style.shape(), nodeStyle, style.category());
    }

    /**
     * Styles one edge.
     *
     * @param model analyzed flow
     * @param edge consolidated or raw edge
     * @return styled edge
     */
    public RenderedEdge styleEdge(FlowDiagramModel model, FlowEdge edge) {
        String text = edgeText(edge);

        if (model.cycles().isBackEdge(edge.from(), edge.to())) {
            return new RenderedEdge(edge.from(), edge.to(), text, EdgeKind.BACK,
                BACK_EDGE_COLOR, WIDE_PEN, BOLD, false);
        }
        if (edge.collection()) {
            String label = text.isEmpty() ? COLLECTION_LABEL : text + " (" + COLLECTION_LABEL + ")";
            return new RenderedEdge(edge.from(), edge.to(), label, EdgeKind.COLLECTION,
                COLLECTION_EDGE_COLOR, WIDE_PEN, BOLD, true);
        }
        if (edge.isSummary() && edge.multiplicity() >= config.heavyThreshold()) {
            return new RenderedEdge(edge.from(), edge.to(), text, EdgeKind.HEAVY_SUMMARY,
                null, HEAVY_PEN, BOLD, true);
        }
        if (edge.isSummary()) {
            return new RenderedEdge(edge.from(), edge.to(), text, EdgeKind.SUMMARY,
                null, null, null, true);
        }
        String style = model.graph().isProcessorMissing(edge.to()) ? DASHED : null;
        return new RenderedEdge(edge.from(), edge.to(), text, EdgeKind.NORMAL, null, null, style, true);
    }

    private String edgeText(FlowEdge edge) {
        if (edge.isSummary()) {
            return labels.summaryLabel(edge.featureFlag(), edge.label());
        }
        String condition = config.showConditions() ? labels.formatCondition(edge.label()) : "";
        if (edge.featureFlag() != null) {
            return labels.featureLabel(edge.featureFlag(), condition, config.showConditions());
        }
        return condition;
    }

    private void validateGroups(FlowDiagramModel model) {
        Set<String> nodes = new HashSet<>(model.graph().nodes());
        for (CycleCluster cluster : model.cycles().clusters()) {
            for (String member : cluster.members()) {
                if (!nodes.contains(member)) {
                    throw new IllegalStateException(
                        "Cycle cluster member " + member + " is not a node of " + model.behandlingName());
                }
            }
        }
        for (IterationGroup group : model.iterationGroups()) {
            for (String member : group.members()) {
                if (!nodes.contains(member)) {
                    throw new IllegalStateException(
                        "Iteration group member " + member + " is not a node of " + model.behandlingName());
                }
            }
        }
    }
}

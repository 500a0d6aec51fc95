package com.behandlingflow.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.GeneratedDiagram;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.style.FlowStyler;
import com.behandlingflow.core.generator.style.NodeStyle;
import com.behandlingflow.core.generator.style.StyledFlow;
import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.IterationGroup;
import com.behandlingflow.core.model.RenderedEdge;
import com.behandlingflow.core.model.RenderedNode;

/**
 * Generates Graphviz DOT descriptions of activity flows.
 *
 * <p>The output is a single {@code digraph} laid out top to bottom with:
 * <ul>
 *   <li><b>Header:</b> layout direction, spline mode from the configured edge routing,
 *       node and edge defaults, title</li>
 *   <li><b>Iteration clusters:</b> one {@code cluster_iteration_<i>} per iteration group</li>
 *   <li><b>Cycle clusters:</b> one {@code cluster_cycle_<i>} per cycle cluster</li>
 *   <li><b>Nodes</b> in visit order, then <b>edges</b> in consolidated order</li>
 *   <li><b>Legend:</b> optional HTML table pinned to the bottom rank</li>
 * </ul>
 *
 * <p>All identifiers and labels are quoted; backslashes, double quotes and newlines are escaped.
 *
 * @see <a href="https://graphviz.org/doc/info/lang.html">DOT Language</a>
 */
public class DotGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "dot";
    private static final String GENERATOR_DISPLAY_NAME = "Graphviz DOT Generator";
    private static final String FILE_EXTENSION = "dot";

    // Graph defaults
    private static final String GRAPH_START = "digraph BehandlingFlow {\n";
    private static final String GRAPH_END = "}\n";
    private static final String NODE_DEFAULTS = "  node [shape=box, style=rounded, fontname=\"Arial\"];\n";
    private static final String EDGE_DEFAULTS = "  edge [fontname=\"Arial\", fontsize=10];\n";

    // Cycle cluster style
    private static final String CYCLE_COLOR = "#FF6B6B";
    private static final String CYCLE_FILL = "#FFF5F5";
    private static final String CYCLE_LABEL = "🔄 Waiting/Retry Loop";

    // Iteration cluster style
    private static final String ITERATION_COLOR = "#4CAF50";
    private static final String ITERATION_FILL = "#F0FFF0";
    private static final String ITERATION_FONT_COLOR = "#2E7D32";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(FlowDiagramModel model, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(config, "config must not be null");

        FlowStyler styler = new FlowStyler(config);
        StyledFlow flow = styler.style(model);

        StringBuilder sb = new StringBuilder();
        appendGraphHeader(sb, flow.title(), config);
        appendIterationClusters(sb, flow.iterationGroups());
        appendCycleClusters(sb, flow.clusters());
        appendNodes(sb, flow.nodes());
        appendEdges(sb, flow.edges());
        if (config.showLegend()) {
            appendLegend(sb, styler.getRules().allStyles());
        }
        sb.append(GRAPH_END);

        String name = model.behandlingName() + "_flow";
        log.debug("Generated DOT diagram {}: {} nodes, {} edges, {} clusters",
            name, flow.nodes().size(), flow.edges().size(), flow.clusters().size());
        return new GeneratedDiagram(name, sb.toString(), getFileExtension());
    }

    private void appendGraphHeader(StringBuilder sb, String title, GeneratorConfig config) {
        sb.append(GRAPH_START);
        sb.append("  rankdir=TB;\n");
        sb.append("  splines=").append(config.edgeRouting().getSplines()).append(";\n");
        sb.append(NODE_DEFAULTS);
        sb.append(EDGE_DEFAULTS).append("\n");
        sb.append("  labelloc=\"t\";\n");
        sb.append("  label=\"").append(escape(title)).append("\";\n");
        sb.append("  fontsize=16;\n\n");
    }

    private void appendIterationClusters(StringBuilder sb, List<IterationGroup> groups) {
        for (int i = 0; i < groups.size(); i++) {
            IterationGroup group = groups.get(i);
            appendClusterHeader(sb, "cluster_iteration_" + i, ITERATION_COLOR, ITERATION_FILL,
                "Loop (triggered by " + group.triggerNode() + ")", ITERATION_FONT_COLOR);
            appendClusterMembers(sb, group.members());
        }
    }

    private void appendCycleClusters(StringBuilder sb, List<CycleCluster> clusters) {
        for (int i = 0; i < clusters.size(); i++) {
            appendClusterHeader(sb, "cluster_cycle_" + i, CYCLE_COLOR, CYCLE_FILL, CYCLE_LABEL, CYCLE_COLOR);
            appendClusterMembers(sb, clusters.get(i).members());
        }
    }

    private void appendClusterHeader(StringBuilder sb, String id, String color, String fill,
                                     String label, String fontColor) {
        sb.append("  subgraph ").append(id).append(" {\n");
        sb.append("    style=\"rounded,dashed\";\n");
        sb.append("    color=\"").append(color).append("\";\n");
        sb.append("    penwidth=2.5;\n");
        sb.append("    bgcolor=\"").append(fill).append("\";\n");
        sb.append("    label=\"").append(escape(label)).append("\";\n");
        sb.append("    fontcolor=\"").append(fontColor).append("\";\n");
        sb.append("    fontsize=12;\n");
    }

    private void appendClusterMembers(StringBuilder sb, List<String> members) {
        for (String member : members) {
            sb.append("    ").append(quote(member)).append(";\n");
        }
        sb.append("  }\n\n");
    }

    private void appendNodes(StringBuilder sb, List<RenderedNode> nodes) {
        for (RenderedNode node : nodes) {
            sb.append("  ").append(quote(node.id()))
                .append(" [label=").append(quote(node.label()))
                .append(", shape=").append(node.shape())
                .append(", style=").append(quote(node.style()))
                .append(", fillcolor=").append(quote(node.fillColor()))
                .append("];\n");
        }
        sb.append("\n");
    }

    private void appendEdges(StringBuilder sb, List<RenderedEdge> edges) {
        for (RenderedEdge edge : edges) {
            sb.append("  ").append(quote(edge.from())).append(" -> ").append(quote(edge.to()));
            List<String> attributes = edgeAttributes(edge);
            if (!attributes.isEmpty()) {
                sb.append(" [").append(String.join(", ", attributes)).append("]");
            }
            sb.append(";\n");
        }
    }

    private List<String> edgeAttributes(RenderedEdge edge) {
        List<String> attributes = new ArrayList<>();
        if (edge.hasLabel()) {
            attributes.add("label=" + quote(edge.label()));
        }
        if (edge.color() != null) {
            attributes.add("color=" + quote(edge.color()));
        }
        if (edge.penWidth() != null) {
            attributes.add("penwidth=" + edge.penWidth());
        }
        if (edge.style() != null) {
            attributes.add("style=" + edge.style());
        }
        if (!edge.constraint()) {
            attributes.add("constraint=false");
        }
        return attributes;
    }

    private void appendLegend(StringBuilder sb, List<NodeStyle> styles) {
        sb.append("\n  // Legend\n");
        sb.append("  {rank=sink;\n");
        sb.append("    Legend [shape=none, margin=0, label=<\n");
        sb.append("      <TABLE BORDER=\"0\" CELLBORDER=\"1\" CELLSPACING=\"0\" CELLPADDING=\"4\">\n");
        sb.append("        <TR><TD COLSPAN=\"2\" BGCOLOR=\"#E8E8E8\"><B>Legend</B></TD></TR>\n");
        for (NodeStyle style : styles) {
            sb.append("        <TR><TD BGCOLOR=\"").append(style.fillColor()).append("\">  </TD>")
                .append("<TD ALIGN=\"LEFT\">").append(escapeHtml(style.labelPrefix() + style.category().getDescription()))
                .append("</TD></TR>\n");
        }
        sb.append("        <TR><TD BGCOLOR=\"").append(FlowStyler.BACK_EDGE_COLOR).append("\">  </TD>")
            .append("<TD ALIGN=\"LEFT\">Cycle edge</TD></TR>\n");
        sb.append("        <TR><TD BGCOLOR=\"").append(FlowStyler.COLLECTION_EDGE_COLOR).append("\">  </TD>")
            .append("<TD ALIGN=\"LEFT\">Per-item edge</TD></TR>\n");
        sb.append("      </TABLE>\n");
        sb.append("    >];\n");
        sb.append("  }\n");
    }

    /**
     * Quotes an identifier or label for DOT.
     *
     * @param text raw text
     * @return quoted and escaped text
     */
    private String quote(String text) {
        return "\"" + escape(text) + "\"";
    }

    /**
     * Escapes characters that are significant inside a quoted DOT string.
     *
     * @param text raw text
     * @return escaped text
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\r", "")
            .replace("\n", "\\n");
    }

    private String escapeHtml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}

package com.behandlingflow.core.generator.impl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.EdgeRouting;
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
 * Generates Mermaid flowcharts of activity flows, embedded in Markdown.
 *
 * <p>Uses the same styling as {@link DotGenerator}. Node ids are positional ({@code n0},
 * {@code n1}, ...) so activity names never need sanitizing; names only appear in labels.
 * Cycle clusters and iteration groups become subgraphs. Edge routing maps to the flowchart
 * {@code curve} setting.
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String FLOWCHART_TB = "flowchart TB\n";

    private static final String CYCLE_LABEL = "🔄 Waiting/Retry Loop";

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
        Map<String, String> ids = assignIds(flow.nodes());

        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, flow.title(), config.edgeRouting());
        appendNodes(sb, flow.nodes(), ids);
        appendIterationGroups(sb, flow.iterationGroups(), ids);
        appendCycleClusters(sb, flow.clusters(), ids);
        appendEdges(sb, flow.edges(), ids);
        appendNodeStyles(sb, flow.nodes(), ids);
        sb.append(CODE_BLOCK_END);
        if (config.showLegend()) {
            appendLegend(sb, styler.getRules().allStyles());
        }

        String name = model.behandlingName() + "_flow";
        log.debug("Generated Mermaid diagram {}", name);
        return new GeneratedDiagram(name, sb.toString(), getFileExtension());
    }

    private Map<String, String> assignIds(List<RenderedNode> nodes) {
        Map<String, String> ids = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            ids.put(nodes.get(i).id(), "n" + i);
        }
        return ids;
    }

    private void appendDiagramHeader(StringBuilder sb, String title, EdgeRouting routing) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append("%%{init: {\"flowchart\": {\"curve\": \"").append(curveFor(routing)).append("\"}}}%%\n");
        sb.append(FLOWCHART_TB);
    }

    private String curveFor(EdgeRouting routing) {
        return switch (routing) {
            case STRAIGHT -> "linear";
            case CURVED -> "basis";
            case ORTHOGONAL -> "step";
        };
    }

    private void appendNodes(StringBuilder sb, List<RenderedNode> nodes, Map<String, String> ids) {
        for (RenderedNode node : nodes) {
            String label = "\"" + escape(node.label()) + "\"";
            String shape = switch (node.shape()) {
                case NodeStyle.SHAPE_CIRCLE -> "((" + label + "))";
                case NodeStyle.SHAPE_DIAMOND -> "{" + label + "}";
                default -> "(" + label + ")";
            };
            sb.append("  ").append(ids.get(node.id())).append(shape).append("\n");
        }
    }

    private void appendIterationGroups(StringBuilder sb, List<IterationGroup> groups, Map<String, String> ids) {
        for (int i = 0; i < groups.size(); i++) {
            IterationGroup group = groups.get(i);
            appendSubgraph(sb, "iteration" + i, "Loop (triggered by " + group.triggerNode() + ")",
                group.members(), ids);
        }
    }

    private void appendCycleClusters(StringBuilder sb, List<CycleCluster> clusters, Map<String, String> ids) {
        for (int i = 0; i < clusters.size(); i++) {
            appendSubgraph(sb, "cycle" + i, CYCLE_LABEL, clusters.get(i).members(), ids);
        }
    }

    private void appendSubgraph(StringBuilder sb, String id, String title, List<String> members,
                                Map<String, String> ids) {
        sb.append("  subgraph ").append(id).append(" [\"").append(escape(title)).append("\"]\n");
        for (String member : members) {
            sb.append("    ").append(ids.get(member)).append("\n");
        }
        sb.append("  end\n");
    }

    private void appendEdges(StringBuilder sb, List<RenderedEdge> edges, Map<String, String> ids) {
        for (RenderedEdge edge : edges) {
            String arrow = switch (edge.kind()) {
                case BACK -> "-.->";
                case COLLECTION, HEAVY_SUMMARY -> "==>";
                default -> "-->";
            };
            sb.append("  ").append(ids.get(edge.from())).append(" ").append(arrow);
            if (edge.hasLabel()) {
                sb.append("|\"").append(escape(edge.label())).append("\"|");
            }
            sb.append(" ").append(ids.get(edge.to())).append("\n");
        }
        for (int i = 0; i < edges.size(); i++) {
            RenderedEdge edge = edges.get(i);
            if (edge.color() != null) {
                sb.append("  linkStyle ").append(i).append(" stroke:").append(edge.color()).append("\n");
            }
        }
    }

    private void appendNodeStyles(StringBuilder sb, List<RenderedNode> nodes, Map<String, String> ids) {
        for (RenderedNode node : nodes) {
            sb.append("  style ").append(ids.get(node.id())).append(" fill:").append(node.fillColor()).append("\n");
        }
    }

    private void appendLegend(StringBuilder sb, List<NodeStyle> styles) {
        sb.append(MARKDOWN_NEWLINE).append("| Color | Meaning |\n|---|---|\n");
        for (NodeStyle style : styles) {
            sb.append("| `").append(style.fillColor()).append("` | ")
                .append(style.labelPrefix()).append(style.category().getDescription()).append(" |\n");
        }
        sb.append("| `").append(FlowStyler.BACK_EDGE_COLOR).append("` | Cycle edge (dotted) |\n");
        sb.append("| `").append(FlowStyler.COLLECTION_EDGE_COLOR).append("` | Per-item edge (thick) |\n");
    }

    /**
     * Escapes text for a quoted Mermaid label.
     *
     * @param text the text to escape
     * @return escaped text
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "#quot;").replace("\r", "").replace("\n", "<br/>");
    }
}

package com.behandlingflow.core.generator.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.flow.FlowTraverser;
import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.GeneratedDiagram;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.style.LabelFormatter;
import com.behandlingflow.core.model.EdgeKey;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.FlowGraph;

/**
 * Renders an indented, plain-text trace of a flow.
 *
 * <p>Each activity is expanded once, in traversal order. Revisits are marked as cycles (for
 * back-edges) or as already shown. Always uses the raw edges, so every branch is listed.
 *
 * <pre>
 * Flow for CycleTestBehandling:
 *   Starting with: StartAktivitet
 *     → VentPaaDataAktivitet
 *       → SjekkDataAktivitet
 *         → [IF dataErKlar()] BehandleDataAktivitet
 *           → [END]
 *         → [ELSE] VentPaaDataAktivitet [CYCLE]
 * </pre>
 */
public class TextTraceGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextTraceGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "text";
    private static final String GENERATOR_DISPLAY_NAME = "Text Flow Trace";
    private static final String FILE_EXTENSION = "txt";

    private static final String INDENT = "  ";
    private static final String ARROW = "→ ";

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

        LabelFormatter labels = new LabelFormatter(config.nodeStyles());
        FlowGraph graph = model.graph();
        Map<String, List<FlowEdge>> outgoing = groupBySource(graph.edges());

        StringBuilder sb = new StringBuilder();
        sb.append("Flow for ").append(model.behandlingName()).append(":\n");
        sb.append(INDENT).append("Starting with: ").append(graph.entryActivity()).append("\n");

        appendTrace(sb, model, outgoing);
        appendCycles(sb, model, labels);

        String name = model.behandlingName() + "_flow";
        log.debug("Generated text trace {}", name);
        return new GeneratedDiagram(name, sb.toString(), getFileExtension());
    }

    private Map<String, List<FlowEdge>> groupBySource(List<FlowEdge> edges) {
        Map<String, List<FlowEdge>> outgoing = new LinkedHashMap<>();
        for (FlowEdge edge : edges) {
            outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
        return outgoing;
    }

    private void appendTrace(StringBuilder sb, FlowDiagramModel model, Map<String, List<FlowEdge>> outgoing) {
        FlowGraph graph = model.graph();
        Set<String> expanded = new HashSet<>();
        Deque<Step> stack = new ArrayDeque<>();

        String entry = graph.entryActivity();
        expanded.add(entry);
        if (graph.isProcessorMissing(entry)) {
            appendLine(sb, 2, ARROW + "[PROCESSOR NOT FOUND]");
        }
        pushChildren(stack, outgoing.getOrDefault(entry, List.of()), 2);

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            FlowEdge edge = step.edge();
            String target = edge.to();

            if (FlowGraph.END_NODE.equals(target)) {
                appendLine(sb, step.depth(), ARROW + branchPrefix(edge) + "[END]");
                continue;
            }

            StringBuilder line = new StringBuilder(ARROW).append(branchPrefix(edge)).append(target);
            if (edge.collection()) {
                line.append(" (multiple)");
            }
            if (!expanded.add(target)) {
                line.append(model.cycles().isBackEdge(edge.from(), target) ? " [CYCLE]" : " (see above)");
                appendLine(sb, step.depth(), line.toString());
                continue;
            }

            appendLine(sb, step.depth(), line.toString());
            if (graph.isProcessorMissing(target)) {
                appendLine(sb, step.depth() + 1, ARROW + "[PROCESSOR NOT FOUND]");
            }
            pushChildren(stack, outgoing.getOrDefault(target, List.of()), step.depth() + 1);
        }
    }

    private void pushChildren(Deque<Step> stack, List<FlowEdge> edges, int depth) {
        for (int i = edges.size() - 1; i >= 0; i--) {
            stack.push(new Step(edges.get(i), depth));
        }
    }

    private String branchPrefix(FlowEdge edge) {
        StringBuilder prefix = new StringBuilder();
        if (edge.featureFlag() != null) {
            prefix.append("[🚩 ").append(edge.featureFlag()).append("] ");
        }
        if (FlowTraverser.FALLBACK_LABEL.equals(edge.label())) {
            prefix.append("[ELSE] ");
        } else if (edge.hasLabel()) {
            prefix.append("[IF ").append(edge.label()).append("] ");
        }
        return prefix.toString();
    }

    private void appendCycles(StringBuilder sb, FlowDiagramModel model, LabelFormatter labels) {
        Set<EdgeKey> backEdges = model.cycles().backEdges();
        if (backEdges.isEmpty()) {
            return;
        }
        sb.append("\n").append(INDENT).append("🔄 Detected ").append(backEdges.size()).append(" cycle(s) in this flow:\n");
        Set<String> pairs = new TreeSet<>();
        for (EdgeKey key : backEdges) {
            pairs.add(oneLine(labels.displayName(key.from())) + " ↩ " + oneLine(labels.displayName(key.to())));
        }
        for (String pair : pairs) {
            appendLine(sb, 2, pair);
        }
    }

    private String oneLine(String text) {
        return text.replace('\n', ' ');
    }

    private void appendLine(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append("\n");
    }

    private record Step(FlowEdge edge, int depth) {
    }
}

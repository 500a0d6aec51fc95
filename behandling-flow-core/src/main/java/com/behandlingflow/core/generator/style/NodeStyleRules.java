package com.behandlingflow.core.generator.style;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.behandlingflow.core.model.NodeCategory;

/**
 * Ordered list of node style rules. The first matching rule wins.
 *
 * <p>Default order:
 * <ol>
 *   <li>entry activity</li>
 *   <li>activity class with a highlighted supertype</li>
 *   <li>processor creates a manual task (label gets a clipboard marker)</li>
 *   <li>waiting keywords</li>
 *   <li>manual-intervention keywords</li>
 *   <li>abort/rejection keywords</li>
 *   <li>decision/execution keywords</li>
 *   <li>the synthetic end node</li>
 *   <li>no processor found (label gets a question-mark marker)</li>
 * </ol>
 * Nodes matching no rule get the {@link #getFallback() fallback} style.
 */
public final class NodeStyleRules {

    // Colors
    public static final String ENTRY_COLOR = "#90EE90";
    public static final String HIGHLIGHT_COLOR = "#9370DB";
    public static final String MANUAL_TASK_COLOR = "#FFA500";
    public static final String WAITING_COLOR = "#FFD700";
    public static final String MANUAL_COLOR = "#FF6B6B";
    public static final String ABORT_COLOR = "#FF4444";
    public static final String DECISION_COLOR = "#4CAF50";
    public static final String END_COLOR = "#FFB6C1";
    public static final String NOT_FOUND_COLOR = "#CCCCCC";
    public static final String DEFAULT_COLOR = "#87CEEB";

    // Label markers
    public static final String MANUAL_TASK_PREFIX = "📋 ";
    public static final String NOT_FOUND_PREFIX = "? ";

    private final List<NodeStyleRule> rules;
    private final NodeStyle fallback;

    public NodeStyleRules(List<NodeStyleRule> rules, NodeStyle fallback) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /**
     * Builds the default rule list from keyword settings.
     *
     * @param settings keyword sets
     * @return ordered rules
     */
    public static NodeStyleRules defaults(NodeStyleSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new NodeStyleRules(List.of(
            new NodeStyleRule("entry", NodeContext::entry,
                NodeStyle.box(NodeCategory.ENTRY, ENTRY_COLOR)),
            new NodeStyleRule("highlighted-supertype",
                n -> n.supertypeContainsAny(settings.highlightSupertypes()),
                NodeStyle.box(NodeCategory.HIGHLIGHTED, HIGHLIGHT_COLOR)),
            new NodeStyleRule("manual-task", NodeContext::createsManualTask,
                new NodeStyle(NodeCategory.MANUAL_TASK, MANUAL_TASK_COLOR, NodeStyle.SHAPE_BOX, MANUAL_TASK_PREFIX)),
            new NodeStyleRule("waiting", n -> n.nameContainsAny(settings.waitingKeywords()),
                NodeStyle.box(NodeCategory.WAITING, WAITING_COLOR)),
            new NodeStyleRule("manual", n -> n.nameContainsAny(settings.manualKeywords()),
                NodeStyle.box(NodeCategory.MANUAL, MANUAL_COLOR)),
            new NodeStyleRule("abort", n -> n.nameContainsAny(settings.abortKeywords()),
                NodeStyle.box(NodeCategory.ABORT, ABORT_COLOR)),
            new NodeStyleRule("decision", n -> n.nameContainsAny(settings.decisionKeywords()),
                NodeStyle.box(NodeCategory.DECISION, DECISION_COLOR)),
            new NodeStyleRule("end", NodeContext::isEndNode,
                new NodeStyle(NodeCategory.END, END_COLOR, NodeStyle.SHAPE_CIRCLE, "")),
            new NodeStyleRule("not-found", NodeContext::processorMissing,
                new NodeStyle(NodeCategory.NOT_FOUND, NOT_FOUND_COLOR, NodeStyle.SHAPE_DIAMOND, NOT_FOUND_PREFIX))
        ), NodeStyle.box(NodeCategory.DEFAULT, DEFAULT_COLOR));
    }

    /**
     * Selects the style of the first rule matching the node.
     *
     * @param node node facts
     * @return matching style, or the fallback
     */
    public NodeStyle styleFor(NodeContext node) {
        Objects.requireNonNull(node, "node must not be null");
        for (NodeStyleRule rule : rules) {
            if (rule.matches(node)) {
                return rule.style();
            }
        }
        return fallback;
    }

    public List<NodeStyleRule> getRules() {
        return rules;
    }

    public NodeStyle getFallback() {
        return fallback;
    }

    /**
     * Returns every style in rule order followed by the fallback. Used for legends.
     *
     * @return all styles
     */
    public List<NodeStyle> allStyles() {
        List<NodeStyle> styles = new ArrayList<>(rules.stream().map(NodeStyleRule::style).toList());
        styles.add(fallback);
        return styles;
    }
}

package com.behandlingflow.core.generator.style;

import java.util.List;
import java.util.Objects;

import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.FlowGraph;

/**
 * Facts about one node that style rules may look at.
 *
 * @param activity activity name
 * @param entry whether the node is the entry activity
 * @param processorMissing whether no processor handles the activity
 * @param createsManualTask whether the processor opens a manual task
 * @param supertypes supertypes of the activity class, empty if unknown
 */
public record NodeContext(
    String activity,
    boolean entry,
    boolean processorMissing,
    boolean createsManualTask,
    List<String> supertypes
) {
    /**
     * Compact constructor with validation.
     */
    public NodeContext {
        Objects.requireNonNull(activity, "activity must not be null");
        supertypes = supertypes == null ? List.of() : List.copyOf(supertypes);
    }

    /**
     * Collects the context of a node from an analyzed flow.
     *
     * @param model analyzed flow
     * @param activity activity name
     * @return node context
     */
    public static NodeContext of(FlowDiagramModel model, String activity) {
        return new NodeContext(
            activity,
            activity.equals(model.entryActivity()),
            model.graph().isProcessorMissing(activity),
            model.createsManualTask(activity),
            model.supertypesOf(activity));
    }

    public boolean isEndNode() {
        return FlowGraph.END_NODE.equals(activity);
    }

    public boolean nameContainsAny(List<String> keywords) {
        return keywords.stream().anyMatch(activity::contains);
    }

    public boolean supertypeContainsAny(List<String> markers) {
        return supertypes.stream().anyMatch(s -> markers.stream().anyMatch(s::contains));
    }
}

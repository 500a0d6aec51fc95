package com.behandlingflow.core.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.FlowGraph;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;

/**
 * Builds the raw flow graph reachable from one entry activity.
 *
 * <p>The walk is a depth-first traversal driven by an explicit frame stack, so arbitrarily deep
 * flows cannot exhaust the call stack. Edges are emitted in the same order a recursive walk
 * would emit them: when a frame advances to its next outbound edge, the edge is recorded, and an
 * unvisited target gets its own frame on top of the stack.
 *
 * <h2>Rules per node</h2>
 * <ul>
 *   <li>No processor: no outbound edges; the node is recorded as missing a processor.</li>
 *   <li>Processor without transitions: one edge to {@link FlowGraph#END_NODE}.</li>
 *   <li>Otherwise: one edge per transition target in source order. Unconditioned transitions
 *       of a processor with several transitions are labelled {@value #FALLBACK_LABEL}.</li>
 * </ul>
 *
 * <p>Every node is expanded once. Edges into visited nodes are still emitted, so fan-in and
 * cycles stay visible. Traversal never throws on data gaps.
 *
 * <p>Instances are stateless and thread-safe; all mutable state lives in a per-call
 * {@link TraversalState}.
 */
public class FlowTraverser {

    private static final Logger log = LoggerFactory.getLogger(FlowTraverser.class);

    /** Label given to the unconditioned branch of a multi-branch processor. */
    public static final String FALLBACK_LABEL = "else";

    private final FactIndex index;

    public FlowTraverser(FactIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * Traverses the flow starting at the given activity.
     *
     * @param entryActivity entry activity name
     * @return flow graph with nodes in visit order and edges in traversal order
     */
    public FlowGraph traverse(String entryActivity) {
        Objects.requireNonNull(entryActivity, "entryActivity must not be null");

        TraversalState state = new TraversalState();
        state.enter(entryActivity, outboundEdges(entryActivity, state));

        while (!state.frames.isEmpty()) {
            Frame frame = state.frames.peek();
            if (!frame.hasNext()) {
                state.frames.pop();
                continue;
            }

            FlowEdge edge = frame.next();
            state.edges.add(edge);

            String target = edge.to();
            if (!state.visited.contains(target)) {
                state.enter(target, outboundEdges(target, state));
            }
        }

        log.debug("Traversed flow from {}: {} nodes, {} edges, {} missing processors",
            entryActivity, state.visited.size(), state.edges.size(), state.missing.size());

        return new FlowGraph(entryActivity, new ArrayList<>(state.visited), state.edges, state.missing);
    }

    /**
     * Resolves the outbound edges of a node from its processor.
     */
    private List<FlowEdge> outboundEdges(String activity, TraversalState state) {
        if (FlowGraph.END_NODE.equals(activity)) {
            return List.of();
        }

        Optional<ProcessorFact> processor = index.findProcessor(activity);
        if (processor.isEmpty()) {
            log.debug("No processor found for activity: {}", activity);
            state.missing.add(activity);
            return List.of();
        }

        ProcessorFact fact = processor.get();
        if (fact.completesFlow()) {
            return List.of(FlowEdge.of(activity, FlowGraph.END_NODE, ""));
        }

        boolean branching = fact.transitions().size() > 1;
        List<FlowEdge> edges = new ArrayList<>();
        for (Transition transition : fact.transitions()) {
            String label = labelFor(transition, branching);
            for (String target : transition.targetActivityNames()) {
                edges.add(new FlowEdge(activity, target, label,
                    transition.featureFlagName(), transition.collection(), 1));
            }
        }
        return edges;
    }

    private String labelFor(Transition transition, boolean branching) {
        if (transition.isConditional()) {
            return transition.condition();
        }
        return branching ? FALLBACK_LABEL : "";
    }

    /**
     * Mutable state of one traversal: visited nodes, frame stack, emitted edges.
     */
    private static final class TraversalState {
        private final Set<String> visited = new LinkedHashSet<>();
        private final Set<String> missing = new LinkedHashSet<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final List<FlowEdge> edges = new ArrayList<>();

        void enter(String node, List<FlowEdge> outbound) {
            visited.add(node);
            frames.push(new Frame(outbound));
        }
    }

    /**
     * One node being expanded, with a cursor over its outbound edges.
     */
    private static final class Frame {
        private final List<FlowEdge> outbound;
        private int cursor;

        Frame(List<FlowEdge> outbound) {
            this.outbound = outbound;
        }

        boolean hasNext() {
            return cursor < outbound.size();
        }

        FlowEdge next() {
            return outbound.get(cursor++);
        }
    }
}

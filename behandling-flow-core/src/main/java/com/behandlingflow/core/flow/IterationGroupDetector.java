package com.behandlingflow.core.flow;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.CycleAnalysis;
import com.behandlingflow.core.model.EdgeKey;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.FlowGraph;
import com.behandlingflow.core.model.IterationGroup;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;

/**
 * Finds the activities that run once per collection item.
 *
 * <p>For each distinct collection edge {@code X -> Y} the chain starting at {@code Y} is
 * followed while the current processor has exactly one transition with exactly one target.
 * At most {@value #MAX_CHAIN_LENGTH} nodes are visited per chain. Activities on a cycle, in an
 * earlier group, or the end node are left out, and a group needs at least two members.
 */
public class IterationGroupDetector {

    private static final Logger log = LoggerFactory.getLogger(IterationGroupDetector.class);

    static final int MAX_CHAIN_LENGTH = 20;
    private static final int MIN_GROUP_SIZE = 2;

    private final FactIndex index;

    public IterationGroupDetector(FactIndex index) {
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /**
     * Detects iteration groups in a traversed graph.
     *
     * @param graph flow graph
     * @param cycles cycle analysis of the graph; cycle members are never grouped
     * @return groups in collection-edge order
     */
    public List<IterationGroup> detect(FlowGraph graph, CycleAnalysis cycles) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(cycles, "cycles must not be null");

        Set<EdgeKey> collectionEdges = new LinkedHashSet<>();
        for (FlowEdge edge : graph.edges()) {
            if (edge.collection()) {
                collectionEdges.add(edge.key());
            }
        }

        Set<String> claimed = new HashSet<>();
        List<IterationGroup> groups = new ArrayList<>();

        for (EdgeKey trigger : collectionEdges) {
            List<String> members = followChain(trigger.to(), cycles, claimed);
            if (members.size() >= MIN_GROUP_SIZE) {
                claimed.addAll(members);
                groups.add(new IterationGroup(trigger.from(), members));
                log.debug("Iteration group triggered by {}: {}", trigger.from(), members);
            }
        }
        return groups;
    }

    private List<String> followChain(String start, CycleAnalysis cycles, Set<String> claimed) {
        List<String> members = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = start;

        while (current != null && seen.size() < MAX_CHAIN_LENGTH && seen.add(current)) {
            if (isEligible(current, cycles, claimed)) {
                members.add(current);
            }
            current = singleSuccessor(current);
        }
        return members;
    }

    private boolean isEligible(String activity, CycleAnalysis cycles, Set<String> claimed) {
        return !FlowGraph.END_NODE.equals(activity)
            && !claimed.contains(activity)
            && cycles.clusterOf(activity).isEmpty();
    }

    private String singleSuccessor(String activity) {
        List<Transition> transitions = index.findProcessor(activity)
            .map(ProcessorFact::transitions)
            .orElse(List.of());
        if (transitions.size() == 1 && !transitions.get(0).isFanOut()) {
            return transitions.get(0).targetActivityName();
        }
        return null;
    }
}

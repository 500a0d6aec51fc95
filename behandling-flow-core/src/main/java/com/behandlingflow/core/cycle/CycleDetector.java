package com.behandlingflow.core.cycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.model.CycleAnalysis;
import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.EdgeKey;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.FlowGraph;

/**
 * Finds back-edges in a flow graph and groups the activities on cycles into disjoint clusters.
 *
 * <p>Uses an iterative depth-first search with three node states. An edge {@code (u, v)} seen
 * while {@code v} is still on the DFS path is a back-edge; self-loops count. The same walk keeps
 * Tarjan's discovery index and low-link per node, so every cluster is a strongly connected
 * component: the maximal set of activities that can all reach each other. A single activity
 * forms a cluster only when it loops to itself. Two cycles joined only by a forward edge stay
 * in separate clusters.
 *
 * <p>Clusters are ordered by their earliest discovered member, members by discovery.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    /**
     * DFS state of a node.
     */
    enum NodeState {
        UNVISITED,
        ON_STACK,
        FINISHED
    }

    /**
     * Analyzes the graph, starting at its entry and then at any node not yet reached.
     *
     * @param graph flow graph
     * @return back-edges and cycle clusters
     */
    public CycleAnalysis detect(FlowGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        SearchState state = new SearchState(buildAdjacency(graph));

        List<String> roots = new ArrayList<>();
        roots.add(graph.entryActivity());
        roots.addAll(graph.nodes());

        for (String root : roots) {
            if (state.stateOf(root) == NodeState.UNVISITED) {
                explore(root, state);
            }
        }

        List<CycleCluster> clusters = state.components.stream()
            .sorted(Comparator.comparingInt(component -> state.discovery.get(component.get(0))))
            .map(CycleCluster::new)
            .toList();

        if (!state.backEdges.isEmpty()) {
            log.debug("Found {} back-edges forming {} cycle clusters from {}",
                state.backEdges.size(), clusters.size(), graph.entryActivity());
        }

        return new CycleAnalysis(state.backEdges, clusters);
    }

    private void explore(String root, SearchState state) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(state.visit(root));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.hasNext()) {
                stack.pop();
                state.finish(frame.node);
                if (!stack.isEmpty()) {
                    state.lowerLink(stack.peek().node, state.lowLink.get(frame.node));
                }
                continue;
            }

            String target = frame.next();
            NodeState targetState = state.stateOf(target);

            if (targetState == NodeState.ON_STACK) {
                state.backEdges.add(new EdgeKey(frame.node, target));
                if (target.equals(frame.node)) {
                    state.selfLoops.add(target);
                }
                state.lowerLink(frame.node, state.discovery.get(target));
            } else if (targetState == NodeState.UNVISITED) {
                stack.push(state.visit(target));
            } else if (state.open.contains(target)) {
                // finished, but its component is still open: target reaches back into this path
                state.lowerLink(frame.node, state.discovery.get(target));
            }
        }
    }

    private Map<String, List<String>> buildAdjacency(FlowGraph graph) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (FlowEdge edge : graph.edges()) {
            adjacency.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }
        return adjacency;
    }

    /**
     * Mutable state of one analysis: node states, discovery order, low-links and open components.
     */
    private static final class SearchState {
        private final Map<String, List<String>> adjacency;
        private final Map<String, NodeState> states = new HashMap<>();
        private final Map<String, Integer> discovery = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> componentStack = new ArrayDeque<>();
        private final Set<String> open = new HashSet<>();
        private final Set<String> selfLoops = new HashSet<>();
        private final Set<EdgeKey> backEdges = new LinkedHashSet<>();
        private final List<List<String>> components = new ArrayList<>();

        SearchState(Map<String, List<String>> adjacency) {
            this.adjacency = adjacency;
        }

        NodeState stateOf(String node) {
            return states.getOrDefault(node, NodeState.UNVISITED);
        }

        Frame visit(String node) {
            int index = discovery.size();
            discovery.put(node, index);
            lowLink.put(node, index);
            states.put(node, NodeState.ON_STACK);
            componentStack.push(node);
            open.add(node);
            return new Frame(node, adjacency.getOrDefault(node, List.of()));
        }

        void lowerLink(String node, int candidate) {
            if (candidate < lowLink.get(node)) {
                lowLink.put(node, candidate);
            }
        }

        void finish(String node) {
            states.put(node, NodeState.FINISHED);
            if (!lowLink.get(node).equals(discovery.get(node))) {
                return;
            }

            List<String> component = new ArrayList<>();
            String member;
            do {
                member = componentStack.pop();
                open.remove(member);
                component.add(member);
            } while (!member.equals(node));

            if (component.size() > 1 || selfLoops.contains(node)) {
                component.sort(Comparator.comparingInt(discovery::get));
                components.add(component);
            }
        }
    }

    /**
     * Node being expanded, with a cursor over its successors.
     */
    private static final class Frame {
        private final String node;
        private final List<String> successors;
        private int cursor;

        Frame(String node, List<String> successors) {
            this.node = node;
            this.successors = successors;
        }

        boolean hasNext() {
            return cursor < successors.size();
        }

        String next() {
            return successors.get(cursor++);
        }
    }
}

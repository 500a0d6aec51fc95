package com.behandlingflow.core.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.consolidate.EdgeConsolidator;
import com.behandlingflow.core.cycle.CycleDetector;
import com.behandlingflow.core.flow.FlowTraverser;
import com.behandlingflow.core.flow.IterationGroupDetector;
import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.GeneratedDiagram;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.style.LabelFormatter;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.CycleAnalysis;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.FlowEdge;
import com.behandlingflow.core.model.FlowGraph;
import com.behandlingflow.core.model.IterationGroup;
import com.behandlingflow.core.model.ProcessorFact;

/**
 * Runs the flow pipeline for entry points: traversal, cycle detection, consolidation,
 * iteration grouping and generation.
 *
 * <p>Each entry point is processed independently and only reads the shared, immutable
 * {@link FactIndex}. A failure in one entry point is logged and reported as a failed
 * {@link EntryPointResult}; it never stops the others.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FactIndex index = FactIndex.build(facts);
 * FlowDiagramEngine engine = new FlowDiagramEngine(index, GeneratorConfig.defaults());
 * List<EntryPointResult> results = engine.generateAll(new DotGenerator(), false);
 * }</pre>
 */
public class FlowDiagramEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowDiagramEngine.class);

    private static final String DIAGRAM_SUFFIX = "_flow";

    private final FactIndex index;
    private final GeneratorConfig config;
    private final FlowTraverser traverser;
    private final CycleDetector cycleDetector;
    private final EdgeConsolidator consolidator;
    private final IterationGroupDetector iterationDetector;

    public FlowDiagramEngine(FactIndex index, GeneratorConfig config) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.traverser = new FlowTraverser(index);
        this.cycleDetector = new CycleDetector();
        this.consolidator = new EdgeConsolidator(config.summaryThreshold(), config.heavyThreshold(),
            new LabelFormatter(config.nodeStyles())::formatCondition);
        this.iterationDetector = new IterationGroupDetector(index);
    }

    /**
     * Returns the entry points in processing order.
     *
     * @return entry point classes sorted by name
     */
    public List<ClassFact> entryPoints() {
        return index.entryPoints();
    }

    /**
     * Analyzes the flow of one entry point.
     *
     * @param entry entry point class
     * @return analyzed flow
     * @throws IllegalArgumentException if the class has no initial activity
     */
    public FlowDiagramModel analyze(ClassFact entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (!entry.isEntryPoint()) {
            throw new IllegalArgumentException("Class has no initial activity: " + entry.name());
        }

        FlowGraph graph = traverser.traverse(entry.initialActivityName());
        CycleAnalysis cycles = cycleDetector.detect(graph);
        List<FlowEdge> edges = config.deduplicate()
            ? consolidator.consolidate(graph.edges(), cycles, config.showConditions())
            : graph.edges();
        List<IterationGroup> iterationGroups = iterationDetector.detect(graph, cycles);

        return new FlowDiagramModel(entry.name(), graph, cycles, edges, iterationGroups,
            manualTaskActivities(graph), supertypesByActivity(graph));
    }

    /**
     * Generates the diagram of one entry point.
     *
     * @param entry entry point class
     * @param generator diagram generator
     * @return successful result, or a failed result describing the error
     */
    public EntryPointResult generate(ClassFact entry, DiagramGenerator generator) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(generator, "generator must not be null");

        try {
            FlowDiagramModel model = analyze(entry);
            GeneratedDiagram generated = generator.generate(model, config);
            GeneratedDiagram diagram = new GeneratedDiagram(entry.name() + DIAGRAM_SUFFIX,
                generated.content(), generated.fileExtension());
            log.debug("Generated {} for {}", diagram.fileName(), entry.name());
            return EntryPointResult.success(entry.name(), diagram);
        } catch (RuntimeException e) {
            log.error("Failed to generate flow for {}: {}", entry.name(), e.getMessage(), e);
            return EntryPointResult.failed(entry.name(), e.getMessage());
        }
    }

    /**
     * Generates diagrams for every entry point.
     *
     * @param generator diagram generator
     * @param parallel whether entry points run on a thread pool
     * @return results in entry-point order
     */
    public List<EntryPointResult> generateAll(DiagramGenerator generator, boolean parallel) {
        Objects.requireNonNull(generator, "generator must not be null");
        List<ClassFact> entries = entryPoints();
        log.info("Generating {} flow diagram(s) with {}", entries.size(), generator.getDisplayName());

        if (!parallel || entries.size() < 2) {
            List<EntryPointResult> results = new ArrayList<>();
            for (ClassFact entry : entries) {
                results.add(generate(entry, generator));
            }
            return results;
        }
        return generateInParallel(entries, generator);
    }

    private List<EntryPointResult> generateInParallel(List<ClassFact> entries, DiagramGenerator generator) {
        int threads = Math.min(entries.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<EntryPointResult>> futures = new ArrayList<>();
            for (ClassFact entry : entries) {
                futures.add(executor.submit(() -> generate(entry, generator)));
            }

            List<EntryPointResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), entries.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private EntryPointResult await(Future<EntryPointResult> future, ClassFact entry) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while generating flow diagrams", e);
        } catch (ExecutionException e) {
            log.error("Failed to generate flow for {}", entry.name(), e.getCause());
            return EntryPointResult.failed(entry.name(), String.valueOf(e.getCause()));
        }
    }

    private Set<String> manualTaskActivities(FlowGraph graph) {
        return graph.nodes().stream()
            .filter(activity -> index.findProcessor(activity)
                .map(ProcessorFact::createsManualTask)
                .orElse(false))
            .collect(Collectors.toSet());
    }

    private Map<String, List<String>> supertypesByActivity(FlowGraph graph) {
        Map<String, List<String>> supertypes = new HashMap<>();
        for (String activity : graph.nodes()) {
            index.findClass(activity)
                .filter(fact -> !fact.supertypeNames().isEmpty())
                .ifPresent(fact -> supertypes.put(activity, fact.supertypeNames()));
        }
        return supertypes;
    }
}

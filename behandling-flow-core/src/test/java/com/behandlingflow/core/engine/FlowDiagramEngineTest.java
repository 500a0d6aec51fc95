package com.behandlingflow.core.engine;

import com.behandlingflow.core.FlowFixtures;
import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.GeneratedDiagram;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.impl.DotGenerator;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.behandlingflow.core.FlowFixtures.activity;
import static com.behandlingflow.core.FlowFixtures.entry;
import static com.behandlingflow.core.FlowFixtures.manualTaskProcessor;
import static com.behandlingflow.core.FlowFixtures.processor;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FlowDiagramEngine}.
 */
class FlowDiagramEngineTest {

    /**
     * Fails for one behandling, delegates to DOT for the others.
     */
    private static final class FailingGenerator implements DiagramGenerator {
        private final String failFor;
        private final DotGenerator delegate = new DotGenerator();

        FailingGenerator(String failFor) {
            this.failFor = failFor;
        }

        @Override
        public String getId() {
            return "failing";
        }

        @Override
        public String getDisplayName() {
            return "Failing Generator";
        }

        @Override
        public String getFileExtension() {
            return "dot";
        }

        @Override
        public GeneratedDiagram generate(FlowDiagramModel model, GeneratorConfig config) {
            if (model.behandlingName().equals(failFor)) {
                throw new IllegalStateException("broken flow " + failFor);
            }
            return delegate.generate(model, config);
        }
    }

    private static FactIndex threeBehandlinger() {
        return FactIndex.build(
            List.of(entry("CBehandling", "C"), entry("ABehandling", "A"), entry("BBehandling", "B")),
            List.of(
                processor("A", Transition.to("Felles")),
                processor("B", Transition.when("x()", "Felles"), Transition.to("B")),
                processor("C"),
                processor("Felles")));
    }

    @Test
    void generateAll_sequential_returnsResultsInEntryOrder() {
        FlowDiagramEngine engine = new FlowDiagramEngine(threeBehandlinger(), GeneratorConfig.defaults());

        List<EntryPointResult> results = engine.generateAll(new DotGenerator(), false);

        assertThat(results).extracting(EntryPointResult::behandlingName)
            .containsExactly("ABehandling", "BBehandling", "CBehandling");
        assertThat(results).allMatch(EntryPointResult::success);
        assertThat(results.get(0).diagram().fileName()).isEqualTo("ABehandling_flow.dot");
    }

    @Test
    void generateAll_oneEntryFails_othersStillSucceed() {
        FlowDiagramEngine engine = new FlowDiagramEngine(threeBehandlinger(), GeneratorConfig.defaults());

        List<EntryPointResult> results = engine.generateAll(new FailingGenerator("BBehandling"), false);

        assertThat(results).extracting(EntryPointResult::success).containsExactly(true, false, true);
        assertThat(results.get(1).errorMessage()).isEqualTo("broken flow BBehandling");
        assertThat(results.get(1).diagram()).isNull();
    }

    @Test
    void generateAll_parallel_matchesSequentialOutput() {
        List<ClassFact> classes = new ArrayList<>();
        List<ProcessorFact> processors = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            classes.add(entry("Behandling" + i, "Start" + i));
            processors.add(processor("Start" + i, Transition.when("ok()", "Vent" + i), Transition.to("Avbryt")));
            processors.add(processor("Vent" + i, Transition.to("Start" + i)));
        }
        FlowDiagramEngine engine = new FlowDiagramEngine(
            FactIndex.build(classes, processors), GeneratorConfig.defaults().withShowConditions(true));

        List<EntryPointResult> sequential = engine.generateAll(new DotGenerator(), false);
        List<EntryPointResult> parallel = engine.generateAll(new DotGenerator(), true);

        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void generateAll_parallelWithFailure_isolatesFailure() {
        FlowDiagramEngine engine = new FlowDiagramEngine(threeBehandlinger(), GeneratorConfig.defaults());

        List<EntryPointResult> results = engine.generateAll(new FailingGenerator("ABehandling"), true);

        assertThat(results).extracting(EntryPointResult::success).containsExactly(false, true, true);
    }

    @Test
    void analyze_collectsCyclesManualTasksAndSupertypes() {
        FactIndex index = FactIndex.build(
            List.of(entry("Behandling", "Start"), activity("Beregn", "AldeAktivitet")),
            List.of(
                processor("Start", Transition.to("Beregn")),
                manualTaskProcessor("Beregn", Transition.to("Start"))));
        FlowDiagramEngine engine = new FlowDiagramEngine(index, GeneratorConfig.defaults());

        FlowDiagramModel model = engine.analyze(index.findClass("Behandling").orElseThrow());

        assertThat(model.entryActivity()).isEqualTo("Start");
        assertThat(model.cycles().hasCycles()).isTrue();
        assertThat(model.createsManualTask("Beregn")).isTrue();
        assertThat(model.createsManualTask("Start")).isFalse();
        assertThat(model.supertypesOf("Beregn")).containsExactly("AldeAktivitet");
    }

    @Test
    void analyze_deduplicateDisabled_keepsRawEdges() {
        FactIndex index = FactIndex.build(List.of(entry("Behandling", "Start")), List.of(
            processor("Start", Transition.when("a()", "A"), Transition.when("b()", "A"))));
        GeneratorConfig config = GeneratorConfig.defaults().withDeduplicate(false);

        FlowDiagramModel model = new FlowDiagramEngine(index, config)
            .analyze(index.findClass("Behandling").orElseThrow());

        assertThat(model.edges()).isEqualTo(model.graph().edges()).hasSize(2);
    }

    @Test
    void analyze_deduplicateEnabled_consolidatesEdges() {
        FactIndex index = FactIndex.build(List.of(entry("Behandling", "Start")), List.of(
            processor("Start", Transition.when("a()", "A"), Transition.when("b()", "A"))));

        FlowDiagramModel model = FlowFixtures.analyze(index, "Behandling", GeneratorConfig.defaults());

        assertThat(model.edges()).hasSize(1);
        assertThat(model.graph().edges()).hasSize(2);
    }

    @Test
    void analyze_classWithoutInitialActivity_throwsException() {
        FactIndex index = FactIndex.build(List.of(activity("Plain")), List.of());
        FlowDiagramEngine engine = new FlowDiagramEngine(index, GeneratorConfig.defaults());

        assertThatThrownBy(() -> engine.analyze(index.findClass("Plain").orElseThrow()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Plain");
    }

    @Test
    void generate_entryWithoutProcessor_producesSingleNodeDiagram() {
        FactIndex index = FactIndex.build(List.of(entry("Tom", "Ukjent")), List.of());
        FlowDiagramEngine engine = new FlowDiagramEngine(index, GeneratorConfig.defaults());

        EntryPointResult result = engine.generate(index.entryPoints().get(0), new DotGenerator());

        assertThat(result.success()).isTrue();
        assertThat(result.diagram().content()).contains("\"Ukjent\" [label=\"Ukjent\"").doesNotContain(" -> ");
    }
}

package com.behandlingflow.core;

import com.behandlingflow.core.engine.FlowDiagramEngine;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.FlowDiagramModel;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;

import java.util.List;

/**
 * Builders for the fact sets shared by the engine tests.
 */
public final class FlowFixtures {

    private FlowFixtures() {
    }

    public static ClassFact entry(String name, String initialActivity) {
        return new ClassFact(name, name + ".java", List.of(), initialActivity);
    }

    public static ClassFact activity(String name, String... supertypes) {
        return new ClassFact(name, name + ".java", List.of(supertypes), null);
    }

    public static ProcessorFact processor(String activity, Transition... transitions) {
        return new ProcessorFact(activity, null, List.of(transitions), false);
    }

    public static ProcessorFact manualTaskProcessor(String activity, Transition... transitions) {
        return new ProcessorFact(activity, null, List.of(transitions), true);
    }

    /**
     * Start, then Wait and Check looping until Check is ready, then Done (no processor).
     *
     * @return index with entry class {@code StartBehandling}
     */
    public static FactIndex waitCheckIndex() {
        return FactIndex.build(
            List.of(entry("StartBehandling", "Start")),
            List.of(
                processor("Start", Transition.to("Wait")),
                processor("Wait", Transition.to("Check")),
                processor("Check",
                    Transition.when("isReady()", "Done"),
                    Transition.to("Wait"))));
    }

    /**
     * Runs the analysis pipeline for one entry class.
     *
     * @param index facts
     * @param entryClass name of the entry class
     * @param config generator configuration
     * @return analyzed flow
     */
    public static FlowDiagramModel analyze(FactIndex index, String entryClass, GeneratorConfig config) {
        return new FlowDiagramEngine(index, config).analyze(index.findClass(entryClass).orElseThrow());
    }
}

package com.behandlingflow.core.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.FactConflict;
import com.behandlingflow.core.model.FactConflict.ConflictType;
import com.behandlingflow.core.model.FactSet;
import com.behandlingflow.core.model.ProcessorFact;

/**
 * Immutable lookup structures over extracted facts.
 *
 * <p>Maps class name to {@link ClassFact} and processed activity name to {@link ProcessorFact}.
 * When two facts claim the same key the later one in the given order wins and a
 * {@link FactConflict} is recorded. The index itself never logs; callers decide how to surface
 * conflicts.
 *
 * <p>Instances are safe to share between threads.
 */
public final class FactIndex {

    private final Map<String, ClassFact> classesByName;
    private final Map<String, ProcessorFact> processorsByActivity;
    private final List<FactConflict> conflicts;

    private FactIndex(Map<String, ClassFact> classesByName,
                      Map<String, ProcessorFact> processorsByActivity,
                      List<FactConflict> conflicts) {
        this.classesByName = Collections.unmodifiableMap(classesByName);
        this.processorsByActivity = Collections.unmodifiableMap(processorsByActivity);
        this.conflicts = List.copyOf(conflicts);
    }

    /**
     * Builds an index from facts in declaration order.
     *
     * @param classes class facts
     * @param processors processor facts
     * @return the index
     */
    public static FactIndex build(List<ClassFact> classes, List<ProcessorFact> processors) {
        Objects.requireNonNull(classes, "classes must not be null");
        Objects.requireNonNull(processors, "processors must not be null");

        Map<String, ClassFact> classesByName = new LinkedHashMap<>();
        Map<String, ProcessorFact> processorsByActivity = new LinkedHashMap<>();
        List<FactConflict> conflicts = new ArrayList<>();

        for (ClassFact fact : classes) {
            ClassFact previous = classesByName.put(fact.name(), fact);
            if (previous != null) {
                conflicts.add(new FactConflict(ConflictType.DUPLICATE_CLASS, fact.name(),
                    describe(previous), describe(fact)));
            }
        }

        for (ProcessorFact fact : processors) {
            ProcessorFact previous = processorsByActivity.put(fact.processedActivityName(), fact);
            if (previous != null) {
                conflicts.add(new FactConflict(ConflictType.DUPLICATE_PROCESSOR, fact.processedActivityName(),
                    previous.processorName(), fact.processorName()));
            }
        }

        return new FactIndex(classesByName, processorsByActivity, conflicts);
    }

    /**
     * Builds an index from a fact set.
     *
     * @param facts class and processor facts
     * @return the index
     */
    public static FactIndex build(FactSet facts) {
        Objects.requireNonNull(facts, "facts must not be null");
        return build(facts.classes(), facts.processors());
    }

    public Optional<ClassFact> findClass(String name) {
        return Optional.ofNullable(classesByName.get(name));
    }

    public Optional<ProcessorFact> findProcessor(String activityName) {
        return Optional.ofNullable(processorsByActivity.get(activityName));
    }

    /**
     * Returns every class with an initial activity, sorted by class name.
     *
     * @return entry point classes
     */
    public List<ClassFact> entryPoints() {
        return classesByName.values().stream()
            .filter(ClassFact::isEntryPoint)
            .sorted(Comparator.comparing(ClassFact::name))
            .toList();
    }

    public Map<String, ClassFact> classes() {
        return classesByName;
    }

    public Map<String, ProcessorFact> processors() {
        return processorsByActivity;
    }

    public List<FactConflict> conflicts() {
        return conflicts;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    private static String describe(ClassFact fact) {
        return fact.sourceLocation() != null ? fact.name() + " (" + fact.sourceLocation() + ")" : fact.name();
    }
}

package com.behandlingflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Class and processor facts from one or more fact sources, in declaration order.
 *
 * @param classes class facts
 * @param processors processor facts
 */
public record FactSet(
    List<ClassFact> classes,
    List<ProcessorFact> processors
) {
    /**
     * Compact constructor with validation.
     */
    public FactSet {
        classes = classes == null ? List.of() : List.copyOf(classes);
        processors = processors == null ? List.of() : List.copyOf(processors);
    }

    public static FactSet empty() {
        return new FactSet(List.of(), List.of());
    }

    /**
     * Appends another fact set after this one, keeping declaration order.
     *
     * @param other facts declared later
     * @return combined facts
     */
    public FactSet merge(FactSet other) {
        List<ClassFact> allClasses = new ArrayList<>(classes);
        allClasses.addAll(other.classes());
        List<ProcessorFact> allProcessors = new ArrayList<>(processors);
        allProcessors.addAll(other.processors());
        return new FactSet(allClasses, allProcessors);
    }

    public boolean isEmpty() {
        return classes.isEmpty() && processors.isEmpty();
    }
}

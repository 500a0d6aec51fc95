package com.behandlingflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One outbound transition declared by a processor.
 *
 * <p>A transition with a single target is an ordinary "next activity" step. A transition
 * with several targets is a fan-out: one logical step producing several simultaneous next
 * activities. The surface shape that produced the fan-out (list literal, list transform,
 * transform plus append) is resolved by the extractor; the engine only sees the target list.
 *
 * @param targetActivityNames resolved target activities, never empty
 * @param condition branch condition as source text, or null when unconditional
 * @param featureFlagged whether the branch is guarded by a feature toggle
 * @param featureFlagName name of the feature toggle, or null
 * @param collection whether the targets are created once per item of a collection
 */
public record Transition(
    List<String> targetActivityNames,
    String condition,
    boolean featureFlagged,
    String featureFlagName,
    boolean collection
) {
    /**
     * Compact constructor with validation.
     */
    public Transition {
        Objects.requireNonNull(targetActivityNames, "targetActivityNames must not be null");
        if (targetActivityNames.isEmpty()) {
            throw new IllegalArgumentException("A transition needs at least one target activity");
        }
        targetActivityNames = List.copyOf(targetActivityNames);
        if (condition != null && condition.isBlank()) {
            condition = null;
        }
        if (featureFlagName != null && featureFlagName.isBlank()) {
            featureFlagName = null;
        }
        if (featureFlagName != null) {
            featureFlagged = true;
        }
    }

    /**
     * Creates an unconditional transition.
     *
     * @param target next activity
     * @return transition
     */
    public static Transition to(String target) {
        return new Transition(List.of(target), null, false, null, false);
    }

    /**
     * Creates a conditional transition.
     *
     * @param condition branch condition
     * @param target next activity when the condition holds
     * @return transition
     */
    public static Transition when(String condition, String target) {
        return new Transition(List.of(target), condition, false, null, false);
    }

    /**
     * Creates a fan-out transition.
     *
     * @param condition condition wrapping the fan-out, or null
     * @param targets all activities produced by the step
     * @return transition
     */
    public static Transition fanOut(String condition, List<String> targets) {
        return new Transition(targets, condition, false, null, false);
    }

    /**
     * Creates a transition whose target is created once per collection item.
     *
     * @param condition condition wrapping the iteration, or null
     * @param target activity created per item
     * @return transition
     */
    public static Transition forEach(String condition, String target) {
        return new Transition(List.of(target), condition, false, null, true);
    }

    /**
     * Returns a copy guarded by the given feature toggle.
     *
     * @param flagName feature toggle name
     * @return flagged transition
     */
    public Transition withFeatureFlag(String flagName) {
        return new Transition(targetActivityNames, condition, true, flagName, collection);
    }

    /**
     * Returns the first (for ordinary transitions, the only) target.
     *
     * @return target activity name
     */
    public String targetActivityName() {
        return targetActivityNames.get(0);
    }

    public boolean isConditional() {
        return condition != null;
    }

    public boolean isFanOut() {
        return targetActivityNames.size() > 1;
    }
}

package com.behandlingflow.core.consolidate;

import com.behandlingflow.core.model.CycleAnalysis;
import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.EdgeKey;
import com.behandlingflow.core.model.FlowEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EdgeConsolidator}.
 */
class EdgeConsolidatorTest {

    private final EdgeConsolidator consolidator = new EdgeConsolidator();

    @Test
    void consolidate_singleEdges_areKeptUnchanged() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", ""),
            FlowEdge.of("B", "C", "ok()"));

        assertThat(consolidator.consolidate(edges, CycleAnalysis.none(), true)).isEqualTo(edges);
    }

    @Test
    void consolidate_twoParallelEdges_becomeSummaryWithExample() {
        // Given
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "harSak()"),
            FlowEdge.of("A", "B", "harKrav()"));

        // When
        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), true);

        // Then
        assertThat(result).singleElement().satisfies(edge -> {
            assertThat(edge.label()).isEqualTo("2 paths: harSak()");
            assertThat(edge.multiplicity()).isEqualTo(2);
            assertThat(edge.isSummary()).isTrue();
        });
    }

    @Test
    void consolidate_summaryExample_isTruncatedToFortyCharacters() {
        String longCondition = "x".repeat(50);
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", longCondition),
            FlowEdge.of("A", "B", "kort()"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), true);

        assertThat(result.get(0).label()).isEqualTo("2 paths: " + "x".repeat(40) + "...");
    }

    @Test
    void consolidate_summaryExample_isTruncatedOnCodePointBoundary() {
        String emojiCondition = "x".repeat(39) + "🚩🚩";
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", emojiCondition),
            FlowEdge.of("A", "B", "kort()"));

        String label = consolidator.consolidate(edges, CycleAnalysis.none(), true).get(0).label();

        assertThat(label).isEqualTo("2 paths: " + "x".repeat(39) + "🚩...");
        assertThat(label.codePoints()).noneMatch(cp -> cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE);
    }

    @Test
    void consolidate_exampleFormatter_isAppliedBeforeTruncation() {
        EdgeConsolidator formatting = new EdgeConsolidator(2, 4, text -> text.replace("behandling.", ""));
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "behandling.erKlar()"),
            FlowEdge.of("A", "B", "behandling.harSak()"));

        List<FlowEdge> result = formatting.consolidate(edges, CycleAnalysis.none(), true);

        assertThat(result).extracting(FlowEdge::label).containsExactly("2 paths: erKlar()");
    }

    @Test
    void consolidate_conditionsHidden_summaryHasNoExample() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "harSak()"),
            FlowEdge.of("A", "B", "harKrav()"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), false);

        assertThat(result).extracting(FlowEdge::label).containsExactly("2 paths");
    }

    @Test
    void consolidate_fourParallelEdges_becomeHeavySummary() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "a()"),
            FlowEdge.of("A", "B", "b()"),
            FlowEdge.of("A", "B", "c()"),
            FlowEdge.of("A", "B", "d()"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), true);

        assertThat(result).singleElement().satisfies(edge -> {
            assertThat(edge.label()).isEqualTo("4 paths");
            assertThat(consolidator.isHeavy(edge)).isTrue();
        });
    }

    @Test
    void consolidate_conditionsHidden_dropsElseEdgeNextToConditionedEdge() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "ok()"),
            FlowEdge.of("A", "B", "else"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), false);

        assertThat(result).containsExactly(FlowEdge.of("A", "B", "ok()"));
    }

    @Test
    void consolidate_onlyElseEdges_keepsFirst() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "else"),
            FlowEdge.of("A", "B", "else"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), false);

        assertThat(result).containsExactly(FlowEdge.of("A", "B", "else"));
    }

    @Test
    void consolidate_conditionsShown_keepsElseInCount() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "else"),
            FlowEdge.of("A", "B", "ok()"));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), true);

        assertThat(result).extracting(FlowEdge::label).containsExactly("2 paths: ok()");
    }

    @Test
    void consolidate_keepsFirstAppearanceOrderOfGroups() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "x()"),
            FlowEdge.of("A", "C", ""),
            FlowEdge.of("A", "B", "y()"),
            FlowEdge.of("C", "D", ""));

        List<FlowEdge> result = consolidator.consolidate(edges, CycleAnalysis.none(), true);

        assertThat(result).extracting(FlowEdge::key).containsExactly(
            new EdgeKey("A", "B"), new EdgeKey("A", "C"), new EdgeKey("C", "D"));
    }

    @Test
    void consolidate_isIdempotent() {
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "a()"),
            FlowEdge.of("A", "B", "b()"),
            FlowEdge.of("A", "C", "a()"),
            FlowEdge.of("A", "C", "b()"),
            FlowEdge.of("A", "C", "c()"),
            FlowEdge.of("A", "C", "d()"),
            FlowEdge.of("A", "C", "e()"),
            FlowEdge.of("B", "D", "ok()"),
            FlowEdge.of("B", "D", "else"),
            FlowEdge.of("D", "A", ""));
        CycleAnalysis cycles = new CycleAnalysis(Set.of(new EdgeKey("D", "A")),
            List.of(new CycleCluster(List.of("A", "B", "D"))));

        for (boolean showConditions : new boolean[] {true, false}) {
            List<FlowEdge> once = consolidator.consolidate(edges, cycles, showConditions);
            List<FlowEdge> twice = consolidator.consolidate(once, cycles, showConditions);

            assertThat(twice).isEqualTo(once);
        }
    }

    @Test
    void consolidate_mixedFlags_summaryKeepsOnlyCommonValues() {
        List<FlowEdge> edges = List.of(
            new FlowEdge("A", "B", "a()", "FLAG", true, 1),
            new FlowEdge("A", "B", "b()", "FLAG", false, 1));

        FlowEdge summary = consolidator.consolidate(edges, CycleAnalysis.none(), true).get(0);

        assertThat(summary.featureFlag()).isEqualTo("FLAG");
        assertThat(summary.collection()).isFalse();
    }

    @Test
    void consolidate_customThresholds_keepEdgesBelowSummaryThreshold() {
        EdgeConsolidator strict = new EdgeConsolidator(3, 5);
        List<FlowEdge> edges = List.of(
            FlowEdge.of("A", "B", "a()"),
            FlowEdge.of("A", "B", "b()"));

        assertThat(strict.consolidate(edges, CycleAnalysis.none(), true)).isEqualTo(edges);
    }

    @Test
    void constructor_nullExampleFormatter_throwsException() {
        assertThatThrownBy(() -> new EdgeConsolidator(2, 4, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void constructor_invalidThresholds_throwsException() {
        assertThatThrownBy(() -> new EdgeConsolidator(1, 4))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EdgeConsolidator(3, 3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

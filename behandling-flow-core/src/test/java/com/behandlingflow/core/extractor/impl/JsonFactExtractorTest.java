package com.behandlingflow.core.extractor.impl;

import com.behandlingflow.core.extractor.ExtractionResult;
import com.behandlingflow.core.extractor.ExtractorTestBase;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonFactExtractor}.
 */
class JsonFactExtractorTest extends ExtractorTestBase {

    private JsonFactExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new JsonFactExtractor();
    }

    @Test
    void extract_fullDocument_readsClassesAndProcessors() throws IOException {
        // Given
        createFile("flows/sak.facts.json", """
            {
              "classes": [
                {"name": "SakBehandling", "sourceLocation": "Sak.kt",
                 "supertypes": ["Behandling"], "initialActivity": "StartAktivitet"},
                {"name": "BeregnAktivitet", "supertypes": "AldeAktivitet"}
              ],
              "processors": [
                {"activity": "StartAktivitet", "processor": "StartProcessor",
                 "createsManualTask": true,
                 "transitions": [
                   {"target": "BeregnAktivitet", "condition": "behandling.erKlar()"},
                   {"targets": ["A", "B"], "condition": "harVedlegg()"},
                   {"target": "C", "collection": true, "featureFlag": "PEN_FLAG"},
                   {"target": "D"}
                 ]}
              ]
            }
            """);

        // When
        ExtractionResult result = extractor.extract(context);

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.facts().classes()).containsExactly(
            new ClassFact("SakBehandling", "Sak.kt", List.of("Behandling"), "StartAktivitet"),
            new ClassFact("BeregnAktivitet", "flows/sak.facts.json", List.of("AldeAktivitet"), null));

        ProcessorFact processor = result.facts().processors().get(0);
        assertThat(processor.processorName()).isEqualTo("StartProcessor");
        assertThat(processor.createsManualTask()).isTrue();
        assertThat(processor.transitions()).containsExactly(
            Transition.when("behandling.erKlar()", "BeregnAktivitet"),
            Transition.fanOut("harVedlegg()", List.of("A", "B")),
            new Transition(List.of("C"), null, true, "PEN_FLAG", true),
            Transition.to("D"));
    }

    @Test
    void extract_entriesWithoutRequiredFields_areSkippedWithWarnings() throws IOException {
        createFile("a.facts.json", """
            {
              "classes": [{"sourceLocation": "x"}, {"name": "Ok"}],
              "processors": [
                {"processor": "Orphan"},
                {"activity": "Start", "transitions": [{"condition": "x()"}, {"target": "A"}]}
              ]
            }
            """);

        ExtractionResult result = extractor.extract(context);

        assertThat(result.facts().classes()).extracting(ClassFact::name).containsExactly("Ok");
        assertThat(result.facts().processors()).singleElement()
            .satisfies(p -> assertThat(p.transitions()).containsExactly(Transition.to("A")));
        assertThat(result.warnings()).hasSize(3);
    }

    @Test
    void extract_invalidJson_skipsFileAndReadsOthers() throws IOException {
        createFile("broken.facts.json", "{ not json");
        createFile("ok.facts.json", """
            {"processors": [{"activity": "Start"}]}
            """);

        ExtractionResult result = extractor.extract(context);

        assertThat(result.success()).isTrue();
        assertThat(result.documents()).hasSize(1);
        assertThat(result.warnings()).singleElement().asString().contains("broken.facts.json");
    }

    @Test
    void extract_unknownProperties_areIgnored() throws IOException {
        createFile("a.facts.json", """
            {"version": 2, "classes": [{"name": "A", "annotations": ["X"]}]}
            """);

        ExtractionResult result = extractor.extract(context);

        assertThat(result.warnings()).isEmpty();
        assertThat(result.facts().classes()).hasSize(1);
    }

    @Test
    void extract_noMatchingFiles_returnsEmptyResult() throws IOException {
        createFile("notes.json", "{}");

        ExtractionResult result = extractor.extract(context);

        assertThat(result.documents()).isEmpty();
        assertThat(extractor.appliesTo(context)).isFalse();
    }

    @Test
    void metadata_isStable() {
        assertThat(extractor.getId()).isEqualTo("json-facts");
        assertThat(extractor.getSupportedFilePatterns()).contains("**/*.facts.json");
        assertThat(extractor.getPriority()).isLessThan(new YamlFactExtractor().getPriority());
    }
}

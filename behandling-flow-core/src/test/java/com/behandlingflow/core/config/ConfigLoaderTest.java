package com.behandlingflow.core.config;

import com.behandlingflow.core.generator.EdgeRouting;
import com.behandlingflow.core.generator.GeneratorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("behandling-flow.yaml");
        Files.writeString(configFile, """
            project:
              name: "pensjon-behandlinger"
              description: "Alderspensjon flows"

            diagram:
              generator: mermaid
              edgeStyle: orthogonal
              showConditions: true
              summaryThreshold: 3
              heavyThreshold: 6

            styles:
              waitingKeywords: [Vent, Pause]
              highlightSupertypes: [UforeAktivitet]

            output:
              directory: "./flows"
              format: png
              keepDot: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("pensjon-behandlinger");
        assertThat(config.project().description()).isEqualTo("Alderspensjon flows");
        assertThat(config.diagram().generator()).isEqualTo("mermaid");
        assertThat(config.diagram().edgeStyle()).isEqualTo("orthogonal");
        assertThat(config.diagram().showConditions()).isTrue();
        assertThat(config.diagram().showLegend()).isFalse();
        assertThat(config.styles().waitingKeywords()).containsExactly("Vent", "Pause");
        assertThat(config.output().directory()).isEqualTo("./flows");
        assertThat(config.output().format()).isEqualTo("png");
        assertThat(config.output().keepDot()).isTrue();
        assertThat(config.output().renderer()).isEqualTo("graphviz");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("behandling-flow.yaml");
        Files.writeString(configFile, """
            project:
              name: "flows"
              version: "2.0.0"
            renderers:
              enabled: [graphviz]
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("flows");
        assertThat(config.diagram().generator()).isEqualTo("dot");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.project().name()).isEqualTo("project");
        assertThat(config.output().directory()).isEqualTo(".");
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("behandling-flow.yaml");
        Files.writeString(configFile, """
            diagram:
              showConditions: [not, a, boolean
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void toGeneratorConfig_defaults_matchGeneratorDefaults() {
        GeneratorConfig config = ProjectConfig.defaults().toGeneratorConfig();

        assertThat(config).isEqualTo(GeneratorConfig.defaults());
    }

    @Test
    void toGeneratorConfig_carriesDiagramAndStyleSettings() throws IOException {
        Path configFile = tempDir.resolve("behandling-flow.yaml");
        Files.writeString(configFile, """
            diagram:
              edgeStyle: curved
              showLegend: true
              deduplicate: false
              summaryThreshold: 3
              heavyThreshold: 6
            styles:
              stripTokens: [Steg]
            """);

        GeneratorConfig config = ConfigLoader.load(configFile).toGeneratorConfig();

        assertThat(config.edgeRouting()).isEqualTo(EdgeRouting.CURVED);
        assertThat(config.showConditions()).isFalse();
        assertThat(config.showLegend()).isTrue();
        assertThat(config.deduplicate()).isFalse();
        assertThat(config.summaryThreshold()).isEqualTo(3);
        assertThat(config.heavyThreshold()).isEqualTo(6);
        assertThat(config.nodeStyles().stripTokens()).containsExactly("Steg");
        assertThat(config.nodeStyles().waitingKeywords()).containsExactly("Vent", "Wait");
    }
}

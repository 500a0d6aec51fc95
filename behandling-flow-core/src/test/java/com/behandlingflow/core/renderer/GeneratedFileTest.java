package com.behandlingflow.core.renderer;

import com.behandlingflow.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GeneratedFileTest {

    @Test
    void of_dotDiagram_isGraphvizFile() {
        GeneratedFile file = GeneratedFile.of(new GeneratedDiagram("SakBehandling_flow", "digraph G {}", "dot"));

        assertThat(file.relativePath()).isEqualTo("SakBehandling_flow.dot");
        assertThat(file.contentType()).isEqualTo("text/vnd.graphviz");
        assertThat(file.isDot()).isTrue();
    }

    @Test
    void of_otherExtensions_mapContentTypes() {
        assertThat(GeneratedFile.of(new GeneratedDiagram("a", "", "md")).contentType()).isEqualTo("text/markdown");
        assertThat(GeneratedFile.of(new GeneratedDiagram("a", "", "txt")).contentType()).isEqualTo("text/plain");
        assertThat(GeneratedFile.of(new GeneratedDiagram("a", "", "txt")).isDot()).isFalse();
    }

    @Test
    void constructor_nullContent_throws() {
        assertThatThrownBy(() -> new GeneratedFile("a.dot", null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content");
    }

    @Test
    void generatedOutput_copiesFiles() {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("a.dot", "x", null));
        GeneratedOutput output = new GeneratedOutput(files);

        files.clear();

        assertThat(output.files()).hasSize(1);
    }

    @Test
    void renderContext_nullSettings_becomeEmpty() {
        RenderContext context = new RenderContext("out", null);

        assertThat(context.settings()).isEmpty();
        assertThat(context.getSettingOrDefault("graphviz.format", "svg")).isEqualTo("svg");
        assertThat(new RenderContext("out", Map.of("graphviz.format", "png")).getSettingOrDefault("graphviz.format", "svg"))
            .isEqualTo("png");
    }
}

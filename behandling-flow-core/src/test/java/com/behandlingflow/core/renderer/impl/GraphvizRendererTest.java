package com.behandlingflow.core.renderer.impl;

import com.behandlingflow.core.renderer.GeneratedFile;
import com.behandlingflow.core.renderer.RenderContext;
import com.behandlingflow.core.renderer.RendererTestBase;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphvizRenderer}. The layout command is pointed at a binary that does not
 * exist, so these tests do not depend on a local Graphviz installation.
 */
class GraphvizRendererTest extends RendererTestBase {

    private static final String MISSING_COMMAND = "behandling-flow-missing-dot-binary";

    private final GraphvizRenderer renderer = new GraphvizRenderer();

    @Test
    void getId_returnsGraphviz() {
        assertThat(renderer.getId()).isEqualTo("graphviz");
    }

    @Test
    void render_commandMissing_keepsDotSource() throws Exception {
        // Given
        GeneratedFile dot = new GeneratedFile("SakBehandling_flow.dot", "digraph G {}", "text/vnd.graphviz");

        // When
        List<Path> produced = renderer.render(output(dot),
            createContext(Map.of(GraphvizRenderer.COMMAND_SETTING, MISSING_COMMAND)));

        // Then
        assertThat(produced).containsExactly(tempDir.resolve("SakBehandling_flow.dot"));
        assertThat(readFile("SakBehandling_flow.dot")).isEqualTo("digraph G {}");
        assertThat(tempDir.resolve("SakBehandling_flow.svg")).doesNotExist();
    }

    @Test
    void render_nonDotFiles_areWrittenUnchanged() throws Exception {
        GeneratedFile mermaid = new GeneratedFile("SakBehandling_flow.md", "```mermaid\n```", "text/markdown");

        List<Path> produced = renderer.render(output(mermaid),
            createContext(Map.of(GraphvizRenderer.COMMAND_SETTING, MISSING_COMMAND)));

        assertThat(produced).containsExactly(tempDir.resolve("SakBehandling_flow.md"));
        assertThat(readFile("SakBehandling_flow.md")).isEqualTo("```mermaid\n```");
    }

    @Test
    void render_outputDirectoryMissing_isCreated() {
        Path outputDir = tempDir.resolve("flows");

        List<Path> produced = renderer.render(output(new GeneratedFile("A_flow.dot", "digraph G {}", null)),
            new RenderContext(outputDir.toString(),
                Map.of(GraphvizRenderer.COMMAND_SETTING, MISSING_COMMAND)));

        assertThat(produced).containsExactly(outputDir.resolve("A_flow.dot"));
        assertThat(outputDir.resolve("A_flow.dot")).exists();
    }
}

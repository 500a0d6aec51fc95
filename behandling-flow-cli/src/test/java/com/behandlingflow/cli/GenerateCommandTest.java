package com.behandlingflow.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerateCommand}. All runs use the filesystem renderer so no Graphviz
 * installation is needed.
 */
class GenerateCommandTest extends CliTestBase {

    @Test
    void generate_withEntryPoint_writesDotFile() throws IOException {
        // Given
        createFile("facts/sak.facts.json", WAIT_CHECK_FACTS);
        Path outputDir = tempDir.resolve("out");

        // When
        int exitCode = execute("generate", tempDir.resolve("facts").toString(),
            "-o", outputDir.toString(), "-r", "filesystem");

        // Then
        assertThat(exitCode).isZero();
        Path dotFile = outputDir.resolve("StartBehandling_flow.dot");
        assertThat(dotFile).exists();
        assertThat(Files.readString(dotFile))
            .startsWith("digraph")
            .contains("subgraph cluster_cycle_0");
        assertThat(stdout())
            .contains("✓ Read 1 fact document(s)")
            .contains("✓ Found 1 entry point(s) and 3 processor(s)")
            .contains("✓ Generated 1 of 1 flow diagram(s)");
    }

    @Test
    void generate_mermaidGenerator_writesMarkdown() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);
        Path outputDir = tempDir.resolve("out");

        int exitCode = execute("generate", tempDir.toString(),
            "-o", outputDir.toString(), "-r", "filesystem", "-g", "mermaid", "--show-conditions");

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("StartBehandling_flow.md")).exists();
    }

    @Test
    void generate_consoleRenderer_printsDiagramWithoutWritingFiles() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);
        Path outputDir = tempDir.resolve("out");

        int exitCode = execute("generate", tempDir.toString(), "-o", outputDir.toString(), "-r", "console");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("=== StartBehandling_flow.dot ===")
            .contains("digraph")
            .doesNotContain("✅ Generated:");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generate_withDetails_printsProcessorsAndTrace() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);

        int exitCode = execute("generate", tempDir.toString(),
            "-o", tempDir.resolve("out").toString(), "-r", "filesystem", "--details");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Processors (3):")
            .contains("IF isReady() → Done");
    }

    @Test
    void generate_nonexistentPath_returnsError() {
        int exitCode = execute("generate", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Path does not exist");
    }

    @Test
    void generate_noFactDocuments_returnsError() throws IOException {
        createFile("README.md", "no facts here");

        int exitCode = execute("generate", tempDir.toString(), "-r", "filesystem");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ No fact documents found");
    }

    @Test
    void generate_noEntryPoints_returnsError() throws IOException {
        createFile("sak.facts.json", """
            {"processors": [{"activity": "Start", "processor": "StartProcessor"}]}
            """);

        int exitCode = execute("generate", tempDir.toString(), "-r", "filesystem");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ No entry points found");
    }

    @Test
    void generate_unknownGenerator_returnsError() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);

        int exitCode = execute("generate", tempDir.toString(), "-g", "plantuml", "-r", "filesystem");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Unknown generator: plantuml");
    }

    @Test
    void generate_configFile_selectsGeneratorAndOutput() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);
        Path outputDir = tempDir.resolve("from-config");
        createFile("behandling-flow.yaml", """
            diagram:
              generator: text
            output:
              directory: "%s"
              renderer: filesystem
            """.formatted(outputDir.toString().replace("\\", "/")));

        int exitCode = execute("generate", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(outputDir.resolve("StartBehandling_flow.txt")).exists();
    }
}

package com.behandlingflow.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CliTestBase {

    private static final String DUPLICATE_START = """
        {"processors": [{"activity": "Start", "processor": "OtherStartProcessor"}]}
        """;

    @Test
    void validate_cleanFacts_reportsFlow() throws IOException {
        createFile("sak.facts.json", WAIT_CHECK_FACTS);

        int exitCode = execute("validate", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("✓ No conflicting facts")
            .contains("StartBehandling (starts with Start)")
            .contains("  ? Missing processor: Done")
            .contains("  🔄 Cycle:");
    }

    @Test
    void validate_duplicateProcessor_warnsWithoutStrict() throws IOException {
        createFile("a.facts.json", WAIT_CHECK_FACTS);
        createFile("b.facts.json", DUPLICATE_START);

        int exitCode = execute("validate", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("⚠ 1 conflict(s):")
            .contains("Duplicate processor for Start: OtherStartProcessor replaces StartProcessor");
    }

    @Test
    void validate_duplicateProcessor_failsWithStrict() throws IOException {
        createFile("a.facts.json", WAIT_CHECK_FACTS);
        createFile("b.facts.json", DUPLICATE_START);

        int exitCode = execute("validate", tempDir.toString(), "--strict");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Conflicting facts are not allowed with --strict");
    }

    @Test
    void validate_noEntryPoints_returnsError() throws IOException {
        createFile("b.facts.json", DUPLICATE_START);

        int exitCode = execute("validate", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ No entry points found");
    }
}

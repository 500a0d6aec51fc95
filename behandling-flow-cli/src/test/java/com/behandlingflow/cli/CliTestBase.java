package com.behandlingflow.cli;

import com.behandlingflow.BehandlingFlowCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests: a temporary fact directory and captured standard streams.
 */
public abstract class CliTestBase {

    /** Entry point StartBehandling with a wait/check loop and an activity without processor. */
    protected static final String WAIT_CHECK_FACTS = """
        {
          "classes": [
            {"name": "StartBehandling", "sourceLocation": "sak/StartBehandling.kt",
             "supertypes": ["Behandling"], "initialActivity": "Start"}
          ],
          "processors": [
            {"activity": "Start", "processor": "StartProcessor", "transitions": [{"target": "Wait"}]},
            {"activity": "Wait", "processor": "WaitProcessor", "transitions": [{"target": "Check"}]},
            {"activity": "Check", "processor": "CheckProcessor", "transitions": [
              {"target": "Done", "condition": "isReady()"},
              {"target": "Wait"}
            ]}
          ]
        }
        """;

    @TempDir
    protected Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    protected int execute(String... args) {
        return BehandlingFlowCLI.createCommandLine().execute(args);
    }

    protected String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    protected String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }
}

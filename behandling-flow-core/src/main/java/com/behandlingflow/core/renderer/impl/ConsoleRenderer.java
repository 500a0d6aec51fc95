package com.behandlingflow.core.renderer.impl;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.renderer.GeneratedFile;
import com.behandlingflow.core.renderer.GeneratedOutput;
import com.behandlingflow.core.renderer.OutputRenderer;
import com.behandlingflow.core.renderer.RenderContext;

/**
 * Prints each diagram source under a {@code "=== <file> ==="} header instead of writing files.
 * The output directory of the context is ignored.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDisplayName() {
        return "Console";
    }

    @Override
    public List<Path> render(GeneratedOutput output, RenderContext context) {
        logger.debug("Printing {} diagram(s) to console", output.files().size());

        for (GeneratedFile file : output.files()) {
            out.println("=== " + file.relativePath() + " ===");
            out.println(file.content());
            out.println();
        }
        out.flush();
        return List.of();
    }
}

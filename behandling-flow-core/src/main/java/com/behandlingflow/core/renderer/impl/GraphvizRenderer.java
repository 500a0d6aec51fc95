package com.behandlingflow.core.renderer.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.renderer.GeneratedFile;
import com.behandlingflow.core.renderer.GeneratedOutput;
import com.behandlingflow.core.renderer.OutputRenderer;
import com.behandlingflow.core.renderer.RenderContext;

/**
 * Writes DOT files and converts them to images with the Graphviz {@code dot} command.
 *
 * <p>For every {@code .dot} file the renderer runs
 * {@code dot -T<format> <name>.dot -o <name>.<format>}. On success the DOT source is deleted
 * unless {@code graphviz.keepSource} is set. When the command is missing, fails, or times out
 * the DOT source is kept and a warning is logged. Other files are written unchanged.
 *
 * <p>Settings:
 * <ul>
 *   <li>{@code graphviz.format}: output format, default {@value #DEFAULT_FORMAT}</li>
 *   <li>{@code graphviz.keepSource}: keep DOT files after conversion, default false</li>
 *   <li>{@code graphviz.command}: layout command, default {@value #DEFAULT_COMMAND}</li>
 *   <li>{@code graphviz.timeoutSeconds}: wait per file, default {@value #DEFAULT_TIMEOUT_SECONDS}</li>
 * </ul>
 */
public class GraphvizRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(GraphvizRenderer.class);

    public static final String FORMAT_SETTING = "graphviz.format";
    public static final String KEEP_SOURCE_SETTING = "graphviz.keepSource";
    public static final String COMMAND_SETTING = "graphviz.command";
    public static final String TIMEOUT_SETTING = "graphviz.timeoutSeconds";

    static final String DEFAULT_FORMAT = "svg";
    static final String DEFAULT_COMMAND = "dot";
    static final long DEFAULT_TIMEOUT_SECONDS = 120;

    private final FileSystemRenderer fileSystemRenderer = new FileSystemRenderer();

    @Override
    public String getId() {
        return "graphviz";
    }

    @Override
    public String getDisplayName() {
        return "Graphviz Image Converter";
    }

    @Override
    public List<Path> render(GeneratedOutput output, RenderContext context) {
        String format = context.getSettingOrDefault(FORMAT_SETTING, DEFAULT_FORMAT);
        boolean keepSource = Boolean.parseBoolean(context.getSettingOrDefault(KEEP_SOURCE_SETTING, "false"));
        String command = context.getSettingOrDefault(COMMAND_SETTING, DEFAULT_COMMAND);
        long timeout = Long.parseLong(context.getSettingOrDefault(TIMEOUT_SETTING, String.valueOf(DEFAULT_TIMEOUT_SECONDS)));

        Path outputDir = Paths.get(context.outputDirectory());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        List<Path> produced = new ArrayList<>();
        for (GeneratedFile file : output.files()) {
            Path written = fileSystemRenderer.writeFile(outputDir, file);
            if (!file.isDot()) {
                produced.add(written);
                continue;
            }
            produced.add(convert(written, format, keepSource, command, timeout));
        }
        return produced;
    }

    /**
     * Converts one DOT file.
     *
     * @return the image on success, otherwise the kept DOT file
     */
    private Path convert(Path dotFile, String format, boolean keepSource, String command, long timeoutSeconds) {
        String fileName = dotFile.getFileName().toString();
        Path image = dotFile.resolveSibling(fileName.substring(0, fileName.length() - ".dot".length()) + "." + format);

        ProcessBuilder builder = new ProcessBuilder(command, "-T" + format, dotFile.toString(), "-o", image.toString())
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD);

        try {
            Process process = builder.start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                logger.warn("Graphviz timed out after {}s. DOT file saved at: {}", timeoutSeconds, dotFile);
                return dotFile;
            }
            if (process.exitValue() != 0) {
                logger.warn("Graphviz '{}' failed with exit code {}. DOT file saved at: {}. "
                    + "Convert it manually with: {} -T{} {} -o {}",
                    command, process.exitValue(), dotFile, command, format, dotFile, image);
                return dotFile;
            }
        } catch (IOException e) {
            logger.warn("Could not run Graphviz '{}': {}. Make sure Graphviz is installed. DOT file saved at: {}",
                command, e.getMessage(), dotFile);
            return dotFile;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while converting " + dotFile, e);
        }

        logger.info("Generated: {}", image);
        if (!keepSource) {
            deleteSource(dotFile);
        }
        return image;
    }

    private void deleteSource(Path dotFile) {
        try {
            Files.deleteIfExists(dotFile);
        } catch (IOException e) {
            logger.warn("Could not delete DOT file {}: {}", dotFile, e.getMessage());
        }
    }
}

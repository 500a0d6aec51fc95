package com.behandlingflow.core.renderer.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.behandlingflow.core.renderer.GeneratedFile;
import com.behandlingflow.core.renderer.GeneratedOutput;
import com.behandlingflow.core.renderer.OutputRenderer;
import com.behandlingflow.core.renderer.RenderContext;

/**
 * Writes generated files to the output directory, creating it if needed.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDisplayName() {
        return "File System";
    }

    @Override
    public List<Path> render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        List<Path> written = new ArrayList<>();
        for (GeneratedFile file : output.files()) {
            written.add(writeFile(outputDir, file));
        }

        logger.info("Successfully rendered {} files to filesystem", output.files().size());
        return written;
    }

    /**
     * Writes one file below the output directory.
     *
     * @param outputDir output directory
     * @param file file to write
     * @return the written path
     */
    Path writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, file.content());
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
            return targetPath;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}

package com.behandlingflow.cli;

import com.behandlingflow.core.extractor.FactExtractor;
import com.behandlingflow.core.extractor.FactLoader;
import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list facts or available plugins.
 *
 * <p>Fact listings read the documents below PATH. Plugin listings are discovered via the
 * Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Entry points and their initial activities
 * behandling-flow list entrypoints ./facts
 *
 * # Text trace of every flow
 * behandling-flow list flows ./facts
 *
 * # Available generators
 * behandling-flow list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List entrypoints, processors, flows, extractors, generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: entrypoints, processors, flows, extractors, generators, or renderers"
    )
    private String type;

    @Parameters(
        index = "1",
        description = "Directory containing fact documents (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "entrypoints", "entrypoint" -> listEntryPoints();
            case "processors", "processor" -> listProcessors();
            case "flows", "flow" -> listFlows();
            case "extractors", "extractor" -> listExtractors();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: entrypoints, processors, flows, extractors, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listEntryPoints() {
        Optional<FactIndex> index = loadIndex();
        if (index.isEmpty()) {
            return 1;
        }

        List<ClassFact> entryPoints = index.get().entryPoints();
        System.out.println("Entry Points:");
        System.out.println();
        for (ClassFact entry : entryPoints) {
            System.out.printf("  • %s → %s%n", entry.name(), entry.initialActivityName());
            if (entry.sourceLocation() != null) {
                System.out.printf("    Source: %s%n", entry.sourceLocation());
            }
        }
        if (entryPoints.isEmpty()) {
            System.out.println("  No entry points found.");
        }
        return 0;
    }

    private int listProcessors() {
        Optional<FactIndex> index = loadIndex();
        if (index.isEmpty()) {
            return 1;
        }
        CommandSupport.printProcessorDetails(index.get());
        return 0;
    }

    private int listFlows() {
        Optional<FactIndex> index = loadIndex();
        if (index.isEmpty()) {
            return 1;
        }
        CommandSupport.printTraces(index.get(),
            CommandSupport.loadConfig(projectPath, null).toGeneratorConfig());
        return 0;
    }

    private Optional<FactIndex> loadIndex() {
        if (!CommandSupport.checkDirectory(projectPath)) {
            return Optional.empty();
        }
        return CommandSupport.loadIndex(projectPath);
    }

    private int listExtractors() {
        System.out.println("Available Extractors:");
        System.out.println();

        for (FactExtractor extractor : FactLoader.discoverExtractors()) {
            System.out.printf("  • %s (ID: %s)%n", extractor.getDisplayName(), extractor.getId());
            System.out.printf("    Files: %s%n", extractor.getSupportedFilePatterns());
            System.out.printf("    Priority: %d%n", extractor.getPriority());
            System.out.println();
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File extension: .%s%n", generator.getFileExtension());
            System.out.println();
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.println();
        }
        return 0;
    }
}

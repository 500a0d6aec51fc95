package com.behandlingflow.cli;

import com.behandlingflow.core.config.ConfigLoader;
import com.behandlingflow.core.config.ProjectConfig;
import com.behandlingflow.core.engine.EntryPointResult;
import com.behandlingflow.core.engine.FlowDiagramEngine;
import com.behandlingflow.core.extractor.ExtractionContext;
import com.behandlingflow.core.extractor.FactLoadResult;
import com.behandlingflow.core.extractor.FactLoader;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.generator.impl.TextTraceGenerator;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.FactConflict;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Steps shared by the commands that read fact documents.
 */
final class CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    private CommandSupport() {
        // Utility class
    }

    /**
     * Checks that the path is an existing directory, printing an error otherwise.
     *
     * @param path path given on the command line
     * @return true if the path can be scanned
     */
    static boolean checkDirectory(Path path) {
        if (!Files.exists(path)) {
            System.err.println("✗ Path does not exist: " + path);
            return false;
        }
        if (!Files.isDirectory(path)) {
            System.err.println("✗ Path is not a directory: " + path);
            return false;
        }
        return true;
    }

    /**
     * Loads the project configuration.
     *
     * <p>An explicit file is resolved against the project path when relative. Without one,
     * {@code behandling-flow.yaml} in the project path is used when present.
     *
     * @param projectPath project directory
     * @param configFile explicit configuration file, or null
     * @return loaded or default configuration
     */
    static ProjectConfig loadConfig(Path projectPath, Path configFile) {
        if (configFile != null) {
            Path resolved = configFile.isAbsolute() ? configFile : projectPath.resolve(configFile);
            return ConfigLoader.load(resolved);
        }
        Path defaultFile = projectPath.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultFile)) {
            return ConfigLoader.load(defaultFile);
        }
        log.debug("No {} in {}, using defaults", ConfigLoader.DEFAULT_CONFIG_FILE, projectPath);
        return ProjectConfig.defaults();
    }

    /**
     * Reads all fact documents below the path and builds the index.
     *
     * @param projectPath directory to read
     * @return the index, or empty when no fact document was found
     */
    static Optional<FactIndex> loadIndex(Path projectPath) {
        FactLoadResult result = loadFacts(projectPath);
        if (!result.hasDocuments()) {
            System.err.println("✗ No fact documents found in " + projectPath);
            return Optional.empty();
        }
        System.out.printf("✓ Read %d fact document(s)%n", result.sources().size());

        FactIndex index = FactIndex.build(result.facts());
        for (FactConflict conflict : index.conflicts()) {
            log.warn("Fact conflict: {}", conflict.describe());
        }
        return Optional.of(index);
    }

    /**
     * Reads all fact documents below the path, logging extraction problems.
     *
     * @param projectPath directory to read
     * @return merged load result
     */
    static FactLoadResult loadFacts(Path projectPath) {
        FactLoadResult result = new FactLoader().load(ExtractionContext.of(projectPath));
        for (String warning : result.warnings()) {
            log.warn("{}", warning);
        }
        for (String error : result.errors()) {
            log.error("{}", error);
        }
        return result;
    }

    /**
     * Prints every processor with its transitions, sorted by activity name.
     *
     * @param index fact index
     */
    static void printProcessorDetails(FactIndex index) {
        List<ProcessorFact> processors = index.processors().values().stream()
            .sorted(Comparator.comparing(ProcessorFact::processedActivityName))
            .toList();

        System.out.printf("Processors (%d):%n", processors.size());
        for (ProcessorFact processor : processors) {
            System.out.printf("  • %s (%s)%s%n",
                processor.processedActivityName(),
                processor.processorName(),
                processor.createsManualTask() ? " [manual task]" : "");
            if (processor.completesFlow()) {
                System.out.println("      → END");
            }
            for (Transition transition : processor.transitions()) {
                System.out.println("      " + describe(transition));
            }
        }
        System.out.println();
    }

    /**
     * Prints the text trace of every entry point.
     *
     * @param index fact index
     * @param config generator configuration
     */
    static void printTraces(FactIndex index, GeneratorConfig config) {
        FlowDiagramEngine engine = new FlowDiagramEngine(index, config);
        for (EntryPointResult result : engine.generateAll(new TextTraceGenerator(), false)) {
            if (result.success()) {
                System.out.println(result.diagram().content());
            } else {
                System.err.printf("✗ %s: %s%n", result.behandlingName(), result.errorMessage());
            }
        }
    }

    private static String describe(Transition transition) {
        StringBuilder sb = new StringBuilder();
        if (transition.condition() != null) {
            sb.append("IF ").append(transition.condition()).append(' ');
        }
        sb.append("→ ").append(String.join(", ", transition.targetActivityNames()));
        if (transition.collection()) {
            sb.append(" (multiple)");
        }
        if (transition.featureFlagged()) {
            sb.append(" [flag: ")
                .append(transition.featureFlagName() != null ? transition.featureFlagName() : "?")
                .append(']');
        }
        return sb.toString();
    }
}

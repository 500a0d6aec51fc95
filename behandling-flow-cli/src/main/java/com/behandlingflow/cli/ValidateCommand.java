package com.behandlingflow.cli;

import com.behandlingflow.core.engine.FlowDiagramEngine;
import com.behandlingflow.core.extractor.FactLoadResult;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.CycleCluster;
import com.behandlingflow.core.model.FactConflict;
import com.behandlingflow.core.model.FlowDiagramModel;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to check fact documents before generating diagrams.
 *
 * <p>Reports extraction problems, duplicate facts, activities without a processor and the
 * cycles of each flow. Exits with 1 on extraction errors, and on conflicts with {@code --strict}.
 */
@Command(
    name = "validate",
    description = "Report fact conflicts, missing processors and cycles",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(
        index = "0",
        description = "Directory containing fact documents (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(names = "--strict", description = "Fail when facts are declared more than once")
    private boolean strict;

    @Override
    public Integer call() {
        log.info("Validating facts in: {}", projectPath.toAbsolutePath());

        if (!CommandSupport.checkDirectory(projectPath)) {
            return 1;
        }

        FactLoadResult result = CommandSupport.loadFacts(projectPath);
        if (!result.hasDocuments()) {
            System.err.println("✗ No fact documents found in " + projectPath);
            return 1;
        }
        System.out.printf("✓ Read %d fact document(s)%n", result.sources().size());
        for (String warning : result.warnings()) {
            System.out.println("  ⚠ " + warning);
        }
        for (String error : result.errors()) {
            System.err.println("  ✗ " + error);
        }

        FactIndex index = FactIndex.build(result.facts());
        if (index.hasConflicts()) {
            System.out.printf("⚠ %d conflict(s):%n", index.conflicts().size());
            for (FactConflict conflict : index.conflicts()) {
                System.out.println("  • " + conflict.describe());
            }
        } else {
            System.out.println("✓ No conflicting facts");
        }

        if (index.entryPoints().isEmpty()) {
            System.err.println("✗ No entry points found (no class declares an initial activity)");
            return 1;
        }

        FlowDiagramEngine engine = new FlowDiagramEngine(index, GeneratorConfig.defaults());
        for (ClassFact entry : index.entryPoints()) {
            printFlowReport(engine.analyze(entry));
        }

        if (!result.errors().isEmpty()) {
            return 1;
        }
        if (strict && index.hasConflicts()) {
            System.err.println("✗ Conflicting facts are not allowed with --strict");
            return 1;
        }
        return 0;
    }

    private void printFlowReport(FlowDiagramModel model) {
        System.out.println();
        System.out.printf("%s (starts with %s)%n", model.behandlingName(), model.entryActivity());
        System.out.printf("  Activities: %d%n", model.graph().nodes().size());

        if (model.graph().missingProcessors().isEmpty()) {
            System.out.println("  ✓ Every activity has a processor");
        } else {
            for (String activity : model.graph().missingProcessors()) {
                System.out.println("  ? Missing processor: " + activity);
            }
        }

        for (CycleCluster cluster : model.cycles().clusters()) {
            System.out.println("  🔄 Cycle: " + String.join(", ", cluster.members()));
        }
    }
}

package com.behandlingflow.cli;

import com.behandlingflow.core.config.ProjectConfig;
import com.behandlingflow.core.engine.EntryPointResult;
import com.behandlingflow.core.engine.FlowDiagramEngine;
import com.behandlingflow.core.generator.DiagramGenerator;
import com.behandlingflow.core.generator.EdgeRouting;
import com.behandlingflow.core.generator.GeneratorConfig;
import com.behandlingflow.core.index.FactIndex;
import com.behandlingflow.core.renderer.GeneratedFile;
import com.behandlingflow.core.renderer.GeneratedOutput;
import com.behandlingflow.core.renderer.OutputRenderer;
import com.behandlingflow.core.renderer.RenderContext;
import com.behandlingflow.core.renderer.impl.GraphvizRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to generate one flow diagram per entry point.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # DOT converted to SVG in ./flows
 * behandling-flow generate ./facts -o ./flows
 *
 * # Mermaid with condition labels, written as Markdown
 * behandling-flow generate ./facts -g mermaid --show-conditions -r filesystem
 *
 * # Keep the DOT sources next to the PNG images
 * behandling-flow generate ./facts -f png -k
 * }</pre>
 *
 * <p>Command line options override the values of {@code behandling-flow.yaml}.
 */
@Command(
    name = "generate",
    description = "Generate flow diagrams for all entry points",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(
        index = "0",
        description = "Directory containing fact documents (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: behandling-flow.yaml in PATH)"
    )
    private Path configFile;

    @Option(
        names = {"-g", "--generator"},
        description = "Diagram generator: dot, mermaid, text"
    )
    private String generatorId;

    @Option(
        names = {"-e", "--edge-style"},
        description = "Edge routing: straight, curved, orthogonal"
    )
    private String edgeStyle;

    @Option(names = "--show-conditions", description = "Draw condition labels on edges")
    private Boolean showConditions;

    @Option(names = {"-l", "--show-legend"}, description = "Append a legend to each diagram")
    private Boolean showLegend;

    @Option(names = "--no-deduplicate", description = "Draw every parallel edge")
    private boolean noDeduplicate;

    @Option(names = {"-o", "--output-dir"}, description = "Output directory")
    private Path outputDir;

    @Option(names = {"-f", "--format"}, description = "Graphviz output format: svg, png, pdf")
    private String format;

    @Option(names = {"-k", "--keep-dot"}, description = "Keep DOT files after conversion")
    private Boolean keepDot;

    @Option(
        names = {"-r", "--renderer"},
        description = "Output renderer: graphviz, filesystem, console"
    )
    private String rendererId;

    @Option(names = "--parallel", description = "Generate entry points on a thread pool")
    private boolean parallel;

    @Option(
        names = "--details",
        description = "Print processor details and text traces before generating"
    )
    private boolean details;

    @Override
    public Integer call() {
        log.info("Generating flow diagrams for: {}", projectPath.toAbsolutePath());

        try {
            if (!CommandSupport.checkDirectory(projectPath)) {
                return 1;
            }

            // Step 1: Load configuration
            ProjectConfig config = CommandSupport.loadConfig(projectPath, configFile);
            GeneratorConfig generatorConfig = buildGeneratorConfig(config);

            // Step 2: Read facts
            Optional<FactIndex> loaded = CommandSupport.loadIndex(projectPath);
            if (loaded.isEmpty()) {
                return 1;
            }
            FactIndex index = loaded.get();
            if (index.entryPoints().isEmpty()) {
                System.err.println("✗ No entry points found (no class declares an initial activity)");
                return 1;
            }
            System.out.printf("✓ Found %d entry point(s) and %d processor(s)%n",
                index.entryPoints().size(), index.processors().size());

            if (details) {
                System.out.println();
                CommandSupport.printProcessorDetails(index);
                CommandSupport.printTraces(index, generatorConfig);
            }

            // Step 3: Resolve plugins
            String selectedGenerator = generatorId != null ? generatorId : config.diagram().generator();
            Optional<DiagramGenerator> generator = findGenerator(selectedGenerator);
            if (generator.isEmpty()) {
                System.err.println("✗ Unknown generator: " + selectedGenerator);
                return 1;
            }
            String selectedRenderer = rendererId != null ? rendererId : config.output().renderer();
            Optional<OutputRenderer> renderer = findRenderer(selectedRenderer);
            if (renderer.isEmpty()) {
                System.err.println("✗ Unknown renderer: " + selectedRenderer);
                return 1;
            }

            // Step 4: Generate
            FlowDiagramEngine engine = new FlowDiagramEngine(index, generatorConfig);
            List<EntryPointResult> results = engine.generateAll(generator.get(), parallel);

            List<GeneratedFile> files = new ArrayList<>();
            List<EntryPointResult> failures = new ArrayList<>();
            for (EntryPointResult result : results) {
                if (result.success()) {
                    files.add(GeneratedFile.of(result.diagram()));
                } else {
                    failures.add(result);
                }
            }

            // Step 5: Render
            List<Path> written = renderer.get().render(new GeneratedOutput(files), renderContext(config));
            for (Path path : written) {
                System.out.println("  ✅ Generated: " + path);
            }
            for (EntryPointResult failure : failures) {
                System.err.printf("  ✗ %s: %s%n", failure.behandlingName(), failure.errorMessage());
            }

            System.out.printf("✓ Generated %d of %d flow diagram(s)%n", files.size(), results.size());
            return failures.isEmpty() ? 0 : 1;

        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private GeneratorConfig buildGeneratorConfig(ProjectConfig config) {
        GeneratorConfig generatorConfig = config.toGeneratorConfig();
        if (edgeStyle != null) {
            generatorConfig = generatorConfig.withEdgeRouting(EdgeRouting.parse(edgeStyle));
        }
        if (showConditions != null) {
            generatorConfig = generatorConfig.withShowConditions(showConditions);
        }
        if (showLegend != null) {
            generatorConfig = generatorConfig.withShowLegend(showLegend);
        }
        if (noDeduplicate) {
            generatorConfig = generatorConfig.withDeduplicate(false);
        }
        return generatorConfig;
    }

    private RenderContext renderContext(ProjectConfig config) {
        Path directory = outputDir != null ? outputDir : Path.of(config.output().directory());
        String selectedFormat = format != null ? format : config.output().format();
        boolean keep = keepDot != null ? keepDot : config.output().keepDot();
        return new RenderContext(directory.toString(), Map.of(
            GraphvizRenderer.FORMAT_SETTING, selectedFormat,
            GraphvizRenderer.KEEP_SOURCE_SETTING, String.valueOf(keep)));
    }

    private Optional<DiagramGenerator> findGenerator(String id) {
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getId().equalsIgnoreCase(id)) {
                return Optional.of(generator);
            }
        }
        return Optional.empty();
    }

    private Optional<OutputRenderer> findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}

package com.behandlingflow;

import com.behandlingflow.cli.GenerateCommand;
import com.behandlingflow.cli.ListCommand;
import com.behandlingflow.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Behandling Flow.
 *
 * <p>Behandling Flow reads facts extracted from a behandling code base and draws the
 * activity flow of every behandling as a diagram.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate flow diagrams for all entry points</li>
 *   <li>{@code list} - List entry points, processors, flows, or available plugins</li>
 *   <li>{@code validate} - Report conflicts, missing processors and cycles</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate SVG diagrams for the facts below ./facts
 * behandling-flow generate ./facts -o ./flows
 *
 * # Mermaid output with condition labels
 * behandling-flow generate ./facts -g mermaid --show-conditions
 *
 * # Debug logging
 * behandling-flow -v generate ./facts
 * }</pre>
 */
@Command(
    name = "behandling-flow",
    mixinStandardHelpOptions = true,
    version = "Behandling Flow 1.0.0-SNAPSHOT",
    description = "Draws behandling activity flows from extracted code facts",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class BehandlingFlowCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BehandlingFlowCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("Behandling Flow - Activity flow diagrams for behandlinger");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'behandling-flow --help' to see available commands");
        System.out.println("Use 'behandling-flow <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before the selected subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        BehandlingFlowCLI cli = new BehandlingFlowCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}

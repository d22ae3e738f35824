package com.navgraph;

import com.navgraph.cli.AnalyzeCommand;
import com.navgraph.cli.ListCommand;
import com.navgraph.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for NavGraph.
 *
 * <p>NavGraph checks a declared navigation graph: which pages are reachable from the entry
 * points, which are orphaned or dead ends, whether declared user journeys are fully linked,
 * and an overall 0-10 health score.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a navigation manifest and write the JSON result</li>
 *   <li>{@code validate} - Check that a manifest builds a consistent graph</li>
 *   <li>{@code list} - List available renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * navgraph analyze navigation.yaml
 * navgraph -v analyze navigation.yaml --journeys journeys.yaml --min-score 8
 * navgraph validate navigation.json
 * }</pre>
 */
@Command(
    name = "navgraph",
    mixinStandardHelpOptions = true,
    version = "NavGraph 1.0.0-SNAPSHOT",
    description = "Navigation graph validation: reachability, dead ends, journeys and health score",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class NavGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NavGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("NavGraph - Navigation Graph Validation");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'navgraph --help' to see available commands");
        System.out.println("Use 'navgraph <command> --help' for command-specific help");
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
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return the configured command line
     */
    public static CommandLine commandLine() {
        NavGraphCLI cli = new NavGraphCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

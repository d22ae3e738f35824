package com.navgraph.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.navgraph.core.analysis.AnalysisRequest;
import com.navgraph.core.config.AnalysisConfig;
import com.navgraph.core.config.ConfigLoader;
import com.navgraph.core.config.ManifestLoader;
import com.navgraph.core.exception.NavigationConfigurationException;
import com.navgraph.core.exception.UnknownEntryPointException;
import com.navgraph.core.graph.GraphBuilder;
import com.navgraph.core.graph.NavigationGraph;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to check that a manifest describes a consistent graph, without analyzing it.
 *
 * <p>Fails with exit code 2 on duplicate routes, dangling links, unknown or empty entry points
 * or an unreadable manifest.
 */
@Command(
    name = "validate",
    description = "Check that a navigation manifest builds a consistent graph",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Navigation manifest (.yaml, .yml or .json)")
    private Path manifestPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: navgraph.yaml)"
    )
    private Path configPath = Paths.get("navgraph.yaml");

    @Override
    public Integer call() {
        log.info("Validating navigation manifest: {}", manifestPath);
        try {
            AnalysisConfig config = ConfigLoader.load(configPath);
            AnalysisRequest request = ManifestLoader.loadRequest(manifestPath, config.analysisOrDefaults());
            NavigationGraph graph = GraphBuilder.build(request.routes(), request.links());

            Set<String> unknown = new TreeSet<>();
            for (String entry : request.entryPoints().paths()) {
                if (!graph.containsNode(entry)) {
                    unknown.add(entry);
                }
            }
            if (!unknown.isEmpty()) {
                throw new UnknownEntryPointException(unknown);
            }

            System.out.printf("✓ %s: %d routes, %d links, entry points %s%n",
                manifestPath, graph.nodeCount(), graph.edgeCount(), request.entryPoints().paths());
            return ExitCodes.OK;
        } catch (NavigationConfigurationException | IllegalArgumentException e) {
            System.err.println("✗ Validation failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}

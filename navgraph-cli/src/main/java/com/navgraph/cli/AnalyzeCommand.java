package com.navgraph.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.navgraph.core.analysis.AnalysisOptions;
import com.navgraph.core.analysis.AnalysisRequest;
import com.navgraph.core.analysis.NavigationAnalyzer;
import com.navgraph.core.config.AnalysisConfig;
import com.navgraph.core.config.ConfigLoader;
import com.navgraph.core.config.JourneyRegistryLoader;
import com.navgraph.core.config.ManifestLoader;
import com.navgraph.core.exception.InvariantViolationException;
import com.navgraph.core.exception.NavigationAnalysisException;
import com.navgraph.core.model.AnalysisResult;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.MissingLink;
import com.navgraph.core.renderer.AnalysisResultSerializer;
import com.navgraph.core.renderer.OutputRenderer;
import com.navgraph.core.renderer.RenderContext;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyze a navigation manifest.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load {@code navgraph.yaml} (defaults when missing)</li>
 *   <li>Load the manifest and, optionally, a separate journey registry</li>
 *   <li>Analyze reachability, journeys and health score</li>
 *   <li>Serialize the result to JSON and hand it to the selected renderer</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> {@code 0} no orphans and all journeys complete, {@code 1} orphans,
 * a partial journey or a score below {@code --min-score}, {@code 2} configuration or
 * invariant error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * navgraph analyze navigation.yaml
 * navgraph analyze navigation.json -j journeys.yaml -r console --min-score 8.5
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a navigation manifest and report orphans, dead ends, journeys and health score",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "Navigation manifest (.yaml, .yml or .json)")
    private Path manifestPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: navgraph.yaml)"
    )
    private Path configPath = Paths.get("navgraph.yaml");

    @Option(
        names = {"-j", "--journeys"},
        description = "Journey registry file; replaces journeys declared in the manifest"
    )
    private Path journeysPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-r", "--renderer"},
        description = "Renderer ID: filesystem or console (overrides config)"
    )
    private String rendererId;

    @Option(
        names = {"--parallel"},
        description = "Worker threads for journey validation (overrides config)"
    )
    private Integer parallelism;

    @Option(
        names = {"--timeout"},
        description = "Time budget in milliseconds (overrides config)"
    )
    private Long timeoutMillis;

    @Option(
        names = {"--min-score"},
        description = "Fail with exit code 1 when the health score is below this value"
    )
    private Double minScore;

    @Override
    public Integer call() {
        try {
            AnalysisConfig config = ConfigLoader.load(configPath);
            AnalysisConfig.AnalysisSettings settings = config.analysisOrDefaults();

            log.info("Analyzing navigation manifest: {}", manifestPath);
            AnalysisRequest request = ManifestLoader.loadRequest(manifestPath, settings);
            if (journeysPath != null) {
                request = request.withJourneys(JourneyRegistryLoader.load(journeysPath));
            }

            AnalysisResult result = new NavigationAnalyzer(resolveOptions(settings)).analyze(request);

            render(result, config);
            printSummary(result);

            return exitCode(result);
        } catch (InvariantViolationException e) {
            log.error("Internal invariant violated, please report this as a bug", e);
            System.err.println("✗ Internal error: " + e.getMessage());
            return ExitCodes.ERROR;
        } catch (NavigationAnalysisException | IllegalArgumentException | IllegalStateException e) {
            log.debug("Analysis aborted", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private AnalysisOptions resolveOptions(AnalysisConfig.AnalysisSettings settings) {
        AnalysisOptions options = settings.toOptions();
        if (parallelism != null) {
            options = options.withJourneyParallelism(Math.max(1, parallelism));
        }
        if (timeoutMillis != null) {
            options = options.withTimeout(timeoutMillis > 0 ? Duration.ofMillis(timeoutMillis) : null);
        }
        return options;
    }

    private void render(AnalysisResult result, AnalysisConfig config) {
        AnalysisConfig.OutputConfig output = config.outputOrDefaults();
        String id = rendererId != null ? rendererId : output.renderer();
        String directory = outputDir != null ? outputDir.toString() : output.directory();

        OutputRenderer renderer = findRenderer(id == null ? "filesystem" : id);
        renderer.render(
            AnalysisResultSerializer.toOutput(result),
            new RenderContext(directory == null ? "." : directory, Map.of())
        );
    }

    /**
     * Looks up a renderer registered via SPI.
     *
     * @param id renderer ID
     * @return the renderer
     * @throws IllegalStateException if no renderer has that ID
     */
    static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Unknown renderer: " + id);
    }

    private int exitCode(AnalysisResult result) {
        if (result.hasFindings()) {
            return ExitCodes.FINDINGS;
        }
        if (minScore != null && result.healthScore() < minScore) {
            System.err.printf("✗ Health score %.2f is below the required %.2f%n", result.healthScore(), minScore);
            return ExitCodes.FINDINGS;
        }
        return ExitCodes.OK;
    }

    /**
     * Prints a short summary to stderr so stdout stays clean for the console renderer.
     */
    private void printSummary(AnalysisResult result) {
        System.err.println();
        System.err.printf("Navigation health score: %.2f / 10%n", result.healthScore());
        System.err.println("  Routes:     " + result.totalNodes());
        System.err.println("  Reachable:  " + result.reachable().size());
        System.err.println("  Orphans:    " + result.orphans().size());
        System.err.println("  Dead ends:  " + result.deadEnds().size());

        if (!result.journeyResults().isEmpty()) {
            System.err.printf("  Journeys:   %d complete, %d partial%n",
                result.completeJourneys(), result.partialJourneys());
            for (JourneyResult journey : result.journeyResults()) {
                if (!journey.isComplete()) {
                    MissingLink gap = journey.firstGap();
                    System.err.printf("    ✗ %s (%.0f%%): first gap %s -> %s%n",
                        journey.name(), journey.coverage() * 100.0, gap.from(), gap.to());
                }
            }
        }
        result.orphans().forEach(path -> System.err.println("    orphan: " + path));
    }
}

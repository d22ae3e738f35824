package com.navgraph.core.analysis;

import com.navgraph.core.exception.NavigationAnalysisException;
import com.navgraph.core.graph.GraphBuilder;
import com.navgraph.core.graph.NavigationGraph;
import com.navgraph.core.model.AnalysisResult;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.ReachabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the full navigation analysis pipeline.
 *
 * <p>Data flows strictly forward:
 * <ol>
 *   <li>{@link GraphBuilder} builds the immutable graph</li>
 *   <li>{@link ReachabilityAnalyzer} classifies every route</li>
 *   <li>{@link JourneyValidator} checks declared journeys (skipped when journeys are null)</li>
 *   <li>{@link HealthScorer} computes the composite score</li>
 *   <li>{@link ResultAssembler} checks the partition and packages the result</li>
 * </ol>
 *
 * <p>Configuration errors and invariant violations abort the run; no partial result is
 * returned. Journey findings never abort.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisRequest request = AnalysisRequest.of(routes, links,
 *     EntryPointSet.conventionDefault(), AllowedTerminalSet.conventionDefault());
 *
 * AnalysisResult result = new NavigationAnalyzer().analyze(request);
 * System.out.println(result.healthScore());
 * }</pre>
 */
public class NavigationAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(NavigationAnalyzer.class);

    private final AnalysisOptions options;

    public NavigationAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public NavigationAnalyzer(AnalysisOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * Analyzes one route set.
     *
     * @param request extracted navigation facts
     * @return the assembled result
     * @throws com.navgraph.core.exception.NavigationConfigurationException on inconsistent input
     * @throws com.navgraph.core.exception.InvariantViolationException on an internal defect
     * @throws com.navgraph.core.exception.AnalysisTimeoutException if the time budget is exceeded
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        AnalysisDeadline deadline = AnalysisDeadline.after(options.timeout());

        NavigationGraph graph = GraphBuilder.build(request.routes(), request.links());

        ReachabilityResult reachability = new ReachabilityAnalyzer(deadline)
            .analyze(graph, request.entryPoints(), request.terminals());

        List<JourneyResult> journeyResults = null;
        if (request.hasJourneys()) {
            journeyResults = new JourneyValidator(deadline, options.journeyParallelism())
                .validate(graph, request.journeys(), reachability.orphans());
        } else {
            log.debug("No journeys supplied, skipping journey validation");
        }

        double score = HealthScorer.score(
            reachability.orphans().size(),
            reachability.deadEnds().size(),
            JourneyValidator.averageCoverage(journeyResults)
        );

        AnalysisResult result = ResultAssembler.assemble(graph, reachability, journeyResults, score);
        log.info("Navigation health score: {}", String.format("%.2f", result.healthScore()));
        return result;
    }

    /**
     * Analyzes independent route sets concurrently, one per key.
     *
     * <p>The first failing route set aborts the whole batch and its exception is rethrown.
     *
     * @param requests route sets keyed by tenant or application name
     * @return results in the iteration order of {@code requests}
     */
    public Map<String, AnalysisResult> analyzeAll(Map<String, AnalysisRequest> requests) {
        Objects.requireNonNull(requests, "requests must not be null");
        if (requests.isEmpty()) {
            return Map.of();
        }

        int threads = Math.min(requests.size(), Runtime.getRuntime().availableProcessors());
        log.info("Analyzing {} route sets on {} threads", requests.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<String> keys = new ArrayList<>(requests.keySet());
            List<Future<AnalysisResult>> futures = new ArrayList<>(keys.size());
            for (String key : keys) {
                AnalysisRequest request = requests.get(key);
                futures.add(executor.submit(() -> analyze(request)));
            }

            Map<String, AnalysisResult> results = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                results.put(keys.get(i), awaitResult(keys.get(i), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static AnalysisResult awaitResult(String key, Future<AnalysisResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NavigationAnalysisException("Analysis of '" + key + "' was interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new NavigationAnalysisException("Analysis of '" + key + "' failed", e.getCause());
        }
    }
}

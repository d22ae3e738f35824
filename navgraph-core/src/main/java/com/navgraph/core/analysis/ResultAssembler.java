package com.navgraph.core.analysis;

import com.navgraph.core.exception.InvariantViolationException;
import com.navgraph.core.graph.NavigationGraph;
import com.navgraph.core.model.AnalysisResult;
import com.navgraph.core.model.JourneyResult;
import com.navgraph.core.model.ReachabilityResult;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Packages the pipeline outputs into one {@link AnalysisResult}.
 *
 * <p>Recomputes {@code reachable = nodes - orphans - deadEnds} and requires the three sets
 * to partition the node set exactly. Any mismatch is an engine defect and raises
 * {@link InvariantViolationException}; nothing is corrected.
 */
public final class ResultAssembler {

    private ResultAssembler() {
        // Utility class
    }

    /**
     * Assembles the final result.
     *
     * @param graph the analyzed graph
     * @param reachability reachability classification of the graph
     * @param journeyResults journey results, null when no journeys were supplied
     * @param healthScore composite score
     * @return the immutable analysis result
     * @throws InvariantViolationException if the node sets do not partition the graph
     */
    public static AnalysisResult assemble(
        NavigationGraph graph,
        ReachabilityResult reachability,
        List<JourneyResult> journeyResults,
        double healthScore
    ) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(reachability, "reachability must not be null");

        Set<String> nodes = graph.nodePaths();
        Set<String> orphans = reachability.orphans();
        Set<String> deadEnds = reachability.deadEnds();

        requireSubset("orphans", orphans, nodes);
        requireSubset("deadEnds", deadEnds, nodes);

        Set<String> overlap = new HashSet<>(orphans);
        overlap.retainAll(deadEnds);
        if (!overlap.isEmpty()) {
            throw new InvariantViolationException("Routes classified as both orphan and dead end: " + overlap);
        }

        Set<String> reachable = new HashSet<>(nodes);
        reachable.removeAll(orphans);
        reachable.removeAll(deadEnds);
        if (!reachable.equals(reachability.reachable())) {
            throw new InvariantViolationException(
                "Reachable set " + reachability.reachable() + " does not match nodes - orphans - deadEnds " + reachable);
        }

        if (Double.isNaN(healthScore) || healthScore < 0.0 || healthScore > HealthScorer.MAX_SCORE) {
            throw new InvariantViolationException("Health score out of range: " + healthScore);
        }

        return new AnalysisResult(
            reachable,
            orphans,
            deadEnds,
            journeyResults,
            JourneyValidator.averageCoverage(journeyResults),
            healthScore
        );
    }

    private static void requireSubset(String name, Set<String> subset, Set<String> nodes) {
        for (String path : subset) {
            if (!nodes.contains(path)) {
                throw new InvariantViolationException(name + " contains a route that is not in the graph: " + path);
            }
        }
    }
}

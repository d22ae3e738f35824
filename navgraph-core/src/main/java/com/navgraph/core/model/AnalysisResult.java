package com.navgraph.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Terminal, read-only outcome of a navigation analysis run.
 *
 * <p>Consumed by report rendering and CI gating. Node sets are sorted so that
 * repeated runs over identical input serialize identically; journey results keep
 * declaration order.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AnalysisResult result = analyzer.analyze(request);
 * if (result.hasFindings()) {
 *     result.orphans().forEach(path -> System.err.println("orphan: " + path));
 * }
 * }</pre>
 *
 * @param reachable reached nodes that are not dead ends
 * @param orphans nodes unreachable from every entry point
 * @param deadEnds reached nodes with no outbound links, allowed terminals excluded
 * @param journeyResults one result per journey, in declaration order
 * @param averageJourneyCoverage mean journey coverage, or null when no journeys were supplied
 * @param healthScore composite score in [0, 10]
 */
public record AnalysisResult(
    Set<String> reachable,
    Set<String> orphans,
    Set<String> deadEnds,
    List<JourneyResult> journeyResults,
    Double averageJourneyCoverage,
    double healthScore
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(reachable, "reachable must not be null");
        Objects.requireNonNull(orphans, "orphans must not be null");
        Objects.requireNonNull(deadEnds, "deadEnds must not be null");
        if (healthScore < 0.0 || healthScore > 10.0) {
            throw new IllegalArgumentException("healthScore must be in [0, 10], got " + healthScore);
        }
        reachable = Collections.unmodifiableSet(new TreeSet<>(reachable));
        orphans = Collections.unmodifiableSet(new TreeSet<>(orphans));
        deadEnds = Collections.unmodifiableSet(new TreeSet<>(deadEnds));
        journeyResults = journeyResults == null ? List.of() : List.copyOf(journeyResults);
    }

    public int totalNodes() {
        return reachable.size() + orphans.size() + deadEnds.size();
    }

    public long completeJourneys() {
        return journeyResults.stream().filter(JourneyResult::isComplete).count();
    }

    public long partialJourneys() {
        return journeyResults.size() - completeJourneys();
    }

    /**
     * Returns true if the graph has orphans or any journey is partial.
     *
     * <p>Dead ends alone lower the score but are not gating findings.
     *
     * @return true if orphans exist or a journey is incomplete
     */
    public boolean hasFindings() {
        return !orphans.isEmpty() || partialJourneys() > 0;
    }

    /**
     * Finds the result for a journey by name.
     *
     * @param name journey name
     * @return the journey result, or null if no journey has that name
     */
    public JourneyResult journey(String name) {
        return journeyResults.stream()
            .filter(result -> result.name().equals(name))
            .findFirst()
            .orElse(null);
    }
}

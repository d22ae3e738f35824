package com.navgraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Validation outcome of one journey.
 *
 * @param name journey name
 * @param status {@link JourneyStatus#COMPLETE} when coverage is 1.0, otherwise {@link JourneyStatus#PARTIAL}
 * @param coverage satisfied pairs divided by total pairs, in [0, 1]
 * @param satisfiedPairs number of consecutive step pairs backed by a link
 * @param totalPairs number of consecutive step pairs in the journey
 * @param missingLinks unsatisfied pairs in journey order
 * @param unreachableSteps known steps that are orphans (unreachable from every entry point), in journey order
 */
public record JourneyResult(
    String name,
    JourneyStatus status,
    double coverage,
    int satisfiedPairs,
    int totalPairs,
    List<MissingLink> missingLinks,
    List<String> unreachableSteps
) {
    /**
     * Compact constructor with validation.
     */
    public JourneyResult {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (coverage < 0.0 || coverage > 1.0) {
            throw new IllegalArgumentException("coverage must be in [0, 1], got " + coverage);
        }
        if (totalPairs < 1 || satisfiedPairs < 0 || satisfiedPairs > totalPairs) {
            throw new IllegalArgumentException(
                "invalid pair counts: " + satisfiedPairs + "/" + totalPairs);
        }
        missingLinks = missingLinks == null ? List.of() : List.copyOf(missingLinks);
        unreachableSteps = unreachableSteps == null ? List.of() : List.copyOf(unreachableSteps);
    }

    public boolean isComplete() {
        return status == JourneyStatus.COMPLETE;
    }

    /**
     * Returns the first gap encountered walking the journey from its start.
     *
     * @return first missing link, or null when the journey is complete
     */
    public MissingLink firstGap() {
        return missingLinks.isEmpty() ? null : missingLinks.get(0);
    }
}

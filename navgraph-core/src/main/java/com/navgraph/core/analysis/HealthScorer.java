package com.navgraph.core.analysis;

/**
 * Composite 0-10 navigation health score.
 *
 * <pre>
 * score = max(0, 10
 *             - min(orphans * 0.5, 3.0)
 *             - min(deadEnds * 0.2, 1.0)
 *             - (1 - avgJourneyCoverage) * 2.0)   // only when journeys were supplied
 * </pre>
 *
 * <p>Pure and deterministic, so it can gate CI builds reproducibly.
 *
 * @since 1.0.0
 */
public final class HealthScorer {

    public static final double MAX_SCORE = 10.0;

    static final double ORPHAN_WEIGHT = 0.5;
    static final double ORPHAN_CAP = 3.0;
    static final double DEAD_END_WEIGHT = 0.2;
    static final double DEAD_END_CAP = 1.0;
    static final double JOURNEY_WEIGHT = 2.0;

    private HealthScorer() {
        // Utility class
    }

    /**
     * Computes the health score.
     *
     * @param orphans number of orphan routes
     * @param deadEnds number of dead-end routes
     * @param avgJourneyCoverage mean journey coverage in [0, 1], or null when no journeys were supplied
     * @return score in [0, 10]
     */
    public static double score(int orphans, int deadEnds, Double avgJourneyCoverage) {
        if (orphans < 0) {
            throw new IllegalArgumentException("orphans must be >= 0");
        }
        if (deadEnds < 0) {
            throw new IllegalArgumentException("deadEnds must be >= 0");
        }
        if (avgJourneyCoverage != null && (avgJourneyCoverage < 0.0 || avgJourneyCoverage > 1.0)) {
            throw new IllegalArgumentException("avgJourneyCoverage must be in [0, 1], got " + avgJourneyCoverage);
        }

        double orphanPenalty = Math.min(orphans * ORPHAN_WEIGHT, ORPHAN_CAP);
        double deadEndPenalty = Math.min(deadEnds * DEAD_END_WEIGHT, DEAD_END_CAP);
        double journeyPenalty = avgJourneyCoverage == null ? 0.0 : (1.0 - avgJourneyCoverage) * JOURNEY_WEIGHT;

        return Math.max(0.0, MAX_SCORE - orphanPenalty - deadEndPenalty - journeyPenalty);
    }
}

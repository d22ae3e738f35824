package com.navgraph.core.analysis;

import java.time.Duration;

/**
 * Execution options for {@link NavigationAnalyzer}. None of them change the result.
 *
 * @param journeyParallelism worker threads for journey validation, 1 for sequential
 * @param timeout time budget per analysis run, null for no limit
 */
public record AnalysisOptions(
    int journeyParallelism,
    Duration timeout
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisOptions {
        if (journeyParallelism < 1) {
            throw new IllegalArgumentException("journeyParallelism must be >= 1");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    /**
     * Sequential execution without a time limit.
     *
     * @return default options
     */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(1, null);
    }

    public AnalysisOptions withJourneyParallelism(int parallelism) {
        return new AnalysisOptions(parallelism, timeout);
    }

    public AnalysisOptions withTimeout(Duration timeout) {
        return new AnalysisOptions(journeyParallelism, timeout);
    }
}

package com.navgraph.core.exception;

import java.time.Duration;

/**
 * Thrown when an analysis exceeds the deadline imposed by the caller.
 *
 * <p>Raised at the next node-visit or journey-step boundary after the deadline passes.
 */
public class AnalysisTimeoutException extends NavigationAnalysisException {

    private final Duration budget;
    private final String phase;

    public AnalysisTimeoutException(Duration budget, String phase) {
        super("Analysis exceeded its time budget of " + budget.toMillis() + " ms during " + phase);
        this.budget = budget;
        this.phase = phase;
    }

    public Duration getBudget() {
        return budget;
    }

    /**
     * @return pipeline phase that was running when the deadline passed
     */
    public String getPhase() {
        return phase;
    }
}

package com.navgraph.core.analysis;

import com.navgraph.core.exception.AnalysisTimeoutException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Cooperative time budget for one analysis run.
 *
 * <p>The analyzers call {@link #check(String)} at every node visit and journey step;
 * the run is aborted at the first check after the budget is spent.
 */
public final class AnalysisDeadline {

    private static final AnalysisDeadline NONE = new AnalysisDeadline(null, 0L, System::nanoTime);

    private final Duration budget;
    private final long expiresAtNanos;
    private final LongSupplier clock;

    private AnalysisDeadline(Duration budget, long expiresAtNanos, LongSupplier clock) {
        this.budget = budget;
        this.expiresAtNanos = expiresAtNanos;
        this.clock = clock;
    }

    /**
     * A deadline that never expires.
     *
     * @return the unbounded deadline
     */
    public static AnalysisDeadline none() {
        return NONE;
    }

    /**
     * Starts a deadline that expires {@code budget} from now.
     *
     * @param budget time allowed for the run, null for no limit
     * @return a running deadline
     */
    public static AnalysisDeadline after(Duration budget) {
        return after(budget, System::nanoTime);
    }

    /**
     * Starts a deadline against the given nanosecond clock.
     *
     * @param budget time allowed for the run, null for no limit
     * @param clock monotonic clock in nanoseconds
     * @return a running deadline
     */
    public static AnalysisDeadline after(Duration budget, LongSupplier clock) {
        if (budget == null) {
            return NONE;
        }
        Objects.requireNonNull(clock, "clock must not be null");
        if (budget.isNegative()) {
            throw new IllegalArgumentException("budget must not be negative: " + budget);
        }
        return new AnalysisDeadline(budget, clock.getAsLong() + budget.toNanos(), clock);
    }

    public boolean isBounded() {
        return budget != null;
    }

    /**
     * Aborts the run if the budget is spent.
     *
     * @param phase pipeline phase, reported in the exception
     * @throws AnalysisTimeoutException if the deadline has passed
     */
    public void check(String phase) {
        if (budget != null && clock.getAsLong() - expiresAtNanos > 0) {
            throw new AnalysisTimeoutException(budget, phase);
        }
    }
}

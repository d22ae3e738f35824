package com.navgraph.core.exception;

/**
 * Internal defect: the engine produced an inconsistent result, for example
 * overlapping reachable, orphan and dead-end sets.
 *
 * <p>Should be treated as a bug report, never as a recoverable condition.
 */
public class InvariantViolationException extends NavigationAnalysisException {

    public InvariantViolationException(String message) {
        super(message);
    }
}

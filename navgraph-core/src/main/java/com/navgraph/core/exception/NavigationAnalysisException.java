package com.navgraph.core.exception;

/**
 * Base class for every failure that aborts a navigation analysis run.
 *
 * <p>Data-quality findings (missing journey links, unknown journey steps) are never
 * thrown; they are reported in the result.
 */
public class NavigationAnalysisException extends RuntimeException {

    public NavigationAnalysisException(String message) {
        super(message);
    }

    public NavigationAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.navgraph.cli;

/**
 * Process exit codes used by the NavGraph commands.
 */
public final class ExitCodes {

    /** No orphans and every journey complete */
    public static final int OK = 0;

    /** Orphans present, a journey partial, or the score below the required minimum */
    public static final int FINDINGS = 1;

    /** Configuration error, invariant violation or timeout; no result was produced */
    public static final int ERROR = 2;

    private ExitCodes() {
        // Constants
    }
}

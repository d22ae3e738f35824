package com.navgraph.core.model;

/**
 * Why a journey step pair is not backed by a link.
 */
public enum MissingLinkReason {
    /** Both steps are known routes but no link leads from the first to the second */
    MISSING_EDGE,

    /** The first step references a route that is not in the graph */
    UNKNOWN_FROM,

    /** The second step references a route that is not in the graph */
    UNKNOWN_TO,

    /** Neither step references a route in the graph */
    UNKNOWN_BOTH;

    /**
     * Returns true if the finding is caused by a route missing from the graph
     * rather than by a missing link.
     *
     * @return true for the unknown-step markers
     */
    public boolean isUnknownStep() {
        return this != MISSING_EDGE;
    }
}

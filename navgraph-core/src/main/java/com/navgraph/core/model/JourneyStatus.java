package com.navgraph.core.model;

/**
 * Outcome of validating a single journey.
 */
public enum JourneyStatus {
    /** Every consecutive step pair is linked */
    COMPLETE,

    /** At least one consecutive step pair is not linked */
    PARTIAL
}

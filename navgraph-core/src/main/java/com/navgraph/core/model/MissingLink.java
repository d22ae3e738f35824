package com.navgraph.core.model;

import java.util.Objects;

/**
 * A consecutive journey step pair that is not backed by a link in the graph.
 *
 * @param from journey step the user navigates from
 * @param to journey step the user should reach next
 * @param reason why the pair is unsatisfied
 */
public record MissingLink(
    String from,
    String to,
    MissingLinkReason reason
) {
    /**
     * Compact constructor with validation.
     */
    public MissingLink {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Creates a finding for two known routes that are not linked.
     *
     * @param from source step
     * @param to target step
     * @return a new missing link with {@link MissingLinkReason#MISSING_EDGE}
     */
    public static MissingLink missingEdge(String from, String to) {
        return new MissingLink(from, to, MissingLinkReason.MISSING_EDGE);
    }
}

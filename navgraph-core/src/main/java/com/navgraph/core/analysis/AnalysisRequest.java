package com.navgraph.core.analysis;

import com.navgraph.core.model.AllowedTerminalSet;
import com.navgraph.core.model.EntryPointSet;
import com.navgraph.core.model.Journey;
import com.navgraph.core.model.LinkEdge;
import com.navgraph.core.model.RouteNode;

import java.util.List;
import java.util.Objects;

/**
 * Extracted navigation facts for one analysis run.
 *
 * @param routes declared routes
 * @param links declared links
 * @param entryPoints traversal roots
 * @param terminals routes allowed to have no outbound links
 * @param journeys journeys to validate, null when journey validation is disabled
 */
public record AnalysisRequest(
    List<RouteNode> routes,
    List<LinkEdge> links,
    EntryPointSet entryPoints,
    AllowedTerminalSet terminals,
    List<Journey> journeys
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisRequest {
        Objects.requireNonNull(routes, "routes must not be null");
        Objects.requireNonNull(entryPoints, "entryPoints must not be null");
        routes = List.copyOf(routes);
        links = links == null ? List.of() : List.copyOf(links);
        if (terminals == null) {
            terminals = AllowedTerminalSet.none();
        }
        if (journeys != null) {
            journeys = List.copyOf(journeys);
        }
    }

    /**
     * Creates a request without journey validation.
     *
     * @param routes declared routes
     * @param links declared links
     * @param entryPoints traversal roots
     * @param terminals allowed terminals
     * @return a new request
     */
    public static AnalysisRequest of(
        List<RouteNode> routes,
        List<LinkEdge> links,
        EntryPointSet entryPoints,
        AllowedTerminalSet terminals
    ) {
        return new AnalysisRequest(routes, links, entryPoints, terminals, null);
    }

    /**
     * Returns a copy of this request with the given journeys.
     *
     * @param journeys journeys to validate, null to disable journey validation
     * @return a new request
     */
    public AnalysisRequest withJourneys(List<Journey> journeys) {
        return new AnalysisRequest(routes, links, entryPoints, terminals, journeys);
    }

    public boolean hasJourneys() {
        return journeys != null;
    }
}

package com.navgraph.core.exception;

import com.navgraph.core.model.LinkEdge;

/**
 * Thrown when a link references a route that is not part of the graph.
 */
public class DanglingEdgeException extends NavigationConfigurationException {

    private final LinkEdge edge;
    private final String missingEndpoint;

    public DanglingEdgeException(LinkEdge edge, String missingEndpoint) {
        super("Link " + edge + " references unknown route: " + missingEndpoint);
        this.edge = edge;
        this.missingEndpoint = missingEndpoint;
    }

    public LinkEdge getEdge() {
        return edge;
    }

    /**
     * @return the endpoint path that is not a known route
     */
    public String getMissingEndpoint() {
        return missingEndpoint;
    }
}
